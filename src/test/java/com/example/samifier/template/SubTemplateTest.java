package com.example.samifier.template;

import com.example.samifier.exception.TemplateParseException;
import com.example.samifier.model.SubTemplate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SubTemplateTest {

    @Test
    public void testRenderReproducesInput() {
        String text = "arn:${AWS::Partition}:s3:::${Bucket}/${!Literal}/${Table.Arn}";

        assertEquals(text, SubTemplate.parse(text).render());
    }

    @Test
    public void testReferenceIndicesSkipPseudoAndEscaped() {
        SubTemplate template = SubTemplate.parse("${AWS::Region}-${Bucket}-${!Keep}-${Table.Arn}");

        List<Integer> indices = template.referenceIndices();

        assertEquals(2, indices.size());
        assertEquals("Bucket", template.segment(indices.get(0)).getText());
        assertEquals("Table", template.segment(indices.get(1)).getText());
        assertEquals("Arn", template.segment(indices.get(1)).getAttribute());
    }

    @Test
    public void testRenamePlaceholderKeepsAttribute() {
        SubTemplate template = SubTemplate.parse("https://${Api}.example/${Table.Arn}");
        List<Integer> indices = template.referenceIndices();

        template.renamePlaceholder(indices.get(0), "OrdersApi");
        template.renamePlaceholder(indices.get(1), "OrdersTable");

        assertEquals("https://${OrdersApi}.example/${OrdersTable.Arn}", template.render());
    }

    @Test
    public void testReplaceWithLiteral() {
        SubTemplate template = SubTemplate.parse("/${Stage}/");

        template.replaceWithLiteral(template.referenceIndices().get(0), "prod");

        assertEquals("/prod/", template.render());
        assertTrue(template.referenceIndices().isEmpty());
    }

    @Test
    public void testCopyIsIndependent() {
        SubTemplate original = SubTemplate.parse("${Bucket}");
        SubTemplate copy = original.copy();

        copy.renamePlaceholder(0, "Other");

        assertEquals("${Bucket}", original.render());
        assertEquals("${Other}", copy.render());
    }

    @Test
    public void testUnclosedPlaceholderFails() {
        assertThrows(TemplateParseException.class, () -> SubTemplate.parse("${Bucket"));
    }
}
