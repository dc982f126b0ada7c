package com.example.samifier.rename;

import com.example.samifier.TestTemplates;
import com.example.samifier.exception.RenameConflictException;
import com.example.samifier.model.FnCall;
import com.example.samifier.model.GetAtt;
import com.example.samifier.model.Sub;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.template.ReferenceIndex;
import com.example.samifier.template.TemplateSerializer;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RenamerTest {

    private final Renamer renamer = new Renamer();
    private final TemplateSerializer serializer = new TemplateSerializer();

    private static RenameEntry resource(String oldId, String newId) {
        return RenameEntry.builder().oldId(oldId).newId(newId).build();
    }

    @Test
    public void testRenameRewritesEverySite() {
        TemplateDocument document = TestTemplates.template("short-form.yaml");

        int rewritten = renamer.apply(document, RenamePlan.of(List.of(resource("Bucket", "OrdersBucket"))));

        assertEquals(4, rewritten);
        assertFalse(document.hasResource("Bucket"));
        assertEquals(List.of("OrdersBucket", "Topic"), List.copyOf(document.getResources().keySet()));
        assertEquals(List.of("OrdersBucket"), document.getResource("Topic").getDependsOn());
        FnCall displayName = (FnCall) document.getResource("Topic").property("DisplayName");
        assertEquals("OrdersBucket", ((GetAtt) ((List<?>) displayName.getArgument()).get(1)).getLogicalId());
        @SuppressWarnings("unchecked")
        Sub website = (Sub) ((Map<String, Object>) document.getOutputs().get("Website")).get("Value");
        assertEquals("https://${OrdersBucket.RegionalDomainName}/index.html", website.getTemplate().render());
        assertTrue(ReferenceIndex.build(document).sitesFor("Bucket").isEmpty());
    }

    @Test
    public void testLiteralValuesAreNotRewritten() {
        TemplateDocument document = TestTemplates.parse("Resources:\n"
                + "  Bucket:\n    Type: AWS::S3::Bucket\n    Properties:\n      BucketName: Bucket\n");

        renamer.apply(document, RenamePlan.of(List.of(resource("Bucket", "Store"))));

        assertEquals("Bucket", document.getResource("Store").stringProperty("BucketName"));
        assertEquals("AWS::S3::Bucket", document.getResource("Store").getType());
    }

    @Test
    public void testConditionRename() {
        TemplateDocument document = TestTemplates.template("short-form.yaml");
        RenameEntry entry = RenameEntry.builder().oldId("IsProd").newId("Production").kind(RenameEntry.Kind.CONDITION).build();

        renamer.apply(document, RenamePlan.of(List.of(entry)));

        assertTrue(document.hasCondition("Production"));
        assertEquals("Production", document.getResource("Bucket").getCondition());
        assertEquals(3, ReferenceIndex.build(document).conditionSitesFor("Production").size());
    }

    @Test
    public void testSwapIsAllowed() {
        TemplateDocument document = TestTemplates.template("short-form.yaml");

        renamer.apply(document, RenamePlan.of(Arrays.asList(resource("Bucket", "Topic"), resource("Topic", "Bucket"))));

        assertEquals("AWS::SNS::Topic", document.getResource("Bucket").getType());
        assertEquals("AWS::S3::Bucket", document.getResource("Topic").getType());
        assertEquals(List.of("Topic"), document.getResource("Bucket").getDependsOn());
    }

    @Test
    public void testCollisionLeavesDocumentUntouched() {
        TemplateDocument document = TestTemplates.template("short-form.yaml");
        String before = serializer.toYaml(document);

        RenameConflictException e = assertThrows(RenameConflictException.class, () -> renamer.apply(document,
                RenamePlan.of(Arrays.asList(resource("Topic", "Notifications"), resource("Bucket", "Stage")))));

        assertEquals("RENAME_CONFLICT", e.getCode());
        assertEquals(before, serializer.toYaml(document));
    }

    @Test
    public void testTwoIdsToOneNameIsRejected() {
        TemplateDocument document = TestTemplates.template("short-form.yaml");

        assertThrows(RenameConflictException.class, () -> renamer.apply(document,
                RenamePlan.of(Arrays.asList(resource("Topic", "Store"), resource("Bucket", "Store")))));
    }

    @Test
    public void testInvalidAndUnknownIdsAreRejected() {
        TemplateDocument document = TestTemplates.template("short-form.yaml");

        assertThrows(RenameConflictException.class,
                () -> renamer.apply(document, RenamePlan.of(List.of(resource("Bucket", "orders-bucket")))));
        assertThrows(RenameConflictException.class,
                () -> renamer.apply(document, RenamePlan.of(List.of(resource("Missing", "Other")))));
    }

    @Test
    public void testEmptyPlanIsNoOp() {
        TemplateDocument document = TestTemplates.template("short-form.yaml");

        assertEquals(0, renamer.apply(document, RenamePlan.skipped()));
    }
}
