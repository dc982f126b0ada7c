package com.example.samifier.fold;

import com.example.samifier.TestTemplates;
import com.example.samifier.config.SamifierProperties;
import com.example.samifier.exception.FoldAmbiguousException;
import com.example.samifier.model.GetAtt;
import com.example.samifier.model.Ref;
import com.example.samifier.model.Resource;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.plan.FoldEntry;
import com.example.samifier.plan.PlanMessage;
import com.example.samifier.plan.RefactorPlan;
import com.example.samifier.template.TemplateSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Rule ordering, claiming and safety checks, exercised with mocked rules
 */
public class PatternLibraryTest {

    private SamifierProperties properties;
    private TemplateDocument document;
    private RefactorPlan plan;

    @BeforeEach
    public void setUp() {
        properties = new SamifierProperties();
        document = TestTemplates.template("short-form.yaml");
        plan = new RefactorPlan();
    }

    private static FoldRule rule(String name, int priority, String... consumed) {
        FoldRule rule = mock(FoldRule.class);
        when(rule.getName()).thenReturn(name);
        when(rule.getDefaultPriority()).thenReturn(priority);
        FoldMatch.FoldMatchBuilder match = FoldMatch.builder().rule(name).anchorId(consumed[0]);
        for (String id : consumed) {
            match.consumed(id);
        }
        when(rule.match(any())).thenReturn(Collections.singletonList(match.build()));
        return rule;
    }

    private static FoldRewrite tagBucket(String tag) {
        FoldRewrite rewrite = new FoldRewrite();
        Resource bucket = Resource.builder().logicalId("Bucket").type("AWS::S3::Bucket").condition("IsProd").build();
        bucket.getProperties().put("Tag", tag);
        return rewrite.upsert(bucket);
    }

    private List<String> messages() {
        return plan.getMessages().stream().map(PlanMessage::getText).collect(Collectors.toList());
    }

    @Test
    public void testEqualPriorityOverlapIsAmbiguous() {
        FoldRule alpha = rule("alpha", 10, "Bucket");
        FoldRule beta = rule("beta", 10, "Bucket", "Topic");
        PatternLibrary library = new PatternLibrary(Arrays.asList(alpha, beta), properties);
        String before = new TemplateSerializer().toYaml(document);

        FoldAmbiguousException e = assertThrows(FoldAmbiguousException.class, () -> library.fold(document, plan));

        assertEquals("alpha", e.getFirstRule());
        assertEquals("beta", e.getSecondRule());
        assertEquals(Collections.singleton("Bucket"), e.getOverlap());
        verify(alpha, never()).rewrite(any(), any());
        verify(beta, never()).rewrite(any(), any());
        assertEquals(before, new TemplateSerializer().toYaml(document));
    }

    @Test
    public void testLowerPriorityClaimsFirst() {
        FoldRule first = rule("first", 10, "Bucket");
        FoldRule second = rule("second", 20, "Bucket");
        when(first.rewrite(any(), any())).thenReturn(tagBucket("first"));
        PatternLibrary library = new PatternLibrary(Arrays.asList(second, first), properties);

        List<FoldEntry> applied = library.fold(document, plan);

        assertEquals(1, applied.size());
        assertEquals("first", applied.get(0).getRule());
        assertEquals("first", document.getResource("Bucket").stringProperty("Tag"));
        verify(second, never()).rewrite(any(), any());
        assertTrue(messages().contains("[second] Skipped Bucket, its resources were already folded"));
        assertEquals(applied, plan.getFolds());
    }

    @Test
    public void testPriorityOverrideReordersRules() {
        FoldRule first = rule("first", 10, "Bucket");
        FoldRule second = rule("second", 20, "Bucket");
        when(second.rewrite(any(), any())).thenReturn(tagBucket("second"));
        properties.getFold().getPriorities().put("second", 5);
        PatternLibrary library = new PatternLibrary(Arrays.asList(first, second), properties);

        library.fold(document, plan);

        assertEquals("second", document.getResource("Bucket").stringProperty("Tag"));
        assertEquals(5, library.priorityOf(second));
    }

    @Test
    public void testDisabledRuleDoesNotRun() {
        FoldRule first = rule("first", 10, "Bucket");
        properties.getFold().getDisabled().add("first");
        PatternLibrary library = new PatternLibrary(Collections.singletonList(first), properties);

        assertTrue(library.activeRules().isEmpty());
        assertTrue(library.fold(document, plan).isEmpty());
        verify(first, never()).match(any());
    }

    @Test
    public void testRemovalThatWouldDangleIsLeftRaw() {
        FoldRule remover = rule("remover", 10, "Bucket");
        when(remover.rewrite(any(), any())).thenReturn(new FoldRewrite().remove("Bucket"));
        PatternLibrary library = new PatternLibrary(Collections.singletonList(remover), properties);

        List<FoldEntry> applied = library.fold(document, plan);

        assertTrue(applied.isEmpty());
        assertTrue(document.hasResource("Bucket"));
        assertTrue(messages().stream().anyMatch(m -> m.startsWith("[remover] Left Bucket unfolded: Bucket is still referenced")));
    }

    @Test
    public void testRepointRewritesReferencesAndDependsOn() {
        FoldRule remover = rule("remover", 10, "Bucket");
        when(remover.rewrite(any(), any())).thenReturn(new FoldRewrite().remove("Bucket").repoint("Bucket", "SiteBucket"));
        PatternLibrary library = new PatternLibrary(Collections.singletonList(remover), properties);

        List<FoldEntry> applied = library.fold(document, plan);

        assertEquals(List.of("SiteBucket"), applied.get(0).getProducedIds());
        assertEquals(List.of("Bucket"), applied.get(0).getConsumedIds());
        assertFalse(document.hasResource("Bucket"));
        assertEquals(List.of("SiteBucket"), document.getResource("Topic").getDependsOn());
        @SuppressWarnings("unchecked")
        Object value = ((Map<String, Object>) document.getOutputs().get("BucketArn")).get("Value");
        assertEquals(new GetAtt("SiteBucket", "Arn"), value);
    }

    @Test
    public void testSkippedRewriteIsAnnotated() {
        FoldRule skipper = rule("skipper", 10, "Topic");
        when(skipper.rewrite(any(), any())).thenReturn(FoldRewrite.skip("unsupported property"));
        PatternLibrary library = new PatternLibrary(Collections.singletonList(skipper), properties);

        assertTrue(library.fold(document, plan).isEmpty());
        assertTrue(messages().contains("[skipper] Left Topic unfolded: unsupported property"));
    }

    @Test
    public void testTransformIsAddedOnce() {
        PatternLibrary library = new PatternLibrary(Collections.emptyList(), properties);

        library.fold(document, plan);
        library.fold(document, plan);

        assertEquals(PatternLibrary.SAM_TRANSFORM, document.getSection(TemplateDocument.TRANSFORM));
    }

    @Test
    public void testExistingTransformIsKept() {
        document.setSection(TemplateDocument.TRANSFORM, "AWS::LanguageExtensions");

        PatternLibrary.ensureTransform(document);

        assertEquals(Arrays.asList("AWS::LanguageExtensions", PatternLibrary.SAM_TRANSFORM),
                document.getSection(TemplateDocument.TRANSFORM));
    }

    @Test
    public void testHoistGlobals() {
        TemplateDocument functions = TestTemplates.parse("Resources:\n"
                + "  A:\n    Type: AWS::Serverless::Function\n    Properties:\n      Runtime: python3.12\n      Timeout: 10\n"
                + "  B:\n    Type: AWS::Serverless::Function\n    Properties:\n      Runtime: python3.12\n      Timeout: 30\n");
        properties.getFold().setHoistGlobals(true);
        PatternLibrary library = new PatternLibrary(Collections.emptyList(), properties);

        library.fold(functions, plan);

        @SuppressWarnings("unchecked")
        Map<String, Object> globals = (Map<String, Object>) functions.sectionMap(TemplateDocument.GLOBALS).get("Function");
        assertEquals(Map.of("Runtime", "python3.12"), globals);
        assertNull(functions.getResource("A").property("Runtime"));
        assertEquals(10, functions.getResource("A").property("Timeout"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testHoistSharedEnvironmentVariables() {
        TemplateDocument functions = TestTemplates.parse("Resources:\n"
                + "  A:\n    Type: AWS::Serverless::Function\n    Properties:\n      Runtime: python3.12\n"
                + "      Environment:\n        Variables:\n          STAGE: prod\n          LOG_LEVEL: info\n"
                + "  B:\n    Type: AWS::Serverless::Function\n    Properties:\n      Runtime: python3.12\n"
                + "      Environment:\n        Variables:\n          STAGE: prod\n          TABLE: !Ref Table\n"
                + "  Table:\n    Type: AWS::Serverless::SimpleTable\n");
        PatternLibrary library = new PatternLibrary(Collections.emptyList(), properties);

        library.fold(functions, plan);

        Map<String, Object> globals = (Map<String, Object>) functions.sectionMap(TemplateDocument.GLOBALS).get("Function");
        assertEquals("python3.12", globals.get("Runtime"));
        assertEquals(Map.of("Variables", Map.of("STAGE", "prod")), globals.get("Environment"));
        assertEquals(Map.of("Variables", Map.of("LOG_LEVEL", "info")), functions.getResource("A").property("Environment"));
        assertEquals(Map.of("Variables", Map.of("TABLE", new Ref("Table"))), functions.getResource("B").property("Environment"));
        assertTrue(plan.getMessages().stream().anyMatch(m -> m.getText().equals(
                "Hoisted [Runtime, Environment.Variables.STAGE] of 2 functions into Globals.Function")));
    }

    @Test
    public void testEmptiedEnvironmentIsRemoved() {
        TemplateDocument functions = TestTemplates.parse("Resources:\n"
                + "  A:\n    Type: AWS::Serverless::Function\n    Properties:\n"
                + "      Environment:\n        Variables:\n          STAGE: prod\n"
                + "  B:\n    Type: AWS::Serverless::Function\n    Properties:\n"
                + "      Environment:\n        Variables:\n          STAGE: prod\n");
        PatternLibrary library = new PatternLibrary(Collections.emptyList(), properties);

        library.fold(functions, plan);

        assertNull(functions.getResource("A").property("Environment"));
        assertNull(functions.getResource("B").property("Environment"));
    }

    @Test
    public void testHoistingCanBeTurnedOff() {
        TemplateDocument functions = TestTemplates.parse("Resources:\n"
                + "  A:\n    Type: AWS::Serverless::Function\n    Properties:\n      Runtime: python3.12\n"
                + "  B:\n    Type: AWS::Serverless::Function\n    Properties:\n      Runtime: python3.12\n");
        assertTrue(properties.getFold().isHoistGlobals());
        properties.getFold().setHoistGlobals(false);
        PatternLibrary library = new PatternLibrary(Collections.emptyList(), properties);

        library.fold(functions, plan);

        assertNull(functions.getSection(TemplateDocument.GLOBALS));
        assertEquals("python3.12", functions.getResource("A").property("Runtime"));
    }

    @Test
    public void testAmbiguityIsCheckedWithoutFolding() {
        FoldRule alpha = rule("alpha", 10, "Bucket");
        FoldRule beta = rule("beta", 10, "Bucket");
        PatternLibrary library = new PatternLibrary(Arrays.asList(alpha, beta), properties);

        assertThrows(FoldAmbiguousException.class, () -> library.verifyUnambiguous(document));
        verify(alpha, never()).rewrite(any(), any());
        assertTrue(plan.getMessages().isEmpty());
    }
}
