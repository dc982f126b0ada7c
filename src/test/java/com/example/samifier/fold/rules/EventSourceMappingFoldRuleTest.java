package com.example.samifier.fold.rules;

import com.example.samifier.TestTemplates;
import com.example.samifier.fold.FoldContext;
import com.example.samifier.fold.PatternLibrary;
import com.example.samifier.fold.SamEvents;
import com.example.samifier.model.GetAtt;
import com.example.samifier.model.Resource;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.plan.FoldEntry;
import com.example.samifier.plan.RefactorPlan;
import com.example.samifier.util.Values;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class EventSourceMappingFoldRuleTest {

    private final PatternLibrary library = TestTemplates.patternLibrary();

    @SuppressWarnings("unchecked")
    private static Map<String, Object> event(Resource function, String name) {
        return (Map<String, Object>) function.mapProperty(SamEvents.EVENTS).get(name);
    }

    @Test
    public void testSqsMappingBecomesEvent() {
        TemplateDocument document = TestTemplates.template("scenario-c-sqs-mapping.json");

        List<FoldEntry> folds = library.fold(document, new RefactorPlan());

        assertFalse(document.hasResource("HandlerSqsEventSourceQueue"));
        assertTrue(document.hasResource("Queue"));
        Map<String, Object> event = event(document.getResource("Handler"), "HandlerSqsEventSourceQueue");
        assertEquals("SQS", event.get("Type"));
        assertEquals(Values.mapOf("Queue", new GetAtt("Queue", "Arn"), "BatchSize", 7), event.get("Properties"));
        assertEquals(2, folds.size());
        assertEquals(EventSourceMappingFoldRule.NAME, folds.get(1).getRule());
        assertTrue(folds.get(1).getLossNotes().isEmpty());
    }

    @Test
    public void testUnknownFieldIsKeptAsOverride() {
        TemplateDocument document = TestTemplates.template("scenario-c-sqs-mapping.json");
        document.getResource("HandlerSqsEventSourceQueue").getProperties().put("StartingPosition", "LATEST");

        List<FoldEntry> folds = library.fold(document, new RefactorPlan());

        Resource handler = document.getResource("Handler");
        @SuppressWarnings("unchecked")
        Map<String, Object> overrides = (Map<String, Object>) handler.getMetadata().get(SamEvents.OVERRIDES);
        assertEquals(Map.of("StartingPosition", "LATEST"), overrides.get("HandlerSqsEventSourceQueue"));
        assertEquals(1, folds.get(1).getLossNotes().size());
        assertTrue(folds.get(1).getLossNotes().get(0).contains("StartingPosition"));
    }

    @Test
    public void testKinesisArnWithoutResource() {
        TemplateDocument document = TestTemplates.template("scenario-c-sqs-mapping.json");
        Map<String, Object> properties = document.getResource("HandlerSqsEventSourceQueue").getProperties();
        properties.put("EventSourceArn", "arn:aws:kinesis:us-east-1:123456789012:stream/orders");
        properties.put("StartingPosition", "TRIM_HORIZON");

        library.fold(document, new RefactorPlan());

        Map<String, Object> event = event(document.getResource("Handler"), "HandlerSqsEventSourceQueue");
        assertEquals("Kinesis", event.get("Type"));
        assertEquals("TRIM_HORIZON", ((Map<?, ?>) event.get("Properties")).get("StartingPosition"));
    }

    @Test
    public void testMappingForUnfoldedFunctionStaysRaw() {
        TemplateDocument document = TestTemplates.template("scenario-c-sqs-mapping.json");
        document.getResource("Handler").getProperties().put("FutureSetting", true);
        RefactorPlan plan = new RefactorPlan();

        library.fold(document, plan);

        assertTrue(document.hasResource("HandlerSqsEventSourceQueue"));
        assertEquals(FoldContext.LAMBDA_FUNCTION, document.getResource("Handler").getType());
        assertTrue(plan.getMessages().stream().anyMatch(m -> m.getText().contains("was not folded")));
    }

    @Test
    public void testMappingWithExternalFunctionIsNotMatched() {
        TemplateDocument document = TestTemplates.parse("Resources:\n"
                + "  Mapping:\n"
                + "    Type: AWS::Lambda::EventSourceMapping\n"
                + "    Properties:\n"
                + "      FunctionName: external-function\n"
                + "      EventSourceArn: arn:aws:sqs:us-east-1:123456789012:orders\n");
        FoldContext context = new FoldContext(document);

        assertTrue(new EventSourceMappingFoldRule().match(context).isEmpty());
        assertTrue(context.getAnnotations().get(0).contains("function is not defined"));
    }

    @Test
    @DisplayName("A mapping with its own Condition is not turned into an unconditional event")
    public void testConditionalMappingStaysRaw() {
        TemplateDocument document = TestTemplates.template("scenario-c-sqs-mapping.json");
        document.getResource("HandlerSqsEventSourceQueue").setCondition("UseQueue");
        RefactorPlan plan = new RefactorPlan();

        List<FoldEntry> folds = library.fold(document, plan);

        assertEquals(1, folds.size());
        Resource mapping = document.getResource("HandlerSqsEventSourceQueue");
        assertNotNull(mapping);
        assertEquals("UseQueue", mapping.getCondition());
        assertNull(document.getResource("Handler").property(SamEvents.EVENTS));
        assertTrue(plan.getMessages().stream().anyMatch(m -> m.getText().equals(
                "[event-source-mapping] HandlerSqsEventSourceQueue stays raw: "
                        + "HandlerSqsEventSourceQueue has Condition UseQueue that Handler does not share")));
    }

    @Test
    public void testMappingSharingFunctionConditionFolds() {
        TemplateDocument document = TestTemplates.template("scenario-c-sqs-mapping.json");
        document.getResource("Handler").setCondition("UseQueue");
        document.getResource("HandlerSqsEventSourceQueue").setCondition("UseQueue");

        library.fold(document, new RefactorPlan());

        assertFalse(document.hasResource("HandlerSqsEventSourceQueue"));
        Resource handler = document.getResource("Handler");
        assertEquals("UseQueue", handler.getCondition());
        assertEquals("SQS", event(handler, "HandlerSqsEventSourceQueue").get("Type"));
    }

    @Test
    public void testRetainedMappingStaysRaw() {
        TemplateDocument document = TestTemplates.template("scenario-c-sqs-mapping.json");
        document.getResource("HandlerSqsEventSourceQueue").getAttributes().put("DeletionPolicy", "Retain");
        RefactorPlan plan = new RefactorPlan();

        library.fold(document, plan);

        assertTrue(document.hasResource("HandlerSqsEventSourceQueue"));
        assertTrue(plan.getMessages().stream().anyMatch(m -> m.getText().endsWith(
                "HandlerSqsEventSourceQueue stays raw: HandlerSqsEventSourceQueue sets [DeletionPolicy]")));
    }

    @Test
    public void testDependsOnAndMetadataAreNoted() {
        TemplateDocument document = TestTemplates.template("scenario-c-sqs-mapping.json");
        Resource mapping = document.getResource("HandlerSqsEventSourceQueue");
        mapping.getDependsOn().add("Queue");
        mapping.getDependsOn().add("Handler");
        mapping.getMetadata().put("aws:cdk:path", "Stack/Handler/SqsEventSourceQueue/Resource");
        mapping.getMetadata().put("checkov", Values.mapOf("skip", "CKV_AWS_116"));

        List<FoldEntry> folds = library.fold(document, new RefactorPlan());

        assertFalse(document.hasResource("HandlerSqsEventSourceQueue"));
        assertEquals(List.of(
                "HandlerSqsEventSourceQueue: DependsOn [Queue] is not carried over",
                "HandlerSqsEventSourceQueue: Metadata [checkov] is not carried over"), folds.get(1).getLossNotes());
    }
}
