package com.example.samifier.fold.rules;

import com.example.samifier.TestTemplates;
import com.example.samifier.fold.PatternLibrary;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.plan.FoldEntry;
import com.example.samifier.plan.RefactorPlan;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class EventsRuleFoldRuleTest {

    private static final String FUNCTION = "Resources:\n"
            + "  Fn:\n"
            + "    Type: AWS::Lambda::Function\n"
            + "    Properties:\n"
            + "      Code: {ZipFile: 'exports.handler = async () => {}'}\n"
            + "      Handler: index.handler\n"
            + "      Runtime: nodejs18.x\n"
            + "      Role: arn:aws:iam::123456789012:role/lambda\n";

    private final PatternLibrary library = TestTemplates.patternLibrary();

    @Test
    @SuppressWarnings("unchecked")
    public void testScheduleRuleBecomesScheduleEvent() {
        TemplateDocument document = TestTemplates.parse(FUNCTION
                + "  Nightly:\n"
                + "    Type: AWS::Events::Rule\n"
                + "    Properties:\n"
                + "      ScheduleExpression: rate(1 day)\n"
                + "      State: ENABLED\n"
                + "      Targets:\n"
                + "        - Arn: !GetAtt Fn.Arn\n"
                + "          Id: Target0\n"
                + "  NightlyPermission:\n"
                + "    Type: AWS::Lambda::Permission\n"
                + "    Properties:\n"
                + "      Action: lambda:InvokeFunction\n"
                + "      FunctionName: !GetAtt Fn.Arn\n"
                + "      Principal: events.amazonaws.com\n"
                + "      SourceArn: !GetAtt Nightly.Arn\n");

        List<FoldEntry> folds = library.fold(document, new RefactorPlan());

        assertEquals(Set.of("Fn"), document.getResources().keySet());
        Map<String, Object> event = (Map<String, Object>) document.getResource("Fn").mapProperty("Events").get("Nightly");
        assertEquals("Schedule", event.get("Type"));
        assertEquals(Map.of("Schedule", "rate(1 day)", "State", "ENABLED"), event.get("Properties"));
        assertEquals(List.of("Nightly", "NightlyPermission"), folds.get(1).getConsumedIds());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testPatternRuleKeepsTargetIdAndNotesDescription() {
        TemplateDocument document = TestTemplates.parse(FUNCTION
                + "  Uploads:\n"
                + "    Type: AWS::Events::Rule\n"
                + "    Properties:\n"
                + "      Description: object uploads\n"
                + "      EventPattern:\n"
                + "        source: [aws.s3]\n"
                + "      Targets:\n"
                + "        - Arn: !GetAtt Fn.Arn\n"
                + "          Id: Target0\n");

        List<FoldEntry> folds = library.fold(document, new RefactorPlan());

        Map<String, Object> event = (Map<String, Object>) document.getResource("Fn").mapProperty("Events").get("Uploads");
        assertEquals("EventBridgeRule", event.get("Type"));
        Map<String, Object> properties = (Map<String, Object>) event.get("Properties");
        assertEquals(Map.of("source", List.of("aws.s3")), properties.get("Pattern"));
        assertEquals(Map.of("Id", "Target0"), properties.get("Target"));
        assertEquals(List.of("Uploads: Description has no EventBridgeRule event equivalent"), folds.get(1).getLossNotes());
    }

    @Test
    public void testMultipleTargetsStayRaw() {
        TemplateDocument document = TestTemplates.parse(FUNCTION
                + "  Fanout:\n"
                + "    Type: AWS::Events::Rule\n"
                + "    Properties:\n"
                + "      ScheduleExpression: rate(5 minutes)\n"
                + "      Targets:\n"
                + "        - {Arn: !GetAtt Fn.Arn, Id: One}\n"
                + "        - {Arn: !GetAtt Fn.Arn, Id: Two}\n");
        RefactorPlan plan = new RefactorPlan();

        library.fold(document, plan);

        assertTrue(document.hasResource("Fanout"));
        assertTrue(plan.getMessages().stream().anyMatch(m -> m.getText().startsWith("[events-rule] Fanout stays raw")));
    }

    private static final String NIGHTLY = FUNCTION
            + "  Nightly:\n"
            + "    Type: AWS::Events::Rule\n"
            + "    Properties:\n"
            + "      ScheduleExpression: rate(1 day)\n"
            + "      Targets:\n"
            + "        - Arn: !GetAtt Fn.Arn\n"
            + "          Id: Target0\n";

    @Test
    public void testConditionalRuleStaysRaw() {
        TemplateDocument document = TestTemplates.parse(NIGHTLY);
        document.getResource("Nightly").setCondition("IsProd");
        RefactorPlan plan = new RefactorPlan();

        library.fold(document, plan);

        assertTrue(document.hasResource("Nightly"));
        assertNull(document.getResource("Fn").property("Events"));
        assertTrue(plan.getMessages().stream().anyMatch(m -> m.getText().equals(
                "[events-rule] Nightly stays raw: Nightly has Condition IsProd that Fn does not share")));
    }

    @Test
    public void testRuleMetadataIsNoted() {
        TemplateDocument document = TestTemplates.parse(NIGHTLY);
        document.getResource("Nightly").getMetadata().put("owner", "billing");

        List<FoldEntry> folds = library.fold(document, new RefactorPlan());

        assertFalse(document.hasResource("Nightly"));
        assertEquals(List.of("Nightly: Metadata [owner] is not carried over"), folds.get(1).getLossNotes());
    }
}
