package com.example.samifier.fold.rules;

import com.example.samifier.TestTemplates;
import com.example.samifier.fold.PatternLibrary;
import com.example.samifier.model.Ref;
import com.example.samifier.model.Resource;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.plan.RefactorPlan;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class BucketNotificationFoldRuleTest {

    private static final String TEMPLATE = "Resources:\n"
            + "  Fn:\n"
            + "    Type: AWS::Lambda::Function\n"
            + "    Properties:\n"
            + "      Code: {ZipFile: 'def handler(e, c): pass'}\n"
            + "      Handler: index.handler\n"
            + "      Runtime: python3.12\n"
            + "      Role: arn:aws:iam::123456789012:role/lambda\n"
            + "  Uploads:\n"
            + "    Type: AWS::S3::Bucket\n"
            + "    Properties:\n"
            + "      VersioningConfiguration: {Status: Enabled}\n"
            + "      NotificationConfiguration:\n"
            + "        LambdaConfigurations:\n"
            + "          - Event: s3:ObjectCreated:*\n"
            + "            Function: !GetAtt Fn.Arn\n"
            + "    DependsOn: [UploadsPermission]\n"
            + "  UploadsPermission:\n"
            + "    Type: AWS::Lambda::Permission\n"
            + "    Properties:\n"
            + "      Action: lambda:InvokeFunction\n"
            + "      FunctionName: !Ref Fn\n"
            + "      Principal: s3.amazonaws.com\n"
            + "      SourceArn: !GetAtt Uploads.Arn\n";

    private final PatternLibrary library = TestTemplates.patternLibrary();

    @Test
    @SuppressWarnings("unchecked")
    public void testNotificationMovesToFunction() {
        TemplateDocument document = TestTemplates.parse(TEMPLATE);

        library.fold(document, new RefactorPlan());

        assertEquals(Set.of("Fn", "Uploads"), document.getResources().keySet());
        Resource bucket = document.getResource("Uploads");
        assertNull(bucket.property("NotificationConfiguration"));
        assertEquals(Map.of("Status", "Enabled"), bucket.property("VersioningConfiguration"));
        assertTrue(bucket.getDependsOn().isEmpty());

        Map<String, Object> event = (Map<String, Object>) document.getResource("Fn").mapProperty("Events").get("UploadsEvent");
        assertEquals("S3", event.get("Type"));
        assertEquals(Map.of("Bucket", new Ref("Uploads"), "Events", "s3:ObjectCreated:*"), event.get("Properties"));
    }

    @Test
    public void testMissingPermissionLeavesBucketRaw() {
        TemplateDocument document = TestTemplates.parse(TEMPLATE);
        document.removeResource("UploadsPermission");
        document.getResource("Uploads").getDependsOn().clear();
        RefactorPlan plan = new RefactorPlan();

        library.fold(document, plan);

        assertNotNull(document.getResource("Uploads").property("NotificationConfiguration"));
        assertTrue(plan.getMessages().stream().anyMatch(m -> m.getText().equals(
                "[bucket-notification] Uploads notifications stay raw: no S3 invoke permission pairs with them")));
    }

    @Test
    public void testExternalTargetLeavesBucketRaw() {
        TemplateDocument document = TestTemplates.parse(TEMPLATE.replace("Function: !GetAtt Fn.Arn",
                "Function: arn:aws:lambda:us-east-1:123456789012:function:other"));

        List<?> folds = library.fold(document, new RefactorPlan());

        assertEquals(1, folds.size());
        assertTrue(document.hasResource("UploadsPermission"));
    }

    @Test
    public void testRetainedPermissionLeavesBucketRaw() {
        TemplateDocument document = TestTemplates.parse(TEMPLATE);
        document.getResource("UploadsPermission").getAttributes().put("DeletionPolicy", "Retain");
        RefactorPlan plan = new RefactorPlan();

        library.fold(document, plan);

        assertTrue(document.hasResource("UploadsPermission"));
        assertNotNull(document.getResource("Uploads").property("NotificationConfiguration"));
        assertTrue(plan.getMessages().stream().anyMatch(m -> m.getText().equals(
                "[bucket-notification] Uploads notifications stay raw: UploadsPermission sets [DeletionPolicy]")));
    }

    @Test
    public void testConditionalPermissionLeavesBucketRaw() {
        TemplateDocument document = TestTemplates.parse(TEMPLATE);
        document.getResource("UploadsPermission").setCondition("HasUploads");
        RefactorPlan plan = new RefactorPlan();

        library.fold(document, plan);

        assertTrue(document.hasResource("UploadsPermission"));
        assertTrue(plan.getMessages().stream().anyMatch(m -> m.getText().contains(
                "UploadsPermission has Condition HasUploads that Fn does not share")));
    }
}
