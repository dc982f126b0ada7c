package com.example.samifier.fold.rules;

import com.example.samifier.TestTemplates;
import com.example.samifier.fold.FoldContext;
import com.example.samifier.fold.FoldMatch;
import com.example.samifier.fold.PatternLibrary;
import com.example.samifier.fold.PolicyTemplateTranslator;
import com.example.samifier.model.GetAtt;
import com.example.samifier.model.Ref;
import com.example.samifier.model.FnCall;
import com.example.samifier.model.Resource;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.plan.FoldEntry;
import com.example.samifier.plan.RefactorPlan;
import com.example.samifier.util.Values;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class FunctionFoldRuleTest {

    private final FunctionFoldRule rule = new FunctionFoldRule(new PolicyTemplateTranslator());
    private final PatternLibrary library = TestTemplates.patternLibrary();

    private static final String SHARED_ROLE = "Resources:\n"
            + "  SharedRole:\n"
            + "    Type: AWS::IAM::Role\n"
            + "    Properties:\n"
            + "      AssumeRolePolicyDocument:\n"
            + "        Statement:\n"
            + "          - Effect: Allow\n"
            + "            Principal: {Service: lambda.amazonaws.com}\n"
            + "            Action: sts:AssumeRole\n"
            + "  First:\n"
            + "    Type: AWS::Lambda::Function\n"
            + "    Properties:\n"
            + "      Code: {ZipFile: one}\n"
            + "      Handler: index.handler\n"
            + "      Runtime: python3.12\n"
            + "      Role: !GetAtt SharedRole.Arn\n"
            + "  Second:\n"
            + "    Type: AWS::Lambda::Function\n"
            + "    Properties:\n"
            + "      Code: {ZipFile: two}\n"
            + "      Handler: index.handler\n"
            + "      Runtime: python3.12\n"
            + "      Role: !GetAtt SharedRole.Arn\n";

    @Test
    @DisplayName("Inline function with a basic execution role folds into one serverless function")
    public void testScenarioA() {
        TemplateDocument document = TestTemplates.template("scenario-a-inline-function.json");
        Object inlineCode = document.getResource("Handler").mapProperty("Code").get("ZipFile");

        List<FoldEntry> folds = library.fold(document, new RefactorPlan());

        assertEquals(Set.of("Handler"), document.getResources().keySet());
        Resource handler = document.getResource("Handler");
        assertEquals(FoldContext.SERVERLESS_FUNCTION, handler.getType());
        assertEquals(inlineCode, handler.property("InlineCode"));
        assertEquals("index.handler", handler.property("Handler"));
        assertEquals("nodejs18.x", handler.property("Runtime"));
        assertNull(handler.property("Role"));
        assertNull(handler.property("Policies"));
        assertTrue(handler.getDependsOn().isEmpty());
        assertEquals(PatternLibrary.SAM_TRANSFORM, document.getSection(TemplateDocument.TRANSFORM));

        FoldEntry entry = folds.get(0);
        assertEquals(FunctionFoldRule.NAME, entry.getRule());
        assertEquals(List.of("Handler", "HandlerServiceRole"), entry.getConsumedIds());
        assertEquals(List.of("Handler", "HandlerRole"), entry.getProducedIds());
    }

    @Test
    public void testAttachedPolicyBecomesPolicyTemplate() {
        TemplateDocument document = TestTemplates.template("scenario-c-sqs-mapping.json");

        library.fold(document, new RefactorPlan());

        Resource handler = document.getResource("Handler");
        assertFalse(document.hasResource("HandlerServiceRole"));
        assertFalse(document.hasResource("HandlerServiceRoleDefaultPolicy"));
        assertEquals(List.of(Values.mapOf("SQSPollerPolicy", Values.mapOf("QueueName", new GetAtt("Queue", "QueueName")))),
                handler.property("Policies"));
    }

    @Test
    public void testSharedRoleStaysRaw() {
        TemplateDocument document = TestTemplates.parse(SHARED_ROLE);

        List<FoldEntry> folds = library.fold(document, new RefactorPlan());

        assertTrue(document.hasResource("SharedRole"));
        assertEquals(new GetAtt("SharedRole", "Arn"), document.getResource("First").property("Role"));
        assertEquals(FoldContext.SERVERLESS_FUNCTION, document.getResource("Second").getType());
        assertEquals(2, folds.size());
        assertTrue(folds.get(0).getReviewFlags().get(0).startsWith("Role SharedRole stays raw: role is also used by"));
    }

    @Test
    public void testUnsupportedPropertyBlocksMatch() {
        TemplateDocument document = TestTemplates.parse("Resources:\n"
                + "  Fn:\n"
                + "    Type: AWS::Lambda::Function\n"
                + "    Properties:\n"
                + "      Code: {ZipFile: x}\n"
                + "      Handler: index.handler\n"
                + "      Runtime: python3.12\n"
                + "      Role: arn:aws:iam::123456789012:role/fn\n"
                + "      FutureSetting: true\n");
        FoldContext context = new FoldContext(document);

        assertTrue(rule.match(context).isEmpty());
        assertEquals(List.of("[function] Fn stays raw: no SAM equivalent for [FutureSetting]"), context.getAnnotations());
    }

    @Test
    public void testLiteralRoleIsKept() {
        TemplateDocument document = TestTemplates.parse("Resources:\n"
                + "  Fn:\n"
                + "    Type: AWS::Lambda::Function\n"
                + "    Properties:\n"
                + "      Code: {S3Bucket: code-bucket, S3Key: fn.zip}\n"
                + "      Handler: index.handler\n"
                + "      Runtime: python3.12\n"
                + "      Role: arn:aws:iam::123456789012:role/fn\n"
                + "      TracingConfig: {Mode: Active}\n"
                + "      Tags:\n"
                + "        - {Key: team, Value: orders}\n");

        library.fold(document, new RefactorPlan());

        Resource function = document.getResource("Fn");
        assertEquals("arn:aws:iam::123456789012:role/fn", function.property("Role"));
        assertEquals("Active", function.property("Tracing"));
        assertEquals(Map.of("team", "orders"), function.property("Tags"));
        assertEquals(Values.mapOf("Bucket", "code-bucket", "Key", "fn.zip", "Version", null), function.property("CodeUri"));
    }

    @Test
    public void testKeptPolicyIsRepointedToGeneratedRole() {
        TemplateDocument document = TestTemplates.parse("Resources:\n"
                + "  FnRoleSource:\n"
                + "    Type: AWS::IAM::Role\n"
                + "    Properties:\n"
                + "      AssumeRolePolicyDocument:\n"
                + "        Statement:\n"
                + "          - Effect: Allow\n"
                + "            Principal: {Service: lambda.amazonaws.com}\n"
                + "            Action: sts:AssumeRole\n"
                + "  Extra:\n"
                + "    Type: AWS::IAM::Policy\n"
                + "    Properties:\n"
                + "      PolicyName: extra\n"
                + "      PolicyDocument:\n"
                + "        Statement:\n"
                + "          - Effect: Allow\n"
                + "            NotAction: iam:*\n"
                + "            Resource: '*'\n"
                + "      Roles: [!Ref FnRoleSource]\n"
                + "  Fn:\n"
                + "    Type: AWS::Lambda::Function\n"
                + "    Properties:\n"
                + "      Code: {ZipFile: x}\n"
                + "      Handler: index.handler\n"
                + "      Runtime: python3.12\n"
                + "      Role: !GetAtt FnRoleSource.Arn\n");

        List<FoldEntry> folds = library.fold(document, new RefactorPlan());

        assertFalse(document.hasResource("FnRoleSource"));
        assertEquals(List.of(new Ref("FnRole")), document.getResource("Extra").property("Roles"));
        assertTrue(folds.get(0).getProducedIds().contains("FnRole"));
        assertTrue(folds.get(0).getReviewFlags().get(0).contains("Extra"));
    }

    @Test
    public void testMatchClaimsRoleOnlyWhenAbsorbable() {
        FoldContext context = new FoldContext(TestTemplates.template("scenario-c-sqs-mapping.json"));

        FoldMatch match = rule.match(context).get(0);

        assertEquals(Set.of("Handler", "HandlerServiceRole", "HandlerServiceRoleDefaultPolicy"), match.getConsumedIds());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testRoleTrustingAnotherPrincipalStaysRaw() {
        TemplateDocument document = TestTemplates.template("scenario-a-inline-function.json");
        Map<String, Object> trust = document.getResource("HandlerServiceRole").mapProperty("AssumeRolePolicyDocument");
        Map<String, Object> statement = (Map<String, Object>) Values.listOf(trust.get("Statement")).get(0);
        statement.put("Principal", Values.mapOf("Service", Arrays.asList("lambda.amazonaws.com", "edgelambda.amazonaws.com")));

        List<FoldEntry> folds = library.fold(document, new RefactorPlan());

        assertTrue(document.hasResource("HandlerServiceRole"));
        Resource handler = document.getResource("Handler");
        assertEquals(new GetAtt("HandlerServiceRole", "Arn"), handler.property("Role"));
        assertEquals(List.of("Role HandlerServiceRole stays raw: role trusts principals other than lambda.amazonaws.com"),
                folds.get(0).getReviewFlags());
    }

    @Test
    public void testTrustPolicyWithExtraKeysStaysRaw() {
        TemplateDocument document = TestTemplates.template("scenario-a-inline-function.json");
        Map<String, Object> trust = document.getResource("HandlerServiceRole").mapProperty("AssumeRolePolicyDocument");
        trust.put("Id", "custom-trust");

        library.fold(document, new RefactorPlan());

        assertTrue(document.hasResource("HandlerServiceRole"));
    }

    @Test
    public void testRoleDependsOnIsNoted() {
        TemplateDocument document = TestTemplates.template("scenario-a-inline-function.json");
        document.getResource("HandlerServiceRole").getDependsOn().add("Boundary");

        List<FoldEntry> folds = library.fold(document, new RefactorPlan());

        assertFalse(document.hasResource("HandlerServiceRole"));
        assertEquals(List.of("HandlerServiceRole: DependsOn [Boundary] is not carried over"), folds.get(0).getLossNotes());
    }

    @Test
    public void testRetainedRoleStaysRaw() {
        TemplateDocument document = TestTemplates.template("scenario-a-inline-function.json");
        document.getResource("HandlerServiceRole").getAttributes().put("DeletionPolicy", "Retain");

        List<FoldEntry> folds = library.fold(document, new RefactorPlan());

        assertTrue(document.hasResource("HandlerServiceRole"));
        assertEquals(List.of("Role HandlerServiceRole stays raw: role sets [DeletionPolicy]"), folds.get(0).getReviewFlags());
    }

    @Test
    public void testBasicExecutionPolicyMatchesExactly() {
        Object joined = new FnCall(FnCall.JOIN, Arrays.asList("", Arrays.asList(
                "arn:", new Ref("AWS::Partition"), ":iam::aws:policy/service-role/AWSLambdaBasicExecutionRole")));

        assertTrue(FunctionFoldRule.isBasicExecutionPolicy(joined));
        assertTrue(FunctionFoldRule.isBasicExecutionPolicy("arn:aws:iam::aws:policy/service-role/AWSLambdaBasicExecutionRole"));
        assertFalse(FunctionFoldRule.isBasicExecutionPolicy("arn:aws:iam::123456789012:policy/AWSLambdaBasicExecutionRole"));
        assertFalse(FunctionFoldRule.isBasicExecutionPolicy(
                "arn:aws:iam::aws:policy/service-role/AWSLambdaBasicExecutionRoleExtended"));
    }

    @Test
    public void testOtherManagedPoliciesAreKept() {
        TemplateDocument document = TestTemplates.template("scenario-a-inline-function.json");
        @SuppressWarnings("unchecked")
        List<Object> arns = (List<Object>) document.getResource("HandlerServiceRole").property("ManagedPolicyArns");
        arns.add("arn:aws:iam::123456789012:policy/AWSLambdaBasicExecutionRole");

        library.fold(document, new RefactorPlan());

        assertEquals(List.of("arn:aws:iam::123456789012:policy/AWSLambdaBasicExecutionRole"),
                document.getResource("Handler").property("Policies"));
    }
}
