package com.example.samifier.fold.rules;

import com.example.samifier.fold.FoldContext;
import com.example.samifier.fold.FoldMatch;
import com.example.samifier.fold.FoldRewrite;
import com.example.samifier.fold.FoldRule;
import com.example.samifier.fold.PolicyTemplateTranslator;
import com.example.samifier.fold.ResourceAttributes;
import com.example.samifier.fold.SamProperties;
import com.example.samifier.model.FnCall;
import com.example.samifier.model.Ref;
import com.example.samifier.model.Resource;
import com.example.samifier.model.Sub;
import com.example.samifier.util.Values;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code AWS::Lambda::Function} plus, when possible, its execution role and attached policies
 * become one {@code AWS::Serverless::Function}.
 *
 * A function with a property SAM cannot express stays raw. The role is absorbed only when it
 * trusts Lambda alone, serves this function alone and its inline statements translate into
 * policy entries; otherwise the function keeps {@code Role} and the role is flagged for review.
 * A role or policy with its own lifecycle policy is never absorbed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FunctionFoldRule implements FoldRule {
    public static final String NAME = "function";

    static final String IAM_ROLE = "AWS::IAM::Role";
    static final String IAM_POLICY = "AWS::IAM::Policy";
    private static final String BASIC_EXECUTION_POLICY = ":iam::aws:policy/service-role/AWSLambdaBasicExecutionRole";
    private static final String LAMBDA_SERVICE = "lambda.amazonaws.com";

    private static final Set<String> PASSTHROUGH = Set.of(
            "Architectures", "CodeSigningConfigArn", "Description", "Environment", "EphemeralStorage",
            "FileSystemConfigs", "FunctionName", "Handler", "ImageConfig", "KmsKeyArn", "Layers", "LoggingConfig",
            "MemorySize", "PackageType", "RecursiveLoop", "ReservedConcurrentExecutions", "Role", "Runtime",
            "RuntimeManagementPolicy", "SnapStart", "Timeout", "VpcConfig");
    private static final Set<String> MAPPED = Set.of("Code", "TracingConfig", "Tags", "DeadLetterConfig");
    private static final Set<String> CODE_KEYS = Set.of("ZipFile", "S3Bucket", "S3Key", "S3ObjectVersion", "ImageUri");
    private static final Set<String> ROLE_KEYS = Set.of(
            "AssumeRolePolicyDocument", "ManagedPolicyArns", "Policies", "PermissionsBoundary");
    private static final Set<String> POLICY_KEYS = Set.of("PolicyDocument", "PolicyName", "Roles");
    private static final Set<String> TRUST_KEYS = Set.of("Version", "Statement");
    private static final Set<String> TRUST_STATEMENT_KEYS = Set.of("Sid", "Effect", "Principal", "Action");

    private final PolicyTemplateTranslator translator;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getDefaultPriority() {
        return 10;
    }

    @Override
    public List<FoldMatch> match(FoldContext context) {
        List<FoldMatch> matches = new ArrayList<>();
        for (Resource function : context.getDocument().resourcesOfType(FoldContext.LAMBDA_FUNCTION)) {
            String blocker = findBlocker(function, context);
            if (blocker != null) {
                context.annotate(NAME, function.getLogicalId() + " stays raw: " + blocker);
                continue;
            }
            RoleAnalysis role = analyzeRole(function, context);
            FoldMatch.FoldMatchBuilder match = FoldMatch.builder()
                    .rule(NAME)
                    .anchorId(function.getLogicalId())
                    .consumed(function.getLogicalId())
                    .attribute("role", role);
            if (role.isAbsorbable()) {
                match.consumed(role.getRoleId());
                role.getAbsorbedPolicies().forEach(match::consumed);
            }
            matches.add(match.build());
        }
        return matches;
    }

    @Override
    public FoldRewrite rewrite(FoldMatch match, FoldContext context) {
        Resource function = context.resource(match.getAnchorId());
        RoleAnalysis role = match.attribute("role");
        FoldRewrite rewrite = new FoldRewrite();

        Resource folded = function.copy();
        folded.setType(FoldContext.SERVERLESS_FUNCTION);
        Map<String, Object> properties = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : function.getProperties().entrySet()) {
            Object value = Values.deepCopy(entry.getValue());
            switch (entry.getKey()) {
                case "Code":
                    properties.putAll(mapCode(Values.asMap(value)));
                    break;
                case "TracingConfig":
                    properties.put("Tracing", Values.asMap(value).get("Mode"));
                    break;
                case "Tags":
                    properties.put("Tags", SamProperties.tagsToMap(value));
                    break;
                case "DeadLetterConfig":
                    Object targetArn = Values.asMap(value).get("TargetArn");
                    properties.put("DeadLetterQueue", Values.mapOf("Type", deadLetterType(targetArn, context), "TargetArn", targetArn));
                    break;
                case "Role":
                    if (!role.isAbsorbable()) {
                        properties.put("Role", value);
                    }
                    break;
                default:
                    properties.put(entry.getKey(), value);
            }
        }

        if (role.isAbsorbable()) {
            absorbRole(function.getLogicalId(), role, match.group(), properties, rewrite, context);
        } else if (role.getReason() != null) {
            rewrite.review(String.format("Role %s stays raw: %s", role.getRoleId(), role.getReason()));
            for (String policy : role.getKeptPolicies()) {
                rewrite.review(String.format("Policy %s stays raw and attached to %s", policy, role.getRoleId()));
            }
        }

        folded.setProperties(properties);
        rewrite.upsert(folded);
        return rewrite;
    }

    private void absorbRole(String functionId, RoleAnalysis role, Set<String> group, Map<String, Object> properties,
                            FoldRewrite rewrite, FoldContext context) {
        Resource roleResource = context.resource(role.getRoleId());
        ResourceAttributes.noteDropped(roleResource, group, rewrite);
        List<Object> policies = new ArrayList<>();
        for (Object arn : Values.listOf(roleResource.property("ManagedPolicyArns"))) {
            if (!isBasicExecutionPolicy(arn)) {
                policies.add(Values.deepCopy(arn));
            }
        }

        List<Object> statements = new ArrayList<>(role.inlineStatements(context));
        if (!Values.isEmpty(roleResource.property("Policies"))) {
            rewrite.loss(String.format("Inline policy names of %s are replaced by the names SAM generates", role.getRoleId()));
        }
        for (String policyId : role.getAbsorbedPolicies()) {
            Resource policy = context.resource(policyId);
            ResourceAttributes.noteDropped(policy, group, rewrite);
            statements.addAll(statementsOf(policy.property("PolicyDocument")));
            if (policy.property("PolicyName") != null) {
                rewrite.loss(String.format("Policy name of %s is replaced by the name SAM generates", policyId));
            }
            rewrite.remove(policyId);
        }
        List<Object> translated = translator.translate(statements, context, role.forbiddenIds());
        policies.addAll(translated);
        if (!policies.isEmpty()) {
            properties.put("Policies", policies);
        }
        Object boundary = roleResource.property("PermissionsBoundary");
        if (boundary != null) {
            properties.put("PermissionsBoundary", Values.deepCopy(boundary));
        }

        String generatedRole = functionId + "Role";
        rewrite.remove(role.getRoleId());
        if (role.getKeptPolicies().isEmpty()) {
            rewrite.generated(generatedRole);
        } else {
            rewrite.repoint(role.getRoleId(), generatedRole);
            for (String policy : role.getKeptPolicies()) {
                rewrite.review(String.format("Policy %s stays raw and is attached to the generated role %s", policy, generatedRole));
            }
        }
        log.debug("Absorbed role {} into {} with {} policy entries", role.getRoleId(), functionId, policies.size());
    }

    /**
     * The AWS managed basic execution policy, which SAM attaches to every role it generates
     */
    static boolean isBasicExecutionPolicy(Object arn) {
        if (arn instanceof String) {
            return ((String) arn).startsWith("arn:") && ((String) arn).endsWith(BASIC_EXECUTION_POLICY);
        }
        if (arn instanceof Sub) {
            String text = ((Sub) arn).getTemplate().render();
            return text.startsWith("arn:") && text.endsWith(BASIC_EXECUTION_POLICY);
        }
        if (arn instanceof FnCall && FnCall.JOIN.equals(((FnCall) arn).getFunctionName())) {
            List<Object> argument = Values.listOf(((FnCall) arn).getArgument());
            List<Object> parts = argument.size() == 2 && "".equals(argument.get(0)) ? Values.listOf(argument.get(1)) : List.of();
            return parts.size() == 3
                    && "arn:".equals(parts.get(0))
                    && parts.get(1) instanceof Ref && "AWS::Partition".equals(((Ref) parts.get(1)).getTarget())
                    && BASIC_EXECUTION_POLICY.equals(parts.get(2));
        }
        return false;
    }

    private static Map<String, Object> mapCode(Map<String, Object> code) {
        if (code.containsKey("ZipFile")) {
            return Values.mapOf("InlineCode", code.get("ZipFile"));
        }
        if (code.containsKey("ImageUri")) {
            return Values.mapOf("ImageUri", code.get("ImageUri"));
        }
        return Values.mapOf("CodeUri", Values.mapOf(
                "Bucket", code.get("S3Bucket"),
                "Key", code.get("S3Key"),
                "Version", code.get("S3ObjectVersion")));
    }

    private String findBlocker(Resource function, FoldContext context) {
        List<String> unsupported = new ArrayList<>();
        for (String key : function.getProperties().keySet()) {
            if (!PASSTHROUGH.contains(key) && !MAPPED.contains(key)) {
                unsupported.add(key);
            }
        }
        if (!unsupported.isEmpty()) {
            return "no SAM equivalent for " + unsupported;
        }
        Map<String, Object> code = function.mapProperty("Code");
        if (code == null || code.isEmpty() || !SamProperties.unsupported(code, CODE_KEYS).isEmpty()) {
            return "code location cannot be expressed";
        }
        Object tracing = function.property("TracingConfig");
        if (tracing != null && (Values.asMap(tracing) == null || !Values.asMap(tracing).keySet().equals(Set.of("Mode")))) {
            return "TracingConfig cannot be expressed";
        }
        if (function.property("Tags") != null && SamProperties.tagsToMap(function.property("Tags")) == null) {
            return "Tags cannot be converted to a map";
        }
        Object deadLetter = function.property("DeadLetterConfig");
        if (deadLetter != null) {
            Map<String, Object> config = Values.asMap(deadLetter);
            if (config == null || deadLetterType(config.get("TargetArn"), context) == null) {
                return "dead letter target type is unknown";
            }
        }
        return null;
    }

    static String deadLetterType(Object targetArn, FoldContext context) {
        Resource target = context.resource(Values.directTarget(targetArn));
        if (target != null) {
            if (target.isType("AWS::SQS::Queue")) {
                return "SQS";
            }
            if (target.isType("AWS::SNS::Topic")) {
                return "SNS";
            }
            return null;
        }
        if (Values.containsText(targetArn, ":sqs:")) {
            return "SQS";
        }
        if (Values.containsText(targetArn, ":sns:")) {
            return "SNS";
        }
        return null;
    }

    private RoleAnalysis analyzeRole(Resource function, FoldContext context) {
        Object roleValue = function.property("Role");
        Resource role = context.target(roleValue, IAM_ROLE);
        RoleAnalysis analysis = new RoleAnalysis(role == null ? Values.directTarget(roleValue) : role.getLogicalId());
        if (role == null) {
            return analysis;
        }

        String functionId = function.getLogicalId();
        List<Resource> attached = attachedPolicies(role.getLogicalId(), context);
        for (Resource policy : attached) {
            if (isAbsorbable(policy, role.getLogicalId(), context)) {
                analysis.absorbedPolicies.add(policy.getLogicalId());
            } else {
                analysis.keptPolicies.add(policy.getLogicalId());
            }
        }

        String generatedRole = functionId + "Role";
        Set<String> allowedReferrers = new HashSet<>();
        allowedReferrers.add(functionId);
        attached.forEach(policy -> allowedReferrers.add(policy.getLogicalId()));

        if (role.getCondition() != null) {
            analysis.reason = "role is conditional";
        } else if (!role.getAttributes().isEmpty()) {
            analysis.reason = "role sets " + new ArrayList<>(role.getAttributes().keySet());
        } else if (!SamProperties.unsupported(role.getProperties(), ROLE_KEYS).isEmpty()) {
            analysis.reason = "role sets " + SamProperties.unsupported(role.getProperties(), ROLE_KEYS);
        } else if (!trustsLambdaOnly(role.property("AssumeRolePolicyDocument"))) {
            analysis.reason = "role trusts principals other than " + LAMBDA_SERVICE;
        } else if (context.getIndex().isReferencedOutside(role.getLogicalId(), allowedReferrers)) {
            analysis.reason = "role is also used by " + context.getIndex().referrersOf(role.getLogicalId());
        } else if (!generatedRole.equals(role.getLogicalId()) && context.getDocument().hasResource(generatedRole)) {
            analysis.reason = "SAM would generate " + generatedRole + ", which already exists";
        } else if (role.property("ManagedPolicyArns") != null && Values.asList(role.property("ManagedPolicyArns")) == null) {
            analysis.reason = "managed policy list is computed";
        } else if (translator.translate(analysis.inlineStatements(context), context, analysis.forbiddenIds()) == null) {
            analysis.reason = "inline policies contain statements SAM cannot express";
        } else {
            analysis.absorbable = true;
        }
        return analysis;
    }

    private static List<Resource> attachedPolicies(String roleId, FoldContext context) {
        List<Resource> attached = new ArrayList<>();
        for (Resource policy : context.getDocument().resourcesOfType(IAM_POLICY)) {
            for (Object role : Values.listOf(policy.property("Roles"))) {
                if (roleId.equals(Values.directTarget(role))) {
                    attached.add(policy);
                    break;
                }
            }
        }
        return attached;
    }

    private boolean isAbsorbable(Resource policy, String roleId, FoldContext context) {
        List<Object> roles = Values.listOf(policy.property("Roles"));
        return policy.getCondition() == null
                && policy.getAttributes().isEmpty()
                && SamProperties.unsupported(policy.getProperties(), POLICY_KEYS).isEmpty()
                && roles.size() == 1
                && roleId.equals(Values.directTarget(roles.get(0)))
                && context.getIndex().referrersOf(policy.getLogicalId()).isEmpty()
                && translator.translate(statementsOf(policy.property("PolicyDocument")), context,
                        Set.of(roleId, policy.getLogicalId())) != null;
    }

    private static boolean trustsLambdaOnly(Object document) {
        Map<String, Object> trust = Values.asMap(document);
        if (trust == null || !SamProperties.unsupported(trust, TRUST_KEYS).isEmpty()) {
            return false;
        }
        List<Object> statements = Values.listOf(trust.get("Statement"));
        if (statements.isEmpty()) {
            return false;
        }
        for (Object raw : statements) {
            Map<String, Object> statement = Values.asMap(raw);
            if (statement == null || !SamProperties.unsupported(statement, TRUST_STATEMENT_KEYS).isEmpty()
                    || !"Allow".equals(statement.get("Effect"))
                    || !Values.listOf(statement.get("Action")).equals(List.of("sts:AssumeRole"))) {
                return false;
            }
            Map<String, Object> principal = Values.asMap(statement.get("Principal"));
            if (principal == null || principal.size() != 1
                    || !Values.listOf(principal.get("Service")).equals(List.of(LAMBDA_SERVICE))) {
                return false;
            }
        }
        return true;
    }

    static List<Object> statementsOf(Object policyDocument) {
        Map<String, Object> document = Values.asMap(policyDocument);
        if (document == null) {
            return policyDocument == null ? List.of() : Collections.singletonList(policyDocument);
        }
        return Values.listOf(document.get("Statement"));
    }

    /**
     * What the function rule decided about an execution role
     */
    @Getter
    static class RoleAnalysis {
        private final String roleId;
        private boolean absorbable;
        /** Why the role stays raw, null when there is nothing to review */
        private String reason;
        private final List<String> absorbedPolicies = new ArrayList<>();
        private final List<String> keptPolicies = new ArrayList<>();

        RoleAnalysis(String roleId) {
            this.roleId = roleId;
        }

        List<Object> inlineStatements(FoldContext context) {
            List<Object> statements = new ArrayList<>();
            Resource role = context.resource(roleId);
            for (Object raw : Values.listOf(role.property("Policies"))) {
                Map<String, Object> policy = Values.asMap(raw);
                statements.addAll(statementsOf(policy == null ? raw : policy.get("PolicyDocument")));
            }
            return statements;
        }

        Set<String> forbiddenIds() {
            Set<String> ids = new HashSet<>(absorbedPolicies);
            ids.add(roleId);
            return ids;
        }
    }
}
