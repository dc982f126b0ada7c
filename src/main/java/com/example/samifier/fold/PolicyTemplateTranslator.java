package com.example.samifier.fold;

import com.example.samifier.model.FnCall;
import com.example.samifier.model.GetAtt;
import com.example.samifier.model.Ref;
import com.example.samifier.model.Resource;
import com.example.samifier.model.Sub;
import com.example.samifier.model.SubTemplate;
import com.example.samifier.util.Values;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns IAM policy statements into entries of a serverless function's {@code Policies} list.
 *
 * Statements granting a known action set on a single bucket, queue, table or topic become SAM
 * policy templates (which may grant a little more than the original statement). Everything else
 * that can be expressed becomes one inline policy document.
 */
@Slf4j
@Component
public class PolicyTemplateTranslator {
    private static final Set<String> STATEMENT_KEYS = Set.of("Sid", "Effect", "Action", "Resource", "Condition");

    private static final Set<String> S3_READ = Set.of(
            "s3:GetObject*", "s3:GetObject", "s3:GetBucket*", "s3:List*", "s3:ListBucket");
    private static final Set<String> S3_CRUD = union(S3_READ, Set.of(
            "s3:DeleteObject*", "s3:DeleteObject", "s3:PutObject", "s3:PutObject*", "s3:PutObjectLegalHold",
            "s3:PutObjectRetention", "s3:PutObjectTagging", "s3:PutObjectVersionTagging", "s3:Abort*"));
    private static final Set<String> SQS_POLLER = Set.of(
            "sqs:ReceiveMessage", "sqs:ChangeMessageVisibility", "sqs:GetQueueUrl", "sqs:DeleteMessage",
            "sqs:GetQueueAttributes");
    private static final Set<String> SQS_SEND = Set.of(
            "sqs:SendMessage", "sqs:GetQueueAttributes", "sqs:GetQueueUrl");
    private static final Set<String> DYNAMODB_READ = Set.of(
            "dynamodb:BatchGetItem", "dynamodb:GetRecords", "dynamodb:GetShardIterator", "dynamodb:Query",
            "dynamodb:GetItem", "dynamodb:Scan", "dynamodb:ConditionCheckItem", "dynamodb:DescribeTable");
    private static final Set<String> DYNAMODB_CRUD = union(DYNAMODB_READ, Set.of(
            "dynamodb:BatchWriteItem", "dynamodb:PutItem", "dynamodb:UpdateItem", "dynamodb:DeleteItem"));
    private static final Set<String> SNS_PUBLISH = Set.of("sns:Publish");

    /**
     * @param statements  IAM statements, in order
     * @param context     the document the statements live in
     * @param forbiddenIds IDs that disappear with the fold, a statement naming one cannot be kept
     * @return policy entries, or null when at least one statement cannot be expressed
     */
    public List<Object> translate(List<Object> statements, FoldContext context, Collection<String> forbiddenIds) {
        List<Object> policies = new ArrayList<>();
        List<Object> inline = new ArrayList<>();
        for (Object raw : statements) {
            Map<String, Object> statement = Values.asMap(raw);
            if (statement == null || !STATEMENT_KEYS.containsAll(statement.keySet())) {
                log.debug("Statement {} has a shape policy templates cannot express", raw);
                return null;
            }
            for (String id : Values.referencedIds(statement)) {
                if (forbiddenIds.contains(id)) {
                    log.debug("Statement references {}, which is folded away", id);
                    return null;
                }
            }
            Map<String, Object> template = toTemplate(statement, context);
            if (template != null) {
                if (!policies.contains(template)) {
                    policies.add(template);
                }
            } else {
                inline.add(Values.deepCopy(statement));
            }
        }
        if (!inline.isEmpty()) {
            policies.add(Values.mapOf("Version", "2012-10-17", "Statement", inline));
        }
        return policies;
    }

    private Map<String, Object> toTemplate(Map<String, Object> statement, FoldContext context) {
        if (!"Allow".equals(statement.get("Effect")) || statement.containsKey("Condition")) {
            return null;
        }
        Set<String> actions = new HashSet<>();
        for (Object action : Values.listOf(statement.get("Action"))) {
            if (!(action instanceof String)) {
                return null;
            }
            actions.add((String) action);
        }
        Resource target = singleTarget(statement.get("Resource"), context);
        if (target == null || actions.isEmpty()) {
            return null;
        }
        String id = target.getLogicalId();
        switch (target.getType()) {
            case "AWS::S3::Bucket":
                if (S3_READ.containsAll(actions)) {
                    return Values.mapOf("S3ReadPolicy", Values.mapOf("BucketName", new Ref(id)));
                }
                if (S3_CRUD.containsAll(actions)) {
                    return Values.mapOf("S3CrudPolicy", Values.mapOf("BucketName", new Ref(id)));
                }
                return null;
            case "AWS::SQS::Queue":
                if (SQS_POLLER.containsAll(actions)) {
                    return Values.mapOf("SQSPollerPolicy", Values.mapOf("QueueName", new GetAtt(id, "QueueName")));
                }
                if (SQS_SEND.containsAll(actions)) {
                    return Values.mapOf("SQSSendMessagePolicy", Values.mapOf("QueueName", new GetAtt(id, "QueueName")));
                }
                return null;
            case "AWS::DynamoDB::Table":
                if (DYNAMODB_READ.containsAll(actions)) {
                    return Values.mapOf("DynamoDBReadPolicy", Values.mapOf("TableName", new Ref(id)));
                }
                if (DYNAMODB_CRUD.containsAll(actions)) {
                    return Values.mapOf("DynamoDBCrudPolicy", Values.mapOf("TableName", new Ref(id)));
                }
                return null;
            case "AWS::SNS::Topic":
                if (SNS_PUBLISH.containsAll(actions)) {
                    return Values.mapOf("SNSPublishMessagePolicy", Values.mapOf("TopicName", new GetAtt(id, "TopicName")));
                }
                return null;
            default:
                return null;
        }
    }

    /**
     * The one resource every ARN in the statement points at. Plain ARNs ({@code GetAtt X.Arn},
     * a topic's {@code Ref}) and sub-paths built from them ({@code bucket/*}, {@code table/index/*}) qualify.
     */
    private Resource singleTarget(Object resources, FoldContext context) {
        Set<String> ids = new LinkedHashSet<>();
        for (Object item : Values.listOf(resources)) {
            if (item instanceof Ref && "AWS::NoValue".equals(((Ref) item).getTarget())) {
                continue;
            }
            if (item instanceof GetAtt && !((GetAtt) item).hasAttribute("Arn")) {
                return null;
            }
            Set<String> referenced = Values.referencedIds(item);
            if (referenced.size() != 1 || !isArnOf(item)) {
                return null;
            }
            ids.addAll(referenced);
        }
        if (ids.size() != 1) {
            return null;
        }
        return context.resource(ids.iterator().next());
    }

    private static boolean isArnOf(Object item) {
        if (item instanceof Ref) {
            return true;
        }
        List<String> attributes = new ArrayList<>();
        collectAttributes(item, attributes);
        return !attributes.isEmpty() && attributes.stream().allMatch("Arn"::equals);
    }

    @SuppressWarnings("unchecked")
    private static void collectAttributes(Object value, List<String> attributes) {
        if (value instanceof GetAtt) {
            attributes.add(String.valueOf(((GetAtt) value).getAttribute()));
        } else if (value instanceof Sub) {
            SubTemplate template = ((Sub) value).getTemplate();
            for (int index : template.referenceIndices()) {
                attributes.add(String.valueOf(template.segment(index).getAttribute()));
            }
        } else if (value instanceof FnCall) {
            collectAttributes(((FnCall) value).getArgument(), attributes);
        } else if (value instanceof List) {
            for (Object item : (List<Object>) value) {
                collectAttributes(item, attributes);
            }
        }
    }

    private static Set<String> union(Set<String> first, Set<String> second) {
        Set<String> all = new HashSet<>(first);
        all.addAll(second);
        return Set.copyOf(all);
    }
}
