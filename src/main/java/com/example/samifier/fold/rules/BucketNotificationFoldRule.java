package com.example.samifier.fold.rules;

import com.example.samifier.fold.FoldContext;
import com.example.samifier.fold.FoldMatch;
import com.example.samifier.fold.FoldRewrite;
import com.example.samifier.fold.FoldRule;
import com.example.samifier.fold.ResourceAttributes;
import com.example.samifier.fold.SamEvents;
import com.example.samifier.model.Ref;
import com.example.samifier.model.Resource;
import com.example.samifier.util.Values;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lambda notifications declared on a bucket, together with the matching S3 invoke permission,
 * become {@code S3} events on the function. The bucket keeps the rest of its configuration.
 */
@Component
public class BucketNotificationFoldRule implements FoldRule {
    public static final String NAME = "bucket-notification";

    static final String BUCKET = "AWS::S3::Bucket";
    private static final String S3_SERVICE = "s3.amazonaws.com";
    private static final String NOTIFICATIONS = "NotificationConfiguration";
    private static final String LAMBDA_CONFIGURATIONS = "LambdaConfigurations";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getDefaultPriority() {
        return 50;
    }

    @Override
    public List<FoldMatch> match(FoldContext context) {
        List<FoldMatch> matches = new ArrayList<>();
        for (Resource bucket : context.getDocument().resourcesOfType(BUCKET)) {
            Map<String, Object> notifications = bucket.mapProperty(NOTIFICATIONS);
            List<Object> configurations = notifications == null ? List.of() : Values.listOf(notifications.get(LAMBDA_CONFIGURATIONS));
            if (configurations.isEmpty()) {
                continue;
            }
            String bucketId = bucket.getLogicalId();
            Set<String> functions = new LinkedHashSet<>();
            for (Object raw : configurations) {
                Map<String, Object> configuration = Values.asMap(raw);
                String functionId = configuration == null ? null : context.functionTarget(configuration.get("Function"));
                if (functionId == null) {
                    functions.clear();
                    break;
                }
                functions.add(functionId);
            }
            if (functions.isEmpty()) {
                context.annotate(NAME, bucketId + " notifications stay raw: a target is not a function of this template");
                continue;
            }

            FoldMatch.FoldMatchBuilder match = FoldMatch.builder().rule(NAME).anchorId(bucketId).consumed(bucketId);
            boolean permitted = true;
            String blocker = null;
            for (String functionId : functions) {
                match.host(functionId);
                boolean found = false;
                for (Resource permission : context.permissionsFor(functionId, S3_SERVICE)) {
                    if (bucketId.equals(Values.directTarget(permission.property("SourceArn")))) {
                        match.consumed(permission.getLogicalId());
                        found = true;
                        if (blocker == null) {
                            blocker = ResourceAttributes.blocker(permission, context.resource(functionId));
                        }
                    }
                }
                permitted &= found;
            }
            if (!permitted) {
                context.annotate(NAME, bucketId + " notifications stay raw: no S3 invoke permission pairs with them");
                continue;
            }
            if (blocker != null) {
                context.annotate(NAME, bucketId + " notifications stay raw: " + blocker);
                continue;
            }
            matches.add(match.build());
        }
        return matches;
    }

    @Override
    public FoldRewrite rewrite(FoldMatch match, FoldContext context) {
        String bucketId = match.getAnchorId();
        FoldRewrite rewrite = new FoldRewrite();
        List<Resource> hosts = new ArrayList<>();
        for (String functionId : match.getHostIds()) {
            Resource function = context.foldedFunction(functionId);
            if (function == null) {
                return FoldRewrite.skip(functionId + " was not folded into a serverless function");
            }
            hosts.add(function.copy());
        }

        Resource bucket = context.resource(bucketId).copy();
        Map<String, Object> notifications = bucket.mapProperty(NOTIFICATIONS);
        List<Object> configurations = Values.listOf(notifications.remove(LAMBDA_CONFIGURATIONS));
        if (notifications.isEmpty()) {
            bucket.getProperties().remove(NOTIFICATIONS);
        }
        for (Object raw : configurations) {
            Map<String, Object> configuration = Values.asMap(raw);
            String functionId = context.functionTarget(configuration.get("Function"));
            Resource host = hosts.get(match.getHostIds().indexOf(functionId));
            SamEvents.add(host, bucketId + "Event", "S3", Values.mapOf(
                    "Bucket", new Ref(bucketId),
                    "Events", Values.deepCopy(configuration.get("Event")),
                    "Filter", Values.deepCopy(configuration.get("Filter"))));
        }

        rewrite.upsert(bucket);
        hosts.forEach(rewrite::upsert);
        for (String consumed : match.getConsumedIds()) {
            if (!consumed.equals(bucketId)) {
                ResourceAttributes.noteDropped(context.resource(consumed), match.group(), rewrite);
                rewrite.remove(consumed);
            }
        }
        return rewrite;
    }
}
