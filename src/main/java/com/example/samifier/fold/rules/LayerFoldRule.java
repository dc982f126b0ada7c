package com.example.samifier.fold.rules;

import com.example.samifier.fold.FoldContext;
import com.example.samifier.fold.FoldMatch;
import com.example.samifier.fold.FoldRewrite;
import com.example.samifier.fold.FoldRule;
import com.example.samifier.fold.SamProperties;
import com.example.samifier.model.Resource;
import com.example.samifier.util.Values;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code AWS::Lambda::LayerVersion} becomes {@code AWS::Serverless::LayerVersion}.
 */
@Component
public class LayerFoldRule implements FoldRule {
    public static final String NAME = "layer";

    static final String LAYER = "AWS::Lambda::LayerVersion";
    private static final Set<String> PASSTHROUGH = Set.of(
            "CompatibleRuntimes", "CompatibleArchitectures", "Description", "LayerName", "LicenseInfo");
    private static final Set<String> CONTENT_KEYS = Set.of("S3Bucket", "S3Key", "S3ObjectVersion");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getDefaultPriority() {
        return 60;
    }

    @Override
    public List<FoldMatch> match(FoldContext context) {
        List<FoldMatch> matches = new ArrayList<>();
        for (Resource layer : context.getDocument().resourcesOfType(LAYER)) {
            Map<String, Object> content = layer.mapProperty("Content");
            List<String> unsupported = SamProperties.unsupported(layer.getProperties(), PASSTHROUGH);
            unsupported.remove("Content");
            if (content == null || !unsupported.isEmpty() || !SamProperties.unsupported(content, CONTENT_KEYS).isEmpty()) {
                context.annotate(NAME, layer.getLogicalId() + " stays raw: unsupported settings");
                continue;
            }
            matches.add(FoldMatch.builder().rule(NAME).anchorId(layer.getLogicalId()).consumed(layer.getLogicalId()).build());
        }
        return matches;
    }

    @Override
    public FoldRewrite rewrite(FoldMatch match, FoldContext context) {
        Resource layer = context.resource(match.getAnchorId());
        Resource folded = layer.copy();
        folded.setType("AWS::Serverless::LayerVersion");
        Map<String, Object> content = layer.mapProperty("Content");
        Map<String, Object> properties = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : layer.getProperties().entrySet()) {
            if ("Content".equals(entry.getKey())) {
                properties.put("ContentUri", Values.mapOf(
                        "Bucket", Values.deepCopy(content.get("S3Bucket")),
                        "Key", Values.deepCopy(content.get("S3Key")),
                        "Version", Values.deepCopy(content.get("S3ObjectVersion"))));
            } else {
                properties.put(entry.getKey(), Values.deepCopy(entry.getValue()));
            }
        }
        // SAM derives DeletionPolicy from RetentionPolicy
        Object deletionPolicy = folded.getAttributes().remove("DeletionPolicy");
        properties.put("RetentionPolicy", "Retain".equals(deletionPolicy) ? "Retain" : "Delete");
        folded.setProperties(properties);
        return new FoldRewrite().upsert(folded);
    }
}
