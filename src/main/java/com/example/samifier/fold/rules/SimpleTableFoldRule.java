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
 * A DynamoDB table keyed by a single hash attribute, without indexes, streams or other features,
 * becomes {@code AWS::Serverless::SimpleTable}.
 */
@Component
public class SimpleTableFoldRule implements FoldRule {
    public static final String NAME = "simple-table";

    static final String TABLE = "AWS::DynamoDB::Table";
    private static final Set<String> TABLE_KEYS = Set.of(
            "KeySchema", "AttributeDefinitions", "ProvisionedThroughput", "BillingMode", "TableName",
            "SSESpecification", "Tags");
    private static final Map<String, String> KEY_TYPES = Map.of("S", "String", "N", "Number", "B", "Binary");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getDefaultPriority() {
        return 70;
    }

    @Override
    public List<FoldMatch> match(FoldContext context) {
        List<FoldMatch> matches = new ArrayList<>();
        for (Resource table : context.getDocument().resourcesOfType(TABLE)) {
            if (primaryKey(table) == null
                    || !SamProperties.unsupported(table.getProperties(), TABLE_KEYS).isEmpty()
                    || (table.property("Tags") != null && SamProperties.tagsToMap(table.property("Tags")) == null)
                    || !billingModeMatches(table)) {
                continue;
            }
            matches.add(FoldMatch.builder().rule(NAME).anchorId(table.getLogicalId()).consumed(table.getLogicalId()).build());
        }
        return matches;
    }

    @Override
    public FoldRewrite rewrite(FoldMatch match, FoldContext context) {
        Resource table = context.resource(match.getAnchorId());
        Resource folded = table.copy();
        folded.setType("AWS::Serverless::SimpleTable");
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("PrimaryKey", primaryKey(table));
        for (Map.Entry<String, Object> entry : table.getProperties().entrySet()) {
            switch (entry.getKey()) {
                case "ProvisionedThroughput":
                case "TableName":
                case "SSESpecification":
                    properties.put(entry.getKey(), Values.deepCopy(entry.getValue()));
                    break;
                case "Tags":
                    properties.put("Tags", SamProperties.tagsToMap(entry.getValue()));
                    break;
                default:
                    break;
            }
        }
        folded.setProperties(properties);
        return new FoldRewrite().upsert(folded);
    }

    /**
     * {@code {Name, Type}} of a single HASH key, null for any other key shape
     */
    static Map<String, Object> primaryKey(Resource table) {
        List<Object> keySchema = Values.asList(table.property("KeySchema"));
        List<Object> attributes = Values.asList(table.property("AttributeDefinitions"));
        if (keySchema == null || attributes == null || keySchema.size() != 1 || attributes.size() != 1) {
            return null;
        }
        Map<String, Object> key = Values.asMap(keySchema.get(0));
        Map<String, Object> attribute = Values.asMap(attributes.get(0));
        if (key == null || attribute == null || !"HASH".equals(key.get("KeyType"))
                || !(key.get("AttributeName") instanceof String)
                || !key.get("AttributeName").equals(attribute.get("AttributeName"))) {
            return null;
        }
        String type = KEY_TYPES.get(Values.asString(attribute.get("AttributeType")));
        return type == null ? null : Values.mapOf("Name", key.get("AttributeName"), "Type", type);
    }

    private static boolean billingModeMatches(Resource table) {
        Object billingMode = table.property("BillingMode");
        if ("PAY_PER_REQUEST".equals(billingMode)) {
            return table.property("ProvisionedThroughput") == null;
        }
        return billingMode == null || "PROVISIONED".equals(billingMode);
    }
}
