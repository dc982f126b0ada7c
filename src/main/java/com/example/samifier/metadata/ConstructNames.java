package com.example.samifier.metadata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns construct paths into readable logical ID candidates.
 *
 * Examples:
 * <pre>
 *   /Orders/OrdersTable/Resource                       -> OrdersTable
 *   /Orders/Handler/ServiceRole/Resource               -> HandlerRole
 *   /Orders/Handler/ServiceRole/DefaultPolicy/Resource -> HandlerPolicy
 *   /Orders/Vpc/PublicSubnet1/RouteTable               -> VpcPublicSubnet1RouteTable
 * </pre>
 */
public final class ConstructNames {
    private static final Pattern HASH_SUFFIX = Pattern.compile("[A-F0-9]{8}$");

    /**
     * Applied in order, first match wins
     */
    private static final Map<Pattern, String> SEMANTIC_RULES = new LinkedHashMap<>();

    static {
        SEMANTIC_RULES.put(Pattern.compile("^(.+)ServiceRoleDefaultPolicy$"), "$1Policy");
        SEMANTIC_RULES.put(Pattern.compile("^(.+)ServiceRole$"), "$1Role");
        SEMANTIC_RULES.put(Pattern.compile("^(.+)DefaultPolicy$"), "$1Policy");
        SEMANTIC_RULES.put(Pattern.compile("^(.+)LogGroup$"), "$1Logs");
        SEMANTIC_RULES.put(Pattern.compile("^CustomResourceProviderframework(.*)$"), "CustomResourceProvider$1");
    }

    private ConstructNames() {
    }

    public static String candidateFor(String constructPath) {
        List<String> parts = new ArrayList<>();
        for (String part : constructPath.split("/")) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        if (parts.isEmpty()) {
            return "Resource";
        }
        if (parts.size() > 1) {
            parts.remove(0);
        }
        if (parts.size() > 1 && "Resource".equals(parts.get(parts.size() - 1))) {
            parts.remove(parts.size() - 1);
        }
        // "Default" is the conventional id of a construct's main child and carries no meaning
        if (parts.size() > 1) {
            parts.removeIf("Default"::equals);
            if (parts.isEmpty()) {
                parts.add("Default");
            }
        }

        String joined;
        if (parts.size() <= 2) {
            joined = String.join("", parts);
        } else {
            // deep nesting: the root construct plus the last two segments
            joined = parts.get(0) + parts.get(parts.size() - 2) + parts.get(parts.size() - 1);
        }
        return applySemanticRules(stripHash(sanitize(joined)));
    }

    /**
     * Alphanumerics only, starting with a letter
     */
    public static String sanitize(String raw) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                out.append(c);
            }
        }
        if (out.length() == 0) {
            return "Resource";
        }
        if (!Character.isLetter(out.charAt(0))) {
            out.insert(0, "Resource");
        }
        return out.toString();
    }

    /**
     * Removes the 8 hex digit suffix the CDK appends to make logical IDs unique
     */
    public static String stripHash(String logicalId) {
        Matcher matcher = HASH_SUFFIX.matcher(logicalId);
        if (matcher.find() && matcher.start() > 0) {
            return logicalId.substring(0, matcher.start());
        }
        return logicalId;
    }

    static String applySemanticRules(String name) {
        for (Map.Entry<Pattern, String> rule : SEMANTIC_RULES.entrySet()) {
            Matcher matcher = rule.getKey().matcher(name);
            if (matcher.matches()) {
                return matcher.replaceFirst(rule.getValue());
            }
        }
        return name;
    }

    /**
     * Last segment of a CloudFormation type, e.g. {@code Table} for {@code AWS::DynamoDB::Table}
     */
    public static String typeSuffix(String resourceType) {
        if (resourceType == null) {
            return "Resource";
        }
        int separator = resourceType.lastIndexOf("::");
        return sanitize(separator < 0 ? resourceType : resourceType.substring(separator + 2));
    }
}
