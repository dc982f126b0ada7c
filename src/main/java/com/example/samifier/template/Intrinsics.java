package com.example.samifier.template;

import com.example.samifier.exception.TemplateParseException;
import com.example.samifier.model.ConditionRef;
import com.example.samifier.model.FnCall;
import com.example.samifier.model.GetAtt;
import com.example.samifier.model.Ref;
import com.example.samifier.model.Sub;
import com.example.samifier.model.SubTemplate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds typed intrinsic nodes from the JSON long form ({@code {"Ref": "X"}}) and the
 * YAML short form ({@code !Ref X}).
 */
public final class Intrinsics {

    /**
     * Short-form tags understood by the YAML loader, without the leading {@code !}
     */
    public static final List<String> SHORT_FORMS = Collections.unmodifiableList(Arrays.asList(
            "Ref", "Condition", "GetAtt", "Sub", "Join", "If", "Equals", "Not", "And", "Or",
            "Select", "Split", "FindInMap", "Base64", "Cidr", "GetAZs", "ImportValue",
            "Transform", "ToJsonString", "Length"));

    private Intrinsics() {
    }

    /**
     * Recursively replaces long-form intrinsic mappings with typed nodes
     */
    public static Object decode(Object raw) {
        if (raw instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) raw;
            if (map.size() == 1) {
                Map.Entry<?, ?> entry = map.entrySet().iterator().next();
                String key = String.valueOf(entry.getKey());
                boolean conditionMap = ConditionRef.FUNCTION.equals(key) && !(entry.getValue() instanceof String);
                if (isIntrinsicKey(key) && !conditionMap) {
                    return build(key, decode(entry.getValue()));
                }
            }
            Map<String, Object> decoded = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                decoded.put(String.valueOf(entry.getKey()), decode(entry.getValue()));
            }
            return decoded;
        }
        if (raw instanceof List) {
            List<Object> decoded = new ArrayList<>();
            for (Object item : (List<?>) raw) {
                decoded.add(decode(item));
            }
            return decoded;
        }
        return raw;
    }

    /**
     * Node for a YAML short-form tag; the tagged value has already been constructed
     */
    public static Object fromShortForm(String shortName, Object value) {
        String name = Ref.FUNCTION.equals(shortName) || ConditionRef.FUNCTION.equals(shortName)
                ? shortName : "Fn::" + shortName;
        if (ConditionRef.FUNCTION.equals(name) && !(value instanceof String)) {
            throw new TemplateParseException("!Condition expects a condition name, got: " + value);
        }
        return build(name, decode(value));
    }

    public static boolean isIntrinsicKey(String key) {
        return Ref.FUNCTION.equals(key) || ConditionRef.FUNCTION.equals(key) || key.startsWith("Fn::");
    }

    @SuppressWarnings("unchecked")
    private static Object build(String name, Object argument) {
        switch (name) {
            case Ref.FUNCTION:
                if (!(argument instanceof String)) {
                    throw new TemplateParseException("Ref expects a logical ID string, got: " + argument);
                }
                return new Ref((String) argument);
            case ConditionRef.FUNCTION:
                return new ConditionRef((String) argument);
            case GetAtt.FUNCTION:
                return buildGetAtt(argument);
            case Sub.FUNCTION:
                if (argument instanceof String) {
                    return new Sub((String) argument);
                }
                if (argument instanceof List) {
                    List<Object> parts = (List<Object>) argument;
                    if (!parts.isEmpty() && parts.size() <= 2 && parts.get(0) instanceof String
                            && (parts.size() == 1 || parts.get(1) instanceof Map)) {
                        Map<String, Object> variables = parts.size() == 2
                                ? new LinkedHashMap<>((Map<String, Object>) parts.get(1)) : null;
                        return new Sub(SubTemplate.parse((String) parts.get(0)), variables);
                    }
                }
                throw new TemplateParseException("Fn::Sub expects a string or [string, map], got: " + argument);
            default:
                return new FnCall(name, argument);
        }
    }

    private static GetAtt buildGetAtt(Object argument) {
        if (argument instanceof String) {
            String text = (String) argument;
            int dot = text.indexOf('.');
            if (dot <= 0 || dot == text.length() - 1) {
                throw new TemplateParseException("Fn::GetAtt expects 'LogicalId.Attribute', got: " + text);
            }
            return new GetAtt(text.substring(0, dot), text.substring(dot + 1));
        }
        if (argument instanceof List) {
            List<?> parts = (List<?>) argument;
            if (parts.size() == 2 && parts.get(0) instanceof String) {
                return new GetAtt((String) parts.get(0), parts.get(1));
            }
        }
        throw new TemplateParseException("Fn::GetAtt expects [LogicalId, Attribute], got: " + argument);
    }
}
