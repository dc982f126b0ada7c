package com.example.samifier.util;

import com.example.samifier.model.FnCall;
import com.example.samifier.model.GetAtt;
import com.example.samifier.model.Intrinsic;
import com.example.samifier.model.Ref;
import com.example.samifier.model.Sub;
import com.example.samifier.model.SubTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static helpers over the loosely typed value tree of a template
 * (maps, lists, scalars and intrinsic nodes).
 */
public final class Values {

    private Values() {
    }

    @SuppressWarnings("unchecked")
    public static Object deepCopy(Object value) {
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<Object, Object> entry : ((Map<Object, Object>) value).entrySet()) {
                copy.put(entry.getKey(), deepCopy(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        if (value instanceof Intrinsic) {
            return ((Intrinsic) value).copy();
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> copyMap(Map<String, Object> map) {
        return map == null ? new LinkedHashMap<>() : (Map<String, Object>) deepCopy(map);
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    @SuppressWarnings("unchecked")
    public static List<Object> asList(Object value) {
        return value instanceof List ? (List<Object>) value : null;
    }

    public static String asString(Object value) {
        return value instanceof String ? (String) value : null;
    }

    /**
     * CloudFormation accepts a scalar wherever a one-element list is expected
     */
    @SuppressWarnings("unchecked")
    public static List<Object> listOf(Object value) {
        if (value == null) {
            return Collections.emptyList();
        }
        if (value instanceof List) {
            return (List<Object>) value;
        }
        return Collections.singletonList(value);
    }

    public static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).isEmpty();
        }
        if (value instanceof List) {
            return ((List<?>) value).isEmpty();
        }
        return false;
    }

    public static Map<String, Object> mapOf(Object... keysAndValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            if (keysAndValues[i + 1] != null) {
                map.put((String) keysAndValues[i], keysAndValues[i + 1]);
            }
        }
        return map;
    }

    /**
     * Logical IDs referenced anywhere inside the value, in encounter order.
     * Pseudo parameters and local {@code Fn::Sub} variables are excluded.
     */
    public static Set<String> referencedIds(Object value) {
        Set<String> ids = new LinkedHashSet<>();
        collectReferences(value, ids);
        return ids;
    }

    @SuppressWarnings("unchecked")
    private static void collectReferences(Object value, Set<String> ids) {
        if (value instanceof Ref) {
            Ref ref = (Ref) value;
            if (!ref.isPseudo()) {
                ids.add(ref.getTarget());
            }
        } else if (value instanceof GetAtt) {
            ids.add(((GetAtt) value).getLogicalId());
            collectReferences(((GetAtt) value).getAttribute(), ids);
        } else if (value instanceof Sub) {
            Sub sub = (Sub) value;
            for (int index : sub.getTemplate().referenceIndices()) {
                String name = sub.getTemplate().segment(index).getText();
                if (!sub.hasVariable(name)) {
                    ids.add(name);
                }
            }
            if (sub.getVariables() != null) {
                collectReferences(sub.getVariables(), ids);
            }
        } else if (value instanceof FnCall) {
            collectReferences(((FnCall) value).getArgument(), ids);
        } else if (value instanceof Map) {
            for (Object item : ((Map<String, Object>) value).values()) {
                collectReferences(item, ids);
            }
        } else if (value instanceof List) {
            for (Object item : (List<Object>) value) {
                collectReferences(item, ids);
            }
        }
    }

    /**
     * Whether any literal text inside the value (plain strings, {@code Fn::Sub} templates,
     * {@code Fn::Join} parts) contains the fragment
     */
    @SuppressWarnings("unchecked")
    public static boolean containsText(Object value, String fragment) {
        if (value instanceof String) {
            return ((String) value).contains(fragment);
        }
        if (value instanceof Sub) {
            return ((Sub) value).getTemplate().render().contains(fragment);
        }
        if (value instanceof FnCall) {
            return containsText(((FnCall) value).getArgument(), fragment);
        }
        if (value instanceof Map) {
            for (Object item : ((Map<String, Object>) value).values()) {
                if (containsText(item, fragment)) {
                    return true;
                }
            }
        }
        if (value instanceof List) {
            for (Object item : (List<Object>) value) {
                if (containsText(item, fragment)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Logical ID targeted by a bare {@code Ref}, {@code GetAtt} or single-placeholder {@code Fn::Sub}
     */
    public static String directTarget(Object value) {
        if (value instanceof Ref && !((Ref) value).isPseudo()) {
            return ((Ref) value).getTarget();
        }
        if (value instanceof GetAtt) {
            return ((GetAtt) value).getLogicalId();
        }
        if (value instanceof Sub) {
            SubTemplate template = ((Sub) value).getTemplate();
            List<Integer> refs = template.referenceIndices();
            if (refs.size() == 1 && template.getSegments().size() == 1) {
                return template.segment(refs.get(0)).getText();
            }
        }
        return null;
    }
}
