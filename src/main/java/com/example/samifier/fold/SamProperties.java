package com.example.samifier.fold;

import com.example.samifier.util.Values;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Property conversions shared by the fold rules.
 */
public final class SamProperties {

    private SamProperties() {
    }

    /**
     * CloudFormation {@code [{Key, Value}]} tags as the map SAM expects, null when a key is not a plain string
     */
    public static Map<String, Object> tagsToMap(Object tags) {
        List<Object> list = Values.asList(tags);
        if (list == null) {
            return null;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (Object item : list) {
            Map<String, Object> tag = Values.asMap(item);
            if (tag == null || !(tag.get("Key") instanceof String) || !tag.containsKey("Value") || tag.size() != 2) {
                return null;
            }
            map.put((String) tag.get("Key"), Values.deepCopy(tag.get("Value")));
        }
        return map;
    }

    /**
     * Copies the listed keys that are present, keeping the source order
     */
    public static void copy(Map<String, Object> from, Map<String, Object> to, Collection<String> keys) {
        for (Map.Entry<String, Object> entry : from.entrySet()) {
            if (keys.contains(entry.getKey())) {
                to.put(entry.getKey(), Values.deepCopy(entry.getValue()));
            }
        }
    }

    /**
     * Keys of the map that are not in the allowed set, in map order
     */
    public static List<String> unsupported(Map<String, Object> map, Collection<String> allowed) {
        List<String> keys = new ArrayList<>();
        if (map != null) {
            for (String key : map.keySet()) {
                if (!allowed.contains(key)) {
                    keys.add(key);
                }
            }
        }
        return keys;
    }
}
