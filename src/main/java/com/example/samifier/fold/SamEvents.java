package com.example.samifier.fold;

import com.example.samifier.model.Resource;
import com.example.samifier.util.Values;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for the {@code Events} block of a serverless function.
 */
public final class SamEvents {
    public static final String EVENTS = "Events";
    public static final String OVERRIDES = "SamEventOverrides";

    private SamEvents() {
    }

    /**
     * Adds an event under the preferred name, or the name with a counter when taken
     *
     * @return the name used
     */
    public static String add(Resource function, String preferredName, String type, Map<String, Object> properties) {
        Map<String, Object> events = Values.asMap(function.getProperties().get(EVENTS));
        if (events == null) {
            events = new LinkedHashMap<>();
            function.getProperties().put(EVENTS, events);
        }
        String name = preferredName;
        int counter = 2;
        while (events.containsKey(name)) {
            name = preferredName + counter++;
        }
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("Type", type);
        event.put("Properties", properties);
        events.put(name, event);
        return name;
    }

    /**
     * Keeps a field the event type cannot express under the function's Metadata
     */
    public static void addOverride(Resource function, String eventName, String field, Object value) {
        Map<String, Object> overrides = Values.asMap(function.getMetadata().get(OVERRIDES));
        if (overrides == null) {
            overrides = new LinkedHashMap<>();
            function.getMetadata().put(OVERRIDES, overrides);
        }
        Map<String, Object> fields = Values.asMap(overrides.get(eventName));
        if (fields == null) {
            fields = new LinkedHashMap<>();
            overrides.put(eventName, fields);
        }
        fields.put(field, value);
    }
}
