package com.example.samifier.model;

import com.example.samifier.util.Values;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One entry of the Resources section.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Resource {
    public static final String PROPERTIES = "Properties";
    public static final String METADATA = "Metadata";
    public static final String DEPENDS_ON = "DependsOn";
    public static final String CONDITION = "Condition";
    public static final String TYPE = "Type";

    private String logicalId;

    private String type;

    @Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();

    /**
     * Ordered, duplicate free list of logical IDs
     */
    @Builder.Default
    private List<String> dependsOn = new ArrayList<>();

    private String condition;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /**
     * Other resource-level keys (DeletionPolicy, UpdateReplacePolicy, CreationPolicy, UpdatePolicy, ...)
     */
    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    public boolean isType(String candidate) {
        return candidate.equals(type);
    }

    public Object property(String name) {
        return properties.get(name);
    }

    public String stringProperty(String name) {
        return Values.asString(properties.get(name));
    }

    public Map<String, Object> mapProperty(String name) {
        return Values.asMap(properties.get(name));
    }

    public void addDependency(String logicalId) {
        if (!dependsOn.contains(logicalId)) {
            dependsOn.add(logicalId);
        }
    }

    public Resource copy() {
        return Resource.builder()
                .logicalId(logicalId)
                .type(type)
                .properties(Values.copyMap(properties))
                .dependsOn(new ArrayList<>(dependsOn))
                .condition(condition)
                .metadata(Values.copyMap(metadata))
                .attributes(Values.copyMap(attributes))
                .build();
    }
}
