package com.example.samifier.model;

import com.example.samifier.util.Values;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory template graph: the ordered top-level sections plus the typed Resources section.
 *
 * One instance is owned by exactly one refactoring run. Every pass mutates it in place.
 */
public class TemplateDocument {
    public static final String FORMAT_VERSION = "AWSTemplateFormatVersion";
    public static final String DESCRIPTION = "Description";
    public static final String TRANSFORM = "Transform";
    public static final String METADATA = "Metadata";
    public static final String PARAMETERS = "Parameters";
    public static final String MAPPINGS = "Mappings";
    public static final String CONDITIONS = "Conditions";
    public static final String RULES = "Rules";
    public static final String GLOBALS = "Globals";
    public static final String RESOURCES = "Resources";
    public static final String OUTPUTS = "Outputs";

    /**
     * Canonical section order used when serializing
     */
    public static final List<String> SECTION_ORDER = Collections.unmodifiableList(Arrays.asList(
            FORMAT_VERSION, DESCRIPTION, TRANSFORM, METADATA, PARAMETERS, MAPPINGS,
            CONDITIONS, RULES, GLOBALS, RESOURCES, OUTPUTS));

    private final Map<String, Object> sections = new LinkedHashMap<>();
    private Map<String, Resource> resources = new LinkedHashMap<>();

    // ---- sections ----

    /**
     * All non-Resources sections in the order they were loaded
     */
    public Map<String, Object> getSections() {
        return sections;
    }

    public Object getSection(String name) {
        return sections.get(name);
    }

    public void setSection(String name, Object value) {
        sections.put(name, value);
    }

    public Object removeSection(String name) {
        return sections.remove(name);
    }

    /**
     * Mapping section, or an empty read-only map when the section is absent or not a mapping
     */
    public Map<String, Object> sectionMap(String name) {
        Map<String, Object> map = Values.asMap(sections.get(name));
        return map != null ? map : Collections.emptyMap();
    }

    /**
     * Mapping section, created when absent
     */
    public Map<String, Object> mutableSection(String name) {
        Map<String, Object> map = Values.asMap(sections.get(name));
        if (map == null) {
            map = new LinkedHashMap<>();
            sections.put(name, map);
        }
        return map;
    }

    public Map<String, Object> getParameters() {
        return sectionMap(PARAMETERS);
    }

    public Map<String, Object> getConditions() {
        return sectionMap(CONDITIONS);
    }

    public Map<String, Object> getOutputs() {
        return sectionMap(OUTPUTS);
    }

    public boolean hasCondition(String name) {
        return getConditions().containsKey(name);
    }

    /**
     * Drops mapping sections that ended up empty after a pass
     */
    public void pruneEmptySections(String... names) {
        for (String name : names) {
            Object value = sections.get(name);
            if (value instanceof Map && ((Map<?, ?>) value).isEmpty()) {
                sections.remove(name);
            }
        }
    }

    // ---- resources ----

    public Map<String, Resource> getResources() {
        return Collections.unmodifiableMap(resources);
    }

    public Resource getResource(String logicalId) {
        return resources.get(logicalId);
    }

    public boolean hasResource(String logicalId) {
        return resources.containsKey(logicalId);
    }

    /**
     * Adds a resource, replacing an existing one with the same logical ID in place
     */
    public void putResource(Resource resource) {
        resources.put(resource.getLogicalId(), resource);
    }

    public Resource removeResource(String logicalId) {
        return resources.remove(logicalId);
    }

    public List<Resource> resourcesOfType(String type) {
        List<Resource> matching = new ArrayList<>();
        for (Resource resource : resources.values()) {
            if (resource.isType(type)) {
                matching.add(resource);
            }
        }
        return matching;
    }

    /**
     * Resource and parameter names, which share the Ref namespace
     */
    public Set<String> getLogicalIds() {
        Set<String> ids = new LinkedHashSet<>(resources.keySet());
        ids.addAll(getParameters().keySet());
        return ids;
    }

    /**
     * Re-keys resources, keeping their order
     */
    public void renameResources(Map<String, String> mapping) {
        Map<String, Resource> renamed = new LinkedHashMap<>();
        for (Map.Entry<String, Resource> entry : resources.entrySet()) {
            String newId = mapping.getOrDefault(entry.getKey(), entry.getKey());
            Resource resource = entry.getValue();
            resource.setLogicalId(newId);
            renamed.put(newId, resource);
        }
        resources = renamed;
    }

    /**
     * Re-keys conditions, keeping their order
     */
    public void renameConditions(Map<String, String> mapping) {
        Map<String, Object> conditions = Values.asMap(sections.get(CONDITIONS));
        if (conditions == null || mapping.isEmpty()) {
            return;
        }
        Map<String, Object> renamed = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : conditions.entrySet()) {
            renamed.put(mapping.getOrDefault(entry.getKey(), entry.getKey()), entry.getValue());
        }
        sections.put(CONDITIONS, renamed);
    }

    // ---- navigation ----

    public Object valueAt(NodePath path) {
        Object current = this;
        for (Object segment : path.getSegments()) {
            current = step(current, segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Replaces the value at the path inside its parent container
     */
    @SuppressWarnings("unchecked")
    public void replaceAt(NodePath path, Object value) {
        Object parent = valueAt(path.parent());
        Object key = path.last();
        if (parent instanceof TemplateDocument) {
            setSection((String) key, value);
        } else if (parent instanceof Resource) {
            Resource resource = (Resource) parent;
            if (Resource.CONDITION.equals(key)) {
                resource.setCondition((String) value);
            } else if (Resource.TYPE.equals(key)) {
                resource.setType((String) value);
            } else {
                resource.getAttributes().put((String) key, value);
            }
        } else if (parent instanceof List) {
            ((List<Object>) parent).set((Integer) key, value);
        } else if (parent instanceof Map) {
            ((Map<String, Object>) parent).put((String) key, value);
        } else if (parent instanceof FnCall && NodePath.ARGS.equals(key)) {
            ((FnCall) parent).setArgument(value);
        } else if (parent instanceof GetAtt && NodePath.ATTR.equals(key)) {
            ((GetAtt) parent).setAttribute(value);
        } else {
            throw new IllegalArgumentException("Cannot replace value at " + path);
        }
    }

    private Object step(Object current, Object segment) {
        if (current instanceof TemplateDocument) {
            return RESOURCES.equals(segment) ? resources : sections.get(segment);
        }
        if (current instanceof Resource && segment instanceof String) {
            Resource resource = (Resource) current;
            switch ((String) segment) {
                case Resource.PROPERTIES:
                    return resource.getProperties();
                case Resource.METADATA:
                    return resource.getMetadata();
                case Resource.DEPENDS_ON:
                    return resource.getDependsOn();
                case Resource.CONDITION:
                    return resource.getCondition();
                case Resource.TYPE:
                    return resource.getType();
                default:
                    return resource.getAttributes().get(segment);
            }
        }
        if (current instanceof Map) {
            return ((Map<?, ?>) current).get(segment);
        }
        if (current instanceof List && segment instanceof Integer) {
            List<?> list = (List<?>) current;
            int index = (Integer) segment;
            return index < list.size() ? list.get(index) : null;
        }
        if (current instanceof FnCall && NodePath.ARGS.equals(segment)) {
            return ((FnCall) current).getArgument();
        }
        if (current instanceof Sub && NodePath.VARS.equals(segment)) {
            return ((Sub) current).getVariables();
        }
        if (current instanceof GetAtt && NodePath.ATTR.equals(segment)) {
            return ((GetAtt) current).getAttribute();
        }
        return null;
    }
}
