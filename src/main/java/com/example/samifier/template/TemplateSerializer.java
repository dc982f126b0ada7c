package com.example.samifier.template;

import com.example.samifier.exception.SamifierException;
import com.example.samifier.model.ConditionRef;
import com.example.samifier.model.FnCall;
import com.example.samifier.model.GetAtt;
import com.example.samifier.model.OutputFormat;
import com.example.samifier.model.Ref;
import com.example.samifier.model.Resource;
import com.example.samifier.model.Sub;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.util.Values;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link TemplateDocument} back to text.
 *
 * Output is deterministic: sections follow {@link TemplateDocument#SECTION_ORDER}, resource keys
 * follow Type, Condition, DependsOn, Metadata, Properties and then the remaining attributes.
 */
@Component
public class TemplateSerializer {
    private final ObjectMapper jsonMapper = new ObjectMapper();

    public String serialize(TemplateDocument document, OutputFormat format) {
        return format == OutputFormat.JSON ? toJson(document) : toYaml(document);
    }

    public String toYaml(TemplateDocument document) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        options.setIndicatorIndent(2);
        options.setIndentWithIndicator(true);
        options.setSplitLines(false);
        Yaml yaml = new Yaml(new CfnYamlRepresenter(options), options);
        return yaml.dump(toTree(document, false));
    }

    public String toJson(TemplateDocument document) {
        try {
            return jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(document, true)) + "\n";
        } catch (JsonProcessingException e) {
            throw new SamifierException("SERIALIZATION_FAILED", "Cannot write template as JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Ordered plain tree of the document. Every container is a fresh copy so the YAML writer never emits anchors.
     */
    public Map<String, Object> toTree(TemplateDocument document, boolean longForm) {
        Map<String, Object> tree = new LinkedHashMap<>();
        for (String section : TemplateDocument.SECTION_ORDER) {
            if (TemplateDocument.RESOURCES.equals(section)) {
                tree.put(section, resourcesTree(document, longForm));
            } else if (document.getSections().containsKey(section)) {
                tree.put(section, convert(document.getSection(section), longForm));
            }
        }
        for (Map.Entry<String, Object> entry : document.getSections().entrySet()) {
            if (!tree.containsKey(entry.getKey())) {
                tree.put(entry.getKey(), convert(entry.getValue(), longForm));
            }
        }
        return tree;
    }

    private Map<String, Object> resourcesTree(TemplateDocument document, boolean longForm) {
        Map<String, Object> resources = new LinkedHashMap<>();
        for (Resource resource : document.getResources().values()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put(Resource.TYPE, resource.getType());
            if (resource.getCondition() != null) {
                body.put(Resource.CONDITION, resource.getCondition());
            }
            List<String> dependsOn = resource.getDependsOn();
            if (dependsOn.size() == 1) {
                body.put(Resource.DEPENDS_ON, dependsOn.get(0));
            } else if (dependsOn.size() > 1) {
                body.put(Resource.DEPENDS_ON, new ArrayList<>(dependsOn));
            }
            if (!resource.getMetadata().isEmpty()) {
                body.put(Resource.METADATA, convert(resource.getMetadata(), longForm));
            }
            if (!resource.getProperties().isEmpty()) {
                body.put(Resource.PROPERTIES, convert(resource.getProperties(), longForm));
            }
            for (Map.Entry<String, Object> attribute : resource.getAttributes().entrySet()) {
                body.put(attribute.getKey(), convert(attribute.getValue(), longForm));
            }
            resources.put(resource.getLogicalId(), body);
        }
        return resources;
    }

    @SuppressWarnings("unchecked")
    private Object convert(Object value, boolean longForm) {
        if (!longForm) {
            return Values.deepCopy(value);
        }
        if (value instanceof Map) {
            Map<String, Object> converted = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
                converted.put(entry.getKey(), convert(entry.getValue(), true));
            }
            return converted;
        }
        if (value instanceof List) {
            List<Object> converted = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                converted.add(convert(item, true));
            }
            return converted;
        }
        if (value instanceof Ref) {
            return Collections.singletonMap(Ref.FUNCTION, ((Ref) value).getTarget());
        }
        if (value instanceof ConditionRef) {
            return Collections.singletonMap(ConditionRef.FUNCTION, ((ConditionRef) value).getName());
        }
        if (value instanceof GetAtt) {
            GetAtt getAtt = (GetAtt) value;
            return Collections.singletonMap(GetAtt.FUNCTION,
                    Arrays.asList(getAtt.getLogicalId(), convert(getAtt.getAttribute(), true)));
        }
        if (value instanceof Sub) {
            Sub sub = (Sub) value;
            String text = sub.getTemplate().render();
            Object argument = sub.getVariables() == null ? text : Arrays.asList(text, convert(sub.getVariables(), true));
            return Collections.singletonMap(Sub.FUNCTION, argument);
        }
        if (value instanceof FnCall) {
            FnCall call = (FnCall) value;
            return Collections.singletonMap(call.getFunctionName(), convert(call.getArgument(), true));
        }
        return value;
    }
}
