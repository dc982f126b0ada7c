package com.example.samifier.template;

import com.example.samifier.exception.TemplateParseException;
import com.example.samifier.exception.TemplateSourceException;
import com.example.samifier.model.Resource;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.util.Values;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses CloudFormation, CDK synthesized and SAM templates (JSON or YAML) into a {@link TemplateDocument}.
 *
 * Intrinsic functions are preserved as typed nodes in both their long and short forms.
 */
@Slf4j
@Component
public class TemplateParser {
    private static final int MAX_CODE_POINTS = 64 * 1024 * 1024;

    private final ObjectMapper jsonMapper;

    public TemplateParser() {
        this.jsonMapper = new ObjectMapper();
        this.jsonMapper.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    public TemplateDocument parse(Path path) {
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException e) {
            throw new TemplateSourceException("Cannot read template " + path + ": " + e.getMessage(), e);
        }
        log.debug("Read {} characters from {}", text.length(), path);
        return parse(text);
    }

    public TemplateDocument parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new TemplateParseException("Template text is empty");
        }
        Object raw = looksLikeJson(text) ? readJson(text) : readYaml(text);
        return toDocument(Intrinsics.decode(raw));
    }

    private static boolean looksLikeJson(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                return c == '{';
            }
        }
        return false;
    }

    private Object readJson(String text) {
        try {
            return jsonMapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            throw new TemplateParseException("Invalid JSON template: " + e.getOriginalMessage(), e);
        }
    }

    private Object readYaml(String text) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        options.setCodePointLimit(MAX_CODE_POINTS);
        DumperOptions dumperOptions = new DumperOptions();
        Yaml yaml = new Yaml(new CfnYamlConstructor(options), new Representer(dumperOptions), dumperOptions, options);
        try {
            return yaml.load(text);
        } catch (YAMLException e) {
            throw new TemplateParseException("Invalid YAML template: " + e.getMessage(), e);
        }
    }

    private TemplateDocument toDocument(Object decoded) {
        Map<String, Object> root = Values.asMap(decoded);
        if (root == null) {
            throw new TemplateParseException("Template root must be a mapping");
        }
        Map<String, Object> resources = Values.asMap(root.get(TemplateDocument.RESOURCES));
        if (resources == null) {
            throw new TemplateParseException("Template has no Resources mapping");
        }

        TemplateDocument document = new TemplateDocument();
        for (Map.Entry<String, Object> entry : root.entrySet()) {
            if (!TemplateDocument.RESOURCES.equals(entry.getKey())) {
                document.setSection(entry.getKey(), entry.getValue());
            }
        }
        for (Map.Entry<String, Object> entry : resources.entrySet()) {
            document.putResource(toResource(entry.getKey(), entry.getValue()));
        }
        return document;
    }

    private Resource toResource(String logicalId, Object value) {
        Map<String, Object> body = Values.asMap(value);
        if (body == null) {
            throw new TemplateParseException("Resource " + logicalId + " must be a mapping");
        }
        Object type = body.get(Resource.TYPE);
        if (!(type instanceof String)) {
            throw new TemplateParseException("Resource " + logicalId + " has no Type");
        }

        Resource resource = new Resource();
        resource.setLogicalId(logicalId);
        resource.setType((String) type);
        for (Map.Entry<String, Object> entry : body.entrySet()) {
            String key = entry.getKey();
            Object item = entry.getValue();
            switch (key) {
                case Resource.TYPE:
                    break;
                case Resource.PROPERTIES:
                    resource.setProperties(requireMap(logicalId, key, item));
                    break;
                case Resource.METADATA:
                    resource.setMetadata(requireMap(logicalId, key, item));
                    break;
                case Resource.DEPENDS_ON:
                    resource.setDependsOn(toDependsOn(logicalId, item));
                    break;
                case Resource.CONDITION:
                    if (!(item instanceof String)) {
                        throw new TemplateParseException("Resource " + logicalId + " has a non-string Condition");
                    }
                    resource.setCondition((String) item);
                    break;
                default:
                    resource.getAttributes().put(key, item);
            }
        }
        return resource;
    }

    private static Map<String, Object> requireMap(String logicalId, String key, Object value) {
        if (value == null) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> map = Values.asMap(value);
        if (map == null) {
            throw new TemplateParseException("Resource " + logicalId + " has a non-mapping " + key);
        }
        return map;
    }

    private static List<String> toDependsOn(String logicalId, Object value) {
        List<String> dependsOn = new ArrayList<>();
        for (Object item : Values.listOf(value)) {
            if (!(item instanceof String)) {
                throw new TemplateParseException("Resource " + logicalId + " has a non-string DependsOn entry: " + item);
            }
            if (!dependsOn.contains(item)) {
                dependsOn.add((String) item);
            }
        }
        return dependsOn;
    }
}
