package com.example.samifier.plan;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.springframework.stereotype.Component;

/**
 * Serializes a {@link RefactorPlan}. JSON by default, YAML when the plan file asks for it.
 */
@Component
public class PlanRenderer {
    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public PlanRenderer() {
        this.jsonMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
        this.yamlMapper = new ObjectMapper(new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER))
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String render(RefactorPlan plan, String fileName) {
        return isYaml(fileName) ? toYaml(plan) : toJson(plan);
    }

    public String toJson(RefactorPlan plan) {
        try {
            return jsonMapper.writeValueAsString(plan) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize refactor plan", e);
        }
    }

    public String toYaml(RefactorPlan plan) {
        try {
            return yamlMapper.writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize refactor plan", e);
        }
    }

    private static boolean isYaml(String fileName) {
        return fileName != null && (fileName.endsWith(".yaml") || fileName.endsWith(".yml"));
    }
}
