package com.example.samifier.config;

import com.example.samifier.asset.AssetPolicy;
import com.example.samifier.model.OutputFormat;
import com.example.samifier.model.RefactorTarget;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Defaults for refactoring runs. Request and command line options override them per run.
 *
 * Example application.yml:
 *
 * samifier:
 *   target: sam
 *   asset-policy: prefer-inline
 *   assets-directory: src
 *   template-file-name: template.yaml
 *   plan-file-name: refactor-plan.json
 *   output-format: yaml
 *   allow-lint-errors: false
 *   use-template-path-metadata: true
 *   clean:
 *     strip-path-metadata: false
 *   fold:
 *     hoist-globals: true
 *     priorities:
 *       event-source-mapping: 25
 *     disabled:
 *       - simple-table
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "samifier")
public class SamifierProperties {

    /**
     * Output flavour when the caller does not choose one
     */
    private RefactorTarget target = RefactorTarget.SAM;

    /**
     * Code placement when the caller does not choose one
     */
    private AssetPolicy assetPolicy = AssetPolicy.PREFER_INLINE;

    /**
     * Directory, relative to the output template, that receives staged code
     */
    private String assetsDirectory = "src";

    private String templateFileName = "template.yaml";

    private String planFileName = "refactor-plan.json";

    private OutputFormat outputFormat = OutputFormat.YAML;

    /**
     * Write output even when the lint validator reports errors
     */
    private boolean allowLintErrors = false;

    /**
     * Harvest construct paths from aws:cdk:path resource metadata when no cdk.out is given
     */
    private boolean useTemplatePathMetadata = true;

    private Clean clean = new Clean();

    private Fold fold = new Fold();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Clean {
        /**
         * Drop aws:cdk:path metadata once names have been resolved
         */
        private boolean stripPathMetadata = false;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Fold {
        /**
         * Priority overrides by rule name, lower runs first
         */
        private Map<String, Integer> priorities = new LinkedHashMap<>();

        /**
         * Rule names that never run
         */
        private List<String> disabled = new ArrayList<>();

        /**
         * Move settings shared by every function into Globals.Function
         */
        private boolean hoistGlobals = true;
    }
}
