package com.example.samifier.model;

import com.example.samifier.asset.AssetPolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the REST preview endpoint
 *
 * POST /api/templates/refactor
 * {
 *   "template": "{\"Resources\": {...}}",
 *   "target": "SAM",
 *   "outputFormat": "YAML"
 * }
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateRefactorRequest {
    /**
     * Template text, JSON or YAML
     */
    private String template;

    private RefactorTarget target;

    private AssetPolicy assetPolicy;

    private OutputFormat outputFormat;

    private Boolean allowLintErrors;
}
