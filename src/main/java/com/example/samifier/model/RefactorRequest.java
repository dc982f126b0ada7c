package com.example.samifier.model;

import com.example.samifier.asset.AssetPolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * Input of one refactoring run. Exactly one template source is used, in this order:
 * {@link #templateText}, {@link #templatePath}, {@link #cdkOut}, {@link #stackName}.
 * Null options fall back to {@code samifier.*} configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefactorRequest {
    private String templateText;

    private Path templatePath;

    /**
     * Stack artifact inside {@link #cdkOut}, or the deployed stack to fetch when no other source is given
     */
    private String stackName;

    /**
     * Synthesized cloud assembly; supplies the template, construct metadata and local assets
     */
    private Path cdkOut;

    private Path manifest;

    private Path tree;

    private RefactorTarget target;

    private AssetPolicy assetPolicy;

    private OutputFormat outputFormat;

    private Boolean allowLintErrors;

    /**
     * Where to write the template, the plan and staged assets; null for an in-memory run
     */
    private Path outputDir;

    /**
     * Plan file name inside {@link #outputDir}
     */
    private String planFile;
}
