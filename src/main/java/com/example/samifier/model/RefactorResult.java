package com.example.samifier.model;

import com.example.samifier.asset.StagedAsset;
import com.example.samifier.plan.RefactorPlan;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefactorResult {

    public enum Outcome {
        /** Template, plan and assets were written to the output directory */
        WRITTEN,
        /** Nothing was written; the caller gets the template text */
        PREVIEW
    }

    private String template;

    private RefactorPlan plan;

    @Builder.Default
    private List<StagedAsset> stagedAssets = new ArrayList<>();

    private Outcome outcome;

    /**
     * Path of the written template, null for a preview
     */
    private Path templateFile;
}
