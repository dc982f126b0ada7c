package com.example.samifier.plan;

import com.example.samifier.asset.AssetRecord;
import com.example.samifier.model.RefactorTarget;
import com.example.samifier.rename.RenameEntry;
import com.example.samifier.rename.RenamePlan;
import com.example.samifier.rename.RenameStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Audit trail of one run: every rename, fold, asset decision and lint finding, in the order they happened.
 */
@Data
@NoArgsConstructor
public class RefactorPlan {

    private RefactorTarget target;

    /**
     * Input description, e.g. a file path or {@code stack:Orders}
     */
    private String source;

    private RenameStatus renameStatus = RenameStatus.SKIPPED;

    private List<RenameEntry> renames = new ArrayList<>();

    private List<FoldEntry> folds = new ArrayList<>();

    private List<AssetRecord> assets = new ArrayList<>();

    private List<LintFinding> lint = new ArrayList<>();

    private List<PlanMessage> messages = new ArrayList<>();

    public void info(String text) {
        messages.add(new PlanMessage(PlanMessage.Level.INFO, text));
    }

    public void warn(String text) {
        messages.add(new PlanMessage(PlanMessage.Level.WARN, text));
    }

    public void recordRenames(RenamePlan renamePlan) {
        renameStatus = renamePlan.getStatus();
        renames.addAll(renamePlan.getEntries());
    }

    public boolean hasLintErrors() {
        for (LintFinding finding : lint) {
            if (finding.isError()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Counts per section, serialized alongside the details
     */
    public Map<String, Object> getSummary() {
        int lossNotes = 0;
        int reviewFlags = 0;
        for (FoldEntry fold : folds) {
            lossNotes += fold.getLossNotes().size();
            reviewFlags += fold.getReviewFlags().size();
        }
        long staged = assets.stream().filter(a -> a.getPlacement() == AssetRecord.Placement.STAGED).count();

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("renameStatus", renameStatus);
        summary.put("renamed", renames.size());
        summary.put("folds", folds.size());
        summary.put("lossNotes", lossNotes);
        summary.put("reviewFlags", reviewFlags);
        summary.put("stagedAssets", staged);
        summary.put("lintFindings", lint.size());
        return summary;
    }

    /**
     * Convenience for callers that only need the old to new mapping
     */
    public Map<String, String> renameMapping() {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (RenameEntry entry : renames) {
            mapping.put(entry.getOldId(), entry.getNewId());
        }
        return mapping;
    }
}
