package com.example.samifier.fold;

import com.example.samifier.model.Resource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Changes a fold wants to make. Applied by {@link PatternLibrary} in this order:
 * upserts, removals, DependsOn pruning, repoints, literal replacements.
 */
public class FoldRewrite {
    private final Map<String, Resource> upserts = new LinkedHashMap<>();
    private final Set<String> removals = new LinkedHashSet<>();
    private final Map<String, String> repoints = new LinkedHashMap<>();
    private final Map<String, String> literalReplacements = new LinkedHashMap<>();
    private final Set<String> generatedIds = new LinkedHashSet<>();
    private final List<String> lossNotes = new ArrayList<>();
    private final List<String> reviewFlags = new ArrayList<>();
    private String skipReason;

    public static FoldRewrite skip(String reason) {
        FoldRewrite rewrite = new FoldRewrite();
        rewrite.skipReason = reason;
        return rewrite;
    }

    /**
     * Adds or replaces a resource, keeping its position when it already exists
     */
    public FoldRewrite upsert(Resource resource) {
        upserts.put(resource.getLogicalId(), resource);
        return this;
    }

    public FoldRewrite remove(String logicalId) {
        removals.add(logicalId);
        return this;
    }

    /**
     * References to a removed ID are rewritten to an ID SAM generates during the transform
     */
    public FoldRewrite repoint(String removedId, String generatedId) {
        repoints.put(removedId, generatedId);
        generatedIds.add(generatedId);
        return this;
    }

    /**
     * Ref and Fn::Sub references to a removed ID become fixed text
     */
    public FoldRewrite replaceWithLiteral(String removedId, String literal) {
        literalReplacements.put(removedId, literal);
        return this;
    }

    public FoldRewrite generated(String logicalId) {
        generatedIds.add(logicalId);
        return this;
    }

    public FoldRewrite loss(String note) {
        lossNotes.add(note);
        return this;
    }

    public FoldRewrite review(String flag) {
        reviewFlags.add(flag);
        return this;
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    public String getSkipReason() {
        return skipReason;
    }

    public Map<String, Resource> getUpserts() {
        return upserts;
    }

    public Set<String> getRemovals() {
        return removals;
    }

    public Map<String, String> getRepoints() {
        return repoints;
    }

    public Map<String, String> getLiteralReplacements() {
        return literalReplacements;
    }

    public Set<String> getGeneratedIds() {
        return generatedIds;
    }

    public List<String> getLossNotes() {
        return lossNotes;
    }

    public List<String> getReviewFlags() {
        return reviewFlags;
    }
}
