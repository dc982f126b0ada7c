package com.example.samifier.metadata;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable logical ID to construct lookup, passed explicitly into each run.
 */
public final class CdkMetadataBundle {
    private static final CdkMetadataBundle EMPTY = new CdkMetadataBundle(Collections.emptyMap(), "none");

    private final Map<String, ConstructInfo> constructs;
    private final String source;

    public CdkMetadataBundle(Map<String, ConstructInfo> constructs, String source) {
        this.constructs = Collections.unmodifiableMap(new TreeMap<>(constructs));
        this.source = source;
    }

    public static CdkMetadataBundle empty() {
        return EMPTY;
    }

    public Optional<ConstructInfo> lookup(String logicalId) {
        return Optional.ofNullable(constructs.get(logicalId));
    }

    /**
     * Entries sorted by logical ID
     */
    public Map<String, ConstructInfo> getConstructs() {
        return constructs;
    }

    /**
     * Where the bundle came from (a file path, {@code template} or {@code none})
     */
    public String getSource() {
        return source;
    }

    public boolean isEmpty() {
        return constructs.isEmpty();
    }

    public int size() {
        return constructs.size();
    }

    /**
     * Entries of this bundle win; the other bundle only fills gaps
     */
    public CdkMetadataBundle mergedWith(CdkMetadataBundle fallback) {
        if (fallback == null || fallback.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return fallback;
        }
        Map<String, ConstructInfo> merged = new TreeMap<>(fallback.constructs);
        merged.putAll(constructs);
        return new CdkMetadataBundle(merged, source + "+" + fallback.source);
    }
}
