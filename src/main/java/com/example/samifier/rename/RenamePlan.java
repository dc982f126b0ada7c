package com.example.samifier.rename;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered set of renames to apply atomically.
 */
public final class RenamePlan {
    private final RenameStatus status;
    private final List<RenameEntry> entries;

    private RenamePlan(RenameStatus status, List<RenameEntry> entries) {
        this.status = status;
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public static RenamePlan skipped() {
        return new RenamePlan(RenameStatus.SKIPPED, Collections.emptyList());
    }

    public static RenamePlan of(List<RenameEntry> entries) {
        return new RenamePlan(entries.isEmpty() ? RenameStatus.UNCHANGED : RenameStatus.PERFORMED, entries);
    }

    public RenameStatus getStatus() {
        return status;
    }

    public List<RenameEntry> getEntries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Map<String, String> mapping(RenameEntry.Kind kind) {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (RenameEntry entry : entries) {
            if (entry.getKind() == kind) {
                mapping.put(entry.getOldId(), entry.getNewId());
            }
        }
        return mapping;
    }
}
