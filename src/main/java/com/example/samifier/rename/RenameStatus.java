package com.example.samifier.rename;

/**
 * Whether renaming happened in a run
 */
public enum RenameStatus {
    /** At least one logical ID was renamed */
    PERFORMED,
    /** Metadata was available but every ID already had its semantic name */
    UNCHANGED,
    /** No metadata bundle, the resolver degraded to identity */
    SKIPPED
}
