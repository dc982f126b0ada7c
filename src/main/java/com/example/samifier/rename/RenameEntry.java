package com.example.samifier.rename;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One old to new identifier mapping with its provenance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RenameEntry {

    public enum Kind { RESOURCE, CONDITION }

    private String oldId;

    private String newId;

    @Builder.Default
    private Kind kind = Kind.RESOURCE;

    /**
     * Construct path the name was derived from, null for hand-written plans
     */
    private String constructPath;

    /**
     * Name derived from the construct path before collision handling
     */
    private String candidate;

    @Builder.Default
    private CollisionStrategy strategy = CollisionStrategy.NONE;
}
