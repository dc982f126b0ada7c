package com.example.samifier.plan;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Record of one applied fold.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FoldEntry {

    private String rule;

    /**
     * Resource the match was anchored on
     */
    private String anchorId;

    /**
     * Resources removed or rewritten by the fold, in match order
     */
    @Builder.Default
    private List<String> consumedIds = new ArrayList<>();

    /**
     * Resources created or modified, plus IDs SAM generates at deploy time
     */
    @Builder.Default
    private List<String> producedIds = new ArrayList<>();

    /**
     * Information that could not be carried over to the SAM construct
     */
    @Builder.Default
    private List<String> lossNotes = new ArrayList<>();

    /**
     * Resources left raw that need a human decision
     */
    @Builder.Default
    private List<String> reviewFlags = new ArrayList<>();
}
