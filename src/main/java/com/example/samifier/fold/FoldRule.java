package com.example.samifier.fold;

import java.util.List;

/**
 * A pattern over a group of resources and the rewrite that turns it into a SAM construct.
 *
 * {@link #match} only inspects the document. {@link #rewrite} describes the change without
 * applying it; {@link PatternLibrary} applies it, so every rule can be tested on its own.
 */
public interface FoldRule {

    /**
     * Stable name used in the plan and in configuration
     */
    String getName();

    /**
     * Lower runs first. Can be overridden under {@code samifier.fold.priorities}
     */
    int getDefaultPriority();

    /**
     * All occurrences of the pattern, in document order
     */
    List<FoldMatch> match(FoldContext context);

    /**
     * Rewrite for one match, evaluated against the current state of the document
     */
    FoldRewrite rewrite(FoldMatch match, FoldContext context);
}
