package com.example.samifier.exception;

import java.util.Set;

/**
 * Two fold rules with the same priority claim overlapping resources.
 * This is a configuration defect and is raised before any rule rewrites the template.
 */
public class FoldAmbiguousException extends SamifierException {
    public static final String CODE = "FOLD_AMBIGUOUS";

    private final String firstRule;
    private final String secondRule;
    private final Set<String> overlap;

    public FoldAmbiguousException(String firstRule, String secondRule, int priority, Set<String> overlap) {
        super(CODE, String.format("Rules '%s' and '%s' share priority %d and both claim %s",
                firstRule, secondRule, priority, overlap));
        this.firstRule = firstRule;
        this.secondRule = secondRule;
        this.overlap = overlap;
    }

    public String getFirstRule() {
        return firstRule;
    }

    public String getSecondRule() {
        return secondRule;
    }

    public Set<String> getOverlap() {
        return overlap;
    }
}
