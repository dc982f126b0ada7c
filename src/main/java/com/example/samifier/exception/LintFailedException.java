package com.example.samifier.exception;

import com.example.samifier.plan.LintFinding;

import java.util.List;

/**
 * The external validator reported errors and the caller did not allow them.
 */
public class LintFailedException extends SamifierException {
    public static final String CODE = "LINT_FAILED";

    private final List<LintFinding> findings;

    public LintFailedException(List<LintFinding> findings) {
        super(CODE, findings.size() + " lint error(s) reported, first: " + findings.get(0).getMessage());
        this.findings = findings;
    }

    public List<LintFinding> getFindings() {
        return findings;
    }
}
