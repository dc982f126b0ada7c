package com.example.samifier.plan;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One finding reported by the external lint validator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LintFinding {

    public enum Severity { ERROR, WARNING, INFO }

    private Severity severity;

    /**
     * Validator specific rule identifier, e.g. {@code E3012}
     */
    private String ruleId;

    private String message;

    /**
     * Location in the template, e.g. {@code Resources.Handler.Properties.Runtime}
     */
    private String path;

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
