package com.example.samifier.service;

import com.example.samifier.model.RefactorTarget;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.plan.LintFinding;

import java.util.List;

/**
 * Checks the final template. Every registered validator runs; findings of severity
 * {@link LintFinding.Severity#ERROR} abort the run unless lint errors are allowed.
 */
public interface TemplateLintValidator {

    String getName();

    /**
     * @param templateText the template as it will be written
     * @param document     the same template in parsed form
     */
    List<LintFinding> validate(String templateText, TemplateDocument document, RefactorTarget target);
}
