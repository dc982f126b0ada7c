package com.example.samifier.service;

import com.example.samifier.fold.PatternLibrary;
import com.example.samifier.model.RefactorTarget;
import com.example.samifier.model.Resource;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.plan.LintFinding;
import com.example.samifier.template.ReferenceIndex;
import com.example.samifier.template.ReferenceKind;
import com.example.samifier.template.ReferenceSite;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Built-in checks that need no external tooling: declared types, the SAM transform and
 * references that resolve to nothing.
 *
 * With a SAM target a Ref or GetAtt to an unknown ID is only a warning, since SAM creates
 * resources such as {@code <Function>Role} at deploy time.
 */
@Slf4j
@Component
public class StructuralLintValidator implements TemplateLintValidator {
    private static final String SERVERLESS_PREFIX = "AWS::Serverless::";

    @Override
    public String getName() {
        return "structural";
    }

    @Override
    public List<LintFinding> validate(String templateText, TemplateDocument document, RefactorTarget target) {
        List<LintFinding> findings = new ArrayList<>();
        if (document.getResources().isEmpty()) {
            findings.add(finding(LintFinding.Severity.ERROR, "S1001", "Template declares no resources", TemplateDocument.RESOURCES));
        }

        boolean serverless = false;
        for (Resource resource : document.getResources().values()) {
            String path = TemplateDocument.RESOURCES + "." + resource.getLogicalId();
            if (resource.getType() == null || resource.getType().isEmpty()) {
                findings.add(finding(LintFinding.Severity.ERROR, "S1002", "Resource has no Type", path));
            } else if (resource.getType().startsWith(SERVERLESS_PREFIX)) {
                serverless = true;
            }
            if (resource.getCondition() != null && !document.hasCondition(resource.getCondition())) {
                findings.add(finding(LintFinding.Severity.ERROR, "S1003",
                        "Condition " + resource.getCondition() + " is not declared", path + ".Condition"));
            }
        }
        if (serverless && !hasSamTransform(document)) {
            findings.add(finding(LintFinding.Severity.ERROR, "S1004",
                    "Serverless resources require the AWS::Serverless-2016-10-31 transform", TemplateDocument.TRANSFORM));
        }

        Set<String> known = document.getLogicalIds();
        Set<String> reported = new LinkedHashSet<>();
        for (ReferenceSite site : ReferenceIndex.build(document).getSites()) {
            String name = site.getTarget();
            if (site.getKind().targetsCondition()) {
                if (!document.hasCondition(name) && reported.add("condition:" + name)) {
                    findings.add(finding(LintFinding.Severity.ERROR, "S2001", "Unknown condition " + name, site.getPath().toString()));
                }
                continue;
            }
            if (name.startsWith("AWS::") || known.contains(name) || !reported.add(name)) {
                continue;
            }
            boolean generated = target == RefactorTarget.SAM && site.getKind() != ReferenceKind.DEPENDS_ON;
            findings.add(finding(generated ? LintFinding.Severity.WARNING : LintFinding.Severity.ERROR, "S2002",
                    (generated ? "Reference to an ID that is not declared, expected to be created by SAM: " : "Reference to unknown ID ") + name,
                    site.getPath().toString()));
        }
        log.debug("Structural lint produced {} finding(s)", findings.size());
        return findings;
    }

    private static boolean hasSamTransform(TemplateDocument document) {
        Object transform = document.getSection(TemplateDocument.TRANSFORM);
        if (transform instanceof List) {
            return ((List<?>) transform).contains(PatternLibrary.SAM_TRANSFORM);
        }
        return PatternLibrary.SAM_TRANSFORM.equals(transform);
    }

    private static LintFinding finding(LintFinding.Severity severity, String ruleId, String message, String path) {
        return LintFinding.builder().severity(severity).ruleId(ruleId).message(message).path(path).build();
    }
}
