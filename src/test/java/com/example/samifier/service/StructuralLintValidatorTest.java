package com.example.samifier.service;

import com.example.samifier.TestTemplates;
import com.example.samifier.model.RefactorTarget;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.plan.LintFinding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StructuralLintValidatorTest {

    private final StructuralLintValidator validator = new StructuralLintValidator();

    @Test
    public void testCleanTemplateHasNoFindings() {
        TemplateDocument document = TestTemplates.template("short-form.yaml");

        assertTrue(validator.validate("", document, RefactorTarget.CFN).isEmpty());
    }

    @Test
    public void testServerlessWithoutTransform() {
        TemplateDocument document = TestTemplates.parse("Resources:\n"
                + "  Fn:\n"
                + "    Type: AWS::Serverless::Function\n"
                + "    Properties:\n"
                + "      InlineCode: x\n");

        List<LintFinding> findings = validator.validate("", document, RefactorTarget.SAM);

        assertEquals(1, findings.size());
        assertEquals("S1004", findings.get(0).getRuleId());
        assertTrue(findings.get(0).isError());
    }

    @Test
    public void testUnknownReferenceSeverityDependsOnTarget() {
        String text = "Transform: AWS::Serverless-2016-10-31\n"
                + "Resources:\n"
                + "  Fn:\n"
                + "    Type: AWS::Serverless::Function\n"
                + "    Properties:\n"
                + "      InlineCode: x\n"
                + "Outputs:\n"
                + "  RoleArn:\n"
                + "    Value: !GetAtt FnRole.Arn\n"
                + "  RoleName:\n"
                + "    Value: !Ref FnRole\n";
        TemplateDocument document = TestTemplates.parse(text);

        List<LintFinding> sam = validator.validate(text, document, RefactorTarget.SAM);
        List<LintFinding> cfn = validator.validate(text, document, RefactorTarget.CFN);

        assertEquals(1, sam.size());
        assertEquals(LintFinding.Severity.WARNING, sam.get(0).getSeverity());
        assertEquals("S2002", sam.get(0).getRuleId());
        assertEquals(LintFinding.Severity.ERROR, cfn.get(0).getSeverity());
        assertEquals("Reference to unknown ID FnRole", cfn.get(0).getMessage());
    }

    @Test
    public void testUndeclaredConditionAndDependency() {
        TemplateDocument document = TestTemplates.parse("Resources:\n"
                + "  Queue:\n"
                + "    Type: AWS::SQS::Queue\n"
                + "    Condition: IsProd\n"
                + "    DependsOn: [Missing]\n");

        List<LintFinding> findings = validator.validate("", document, RefactorTarget.SAM);

        assertTrue(findings.stream().anyMatch(f -> "S1003".equals(f.getRuleId())));
        assertTrue(findings.stream().anyMatch(f -> "S2002".equals(f.getRuleId()) && f.isError()));
    }
}
