package com.example.samifier.controller;

import com.example.samifier.exception.AssetUnavailableException;
import com.example.samifier.exception.FoldAmbiguousException;
import com.example.samifier.exception.LintFailedException;
import com.example.samifier.exception.RenameConflictException;
import com.example.samifier.exception.SamifierException;
import com.example.samifier.exception.TemplateParseException;
import com.example.samifier.exception.TemplateSourceException;
import com.example.samifier.fold.FoldRule;
import com.example.samifier.fold.PatternLibrary;
import com.example.samifier.model.RefactorRequest;
import com.example.samifier.model.RefactorResult;
import com.example.samifier.model.TemplateRefactorRequest;
import com.example.samifier.service.RefactorOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for previewing a refactoring. Nothing is written to disk; staged assets are
 * reported in the plan only.
 */
@Slf4j
@RestController
@RequestMapping("/api/templates")
@RequiredArgsConstructor
public class RefactorController {
    private final RefactorOrchestrator orchestrator;
    private final PatternLibrary patternLibrary;

    /**
     * Refactor a template passed inline
     *
     * @return {@code {template, plan}} on success, {@code {code, description}} on failure
     */
    @PostMapping("/refactor")
    public ResponseEntity<?> refactor(@RequestBody TemplateRefactorRequest request) {
        log.info("Received refactoring request, target: {}", request.getTarget());
        if (request.getTemplate() == null || request.getTemplate().isBlank()) {
            return error(new TemplateSourceException("Request has no template"), HttpStatus.BAD_REQUEST);
        }
        try {
            RefactorResult result = orchestrator.refactor(RefactorRequest.builder()
                    .templateText(request.getTemplate())
                    .target(request.getTarget())
                    .assetPolicy(request.getAssetPolicy())
                    .outputFormat(request.getOutputFormat())
                    .allowLintErrors(request.getAllowLintErrors())
                    .build());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("template", result.getTemplate());
            body.put("plan", result.getPlan());
            return ResponseEntity.ok(body);
        } catch (SamifierException e) {
            log.warn("Refactoring failed [{}]: {}", e.getCode(), e.getDescription());
            return error(e, statusFor(e.getCode()));
        }
    }

    /**
     * Fold rules in the order they run
     */
    @GetMapping("/rules")
    public ResponseEntity<List<Map<String, Object>>> rules() {
        List<Map<String, Object>> rules = new ArrayList<>();
        for (FoldRule rule : patternLibrary.activeRules()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", rule.getName());
            entry.put("priority", patternLibrary.priorityOf(rule));
            rules.add(entry);
        }
        return ResponseEntity.ok(rules);
    }

    static HttpStatus statusFor(String code) {
        if (TemplateParseException.CODE.equals(code) || TemplateSourceException.CODE.equals(code)) {
            return HttpStatus.BAD_REQUEST;
        } else if (RenameConflictException.CODE.equals(code) || FoldAmbiguousException.CODE.equals(code)) {
            return HttpStatus.CONFLICT;
        } else if (AssetUnavailableException.CODE.equals(code) || LintFailedException.CODE.equals(code)) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static ResponseEntity<Map<String, String>> error(SamifierException e, HttpStatus status) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("code", e.getCode());
        body.put("description", e.getDescription());
        return new ResponseEntity<>(body, status);
    }
}
