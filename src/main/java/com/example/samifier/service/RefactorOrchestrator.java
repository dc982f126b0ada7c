package com.example.samifier.service;

import com.example.samifier.aspect.LogExecutionTime;
import com.example.samifier.asset.AssetPlan;
import com.example.samifier.asset.AssetPlanner;
import com.example.samifier.asset.AssetPolicy;
import com.example.samifier.config.SamifierProperties;
import com.example.samifier.exception.LintFailedException;
import com.example.samifier.exception.ReferenceDanglingException;
import com.example.samifier.exception.TemplateSourceException;
import com.example.samifier.fold.PatternLibrary;
import com.example.samifier.metadata.CdkMetadataBundle;
import com.example.samifier.metadata.CdkMetadataLoader;
import com.example.samifier.metadata.MetadataResolver;
import com.example.samifier.model.OutputFormat;
import com.example.samifier.model.RefactorRequest;
import com.example.samifier.model.RefactorResult;
import com.example.samifier.model.RefactorTarget;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.plan.FoldEntry;
import com.example.samifier.plan.LintFinding;
import com.example.samifier.plan.PlanRenderer;
import com.example.samifier.plan.RefactorPlan;
import com.example.samifier.rename.RenamePlan;
import com.example.samifier.rename.Renamer;
import com.example.samifier.template.CdkCleaner;
import com.example.samifier.template.CleanOptions;
import com.example.samifier.template.ReferenceIndex;
import com.example.samifier.template.ReferenceSite;
import com.example.samifier.template.TemplateParser;
import com.example.samifier.template.TemplateSerializer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Main orchestrator for template refactoring.
 *
 * Runs load, parse, clean, rename, fold, asset planning, integrity check, serialization,
 * formatting and lint in that order. The template is mutated in memory only; when an output
 * directory is requested, the template, the plan and staged assets are written once at the end.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefactorOrchestrator {
    private final TemplateParser templateParser;
    private final CdkCleaner cdkCleaner;
    private final CdkMetadataLoader metadataLoader;
    private final MetadataResolver metadataResolver;
    private final Renamer renamer;
    private final PatternLibrary patternLibrary;
    private final AssetPlanner assetPlanner;
    private final TemplateSerializer templateSerializer;
    private final PlanRenderer planRenderer;
    private final OutputWriter outputWriter;
    private final SamifierProperties properties;
    private final List<TemplateLintValidator> lintValidators;
    private final Optional<TemplateFormatter> templateFormatter;
    private final Optional<StackTemplateFetcher> stackTemplateFetcher;

    @LogExecutionTime("Total template refactoring")
    public RefactorResult refactor(RefactorRequest request) {
        RefactorTarget target = request.getTarget() != null ? request.getTarget() : properties.getTarget();
        AssetPolicy assetPolicy = request.getAssetPolicy() != null ? request.getAssetPolicy() : properties.getAssetPolicy();
        OutputFormat format = request.getOutputFormat() != null ? request.getOutputFormat() : properties.getOutputFormat();
        boolean allowLintErrors = request.getAllowLintErrors() != null ? request.getAllowLintErrors() : properties.isAllowLintErrors();

        RefactorPlan plan = new RefactorPlan();
        plan.setTarget(target);
        List<Path> searchRoots = new ArrayList<>();
        TemplateDocument document = load(request, plan, searchRoots);
        log.info("Refactoring {} into {}", plan.getSource(), target);
        if (target == RefactorTarget.SAM) {
            patternLibrary.verifyUnambiguous(document);
        }

        CdkMetadataBundle bundle = loadMetadata(request);
        if (properties.isUseTemplatePathMetadata()) {
            bundle = bundle.mergedWith(metadataLoader.fromTemplate(document));
        }

        CleanOptions cleanOptions = CleanOptions.builder()
                .keepAssetMetadata(true)
                .stripPathMetadata(properties.getClean().isStripPathMetadata())
                .build();
        cdkCleaner.clean(document, cleanOptions).forEach(plan::info);

        RenamePlan renamePlan = metadataResolver.resolve(document, bundle);
        renamer.apply(document, renamePlan);
        plan.recordRenames(renamePlan);

        Set<String> declaredBeforeFold = new LinkedHashSet<>(document.getLogicalIds());
        if (target == RefactorTarget.SAM) {
            patternLibrary.fold(document, plan);
        }

        AssetPlan assetPlan = assetPlanner.plan(document, assetPolicy, properties.getAssetsDirectory(), searchRoots);
        plan.getAssets().addAll(assetPlan.getRecords());

        verifyIntegrity(document, declaredBeforeFold, plan.getFolds());

        String text = templateSerializer.serialize(document, format);
        if (templateFormatter.isPresent()) {
            text = templateFormatter.get().format(text, format);
        }

        lint(text, document, target, plan);
        if (plan.hasLintErrors()) {
            List<LintFinding> errors = plan.getLint().stream().filter(LintFinding::isError).collect(Collectors.toList());
            if (!allowLintErrors) {
                throw new LintFailedException(errors);
            }
            plan.warn(errors.size() + " lint error(s) were allowed");
        }

        RefactorResult.RefactorResultBuilder result = RefactorResult.builder()
                .template(text)
                .plan(plan)
                .stagedAssets(assetPlan.getStaged());
        if (request.getOutputDir() == null) {
            return result.outcome(RefactorResult.Outcome.PREVIEW).build();
        }

        String templateFileName = templateFileName(format);
        String planFileName = request.getPlanFile() != null ? request.getPlanFile() : properties.getPlanFileName();
        Map<String, String> documents = new LinkedHashMap<>();
        documents.put(templateFileName, text);
        documents.put(planFileName, planRenderer.render(plan, planFileName));
        outputWriter.write(request.getOutputDir(), documents, assetPlan.getStaged());
        return result
                .outcome(RefactorResult.Outcome.WRITTEN)
                .templateFile(request.getOutputDir().resolve(templateFileName))
                .build();
    }

    private TemplateDocument load(RefactorRequest request, RefactorPlan plan, List<Path> searchRoots) {
        if (request.getTemplateText() != null) {
            plan.setSource("inline");
            return templateParser.parse(request.getTemplateText());
        }
        if (request.getTemplatePath() != null) {
            Path path = request.getTemplatePath();
            plan.setSource(path.toString());
            if (path.toAbsolutePath().getParent() != null) {
                searchRoots.add(path.toAbsolutePath().getParent());
            }
            if (request.getCdkOut() != null) {
                searchRoots.add(request.getCdkOut());
            }
            return templateParser.parse(path);
        }
        if (request.getCdkOut() != null) {
            Path template = metadataLoader.findTemplate(request.getCdkOut(), request.getStackName())
                    .orElseThrow(() -> new TemplateSourceException("No synthesized template in " + request.getCdkOut()));
            plan.setSource(template.toString());
            searchRoots.add(request.getCdkOut());
            return templateParser.parse(template);
        }
        if (request.getStackName() != null) {
            StackTemplateFetcher fetcher = stackTemplateFetcher.orElseThrow(() -> new TemplateSourceException(
                    "Cannot read stack " + request.getStackName() + ": no stack template fetcher is configured"));
            plan.setSource("stack:" + request.getStackName());
            return templateParser.parse(fetcher.fetch(request.getStackName()));
        }
        throw new TemplateSourceException("No template source given");
    }

    private CdkMetadataBundle loadMetadata(RefactorRequest request) {
        if (request.getManifest() != null) {
            return metadataLoader.load(request.getManifest(), request.getTree(), request.getStackName());
        }
        if (request.getCdkOut() != null) {
            return metadataLoader.load(request.getCdkOut(), request.getStackName());
        }
        return CdkMetadataBundle.empty();
    }

    /**
     * A reference may only name an ID that still exists, was never declared, or that SAM creates at deploy time
     */
    static void verifyIntegrity(TemplateDocument document, Set<String> declaredBeforeFold, List<FoldEntry> folds) {
        Set<String> retired = new LinkedHashSet<>(declaredBeforeFold);
        retired.removeAll(document.getLogicalIds());
        for (FoldEntry fold : folds) {
            fold.getProducedIds().forEach(retired::remove);
        }
        if (retired.isEmpty()) {
            return;
        }
        List<ReferenceSite> dangling = ReferenceIndex.build(document).dangling(retired, Collections.emptySet());
        if (!dangling.isEmpty()) {
            ReferenceSite first = dangling.get(0);
            throw new ReferenceDanglingException(String.format("%d reference(s) to removed resources, first %s at %s",
                    dangling.size(), first.getTarget(), first.getPath()));
        }
    }

    private void lint(String text, TemplateDocument document, RefactorTarget target, RefactorPlan plan) {
        for (TemplateLintValidator validator : lintValidators) {
            List<LintFinding> findings = validator.validate(text, document, target);
            log.debug("Lint validator {} reported {} finding(s)", validator.getName(), findings.size());
            plan.getLint().addAll(findings);
        }
    }

    private String templateFileName(OutputFormat format) {
        String name = properties.getTemplateFileName();
        if (format == OutputFormat.JSON && (name.endsWith(".yaml") || name.endsWith(".yml"))) {
            return name.substring(0, name.lastIndexOf('.')) + ".json";
        }
        return name;
    }
}
