package com.example.samifier.cli;

import com.example.samifier.asset.AssetPolicy;
import com.example.samifier.exception.LintFailedException;
import com.example.samifier.exception.SamifierException;
import com.example.samifier.model.OutputFormat;
import com.example.samifier.model.RefactorRequest;
import com.example.samifier.model.RefactorResult;
import com.example.samifier.model.RefactorTarget;
import com.example.samifier.plan.LintFinding;
import com.example.samifier.plan.PlanRenderer;
import com.example.samifier.service.RefactorOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command line entry point. Without a template source option the application keeps running as a REST service.
 *
 * Examples:
 *
 * java -jar samifier.jar --cdk-out=./cdk.out --stack=OrdersStack --output-dir=./sam
 *
 * java -jar samifier.jar --input=./Orders.template.json --target=cfn --format=json
 *
 * java -jar samifier.jar --input=./template.json --manifest=./cdk.out/manifest.json \
 *   --tree=./cdk.out/tree.json --prefer-external-assets --output-dir=./sam --plan=plan.yaml
 *
 * Exit codes: 0 on success, 1 on failure, 2 when lint errors stopped the run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RefactorCommandLineRunner implements ApplicationRunner {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_LINT = 2;

    private final RefactorOrchestrator orchestrator;
    private final PlanRenderer planRenderer;

    @Override
    public void run(ApplicationArguments args) {
        if (!isCliInvocation(args)) {
            log.info("Starting in REST API mode. Use --input, --cdk-out or --stack for CLI mode.");
            return;
        }
        log.info("Starting in CLI mode");
        System.exit(execute(args, System.out));
    }

    static boolean isCliInvocation(ApplicationArguments args) {
        return args.containsOption("input") || args.containsOption("cdk-out") || args.containsOption("stack");
    }

    /**
     * Runs one refactoring and maps the outcome to an exit code
     *
     * @param out receives the template when no output directory is given
     */
    int execute(ApplicationArguments args, PrintStream out) {
        try {
            RefactorRequest request = toRequest(args);
            RefactorResult result = orchestrator.refactor(request);
            if (result.getOutcome() == RefactorResult.Outcome.WRITTEN) {
                out.println("Template written to " + result.getTemplateFile().toAbsolutePath());
            } else {
                out.print(result.getTemplate());
                String planFile = getOption(args, "plan", null);
                if (planFile != null) {
                    Files.writeString(Path.of(planFile), planRenderer.render(result.getPlan(), planFile));
                }
            }
            printSummary(result.getPlan().getSummary(), result.getPlan().getLint());
            return EXIT_OK;
        } catch (LintFailedException e) {
            log.error("Lint errors stopped the run: {}", e.getDescription());
            for (LintFinding finding : e.getFindings()) {
                System.err.println("  " + finding.getRuleId() + " " + finding.getPath() + ": " + finding.getMessage());
            }
            return EXIT_LINT;
        } catch (SamifierException e) {
            log.error("Refactoring failed [{}]: {}", e.getCode(), e.getDescription(), e);
            return EXIT_FAILURE;
        } catch (IOException | IllegalArgumentException e) {
            log.error("CLI execution failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    RefactorRequest toRequest(ApplicationArguments args) {
        RefactorRequest.RefactorRequestBuilder request = RefactorRequest.builder()
                .templatePath(getPath(args, "input"))
                .stackName(getOption(args, "stack", null))
                .cdkOut(getPath(args, "cdk-out"))
                .manifest(getPath(args, "manifest"))
                .tree(getPath(args, "tree"))
                .outputDir(getPath(args, "output-dir"));

        String target = getOption(args, "target", null);
        if (target != null) {
            request.target(RefactorTarget.valueOf(target.toUpperCase(Locale.ROOT)));
        }
        String format = getOption(args, "format", null);
        if (format != null) {
            request.outputFormat(OutputFormat.valueOf(format.toUpperCase(Locale.ROOT)));
        }
        if (args.containsOption("prefer-external-assets")) {
            request.assetPolicy(AssetPolicy.PREFER_EXTERNAL);
        }
        if (args.containsOption("allow-lint-errors")) {
            request.allowLintErrors(true);
        }
        if (args.containsOption("output-dir")) {
            request.planFile(getOption(args, "plan", null));
        }
        return request.build();
    }

    private void printSummary(Map<String, Object> summary, List<LintFinding> lint) {
        System.err.println();
        summary.forEach((name, value) -> System.err.printf("  %-14s %s%n", name + ":", value));
        for (LintFinding finding : lint) {
            System.err.println("  " + finding.getSeverity() + " " + finding.getRuleId() + " " + finding.getPath() + ": " + finding.getMessage());
        }
    }

    private static Path getPath(ApplicationArguments args, String name) {
        String value = getOption(args, name, null);
        return value == null ? null : Path.of(value);
    }

    private static String getOption(ApplicationArguments args, String name, String defaultValue) {
        if (args.containsOption(name)) {
            List<String> values = args.getOptionValues(name);
            return values.isEmpty() ? defaultValue : values.get(0);
        }
        return defaultValue;
    }
}
