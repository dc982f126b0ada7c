package com.example.samifier.fold;

import com.example.samifier.aspect.LogExecutionTime;
import com.example.samifier.config.SamifierProperties;
import com.example.samifier.exception.FoldAmbiguousException;
import com.example.samifier.model.Resource;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.plan.FoldEntry;
import com.example.samifier.plan.RefactorPlan;
import com.example.samifier.template.ReferenceKind;
import com.example.samifier.template.ReferenceRewriter;
import com.example.samifier.template.ReferenceSite;
import com.example.samifier.util.Values;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Runs the fold rules over a document.
 *
 * Every rule matches against the document as it was before folding started. Matches are then
 * applied in priority order (document order within a rule) and a resource is claimed by the
 * first applied match only. Two rules that share a priority and claim the same resource make
 * the outcome order dependent, which is reported before anything is rewritten.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatternLibrary {
    public static final String SAM_TRANSFORM = "AWS::Serverless-2016-10-31";

    private static final List<String> GLOBAL_KEYS = List.of("Runtime", "MemorySize", "Timeout", "Architectures");

    private final List<FoldRule> rules;
    private final SamifierProperties properties;

    public int priorityOf(FoldRule rule) {
        return properties.getFold().getPriorities().getOrDefault(rule.getName(), rule.getDefaultPriority());
    }

    /**
     * Enabled rules, lowest priority first, ties broken by name
     */
    public List<FoldRule> activeRules() {
        List<FoldRule> active = new ArrayList<>();
        for (FoldRule rule : rules) {
            if (!properties.getFold().getDisabled().contains(rule.getName())) {
                active.add(rule);
            }
        }
        active.sort(Comparator.comparingInt(this::priorityOf).thenComparing(FoldRule::getName));
        return active;
    }

    /**
     * Raises FOLD_AMBIGUOUS when rules sharing a priority claim the same resources of the document.
     * Only inspects the document, so it can run on the template as written.
     */
    public void verifyUnambiguous(TemplateDocument document) {
        checkAmbiguity(matchAll(new FoldContext(document)));
    }

    @LogExecutionTime("Fold template into SAM")
    public List<FoldEntry> fold(TemplateDocument document, RefactorPlan plan) {
        FoldContext context = new FoldContext(document);

        Map<FoldRule, List<FoldMatch>> matches = matchAll(context);
        checkAmbiguity(matches);

        List<FoldEntry> applied = new ArrayList<>();
        Set<String> claimed = new HashSet<>();
        for (Map.Entry<FoldRule, List<FoldMatch>> entry : matches.entrySet()) {
            FoldRule rule = entry.getKey();
            for (FoldMatch match : entry.getValue()) {
                if (containsAny(claimed, match.getConsumedIds())) {
                    context.annotate(rule.getName(), "Skipped " + match.getAnchorId() + ", its resources were already folded");
                    continue;
                }
                FoldRewrite rewrite = rule.rewrite(match, context);
                String blocker = rewrite.isSkipped() ? rewrite.getSkipReason() : findBlocker(match, rewrite, context);
                if (blocker != null) {
                    context.annotate(rule.getName(), "Left " + match.getAnchorId() + " unfolded: " + blocker);
                    continue;
                }
                apply(rewrite, context);
                claimed.addAll(match.getConsumedIds());
                FoldEntry foldEntry = toEntry(match, rewrite);
                applied.add(foldEntry);
                log.info("Folded {} with rule {}: consumed {}, produced {}", match.getAnchorId(), rule.getName(),
                        foldEntry.getConsumedIds(), foldEntry.getProducedIds());
            }
        }

        for (String annotation : context.getAnnotations()) {
            log.warn(annotation);
            plan.warn(annotation);
        }
        ensureTransform(document);
        if (properties.getFold().isHoistGlobals()) {
            hoistGlobals(document, plan);
        }
        plan.getFolds().addAll(applied);
        return applied;
    }

    private Map<FoldRule, List<FoldMatch>> matchAll(FoldContext context) {
        Map<FoldRule, List<FoldMatch>> matches = new LinkedHashMap<>();
        for (FoldRule rule : activeRules()) {
            List<FoldMatch> found = rule.match(context);
            log.debug("Rule {} matched {} time(s)", rule.getName(), found.size());
            matches.put(rule, found);
        }
        return matches;
    }

    private void checkAmbiguity(Map<FoldRule, List<FoldMatch>> matches) {
        List<FoldRule> ordered = new ArrayList<>(matches.keySet());
        for (int i = 0; i < ordered.size(); i++) {
            for (int j = i + 1; j < ordered.size(); j++) {
                FoldRule first = ordered.get(i);
                FoldRule second = ordered.get(j);
                if (priorityOf(first) != priorityOf(second)) {
                    continue;
                }
                for (FoldMatch a : matches.get(first)) {
                    for (FoldMatch b : matches.get(second)) {
                        Set<String> overlap = new LinkedHashSet<>(a.getConsumedIds());
                        overlap.retainAll(b.getConsumedIds());
                        if (!overlap.isEmpty()) {
                            throw new FoldAmbiguousException(first.getName(), second.getName(), priorityOf(first), overlap);
                        }
                    }
                }
            }
        }
    }

    /**
     * Reason the rewrite would leave a dangling reference, or null when it is safe
     */
    private String findBlocker(FoldMatch match, FoldRewrite rewrite, FoldContext context) {
        for (String removed : rewrite.getRemovals()) {
            boolean repointed = rewrite.getRepoints().containsKey(removed);
            boolean literal = rewrite.getLiteralReplacements().containsKey(removed);
            for (ReferenceSite site : context.getIndex().sitesFor(removed)) {
                String owner = site.getOwnerResource();
                if (site.getKind() == ReferenceKind.DEPENDS_ON
                        || (owner != null && (rewrite.getRemovals().contains(owner) || rewrite.getUpserts().containsKey(owner)))) {
                    continue;
                }
                if (repointed || (literal && isLiteralReplaceable(site))) {
                    continue;
                }
                return removed + " is still referenced from " + site.getPath();
            }
            for (Resource upsert : rewrite.getUpserts().values()) {
                Set<String> referenced = Values.referencedIds(upsert.getProperties());
                referenced.addAll(Values.referencedIds(upsert.getMetadata()));
                if (referenced.contains(removed) && !repointed && !literal) {
                    return "rewritten " + upsert.getLogicalId() + " still references " + removed;
                }
            }
        }
        return null;
    }

    private static boolean isLiteralReplaceable(ReferenceSite site) {
        return site.getKind() == ReferenceKind.REF
                || (site.getKind() == ReferenceKind.SUB && site.getAttribute() == null);
    }

    private void apply(FoldRewrite rewrite, FoldContext context) {
        TemplateDocument document = context.getDocument();
        for (Resource resource : rewrite.getUpserts().values()) {
            document.putResource(resource);
        }
        for (String removed : rewrite.getRemovals()) {
            document.removeResource(removed);
        }
        for (Resource resource : document.getResources().values()) {
            List<String> dependsOn = new ArrayList<>();
            for (String dependency : resource.getDependsOn()) {
                String target = rewrite.getRepoints().getOrDefault(dependency, dependency);
                if (!rewrite.getRemovals().contains(target) && !dependsOn.contains(target)) {
                    dependsOn.add(target);
                }
            }
            resource.setDependsOn(dependsOn);
        }

        context.refresh();
        for (ReferenceSite site : context.getIndex().getSites()) {
            if (site.getKind() == ReferenceKind.DEPENDS_ON || site.getKind().targetsCondition()) {
                continue;
            }
            String repoint = rewrite.getRepoints().get(site.getTarget());
            String literal = rewrite.getLiteralReplacements().get(site.getTarget());
            if (repoint != null) {
                ReferenceRewriter.rename(document, site, repoint);
            } else if (literal != null && isLiteralReplaceable(site)) {
                ReferenceRewriter.replaceWithLiteral(document, site, literal);
            }
        }
        context.refresh();
    }

    private static FoldEntry toEntry(FoldMatch match, FoldRewrite rewrite) {
        List<String> produced = new ArrayList<>(rewrite.getUpserts().keySet());
        for (String generated : rewrite.getGeneratedIds()) {
            if (!produced.contains(generated)) {
                produced.add(generated);
            }
        }
        return FoldEntry.builder()
                .rule(match.getRule())
                .anchorId(match.getAnchorId())
                .consumedIds(new ArrayList<>(match.getConsumedIds()))
                .producedIds(produced)
                .lossNotes(new ArrayList<>(rewrite.getLossNotes()))
                .reviewFlags(new ArrayList<>(rewrite.getReviewFlags()))
                .build();
    }

    private static boolean containsAny(Set<String> claimed, Set<String> candidates) {
        for (String candidate : candidates) {
            if (claimed.contains(candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Adds the SAM transform, keeping any transform already declared
     */
    @SuppressWarnings("unchecked")
    static void ensureTransform(TemplateDocument document) {
        Object transform = document.getSection(TemplateDocument.TRANSFORM);
        if (transform == null) {
            document.setSection(TemplateDocument.TRANSFORM, SAM_TRANSFORM);
        } else if (transform instanceof List) {
            List<Object> transforms = (List<Object>) transform;
            if (!transforms.contains(SAM_TRANSFORM)) {
                transforms.add(SAM_TRANSFORM);
            }
        } else if (!SAM_TRANSFORM.equals(transform)) {
            List<Object> transforms = new ArrayList<>();
            transforms.add(transform);
            transforms.add(SAM_TRANSFORM);
            document.setSection(TemplateDocument.TRANSFORM, transforms);
        }
    }

    /**
     * Moves settings that every serverless function shares into Globals.Function
     */
    private void hoistGlobals(TemplateDocument document, RefactorPlan plan) {
        List<Resource> functions = document.resourcesOfType(FoldContext.SERVERLESS_FUNCTION);
        if (functions.size() < 2) {
            return;
        }
        Map<String, Object> hoisted = new LinkedHashMap<>();
        for (String key : GLOBAL_KEYS) {
            Object shared = sharedValue(functions, function -> function.property(key));
            if (shared != null) {
                hoisted.put(key, shared);
            }
        }
        Map<String, Object> variables = sharedVariables(functions);
        if (hoisted.isEmpty() && variables.isEmpty()) {
            return;
        }

        for (Resource function : functions) {
            hoisted.keySet().forEach(function.getProperties()::remove);
            removeVariables(function, variables.keySet());
        }
        Map<String, Object> globals = document.mutableSection(TemplateDocument.GLOBALS);
        Map<String, Object> functionGlobals = childMap(globals, "Function");
        functionGlobals.putAll(hoisted);
        if (!variables.isEmpty()) {
            childMap(childMap(functionGlobals, "Environment"), "Variables").putAll(variables);
        }
        List<String> names = new ArrayList<>(hoisted.keySet());
        variables.keySet().forEach(name -> names.add("Environment.Variables." + name));
        plan.info("Hoisted " + names + " of " + functions.size() + " functions into Globals.Function");
    }

    /**
     * Value every function has for the setting, or null. Values referencing resources stay per function
     */
    private static Object sharedValue(List<Resource> functions, Function<Resource, Object> setting) {
        Object first = setting.apply(functions.get(0));
        if (first == null || !Values.referencedIds(first).isEmpty()) {
            return null;
        }
        for (Resource function : functions) {
            if (!first.equals(setting.apply(function))) {
                return null;
            }
        }
        return first;
    }

    private static Map<String, Object> sharedVariables(List<Resource> functions) {
        Map<String, Object> shared = new LinkedHashMap<>();
        Map<String, Object> first = variablesOf(functions.get(0));
        if (first == null) {
            return shared;
        }
        for (String name : first.keySet()) {
            Object value = sharedValue(functions, function -> {
                Map<String, Object> variables = variablesOf(function);
                return variables == null ? null : variables.get(name);
            });
            if (value != null) {
                shared.put(name, Values.deepCopy(value));
            }
        }
        return shared;
    }

    private static Map<String, Object> variablesOf(Resource function) {
        Map<String, Object> environment = function.mapProperty("Environment");
        return environment == null ? null : Values.asMap(environment.get("Variables"));
    }

    private static void removeVariables(Resource function, Set<String> names) {
        Map<String, Object> environment = function.mapProperty("Environment");
        Map<String, Object> variables = environment == null ? null : Values.asMap(environment.get("Variables"));
        if (variables == null || names.isEmpty()) {
            return;
        }
        names.forEach(variables::remove);
        if (variables.isEmpty()) {
            environment.remove("Variables");
        }
        if (environment.isEmpty()) {
            function.getProperties().remove("Environment");
        }
    }

    private static Map<String, Object> childMap(Map<String, Object> parent, String key) {
        Map<String, Object> child = Values.asMap(parent.get(key));
        if (child == null) {
            child = new LinkedHashMap<>();
            parent.put(key, child);
        }
        return child;
    }
}
