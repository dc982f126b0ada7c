package com.example.samifier.rename;

import com.example.samifier.exception.ReferenceDanglingException;
import com.example.samifier.exception.RenameConflictException;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.template.ReferenceIndex;
import com.example.samifier.template.ReferenceRewriter;
import com.example.samifier.template.ReferenceSite;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Applies a {@link RenamePlan} to a document.
 *
 * The plan is validated as a whole before anything is touched, so a conflicting plan leaves
 * the document exactly as it was. Only identifiers change: resource types and literal
 * property values are never rewritten.
 */
@Slf4j
@Component
public class Renamer {
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9]{1,255}");

    /**
     * @return number of reference sites rewritten
     */
    public int apply(TemplateDocument document, RenamePlan plan) {
        if (plan.isEmpty()) {
            return 0;
        }
        Map<String, String> resourceIds = plan.mapping(RenameEntry.Kind.RESOURCE);
        Map<String, String> conditionNames = plan.mapping(RenameEntry.Kind.CONDITION);

        validate(resourceIds, document.getResources().keySet(), document.getLogicalIds(), "resource");
        validate(conditionNames, document.getConditions().keySet(), document.getConditions().keySet(), "condition");

        ReferenceIndex index = ReferenceIndex.build(document);
        int rewritten = ReferenceRewriter.renameAll(document, index.getSites(), resourceIds, conditionNames);
        document.renameResources(resourceIds);
        document.renameConditions(conditionNames);
        log.info("Renamed {} resource(s) and {} condition(s), {} reference site(s) rewritten",
                resourceIds.size(), conditionNames.size(), rewritten);

        verify(document, resourceIds, conditionNames);
        return rewritten;
    }

    private void validate(Map<String, String> mapping, Set<String> renamable, Set<String> namespace, String kind) {
        Map<String, String> claimedBy = new HashMap<>();
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            String oldId = entry.getKey();
            String newId = entry.getValue();
            if (!renamable.contains(oldId)) {
                throw new RenameConflictException(String.format("Cannot rename unknown %s '%s'", kind, oldId));
            }
            if (newId == null || !VALID_ID.matcher(newId).matches()) {
                throw new RenameConflictException(String.format("'%s' is not a valid logical ID (renaming %s)", newId, oldId));
            }
            String previous = claimedBy.put(newId, oldId);
            if (previous != null) {
                throw new RenameConflictException(String.format("Both '%s' and '%s' would be renamed to '%s'",
                        previous, oldId, newId));
            }
            if (!newId.equals(oldId) && namespace.contains(newId) && !mapping.containsKey(newId)) {
                throw new RenameConflictException(String.format("Renaming '%s' to '%s' collides with an existing %s",
                        oldId, newId, kind));
            }
        }
    }

    private void verify(TemplateDocument document, Map<String, String> resourceIds, Map<String, String> conditionNames) {
        Set<String> retiredIds = new HashSet<>(resourceIds.keySet());
        retiredIds.removeAll(document.getLogicalIds());
        Set<String> retiredConditions = new HashSet<>(conditionNames.keySet());
        retiredConditions.removeAll(document.getConditions().keySet());

        List<ReferenceSite> dangling = ReferenceIndex.build(document).dangling(retiredIds, retiredConditions);
        if (!dangling.isEmpty()) {
            ReferenceSite first = dangling.get(0);
            throw new ReferenceDanglingException(String.format("%d reference(s) still name a renamed ID, first: %s at %s",
                    dangling.size(), first.getTarget(), first.getPath()));
        }
    }
}
