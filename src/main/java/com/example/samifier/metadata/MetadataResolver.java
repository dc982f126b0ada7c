package com.example.samifier.metadata;

import com.example.samifier.model.Resource;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.rename.CollisionStrategy;
import com.example.samifier.rename.RenameEntry;
import com.example.samifier.rename.RenamePlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Derives semantic logical IDs from CDK construct paths.
 *
 * IDs are processed in sorted order, so the same template and bundle always produce the same plan.
 * A candidate already taken gets the resource type suffix, then a counter starting at 2.
 */
@Slf4j
@Component
public class MetadataResolver {

    public RenamePlan resolve(TemplateDocument document, CdkMetadataBundle bundle) {
        if (bundle == null || bundle.isEmpty()) {
            log.info("No CDK metadata available, logical IDs are kept as they are");
            return RenamePlan.skipped();
        }

        Set<String> known = new TreeSet<>();
        Set<String> taken = new HashSet<>(document.getParameters().keySet());
        for (String logicalId : document.getResources().keySet()) {
            if (bundle.lookup(logicalId).isPresent()) {
                known.add(logicalId);
            } else {
                taken.add(logicalId);
            }
        }

        List<RenameEntry> entries = new ArrayList<>();
        for (String logicalId : known) {
            ConstructInfo info = bundle.lookup(logicalId).get();
            Resource resource = document.getResource(logicalId);
            String candidate = ConstructNames.candidateFor(info.getPath());

            String chosen = candidate;
            CollisionStrategy strategy = CollisionStrategy.NONE;
            if (taken.contains(chosen)) {
                String suffix = ConstructNames.typeSuffix(resource.getType());
                String base = candidate.endsWith(suffix) ? candidate : candidate + suffix;
                chosen = base;
                strategy = CollisionStrategy.TYPE_SUFFIX;
                int counter = 2;
                while (taken.contains(chosen)) {
                    chosen = base + counter++;
                    strategy = CollisionStrategy.COUNTER;
                }
                log.debug("Candidate {} for {} is taken, using {}", candidate, logicalId, chosen);
            }
            taken.add(chosen);

            if (!chosen.equals(logicalId)) {
                entries.add(RenameEntry.builder()
                        .oldId(logicalId)
                        .newId(chosen)
                        .constructPath(info.getPath())
                        .candidate(candidate)
                        .strategy(strategy)
                        .build());
            }
        }
        log.info("Resolved {} rename(s) from {} construct path(s) ({})", entries.size(), known.size(), bundle.getSource());
        return RenamePlan.of(entries);
    }
}
