package com.example.samifier.fold;

import com.example.samifier.model.Resource;
import com.example.samifier.template.CdkCleaner;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Resource-level attributes of resources that a fold removes.
 *
 * Condition and the lifecycle policies change what gets deployed, so a resource carrying them
 * is not folded. DependsOn and Metadata outside the folded group are recorded as losses.
 */
public final class ResourceAttributes {

    private ResourceAttributes() {
    }

    /**
     * Reason the resource cannot be merged into {@code host}, or null when it can
     */
    public static String blocker(Resource consumed, Resource host) {
        String condition = consumed.getCondition();
        if (condition != null && (host == null || !condition.equals(host.getCondition()))) {
            return String.format("%s has Condition %s that %s does not share", consumed.getLogicalId(), condition,
                    host == null ? "its target" : host.getLogicalId());
        }
        if (!consumed.getAttributes().isEmpty()) {
            return consumed.getLogicalId() + " sets " + new ArrayList<>(consumed.getAttributes().keySet());
        }
        return null;
    }

    /**
     * First blocker among the resources, checked against the same host
     */
    public static String blocker(Collection<Resource> consumed, Resource host) {
        for (Resource resource : consumed) {
            String reason = blocker(resource, host);
            if (reason != null) {
                return reason;
            }
        }
        return null;
    }

    /**
     * Loss notes for DependsOn entries pointing outside {@code group} and for Metadata.
     * Construct path metadata only names the resource and is not reported.
     */
    public static void noteDropped(Resource consumed, Collection<String> group, FoldRewrite rewrite) {
        List<String> dependencies = new ArrayList<>();
        for (String dependency : consumed.getDependsOn()) {
            if (!group.contains(dependency)) {
                dependencies.add(dependency);
            }
        }
        if (!dependencies.isEmpty()) {
            rewrite.loss(String.format("%s: DependsOn %s is not carried over", consumed.getLogicalId(), dependencies));
        }
        List<String> metadata = new ArrayList<>();
        for (String key : consumed.getMetadata().keySet()) {
            if (!CdkCleaner.PATH_METADATA.equals(key)) {
                metadata.add(key);
            }
        }
        if (!metadata.isEmpty()) {
            rewrite.loss(String.format("%s: Metadata %s is not carried over", consumed.getLogicalId(), metadata));
        }
    }
}
