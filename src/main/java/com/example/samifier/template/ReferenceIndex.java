package com.example.samifier.template;

import com.example.samifier.model.ConditionRef;
import com.example.samifier.model.FnCall;
import com.example.samifier.model.GetAtt;
import com.example.samifier.model.NodePath;
import com.example.samifier.model.Ref;
import com.example.samifier.model.Resource;
import com.example.samifier.model.Sub;
import com.example.samifier.model.SubTemplate;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.util.Values;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Every place a logical ID or condition name is referenced, with a navigable path.
 *
 * The index is a snapshot: rebuild it after a pass that changes the document structure.
 * Cycles (self references, mutual GetAtt chains) are recorded like any other edge.
 */
public class ReferenceIndex {
    private final List<ReferenceSite> sites;

    private ReferenceIndex(List<ReferenceSite> sites) {
        this.sites = Collections.unmodifiableList(sites);
    }

    public static ReferenceIndex build(TemplateDocument document) {
        List<ReferenceSite> sites = new ArrayList<>();
        NodePath conditions = NodePath.of(TemplateDocument.CONDITIONS);
        for (Map.Entry<String, Object> entry : document.getConditions().entrySet()) {
            walk(entry.getValue(), conditions.child(entry.getKey()), sites);
        }

        for (Resource resource : document.getResources().values()) {
            NodePath base = NodePath.of(TemplateDocument.RESOURCES, resource.getLogicalId());
            if (resource.getCondition() != null) {
                sites.add(nameSite(ReferenceKind.CONDITION, resource.getCondition(), base.child(Resource.CONDITION)));
            }
            List<String> dependsOn = resource.getDependsOn();
            for (int i = 0; i < dependsOn.size(); i++) {
                sites.add(nameSite(ReferenceKind.DEPENDS_ON, dependsOn.get(i), base.child(Resource.DEPENDS_ON).child(i)));
            }
            walk(resource.getMetadata(), base.child(Resource.METADATA), sites);
            walk(resource.getProperties(), base.child(Resource.PROPERTIES), sites);
            for (Map.Entry<String, Object> attribute : resource.getAttributes().entrySet()) {
                walk(attribute.getValue(), base.child(attribute.getKey()), sites);
            }
        }

        NodePath outputs = NodePath.of(TemplateDocument.OUTPUTS);
        for (Map.Entry<String, Object> entry : document.getOutputs().entrySet()) {
            NodePath outputPath = outputs.child(entry.getKey());
            Map<String, Object> output = Values.asMap(entry.getValue());
            if (output == null) {
                continue;
            }
            for (Map.Entry<String, Object> field : output.entrySet()) {
                if (Resource.CONDITION.equals(field.getKey()) && field.getValue() instanceof String) {
                    sites.add(nameSite(ReferenceKind.CONDITION, (String) field.getValue(), outputPath.child(field.getKey())));
                } else {
                    walk(field.getValue(), outputPath.child(field.getKey()), sites);
                }
            }
        }

        NodePath rules = NodePath.of(TemplateDocument.RULES);
        for (Map.Entry<String, Object> entry : document.sectionMap(TemplateDocument.RULES).entrySet()) {
            walk(entry.getValue(), rules.child(entry.getKey()), sites);
        }
        return new ReferenceIndex(sites);
    }

    private static ReferenceSite nameSite(ReferenceKind kind, String target, NodePath path) {
        return ReferenceSite.builder().kind(kind).target(target).path(path).build();
    }

    @SuppressWarnings("unchecked")
    private static void walk(Object value, NodePath path, List<ReferenceSite> sites) {
        if (value instanceof Ref) {
            Ref ref = (Ref) value;
            if (!ref.isPseudo()) {
                sites.add(nameSite(ReferenceKind.REF, ref.getTarget(), path));
            }
        } else if (value instanceof GetAtt) {
            GetAtt getAtt = (GetAtt) value;
            sites.add(ReferenceSite.builder()
                    .kind(ReferenceKind.GET_ATT)
                    .target(getAtt.getLogicalId())
                    .attribute(Values.asString(getAtt.getAttribute()))
                    .path(path)
                    .build());
            walk(getAtt.getAttribute(), path.child(NodePath.ATTR), sites);
        } else if (value instanceof Sub) {
            Sub sub = (Sub) value;
            SubTemplate template = sub.getTemplate();
            for (int index : template.referenceIndices()) {
                SubTemplate.Segment segment = template.segment(index);
                if (sub.hasVariable(segment.getText())) {
                    continue;
                }
                sites.add(ReferenceSite.builder()
                        .kind(ReferenceKind.SUB)
                        .target(segment.getText())
                        .attribute(segment.getAttribute())
                        .path(path)
                        .segmentIndex(index)
                        .build());
            }
            if (sub.getVariables() != null) {
                NodePath vars = path.child(NodePath.VARS);
                for (Map.Entry<String, Object> entry : sub.getVariables().entrySet()) {
                    walk(entry.getValue(), vars.child(entry.getKey()), sites);
                }
            }
        } else if (value instanceof ConditionRef) {
            sites.add(nameSite(ReferenceKind.CONDITION, ((ConditionRef) value).getName(), path));
        } else if (value instanceof FnCall) {
            FnCall call = (FnCall) value;
            NodePath args = path.child(NodePath.ARGS);
            String condition = call.getIfCondition();
            if (condition != null) {
                sites.add(nameSite(ReferenceKind.CONDITION, condition, args.child(0)));
                List<Object> branches = (List<Object>) call.getArgument();
                for (int i = 1; i < branches.size(); i++) {
                    walk(branches.get(i), args.child(i), sites);
                }
            } else {
                walk(call.getArgument(), args, sites);
            }
        } else if (value instanceof Map) {
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
                walk(entry.getValue(), path.child(entry.getKey()), sites);
            }
        } else if (value instanceof List) {
            List<Object> list = (List<Object>) value;
            for (int i = 0; i < list.size(); i++) {
                walk(list.get(i), path.child(i), sites);
            }
        }
    }

    public List<ReferenceSite> getSites() {
        return sites;
    }

    /**
     * Sites naming the logical ID (resource or parameter namespace)
     */
    public List<ReferenceSite> sitesFor(String logicalId) {
        List<ReferenceSite> matching = new ArrayList<>();
        for (ReferenceSite site : sites) {
            if (!site.getKind().targetsCondition() && logicalId.equals(site.getTarget())) {
                matching.add(site);
            }
        }
        return matching;
    }

    public List<ReferenceSite> conditionSitesFor(String conditionName) {
        List<ReferenceSite> matching = new ArrayList<>();
        for (ReferenceSite site : sites) {
            if (site.getKind().targetsCondition() && conditionName.equals(site.getTarget())) {
                matching.add(site);
            }
        }
        return matching;
    }

    /**
     * Owners (resource IDs or {@code Section.Name}) that reference the logical ID other than through DependsOn
     */
    public Set<String> referrersOf(String logicalId) {
        Set<String> owners = new TreeSet<>();
        for (ReferenceSite site : sitesFor(logicalId)) {
            if (site.getKind() != ReferenceKind.DEPENDS_ON) {
                owners.add(site.getOwner());
            }
        }
        return owners;
    }

    /**
     * Whether anything outside the allowed owners references the logical ID (DependsOn excluded)
     */
    public boolean isReferencedOutside(String logicalId, Collection<String> allowedOwners) {
        for (String owner : referrersOf(logicalId)) {
            if (!allowedOwners.contains(owner)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Resource to referenced-resource edges; self loops and cycles are kept
     */
    public Map<String, Set<String>> dependencyGraph(TemplateDocument document) {
        Map<String, Set<String>> graph = new TreeMap<>();
        for (String logicalId : document.getResources().keySet()) {
            graph.put(logicalId, new LinkedHashSet<>());
        }
        for (ReferenceSite site : sites) {
            String owner = site.getOwnerResource();
            if (owner != null && !site.getKind().targetsCondition() && document.hasResource(site.getTarget())) {
                graph.get(owner).add(site.getTarget());
            }
        }
        return graph;
    }

    /**
     * Sites that still name an ID from the retired set (resources and conditions)
     */
    public List<ReferenceSite> dangling(Set<String> retiredIds, Set<String> retiredConditions) {
        List<ReferenceSite> dangling = new ArrayList<>();
        for (ReferenceSite site : sites) {
            Set<String> retired = site.getKind().targetsCondition() ? retiredConditions : retiredIds;
            if (retired.contains(site.getTarget())) {
                dangling.add(site);
            }
        }
        return dangling;
    }
}
