package com.example.samifier.template;

import com.example.samifier.model.ConditionRef;
import com.example.samifier.model.GetAtt;
import com.example.samifier.model.Ref;
import com.example.samifier.model.Sub;
import com.example.samifier.model.TemplateDocument;

import java.util.List;
import java.util.Map;

/**
 * Rewrites reference sites in place, using the paths recorded by {@link ReferenceIndex}.
 */
public final class ReferenceRewriter {

    private ReferenceRewriter() {
    }

    /**
     * Applies both mappings to every matching site. Sites are located before any rewrite so swaps are safe.
     */
    public static int renameAll(TemplateDocument document, List<ReferenceSite> sites,
                                Map<String, String> resourceIds, Map<String, String> conditionNames) {
        int rewritten = 0;
        for (ReferenceSite site : sites) {
            Map<String, String> mapping = site.getKind().targetsCondition() ? conditionNames : resourceIds;
            String newName = mapping.get(site.getTarget());
            if (newName != null && !newName.equals(site.getTarget())) {
                rename(document, site, newName);
                rewritten++;
            }
        }
        return rewritten;
    }

    public static void rename(TemplateDocument document, ReferenceSite site, String newName) {
        Object node = document.valueAt(site.getPath());
        switch (site.getKind()) {
            case REF:
                ((Ref) node).setTarget(newName);
                break;
            case GET_ATT:
                ((GetAtt) node).setLogicalId(newName);
                break;
            case SUB:
                ((Sub) node).getTemplate().renamePlaceholder(site.getSegmentIndex(), newName);
                break;
            case CONDITION:
                if (node instanceof ConditionRef) {
                    ((ConditionRef) node).setName(newName);
                } else {
                    document.replaceAt(site.getPath(), newName);
                }
                break;
            case DEPENDS_ON:
            default:
                document.replaceAt(site.getPath(), newName);
        }
    }

    /**
     * Replaces a Ref or Fn::Sub placeholder with fixed text, e.g. a folded stage becomes its stage name
     */
    public static void replaceWithLiteral(TemplateDocument document, ReferenceSite site, String literal) {
        switch (site.getKind()) {
            case REF:
                document.replaceAt(site.getPath(), literal);
                break;
            case SUB:
                ((Sub) document.valueAt(site.getPath())).getTemplate().replaceWithLiteral(site.getSegmentIndex(), literal);
                break;
            default:
                throw new IllegalStateException("Cannot replace a " + site.getKind() + " reference with a literal at " + site.getPath());
        }
    }
}
