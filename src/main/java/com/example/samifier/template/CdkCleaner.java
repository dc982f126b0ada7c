package com.example.samifier.template;

import com.example.samifier.model.Resource;
import com.example.samifier.model.TemplateDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Removes the bookkeeping the CDK adds to every synthesized template.
 *
 * Running it twice gives the same document as running it once.
 */
@Slf4j
@Component
public class CdkCleaner {
    public static final String CDK_METADATA_TYPE = "AWS::CDK::Metadata";
    public static final String CDK_METADATA_CONDITION = "CDKMetadataAvailable";
    public static final String BOOTSTRAP_PARAMETER = "BootstrapVersion";
    public static final String BOOTSTRAP_RULE = "CheckBootstrapVersion";
    public static final String ASSET_PARAMETER_PREFIX = "AssetParameters";
    public static final String ASSET_METADATA_PREFIX = "aws:asset:";
    public static final String PATH_METADATA = "aws:cdk:path";

    /**
     * @return human readable notes about what was removed, in removal order
     */
    public List<String> clean(TemplateDocument document, CleanOptions options) {
        List<String> notes = new ArrayList<>();

        for (Resource resource : document.resourcesOfType(CDK_METADATA_TYPE)) {
            document.removeResource(resource.getLogicalId());
            notes.add("Removed CDK metadata resource " + resource.getLogicalId());
        }

        Map<String, Object> rules = document.sectionMap(TemplateDocument.RULES);
        if (rules.containsKey(BOOTSTRAP_RULE)) {
            document.mutableSection(TemplateDocument.RULES).remove(BOOTSTRAP_RULE);
            notes.add("Removed rule " + BOOTSTRAP_RULE);
        }

        ReferenceIndex index = ReferenceIndex.build(document);
        if (document.hasCondition(CDK_METADATA_CONDITION) && index.conditionSitesFor(CDK_METADATA_CONDITION).isEmpty()) {
            document.mutableSection(TemplateDocument.CONDITIONS).remove(CDK_METADATA_CONDITION);
            notes.add("Removed condition " + CDK_METADATA_CONDITION);
        }
        if (document.getParameters().containsKey(BOOTSTRAP_PARAMETER) && index.sitesFor(BOOTSTRAP_PARAMETER).isEmpty()) {
            document.mutableSection(TemplateDocument.PARAMETERS).remove(BOOTSTRAP_PARAMETER);
            notes.add("Removed parameter " + BOOTSTRAP_PARAMETER);
        }

        removeAssetParameters(document, index, notes);
        stripResourceMetadata(document, options, notes);

        document.pruneEmptySections(TemplateDocument.PARAMETERS, TemplateDocument.CONDITIONS,
                TemplateDocument.RULES, TemplateDocument.OUTPUTS);
        log.debug("CDK cleanup produced {} note(s)", notes.size());
        return notes;
    }

    /**
     * CDK v1 passed asset locations as parameters; their references become readable placeholders
     */
    private void removeAssetParameters(TemplateDocument document, ReferenceIndex index, List<String> notes) {
        List<String> names = new ArrayList<>();
        for (String name : document.getParameters().keySet()) {
            if (name.startsWith(ASSET_PARAMETER_PREFIX)) {
                names.add(name);
            }
        }
        for (String name : names) {
            List<ReferenceSite> sites = index.sitesFor(name);
            boolean replaceable = true;
            for (ReferenceSite site : sites) {
                if (site.getKind() != ReferenceKind.REF && site.getKind() != ReferenceKind.SUB) {
                    replaceable = false;
                }
            }
            if (!replaceable) {
                log.warn("Keeping asset parameter {} because it is referenced through an unsupported form", name);
                continue;
            }
            String placeholder = placeholderFor(name);
            for (ReferenceSite site : sites) {
                ReferenceRewriter.replaceWithLiteral(document, site, placeholder);
            }
            document.mutableSection(TemplateDocument.PARAMETERS).remove(name);
            notes.add("Replaced asset parameter " + name + " with " + placeholder);
        }
    }

    static String placeholderFor(String parameterName) {
        if (parameterName.contains("S3Bucket")) {
            return "<asset-bucket>";
        }
        if (parameterName.contains("S3VersionKey")) {
            return "<asset-key>";
        }
        if (parameterName.contains("ArtifactHash")) {
            return "<asset-hash>";
        }
        return "<asset-param>";
    }

    private void stripResourceMetadata(TemplateDocument document, CleanOptions options, List<String> notes) {
        int stripped = 0;
        for (Resource resource : document.getResources().values()) {
            Iterator<String> keys = resource.getMetadata().keySet().iterator();
            while (keys.hasNext()) {
                String key = keys.next();
                boolean asset = key.startsWith(ASSET_METADATA_PREFIX) && !options.isKeepAssetMetadata();
                boolean path = PATH_METADATA.equals(key) && options.isStripPathMetadata();
                if (asset || path) {
                    keys.remove();
                    stripped++;
                }
            }
        }
        if (stripped > 0) {
            notes.add("Stripped " + stripped + " CDK metadata entr" + (stripped == 1 ? "y" : "ies"));
        }
    }
}
