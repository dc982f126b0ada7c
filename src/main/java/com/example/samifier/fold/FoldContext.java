package com.example.samifier.fold;

import com.example.samifier.model.Resource;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.template.ReferenceIndex;
import com.example.samifier.util.Values;

import java.util.ArrayList;
import java.util.List;

/**
 * The document being folded plus a reference index kept in step with it.
 */
public class FoldContext {
    public static final String LAMBDA_FUNCTION = "AWS::Lambda::Function";
    public static final String SERVERLESS_FUNCTION = "AWS::Serverless::Function";
    public static final String LAMBDA_PERMISSION = "AWS::Lambda::Permission";

    private final TemplateDocument document;
    private ReferenceIndex index;
    private final List<String> annotations = new ArrayList<>();

    public FoldContext(TemplateDocument document) {
        this.document = document;
        this.index = ReferenceIndex.build(document);
    }

    public TemplateDocument getDocument() {
        return document;
    }

    public ReferenceIndex getIndex() {
        return index;
    }

    /**
     * Rebuilds the index after the document changed
     */
    public void refresh() {
        index = ReferenceIndex.build(document);
    }

    /**
     * Records why a candidate was left raw
     */
    public void annotate(String rule, String message) {
        annotations.add("[" + rule + "] " + message);
    }

    public List<String> getAnnotations() {
        return annotations;
    }

    public Resource resource(String logicalId) {
        return logicalId == null ? null : document.getResource(logicalId);
    }

    /**
     * Resource of the given type that the value points at directly, or null
     */
    public Resource target(Object value, String type) {
        Resource resource = resource(Values.directTarget(value));
        return resource != null && resource.isType(type) ? resource : null;
    }

    /**
     * Lambda function, raw or already folded, that the value points at directly
     */
    public String functionTarget(Object value) {
        Resource resource = resource(Values.directTarget(value));
        if (resource != null && (resource.isType(LAMBDA_FUNCTION) || resource.isType(SERVERLESS_FUNCTION))) {
            return resource.getLogicalId();
        }
        return null;
    }

    /**
     * Invoke permissions granted to a service principal for the function
     */
    public List<Resource> permissionsFor(String functionId, String principal) {
        List<Resource> permissions = new ArrayList<>();
        for (Resource permission : document.resourcesOfType(LAMBDA_PERMISSION)) {
            if (principal.equals(permission.stringProperty("Principal"))
                    && functionId.equals(functionTarget(permission.property("FunctionName")))) {
                permissions.add(permission);
            }
        }
        return permissions;
    }

    /**
     * Function in the current document that can receive SAM events
     */
    public Resource foldedFunction(String functionId) {
        Resource function = resource(functionId);
        return function != null && function.isType(SERVERLESS_FUNCTION) ? function : null;
    }
}
