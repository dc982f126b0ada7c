package com.example.samifier.template;

import com.example.samifier.model.NodePath;
import com.example.samifier.model.TemplateDocument;
import lombok.Builder;
import lombok.Value;

/**
 * One occurrence of a logical ID or condition name inside the template.
 */
@Value
@Builder
public class ReferenceSite {
    ReferenceKind kind;

    String target;

    /**
     * Attribute of a GetAtt or {@code ${Name.Attr}} placeholder, null otherwise
     */
    String attribute;

    /**
     * For REF, GET_ATT and SUB the path of the intrinsic node, otherwise the path of the string holding the name
     */
    NodePath path;

    /**
     * Placeholder position inside the Fn::Sub template, -1 for other kinds
     */
    @Builder.Default
    int segmentIndex = -1;

    /**
     * Logical ID of the resource containing the site, null when it lives outside the Resources section
     */
    public String getOwnerResource() {
        if (path.size() >= 2 && TemplateDocument.RESOURCES.equals(path.get(0))) {
            return (String) path.get(1);
        }
        return null;
    }

    /**
     * Top-level owner, e.g. {@code MyBucket} or {@code Outputs.BucketName}
     */
    public String getOwner() {
        String resource = getOwnerResource();
        if (resource != null) {
            return resource;
        }
        return path.size() >= 2 ? path.get(0) + "." + path.get(1) : String.valueOf(path.get(0));
    }
}
