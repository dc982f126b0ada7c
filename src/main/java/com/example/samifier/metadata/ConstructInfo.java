package com.example.samifier.metadata;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What the CDK recorded about one synthesized resource.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConstructInfo {
    private String logicalId;

    /**
     * Construct path, e.g. {@code /OrdersStack/OrdersTable/Resource}
     */
    private String path;

    /**
     * CloudFormation type from tree.json, null when only the manifest was available
     */
    private String resourceType;

    /**
     * Cloud assembly artifact the entry came from
     */
    private String stackName;
}
