package com.example.samifier.template;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Switches for {@link CdkCleaner}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleanOptions {
    /**
     * Keep {@code aws:asset:*} metadata, needed when code assets are staged afterwards
     */
    private boolean keepAssetMetadata;

    /**
     * Drop {@code aws:cdk:path} metadata as well
     */
    private boolean stripPathMetadata;
}
