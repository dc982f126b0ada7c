package com.example.samifier.asset;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Placement decision for the code of one resource.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetRecord {

    public enum Kind { INLINE_TEXT, LOCAL_PATH, REMOTE_OBJECT }

    public enum Placement {
        /** Code stays in the template */
        INLINE,
        /** Code is written next to the template */
        STAGED,
        /** Code stays in its bucket */
        REMOTE
    }

    private String logicalId;

    private Kind kind;

    /**
     * Where the bytes came from: a local path, an s3 location or {@code inline}
     */
    private String source;

    private Placement placement;

    /**
     * SHA-256 of the staged content, null unless staged
     */
    private String digest;

    /**
     * Path relative to the output template, null unless staged
     */
    private String relativePath;

    /**
     * Logical ID that first staged identical content, null when this record owns it
     */
    private String sharedWith;
}
