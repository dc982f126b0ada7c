package com.example.samifier.exception;

/**
 * CDK build metadata (manifest.json, tree.json) is missing or unreadable.
 */
public class MetadataLoadingException extends SamifierException {
    public static final String CODE = "METADATA_INVALID";

    public MetadataLoadingException(String description) {
        super(CODE, description);
    }

    public MetadataLoadingException(String description, Throwable cause) {
        super(CODE, description, cause);
    }
}
