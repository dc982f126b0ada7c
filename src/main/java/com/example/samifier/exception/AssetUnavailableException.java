package com.example.samifier.exception;

/**
 * The bytes of a code asset could not be obtained, so the template would not build.
 */
public class AssetUnavailableException extends SamifierException {
    public static final String CODE = "ASSET_UNAVAILABLE";

    public AssetUnavailableException(String description) {
        super(CODE, description);
    }

    public AssetUnavailableException(String description, Throwable cause) {
        super(CODE, description, cause);
    }
}
