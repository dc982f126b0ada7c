package com.example.samifier.exception;

/**
 * A reference still points at a logical ID that a rename or fold retired.
 */
public class ReferenceDanglingException extends SamifierException {
    public static final String CODE = "REFERENCE_DANGLING";

    public ReferenceDanglingException(String description) {
        super(CODE, description);
    }

    public ReferenceDanglingException(String description, Throwable cause) {
        super(CODE, description, cause);
    }
}
