package com.example.samifier.exception;

/**
 * Writing the template, plan or staged assets failed.
 */
public class OutputWriteException extends SamifierException {
    public static final String CODE = "OUTPUT_FAILED";

    public OutputWriteException(String description) {
        super(CODE, description);
    }

    public OutputWriteException(String description, Throwable cause) {
        super(CODE, description, cause);
    }
}
