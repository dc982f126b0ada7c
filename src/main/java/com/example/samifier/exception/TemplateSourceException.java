package com.example.samifier.exception;

/**
 * The template text could not be read from a file or fetched from a deployed stack.
 */
public class TemplateSourceException extends SamifierException {
    public static final String CODE = "SOURCE_UNAVAILABLE";

    public TemplateSourceException(String description) {
        super(CODE, description);
    }

    public TemplateSourceException(String description, Throwable cause) {
        super(CODE, description, cause);
    }
}
