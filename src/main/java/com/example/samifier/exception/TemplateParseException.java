package com.example.samifier.exception;

/**
 * Malformed template text or an unrecognized top-level shape. Fatal, nothing is written.
 */
public class TemplateParseException extends SamifierException {
    public static final String CODE = "PARSE_ERROR";

    public TemplateParseException(String description) {
        super(CODE, description);
    }

    public TemplateParseException(String description, Throwable cause) {
        super(CODE, description, cause);
    }
}
