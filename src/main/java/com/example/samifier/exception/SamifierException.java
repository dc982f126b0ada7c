package com.example.samifier.exception;

/**
 * Base class for every failure raised while refactoring a template.
 *
 * The code is stable and machine readable; the REST controller and the command
 * line runner map it to an HTTP status or an exit code respectively.
 */
public class SamifierException extends RuntimeException {
    private final String code;
    private final String description;

    public SamifierException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public SamifierException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
