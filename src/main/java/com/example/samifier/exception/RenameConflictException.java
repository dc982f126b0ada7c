package com.example.samifier.exception;

/**
 * A rename plan would introduce a duplicate logical ID or names an unknown resource.
 */
public class RenameConflictException extends SamifierException {
    public static final String CODE = "RENAME_CONFLICT";

    public RenameConflictException(String description) {
        super(CODE, description);
    }

    public RenameConflictException(String description, Throwable cause) {
        super(CODE, description, cause);
    }
}
