package com.example.samifier.model;

/**
 * Serialization format of the refactored template
 */
public enum OutputFormat {
    YAML,
    JSON
}
