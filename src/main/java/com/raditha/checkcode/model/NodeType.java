package com.raditha.checkcode.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of node in the report tree.
 * Only {@link #FUNCTION} and {@link #METHOD} are leaves carrying metrics.
 */
public enum NodeType {
    DIRECTORY,
    FILE,
    CLASS,
    FUNCTION,
    METHOD;

    /**
     * Convert a string value to NodeType.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding NodeType
     * @throws IllegalArgumentException if the value is not a known node type
     */
    public static NodeType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("NodeType value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "directory" -> DIRECTORY;
            case "file" -> FILE;
            case "class" -> CLASS;
            case "function" -> FUNCTION;
            case "method" -> METHOD;
            default -> throw new IllegalArgumentException(
                    "Invalid node type: " + value + ". Must be: directory, file, class, function or method");
        };
    }

    /**
     * Lowercase name used in the JSON report.
     */
    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    public boolean isLeaf() {
        return this == FUNCTION || this == METHOD;
    }
}
