package com.openapi.resolution.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Documentation keywords carried through resolution for the generator.
 * Any field may be null.
 */
public record SchemaMetadata(String title, String description, JsonNode example,
                             JsonNode defaultValue, boolean deprecated) {

    private static final SchemaMetadata EMPTY = new SchemaMetadata(null, null, null, null, false);

    public static SchemaMetadata empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return equals(EMPTY);
    }

    /**
     * Fills the fields this metadata lacks from {@code other}; fields already set win.
     */
    public SchemaMetadata orElse(SchemaMetadata other) {
        if (other == null) {
            return this;
        }
        return new SchemaMetadata(
                title != null ? title : other.title,
                description != null ? description : other.description,
                example != null ? example : other.example,
                defaultValue != null ? defaultValue : other.defaultValue,
                deprecated || other.deprecated);
    }
}
