package com.openapi.resolution.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Objects;

/**
 * Scalar schema. {@code format} is {@code null} when absent.
 */
public record PrimitiveSchema(
        String sourceName,
        PrimitiveType type,
        String format,
        boolean nullable,
        SchemaMetadata metadata,
        Map<String, JsonNode> validationConstraints
) implements ResolvedSchema {

    public PrimitiveSchema {
        Objects.requireNonNull(type, "type is required");
        sourceName = ResolvedSchema.nameOrEmpty(sourceName);
        metadata = metadata != null ? metadata : SchemaMetadata.empty();
        validationConstraints = ResolvedSchema.copyConstraints(validationConstraints);
    }

    public static PrimitiveSchema of(PrimitiveType type) {
        return new PrimitiveSchema("", type, null, false, SchemaMetadata.empty(), Map.of());
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.PRIMITIVE;
    }

    @Override
    public PrimitiveSchema withSourceName(String name) {
        return new PrimitiveSchema(name, type, format, nullable, metadata, validationConstraints);
    }

    @Override
    public int sizeHint() {
        return 1;
    }
}
