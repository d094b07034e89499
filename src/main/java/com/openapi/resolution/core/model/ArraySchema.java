package com.openapi.resolution.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Objects;

public record ArraySchema(
        String sourceName,
        ResolvedSchema items,
        boolean nullable,
        SchemaMetadata metadata,
        Map<String, JsonNode> validationConstraints
) implements ResolvedSchema {

    public ArraySchema {
        Objects.requireNonNull(items, "items is required");
        sourceName = ResolvedSchema.nameOrEmpty(sourceName);
        metadata = metadata != null ? metadata : SchemaMetadata.empty();
        validationConstraints = ResolvedSchema.copyConstraints(validationConstraints);
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.ARRAY;
    }

    @Override
    public ArraySchema withSourceName(String name) {
        return new ArraySchema(name, items, nullable, metadata, validationConstraints);
    }

    @Override
    public int sizeHint() {
        return 1 + items.sizeHint();
    }
}
