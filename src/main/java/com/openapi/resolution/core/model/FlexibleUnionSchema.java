package com.openapi.resolution.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * {@code anyOf}, or an OpenAPI 3.1 multi-type such as {@code type: [string, integer]}:
 * one or more variants may match.
 */
public record FlexibleUnionSchema(
        String sourceName,
        List<ResolvedSchema> variants,
        Discriminator discriminator,
        boolean nullable,
        SchemaMetadata metadata,
        Map<String, JsonNode> validationConstraints
) implements ResolvedSchema {

    public FlexibleUnionSchema {
        sourceName = ResolvedSchema.nameOrEmpty(sourceName);
        variants = List.copyOf(variants);
        metadata = metadata != null ? metadata : SchemaMetadata.empty();
        validationConstraints = ResolvedSchema.copyConstraints(validationConstraints);
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.FLEXIBLE_UNION;
    }

    @Override
    public FlexibleUnionSchema withSourceName(String name) {
        return new FlexibleUnionSchema(name, variants, discriminator, nullable, metadata, validationConstraints);
    }

    @Override
    public int sizeHint() {
        return 1 + variants.stream().mapToInt(ResolvedSchema::sizeHint).sum();
    }
}
