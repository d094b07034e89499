package com.openapi.resolution.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * {@code oneOf}: exactly one of the variants matches.
 */
public record UnionSchema(
        String sourceName,
        List<ResolvedSchema> variants,
        Discriminator discriminator,
        boolean nullable,
        SchemaMetadata metadata,
        Map<String, JsonNode> validationConstraints
) implements ResolvedSchema {

    public UnionSchema {
        sourceName = ResolvedSchema.nameOrEmpty(sourceName);
        variants = List.copyOf(variants);
        metadata = metadata != null ? metadata : SchemaMetadata.empty();
        validationConstraints = ResolvedSchema.copyConstraints(validationConstraints);
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.UNION;
    }

    @Override
    public UnionSchema withSourceName(String name) {
        return new UnionSchema(name, variants, discriminator, nullable, metadata, validationConstraints);
    }

    @Override
    public int sizeHint() {
        return 1 + variants.stream().mapToInt(ResolvedSchema::sizeHint).sum();
    }
}
