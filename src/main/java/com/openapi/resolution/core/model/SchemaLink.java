package com.openapi.resolution.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Objects;

/**
 * Named reference to a component schema, emitted where a property, array item or
 * operation schema points at {@code #/components/schemas/<name>}. The target itself
 * is available from the catalog under {@link #targetName()}.
 *
 * <p>{@code nullable} and {@code metadata} come from the referring site, e.g.
 * {@code parent: {allOf: [{$ref: Node}], nullable: true, description: ...}}.</p>
 */
public record SchemaLink(String targetName, String pointer, boolean nullable, SchemaMetadata metadata)
        implements ResolvedSchema {

    public SchemaLink {
        Objects.requireNonNull(targetName, "targetName is required");
        Objects.requireNonNull(pointer, "pointer is required");
        metadata = metadata != null ? metadata : SchemaMetadata.empty();
    }

    public SchemaLink(String targetName, String pointer) {
        this(targetName, pointer, false, SchemaMetadata.empty());
    }

    public static SchemaLink to(String componentName) {
        return new SchemaLink(componentName, SchemaReference.toComponent(componentName).pointer());
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.LINK;
    }

    /**
     * A link is named after its target.
     */
    @Override
    public String sourceName() {
        return targetName;
    }

    @Override
    public Map<String, JsonNode> validationConstraints() {
        return Map.of();
    }

    /**
     * Links always carry their target's name; renaming is a no-op.
     */
    @Override
    public SchemaLink withSourceName(String name) {
        return this;
    }

    @Override
    public int sizeHint() {
        return 1;
    }
}
