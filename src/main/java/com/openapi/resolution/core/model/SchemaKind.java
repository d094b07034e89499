package com.openapi.resolution.core.model;

/**
 * Shape of a {@link ResolvedSchema}.
 */
public enum SchemaKind {
    OBJECT,
    ARRAY,
    PRIMITIVE,
    /** {@code oneOf}: exactly one variant applies. */
    UNION,
    /** {@code anyOf}: one or more variants apply. */
    FLEXIBLE_UNION,
    /** Named reference to a component schema. */
    LINK
}
