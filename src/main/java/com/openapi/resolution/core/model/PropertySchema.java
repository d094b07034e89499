package com.openapi.resolution.core.model;

import java.util.Objects;

/**
 * A resolved object property and whether the owning object requires it.
 */
public record PropertySchema(ResolvedSchema schema, boolean required) {

    public PropertySchema {
        Objects.requireNonNull(schema, "schema is required");
    }

    public PropertySchema asRequired() {
        return required ? this : new PropertySchema(schema, true);
    }
}
