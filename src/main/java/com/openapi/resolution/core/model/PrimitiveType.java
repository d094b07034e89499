package com.openapi.resolution.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Scalar OpenAPI types. {@code ANY} stands for an unconstrained schema ({@code {}}).
 */
public enum PrimitiveType {
    STRING, INTEGER, NUMBER, BOOLEAN, ANY;

    /**
     * Maps an OpenAPI {@code type} value to a primitive type.
     *
     * @return empty for {@code object}, {@code array}, {@code null} and unknown names
     */
    public static Optional<PrimitiveType> fromOpenApi(String type) {
        if (type == null) {
            return Optional.empty();
        }
        switch (type.toLowerCase(Locale.ROOT)) {
            case "string":
                return Optional.of(STRING);
            case "integer":
                return Optional.of(INTEGER);
            case "number":
                return Optional.of(NUMBER);
            case "boolean":
                return Optional.of(BOOLEAN);
            default:
                return Optional.empty();
        }
    }

    public String openApiName() {
        return this == ANY ? "" : name().toLowerCase(Locale.ROOT);
    }
}
