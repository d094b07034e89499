package com.openapi.resolution.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Discriminator of a polymorphic schema: the tag property and the mapping from
 * tag value to component schema name, in declaration order.
 */
public record Discriminator(String propertyName, Map<String, String> mapping) {

    public Discriminator {
        Objects.requireNonNull(propertyName, "propertyName is required");
        mapping = mapping != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(mapping))
                : Map.of();
    }
}
