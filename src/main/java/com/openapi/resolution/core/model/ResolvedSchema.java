package com.openapi.resolution.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fully resolved schema: no raw {@code $ref} remains, compositions are expanded and
 * recursion is expressed through {@link SchemaLink}s to named component schemas.
 *
 * <p>Instances are immutable and safe to share between threads and between catalog
 * entries.</p>
 */
public sealed interface ResolvedSchema
        permits ObjectSchema, ArraySchema, PrimitiveSchema, UnionSchema, FlexibleUnionSchema, SchemaLink {

    SchemaKind kind();

    /**
     * Name of the component schema this was resolved from, empty when anonymous.
     */
    String sourceName();

    boolean nullable();

    SchemaMetadata metadata();

    /**
     * Keywords that do not shape the type ({@code minLength}, {@code pattern}, {@code enum},
     * {@code x-*} extensions, ...) in declaration order.
     */
    Map<String, JsonNode> validationConstraints();

    /**
     * Returns a copy carrying the given source name.
     */
    ResolvedSchema withSourceName(String name);

    /**
     * Number of model nodes reachable without following links.
     */
    int sizeHint();

    default boolean isAnonymous() {
        return sourceName().isEmpty();
    }

    /**
     * Returns the {@code enum} values, or an empty list when the schema is not an enumeration.
     */
    default List<JsonNode> enumValues() {
        JsonNode values = validationConstraints().get("enum");
        if (values == null || !values.isArray()) {
            return List.of();
        }
        List<JsonNode> result = new ArrayList<>(values.size());
        values.forEach(result::add);
        return Collections.unmodifiableList(result);
    }

    static Map<String, JsonNode> copyConstraints(Map<String, JsonNode> constraints) {
        if (constraints == null || constraints.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(constraints));
    }

    static String nameOrEmpty(String name) {
        return name != null ? name : "";
    }
}
