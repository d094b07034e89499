package com.openapi.resolution.compose;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.resolution.core.model.SchemaReference;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Keyword sets and node predicates shared by the composer and the dependency graph.
 */
final class SchemaKeywords {

    static final String REF = "$ref";
    static final String ALL_OF = "allOf";
    static final String ONE_OF = "oneOf";
    static final String ANY_OF = "anyOf";

    static final Set<String> METADATA = Set.of("title", "description", "example", "default", "deprecated");

    /** Keywords that decide the shape of a schema; never copied into validation constraints. */
    static final Set<String> SHAPE = Set.of(REF, ALL_OF, ONE_OF, ANY_OF, "type", "nullable", "discriminator",
            "properties", "required", "additionalProperties", "items");

    private SchemaKeywords() {
    }

    static boolean isReference(JsonNode node) {
        return node.isObject() && node.path(REF).isTextual();
    }

    /**
     * Returns the component a node at a property, item or operation position links to, if any:
     * either a plain {@code $ref} to {@code #/components/schemas/X} or a single-branch
     * {@code allOf} wrapper around one that only adds metadata or {@code nullable}. A wrapper
     * carrying any other sibling keyword is composed instead so its constraints survive.
     */
    static Optional<SchemaReference> linkTarget(JsonNode node) {
        if (!node.isObject()) {
            return Optional.empty();
        }
        if (isReference(node)) {
            return componentReference(node.get(REF).asText());
        }
        JsonNode allOf = node.get(ALL_OF);
        if (allOf == null || !allOf.isArray() || allOf.size() != 1 || !isReference(allOf.get(0))) {
            return Optional.empty();
        }
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!name.equals(ALL_OF) && !name.equals("nullable") && !METADATA.contains(name)) {
                return Optional.empty();
            }
        }
        return componentReference(allOf.get(0).get(REF).asText());
    }

    /**
     * Returns the union keyword that drives a node's composition, if the node is a plain
     * {@code oneOf} or {@code anyOf} with no {@code $ref} or {@code allOf} taking precedence.
     */
    static Optional<String> unionKeyword(JsonNode node) {
        if (!node.isObject() || node.has(REF) || node.has(ALL_OF)) {
            return Optional.empty();
        }
        if (node.has(ONE_OF)) {
            return Optional.of(ONE_OF);
        }
        return node.has(ANY_OF) ? Optional.of(ANY_OF) : Optional.empty();
    }

    static Set<String> stringSet(JsonNode array) {
        Set<String> values = new LinkedHashSet<>();
        if (array != null && array.isArray()) {
            array.forEach(v -> {
                if (v.isTextual()) {
                    values.add(v.asText());
                }
            });
        }
        return values;
    }

    private static Optional<SchemaReference> componentReference(String pointer) {
        if (pointer.isBlank()) {
            return Optional.empty();
        }
        SchemaReference ref = SchemaReference.of(pointer);
        return ref.componentName().isPresent() ? Optional.of(ref) : Optional.empty();
    }
}
