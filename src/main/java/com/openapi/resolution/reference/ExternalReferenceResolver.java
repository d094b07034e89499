package com.openapi.resolution.reference;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Resolves {@code $ref} values that do not point into the current document, such as
 * {@code common.yaml#/components/schemas/Error}.
 *
 * <p>Implementations must be thread-safe; the catalog builder calls them from its
 * worker threads.</p>
 */
@FunctionalInterface
public interface ExternalReferenceResolver {

    /**
     * @param pointer     the raw {@code $ref} value
     * @param baseContext location of the referring document, empty when unknown
     * @return the raw schema node the pointer designates
     */
    JsonNode resolveExternal(String pointer, String baseContext);
}
