package com.openapi.resolution.compose;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.resolution.core.model.ResolvedSchema;
import com.openapi.resolution.core.model.SchemaReference;
import com.openapi.resolution.document.OpenApiDocument;

/**
 * Resolves raw schema nodes into the resolved model. Implemented by the pure
 * {@link SchemaComposer} and by decorators such as the caching resolver, which
 * the composer calls back into for every nested schema.
 */
public interface SchemaNodeResolver {

    ResolvedSchema resolveNode(OpenApiDocument document, JsonNode node, ResolutionContext ctx);

    ResolvedSchema resolveReference(OpenApiDocument document, SchemaReference ref, ResolutionContext ctx);
}
