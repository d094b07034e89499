package com.openapi.resolution.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.openapi.resolution.compose.ResolutionContext;
import com.openapi.resolution.compose.SchemaComposer;
import com.openapi.resolution.compose.SchemaNodeResolver;
import com.openapi.resolution.compose.SchemaSignature;
import com.openapi.resolution.core.model.ResolvedSchema;
import com.openapi.resolution.core.model.SchemaReference;
import com.openapi.resolution.document.OpenApiDocument;
import com.openapi.resolution.reference.ReferenceResolver;

import java.util.Objects;

/**
 * Puts a {@link ResolutionCache} in front of a {@link SchemaComposer}.
 *
 * <p>References are cached under {@code <document>|ref:<canonical pointer>}, inline
 * objects and compositions under {@code <document>|shape:<signature>}. Scalars and arrays
 * of scalars are cheap to rebuild and are not cached. A reference that is already on the
 * current resolution path bypasses the cache so the composer reports the cycle.</p>
 */
public class CachingSchemaNodeResolver implements SchemaNodeResolver {

    private final ResolutionCache cache;
    private final SchemaComposer composer;
    private final Cache<OpenApiDocument, String> documentIds = Caffeine.newBuilder()
            .weakKeys()
            .maximumSize(64)
            .build();

    public CachingSchemaNodeResolver(ReferenceResolver references, ResolutionCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.composer = new SchemaComposer(references, this);
    }

    public SchemaComposer composer() {
        return composer;
    }

    public ResolutionCache cache() {
        return cache;
    }

    @Override
    public ResolvedSchema resolveNode(OpenApiDocument document, JsonNode node, ResolutionContext ctx) {
        if (!isWorthCaching(node)) {
            return composer.resolveNode(document, node, ctx);
        }
        String key = documentId(document) + "|shape:" + SchemaSignature.of(node);
        return cache.getOrCompute(key, () -> composer.resolveNode(document, node, ctx));
    }

    @Override
    public ResolvedSchema resolveReference(OpenApiDocument document, SchemaReference ref, ResolutionContext ctx) {
        String pointer = ref.canonical();
        if (ctx.isVisited(pointer)) {
            return composer.resolveReference(document, ref, ctx);
        }
        String key = documentId(document) + "|ref:" + pointer;
        return cache.getOrCompute(key, () -> composer.resolveReference(document, ref, ctx));
    }

    String documentId(OpenApiDocument document) {
        return documentIds.get(document, doc -> SchemaSignature.ofDocument(doc).substring(0, 16));
    }

    private static boolean isWorthCaching(JsonNode node) {
        if (!node.isObject() || node.has("$ref")) {
            return false;
        }
        return node.has("allOf") || node.has("oneOf") || node.has("anyOf") || node.has("properties");
    }
}
