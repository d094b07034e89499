package com.openapi.resolution.cache;

import com.openapi.resolution.TestDocuments;
import com.openapi.resolution.compose.ResolutionContext;
import com.openapi.resolution.core.model.ObjectSchema;
import com.openapi.resolution.core.model.ResolvedSchema;
import com.openapi.resolution.core.model.SchemaReference;
import com.openapi.resolution.document.OpenApiDocument;
import com.openapi.resolution.exception.CircularReferenceException;
import com.openapi.resolution.reference.ReferenceResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CachingSchemaNodeResolver Tests")
class CachingSchemaNodeResolverTest {

    private static final String SCHEMAS = """
            Address:
              type: object
              properties:
                city:
                  type: string
            Customer:
              allOf:
                - $ref: '#/components/schemas/Address'
                - type: object
                  properties:
                    name:
                      type: string
            """;

    private final CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
    private final CachingSchemaNodeResolver resolver = new CachingSchemaNodeResolver(new ReferenceResolver(), cache);

    private ResolvedSchema resolve(OpenApiDocument doc, String name) {
        return resolver.resolveReference(doc, SchemaReference.toComponent(name), new ResolutionContext());
    }

    @Test
    @DisplayName("Nested references are served from the cache")
    void reusesNestedResolutions() {
        OpenApiDocument doc = TestDocuments.withSchemas(SCHEMAS);

        ResolvedSchema address = resolve(doc, "Address");
        ObjectSchema customer = (ObjectSchema) resolve(doc, "Customer");

        assertEquals("Address", address.sourceName());
        assertEquals(2, customer.properties().size());
        assertEquals(1, cache.getStats().hits());
    }

    @Test
    @DisplayName("Repeated resolution returns an equal result")
    void idempotent() {
        OpenApiDocument doc = TestDocuments.withSchemas(SCHEMAS);

        ResolvedSchema first = resolve(doc, "Customer");
        cache.clear();
        ResolvedSchema second = resolve(doc, "Customer");

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Different documents do not share entries")
    void keysIncludeDocument() {
        OpenApiDocument one = TestDocuments.withSchemas("""
                Thing:
                  type: string
                """);
        OpenApiDocument two = TestDocuments.withSchemas("""
                Thing:
                  type: integer
                """);

        assertNotEquals(resolver.documentId(one), resolver.documentId(two));
        assertNotEquals(resolve(one, "Thing"), resolve(two, "Thing"));
    }

    @Test
    @DisplayName("Cycles are still reported through the cache")
    void cyclesBypassCache() {
        OpenApiDocument doc = TestDocuments.withSchemas("""
                A:
                  allOf:
                    - $ref: '#/components/schemas/B'
                B:
                  allOf:
                    - $ref: '#/components/schemas/A'
                """);

        assertThrows(CircularReferenceException.class, () -> resolve(doc, "A"));
        assertThrows(CircularReferenceException.class, () -> resolve(doc, "B"));
        assertEquals(0, cache.getStats().size());
    }
}
