package com.openapi.resolution.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.openapi.resolution.TestDocuments;
import com.openapi.resolution.compose.ResolutionContext;
import com.openapi.resolution.core.model.SchemaReference;
import com.openapi.resolution.document.OpenApiDocument;
import com.openapi.resolution.exception.CircularReferenceException;
import com.openapi.resolution.exception.ErrorCode;
import com.openapi.resolution.exception.ExternalReferenceException;
import com.openapi.resolution.exception.ReferenceNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("ReferenceResolver Tests")
class ReferenceResolverTest {

    private final OpenApiDocument doc = TestDocuments.withSchemas("""
            User:
              type: object
              properties:
                id:
                  type: string
            """);

    @Nested
    @DisplayName("Local references")
    class Local {

        private final ReferenceResolver resolver = new ReferenceResolver();

        @Test
        @DisplayName("Should resolve component and nested pointers")
        void resolvesPointers() {
            JsonNode user = resolver.resolve(doc, SchemaReference.toComponent("User"), new ResolutionContext());
            JsonNode id = resolver.resolve(doc, SchemaReference.of("#/components/schemas/User/properties/id"),
                    new ResolutionContext());

            assertEquals("object", user.path("type").asText());
            assertEquals("string", id.path("type").asText());
        }

        @Test
        @DisplayName("Missing target should name the missing segment")
        void missingSegment() {
            ResolutionContext ctx = ResolutionContext.at("#/components/schemas/Order/properties/user", 10);

            ReferenceNotFoundException e = assertThrows(ReferenceNotFoundException.class,
                    () -> resolver.resolve(doc, SchemaReference.toComponent("Account"), ctx));

            assertEquals(ErrorCode.REFERENCE_NOT_FOUND, e.getErrorCode());
            assertEquals("Account", e.getMissingSegment());
            assertEquals("#/components/schemas/Order/properties/user", e.getSchemaPath());
        }

        @Test
        @DisplayName("A pointer already being resolved is a cycle")
        void detectsCycle() {
            ResolutionContext ctx = new ResolutionContext();
            ctx.enter("#/components/schemas/User");

            CircularReferenceException e = assertThrows(CircularReferenceException.class,
                    () -> resolver.resolve(doc, SchemaReference.toComponent("User"), ctx));

            assertEquals(2, e.getPointerChain().size());
        }

        @Test
        @DisplayName("Fragment pointers without a slash are malformed")
        void invalidFormat() {
            ReferenceNotFoundException e = assertThrows(ReferenceNotFoundException.class,
                    () -> resolver.resolve(doc, SchemaReference.of("#components/schemas/User"), new ResolutionContext()));

            assertEquals(ErrorCode.INVALID_REFERENCE_FORMAT, e.getErrorCode());
        }

        @Test
        @DisplayName("exists and findLocal do not throw")
        void lookupWithoutErrors() {
            assertTrue(resolver.exists(doc, SchemaReference.toComponent("User")));
            assertFalse(resolver.exists(doc, SchemaReference.toComponent("Nope")));
            assertFalse(resolver.exists(doc, SchemaReference.of("other.yaml#/User")));
            assertTrue(ReferenceResolver.findLocal(doc, SchemaReference.toComponent("Nope")).isEmpty());
        }
    }

    @Nested
    @DisplayName("External references")
    class External {

        @Test
        @DisplayName("Default collaborator rejects external references")
        void unsupportedByDefault() {
            ReferenceResolver resolver = new ReferenceResolver();

            ExternalReferenceException e = assertThrows(ExternalReferenceException.class,
                    () -> resolver.resolve(doc, SchemaReference.of("common.yaml#/Address"), new ResolutionContext()));

            assertEquals(ErrorCode.EXTERNAL_REFERENCE_NOT_SUPPORTED, e.getErrorCode());
        }

        @Test
        @DisplayName("Should delegate to the external collaborator with the document base")
        void delegates() {
            ExternalReferenceResolver external = mock(ExternalReferenceResolver.class);
            JsonNode address = JsonNodeFactory.instance.objectNode().put("type", "object");
            when(external.resolveExternal("common.yaml#/Address", "")).thenReturn(address);
            ReferenceResolver resolver = new ReferenceResolver(external);

            JsonNode resolved = resolver.resolve(doc, SchemaReference.of("common.yaml#/Address"), new ResolutionContext());

            assertSame(address, resolved);
            verify(external).resolveExternal("common.yaml#/Address", "");
        }

        @Test
        @DisplayName("Collaborator failures are wrapped with the cause attached")
        void wrapsFailures() {
            ExternalReferenceResolver external = mock(ExternalReferenceResolver.class);
            IllegalStateException boom = new IllegalStateException("disk on fire");
            when(external.resolveExternal(anyString(), anyString())).thenThrow(boom);
            ReferenceResolver resolver = new ReferenceResolver(external);

            ExternalReferenceException e = assertThrows(ExternalReferenceException.class,
                    () -> resolver.resolve(doc, SchemaReference.of("common.yaml#/Address"), new ResolutionContext()));

            assertEquals(ErrorCode.EXTERNAL_FILE_LOAD_FAILED, e.getErrorCode());
            assertSame(boom, e.getCause());
        }

        @Test
        @DisplayName("A timed out fetch is reported at the schema path that needed it")
        void timeoutCarriesSchemaPath() {
            CountDownLatch release = new CountDownLatch(1);
            ExternalReferenceResolver slow = (pointer, base) -> {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return JsonNodeFactory.instance.objectNode();
            };
            ResolutionContext ctx = ResolutionContext.at("#/components/schemas/Order/properties/address", 10);

            try (TimeoutExternalReferenceResolver timed =
                         new TimeoutExternalReferenceResolver(slow, Duration.ofMillis(50))) {
                ReferenceResolver resolver = new ReferenceResolver(timed);

                ExternalReferenceException e = assertThrows(ExternalReferenceException.class,
                        () -> resolver.resolve(doc, SchemaReference.of("common.yaml#/Address"), ctx));

                assertEquals(ErrorCode.EXTERNAL_FETCH_TIMEOUT, e.getErrorCode());
                assertEquals("common.yaml#/Address", e.getPointer());
                assertEquals("#/components/schemas/Order/properties/address", e.getSchemaPath());
                assertTrue(e.getFormattedMessage().contains("at path: #/components/schemas/Order/properties/address"));
            } finally {
                release.countDown();
            }
        }

        @Test
        @DisplayName("Collaborator errors that already carry a path are kept as thrown")
        void keepsExistingPath() {
            ExternalReferenceException original = new ExternalReferenceException("denied",
                    ErrorCode.EXTERNAL_FILE_LOAD_FAILED, "common.yaml#/Address", "#/elsewhere", null);
            ExternalReferenceResolver external = mock(ExternalReferenceResolver.class);
            when(external.resolveExternal(anyString(), anyString())).thenThrow(original);
            ReferenceResolver resolver = new ReferenceResolver(external);

            ExternalReferenceException e = assertThrows(ExternalReferenceException.class,
                    () -> resolver.resolve(doc, SchemaReference.of("common.yaml#/Address"),
                            ResolutionContext.at("#/components/schemas/Order", 10)));

            assertSame(original, e);
        }
    }
}
