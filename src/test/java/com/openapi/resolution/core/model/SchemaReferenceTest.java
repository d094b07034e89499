package com.openapi.resolution.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SchemaReference Tests")
class SchemaReferenceTest {

    @Nested
    @DisplayName("Classification")
    class Classification {

        @Test
        @DisplayName("Should tell local from external pointers")
        void localAndExternal() {
            assertTrue(SchemaReference.of("#/components/schemas/User").isLocal());
            assertFalse(SchemaReference.of("#/components/schemas/User").isExternal());
            assertTrue(SchemaReference.of("common.yaml#/Address").isExternal());
            assertFalse(SchemaReference.of("#components").isLocal());
            assertFalse(SchemaReference.of("#components").isExternal());
        }

        @Test
        @DisplayName("Should reject blank pointers")
        void rejectsBlank() {
            assertThrows(IllegalArgumentException.class, () -> SchemaReference.of(" "));
            assertThrows(IllegalArgumentException.class, () -> SchemaReference.of(null));
        }

        @Test
        @DisplayName("Component name only for pointers exactly at a component")
        void componentName() {
            assertEquals(Optional.of("User"), SchemaReference.of("#/components/schemas/User").componentName());
            assertEquals(Optional.empty(),
                    SchemaReference.of("#/components/schemas/User/properties/id").componentName());
            assertEquals(Optional.empty(), SchemaReference.of("#/definitions/User").componentName());
        }
    }

    @Nested
    @DisplayName("Escaping")
    class Escaping {

        @Test
        @DisplayName("Should decode tilde escapes and percent encoding")
        void decodesSegments() {
            SchemaReference ref = SchemaReference.of("#/paths/~1users~1%7Bid%7D/get/a~0b");

            assertEquals(List.of("paths", "/users/{id}", "get", "a~b"), ref.segments());
        }

        @Test
        @DisplayName("Differently escaped spellings share one canonical form")
        void canonicalForm() {
            SchemaReference encoded = SchemaReference.of("#/components/schemas/Pet%20Store");
            SchemaReference plain = SchemaReference.of("#/components/schemas/Pet Store");

            assertEquals(plain.canonical(), encoded.canonical());
        }

        @Test
        @DisplayName("toComponent should escape slashes in the name")
        void toComponentEscapes() {
            SchemaReference ref = SchemaReference.toComponent("a/b");

            assertEquals("#/components/schemas/a~1b", ref.pointer());
            assertEquals(Optional.of("a/b"), ref.componentName());
        }

        @Test
        @DisplayName("simpleName should return the decoded last segment")
        void simpleName() {
            assertEquals("Address", SchemaReference.of("shared.yaml#/Address").simpleName());
            assertEquals("a/b", SchemaReference.of("#/components/schemas/a~1b").simpleName());
        }
    }
}
