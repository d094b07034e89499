package com.openapi.resolution.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResolvedSchema Tests")
class ResolvedSchemaTest {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    @Test
    @DisplayName("Renaming keeps every other field")
    void withSourceName() {
        PrimitiveSchema id = new PrimitiveSchema("", PrimitiveType.STRING, "uuid", true, SchemaMetadata.empty(),
                Map.of("pattern", JSON.textNode("^[a-f0-9-]+$")));

        PrimitiveSchema named = id.withSourceName("Id");

        assertEquals("Id", named.sourceName());
        assertFalse(named.isAnonymous());
        assertEquals("uuid", named.format());
        assertTrue(named.nullable());
        assertEquals(id.validationConstraints(), named.validationConstraints());
        assertTrue(id.isAnonymous());
    }

    @Test
    @DisplayName("Links keep their target name")
    void linkIgnoresRename() {
        SchemaLink link = SchemaLink.to("User");

        assertSame(link, link.withSourceName("Other"));
        assertEquals("User", link.sourceName());
        assertEquals("#/components/schemas/User", link.pointer());
        assertEquals(SchemaKind.LINK, link.kind());
    }

    @Test
    @DisplayName("Enum values come from the enum constraint")
    void enumValues() {
        Map<String, JsonNode> constraints = new LinkedHashMap<>();
        constraints.put("enum", JSON.arrayNode().add("placed").add("approved"));
        PrimitiveSchema status = new PrimitiveSchema("", PrimitiveType.STRING, null, false, null, constraints);

        assertEquals(List.of(JSON.textNode("placed"), JSON.textNode("approved")), status.enumValues());
        assertTrue(PrimitiveSchema.of(PrimitiveType.STRING).enumValues().isEmpty());
    }

    @Test
    @DisplayName("Object schema reports required properties in order")
    void requiredProperties() {
        Map<String, PropertySchema> properties = new LinkedHashMap<>();
        properties.put("id", new PropertySchema(PrimitiveSchema.of(PrimitiveType.INTEGER), true));
        properties.put("nick", new PropertySchema(PrimitiveSchema.of(PrimitiveType.STRING), false));
        properties.put("name", new PropertySchema(PrimitiveSchema.of(PrimitiveType.STRING), true));
        ObjectSchema user = new ObjectSchema("User", properties, null, null, null, null, false, null, null);

        assertEquals(List.of("id", "name"), user.requiredProperties());
        assertTrue(user.isRequired("id"));
        assertFalse(user.isRequired("missing"));
        assertEquals(4, user.sizeHint());
    }

    @Test
    @DisplayName("Metadata fills missing fields from the fallback")
    void metadataOrElse() {
        SchemaMetadata first = new SchemaMetadata("Title", null, null, null, false);
        SchemaMetadata second = new SchemaMetadata("Other", "Described", null, null, true);

        SchemaMetadata merged = first.orElse(second);

        assertEquals("Title", merged.title());
        assertEquals("Described", merged.description());
        assertTrue(merged.deprecated());
        assertTrue(SchemaMetadata.empty().isEmpty());
    }
}
