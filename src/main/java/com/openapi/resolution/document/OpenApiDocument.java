package com.openapi.resolution.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable, parsed OpenAPI document.
 *
 * <p>The root node is owned by the document; callers must not mutate it. The
 * {@code baseContext} is the location the document was read from and is used to
 * resolve relative external references.</p>
 */
public final class OpenApiDocument {

    private final JsonNode root;
    private final String baseContext;

    public OpenApiDocument(JsonNode root, String baseContext) {
        this.root = Objects.requireNonNull(root, "root is required");
        this.baseContext = baseContext != null ? baseContext : "";
    }

    public static OpenApiDocument of(JsonNode root) {
        return new OpenApiDocument(root, "");
    }

    public JsonNode root() {
        return root;
    }

    public String baseContext() {
        return baseContext;
    }

    public String openApiVersion() {
        return root.path("openapi").asText("");
    }

    public boolean isOpenApi31() {
        return openApiVersion().startsWith("3.1");
    }

    public String title() {
        return root.path("info").path("title").asText("");
    }

    public JsonNode componentSchemas() {
        return root.path("components").path("schemas");
    }

    /**
     * Names under {@code components.schemas} in declaration order.
     */
    public List<String> componentSchemaNames() {
        JsonNode schemas = componentSchemas();
        if (!schemas.isObject()) {
            return List.of();
        }
        List<String> names = new ArrayList<>(schemas.size());
        schemas.fieldNames().forEachRemaining(names::add);
        return Collections.unmodifiableList(names);
    }

    public boolean hasComponentSchema(String name) {
        return componentSchemas().has(name);
    }

    public JsonNode paths() {
        JsonNode paths = root.get("paths");
        return paths != null ? paths : MissingNode.getInstance();
    }

    @Override
    public String toString() {
        return "OpenApiDocument{version=" + openApiVersion()
                + ", title=" + title()
                + ", baseContext=" + baseContext + "}";
    }
}
