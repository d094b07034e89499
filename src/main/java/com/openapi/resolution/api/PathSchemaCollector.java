package com.openapi.resolution.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.resolution.core.model.SchemaReference;
import com.openapi.resolution.document.OpenApiDocument;
import com.openapi.resolution.exception.CircularReferenceException;
import com.openapi.resolution.exception.ErrorCode;
import com.openapi.resolution.exception.ReferenceNotFoundException;
import com.openapi.resolution.exception.SchemaResolutionException;
import com.openapi.resolution.reference.ReferenceResolver;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Walks {@code paths} and collects operations, tags and every schema an operation uses:
 * parameters (path-level and operation-level), request bodies and response bodies, one entry
 * per media type. {@code $ref}s to {@code components.parameters}, {@code requestBodies} and
 * {@code responses} are followed.
 */
final class PathSchemaCollector {

    static final List<String> HTTP_METHODS = List.of("get", "put", "post", "delete", "options", "head", "patch", "trace");

    /**
     * A schema found under {@code paths}.
     *
     * @param location    catalog key, e.g. {@code paths./users.post.requestBody.application/json}
     * @param pointerPath JSON pointer of the schema node, used in error messages
     */
    record PathSchema(String location, String pointerPath, JsonNode node) {
    }

    private final OpenApiDocument document;
    private final List<PathSchema> schemas = new ArrayList<>();
    private final List<OperationInfo> operations = new ArrayList<>();
    private final Set<String> tags = new LinkedHashSet<>();
    private final List<SchemaResolutionException> errors = new ArrayList<>();

    private PathSchemaCollector(OpenApiDocument document) {
        this.document = document;
    }

    static PathSchemaCollector collect(OpenApiDocument document) {
        PathSchemaCollector collector = new PathSchemaCollector(document);
        collector.collectGlobalTags();
        collector.collectPaths();
        return collector;
    }

    List<PathSchema> schemas() {
        return schemas;
    }

    List<OperationInfo> operations() {
        return operations;
    }

    Set<String> tags() {
        return tags;
    }

    /**
     * Parameter, request body or response references that could not be followed.
     */
    List<SchemaResolutionException> errors() {
        return errors;
    }

    private void collectGlobalTags() {
        JsonNode globalTags = document.root().path("tags");
        for (JsonNode tag : globalTags) {
            String name = tag.path("name").asText("");
            if (!name.isEmpty()) {
                tags.add(name);
            }
        }
    }

    private void collectPaths() {
        Iterator<Map.Entry<String, JsonNode>> paths = document.paths().fields();
        while (paths.hasNext()) {
            Map.Entry<String, JsonNode> entry = paths.next();
            String path = entry.getKey();
            JsonNode pathItem = entry.getValue();
            String pathPointer = "#/paths/" + SchemaReference.escape(path);

            collectParameters(pathItem.path("parameters"), "paths." + path, pathPointer + "/parameters");
            for (String method : HTTP_METHODS) {
                JsonNode operation = pathItem.get(method);
                if (operation != null && operation.isObject()) {
                    collectOperation(path, method, operation, pathPointer + "/" + method);
                }
            }
        }
    }

    private void collectOperation(String path, String method, JsonNode operation, String pointer) {
        List<String> operationTags = new ArrayList<>();
        for (JsonNode tag : operation.path("tags")) {
            operationTags.add(tag.asText());
            tags.add(tag.asText());
        }
        operations.add(new OperationInfo(path, method.toUpperCase(Locale.ROOT),
                operation.path("operationId").asText(""), operationTags));

        String location = "paths." + path + "." + method;
        collectParameters(operation.path("parameters"), location, pointer + "/parameters");

        JsonNode requestBody = operation.get("requestBody");
        if (requestBody != null) {
            String bodyPointer = pointer + "/requestBody";
            JsonNode body = follow(requestBody, bodyPointer);
            if (body != null) {
                collectContent(body.path("content"), location + ".requestBody", bodyPointer + "/content");
            }
        }

        Iterator<Map.Entry<String, JsonNode>> responses = operation.path("responses").fields();
        while (responses.hasNext()) {
            Map.Entry<String, JsonNode> response = responses.next();
            String responsePointer = pointer + "/responses/" + SchemaReference.escape(response.getKey());
            JsonNode resolved = follow(response.getValue(), responsePointer);
            if (resolved != null) {
                collectContent(resolved.path("content"), location + ".responses." + response.getKey(),
                        responsePointer + "/content");
            }
        }
    }

    private void collectParameters(JsonNode parameters, String location, String pointer) {
        for (int i = 0; i < parameters.size(); i++) {
            String parameterPointer = pointer + "/" + i;
            JsonNode parameter = follow(parameters.get(i), parameterPointer);
            if (parameter == null) {
                continue;
            }
            String parameterLocation = location + ".parameters." + parameter.path("name").asText(String.valueOf(i));
            if (parameter.has("schema")) {
                schemas.add(new PathSchema(parameterLocation, parameterPointer + "/schema", parameter.get("schema")));
            } else {
                collectContent(parameter.path("content"), parameterLocation, parameterPointer + "/content");
            }
        }
    }

    private void collectContent(JsonNode content, String location, String pointer) {
        Iterator<Map.Entry<String, JsonNode>> mediaTypes = content.fields();
        while (mediaTypes.hasNext()) {
            Map.Entry<String, JsonNode> mediaType = mediaTypes.next();
            JsonNode schema = mediaType.getValue().get("schema");
            if (schema != null) {
                schemas.add(new PathSchema(location + "." + mediaType.getKey(),
                        pointer + "/" + SchemaReference.escape(mediaType.getKey()) + "/schema", schema));
            }
        }
    }

    /**
     * Follows a local {@code $ref} on a parameter, request body or response object.
     *
     * @return the target, or {@code null} after recording an error
     */
    private JsonNode follow(JsonNode node, String pointer) {
        JsonNode current = node;
        Set<String> seen = new LinkedHashSet<>();
        while (current.isObject() && current.path("$ref").isTextual()) {
            String refText = current.get("$ref").asText();
            if (refText.isBlank() || !refText.startsWith("#/")) {
                errors.add(new ReferenceNotFoundException("Only local references are supported here: " + refText,
                        ErrorCode.INVALID_REFERENCE_FORMAT, refText, pointer));
                return null;
            }
            SchemaReference ref = SchemaReference.of(refText);
            if (!seen.add(ref.canonical())) {
                List<String> chain = new ArrayList<>(seen);
                chain.add(ref.canonical());
                errors.add(new CircularReferenceException(chain, pointer));
                return null;
            }
            JsonNode target = ReferenceResolver.findLocal(document, ref).orElse(null);
            if (target == null) {
                errors.add(new ReferenceNotFoundException(refText, lastSegment(ref), pointer));
                return null;
            }
            current = target;
        }
        return current;
    }

    private String lastSegment(SchemaReference ref) {
        List<String> segments = ref.segments();
        JsonNode current = document.root();
        for (String segment : segments) {
            JsonNode next = current.get(segment);
            if (next == null) {
                return segment;
            }
            current = next;
        }
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }
}
