package com.openapi.resolution.api;

import com.openapi.resolution.core.model.ResolvedSchema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only result of a catalog build: every named component schema in declaration order,
 * every schema used by an operation, the document's tags and operations.
 *
 * <p>Path schemas are keyed by location, e.g.
 * {@code paths./users.post.requestBody.application/json} or
 * {@code paths./users/{id}.get.responses.200.application/json}.</p>
 */
public final class SchemaCatalog {

    private final Map<String, ResolvedSchema> schemas;
    private final Map<String, ResolvedSchema> pathSchemas;
    private final Set<String> tags;
    private final List<OperationInfo> operations;
    private final CatalogStats stats;

    public SchemaCatalog(Map<String, ResolvedSchema> schemas, Map<String, ResolvedSchema> pathSchemas,
                         Set<String> tags, List<OperationInfo> operations, CatalogStats stats) {
        this.schemas = Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
        this.pathSchemas = Collections.unmodifiableMap(new LinkedHashMap<>(pathSchemas));
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        this.operations = List.copyOf(operations);
        this.stats = stats;
    }

    public Map<String, ResolvedSchema> schemas() {
        return schemas;
    }

    public Optional<ResolvedSchema> schema(String name) {
        return Optional.ofNullable(schemas.get(name));
    }

    public Map<String, ResolvedSchema> pathSchemas() {
        return pathSchemas;
    }

    /**
     * Global tags first, then tags first seen on operations, each once.
     */
    public Set<String> tags() {
        return tags;
    }

    public List<OperationInfo> operations() {
        return operations;
    }

    public List<OperationInfo> operationsByTag(String tag) {
        return operations.stream()
                .filter(op -> op.hasTag(tag))
                .toList();
    }

    public CatalogStats stats() {
        return stats;
    }

    public int size() {
        return schemas.size() + pathSchemas.size();
    }

    @Override
    public String toString() {
        return "SchemaCatalog{schemas=" + schemas.size() + ", pathSchemas=" + pathSchemas.size()
                + ", operations=" + operations.size() + ", tags=" + tags + "}";
    }
}
