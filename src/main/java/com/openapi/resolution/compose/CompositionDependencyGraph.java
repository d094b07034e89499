package com.openapi.resolution.compose;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.resolution.core.model.SchemaReference;
import com.openapi.resolution.document.OpenApiDocument;
import com.openapi.resolution.reference.ReferenceResolver;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Which component schemas expand which others while being resolved.
 *
 * <p>An edge {@code A -> B} means resolving {@code A} expands {@code B} in place: a
 * {@code $ref} in composition position, or any reference into {@code B} that does not become
 * a link. References that become links add no edge.</p>
 *
 * <p>A schema is <em>tainted</em> when its expansion closure reaches a cycle or an external
 * reference. Resolving two tainted schemas on different threads could make each wait for the
 * other's in-flight cache entry, so the catalog builder resolves them on the calling thread.</p>
 */
public final class CompositionDependencyGraph {

    private final OpenApiDocument document;
    private final Map<String, Set<String>> edges;
    private final Set<String> external;
    private final Set<String> cyclic;
    private final Set<String> tainted;

    private CompositionDependencyGraph(OpenApiDocument document, Map<String, Set<String>> edges,
                                       Set<String> external) {
        this.document = document;
        this.edges = edges;
        this.external = external;
        this.cyclic = Collections.unmodifiableSet(findCyclic());
        this.tainted = Collections.unmodifiableSet(findTainted());
    }

    public static CompositionDependencyGraph build(OpenApiDocument document) {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        Set<String> external = new HashSet<>();
        JsonNode schemas = document.componentSchemas();
        for (String name : document.componentSchemaNames()) {
            Set<String> dependencies = new LinkedHashSet<>();
            if (scan(document, schemas.get(name), false, dependencies, new HashSet<>())) {
                external.add(name);
            }
            edges.put(name, Collections.unmodifiableSet(dependencies));
        }
        return new CompositionDependencyGraph(document, Collections.unmodifiableMap(edges), external);
    }

    /**
     * Whether resolving {@code node} at an operation or property position expands a tainted
     * schema or an external reference.
     */
    public boolean reachesTainted(JsonNode node) {
        Set<String> dependencies = new LinkedHashSet<>();
        if (scan(document, node, true, dependencies, new HashSet<>())) {
            return true;
        }
        return dependencies.stream().anyMatch(tainted::contains);
    }

    public Set<String> dependenciesOf(String name) {
        return edges.getOrDefault(name, Set.of());
    }

    /**
     * Schemas that are part of an expansion cycle.
     */
    public Set<String> cyclicSchemas() {
        return cyclic;
    }

    /**
     * Schemas whose expansion reaches a cycle or an external reference, including the
     * cycle members.
     */
    public Set<String> taintedSchemas() {
        return tainted;
    }

    public boolean isTainted(String name) {
        return tainted.contains(name);
    }

    /**
     * Collects the components {@code node} expands into {@code dependencies}.
     *
     * @return whether an external reference is expanded
     */
    private static boolean scan(OpenApiDocument document, JsonNode node, boolean boundary,
                                Set<String> dependencies, Set<String> seenPointers) {
        if (node == null || !node.isObject()) {
            return false;
        }
        if (boundary && SchemaKeywords.linkTarget(node).isPresent()) {
            return false;
        }
        JsonNode ref = node.get(SchemaKeywords.REF);
        if (ref != null) {
            if (!ref.isTextual() || ref.asText().isBlank()) {
                return false;
            }
            SchemaReference reference = SchemaReference.of(ref.asText());
            Optional<String> owner = owningComponent(reference);
            if (owner.isPresent()) {
                dependencies.add(owner.get());
                return false;
            }
            if (reference.isExternal()) {
                return true;
            }
            if (reference.isLocal() && seenPointers.add(reference.canonical())) {
                JsonNode target = ReferenceResolver.findLocal(document, reference).orElse(null);
                return scan(document, target, false, dependencies, seenPointers);
            }
            return false;
        }
        boolean external = false;
        // a union at a boundary links its component variants
        String linkedUnion = boundary ? SchemaKeywords.unionKeyword(node).orElse(null) : null;
        for (String keyword : List.of(SchemaKeywords.ALL_OF, SchemaKeywords.ONE_OF, SchemaKeywords.ANY_OF)) {
            JsonNode branches = node.get(keyword);
            if (branches != null && branches.isArray()) {
                for (JsonNode branch : branches) {
                    external |= scan(document, branch, keyword.equals(linkedUnion), dependencies, seenPointers);
                }
            }
        }
        JsonNode properties = node.get("properties");
        if (properties != null && properties.isObject()) {
            for (JsonNode property : properties) {
                external |= scan(document, property, true, dependencies, seenPointers);
            }
        }
        external |= scan(document, node.get("items"), true, dependencies, seenPointers);
        external |= scan(document, node.get("additionalProperties"), true, dependencies, seenPointers);
        return external;
    }

    private static Optional<String> owningComponent(SchemaReference reference) {
        List<String> segments = reference.segments();
        if (segments.size() >= 3 && "components".equals(segments.get(0)) && "schemas".equals(segments.get(1))) {
            return Optional.of(segments.get(2));
        }
        return Optional.empty();
    }

    /**
     * Tarjan's strongly connected components; a component is cyclic when it has more than
     * one member or a self edge.
     */
    private Set<String> findCyclic() {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowLink = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        Set<String> result = new LinkedHashSet<>();
        int[] counter = {0};
        for (String vertex : edges.keySet()) {
            if (!index.containsKey(vertex)) {
                strongConnect(vertex, index, lowLink, stack, onStack, counter, result);
            }
        }
        return result;
    }

    private void strongConnect(String vertex, Map<String, Integer> index, Map<String, Integer> lowLink,
                               Deque<String> stack, Set<String> onStack, int[] counter, Set<String> result) {
        index.put(vertex, counter[0]);
        lowLink.put(vertex, counter[0]);
        counter[0]++;
        stack.push(vertex);
        onStack.add(vertex);

        for (String next : dependenciesOf(vertex)) {
            if (!edges.containsKey(next)) {
                continue;
            }
            if (!index.containsKey(next)) {
                strongConnect(next, index, lowLink, stack, onStack, counter, result);
                lowLink.put(vertex, Math.min(lowLink.get(vertex), lowLink.get(next)));
            } else if (onStack.contains(next)) {
                lowLink.put(vertex, Math.min(lowLink.get(vertex), index.get(next)));
            }
        }

        if (lowLink.get(vertex).equals(index.get(vertex))) {
            Set<String> component = new LinkedHashSet<>();
            String member;
            do {
                member = stack.pop();
                onStack.remove(member);
                component.add(member);
            } while (!member.equals(vertex));
            if (component.size() > 1 || dependenciesOf(vertex).contains(vertex)) {
                result.addAll(component);
            }
        }
    }

    private Set<String> findTainted() {
        Set<String> result = new LinkedHashSet<>();
        Map<String, Boolean> memo = new HashMap<>();
        for (String vertex : edges.keySet()) {
            if (reachesCycle(vertex, memo, new HashSet<>())) {
                result.add(vertex);
            }
        }
        return result;
    }

    private boolean reachesCycle(String vertex, Map<String, Boolean> memo, Set<String> path) {
        Boolean known = memo.get(vertex);
        if (known != null) {
            return known;
        }
        if (cyclic.contains(vertex) || external.contains(vertex)) {
            memo.put(vertex, true);
            return true;
        }
        if (!path.add(vertex)) {
            return false;
        }
        boolean reaches = false;
        for (String next : dependenciesOf(vertex)) {
            if (edges.containsKey(next) && reachesCycle(next, memo, path)) {
                reaches = true;
                break;
            }
        }
        path.remove(vertex);
        memo.put(vertex, reaches);
        return reaches;
    }
}
