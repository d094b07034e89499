package com.openapi.resolution.core.model;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A {@code $ref} value. Local pointers start with {@code #/} and are resolved inside the
 * same document; anything else is handed to the external reference resolver.
 */
public record SchemaReference(String pointer) {

    public static final String COMPONENT_SCHEMAS_PREFIX = "#/components/schemas/";

    public SchemaReference {
        if (pointer == null || pointer.isBlank()) {
            throw new IllegalArgumentException("$ref pointer must not be empty");
        }
    }

    public static SchemaReference of(String pointer) {
        return new SchemaReference(pointer);
    }

    /**
     * Reference to {@code #/components/schemas/<name>}.
     */
    public static SchemaReference toComponent(String name) {
        return new SchemaReference(COMPONENT_SCHEMAS_PREFIX + escape(name));
    }

    public boolean isLocal() {
        return pointer.startsWith("#/");
    }

    public boolean isExternal() {
        return !pointer.startsWith("#");
    }

    /**
     * Returns the component name when this points exactly at a component schema.
     */
    public Optional<String> componentName() {
        if (!pointer.startsWith(COMPONENT_SCHEMAS_PREFIX)) {
            return Optional.empty();
        }
        List<String> segments = segments();
        if (segments.size() != 3) {
            return Optional.empty();
        }
        return Optional.of(segments.get(2));
    }

    /**
     * Returns the decoded path segments of a local pointer (RFC 6901 plus
     * percent-decoding of the URI fragment).
     */
    public List<String> segments() {
        if (!isLocal()) {
            return List.of();
        }
        String path = pointer.substring(2);
        if (path.isEmpty()) {
            return List.of();
        }
        List<String> segments = new ArrayList<>();
        for (String raw : path.split("/", -1)) {
            segments.add(decode(raw));
        }
        return Collections.unmodifiableList(segments);
    }

    /**
     * Canonical form used as a cache key: segments decoded and re-encoded, so that
     * differently escaped spellings of one location share an entry.
     */
    public String canonical() {
        if (!isLocal()) {
            return pointer;
        }
        StringBuilder sb = new StringBuilder("#");
        for (String segment : segments()) {
            sb.append('/').append(escape(segment));
        }
        return sb.toString();
    }

    /**
     * Last path segment, used as a display name for non-component pointers.
     */
    public String simpleName() {
        int slash = pointer.lastIndexOf('/');
        String last = slash >= 0 ? pointer.substring(slash + 1) : pointer;
        return decode(last);
    }

    public static String escape(String segment) {
        return segment.replace("~", "~0").replace("/", "~1");
    }

    private static String decode(String raw) {
        String unescaped = raw.indexOf('%') >= 0 ? URLDecoder.decode(raw, StandardCharsets.UTF_8) : raw;
        return unescaped.replace("~1", "/").replace("~0", "~");
    }

    @Override
    public String toString() {
        return pointer;
    }
}
