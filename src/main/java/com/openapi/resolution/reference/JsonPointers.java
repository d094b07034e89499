package com.openapi.resolution.reference;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Walks decoded JSON-pointer segments through a Jackson tree.
 */
final class JsonPointers {

    private JsonPointers() {
    }

    /**
     * Outcome of a walk: the node found, or the first segment that could not be followed.
     */
    record Walk(JsonNode node, String missingSegment) {
        boolean found() {
            return node != null;
        }
    }

    static Walk walk(JsonNode root, List<String> segments) {
        JsonNode current = root;
        for (String segment : segments) {
            JsonNode next = null;
            if (current.isObject()) {
                next = current.get(segment);
            } else if (current.isArray() && isIndex(segment)) {
                next = current.get(Integer.parseInt(segment));
            }
            if (next == null) {
                return new Walk(null, segment);
            }
            current = next;
        }
        return new Walk(current, null);
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
