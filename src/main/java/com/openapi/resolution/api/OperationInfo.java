package com.openapi.resolution.api;

import java.util.List;
import java.util.Objects;

/**
 * An operation declared under {@code paths}.
 *
 * @param method      upper-case HTTP method
 * @param operationId empty when the document declares none
 */
public record OperationInfo(String path, String method, String operationId, List<String> tags) {

    public OperationInfo {
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(method, "method is required");
        operationId = operationId != null ? operationId : "";
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }
}
