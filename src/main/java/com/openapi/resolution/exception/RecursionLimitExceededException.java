package com.openapi.resolution.exception;

/**
 * Resolution nested deeper than the configured limit.
 */
public class RecursionLimitExceededException extends SchemaResolutionException {

    private final int limit;

    public RecursionLimitExceededException(int limit, String schemaPath) {
        super("Schema nesting exceeds the maximum resolution depth of " + limit,
                ErrorCode.RECURSION_LIMIT_EXCEEDED, schemaPath);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
