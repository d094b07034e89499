package com.openapi.resolution.exception;

/**
 * Structurally invalid schema, such as an empty {@code oneOf} or an unknown {@code type}.
 */
public class UnsupportedSchemaShapeException extends SchemaResolutionException {

    public UnsupportedSchemaShapeException(String message, ErrorCode errorCode, String schemaPath) {
        super(message, errorCode, schemaPath);
    }
}
