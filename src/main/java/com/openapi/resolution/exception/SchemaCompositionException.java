package com.openapi.resolution.exception;

/**
 * Branches of a composition cannot be combined: conflicting {@code allOf} types
 * or an ambiguous discriminator mapping.
 */
public class SchemaCompositionException extends SchemaResolutionException {

    private final String compositionType;
    private final String reason;

    public SchemaCompositionException(String compositionType, String reason, ErrorCode errorCode,
                                      String schemaPath) {
        super("Schema composition error in " + compositionType + ": " + reason, errorCode, schemaPath);
        this.compositionType = compositionType;
        this.reason = reason;
    }

    public String getCompositionType() {
        return compositionType;
    }

    public String getReason() {
        return reason;
    }
}
