package com.openapi.resolution.exception;

/**
 * Base class of every error raised while loading or resolving an OpenAPI document.
 *
 * <p>Each error carries an {@link ErrorCode}, the slash path of the offending schema
 * (e.g. {@code #/components/schemas/User/properties/address}) and a suggestion a user
 * can act on.</p>
 */
public abstract class SchemaResolutionException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String schemaPath;
    private final String suggestion;

    protected SchemaResolutionException(String message, ErrorCode errorCode, String schemaPath) {
        this(message, errorCode, schemaPath, null, null);
    }

    protected SchemaResolutionException(String message, ErrorCode errorCode, String schemaPath,
                                        String suggestion, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.schemaPath = schemaPath != null ? schemaPath : "";
        this.suggestion = suggestion != null ? suggestion : errorCode.getSuggestion();
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getSchemaPath() {
        return schemaPath;
    }

    public String getSuggestion() {
        return suggestion;
    }

    /**
     * Returns the message with path, code and suggestion appended.
     */
    public String getFormattedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (!schemaPath.isEmpty()) {
            sb.append(" at path: ").append(schemaPath);
        }
        sb.append(" [").append(errorCode.name()).append(']');
        if (suggestion != null && !suggestion.isEmpty()) {
            sb.append("\nSuggestion: ").append(suggestion);
        }
        return sb.toString();
    }
}
