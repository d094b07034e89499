package com.openapi.resolution.exception;

/**
 * The external reference collaborator failed: unreadable file, disallowed location,
 * unsupported transport or timeout. The original failure is attached as the cause.
 */
public class ExternalReferenceException extends SchemaResolutionException {

    private final String pointer;

    public ExternalReferenceException(String message, ErrorCode errorCode, String pointer) {
        this(message, errorCode, pointer, "", null);
    }

    public ExternalReferenceException(String message, ErrorCode errorCode, String pointer,
                                      String schemaPath, Throwable cause) {
        super(message, errorCode, schemaPath, null, cause);
        this.pointer = pointer;
    }

    public String getPointer() {
        return pointer;
    }
}
