package com.openapi.resolution.exception;

/**
 * A local {@code $ref} points at a path that does not exist in the document.
 */
public class ReferenceNotFoundException extends SchemaResolutionException {

    private final String pointer;
    private final String missingSegment;

    public ReferenceNotFoundException(String pointer, String missingSegment, String schemaPath) {
        super("Reference not found: " + pointer + " (no '" + missingSegment + "' segment)",
                ErrorCode.REFERENCE_NOT_FOUND, schemaPath);
        this.pointer = pointer;
        this.missingSegment = missingSegment;
    }

    public ReferenceNotFoundException(String message, ErrorCode errorCode, String pointer, String schemaPath) {
        super(message, errorCode, schemaPath);
        this.pointer = pointer;
        this.missingSegment = "";
    }

    public String getPointer() {
        return pointer;
    }

    public String getMissingSegment() {
        return missingSegment;
    }
}
