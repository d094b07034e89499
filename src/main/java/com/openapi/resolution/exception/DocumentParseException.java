package com.openapi.resolution.exception;

/**
 * Malformed YAML/JSON input or a document root that is not a usable OpenAPI 3.x document.
 */
public class DocumentParseException extends SchemaResolutionException {

    private final int line;
    private final int column;

    public DocumentParseException(String message, ErrorCode errorCode, String schemaPath) {
        this(message, errorCode, schemaPath, -1, -1, null);
    }

    public DocumentParseException(String message, ErrorCode errorCode, String schemaPath,
                                  int line, int column, Throwable cause) {
        super(message, errorCode, schemaPath, null, cause);
        this.line = line;
        this.column = column;
    }

    /**
     * Returns the 1-based line of the syntax error, or -1 when unknown.
     */
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String getFormattedMessage() {
        if (line < 0) {
            return super.getFormattedMessage();
        }
        return super.getFormattedMessage() + " (line " + line + ", column " + column + ")";
    }
}
