package com.openapi.resolution.exception;

/**
 * Machine-readable codes for every resolution failure, each with a default
 * human-actionable suggestion.
 */
public enum ErrorCode {

    // Document loading
    FILE_NOT_FOUND("Verify the file path exists and you have read permissions"),
    UNSUPPORTED_FORMAT("Use .json, .yaml, or .yml file extensions for OpenAPI specifications"),
    INVALID_JSON("Check JSON syntax and ensure valid JSON format"),
    INVALID_YAML("Check YAML syntax and ensure valid YAML format"),
    INVALID_SPEC_TYPE("Ensure the root of the file is a valid JSON/YAML object"),
    MISSING_OPENAPI_VERSION("Add an \"openapi\" field specifying the OpenAPI version (e.g., \"3.0.3\")"),
    UNSUPPORTED_OPENAPI_VERSION("Update to OpenAPI 3.x format (3.0.x or 3.1.x)"),
    MISSING_INFO("Add an \"info\" object with \"title\" and \"version\" properties"),
    MISSING_INFO_TITLE("Add a \"title\" field to the info object"),
    MISSING_INFO_VERSION("Add a \"version\" field to the info object"),
    MISSING_PATHS("Add a \"paths\" object defining API endpoints"),

    // References
    REFERENCE_NOT_FOUND("Ensure the referenced component exists in the components section"),
    INVALID_REFERENCE_FORMAT("Use \"#/components/schemas/Name\" locally or \"file.yaml#/path/to/schema\" externally"),
    CIRCULAR_REFERENCE("Remove circular references between components, or move the recursion into a property"),
    EXTERNAL_REFERENCE_NOT_SUPPORTED("Use local references within the same document (starting with \"#/\")"),
    EXTERNAL_FILE_LOAD_FAILED("Verify the external file exists and you have read permissions"),
    EXTERNAL_FETCH_TIMEOUT("Increase the external reference timeout or make the referenced document available locally"),
    DOMAIN_NOT_ALLOWED("Move the referenced file inside the allowed directory"),

    // Composition
    ALLOF_MERGE_CONFLICT("Resolve conflicting properties in allOf schemas"),
    AMBIGUOUS_DISCRIMINATOR("Add an explicit discriminator mapping naming one component per value"),
    ONEOF_NO_VARIANTS("Ensure oneOf contains at least one schema variant"),
    ANYOF_NO_VARIANTS("Ensure anyOf contains at least one schema variant"),
    UNSUPPORTED_SCHEMA_TYPE("Use supported OpenAPI schema types: string, number, integer, boolean, array, object"),
    RECURSION_LIMIT_EXCEEDED("Flatten the schema nesting or raise the maximum resolution depth"),

    // Catalog
    CATALOG_BUILD_FAILED("Fix the listed schema errors and run the generation again"),
    CATALOG_CANCELLED("Re-run the generation to build a complete catalog");

    private final String suggestion;

    ErrorCode(String suggestion) {
        this.suggestion = suggestion;
    }

    public String getSuggestion() {
        return suggestion;
    }
}
