package com.openapi.resolution.document;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.openapi.resolution.exception.DocumentParseException;
import com.openapi.resolution.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Parses YAML or JSON bytes into an {@link OpenApiDocument}.
 *
 * <p>With validation on (the default) the document root must be an OpenAPI 3.x document:
 * {@code openapi}, {@code info.title}, {@code info.version} and {@code paths} present.
 * Validation is switched off for fragments such as externally referenced schema files.</p>
 *
 * <p>Instances are thread-safe.</p>
 */
public class DocumentLoader {
    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new YAMLMapper();

    private final boolean validate;

    public DocumentLoader() {
        this(true);
    }

    public DocumentLoader(boolean validate) {
        this.validate = validate;
    }

    public OpenApiDocument parse(byte[] bytes, DocumentFormat format) {
        return parse(bytes, format, "");
    }

    public OpenApiDocument parse(byte[] bytes, DocumentFormat format, String baseContext) {
        JsonNode root = readTree(bytes, format);
        if (validate) {
            validate(root);
        }
        OpenApiDocument document = new OpenApiDocument(root, baseContext);
        log.debug("document.parsed format={} version={} baseContext={}",
                format, document.openApiVersion(), baseContext);
        return document;
    }

    /**
     * Reads a file, choosing the format from its extension.
     */
    public OpenApiDocument load(Path path) {
        DocumentFormat format = DocumentFormat.fromPath(path).orElseThrow(() -> new DocumentParseException(
                "Unsupported file format: " + path.getFileName(), ErrorCode.UNSUPPORTED_FORMAT, ""));
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new DocumentParseException("File not found: " + path.toAbsolutePath(),
                    ErrorCode.FILE_NOT_FOUND, "", -1, -1, e);
        } catch (IOException e) {
            throw new DocumentParseException("Failed to read " + path.toAbsolutePath() + ": " + e.getMessage(),
                    ErrorCode.FILE_NOT_FOUND, "", -1, -1, e);
        }
        return parse(bytes, format, path.toAbsolutePath().normalize().toString());
    }

    private JsonNode readTree(byte[] bytes, DocumentFormat format) {
        ObjectMapper mapper = format == DocumentFormat.JSON ? JSON_MAPPER : YAML_MAPPER;
        ErrorCode code = format == DocumentFormat.JSON ? ErrorCode.INVALID_JSON : ErrorCode.INVALID_YAML;
        JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            int line = location != null ? location.getLineNr() : -1;
            int column = location != null ? location.getColumnNr() : -1;
            throw new DocumentParseException("Failed to parse " + format + ": " + e.getOriginalMessage(),
                    code, "", line, column, e);
        } catch (IOException e) {
            throw new DocumentParseException("Failed to parse " + format + ": " + e.getMessage(),
                    code, "", -1, -1, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new DocumentParseException("Document is empty", ErrorCode.INVALID_SPEC_TYPE, "");
        }
        return root;
    }

    private void validate(JsonNode root) {
        if (!root.isObject()) {
            throw new DocumentParseException("Invalid OpenAPI document: root is not an object",
                    ErrorCode.INVALID_SPEC_TYPE, "#");
        }
        JsonNode openapi = root.get("openapi");
        if (openapi == null || openapi.asText("").isEmpty()) {
            throw new DocumentParseException("Missing required field: openapi",
                    ErrorCode.MISSING_OPENAPI_VERSION, "#/openapi");
        }
        if (!openapi.asText().startsWith("3.")) {
            throw new DocumentParseException("Unsupported OpenAPI version: " + openapi.asText()
                    + ". Only 3.x is supported.", ErrorCode.UNSUPPORTED_OPENAPI_VERSION, "#/openapi");
        }
        JsonNode info = root.get("info");
        if (info == null || !info.isObject()) {
            throw new DocumentParseException("Missing required field: info", ErrorCode.MISSING_INFO, "#/info");
        }
        if (info.path("title").asText("").isEmpty()) {
            throw new DocumentParseException("Missing required field: info.title",
                    ErrorCode.MISSING_INFO_TITLE, "#/info/title");
        }
        if (info.path("version").asText("").isEmpty()) {
            throw new DocumentParseException("Missing required field: info.version",
                    ErrorCode.MISSING_INFO_VERSION, "#/info/version");
        }
        if (!root.has("paths")) {
            throw new DocumentParseException("Missing required field: paths", ErrorCode.MISSING_PATHS, "#/paths");
        }
    }
}
