package com.openapi.resolution;

import com.openapi.resolution.document.DocumentFormat;
import com.openapi.resolution.document.DocumentLoader;
import com.openapi.resolution.document.OpenApiDocument;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Builds documents for tests, either from inline YAML or from {@code src/test/resources/documents}.
 */
public final class TestDocuments {

    private static final DocumentLoader LOADER = new DocumentLoader();

    private TestDocuments() {
    }

    public static OpenApiDocument yaml(String yaml) {
        return LOADER.parse(yaml.getBytes(StandardCharsets.UTF_8), DocumentFormat.YAML);
    }

    /**
     * Wraps a {@code components.schemas} body into a minimal valid document.
     */
    public static OpenApiDocument withSchemas(String schemasYaml) {
        return yaml("""
                openapi: 3.0.3
                info:
                  title: Test
                  version: '1'
                paths: {}
                components:
                  schemas:
                """ + schemasYaml.indent(4));
    }

    public static OpenApiDocument load(String name) {
        return LOADER.load(resource(name));
    }

    public static Path resource(String name) {
        URL url = TestDocuments.class.getResource("/documents/" + name);
        if (url == null) {
            throw new IllegalArgumentException("No test document " + name);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
