package com.openapi.resolution.document;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public enum DocumentFormat {
    JSON,
    YAML;

    /**
     * Picks the format from a file extension ({@code .json}, {@code .yaml}, {@code .yml}).
     */
    public static Optional<DocumentFormat> fromPath(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return Optional.of(JSON);
        }
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return Optional.of(YAML);
        }
        return Optional.empty();
    }
}
