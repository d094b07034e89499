package com.openapi.resolution.exception;

import com.openapi.resolution.api.SchemaCatalog;

import java.util.List;

/**
 * One or more schemas failed during a catalog build. Holds every failure, in document
 * order, and the catalog of the schemas that did resolve.
 */
public class CatalogBuildException extends SchemaResolutionException {

    private final List<SchemaResolutionException> errors;
    private final transient SchemaCatalog partialCatalog;

    public CatalogBuildException(List<SchemaResolutionException> errors, SchemaCatalog partialCatalog) {
        super(summary(errors), ErrorCode.CATALOG_BUILD_FAILED, "", null, errors.isEmpty() ? null : errors.get(0));
        this.errors = List.copyOf(errors);
        this.partialCatalog = partialCatalog;
        for (int i = 1; i < this.errors.size(); i++) {
            addSuppressed(this.errors.get(i));
        }
    }

    public List<SchemaResolutionException> getErrors() {
        return errors;
    }

    public SchemaCatalog getPartialCatalog() {
        return partialCatalog;
    }

    @Override
    public String getFormattedMessage() {
        StringBuilder sb = new StringBuilder(super.getFormattedMessage());
        for (SchemaResolutionException error : errors) {
            sb.append("\n  - ").append(error.getFormattedMessage().replace("\n", "\n    "));
        }
        return sb.toString();
    }

    private static String summary(List<SchemaResolutionException> errors) {
        if (errors.isEmpty()) {
            return "Catalog build failed";
        }
        return "Catalog build failed with " + errors.size() + " error(s); first: " + errors.get(0).getMessage();
    }
}
