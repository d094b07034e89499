package com.openapi.resolution.exception;

import com.openapi.resolution.api.SchemaCatalog;

/**
 * The catalog build was cancelled between two batches.
 */
public class CatalogCancelledException extends SchemaResolutionException {

    private final transient SchemaCatalog partialCatalog;

    public CatalogCancelledException(int completedBatches, int totalBatches, SchemaCatalog partialCatalog) {
        super("Catalog build cancelled after " + completedBatches + " of " + totalBatches + " batches",
                ErrorCode.CATALOG_CANCELLED, "");
        this.partialCatalog = partialCatalog;
    }

    public SchemaCatalog getPartialCatalog() {
        return partialCatalog;
    }
}
