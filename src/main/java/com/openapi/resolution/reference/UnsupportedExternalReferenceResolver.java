package com.openapi.resolution.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.openapi.resolution.exception.ErrorCode;
import com.openapi.resolution.exception.ExternalReferenceException;

/**
 * Default collaborator: rejects every external reference.
 */
public class UnsupportedExternalReferenceResolver implements ExternalReferenceResolver {

    public static final UnsupportedExternalReferenceResolver INSTANCE = new UnsupportedExternalReferenceResolver();

    @Override
    public JsonNode resolveExternal(String pointer, String baseContext) {
        throw new ExternalReferenceException("External references not supported: " + pointer,
                ErrorCode.EXTERNAL_REFERENCE_NOT_SUPPORTED, pointer);
    }
}
