package com.openapi.resolution.exception;

import java.util.List;

/**
 * A {@code $ref} chain came back to a pointer that is still being resolved.
 */
public class CircularReferenceException extends SchemaResolutionException {

    private final List<String> pointerChain;

    public CircularReferenceException(List<String> pointerChain, String schemaPath) {
        super("Circular reference detected: " + String.join(" -> ", pointerChain),
                ErrorCode.CIRCULAR_REFERENCE, schemaPath);
        this.pointerChain = List.copyOf(pointerChain);
    }

    /**
     * Returns the chain of pointers, ending with the pointer that closed the cycle.
     */
    public List<String> getPointerChain() {
        return pointerChain;
    }

    public String getPointer() {
        return pointerChain.get(pointerChain.size() - 1);
    }
}
