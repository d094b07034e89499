package com.openapi.resolution.cache;

import com.openapi.resolution.core.model.ResolvedSchema;

/**
 * A cached resolution together with its size estimate.
 */
public record CacheEntry(String key, ResolvedSchema value, int sizeHint) {

    public static CacheEntry of(String key, ResolvedSchema value) {
        return new CacheEntry(key, value, value.sizeHint());
    }
}
