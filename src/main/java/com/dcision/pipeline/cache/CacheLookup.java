package com.dcision.pipeline.cache;

import lombok.Value;

/**
 * A value obtained from the cache, and whether this caller computed it or received it
 * from an entry (or another caller's in-flight computation).
 */
@Value
public class CacheLookup<T> {
    T value;
    boolean hit;

    static <T> CacheLookup<T> hit(T value) {
        return new CacheLookup<>(value, true);
    }

    static <T> CacheLookup<T> computed(T value) {
        return new CacheLookup<>(value, false);
    }
}
