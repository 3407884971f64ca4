package com.poolradar.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Provenance of a pool result: which source produced it.
 */
public enum PoolSource {
    CACHE("cache"),
    INDEXED_SERVICE("indexed-service"),
    CHAIN("chain"),
    /** Placeholder built when no real source answered. Never cached. */
    SYNTHETIC("synthetic");

    private final String wireName;

    PoolSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isReal() {
        return this != SYNTHETIC;
    }
}
