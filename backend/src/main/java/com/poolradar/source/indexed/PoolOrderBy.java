package com.poolradar.source.indexed;

import java.util.Arrays;
import java.util.Optional;

/**
 * Sort fields accepted by the indexed service's pools query.
 */
public enum PoolOrderBy {
    TOTAL_VALUE_LOCKED_USD("totalValueLockedUSD"),
    VOLUME_USD("volumeUSD"),
    FEES_USD("feesUSD"),
    CREATED_AT_TIMESTAMP("createdAtTimestamp");

    private final String field;

    PoolOrderBy(String field) {
        this.field = field;
    }

    public String field() {
        return field;
    }

    /** Accepts the wire field name ({@code volumeUSD}) or the constant name, case-insensitively. */
    public static Optional<PoolOrderBy> fromField(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(o -> o.field.equalsIgnoreCase(value) || o.name().equalsIgnoreCase(value))
                .findFirst();
    }
}
