package com.poolradar.source.indexed;

import java.util.Arrays;
import java.util.Optional;

/**
 * Sort direction of a pools query.
 */
public enum OrderDirection {
    ASC,
    DESC;

    public String wireName() {
        return name().toLowerCase();
    }

    public static Optional<OrderDirection> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(d -> d.name().equalsIgnoreCase(value)).findFirst();
    }
}
