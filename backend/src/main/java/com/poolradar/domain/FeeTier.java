package com.poolradar.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Concentrated-liquidity fee levels. {@code value} is in hundredths of a basis point, as stored on chain
 * (3000 = 0.3%). Each tier has the factory's default tick spacing.
 */
public enum FeeTier {
    LOWEST(100, 1),
    LOW(500, 10),
    MEDIUM(3000, 60),
    HIGH(10000, 200);

    private final int value;
    private final int tickSpacing;

    FeeTier(int value, int tickSpacing) {
        this.value = value;
        this.tickSpacing = tickSpacing;
    }

    public int value() {
        return value;
    }

    public int tickSpacing() {
        return tickSpacing;
    }

    /** Fee as a percentage, e.g. 0.3 for MEDIUM. */
    public double percent() {
        return value / 10_000.0;
    }

    public static Optional<FeeTier> fromValue(int value) {
        return Arrays.stream(values()).filter(t -> t.value == value).findFirst();
    }
}
