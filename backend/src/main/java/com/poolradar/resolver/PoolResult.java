package com.poolradar.resolver;

import com.poolradar.domain.PoolSource;
import lombok.Getter;

import java.util.Optional;

/**
 * Outcome of a resolver operation. Resolver methods never throw; callers check {@link #isSuccess()}.
 * Every result carries the source that produced it, a timestamp and the end-to-end latency.
 * A synthetic result is successful but holds a placeholder, never real pool state.
 */
@Getter
public class PoolResult<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final PoolErrorCode errorCode;
    private final PoolSource source;
    private final long timestampMs;
    private final long latencyMs;

    private PoolResult(boolean success, T data, String error, PoolErrorCode errorCode, PoolSource source,
                       long timestampMs, long latencyMs) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorCode = errorCode;
        this.source = source;
        this.timestampMs = timestampMs;
        this.latencyMs = latencyMs;
    }

    public static <T> PoolResult<T> success(T data, PoolSource source, long timestampMs, long latencyMs) {
        return new PoolResult<>(true, data, null, null, source, timestampMs, latencyMs);
    }

    /**
     * Successful result that still reports the failures of some elements (batch).
     */
    public static <T> PoolResult<T> partial(T data, String error, PoolSource source, long timestampMs, long latencyMs) {
        return new PoolResult<>(true, data, error, null, source, timestampMs, latencyMs);
    }

    /**
     * Placeholder returned when every real source failed.
     *
     * @param reason why the real sources could not answer
     */
    public static <T> PoolResult<T> synthetic(T placeholder, String reason, long timestampMs, long latencyMs) {
        return new PoolResult<>(true, placeholder, reason, null, PoolSource.SYNTHETIC, timestampMs, latencyMs);
    }

    public static <T> PoolResult<T> failure(PoolErrorCode errorCode, String error, PoolSource source,
                                            long timestampMs, long latencyMs) {
        return new PoolResult<>(false, null, error, errorCode, source, timestampMs, latencyMs);
    }

    /** Same outcome, re-stamped for a caller that shared another caller's resolution. */
    PoolResult<T> withTiming(long timestampMs, long latencyMs) {
        return new PoolResult<>(success, data, error, errorCode, source, timestampMs, latencyMs);
    }

    public boolean isSynthetic() {
        return source == PoolSource.SYNTHETIC;
    }

    public Optional<T> getData() {
        return Optional.ofNullable(data);
    }
}
