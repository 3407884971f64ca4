package com.poolradar.source.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry policy for indexed-service queries (exponential backoff ± jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "poolradar.retry")
@NoArgsConstructor
@Getter
@Setter
public class ResolverRetryProperties {

    /** Retries after the initial call. Default 3 (4 attempts in total). */
    private int maxRetries = 3;

    /** Base delay in ms for the first retry; doubles each attempt. Default 1000. */
    private long baseDelayMs = 1000L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
    private double jitterFactor = 0.2;
}
