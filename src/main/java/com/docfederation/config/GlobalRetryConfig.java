package com.docfederation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry policy for transient fetch failures ({@code NetworkError}, {@code Timeout}).
 *
 * <p>Properties are loaded from the {@code app.retry} namespace in application.yml:
 * <pre>
 * app:
 *   retry:
 *     max-attempts: 3
 *     backoff-ms: 1000
 *     max-backoff-ms: 10000
 *     multiplier: 2.0
 * </pre>
 *
 * <p>For attempt N (starting at 1) the delay before the next attempt is:
 * <pre>
 *   delay = min(backoff-ms * (multiplier ^ (N - 1)), max-backoff-ms)
 * </pre>
 */
@ConfigurationProperties(prefix = "app.retry")
@Data
public class GlobalRetryConfig {

    /**
     * Total attempts, including the first one.
     */
    private int maxAttempts = 3;

    private long backoffMs = 1000;

    private long maxBackoffMs = 10000;

    private double multiplier = 2.0;

    public long backoffFor(int attempt) {
        double delay = backoffMs * Math.pow(multiplier, Math.max(0, attempt - 1));
        return (long) Math.min(delay, maxBackoffMs);
    }
}
