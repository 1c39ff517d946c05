package com.purchasingpower.ragstore.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Retry configuration for transient upstream failures.
 *
 * <p>Properties are loaded from the {@code app.retry} namespace in application.yml:
 * <pre>
 * app:
 *   retry:
 *     max-attempts: 3
 *     backoff-ms: 500
 *     max-backoff-ms: 5000
 * </pre>
 *
 * <p>For retry N (starting at 0, so at most {@code max-attempts - 1} retries) the delay is
 * {@code min(backoff-ms * 2^N, max-backoff-ms)} plus Reactor's jitter.
 * When every attempt has failed the call surfaces as an upstream timeout.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.retry")
public class RetryProperties {

    /**
     * Total calls per request, the first one included.
     */
    @Min(1)
    private int maxAttempts = 3;

    @Min(1)
    private long backoffMs = 500;

    @Min(1)
    private long maxBackoffMs = 5_000;
}
