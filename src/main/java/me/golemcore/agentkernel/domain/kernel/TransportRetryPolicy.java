package me.golemcore.agentkernel.domain.kernel;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Exponential backoff for retryable model transport failures. The number of
 * attempts includes the first call, so {@code maxAttempts = 1} disables
 * retries.
 */
@Value
@Builder
public class TransportRetryPolicy {

    private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(60);

    @Builder.Default
    int maxAttempts = 1;
    @Builder.Default
    Duration initialBackoff = Duration.ofSeconds(1);
    @Builder.Default
    double multiplier = 2.0;
    @Builder.Default
    Duration maxBackoff = DEFAULT_MAX_BACKOFF;

    public static TransportRetryPolicy none() {
        return TransportRetryPolicy.builder().build();
    }

    /**
     * Checks whether another attempt may follow the given (1-based) attempt.
     */
    public boolean allowsRetryAfter(int attempt) {
        return attempt < maxAttempts;
    }

    /**
     * Backoff to wait after the given (1-based) failed attempt.
     */
    public Duration backoffAfter(int attempt) {
        double factor = Math.pow(multiplier, Math.max(0, attempt - 1));
        long millis = (long) Math.min(initialBackoff.toMillis() * factor, maxBackoff.toMillis());
        return Duration.ofMillis(Math.max(0, millis));
    }
}
