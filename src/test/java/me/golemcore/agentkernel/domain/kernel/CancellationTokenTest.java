package me.golemcore.agentkernel.domain.kernel;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void shouldKeepFirstCancellationReason() {
        CancellationToken token = CancellationToken.create();

        token.cancel("user abort");
        token.cancel("second");

        assertTrue(token.isCancelled());
        assertEquals("user abort", token.getReason());
    }

    @Test
    void childShouldFollowParent() {
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = parent.withDeadline(Instant.MAX, Clock.systemUTC());

        assertFalse(child.isCancelled());
        parent.cancel();

        assertTrue(child.isCancelled());
        assertEquals("cancelled", child.getReason());
    }

    @Test
    void childShouldFireAtDeadline() {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");
        CancellationToken parent = CancellationToken.create();

        CancellationToken expired = parent.withDeadline(now.minusSeconds(1), Clock.fixed(now, ZoneOffset.UTC));

        assertTrue(expired.isCancelled());
        assertEquals("run timeout exceeded", expired.getReason());
        assertFalse(parent.isCancelled());
    }

    @Test
    void retryPolicyShouldBackOffExponentiallyWithCap() {
        TransportRetryPolicy policy = TransportRetryPolicy.builder()
                .maxAttempts(4)
                .initialBackoff(Duration.ofMillis(100))
                .multiplier(3.0)
                .maxBackoff(Duration.ofMillis(500))
                .build();

        assertEquals(Duration.ofMillis(100), policy.backoffAfter(1));
        assertEquals(Duration.ofMillis(300), policy.backoffAfter(2));
        assertEquals(Duration.ofMillis(500), policy.backoffAfter(3));
        assertTrue(policy.allowsRetryAfter(3));
        assertFalse(policy.allowsRetryAfter(4));
        assertFalse(TransportRetryPolicy.none().allowsRetryAfter(1));
    }
}
