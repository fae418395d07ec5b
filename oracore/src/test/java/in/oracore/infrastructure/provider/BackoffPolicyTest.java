package in.oracore.infrastructure.provider;

import in.oracore.domain.common.ProviderException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BackoffPolicy.
 *
 * Tests:
 * - Exponential growth and the delay cap
 * - Attempt budget and reset
 * - Jitter bounds
 * - Builder validation
 */
class BackoffPolicyTest {

    @Test
    void testInitialState() {
        BackoffPolicy policy = policy(Duration.ofSeconds(1), Duration.ofMinutes(5), 2.0, 3);

        assertTrue(policy.shouldRetry(), "Should allow the first retry");
        assertEquals(0, policy.getAttemptCount());
        assertEquals(Duration.ofSeconds(1), policy.getNextDelay());
    }

    @Test
    void testExponentialBackoff() {
        BackoffPolicy policy = policy(Duration.ofSeconds(1), Duration.ofMinutes(5), 2.0, 10);

        policy.recordFailure();
        assertEquals(Duration.ofSeconds(2), policy.getNextDelay());

        policy.recordFailure();
        assertEquals(Duration.ofSeconds(4), policy.getNextDelay());
        assertEquals(2, policy.getAttemptCount());
    }

    @Test
    void testMaxDelayRespected() {
        BackoffPolicy policy = policy(Duration.ofSeconds(10), Duration.ofSeconds(30), 3.0, 10);

        policy.recordFailure();
        assertEquals(Duration.ofSeconds(30), policy.getNextDelay());

        policy.recordFailure();
        assertEquals(Duration.ofSeconds(30), policy.getNextDelay(), "Delay stays capped");
    }

    @Test
    void testAttemptBudget() {
        BackoffPolicy policy = policy(Duration.ofMillis(100), Duration.ofSeconds(1), 2.0, 3);

        policy.recordFailure();
        policy.recordFailure();
        assertTrue(policy.shouldRetry());

        policy.recordFailure();
        assertFalse(policy.shouldRetry(), "Budget of 3 attempts is spent");
    }

    @Test
    void testRecordSuccessResets() {
        BackoffPolicy policy = policy(Duration.ofMillis(100), Duration.ofSeconds(1), 2.0, 3);
        policy.recordFailure();
        policy.recordFailure();

        policy.recordSuccess();

        assertEquals(0, policy.getAttemptCount());
        assertEquals(Duration.ofMillis(100), policy.getNextDelay());
    }

    @Test
    void testFreshIsIndependent() {
        BackoffPolicy policy = policy(Duration.ofMillis(100), Duration.ofSeconds(1), 2.0, 3);
        policy.recordFailure();

        BackoffPolicy fresh = policy.fresh();

        assertEquals(0, fresh.getAttemptCount());
        assertEquals(Duration.ofMillis(100), fresh.getNextDelay());
        assertEquals(3, fresh.getMaxAttempts());
        assertEquals(1, policy.getAttemptCount());
    }

    @Test
    void testJitterShortensDelayWithinBounds() {
        double[] draws = {0.0, 0.5, 0.999};
        int[] next = {0};
        BackoffPolicy policy = BackoffPolicy.builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(30))
            .multiplier(2.0)
            .jitter(0.2)
            .random(() -> draws[next[0]++])
            .build();

        assertEquals(Duration.ofSeconds(1), policy.getNextDelay(), "Zero draw keeps the nominal delay");
        assertEquals(Duration.ofMillis(900), policy.getNextDelay());

        policy.recordFailure();
        assertEquals(Duration.ofMillis(1600), policy.getNextDelay(), "2 s less at most 20%");
    }

    @Test
    void testJitterLeavesGrowthAndCapAlone() {
        BackoffPolicy policy = BackoffPolicy.builder()
            .initialDelay(Duration.ofSeconds(10))
            .maxDelay(Duration.ofSeconds(30))
            .multiplier(3.0)
            .jitter(0.5)
            .random(() -> 0.5)
            .build();

        policy.recordFailure();
        policy.recordFailure();

        // nominal delay capped at 30 s, then shortened by 25%
        assertEquals(Duration.ofMillis(22_500), policy.getNextDelay());
        assertEquals(Duration.ofMillis(7_500), policy.fresh().getNextDelay());
    }

    @Test
    void testProviderDefaultsStayInRange() {
        BackoffPolicy policy = BackoffPolicy.forProvider();

        for (int i = 0; i < 50; i++) {
            long millis = policy.getNextDelay().toMillis();
            assertTrue(millis >= 400 && millis <= 500, "Delay out of range: " + millis);
        }
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.builder().jitter(-0.1));
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.builder().jitter(1.5));
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.builder().initialDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.builder().multiplier(0.5));
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.builder().maxAttempts(0));
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.builder()
            .initialDelay(Duration.ofSeconds(10))
            .maxDelay(Duration.ofSeconds(1))
            .build());
    }

    @Test
    void testRetryableProviderStatuses() {
        assertTrue(new ProviderException("io", new RuntimeException()).isRetryable());
        assertTrue(new ProviderException("throttled", 429, null).isRetryable());
        assertTrue(new ProviderException("upstream", 502, null).isRetryable());
        assertFalse(new ProviderException("unauthorized", 401, null).isRetryable());
        assertFalse(new ProviderException("not found", 404, null).isRetryable());
    }

    private static BackoffPolicy policy(Duration initial, Duration max, double multiplier, int attempts) {
        return BackoffPolicy.builder()
            .initialDelay(initial)
            .maxDelay(max)
            .multiplier(multiplier)
            .maxAttempts(attempts)
            .build();
    }
}
