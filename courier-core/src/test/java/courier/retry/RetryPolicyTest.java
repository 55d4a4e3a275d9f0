package courier.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RetryPolicyTest {
    private static final Duration CEILING = Duration.ofSeconds(600);

    @Test
    void exponentialDoublesFromBase() {
        RetryPolicy policy = RetryPolicy.exponential(10, Duration.ofSeconds(60));
        assertEquals(Duration.ofSeconds(60), policy.delayFor(0, CEILING));
        assertEquals(Duration.ofSeconds(120), policy.delayFor(1, CEILING));
        assertEquals(Duration.ofSeconds(240), policy.delayFor(2, CEILING));
        assertEquals(Duration.ofSeconds(480), policy.delayFor(3, CEILING));
    }

    @Test
    void exponentialIsCappedAtCeiling() {
        RetryPolicy policy = RetryPolicy.exponential(10, Duration.ofSeconds(60));
        assertEquals(CEILING, policy.delayFor(4, CEILING));
        assertEquals(CEILING, policy.delayFor(9, CEILING));
    }

    @Test
    void exponentialDoesNotOverflowForLargeAttempts() {
        RetryPolicy policy = RetryPolicy.exponential(Integer.MAX_VALUE, Duration.ofSeconds(60));
        assertEquals(CEILING, policy.delayFor(62, CEILING));
        assertEquals(CEILING, policy.delayFor(1_000, CEILING));
    }

    @Test
    void fixedGrowsLinearly() {
        RetryPolicy policy = RetryPolicy.fixed(5, Duration.ofSeconds(30));
        assertEquals(Duration.ofSeconds(30), policy.delayFor(0, CEILING));
        assertEquals(Duration.ofSeconds(60), policy.delayFor(1, CEILING));
        assertEquals(Duration.ofSeconds(90), policy.delayFor(2, CEILING));
    }

    @Test
    void zeroBaseDelayMeansImmediateRedelivery() {
        assertEquals(Duration.ZERO, RetryPolicy.exponential(3, Duration.ZERO).delayFor(2, CEILING));
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.fixed(-1, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.fixed(1, Duration.ofSeconds(-1)));
        assertThrows(NullPointerException.class, () -> new RetryPolicy(1, Duration.ofSeconds(1), null));
    }
}
