package com.eia.api.fetch;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import com.eia.api.exceptions.InvalidArgumentException;
import com.eia.api.exceptions.TransportFailureException;

public class RetryPolicyTest {

    @Test
    public void testNoneNeverRetries() {
        TransportFailureException serverError = new TransportFailureException("HTTP 503", 503, "u");

        assertEquals(1, RetryPolicy.none().getMaxAttempts());
        assertFalse(RetryPolicy.none().shouldRetry(serverError, 1));
    }

    @Test
    public void testOnlyRetryableFailuresWithinAttemptsAreRetried() {
        RetryPolicy policy = RetryPolicy.exponential(3, Duration.ofMillis(100));

        assertTrue(policy.shouldRetry(new TransportFailureException("throttled", 429, "u"), 1));
        assertTrue(policy.shouldRetry(new TransportFailureException("io", TransportFailureException.NO_STATUS, "u"), 2));
        assertFalse(policy.shouldRetry(new TransportFailureException("server", 500, "u"), 3));
        assertFalse(policy.shouldRetry(new TransportFailureException("not found", 404, "u"), 1));
    }

    @Test
    public void testBackoffGrowsAndIsCapped() {
        RetryPolicy policy = RetryPolicy.exponential(10, Duration.ofMillis(100), 2.0, Duration.ofMillis(500));

        assertEquals(Duration.ofMillis(100), policy.backoffAfter(1));
        assertEquals(Duration.ofMillis(200), policy.backoffAfter(2));
        assertEquals(Duration.ofMillis(400), policy.backoffAfter(3));
        assertEquals(Duration.ofMillis(500), policy.backoffAfter(4));
    }

    @Test
    public void testInvalidPolicies() {
        assertThrows(InvalidArgumentException.class, () -> RetryPolicy.exponential(0, Duration.ofMillis(1)));
        assertThrows(InvalidArgumentException.class, () -> RetryPolicy.exponential(2, Duration.ofMillis(-1)));
        assertThrows(InvalidArgumentException.class,
                () -> RetryPolicy.exponential(2, Duration.ofMillis(1), 0.5, Duration.ofSeconds(1)));
    }
}
