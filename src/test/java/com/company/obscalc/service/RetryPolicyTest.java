package com.company.obscalc.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofMinutes(1), Duration.ofMinutes(10), 5);

    @Test
    @DisplayName("Backoff doubles with every recorded failure")
    void backoffDoubles() {
        assertEquals(Duration.ofMinutes(1), policy.backoff(0));
        assertEquals(Duration.ofMinutes(2), policy.backoff(1));
        assertEquals(Duration.ofMinutes(4), policy.backoff(2));
        assertEquals(Duration.ofMinutes(8), policy.backoff(3));
    }

    @Test
    @DisplayName("Backoff is capped by the maximum delay and the exponent cap")
    void backoffCapped() {
        assertEquals(Duration.ofMinutes(10), policy.backoff(4));
        assertEquals(Duration.ofMinutes(10), policy.backoff(60));

        RetryPolicy lowExponent = new RetryPolicy(10, Duration.ofSeconds(1), Duration.ofHours(1), 2);
        assertEquals(Duration.ofSeconds(4), lowExponent.backoff(9));
    }

    @Test
    void shouldRetryOnlyBelowMaxRetries() {
        assertTrue(policy.shouldRetry(0));
        assertTrue(policy.shouldRetry(2));
        assertFalse(policy.shouldRetry(3));
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(-1, Duration.ofMinutes(1), Duration.ofHours(1), 5));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(3, Duration.ofMinutes(1), Duration.ofHours(1), 64));
    }
}
