package com.company.obscalc.service;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Bounded exponential backoff for transient calculation failures.
 */
@Getter
@ToString
public class RetryPolicy {

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxExponent;

    public RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, int maxExponent) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (maxExponent < 0 || maxExponent > 30) {
            throw new IllegalArgumentException("maxExponent out of range: " + maxExponent);
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxExponent = maxExponent;
    }

    /**
     * Delay before the next attempt, given the failures already recorded.
     */
    public Duration backoff(int failureCount) {
        int exponent = Math.min(Math.max(failureCount, 0), maxExponent);
        Duration delay = baseDelay.multipliedBy(1L << exponent);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    public boolean shouldRetry(int failureCount) {
        return failureCount < maxRetries;
    }
}
