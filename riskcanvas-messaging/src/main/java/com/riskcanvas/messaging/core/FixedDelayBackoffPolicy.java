/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.riskcanvas.messaging.core;

import com.riskcanvas.common.exception.ConfigurationException;

import java.time.Duration;
import java.util.Objects;

/**
 * Same delay before every retry, retries allowed while {@code attempt < maxAttempts}.
 * No jitter and no growth.
 */
public final class FixedDelayBackoffPolicy implements BackoffPolicy {

    private final int maxAttempts;
    private final Duration delay;

    public FixedDelayBackoffPolicy(int maxAttempts, Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        if (maxAttempts < 0) {
            throw new ConfigurationException("maxAttempts must be >= 0, got " + maxAttempts);
        }
        if (delay.isNegative()) {
            throw new ConfigurationException("delay must not be negative, got " + delay);
        }
        this.maxAttempts = maxAttempts;
        this.delay = delay;
    }

    @Override
    public boolean shouldRetry(int attempt) {
        checkAttempt(attempt);
        return attempt < maxAttempts;
    }

    @Override
    public Duration delayFor(int attempt) {
        checkAttempt(attempt);
        return delay;
    }

    @Override
    public int getMaxAttempts() { return maxAttempts; }

    public Duration getDelay() { return delay; }

    private static void checkAttempt(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, got " + attempt);
        }
    }

    @Override
    public String toString() {
        return "FixedDelayBackoffPolicy{maxAttempts=" + maxAttempts + ", delay=" + delay.toMillis() + "ms}";
    }
}
