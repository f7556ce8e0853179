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

import java.time.Duration;

/**
 * Decides whether a failed connection is retried and how long to wait first.
 *
 * <p>{@code attempt} is the number of consecutive failures since the last successful
 * connection, counting the failure being handled. Implementations must be pure functions of
 * {@code attempt} so reconnection behaviour is reproducible.
 */
public interface BackoffPolicy {

    /** Default wait before every reconnect. */
    Duration DEFAULT_DELAY = Duration.ofMillis(5000);

    /** Default cap on consecutive failed attempts. */
    int DEFAULT_MAX_ATTEMPTS = 5;

    boolean shouldRetry(int attempt);

    Duration delayFor(int attempt);

    int getMaxAttempts();

    static BackoffPolicy fixedDelay(int maxAttempts, Duration delay) {
        return new FixedDelayBackoffPolicy(maxAttempts, delay);
    }

    static BackoffPolicy defaults() {
        return new FixedDelayBackoffPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_DELAY);
    }
}
