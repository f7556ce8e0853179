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
 * Serial executor that owns all state of a {@link ConnectionSupervisor}.
 *
 * <p>Tasks submitted with {@link #execute} and tasks whose delay expired run one at a time,
 * in submission order, never concurrently with each other.
 */
public interface EventLoop extends AutoCloseable {

    void execute(Runnable task);

    /**
     * Run {@code task} on the loop after {@code delay}. The returned handle cancels it.
     */
    ScheduledTask schedule(Runnable task, Duration delay);

    /** Stop accepting tasks; pending tasks and timers are discarded. */
    @Override
    void close();

    /** Cancellable handle of a delayed task. */
    interface ScheduledTask {

        /** Prevent the task from running if it has not started. Idempotent. */
        void cancel();

        boolean isCancelled();
    }
}
