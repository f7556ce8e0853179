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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.*;

/**
 * {@link EventLoop} backed by a single daemon thread.
 */
public class ExecutorEventLoop implements EventLoop {

    private static final Logger log = LoggerFactory.getLogger(ExecutorEventLoop.class);

    private final ScheduledThreadPoolExecutor executor;
    private final String name;

    public ExecutorEventLoop(String name) {
        this.name = name;
        this.executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, name + "-loop");
            t.setDaemon(true);
            return t;
        });
        // cancelled reconnect timers leave the queue immediately
        this.executor.setRemoveOnCancelPolicy(true);
    }

    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(guard(task));
        } catch (RejectedExecutionException e) {
            log.debug("Event loop '{}' is closed, task dropped", name);
        }
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        try {
            ScheduledFuture<?> future = executor.schedule(guard(task), delay.toMillis(), TimeUnit.MILLISECONDS);
            return new FutureHandle(future);
        } catch (RejectedExecutionException e) {
            log.debug("Event loop '{}' is closed, timer not scheduled", name);
            return CANCELLED;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        log.debug("Event loop '{}' stopped", name);
    }

    public boolean isClosed() {
        return executor.isShutdown();
    }

    /** Tasks and timers waiting to run. */
    public int getQueuedTaskCount() {
        return executor.getQueue().size();
    }

    private Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Unhandled error on event loop '{}': {}", name, e.getMessage(), e);
            }
        };
    }

    private record FutureHandle(ScheduledFuture<?> future) implements ScheduledTask {
        @Override
        public void cancel() { future.cancel(false); }

        @Override
        public boolean isCancelled() { return future.isCancelled(); }
    }

    private static final ScheduledTask CANCELLED = new ScheduledTask() {
        @Override
        public void cancel() { }

        @Override
        public boolean isCancelled() { return true; }
    };
}
