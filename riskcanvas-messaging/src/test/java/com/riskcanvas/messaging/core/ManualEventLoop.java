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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Single-threaded {@link EventLoop} driven by the test. Tasks run on {@link #runPending()};
 * timers fire only when {@link #advance(Duration)} moves the virtual clock past them.
 */
public class ManualEventLoop implements EventLoop {

    private final Deque<Runnable> queue = new ArrayDeque<>();
    private final List<Timer> timers = new ArrayList<>();
    private long nowMillis = 0;
    private long sequence = 0;
    private boolean closed = false;

    @Override
    public void execute(Runnable task) {
        if (!closed) {
            queue.addLast(task);
        }
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        Timer timer = new Timer(nowMillis + delay.toMillis(), sequence++, task);
        if (!closed) {
            timers.add(timer);
        } else {
            timer.cancel();
        }
        return timer;
    }

    @Override
    public void close() {
        closed = true;
        queue.clear();
        timers.clear();
    }

    /** Run queued tasks, including tasks they enqueue, until the queue is empty. */
    public void runPending() {
        Runnable task;
        while ((task = queue.pollFirst()) != null) {
            task.run();
        }
    }

    /** Move the clock forward, firing due timers in order and draining the queue after each. */
    public void advance(Duration duration) {
        runPending();
        long target = nowMillis + duration.toMillis();
        while (true) {
            Timer next = timers.stream()
                    .filter(t -> !t.cancelled && t.dueAt <= target)
                    .min(Comparator.comparingLong((Timer t) -> t.dueAt).thenComparingLong(t -> t.seq))
                    .orElse(null);
            if (next == null) {
                break;
            }
            timers.remove(next);
            nowMillis = next.dueAt;
            next.fired = true;
            next.task.run();
            runPending();
        }
        nowMillis = target;
    }

    /** Timers that are scheduled, not yet fired and not cancelled. */
    public int activeTimerCount() {
        return (int) timers.stream().filter(t -> !t.cancelled && !t.fired).count();
    }

    public long nowMillis() { return nowMillis; }

    public boolean isClosed() { return closed; }

    private static final class Timer implements ScheduledTask {
        private final long dueAt;
        private final long seq;
        private final Runnable task;
        private boolean cancelled;
        private boolean fired;

        Timer(long dueAt, long seq, Runnable task) {
            this.dueAt = dueAt;
            this.seq = seq;
            this.task = task;
        }

        @Override
        public void cancel() { cancelled = true; }

        @Override
        public boolean isCancelled() { return cancelled; }
    }
}
