/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.riskcanvas.web.stream;

import com.riskcanvas.common.exception.EventStreamException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.*;

/**
 * The named event streams served under {@code /events/{name}}: {@code jobs} and {@code runs}.
 */
@Component
public class EventStreamRegistry {

    private static final Logger log = LoggerFactory.getLogger(EventStreamRegistry.class);

    public static final String JOBS = "jobs";
    public static final String RUNS = "runs";

    private final Map<String, EventStream> streams = new LinkedHashMap<>();

    public EventStreamRegistry(@Value("${riskcanvas.demo-mode:false}") boolean demoMode,
                               @Value("${riskcanvas.events.history-limit:1000}") int historyLimit) {
        Clock clock = Clock.systemUTC();
        streams.put(JOBS, new EventStream(JOBS, demoMode, historyLimit, clock));
        streams.put(RUNS, new EventStream(RUNS, demoMode, historyLimit, clock));
        log.info("Event streams {} ready (demoMode={}, historyLimit={})", streams.keySet(), demoMode, historyLimit);
    }

    /**
     * @throws EventStreamException with {@link EventStreamException#UNKNOWN_STREAM} if no such stream
     */
    public EventStream get(String name) {
        EventStream stream = streams.get(name);
        if (stream == null) {
            throw new EventStreamException(EventStreamException.UNKNOWN_STREAM,
                    "Unknown event stream '" + name + "'. Available: " + streams.keySet());
        }
        return stream;
    }

    public Collection<EventStream> all() {
        return Collections.unmodifiableCollection(streams.values());
    }

    /** Emit a job event, e.g. {@code job.created} or {@code job.status_changed}. */
    public int emitJobEvent(String type, Map<String, Object> jobData) {
        return get(JOBS).publish(type, jobData);
    }

    /** Emit a run event, e.g. {@code run.created} or {@code run.completed}. */
    public int emitRunEvent(String type, Map<String, Object> runData) {
        return get(RUNS).publish(type, runData);
    }

    @PreDestroy
    public void shutdown() {
        streams.values().forEach(EventStream::completeAll);
        log.info("Event streams closed");
    }
}
