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

import com.riskcanvas.common.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Broadcasts events to every connected SSE subscriber of one named stream.
 *
 * <p>Each event goes out as {@code event: <type>}, {@code data: <json>}, {@code id: <timestamp>}.
 * Subscribers whose send fails are dropped. In demo mode the stream also keeps the most recent
 * events so they can be replayed through the history endpoint.
 */
public class EventStream {

    private static final Logger log = LoggerFactory.getLogger(EventStream.class);

    private final String name;
    private final boolean demoMode;
    private final int historyLimit;
    private final Clock clock;

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();
    private final Deque<StreamEvent> history = new ArrayDeque<>();
    private final AtomicLong published = new AtomicLong();

    public EventStream(String name, boolean demoMode, int historyLimit, Clock clock) {
        this.name = name;
        this.demoMode = demoMode;
        this.historyLimit = historyLimit;
        this.clock = clock;
    }

    /**
     * Open a new subscriber. Timeout 0 keeps the connection open until the client leaves.
     */
    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(0L);
        register(emitter);
        // A comment commits the response headers so the client sees the stream as open
        // before the first real event.
        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.debug("Subscriber of stream '{}' left before the handshake: {}", name, e.getMessage());
            emitters.remove(emitter);
        }
        return emitter;
    }

    void register(SseEmitter emitter) {
        emitters.add(emitter);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(e -> emitters.remove(emitter));
        log.info("Subscriber joined stream '{}' ({} connected)", name, emitters.size());
    }

    /**
     * Send an event to all subscribers.
     *
     * @return the number of subscribers that received it
     */
    public int publish(String type, Map<String, Object> data) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Event type must not be blank");
        }
        StreamEvent event = new StreamEvent(type, data != null ? data : Map.of(), Instant.now(clock));
        published.incrementAndGet();

        if (demoMode) {
            synchronized (history) {
                history.addLast(event);
                while (history.size() > historyLimit) {
                    history.removeFirst();
                }
            }
        }

        String json = JsonUtils.toJson(event.data());
        int delivered = 0;
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(event.type()).data(json).id(event.id()));
                delivered++;
            } catch (IOException | IllegalStateException e) {
                emitters.remove(emitter);
                log.debug("Dropped subscriber of stream '{}': {}", name, e.getMessage());
            }
        }
        log.debug("Published '{}' on stream '{}' to {} subscribers", type, name, delivered);
        return delivered;
    }

    /**
     * Recent events, oldest first, optionally filtered by type. Empty unless demo mode is on.
     */
    public List<StreamEvent> getHistory(String type, int limit) {
        if (!demoMode || limit <= 0) {
            return List.of();
        }
        List<StreamEvent> events;
        synchronized (history) {
            events = new ArrayList<>(history);
        }
        if (type != null && !type.isBlank()) {
            events = events.stream().filter(e -> e.type().equals(type)).collect(Collectors.toList());
        }
        int from = Math.max(0, events.size() - limit);
        return List.copyOf(events.subList(from, events.size()));
    }

    /** Complete every open subscriber, e.g. on shutdown. */
    public void completeAll() {
        for (SseEmitter emitter : emitters) {
            emitter.complete();
        }
        emitters.clear();
    }

    public String getName() { return name; }

    public boolean isDemoMode() { return demoMode; }

    public int getSubscriberCount() { return emitters.size(); }

    public long getPublishedCount() { return published.get(); }
}
