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

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Routes decoded stream payloads to the handlers registered for their topic.
 *
 * <h3>Key behaviors</h3>
 * <ul>
 *   <li><strong>Ordered fan-out:</strong> handlers run in the order they were subscribed.</li>
 *   <li><strong>Duplicates kept:</strong> subscribing the same handler twice to a topic makes it
 *       run twice per dispatch; each {@link #unsubscribe} removes one registration.</li>
 *   <li><strong>Failure isolation:</strong> a handler that throws is logged and skipped;
 *       the remaining handlers still run and {@link #dispatch} returns normally.</li>
 *   <li><strong>Independent of the connection:</strong> subscriptions can be made before,
 *       during or after a connection and survive reconnects.</li>
 * </ul>
 *
 * <h3>Thread safety</h3>
 * The table maps each topic to a {@link CopyOnWriteArrayList}. Dispatch iterates a snapshot
 * taken when it starts, so handlers added or removed concurrently neither corrupt the list nor
 * change which handlers that dispatch invokes. Entries are created and dropped inside
 * {@code compute}/{@code computeIfPresent}, so a subscribe racing the removal of a topic's
 * last handler is never lost.
 */
public class TopicDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TopicDispatcher.class);

    /** Topic that receives every frame without an explicit event name. */
    public static final String DEFAULT_TOPIC = "message";

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<TopicHandler>> topicHandlers =
            new ConcurrentHashMap<>();

    /** Dispatch calls, whether or not any handler was registered. */
    private final AtomicLong totalDispatched = new AtomicLong();

    /** Handler invocations that returned normally. */
    private final AtomicLong totalDelivered = new AtomicLong();

    /** Handler invocations that threw. */
    private final AtomicLong totalHandlerFailures = new AtomicLong();

    // ========== Subscribe / Unsubscribe ==========

    /**
     * Append a handler to a topic's list, creating the topic if needed.
     *
     * @param topic   topic name, e.g. {@code "job.status_changed"}
     * @param handler callback to invoke for each payload on that topic
     */
    public void subscribe(String topic, TopicHandler handler) {
        Objects.requireNonNull(topic, "topic must not be null");
        Objects.requireNonNull(handler, "handler must not be null");

        CopyOnWriteArrayList<TopicHandler> handlers = topicHandlers.compute(topic, (k, existing) -> {
            CopyOnWriteArrayList<TopicHandler> list = existing != null ? existing : new CopyOnWriteArrayList<>();
            list.add(handler);
            return list;
        });
        log.debug("Handler subscribed to topic '{}' (now {} handlers)", topic, handlers.size());
    }

    /**
     * Remove the first registration of {@code handler} from {@code topic}.
     * Unknown topics and handlers are ignored.
     *
     * @return true if a registration was removed
     */
    public boolean unsubscribe(String topic, TopicHandler handler) {
        if (topic == null || handler == null) {
            return false;
        }
        boolean[] removed = new boolean[1];
        topicHandlers.computeIfPresent(topic, (k, list) -> {
            removed[0] = list.remove(handler);
            return list.isEmpty() ? null : list;
        });
        if (removed[0]) {
            log.debug("Handler unsubscribed from topic '{}' ({} remaining)", topic, getHandlerCount(topic));
        }
        return removed[0];
    }

    /**
     * Drop every handler of a topic.
     *
     * @return the number of registrations removed
     */
    public int removeAll(String topic) {
        Objects.requireNonNull(topic, "topic must not be null");
        CopyOnWriteArrayList<TopicHandler> handlers = topicHandlers.remove(topic);
        int count = handlers != null ? handlers.size() : 0;
        if (count > 0) {
            log.info("All {} handlers removed from topic '{}'", count, topic);
        }
        return count;
    }

    // ========== Dispatch ==========

    /**
     * Invoke every handler registered for {@code topic} when this call starts, in subscription
     * order. Never throws because of a handler.
     *
     * @return the number of handlers that completed normally
     */
    public int dispatch(String topic, JsonNode payload) {
        Objects.requireNonNull(topic, "topic must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        totalDispatched.incrementAndGet();

        CopyOnWriteArrayList<TopicHandler> handlers = topicHandlers.get(topic);
        if (handlers == null) {
            log.debug("No handlers for topic '{}', payload discarded", topic);
            return 0;
        }

        int delivered = 0;
        for (TopicHandler handler : handlers) {
            try {
                handler.invoke(payload);
                delivered++;
                totalDelivered.incrementAndGet();
            } catch (Exception e) {
                totalHandlerFailures.incrementAndGet();
                log.error("Handler error for topic '{}': {}", topic, e.getMessage(), e);
            }
        }
        return delivered;
    }

    // ========== Query API ==========

    public int getHandlerCount(String topic) {
        List<TopicHandler> handlers = topicHandlers.get(topic);
        return handlers != null ? handlers.size() : 0;
    }

    public boolean hasHandlers(String topic) {
        return getHandlerCount(topic) > 0;
    }

    /** Topics with at least one handler. */
    public Set<String> getActiveTopics() {
        return Collections.unmodifiableSet(new TreeSet<>(topicHandlers.keySet()));
    }

    public Map<String, Integer> getTopicHandlerCounts() {
        return topicHandlers.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .collect(Collectors.toMap(
                        Map.Entry::getKey,
                        e -> e.getValue().size(),
                        (a, b) -> a,
                        LinkedHashMap::new));
    }

    public long getTotalDispatched() { return totalDispatched.get(); }

    public long getTotalDelivered() { return totalDelivered.get(); }

    public long getTotalHandlerFailures() { return totalHandlerFailures.get(); }

    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("activeTopics", topicHandlers.size());
        status.put("topicHandlerCounts", getTopicHandlerCounts());
        status.put("totalDispatched", totalDispatched.get());
        status.put("totalDelivered", totalDelivered.get());
        status.put("totalHandlerFailures", totalHandlerFailures.get());
        return status;
    }
}
