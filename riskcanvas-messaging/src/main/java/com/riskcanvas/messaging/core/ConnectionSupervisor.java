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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.riskcanvas.common.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns one server-push connection: opens it, reconnects it through a {@link BackoffPolicy}
 * when it fails, and hands every inbound frame to a {@link TopicDispatcher}.
 *
 * <h3>Architecture</h3>
 * <pre>
 *   connect() / disconnect() ──┐
 *   transport callbacks ───────┼──► EventLoop (single thread) ──► state machine
 *   reconnect timer ───────────┘                                    │
 *                                                                    ▼
 *                                                    TopicDispatcher.dispatch(topic, payload)
 * </pre>
 *
 * <h3>Key behaviors</h3>
 * <ul>
 *   <li><strong>Serialized:</strong> every transition runs on the event loop, so state, the
 *       reconnect counter and the pending timer are never mutated concurrently.
 *       {@link #connect()} and {@link #disconnect()} only post events and return at once.</li>
 *   <li><strong>One transport:</strong> {@code connect()} while CONNECTING, CONNECTED or
 *       RECONNECTING is a no-op.</li>
 *   <li><strong>One timer:</strong> at most one reconnect is pending; {@code disconnect()}
 *       cancels it, and a timer that already fired re-checks the state before opening.</li>
 *   <li><strong>Stale events ignored:</strong> each open gets a new generation number; callbacks
 *       carrying an older generation are dropped.</li>
 *   <li><strong>Nothing thrown:</strong> transport failures end in the observable FAILED state,
 *       undecodable frames are dropped, handler errors are isolated by the dispatcher.</li>
 * </ul>
 */
public class ConnectionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    private final URI endpoint;
    private final Transport transport;
    private final BackoffPolicy backoffPolicy;
    private final TopicDispatcher dispatcher;
    private final EventLoop eventLoop;
    private final List<ConnectionStateListener> stateListeners = new CopyOnWriteArrayList<>();

    // Written only on the event loop; volatile so getters can read from any thread.
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile int reconnectAttempts = 0;
    private volatile EventLoop.ScheduledTask pendingReconnect;

    // Event loop confined.
    private TransportConnection connection;
    private long generation = 0;

    private final AtomicLong transportsOpened = new AtomicLong();
    private final AtomicLong framesReceived = new AtomicLong();
    private final AtomicLong framesDropped = new AtomicLong();

    public ConnectionSupervisor(URI endpoint, Transport transport, BackoffPolicy backoffPolicy,
                                TopicDispatcher dispatcher, EventLoop eventLoop) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop must not be null");
    }

    // ========== Public API ==========

    /**
     * Start connecting if DISCONNECTED or FAILED; otherwise do nothing.
     * Returns without waiting for the connection.
     */
    public void connect() {
        eventLoop.execute(this::handleConnect);
    }

    /**
     * Cancel any pending reconnect, close the transport and go to DISCONNECTED.
     * Safe in every state and safe to repeat.
     */
    public void disconnect() {
        eventLoop.execute(this::handleDisconnect);
    }

    public void addStateListener(ConnectionStateListener listener) {
        stateListeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeStateListener(ConnectionStateListener listener) {
        stateListeners.remove(listener);
    }

    public ConnectionState getState() { return state; }

    public URI getEndpoint() { return endpoint; }

    /** Consecutive failed attempts since the last successful open or explicit connect. */
    public int getReconnectAttempts() { return reconnectAttempts; }

    public boolean hasPendingReconnect() { return pendingReconnect != null; }

    public BackoffPolicy getBackoffPolicy() { return backoffPolicy; }

    public TopicDispatcher getDispatcher() { return dispatcher; }

    public long getTransportsOpened() { return transportsOpened.get(); }

    public long getFramesReceived() { return framesReceived.get(); }

    public long getFramesDropped() { return framesDropped.get(); }

    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("endpoint", endpoint.toString());
        status.put("state", state.name());
        status.put("reconnectAttempts", reconnectAttempts);
        status.put("maxReconnectAttempts", backoffPolicy.getMaxAttempts());
        status.put("reconnectPending", hasPendingReconnect());
        status.put("transportsOpened", transportsOpened.get());
        status.put("framesReceived", framesReceived.get());
        status.put("framesDropped", framesDropped.get());
        status.put("dispatcher", dispatcher.getStatus());
        return status;
    }

    // ========== Event handlers (event loop only) ==========

    private void handleConnect() {
        if (state.isActive()) {
            log.debug("connect() ignored for {}: already {}", endpoint, state);
            return;
        }
        reconnectAttempts = 0;
        openTransport();
    }

    private void handleDisconnect() {
        cancelPendingReconnect();
        generation++;
        closeConnection();
        if (state != ConnectionState.DISCONNECTED) {
            transitionTo(ConnectionState.DISCONNECTED);
            log.info("Disconnected from {}", endpoint);
        }
    }

    private void handleOpen(long gen) {
        if (gen != generation || state != ConnectionState.CONNECTING) {
            log.debug("Ignoring open event from superseded transport (generation {})", gen);
            return;
        }
        reconnectAttempts = 0;
        transitionTo(ConnectionState.CONNECTED);
        log.info("Connected to {}", endpoint);
    }

    private void handleFrame(long gen, StreamFrame frame) {
        if (gen != generation || state != ConnectionState.CONNECTED) {
            log.debug("Ignoring frame from inactive transport (generation {}, state {})", gen, state);
            return;
        }
        framesReceived.incrementAndGet();
        routeFrame(frame);
    }

    private void handleFailure(long gen, Throwable cause) {
        if (gen != generation) {
            log.debug("Ignoring failure from superseded transport (generation {})", gen);
            return;
        }
        if (state != ConnectionState.CONNECTING && state != ConnectionState.CONNECTED) {
            log.debug("Ignoring transport failure in state {}", state);
            return;
        }
        closeConnection();
        reconnectAttempts++;
        String reason = cause != null ? cause.getMessage() : "unknown";
        log.warn("Connection to {} lost: {}", endpoint, reason);

        if (backoffPolicy.shouldRetry(reconnectAttempts)) {
            transitionTo(ConnectionState.RECONNECTING);
            scheduleReconnect();
        } else {
            transitionTo(ConnectionState.FAILED);
            log.error("Max reconnection attempts ({}) reached for {}, giving up",
                    backoffPolicy.getMaxAttempts(), endpoint);
        }
    }

    // ========== Internals ==========

    private void openTransport() {
        long gen = ++generation;
        transitionTo(ConnectionState.CONNECTING);
        transportsOpened.incrementAndGet();
        log.info("Connecting to {}", endpoint);
        try {
            connection = transport.open(endpoint, new GenerationListener(gen));
        } catch (RuntimeException e) {
            handleFailure(gen, e);
        }
    }

    private void scheduleReconnect() {
        if (pendingReconnect != null) {
            log.warn("Reconnect already pending for {}, not scheduling another", endpoint);
            return;
        }
        Duration delay = backoffPolicy.delayFor(reconnectAttempts);
        log.info("Reconnecting to {} in {}ms (attempt {}/{})",
                endpoint, delay.toMillis(), reconnectAttempts, backoffPolicy.getMaxAttempts());
        final EventLoop.ScheduledTask[] holder = new EventLoop.ScheduledTask[1];
        holder[0] = eventLoop.schedule(() -> onReconnectTimer(holder[0]), delay);
        pendingReconnect = holder[0];
    }

    private void onReconnectTimer(EventLoop.ScheduledTask fired) {
        if (fired != pendingReconnect) {
            return;
        }
        pendingReconnect = null;
        if (state != ConnectionState.RECONNECTING) {
            log.debug("Reconnect timer fired in state {}, ignoring", state);
            return;
        }
        openTransport();
    }

    private void cancelPendingReconnect() {
        EventLoop.ScheduledTask task = pendingReconnect;
        if (task != null) {
            task.cancel();
            pendingReconnect = null;
            log.debug("Pending reconnect to {} cancelled", endpoint);
        }
    }

    private void closeConnection() {
        TransportConnection current = connection;
        connection = null;
        if (current == null) {
            return;
        }
        try {
            current.close();
        } catch (RuntimeException e) {
            log.warn("Error closing transport to {}: {}", endpoint, e.getMessage());
        }
    }

    /**
     * Frames without an event name go to {@link TopicDispatcher#DEFAULT_TOPIC}; named frames go
     * to their own topic only.
     */
    private void routeFrame(StreamFrame frame) {
        String topic = frame.hasEventName() ? frame.event() : TopicDispatcher.DEFAULT_TOPIC;
        JsonNode payload;
        try {
            payload = JsonUtils.readTree(frame.data());
        } catch (JsonProcessingException e) {
            framesDropped.incrementAndGet();
            log.warn("Failed to parse frame on topic '{}', dropped: {}", topic, e.getOriginalMessage());
            return;
        }
        if (payload == null || payload.isMissingNode()) {
            framesDropped.incrementAndGet();
            log.warn("Empty frame body on topic '{}', dropped", topic);
            return;
        }
        dispatcher.dispatch(topic, payload);
    }

    private void transitionTo(ConnectionState next) {
        ConnectionState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        log.debug("{}: {} -> {}", endpoint, previous, next);
        for (ConnectionStateListener listener : stateListeners) {
            try {
                listener.onStateChanged(previous, next);
            } catch (Exception e) {
                log.error("State listener error on {} -> {}: {}", previous, next, e.getMessage(), e);
            }
        }
    }

    /** Posts transport callbacks to the event loop, tagged with the generation that opened them. */
    private final class GenerationListener implements TransportListener {
        private final long gen;

        GenerationListener(long gen) { this.gen = gen; }

        @Override
        public void onOpen() {
            eventLoop.execute(() -> handleOpen(gen));
        }

        @Override
        public void onFrame(StreamFrame frame) {
            eventLoop.execute(() -> handleFrame(gen, frame));
        }

        @Override
        public void onFailure(Throwable cause) {
            eventLoop.execute(() -> handleFailure(gen, cause));
        }
    }

    @Override
    public String toString() {
        return "ConnectionSupervisor{endpoint=" + endpoint + ", state=" + state
                + ", reconnectAttempts=" + reconnectAttempts + "}";
    }
}
