/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.riskcanvas.messaging;

import com.riskcanvas.messaging.core.*;
import com.riskcanvas.messaging.sse.SseTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.Map;

/**
 * Real-time update client for RiskCanvas event streams.
 *
 * <p>Handlers can be registered at any time, before or after {@link #connect()}, and stay
 * registered across reconnects. Connection problems never surface as exceptions: watch
 * {@link #getState()} or add a {@link ConnectionStateListener}.
 *
 * <pre>{@code
 *   EventClient client = new EventClient("http://127.0.0.1:8090/events/jobs");
 *   client.subscribe("job.status_changed", payload -> refresh(payload.path("job_id").asText()));
 *   client.connect();
 *   ...
 *   client.close();
 * }</pre>
 */
public class EventClient implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(EventClient.class);

    private final EventClientConfig config;
    private final TopicDispatcher dispatcher;
    private final ConnectionSupervisor supervisor;
    private final EventLoop eventLoop;

    public EventClient(String endpointUrl) {
        this(EventClientConfig.forEndpoint(endpointUrl));
    }

    public EventClient(EventClientConfig config) {
        this(config,
             SseTransport.create(config.getConnectTimeout(), config.getHeaders(), config.getClientName()),
             new ExecutorEventLoop(config.getClientName()));
    }

    /** Wiring seam for alternative transports and deterministic event loops. */
    public EventClient(EventClientConfig config, Transport transport, EventLoop eventLoop) {
        this.config = config;
        this.eventLoop = eventLoop;
        this.dispatcher = new TopicDispatcher();
        this.supervisor = new ConnectionSupervisor(config.getEndpoint(), transport,
                config.toBackoffPolicy(), dispatcher, eventLoop);
        log.debug("EventClient created: {}", config);
    }

    /** Create a client and start connecting right away. */
    public static EventClient createAndConnect(String endpointUrl) {
        EventClient client = new EventClient(endpointUrl);
        client.connect();
        return client;
    }

    public void connect() { supervisor.connect(); }

    public void disconnect() { supervisor.disconnect(); }

    public void subscribe(String topic, TopicHandler handler) {
        dispatcher.subscribe(topic, handler);
    }

    public void unsubscribe(String topic, TopicHandler handler) {
        dispatcher.unsubscribe(topic, handler);
    }

    public void addStateListener(ConnectionStateListener listener) {
        supervisor.addStateListener(listener);
    }

    public void removeStateListener(ConnectionStateListener listener) {
        supervisor.removeStateListener(listener);
    }

    public ConnectionState getState() { return supervisor.getState(); }

    public EventClientConfig getConfig() { return config; }

    public TopicDispatcher getDispatcher() { return dispatcher; }

    public ConnectionSupervisor getSupervisor() { return supervisor; }

    public Map<String, Object> getStatus() { return supervisor.getStatus(); }

    /**
     * Disconnect and stop the event loop. The client cannot be reconnected afterwards.
     */
    @Override
    public void close() {
        supervisor.disconnect();
        // The disconnect runs on the loop; close the loop behind it.
        eventLoop.execute(eventLoop::close);
        log.debug("EventClient for {} closing", config.getEndpoint());
    }
}
