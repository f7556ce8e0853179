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

import com.riskcanvas.common.config.AuthHeaders;
import com.riskcanvas.common.config.RCProperties;
import com.riskcanvas.common.exception.ConfigurationException;
import com.riskcanvas.messaging.core.BackoffPolicy;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for an {@link EventClient}.
 *
 * <p>Usage with builder pattern:
 * <pre>{@code
 *   EventClientConfig config = EventClientConfig.builder()
 *       .endpoint("http://127.0.0.1:8090/events/jobs")
 *       .header("x-demo-user", "demo-user")
 *       .build();
 * }</pre>
 *
 * <p>Or from properties:
 * <pre>{@code
 *   EventClientConfig config = EventClientConfig.fromProperties(RCProperties.load());
 * }</pre>
 */
public class EventClientConfig {

    public static final String PREFIX = "riskcanvas.events.";

    private URI endpoint;
    private Duration reconnectDelay = BackoffPolicy.DEFAULT_DELAY;
    private int maxReconnectAttempts = BackoffPolicy.DEFAULT_MAX_ATTEMPTS;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private String clientName = "riskcanvas-events";
    private final Map<String, String> headers = new LinkedHashMap<>();

    private EventClientConfig() {}

    // ========== Builder ==========

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private final EventClientConfig config = new EventClientConfig();
        private String endpoint;

        public Builder endpoint(String url) {
            this.endpoint = url; return this;
        }
        public Builder reconnectDelay(Duration delay) {
            config.reconnectDelay = delay; return this;
        }
        public Builder maxReconnectAttempts(int attempts) {
            config.maxReconnectAttempts = attempts; return this;
        }
        public Builder connectTimeout(Duration timeout) {
            config.connectTimeout = timeout; return this;
        }
        public Builder clientName(String name) {
            config.clientName = name; return this;
        }
        public Builder header(String name, String value) {
            config.headers.put(name, value); return this;
        }
        public Builder headers(Map<String, String> headers) {
            config.headers.putAll(headers); return this;
        }

        public EventClientConfig build() {
            if (endpoint == null || endpoint.isBlank()) {
                throw new ConfigurationException("Event stream endpoint must be set");
            }
            try {
                config.endpoint = URI.create(endpoint.trim());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid event stream endpoint '" + endpoint + "': " + e.getMessage());
            }
            if (config.reconnectDelay == null || config.reconnectDelay.isNegative()) {
                throw new ConfigurationException("reconnectDelay must be a non-negative duration");
            }
            if (config.maxReconnectAttempts < 0) {
                throw new ConfigurationException("maxReconnectAttempts must be >= 0");
            }
            if (config.connectTimeout == null || config.connectTimeout.isNegative() || config.connectTimeout.isZero()) {
                throw new ConfigurationException("connectTimeout must be positive");
            }
            if (config.clientName == null || config.clientName.isBlank()) {
                throw new ConfigurationException("clientName must not be blank");
            }
            // Snapshot so later builder calls cannot change a built config
            EventClientConfig built = new EventClientConfig();
            built.endpoint = config.endpoint;
            built.reconnectDelay = config.reconnectDelay;
            built.maxReconnectAttempts = config.maxReconnectAttempts;
            built.connectTimeout = config.connectTimeout;
            built.clientName = config.clientName;
            built.headers.putAll(config.headers);
            return built;
        }
    }

    // ========== Factory from properties ==========

    /**
     * Recognized keys:
     *   riskcanvas.events.endpoint, riskcanvas.events.reconnect-delay,
     *   riskcanvas.events.max-reconnect-attempts, riskcanvas.events.connect-timeout,
     *   riskcanvas.events.client-name, riskcanvas.events.header.&lt;name&gt;
     * plus the auth keys read by {@link AuthHeaders}. Explicit header properties win over
     * auth headers of the same name.
     */
    public static EventClientConfig fromProperties(RCProperties props) {
        Builder b = builder()
                .endpoint(props.getString(PREFIX + "endpoint"))
                .reconnectDelay(props.getDuration(PREFIX + "reconnect-delay", BackoffPolicy.DEFAULT_DELAY))
                .maxReconnectAttempts(props.getInt(PREFIX + "max-reconnect-attempts", BackoffPolicy.DEFAULT_MAX_ATTEMPTS))
                .connectTimeout(props.getDuration(PREFIX + "connect-timeout", Duration.ofSeconds(10)))
                .clientName(props.getString(PREFIX + "client-name", "riskcanvas-events"))
                .headers(AuthHeaders.resolve(props))
                .headers(props.getSubProperties(PREFIX + "header."));
        return b.build();
    }

    /** Defaults for everything except the endpoint. */
    public static EventClientConfig forEndpoint(String url) {
        return builder().endpoint(url).build();
    }

    // ========== Getters ==========

    public URI getEndpoint() { return endpoint; }
    public Duration getReconnectDelay() { return reconnectDelay; }
    public int getMaxReconnectAttempts() { return maxReconnectAttempts; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public String getClientName() { return clientName; }
    public Map<String, String> getHeaders() { return Collections.unmodifiableMap(headers); }

    public BackoffPolicy toBackoffPolicy() {
        return BackoffPolicy.fixedDelay(maxReconnectAttempts, reconnectDelay);
    }

    @Override
    public String toString() {
        return "EventClientConfig{endpoint=" + endpoint
                + ", reconnectDelay=" + reconnectDelay.toMillis() + "ms"
                + ", maxReconnectAttempts=" + maxReconnectAttempts
                + ", connectTimeout=" + connectTimeout.toMillis() + "ms"
                + ", clientName='" + clientName + "'"
                + ", headers=" + headers.keySet() + "}";
    }
}
