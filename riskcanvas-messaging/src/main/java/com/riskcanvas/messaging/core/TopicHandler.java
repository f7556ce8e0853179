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

/**
 * Callback registered against a topic with {@link TopicDispatcher#subscribe}.
 *
 * <p>Handlers are compared by identity when unsubscribing, so keep a reference to the
 * instance you registered. Exceptions thrown here are logged and never reach the caller of
 * {@code dispatch}.
 *
 * <pre>{@code
 *   TopicHandler onStatus = payload ->
 *       log.info("Job {} is now {}", payload.path("job_id").asText(), payload.path("status").asText());
 *   client.subscribe("job.status_changed", onStatus);
 * }</pre>
 */
@FunctionalInterface
public interface TopicHandler {

    /**
     * @param payload decoded frame body, never null
     */
    void invoke(JsonNode payload);
}
