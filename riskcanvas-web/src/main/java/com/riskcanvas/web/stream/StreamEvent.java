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

import java.time.Instant;
import java.util.Map;

/**
 * One event published on an {@link EventStream}.
 *
 * @param type      event name, e.g. {@code job.status_changed}
 * @param data      JSON-serializable payload
 * @param timestamp publication time; also sent as the SSE event id
 */
public record StreamEvent(String type, Map<String, Object> data, Instant timestamp) {

    public String id() {
        return timestamp.toString();
    }
}
