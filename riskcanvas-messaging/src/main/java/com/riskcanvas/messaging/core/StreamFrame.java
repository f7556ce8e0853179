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

/**
 * One frame of a server-push stream, as delivered by a {@link Transport}.
 *
 * @param event optional event name; null or empty means the default topic
 * @param data  raw frame body (JSON text)
 * @param id    optional event id sent by the server
 * @param retry optional reconnection hint in milliseconds; informational only
 */
public record StreamFrame(String event, String data, String id, Long retry) {

    public StreamFrame {
        if (data == null) {
            throw new IllegalArgumentException("data must not be null");
        }
    }

    /** Frame without a named event type. */
    public static StreamFrame of(String data) {
        return new StreamFrame(null, data, null, null);
    }

    public static StreamFrame named(String event, String data) {
        return new StreamFrame(event, data, null, null);
    }

    public boolean hasEventName() {
        return event != null && !event.isEmpty();
    }
}
