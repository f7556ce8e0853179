/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.riskcanvas.common.exception;

/**
 * Raised for failures of a server-push event stream: refused or dropped connections,
 * unexpected HTTP responses, and streams closed by the server.
 */
public class EventStreamException extends RiskCanvasException {

    public static final String CONNECT_FAILED = "RC_STREAM_CONNECT_FAILED";
    public static final String BAD_RESPONSE = "RC_STREAM_BAD_RESPONSE";
    public static final String CLOSED = "RC_STREAM_CLOSED";
    public static final String UNKNOWN_STREAM = "RC_STREAM_UNKNOWN";

    public EventStreamException(String errorCode, String message) {
        super(errorCode, message);
    }

    public EventStreamException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
