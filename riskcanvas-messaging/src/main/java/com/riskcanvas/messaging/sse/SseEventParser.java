/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.riskcanvas.messaging.sse;

import com.riskcanvas.messaging.core.StreamFrame;

import java.util.Optional;

/**
 * Incremental parser for the {@code text/event-stream} format. Feed it one line at a time
 * (without the line terminator); a blank line completes an event.
 *
 * <ul>
 *   <li>{@code event:} sets the event name of the current block</li>
 *   <li>{@code data:} appends a line to the body; several lines are joined with {@code \n}</li>
 *   <li>{@code id:} sets the last event id, which persists across events</li>
 *   <li>{@code retry:} records a reconnection hint; ignored unless all digits</li>
 *   <li>lines starting with {@code :} are comments; unknown fields are ignored</li>
 * </ul>
 * One space after the colon is stripped. A block with no {@code data} produces no frame.
 * A byte order mark at the start of the stream is skipped.
 *
 * <p>Not thread-safe; one parser per connection.
 */
public class SseEventParser {

    private final StringBuilder data = new StringBuilder();
    private boolean hasData = false;
    private String eventName = null;
    private String lastEventId = null;
    private Long blockRetry = null;
    private Long retryMillis = null;
    private boolean firstLine = true;

    /**
     * @param line one line of the stream, without its terminator
     * @return the completed frame when {@code line} is blank and the block carried data
     */
    public Optional<StreamFrame> acceptLine(String line) {
        if (firstLine) {
            firstLine = false;
            if (line.startsWith("\uFEFF")) {
                line = line.substring(1);
            }
        }
        if (line.isEmpty()) {
            return dispatch();
        }
        if (line.charAt(0) == ':') {
            return Optional.empty();
        }

        int colon = line.indexOf(':');
        String field;
        String value;
        if (colon < 0) {
            field = line;
            value = "";
        } else {
            field = line.substring(0, colon);
            value = line.substring(colon + 1);
            if (value.startsWith(" ")) {
                value = value.substring(1);
            }
        }
        processField(field, value);
        return Optional.empty();
    }

    /** Discard any partially received block, e.g. when the stream ends mid-event. */
    public void reset() {
        data.setLength(0);
        hasData = false;
        eventName = null;
        blockRetry = null;
    }

    public String getLastEventId() { return lastEventId; }

    /** Latest {@code retry:} hint from the server, or null. */
    public Long getRetryMillis() { return retryMillis; }

    private void processField(String field, String value) {
        switch (field) {
            case "event" -> eventName = value;
            case "data" -> {
                if (hasData) {
                    data.append('\n');
                }
                data.append(value);
                hasData = true;
            }
            case "id" -> {
                if (value.indexOf('\0') < 0) {
                    lastEventId = value;
                }
            }
            case "retry" -> {
                if (!value.isEmpty() && value.chars().allMatch(c -> c >= '0' && c <= '9')) {
                    try {
                        blockRetry = Long.parseLong(value);
                        retryMillis = blockRetry;
                    } catch (NumberFormatException e) {
                        // longer than a long; treated like any other malformed retry field
                        blockRetry = null;
                    }
                }
            }
            default -> { }
        }
    }

    private Optional<StreamFrame> dispatch() {
        if (!hasData) {
            reset();
            return Optional.empty();
        }
        StreamFrame frame = new StreamFrame(
                eventName == null || eventName.isEmpty() ? null : eventName,
                data.toString(),
                lastEventId,
                blockRetry);
        reset();
        return Optional.of(frame);
    }
}
