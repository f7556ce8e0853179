/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.riskcanvas.web.controller;

import com.riskcanvas.web.stream.EventStream;
import com.riskcanvas.web.stream.EventStreamRegistry;
import com.riskcanvas.web.stream.StreamEvent;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.*;

/**
 * Server-push event streams for live job and run updates.
 */
@RestController
@RequestMapping("/events")
public class EventStreamController {

    private final EventStreamRegistry registry;

    public EventStreamController(EventStreamRegistry registry) {
        this.registry = registry;
    }

    /** GET /events: available streams with subscriber counts. */
    @GetMapping
    public List<Map<String, Object>> listStreams() {
        List<Map<String, Object>> result = new ArrayList<>();
        for (EventStream stream : registry.all()) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("name", stream.getName());
            info.put("subscribers", stream.getSubscriberCount());
            info.put("published", stream.getPublishedCount());
            info.put("demoMode", stream.isDemoMode());
            result.add(info);
        }
        return result;
    }

    /** GET /events/{stream}: subscribe (text/event-stream). */
    @GetMapping("/{stream}")
    public SseEmitter subscribe(@PathVariable String stream) {
        return registry.get(stream).subscribe();
    }

    /** POST /events/{stream}: publish {@code {"type": ..., "data": {...}}}. */
    @PostMapping("/{stream}")
    public ResponseEntity<Map<String, Object>> publish(@PathVariable String stream,
                                                       @RequestBody PublishRequest request) {
        int delivered = registry.get(stream).publish(request.type(), request.data());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stream", stream);
        body.put("type", request.type());
        body.put("delivered", delivered);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    /** GET /events/{stream}/history: recent events (demo mode only). */
    @GetMapping("/{stream}/history")
    public Map<String, Object> history(@PathVariable String stream,
                                       @RequestParam(required = false) String type,
                                       @RequestParam(defaultValue = "100") int limit) {
        List<StreamEvent> events = registry.get(stream).getHistory(type, limit);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("stream", stream);
        body.put("count", events.size());
        body.put("events", events);
        return body;
    }

    public record PublishRequest(String type, Map<String, Object> data) {}
}
