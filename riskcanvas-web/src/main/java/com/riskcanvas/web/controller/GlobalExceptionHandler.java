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

import com.riskcanvas.common.exception.EventStreamException;
import com.riskcanvas.common.exception.RiskCanvasException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders errors from the event stream endpoints as JSON.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(EventStreamException.class)
    public ResponseEntity<Map<String, Object>> handleStream(EventStreamException ex, HttpServletRequest request) {
        HttpStatus status = EventStreamException.UNKNOWN_STREAM.equals(ex.getErrorCode())
                ? HttpStatus.NOT_FOUND : HttpStatus.BAD_GATEWAY;
        log.warn("Event stream error at {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return build(status, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request at {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "RC_BAD_REQUEST", ex.getMessage(), request);
    }

    @ExceptionHandler(RiskCanvasException.class)
    public ResponseEntity<Map<String, Object>> handleRiskCanvas(RiskCanvasException ex, HttpServletRequest request) {
        log.error("Unhandled RiskCanvas error at {} {}: {}", request.getMethod(), request.getRequestURI(),
                ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage(), request);
    }

    private ResponseEntity<Map<String, Object>> build(HttpStatus status, String code, String message,
                                                      HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        body.put("status", status.value());
        body.put("path", request.getRequestURI());
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(body);
    }
}
