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

import com.riskcanvas.common.exception.EventStreamException;
import com.riskcanvas.messaging.core.StreamFrame;
import com.riskcanvas.messaging.core.Transport;
import com.riskcanvas.messaging.core.TransportConnection;
import com.riskcanvas.messaging.core.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Server-Sent Events transport over {@link HttpClient}.
 *
 * <p>Each {@link #open} sends one GET with {@code Accept: text/event-stream} plus the configured
 * headers. The response must be 200 with a {@code text/event-stream} content type; anything else
 * is reported as a failure. Body lines are read on a daemon thread and parsed with
 * {@link SseEventParser}. End of stream counts as a failure (the server went away).
 *
 * <p>The transport never reconnects by itself and ignores {@code retry:} hints; reconnection
 * is the supervisor's decision.
 */
public class SseTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(SseTransport.class);

    public static final String EVENT_STREAM_TYPE = "text/event-stream";

    private final HttpClient httpClient;
    private final Map<String, String> headers;
    private final String threadName;

    public SseTransport(HttpClient httpClient, Map<String, String> headers, String threadName) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.threadName = threadName;
    }

    public static SseTransport create(Duration connectTimeout, Map<String, String> headers, String threadName) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return new SseTransport(client, headers, threadName);
    }

    @Override
    public TransportConnection open(URI endpoint, TransportListener listener) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(endpoint)
                .GET()
                .header("Accept", EVENT_STREAM_TYPE)
                .header("Cache-Control", "no-cache");
        headers.forEach(builder::header);

        SseConnection connection = new SseConnection(endpoint, listener);
        connection.start(httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofInputStream()));
        return connection;
    }

    public Map<String, String> getHeaders() { return headers; }

    /** One HTTP exchange. Reports at most one failure, and none after {@link #close()}. */
    private final class SseConnection implements TransportConnection {

        private final URI endpoint;
        private final TransportListener listener;
        private final AtomicBoolean failureReported = new AtomicBoolean();
        private volatile boolean closed = false;
        private volatile CompletableFuture<HttpResponse<InputStream>> pending;
        private volatile InputStream body;
        private volatile Thread reader;

        SseConnection(URI endpoint, TransportListener listener) {
            this.endpoint = endpoint;
            this.listener = listener;
        }

        void start(CompletableFuture<HttpResponse<InputStream>> future) {
            this.pending = future;
            future.whenComplete(this::onResponse);
        }

        private void onResponse(HttpResponse<InputStream> response, Throwable error) {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                fail(new EventStreamException(EventStreamException.CONNECT_FAILED,
                        "Failed to connect to " + endpoint + ": " + describe(cause), cause));
                return;
            }
            InputStream in = response.body();
            if (closed) {
                closeQuietly(in);
                return;
            }
            if (response.statusCode() != 200) {
                closeQuietly(in);
                fail(new EventStreamException(EventStreamException.BAD_RESPONSE,
                        "Unexpected HTTP status " + response.statusCode() + " from " + endpoint));
                return;
            }
            String contentType = response.headers().firstValue("Content-Type").orElse("");
            if (!contentType.toLowerCase(Locale.ROOT).startsWith(EVENT_STREAM_TYPE)) {
                closeQuietly(in);
                fail(new EventStreamException(EventStreamException.BAD_RESPONSE,
                        "Unexpected content type '" + contentType + "' from " + endpoint));
                return;
            }

            body = in;
            if (closed) {
                closeQuietly(in);
                return;
            }
            listener.onOpen();
            Thread t = new Thread(() -> readLoop(in), threadName + "-reader");
            t.setDaemon(true);
            reader = t;
            t.start();
        }

        private void readLoop(InputStream in) {
            SseEventParser parser = new SseEventParser();
            try (BufferedReader lines = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while (!closed && (line = lines.readLine()) != null) {
                    Optional<StreamFrame> frame = parser.acceptLine(line);
                    if (frame.isPresent()) {
                        if (frame.get().retry() != null) {
                            log.debug("Server suggested retry of {}ms on {}, using own backoff policy",
                                    frame.get().retry(), endpoint);
                        }
                        listener.onFrame(frame.get());
                    }
                }
                fail(new EventStreamException(EventStreamException.CLOSED, "Stream closed by server: " + endpoint));
            } catch (IOException e) {
                fail(new EventStreamException(EventStreamException.CLOSED,
                        "Stream read failed on " + endpoint + ": " + describe(e), e));
            }
        }

        private void fail(EventStreamException cause) {
            if (closed || !failureReported.compareAndSet(false, true)) {
                log.debug("Suppressed transport failure on {}: {}", endpoint, cause.getMessage());
                return;
            }
            listener.onFailure(cause);
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            CompletableFuture<HttpResponse<InputStream>> future = pending;
            if (future != null) {
                future.cancel(true);
            }
            InputStream in = body;
            if (in != null) {
                closeQuietly(in);
            }
            Thread t = reader;
            if (t != null && t != Thread.currentThread()) {
                t.interrupt();
            }
            log.debug("SSE connection to {} closed", endpoint);
        }

        @Override
        public boolean isOpen() {
            return !closed && body != null && !failureReported.get();
        }

        private void closeQuietly(InputStream in) {
            try {
                in.close();
            } catch (IOException e) {
                log.debug("Error closing SSE body from {}: {}", endpoint, e.getMessage());
            }
        }

        private String describe(Throwable t) {
            return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        }
    }
}
