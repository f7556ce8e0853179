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
import com.riskcanvas.messaging.core.TransportConnection;
import com.riskcanvas.messaging.core.TransportListener;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SseTransport")
class SseTransportTest {

    private HttpServer server;
    private ExecutorService serverThreads;
    private final CountDownLatch release = new CountDownLatch(1);
    private final Map<String, String> seenHeaders = new ConcurrentHashMap<>();
    private SseTransport transport;
    private TransportConnection connection;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverThreads = Executors.newCachedThreadPool();
        server.setExecutor(serverThreads);
        server.createContext("/stream", this::streamAndHold);
        server.createContext("/short", this::streamAndClose);
        server.createContext("/error", exchange -> respond(exchange, 503, "text/plain", "unavailable"));
        server.createContext("/json", exchange -> respond(exchange, 200, "application/json", "{}"));
        server.start();
        transport = SseTransport.create(Duration.ofSeconds(5), Map.of("x-demo-user", "demo-user"), "sse-test");
    }

    @AfterEach
    void tearDown() {
        if (connection != null) {
            connection.close();
        }
        release.countDown();
        server.stop(0);
        serverThreads.shutdownNow();
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
    }

    private static final String FRAMES =
            ": connected\n\n"
            + "event: job.created\ndata: {\"job_id\":\"j-1\"}\nid: 1\n\n"
            + "data: {\"plain\":\n"
            + "data: true}\n\n";

    private void streamAndHold(HttpExchange exchange) throws IOException {
        exchange.getRequestHeaders().forEach((k, v) -> seenHeaders.put(k.toLowerCase(), String.join(",", v)));
        exchange.getResponseHeaders().add("Content-Type", "text/event-stream; charset=utf-8");
        exchange.sendResponseHeaders(200, 0);
        OutputStream out = exchange.getResponseBody();
        out.write(FRAMES.getBytes(StandardCharsets.UTF_8));
        out.flush();
        try {
            release.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            exchange.close();
        }
    }

    private void streamAndClose(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", "text/event-stream");
        exchange.sendResponseHeaders(200, 0);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write("data: {\"last\":true}\n\n".getBytes(StandardCharsets.UTF_8));
        }
    }

    private static void respond(HttpExchange exchange, int status, String type, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", type);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    @DisplayName("opens, sends headers and delivers frames in order")
    void deliversFrames() throws Exception {
        RecordingListener listener = new RecordingListener();
        connection = transport.open(uri("/stream"), listener);

        assertThat(listener.opened.await(5, TimeUnit.SECONDS)).isTrue();
        StreamFrame first = listener.frames.poll(5, TimeUnit.SECONDS);
        StreamFrame second = listener.frames.poll(5, TimeUnit.SECONDS);

        assertThat(first).isNotNull();
        assertThat(first.event()).isEqualTo("job.created");
        assertThat(first.data()).isEqualTo("{\"job_id\":\"j-1\"}");
        assertThat(first.id()).isEqualTo("1");
        assertThat(second).isNotNull();
        assertThat(second.event()).isNull();
        assertThat(second.data()).isEqualTo("{\"plain\":\ntrue}");

        assertThat(connection.isOpen()).isTrue();
        assertThat(seenHeaders).containsEntry("accept", "text/event-stream")
                .containsEntry("x-demo-user", "demo-user");
    }

    @Test
    @DisplayName("reports end of stream as a failure")
    void serverCloseIsFailure() throws Exception {
        RecordingListener listener = new RecordingListener();
        connection = transport.open(uri("/short"), listener);

        assertThat(listener.frames.poll(5, TimeUnit.SECONDS)).isNotNull();
        Throwable failure = listener.failures.poll(5, TimeUnit.SECONDS);

        assertThat(failure).isInstanceOf(EventStreamException.class)
                .hasFieldOrPropertyWithValue("errorCode", EventStreamException.CLOSED);
        assertThat(listener.failures.poll(200, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    @DisplayName("rejects non-200 responses without opening")
    void badStatus() throws Exception {
        RecordingListener listener = new RecordingListener();
        connection = transport.open(uri("/error"), listener);

        Throwable failure = listener.failures.poll(5, TimeUnit.SECONDS);

        assertThat(failure).isInstanceOf(EventStreamException.class)
                .hasFieldOrPropertyWithValue("errorCode", EventStreamException.BAD_RESPONSE)
                .hasMessageContaining("503");
        assertThat(listener.opened.getCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("rejects responses that are not an event stream")
    void wrongContentType() throws Exception {
        RecordingListener listener = new RecordingListener();
        connection = transport.open(uri("/json"), listener);

        Throwable failure = listener.failures.poll(5, TimeUnit.SECONDS);

        assertThat(failure).isInstanceOf(EventStreamException.class)
                .hasFieldOrPropertyWithValue("errorCode", EventStreamException.BAD_RESPONSE)
                .hasMessageContaining("application/json");
    }

    @Test
    @DisplayName("reports an unreachable endpoint as a connect failure")
    void connectFailure() throws Exception {
        int freePort;
        try (ServerSocket socket = new ServerSocket(0)) {
            freePort = socket.getLocalPort();
        }
        URI unreachable = URI.create("http://127.0.0.1:" + freePort + "/stream");

        RecordingListener listener = new RecordingListener();
        connection = transport.open(unreachable, listener);

        Throwable failure = listener.failures.poll(10, TimeUnit.SECONDS);

        assertThat(failure).isInstanceOf(EventStreamException.class)
                .hasFieldOrPropertyWithValue("errorCode", EventStreamException.CONNECT_FAILED);
    }

    @Test
    @DisplayName("a closed connection reports nothing further")
    void closeIsSilent() throws Exception {
        RecordingListener listener = new RecordingListener();
        connection = transport.open(uri("/stream"), listener);
        assertThat(listener.opened.await(5, TimeUnit.SECONDS)).isTrue();

        connection.close();
        release.countDown();

        assertThat(connection.isOpen()).isFalse();
        assertThat(listener.failures.poll(500, TimeUnit.MILLISECONDS)).isNull();
    }

    private static final class RecordingListener implements TransportListener {
        final CountDownLatch opened = new CountDownLatch(1);
        final BlockingQueue<StreamFrame> frames = new LinkedBlockingQueue<>();
        final BlockingQueue<Throwable> failures = new LinkedBlockingQueue<>();

        @Override
        public void onOpen() { opened.countDown(); }

        @Override
        public void onFrame(StreamFrame frame) { frames.add(frame); }

        @Override
        public void onFailure(Throwable cause) { failures.add(cause); }
    }
}
