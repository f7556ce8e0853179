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
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TopicDispatcher")
class TopicDispatcherTest {

    private TopicDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new TopicDispatcher();
    }

    private static ObjectNode payload(String key, String value) {
        return JsonNodeFactory.instance.objectNode().put(key, value);
    }

    @Nested
    @DisplayName("subscribe and dispatch")
    class SubscribeAndDispatch {

        @Test
        @DisplayName("handlers run in subscription order")
        void subscriptionOrder() {
            List<String> calls = new ArrayList<>();
            dispatcher.subscribe("run.completed", p -> calls.add("first"));
            dispatcher.subscribe("run.completed", p -> calls.add("second"));
            dispatcher.subscribe("run.completed", p -> calls.add("third"));

            int delivered = dispatcher.dispatch("run.completed", payload("run_id", "r-1"));

            assertThat(delivered).isEqualTo(3);
            assertThat(calls).containsExactly("first", "second", "third");
        }

        @Test
        @DisplayName("the same handler subscribed twice runs twice")
        void duplicatesKept() {
            AtomicInteger count = new AtomicInteger();
            TopicHandler handler = p -> count.incrementAndGet();
            dispatcher.subscribe("job.created", handler);
            dispatcher.subscribe("job.created", handler);

            dispatcher.dispatch("job.created", payload("job_id", "j-1"));

            assertThat(count).hasValue(2);
            assertThat(dispatcher.getHandlerCount("job.created")).isEqualTo(2);
        }

        @Test
        @DisplayName("handlers only see their own topic")
        void topicsAreIndependent() {
            List<JsonNode> jobs = new ArrayList<>();
            List<JsonNode> runs = new ArrayList<>();
            dispatcher.subscribe("job.created", jobs::add);
            dispatcher.subscribe("run.created", runs::add);

            dispatcher.dispatch("job.created", payload("job_id", "j-7"));

            assertThat(jobs).hasSize(1);
            assertThat(runs).isEmpty();
        }

        @Test
        @DisplayName("dispatch to a topic without handlers is a counted no-op")
        void noHandlers() {
            assertThat(dispatcher.dispatch("nobody.listens", payload("a", "b"))).isZero();
            assertThat(dispatcher.getTotalDispatched()).isEqualTo(1);
            assertThat(dispatcher.getTotalDelivered()).isZero();
        }

        @Test
        @DisplayName("rejects null topic or handler")
        void rejectsNulls() {
            assertThatThrownBy(() -> dispatcher.subscribe(null, p -> { }))
                    .isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> dispatcher.subscribe("t", null))
                    .isInstanceOf(NullPointerException.class);
        }

        @Test
        @DisplayName("job status updates reach a status handler with their fields")
        void jobStatusScenario() {
            List<String> statuses = new ArrayList<>();
            dispatcher.subscribe("job.status_changed",
                    p -> statuses.add(p.get("job_id").asText() + ":" + p.get("status").asText()));

            ObjectNode update = payload("job_id", "job-42");
            update.put("status", "COMPLETED");
            dispatcher.dispatch("job.status_changed", update);

            assertThat(statuses).containsExactly("job-42:COMPLETED");
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class Unsubscribe {

        @Test
        @DisplayName("removes one registration at a time")
        void removesOneRegistration() {
            AtomicInteger count = new AtomicInteger();
            TopicHandler handler = p -> count.incrementAndGet();
            dispatcher.subscribe("job.created", handler);
            dispatcher.subscribe("job.created", handler);

            assertThat(dispatcher.unsubscribe("job.created", handler)).isTrue();
            dispatcher.dispatch("job.created", payload("job_id", "j-1"));

            assertThat(count).hasValue(1);
        }

        @Test
        @DisplayName("drops the topic once its last handler is gone")
        void dropsEmptyTopic() {
            TopicHandler handler = p -> { };
            dispatcher.subscribe("job.created", handler);
            dispatcher.unsubscribe("job.created", handler);

            assertThat(dispatcher.hasHandlers("job.created")).isFalse();
            assertThat(dispatcher.getActiveTopics()).doesNotContain("job.created");
        }

        @Test
        @DisplayName("ignores unknown topics, unknown handlers and nulls")
        void ignoresUnknown() {
            TopicHandler registered = p -> { };
            dispatcher.subscribe("job.created", registered);

            assertThat(dispatcher.unsubscribe("missing", registered)).isFalse();
            assertThat(dispatcher.unsubscribe("job.created", p -> { })).isFalse();
            assertThat(dispatcher.unsubscribe(null, registered)).isFalse();
            assertThat(dispatcher.unsubscribe("job.created", null)).isFalse();
            assertThat(dispatcher.getHandlerCount("job.created")).isEqualTo(1);
        }

        @Test
        @DisplayName("removeAll clears a topic")
        void removeAll() {
            dispatcher.subscribe("run.completed", p -> { });
            dispatcher.subscribe("run.completed", p -> { });

            assertThat(dispatcher.removeAll("run.completed")).isEqualTo(2);
            assertThat(dispatcher.removeAll("run.completed")).isZero();
        }
    }

    @Nested
    @DisplayName("failure isolation")
    class FailureIsolation {

        @Test
        @DisplayName("a throwing handler is skipped and the rest still run")
        void throwingHandlerSkipped() {
            List<String> calls = new ArrayList<>();
            dispatcher.subscribe("job.created", p -> calls.add("before"));
            dispatcher.subscribe("job.created", p -> {
                throw new IllegalStateException("boom");
            });
            dispatcher.subscribe("job.created", p -> calls.add("after"));

            int delivered = dispatcher.dispatch("job.created", payload("job_id", "j-1"));

            assertThat(delivered).isEqualTo(2);
            assertThat(calls).containsExactly("before", "after");
            assertThat(dispatcher.getTotalHandlerFailures()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("concurrent modification")
    class ConcurrentModification {

        @Test
        @DisplayName("a handler added during dispatch runs from the next dispatch")
        void addDuringDispatch() {
            List<String> calls = new ArrayList<>();
            TopicHandler late = p -> calls.add("late");
            dispatcher.subscribe("t", p -> {
                calls.add("early");
                dispatcher.subscribe("t", late);
            });

            dispatcher.dispatch("t", payload("n", "1"));
            assertThat(calls).containsExactly("early");

            calls.clear();
            dispatcher.dispatch("t", payload("n", "2"));
            assertThat(calls).startsWith("early", "late");
        }

        @Test
        @DisplayName("a handler removed during dispatch still runs for that dispatch")
        void removeDuringDispatch() {
            List<String> calls = new ArrayList<>();
            TopicHandler second = p -> calls.add("second");
            dispatcher.subscribe("t", p -> {
                calls.add("first");
                dispatcher.unsubscribe("t", second);
            });
            dispatcher.subscribe("t", second);

            dispatcher.dispatch("t", payload("n", "1"));
            assertThat(calls).containsExactly("first", "second");

            calls.clear();
            dispatcher.dispatch("t", payload("n", "2"));
            assertThat(calls).containsExactly("first");
        }

        @Test
        @DisplayName("parallel subscribe, unsubscribe and dispatch keep the table consistent")
        void parallelMutation() throws Exception {
            int threads = 8;
            int iterations = 500;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());
            AtomicInteger invocations = new AtomicInteger();
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < threads; t++) {
                    futures.add(pool.submit(() -> {
                        try {
                            start.await();
                            for (int i = 0; i < iterations; i++) {
                                TopicHandler handler = p -> invocations.incrementAndGet();
                                dispatcher.subscribe("shared", handler);
                                dispatcher.dispatch("shared", payload("i", Integer.toString(i)));
                                dispatcher.unsubscribe("shared", handler);
                            }
                        } catch (Throwable e) {
                            errors.add(e);
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> f : futures) {
                    f.get(30, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(errors).isEmpty();
            assertThat(dispatcher.getHandlerCount("shared")).isZero();
            assertThat(dispatcher.getActiveTopics()).isEmpty();
            assertThat(dispatcher.getTotalDispatched()).isEqualTo((long) threads * iterations);
            // each dispatch sees at least the handler its own thread just added
            assertThat(invocations.get()).isGreaterThanOrEqualTo(threads * iterations);
        }
    }

    @Test
    @DisplayName("status lists topics in sorted order with handler counts")
    void status() {
        dispatcher.subscribe("run.completed", p -> { });
        dispatcher.subscribe("job.created", p -> { });
        dispatcher.subscribe("job.created", p -> { });

        assertThat(dispatcher.getActiveTopics()).containsExactly("job.created", "run.completed");
        assertThat(dispatcher.getTopicHandlerCounts())
                .containsExactly(org.assertj.core.api.Assertions.entry("job.created", 2),
                        org.assertj.core.api.Assertions.entry("run.completed", 1));
        assertThat(dispatcher.getStatus()).containsEntry("activeTopics", 2);
    }
}
