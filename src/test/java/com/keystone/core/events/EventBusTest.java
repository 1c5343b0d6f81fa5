package com.keystone.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    private static KeystoneEvent event(String type, String workflowId) {
        return KeystoneEvent.of(type, workflowId, "STEP-001", Map.of());
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers only events of the subscribed workflow, in order")
        void workflowScoped() {
            List<KeystoneEvent> received = new ArrayList<>();
            eventBus.subscribe("WF-1", received::add);

            eventBus.publish(event("step.started", "WF-1"));
            eventBus.publish(event("step.started", "WF-2"));
            eventBus.publish(event("step.completed", "WF-1"));

            assertEquals(List.of("step.started", "step.completed"),
                    received.stream().map(KeystoneEvent::eventType).toList());
        }

        @Test
        @DisplayName("global subscribers see every workflow")
        void global() {
            List<KeystoneEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event("workflow.created", "WF-1"));
            eventBus.publish(event("workflow.created", "WF-2"));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("a null payload becomes empty")
        void nullPayload() {
            assertEquals(Map.of(), KeystoneEvent.of("x", "WF-1", null, null).payload());
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("stops delivery to that subscriber only")
        void unsubscribe() {
            List<KeystoneEvent> first = new ArrayList<>();
            List<KeystoneEvent> second = new ArrayList<>();
            EventBus.Subscription sub = eventBus.subscribe("WF-1", first::add);
            EventBus.Subscription global = eventBus.subscribeAll(second::add);

            sub.unsubscribe();
            eventBus.publish(event("step.started", "WF-1"));
            global.unsubscribe();
            eventBus.publish(event("step.completed", "WF-1"));

            assertTrue(first.isEmpty());
            assertEquals(1, second.size());
        }

        @Test
        @DisplayName("the last listener leaving a workflow releases its listener list")
        void releasesFinishedWorkflows() {
            EventBus.Subscription a = eventBus.subscribe("WF-1", e -> { });
            EventBus.Subscription b = eventBus.subscribe("WF-1", e -> { });

            a.unsubscribe();
            assertTrue(eventBus.hasListeners("WF-1"));
            b.unsubscribe();
            assertFalse(eventBus.hasListeners("WF-1"));
        }

        @Test
        @DisplayName("events without a workflow reach global listeners only")
        void workflowlessEvent() {
            List<KeystoneEvent> global = new ArrayList<>();
            eventBus.subscribeAll(global::add);
            eventBus.subscribe("WF-1", e -> fail("unexpected " + e));

            eventBus.publish(KeystoneEvent.of("keystone.started", null, null, Map.of()));

            assertEquals(1, global.size());
        }
    }

    @Nested
    @DisplayName("robustness")
    class RobustnessTests {

        @Test
        @DisplayName("a throwing subscriber does not stop delivery to others")
        void throwingSubscriber() {
            List<KeystoneEvent> received = new ArrayList<>();
            eventBus.subscribe("WF-1", e -> {
                throw new RuntimeException("boom");
            });
            eventBus.subscribe("WF-1", received::add);

            eventBus.publish(event("step.started", "WF-1"));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("handles concurrent publishes")
        void concurrentPublishes() throws InterruptedException {
            var received = new CopyOnWriteArrayList<KeystoneEvent>();
            eventBus.subscribe("WF-1", received::add);
            int threads = 8;
            var latch = new CountDownLatch(threads);
            for (int t = 0; t < threads; t++) {
                new Thread(() -> {
                    for (int i = 0; i < 50; i++) eventBus.publish(event("step.progress", "WF-1"));
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threads * 50, received.size());
        }
    }
}
