package com.stagegate.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    // -- WorkflowEvent ----------------------------------------------------------

    @Test
    @DisplayName("of() creates a run-level event without a task id")
    void ofCreatesRunLevelEvent() {
        var event = WorkflowEvent.of("run.created", "R-1", Map.of("objective", "ship"));

        assertEquals("run.created", event.eventType());
        assertEquals("R-1", event.runId());
        assertNull(event.taskId());
        assertEquals("ship", event.payload().get("objective"));
        assertNotNull(event.timestamp());
    }

    // -- Subscribe and publish --------------------------------------------------

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers events to the run's subscribers in order")
        void deliversInOrder() {
            List<WorkflowEvent> received = new ArrayList<>();
            eventBus.subscribe("R-1", received::add);

            eventBus.publish(WorkflowEvent.of("run.created", "R-1", Map.of()));
            eventBus.publish(new WorkflowEvent("task.started", "R-1", "T-1", Map.of(), Instant.now()));
            eventBus.publish(WorkflowEvent.of("gate.decided", "R-1", Map.of("action", "PROCEED")));

            assertEquals(List.of("run.created", "task.started", "gate.decided"),
                    received.stream().map(WorkflowEvent::eventType).toList());
        }

        @Test
        @DisplayName("does not deliver events of another run")
        void otherRunIgnored() {
            List<WorkflowEvent> received = new ArrayList<>();
            eventBus.subscribe("R-2", received::add);

            eventBus.publish(WorkflowEvent.of("run.created", "R-1", Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("global subscribers receive every run's events")
        void globalSubscriber() {
            List<WorkflowEvent> global = new ArrayList<>();
            List<WorkflowEvent> scoped = new ArrayList<>();
            eventBus.subscribeAll(global::add);
            eventBus.subscribe("R-1", scoped::add);

            eventBus.publish(WorkflowEvent.of("run.created", "R-1", Map.of()));
            eventBus.publish(WorkflowEvent.of("run.created", "R-2", Map.of()));

            assertEquals(2, global.size());
            assertEquals(1, scoped.size());
        }
    }

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("stops delivery of later events")
        void stopsDelivery() {
            List<WorkflowEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("R-1", received::add);

            eventBus.publish(WorkflowEvent.of("stage.entered", "R-1", Map.of()));
            subscription.unsubscribe();
            eventBus.publish(WorkflowEvent.of("stage.entered", "R-1", Map.of()));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("unsubscribing a global subscriber stops delivery")
        void globalUnsubscribe() {
            List<WorkflowEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribeAll(received::add);

            subscription.unsubscribe();
            eventBus.publish(WorkflowEvent.of("run.created", "R-1", Map.of()));

            assertTrue(received.isEmpty());
        }
    }

    @Test
    @DisplayName("a throwing subscriber does not prevent delivery to others")
    void throwingSubscriberIsolated() {
        List<WorkflowEvent> received = new ArrayList<>();
        eventBus.subscribe("R-1", e -> {
            throw new IllegalStateException("boom");
        });
        eventBus.subscribe("R-1", received::add);

        eventBus.publish(WorkflowEvent.of("run.completed", "R-1", Map.of()));

        assertEquals(1, received.size());
    }
}
