package com.prakash.focusplanner.event;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CompletionEventBus}.
 */
class CompletionEventBusTest {

    private CompletionEventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new CompletionEventBus();
    }

    private static CompletionChangedEvent event(String taskId) {
        return new CompletionChangedEvent(taskId, true, LocalDateTime.of(2026, 3, 11, 9, 0), false, "focus");
    }

    @Test
    @DisplayName("delivers to subscribers of the task only")
    void perTask() {
        List<CompletionChangedEvent> received = new ArrayList<>();
        eventBus.subscribe("t-1", received::add);

        eventBus.publish(event("t-1"));
        eventBus.publish(event("t-2"));

        assertEquals(1, received.size());
        assertEquals("t-1", received.get(0).taskId());
    }

    @Test
    @DisplayName("global subscribers receive every event")
    void global() {
        List<CompletionChangedEvent> received = new ArrayList<>();
        eventBus.subscribeAll(received::add);

        eventBus.publish(event("t-1"));
        eventBus.publish(event("t-2"));

        assertEquals(2, received.size());
    }

    @Test
    @DisplayName("unsubscribed consumers stop receiving")
    void unsubscribe() {
        List<CompletionChangedEvent> received = new ArrayList<>();
        CompletionEventBus.Subscription subscription = eventBus.subscribe("t-1", received::add);

        subscription.unsubscribe();
        eventBus.publish(event("t-1"));

        assertTrue(received.isEmpty());
    }

    @Test
    @DisplayName("a failing subscriber does not stop delivery to the others")
    void failingSubscriber() {
        List<CompletionChangedEvent> received = new ArrayList<>();
        eventBus.subscribe("t-1", e -> {
            throw new IllegalStateException("boom");
        });
        eventBus.subscribeAll(received::add);

        assertDoesNotThrow(() -> eventBus.publish(event("t-1")));
        assertEquals(1, received.size());
    }
}
