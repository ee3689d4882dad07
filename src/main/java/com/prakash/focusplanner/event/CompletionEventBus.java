package com.prakash.focusplanner.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for task completion changes.
 * <p>
 * Supports per-task subscriptions and global subscriptions that receive every event.
 * A failing subscriber is logged and skipped; it never breaks the publisher.
 */
@Service
public class CompletionEventBus {

    private static final Logger log = LoggerFactory.getLogger(CompletionEventBus.class);

    /** Per-task subscribers keyed by taskId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<CompletionChangedEvent>>> taskSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<CompletionChangedEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(CompletionChangedEvent event) {
        log.debug("Publishing completion change for task {} (completed={}, source={})",
                event.taskId(), event.completed(), event.source());

        List<Consumer<CompletionChangedEvent>> taskSubs = taskSubscribers.get(event.taskId());
        if (taskSubs != null) {
            for (Consumer<CompletionChangedEvent> subscriber : taskSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<CompletionChangedEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to completion changes of one task.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String taskId, Consumer<CompletionChangedEvent> consumer) {
        taskSubscribers.computeIfAbsent(taskId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to completion changes of task {}", taskId);
        return () -> {
            CopyOnWriteArrayList<Consumer<CompletionChangedEvent>> subs = taskSubscribers.get(taskId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<CompletionChangedEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all completion changes");
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<CompletionChangedEvent> subscriber, CompletionChangedEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing completion change of task {}: {}",
                    event.taskId(), e.getMessage(), e);
        }
    }
}
