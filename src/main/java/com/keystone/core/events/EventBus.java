package com.keystone.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for orchestration events.
 * <p>
 * A listener either follows one workflow or sees every workflow. Delivery is synchronous on the
 * publishing thread, so a step's events reach listeners in the order the engine raised them.
 * A failing listener is logged and skipped; it never fails the step that published.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Listeners of a single workflow, keyed by workflow ID. Emptied lists are dropped. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<KeystoneEvent>>> byWorkflow =
            new ConcurrentHashMap<>();

    /** Listeners of every workflow, such as the reasoning trail. */
    private final CopyOnWriteArrayList<Consumer<KeystoneEvent>> everyWorkflow = new CopyOnWriteArrayList<>();

    /**
     * Delivers an event to the listeners of its workflow, then to the global listeners.
     * Events without a workflow ID reach global listeners only.
     *
     * @param event the event to deliver
     */
    public void publish(KeystoneEvent event) {
        log.debug("Event {} [workflow={}, step={}]", event.eventType(), event.workflowId(), event.stepId());

        if (event.workflowId() != null) {
            List<Consumer<KeystoneEvent>> listeners = byWorkflow.get(event.workflowId());
            if (listeners != null) {
                listeners.forEach(l -> deliver(l, event));
            }
        }
        everyWorkflow.forEach(l -> deliver(l, event));
    }

    /**
     * Follows one workflow.
     *
     * @param workflowId workflow whose events the listener receives
     * @param listener   callback invoked on the publishing thread
     * @return handle that stops delivery to this listener
     */
    public Subscription subscribe(String workflowId, Consumer<KeystoneEvent> listener) {
        byWorkflow.computeIfAbsent(workflowId, k -> new CopyOnWriteArrayList<>()).add(listener);
        log.debug("Listener attached to workflow {}", workflowId);
        return () -> byWorkflow.computeIfPresent(workflowId, (id, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    /**
     * Follows every workflow.
     *
     * @return handle that stops delivery to this listener
     */
    public Subscription subscribeAll(Consumer<KeystoneEvent> listener) {
        everyWorkflow.add(listener);
        return () -> everyWorkflow.remove(listener);
    }

    boolean hasListeners(String workflowId) {
        return byWorkflow.containsKey(workflowId);
    }

    /** Handle returned by the subscribe methods. */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static void deliver(Consumer<KeystoneEvent> listener, KeystoneEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for workflow {}: {}",
                    event.eventType(), event.workflowId(), e.getMessage(), e);
        }
    }
}
