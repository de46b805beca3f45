package com.extsync.core.events;

import com.extsync.core.model.AppEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for a dev session: processed-batch listeners plus a
 * one-shot readiness latch.
 * <p>
 * Readiness listeners registered before {@link #markReady()} are queued and
 * flushed once; listeners registered afterwards run immediately on the
 * registering thread. A listener that throws is logged and does not affect
 * delivery to the others.
 */
public class SessionEventBus {

    private static final Logger log = LoggerFactory.getLogger(SessionEventBus.class);

    private final CopyOnWriteArrayList<Consumer<AppEvent>> eventListeners = new CopyOnWriteArrayList<>();

    /** Guarded by {@code this}. */
    private final List<Runnable> pendingReadyListeners = new ArrayList<>();
    private boolean ready;

    /**
     * Publish a processed batch to all event listeners in registration order.
     */
    public void publish(AppEvent event) {
        log.debug("Publishing batch for {} with {} events", event.path(), event.events().size());
        for (Consumer<AppEvent> listener : eventListeners) {
            deliverSafely("event", () -> listener.accept(event));
        }
    }

    /**
     * Register a processed-batch listener.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription onEvent(Consumer<AppEvent> listener) {
        eventListeners.add(listener);
        return () -> eventListeners.remove(listener);
    }

    /**
     * Register a readiness listener. Runs immediately if the session is already ready.
     */
    public void onReady(Runnable listener) {
        synchronized (this) {
            if (!ready) {
                pendingReadyListeners.add(listener);
                return;
            }
        }
        deliverSafely("ready", listener);
    }

    /**
     * Flip the readiness latch and run queued readiness listeners. Only the first call has effect.
     */
    public void markReady() {
        List<Runnable> toRun;
        synchronized (this) {
            if (ready) return;
            ready = true;
            toRun = List.copyOf(pendingReadyListeners);
            pendingReadyListeners.clear();
        }
        for (Runnable listener : toRun) {
            deliverSafely("ready", listener);
        }
    }

    public synchronized boolean isReady() {
        return ready;
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(String kind, Runnable delivery) {
        try {
            delivery.run();
        } catch (Exception e) {
            log.warn("Listener threw exception processing {} notification: {}", kind, e.getMessage(), e);
        }
    }
}
