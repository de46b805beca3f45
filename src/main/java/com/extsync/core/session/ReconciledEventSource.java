package com.extsync.core.session;

import com.extsync.core.model.ReconciledBatch;

import java.util.concurrent.CompletableFuture;

/**
 * Source of reconciled change batches.
 * Implementations: WorkspaceWatcher (local directories).
 * <p>
 * Sources deliver batches one at a time in arrival order and should wait for
 * the future returned by the handler before delivering the next batch.
 */
public interface ReconciledEventSource {

    /**
     * Starts delivering batches to {@code handler}.
     *
     * @return a {@link Subscription} handle that stops delivery
     */
    Subscription subscribe(BatchHandler handler);

    /**
     * A source that never delivers anything, for one-shot builds.
     */
    static ReconciledEventSource none() {
        return handler -> () -> {};
    }

    @FunctionalInterface
    interface BatchHandler {
        /**
         * @return a future completing once the batch has been fully processed
         */
        CompletableFuture<Void> handle(ReconciledBatch batch);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    interface Subscription {
        void unsubscribe();
    }
}
