package io.clustermanager.jobs;

import java.util.concurrent.CompletableFuture;

/**
 * Cancellation signal handed to a running job. Cancelling is idempotent.
 */
public class JobCancellation {

    private final CompletableFuture<Void> signal = new CompletableFuture<>();

    /**
     * @return true if this call cancelled the job, false if it was already cancelled
     */
    public boolean cancel() {
        return signal.complete(null);
    }

    public boolean isCancelled() {
        return signal.isDone();
    }

    /**
     * Future that completes when the job is cancelled, for use in {@link CompletableFuture#anyOf}.
     */
    public CompletableFuture<Void> asFuture() {
        return signal;
    }
}
