package com.texflow.core.queue;

/**
 * Outcome of a cancel request against the queue.
 *
 * @param wasQueued the job was still pending and has been removed
 * @param wasRunning the job is executing; it will stop when the engine next polls
 * @param confirmed false when the broker could not be reached, in which case
 *                  neither flag can be trusted
 */
public record CancelResult(boolean wasQueued, boolean wasRunning, boolean confirmed) {

    public static CancelResult removed() {
        return new CancelResult(true, false, true);
    }

    public static CancelResult running() {
        return new CancelResult(false, true, true);
    }

    /** Neither pending nor running: unknown id or already finished. */
    public static CancelResult notFound() {
        return new CancelResult(false, false, true);
    }

    public static CancelResult unconfirmed() {
        return new CancelResult(false, false, false);
    }
}
