package com.musicbackup.sync;

import java.time.Instant;

/**
 * Outcome of a sync run. Exactly one of the nested records; switch on {@link #status()}.
 */
public interface SyncResult {

    enum Status { COMPLETED, INTERRUPTED, CANCELLED, FAILED }

    Status status();

    /**
     * Every planned item was fetched. The snapshot is in memory only; merging it is the caller's call.
     */
    record Completed(Snapshot snapshot) implements SyncResult {
        public Status status() {
            return Status.COMPLETED;
        }
    }

    /**
     * The run stopped on a throttle or a fetch error. {@code availableAt} is null for fetch errors.
     */
    record Interrupted(Instant availableAt, int completedCount, int plannedCount, boolean canResume,
                       InterruptionReason reason) implements SyncResult {
        public Status status() {
            return Status.INTERRUPTED;
        }
    }

    /**
     * The caller asked the run to stop.
     */
    record Cancelled(int completedCount, int plannedCount) implements SyncResult {
        public Status status() {
            return Status.CANCELLED;
        }
    }

    /**
     * The run cannot continue without caller action (e.g. re-authentication).
     */
    record Failed(String reason, Throwable cause) implements SyncResult {
        public Status status() {
            return Status.FAILED;
        }
    }
}
