package com.atelier.sync.core.queue;

import java.util.concurrent.ScheduledFuture;

/** Per-entity queue state. Guarded by the coordinator lock; exists only while a write is pending or running. */
final class SyncQueueEntry {
    final String entityId;
    ScheduledFuture<?> timer;
    long timerGeneration;
    boolean inFlight;
    boolean rerunRequested;
    boolean retired;

    SyncQueueEntry(String entityId) {
        this.entityId = entityId;
    }

    boolean isPending() {
        return timer != null || rerunRequested;
    }

    void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
        timerGeneration++;
    }
}
