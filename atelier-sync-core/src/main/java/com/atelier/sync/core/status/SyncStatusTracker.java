package com.atelier.sync.core.status;

import com.atelier.sync.spi.error.SyncErrorKind;
import com.atelier.sync.spi.error.SyncException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-project sync status. Listeners are called on the thread that caused the transition and only when the
 * status value changes.
 */
@Slf4j
public class SyncStatusTracker {

    private final Map<String, SyncStatusSnapshot> statuses = new ConcurrentHashMap<>();
    private final List<SyncStatusListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public SyncStatusTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void addListener(SyncStatusListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(SyncStatusListener listener) {
        listeners.remove(listener);
    }

    public SyncStatusSnapshot get(String projectId) {
        return statuses.getOrDefault(projectId, SyncStatusSnapshot.initial(projectId, clock.instant()));
    }

    public void pending(String projectId) {
        transition(projectId, s -> s.with(SyncStatus.PENDING, clock.instant()));
    }

    public void syncing(String projectId) {
        transition(projectId, s -> s.with(SyncStatus.SYNCING, clock.instant()));
    }

    public void synced(String projectId) {
        Instant now = clock.instant();
        transition(projectId, s -> new SyncStatusSnapshot(projectId, SyncStatus.SYNCED, now, null, null, now));
    }

    public void failed(String projectId, SyncException error) {
        SyncStatus next = error.getKind() == SyncErrorKind.REMOTE_UNAVAILABLE ? SyncStatus.OFFLINE : SyncStatus.ERROR;
        Instant now = clock.instant();
        transition(
                projectId,
                s -> new SyncStatusSnapshot(projectId, next, s.lastSyncedAt(), error.getMessage(), error.getKind(), now));
    }

    public void failed(String projectId, RuntimeException error) {
        Instant now = clock.instant();
        transition(
                projectId,
                s -> new SyncStatusSnapshot(projectId, SyncStatus.ERROR, s.lastSyncedAt(), error.toString(), null, now));
    }

    public void conflict(String projectId) {
        transition(projectId, s -> s.with(SyncStatus.CONFLICT, clock.instant()));
    }

    public void clear(String projectId) {
        statuses.remove(projectId);
    }

    public void reset() {
        statuses.clear();
    }

    private void transition(String projectId, UnaryOperator<SyncStatusSnapshot> change) {
        SyncStatusSnapshot[] previous = new SyncStatusSnapshot[1];
        SyncStatusSnapshot next = statuses.compute(projectId, (id, existing) -> {
            SyncStatusSnapshot base = existing == null ? SyncStatusSnapshot.initial(id, clock.instant()) : existing;
            previous[0] = base;
            return change.apply(base);
        });
        if (previous[0].status() == next.status() && Objects.equals(previous[0].lastError(), next.lastError())) {
            return;
        }
        for (SyncStatusListener listener : listeners) {
            try {
                listener.onStatusChange(previous[0], next);
            } catch (RuntimeException e) {
                log.warn("Sync status listener {} failed for project {}", listener.getClass().getName(), projectId, e);
            }
        }
    }
}
