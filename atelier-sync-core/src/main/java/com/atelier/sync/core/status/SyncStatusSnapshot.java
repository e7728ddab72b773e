package com.atelier.sync.core.status;

import com.atelier.sync.spi.error.SyncErrorKind;
import java.time.Instant;

/**
 * Sync state of one project.
 *
 * @param lastSyncedAt time of the last successful push, {@code null} if none in this session
 * @param lastError message of the last failure, cleared by a successful push
 */
public record SyncStatusSnapshot(
        String projectId,
        SyncStatus status,
        Instant lastSyncedAt,
        String lastError,
        SyncErrorKind lastErrorKind,
        Instant changedAt) {

    static SyncStatusSnapshot initial(String projectId, Instant now) {
        return new SyncStatusSnapshot(projectId, SyncStatus.SYNCED, null, null, null, now);
    }

    SyncStatusSnapshot with(SyncStatus next, Instant now) {
        return new SyncStatusSnapshot(projectId, next, lastSyncedAt, lastError, lastErrorKind, now);
    }
}
