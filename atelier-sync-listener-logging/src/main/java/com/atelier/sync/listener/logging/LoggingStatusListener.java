package com.atelier.sync.listener.logging;

import com.atelier.sync.core.status.SyncStatus;
import com.atelier.sync.core.status.SyncStatusListener;
import com.atelier.sync.core.status.SyncStatusSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs every project status transition. Failures are logged at warn with the error kind and message. */
public final class LoggingStatusListener implements SyncStatusListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingStatusListener.class);

    @Override
    public void onStatusChange(SyncStatusSnapshot previous, SyncStatusSnapshot current) {
        if (current == null) return;
        SyncStatus from = previous == null ? null : previous.status();
        if (current.status() == SyncStatus.ERROR || current.status() == SyncStatus.OFFLINE) {
            log.warn(
                    "sync project={}, {} -> {}, kind={}, error={}",
                    current.projectId(),
                    from,
                    current.status(),
                    current.lastErrorKind(),
                    current.lastError());
            return;
        }
        log.info(
                "sync project={}, {} -> {}, lastSyncedAt={}",
                current.projectId(),
                from,
                current.status(),
                current.lastSyncedAt());
    }
}
