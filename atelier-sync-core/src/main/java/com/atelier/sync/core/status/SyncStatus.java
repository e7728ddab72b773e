package com.atelier.sync.core.status;

public enum SyncStatus {
    SYNCED,
    PENDING,
    SYNCING,
    OFFLINE,
    ERROR,
    CONFLICT
}
