package com.atelier.sync.core.status;

@FunctionalInterface
public interface SyncStatusListener {

    void onStatusChange(SyncStatusSnapshot previous, SyncStatusSnapshot current);
}
