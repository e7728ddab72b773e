package com.atelier.sync.core.config;

import com.atelier.sync.core.merge.MergeStrategy;
import java.time.Duration;

/** Tunables of a {@link com.atelier.sync.core.engine.SyncEngine}. */
public class SyncSettings {
    private Duration debounce = Duration.ofSeconds(5);
    private Duration conflictWindow = Duration.ofSeconds(30);
    private MergeStrategy loadStrategy = MergeStrategy.SMART;
    private MergeStrategy remoteChangeStrategy = MergeStrategy.SMART;
    private boolean autoMerge = true;
    private int writerThreads = 4;
    private boolean resumeOnInit = true;
    private Duration deleteDrainTimeout = Duration.ofSeconds(10);

    public Duration getDebounce() {
        return debounce;
    }

    public void setDebounce(Duration debounce) {
        this.debounce = debounce;
    }

    public Duration getConflictWindow() {
        return conflictWindow;
    }

    public void setConflictWindow(Duration conflictWindow) {
        this.conflictWindow = conflictWindow;
    }

    public MergeStrategy getLoadStrategy() {
        return loadStrategy;
    }

    public void setLoadStrategy(MergeStrategy loadStrategy) {
        this.loadStrategy = loadStrategy;
    }

    public MergeStrategy getRemoteChangeStrategy() {
        return remoteChangeStrategy;
    }

    public void setRemoteChangeStrategy(MergeStrategy remoteChangeStrategy) {
        this.remoteChangeStrategy = remoteChangeStrategy;
    }

    public boolean isAutoMerge() {
        return autoMerge;
    }

    public void setAutoMerge(boolean autoMerge) {
        this.autoMerge = autoMerge;
    }

    public int getWriterThreads() {
        return writerThreads;
    }

    public void setWriterThreads(int writerThreads) {
        this.writerThreads = writerThreads;
    }

    /** Whether opening a session queues local projects that are newer than their remote copy. */
    public boolean isResumeOnInit() {
        return resumeOnInit;
    }

    public void setResumeOnInit(boolean resumeOnInit) {
        this.resumeOnInit = resumeOnInit;
    }

    /** Longest wait of a project deletion for the project's running push. */
    public Duration getDeleteDrainTimeout() {
        return deleteDrainTimeout;
    }

    public void setDeleteDrainTimeout(Duration deleteDrainTimeout) {
        this.deleteDrainTimeout = deleteDrainTimeout;
    }
}
