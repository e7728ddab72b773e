package com.atelier.sync.spring.autoconfigure;

import com.atelier.sync.core.config.SyncSettings;
import com.atelier.sync.core.merge.MergeStrategy;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the project sync engine.
 *
 * <h3>Configuration Example:</h3>
 * <pre>{@code
 * # application.yml
 * atelier:
 *   sync:
 *     enabled: true                  # auto-configure the engine (default)
 *     debounce: 5s                   # quiet period before a queued push runs
 *     conflict-window: 30s           # edits closer than this are reported as conflicts
 *     load-strategy: smart           # smart | prefer-local | prefer-remote
 *     remote-change-strategy: smart
 *     auto-merge: true               # false parks conflicting remote changes
 *     writer-threads: 4
 *     resume-on-init: true           # queue local projects that are ahead of remote on sign-in
 *     delete-drain-timeout: 10s      # how long a project deletion waits for the project's running push
 *     local-store:
 *       directory: /var/lib/atelier/sync
 * }</pre>
 */
@ConfigurationProperties(prefix = "atelier.sync")
public class AtelierSyncProperties {

    /** Master switch for the auto-configured engine. */
    private boolean enabled = true;

    /** Quiet period after the last mutation of a project before its push runs. */
    private Duration debounce = Duration.ofSeconds(5);

    /**
     * Two snapshots whose scalar fields were both edited within this window are reported as conflicting. Reports
     * never block a merge unless {@link #autoMerge} is off.
     */
    private Duration conflictWindow = Duration.ofSeconds(30);

    private MergeStrategy loadStrategy = MergeStrategy.SMART;

    private MergeStrategy remoteChangeStrategy = MergeStrategy.SMART;

    /** When false, a remote change that conflicts with local edits waits for an explicit resolve call. */
    private boolean autoMerge = true;

    private int writerThreads = 4;

    private boolean resumeOnInit = true;

    private Duration deleteDrainTimeout = Duration.ofSeconds(10);

    private final LocalStore localStore = new LocalStore();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

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

    public boolean isResumeOnInit() {
        return resumeOnInit;
    }

    public void setResumeOnInit(boolean resumeOnInit) {
        this.resumeOnInit = resumeOnInit;
    }

    public Duration getDeleteDrainTimeout() {
        return deleteDrainTimeout;
    }

    public void setDeleteDrainTimeout(Duration deleteDrainTimeout) {
        this.deleteDrainTimeout = deleteDrainTimeout;
    }

    public LocalStore getLocalStore() {
        return localStore;
    }

    /** Engine settings carrying these properties. */
    public SyncSettings toSettings() {
        SyncSettings settings = new SyncSettings();
        settings.setDebounce(debounce);
        settings.setConflictWindow(conflictWindow);
        settings.setLoadStrategy(loadStrategy);
        settings.setRemoteChangeStrategy(remoteChangeStrategy);
        settings.setAutoMerge(autoMerge);
        settings.setWriterThreads(writerThreads);
        settings.setResumeOnInit(resumeOnInit);
        settings.setDeleteDrainTimeout(deleteDrainTimeout);
        return settings;
    }

    /** JSON-file local store used when the application defines no {@code LocalStore} bean. */
    public static class LocalStore {

        private String directory = System.getProperty("java.io.tmpdir") + "/atelier-sync";

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }
}
