package com.atelier.sync.core.subscription;

import com.atelier.project.lineage.LineageMigrations;
import com.atelier.project.lineage.MalformedLineageException;
import com.atelier.project.model.HistoryItem;
import com.atelier.project.model.Project;
import com.atelier.project.model.ProjectState;
import com.atelier.sync.core.config.SyncSettings;
import com.atelier.sync.core.engine.EntityLocks;
import com.atelier.sync.core.history.HistoryPartitioner;
import com.atelier.sync.core.merge.ConflictRegistry;
import com.atelier.sync.core.merge.MergeConflict;
import com.atelier.sync.core.merge.MergeEngine;
import com.atelier.sync.core.queue.SyncCoordinator;
import com.atelier.sync.core.remote.RemoteProjectMapper;
import com.atelier.sync.core.remote.RemoteSnapshot;
import com.atelier.sync.core.session.SessionGuard;
import com.atelier.sync.core.session.SyncSession;
import com.atelier.sync.core.status.SyncStatusTracker;
import com.atelier.sync.spi.LineagePartition;
import com.atelier.sync.spi.LocalStore;
import com.atelier.sync.spi.RemoteProjectDocument;
import com.atelier.sync.spi.RemoteStore;
import com.atelier.sync.spi.RemoteSubscription;
import com.atelier.sync.spi.error.SyncException;
import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Live remote subscriptions and the folding of pushed remote changes into the local store.
 *
 * <p>Per project there is one watch on the project record, plus one watch on the styling partition of each root
 * with listeners. Subscribing the same listener twice keeps one registration. Callbacks from a closed watch are
 * dropped, so closing and reopening never duplicates notifications.
 */
@Slf4j
@RequiredArgsConstructor
public class SubscriptionManager {

    private static final String PROJECT_LEVEL = "";

    private final RemoteStore remote;
    private final RemoteProjectMapper mapper;
    private final MergeEngine merge;
    private final HistoryPartitioner partitioner;
    private final LocalStore local;
    private final EntityLocks locks;
    private final SyncCoordinator coordinator;
    private final ConflictRegistry conflicts;
    private final SyncStatusTracker status;
    private final SessionGuard sessions;
    private final SyncSettings settings;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, ProjectWatch> projects = new HashMap<>();
    private final Map<String, PushedVersion> pushed = new ConcurrentHashMap<>();

    /**
     * Subscribes {@code listener} to remote changes of {@code projectId}. With a {@code rootId} the listener also
     * receives styling changes of that root and the unified lineage of that root on every notification.
     */
    public SyncSubscription subscribe(String projectId, String rootId, ProjectChangeListener listener) {
        Objects.requireNonNull(projectId, "projectId");
        Objects.requireNonNull(listener, "listener");
        SyncSession session = sessions.require();
        String key = rootId == null ? PROJECT_LEVEL : rootId;
        synchronized (lock) {
            ProjectWatch project = projects.get(projectId);
            if (project == null) {
                project = new ProjectWatch(projectId, session);
                ProjectWatch watch = project;
                project.handle = remote.watchProject(projectId, doc -> onProjectDocument(watch, doc));
                projects.put(projectId, project);
                log.info("Opened project subscription projectId={}", projectId);
            }
            RootWatch root = project.roots.get(key);
            if (root == null) {
                root = new RootWatch(rootId);
                if (rootId != null) {
                    ProjectWatch watch = project;
                    RootWatch target = root;
                    root.handle = remote.watchLineage(
                            projectId, LineagePartition.styling(rootId), items -> onStyling(watch, target, items));
                    log.debug("Opened styling subscription projectId={} rootId={}", projectId, rootId);
                }
                project.roots.put(key, root);
            }
            if (!root.listeners.add(listener)) {
                log.debug("Listener already subscribed projectId={} rootId={}", projectId, rootId);
            }
        }
        return new SyncSubscription(() -> unsubscribe(projectId, key, listener));
    }

    /** Closes every watch of {@code projectId}. */
    public void closeProject(String projectId) {
        synchronized (lock) {
            ProjectWatch project = projects.remove(projectId);
            if (project != null) project.close();
        }
        pushed.remove(projectId);
    }

    public void closeAll() {
        int closed;
        synchronized (lock) {
            closed = projects.size();
            projects.values().forEach(ProjectWatch::close);
            projects.clear();
        }
        pushed.clear();
        if (closed > 0) log.info("Closed subscriptions for {} project(s)", closed);
    }

    public boolean isSubscribed(String projectId) {
        synchronized (lock) {
            return projects.containsKey(projectId);
        }
    }

    /** Number of open remote watches across all projects. */
    public int openWatches() {
        synchronized (lock) {
            int count = 0;
            for (ProjectWatch project : projects.values()) {
                count++;
                for (RootWatch root : project.roots.values()) {
                    if (root.handle != null) count++;
                }
            }
            return count;
        }
    }

    /** Records a push about to be made, so its echo is acknowledged instead of merged. */
    public void expectEcho(String projectId, long syncVersion, long updatedAt) {
        pushed.put(projectId, new PushedVersion(syncVersion, updatedAt));
    }

    // ---------- remote callbacks

    private void onProjectDocument(ProjectWatch watch, RemoteProjectDocument document) {
        if (watch.closed || !sessions.isCurrent(watch.session)) return;
        String projectId = watch.projectId;
        if (!watch.session.uid().equals(document.ownerId())) {
            log.warn("Ignoring change of project {} owned by another identity", projectId);
            return;
        }
        PushedVersion own = pushed.get(projectId);
        if (own != null && own.syncVersion == document.syncVersion() && own.updatedAt == document.updatedAt()) {
            acknowledge(projectId, document.syncVersion());
            return;
        }
        RemoteSnapshot snapshot;
        try {
            snapshot = mapper.read(projectId, watch.session.uid()).orElse(null);
        } catch (SyncException e) {
            log.warn("Could not read remote project {} after change: {}", projectId, e.getMessage());
            return;
        }
        if (snapshot == null) return;
        ProjectChange change = locks.withLock(projectId, () -> fold(watch, snapshot));
        if (change != null) publish(watch, change, null);
    }

    private ProjectChange fold(ProjectWatch watch, RemoteSnapshot snapshot) {
        if (watch.closed) return null;
        String projectId = watch.projectId;
        Project localProject = local.loadProject(projectId).orElse(null);
        Project mergedProject = merge.mergeMetadata(localProject, snapshot.project());
        if (!Objects.equals(mergedProject, localProject)) {
            local.saveProject(mergedProject);
        }

        ProjectState remoteState = snapshot.state();
        ProjectState localState = local.loadState(projectId).orElse(null);
        if (localState == null) {
            local.saveState(remoteState);
            return new ProjectChange(projectId, null, remoteState, List.of(), List.of(), false);
        }
        if (localState.equals(remoteState)) return null;

        List<MergeConflict> found = merge.detectConflicts(localState, remoteState);
        if (!settings.isAutoMerge() && !found.isEmpty()) {
            conflicts.park(new ConflictRegistry.PendingConflict(projectId, localState, remoteState, found, clock.instant()));
            status.conflict(projectId);
            log.info("Parked remote change for manual resolution projectId={} conflicts={}", projectId, found.size());
            return new ProjectChange(projectId, null, localState, List.of(), found, true);
        }

        ProjectState merged = merge.merge(localState, remoteState, settings.getRemoteChangeStrategy());
        if (merged.equals(localState)) return null;
        local.saveState(merged);
        if (!merged.sameContent(remoteState)) {
            coordinator.enqueue(projectId);
        }
        log.debug("Merged remote change projectId={} syncVersion={}", projectId, merged.getSyncVersion());
        return new ProjectChange(projectId, null, merged, List.of(), found, false);
    }

    private void onStyling(ProjectWatch watch, RootWatch root, List<HistoryItem> items) {
        if (watch.closed || root.closed || !sessions.isCurrent(watch.session)) return;
        String projectId = watch.projectId;
        List<HistoryItem> incoming = LineageMigrations.inferMissingTypes(items, true);
        ProjectChange change = locks.withLock(projectId, () -> {
            if (root.closed) return null;
            ProjectState state = local.loadState(projectId).orElse(null);
            if (state == null) return null;
            List<HistoryItem> current = state.getStylingHistory().getOrDefault(root.rootId, List.of());
            List<HistoryItem> merged = merge.mergeLineage(current, incoming);
            if (merged.equals(current)) return null;
            Map<String, List<HistoryItem>> styling = new LinkedHashMap<>(state.getStylingHistory());
            styling.put(root.rootId, merged);
            ProjectState next = state.toBuilder().stylingHistory(styling).build();
            local.saveState(next);
            if (!Set.copyOf(merged).equals(Set.copyOf(incoming))) {
                coordinator.enqueue(projectId);
            }
            return new ProjectChange(projectId, null, next, List.of(), List.of(), false);
        });
        if (change != null) publish(watch, change, root.rootId);
    }

    private void acknowledge(String projectId, long syncVersion) {
        locks.run(projectId, () -> local.loadState(projectId)
                .filter(s -> s.getSyncVersion() < syncVersion)
                .ifPresent(s -> local.saveState(s.toBuilder().syncVersion(syncVersion).build())));
    }

    /** Notifies project-level listeners and, if {@code onlyRoot} is null, every root; otherwise only that root. */
    private void publish(ProjectWatch watch, ProjectChange change, String onlyRoot) {
        for (RootWatch root : watch.roots.values()) {
            if (root.closed) continue;
            if (onlyRoot != null && root.rootId != null && !onlyRoot.equals(root.rootId)) continue;
            ProjectChange scoped;
            try {
                scoped = scope(change, root.rootId);
            } catch (MalformedLineageException e) {
                log.warn(
                        "Not notifying root {} of project {}, remote lineage is malformed: {}",
                        root.rootId,
                        change.projectId(),
                        e.getMessage());
                continue;
            }
            for (ProjectChangeListener listener : root.listeners) {
                try {
                    listener.onChange(scoped);
                } catch (RuntimeException e) {
                    log.warn(
                            "Project change listener {} failed for project {}",
                            listener.getClass().getName(),
                            change.projectId(),
                            e);
                }
            }
        }
    }

    private ProjectChange scope(ProjectChange change, String rootId) {
        if (rootId == null) return change;
        return new ProjectChange(
                change.projectId(),
                rootId,
                change.state(),
                partitioner.unify(change.state(), rootId),
                change.conflicts(),
                change.awaitingResolution());
    }

    private void unsubscribe(String projectId, String key, ProjectChangeListener listener) {
        synchronized (lock) {
            ProjectWatch project = projects.get(projectId);
            if (project == null) return;
            RootWatch root = project.roots.get(key);
            if (root == null || !root.listeners.remove(listener) || !root.listeners.isEmpty()) return;
            root.close();
            project.roots.remove(key);
            if (project.roots.isEmpty()) {
                project.close();
                projects.remove(projectId);
                log.info("Closed project subscription projectId={}", projectId);
            }
        }
    }

    // ---------- watch bookkeeping

    private record PushedVersion(long syncVersion, long updatedAt) {}

    private static final class ProjectWatch {
        final String projectId;
        final SyncSession session;
        final Map<String, RootWatch> roots = new ConcurrentHashMap<>();
        RemoteSubscription handle;
        volatile boolean closed;

        ProjectWatch(String projectId, SyncSession session) {
            this.projectId = projectId;
            this.session = session;
        }

        void close() {
            closed = true;
            roots.values().forEach(RootWatch::close);
            roots.clear();
            if (handle != null) handle.close();
        }
    }

    private static final class RootWatch {
        final String rootId;
        final Set<ProjectChangeListener> listeners = new CopyOnWriteArraySet<>();
        RemoteSubscription handle;
        volatile boolean closed;

        RootWatch(String rootId) {
            this.rootId = rootId;
        }

        void close() {
            closed = true;
            listeners.clear();
            if (handle != null) handle.close();
        }
    }
}
