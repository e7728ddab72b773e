package com.atelier.sync.core.engine;

import com.atelier.project.lineage.LineageMigrations;
import com.atelier.project.model.HistoryItem;
import com.atelier.project.model.Project;
import com.atelier.project.model.ProjectState;
import com.atelier.project.model.ProjectStatus;
import com.atelier.project.model.WardrobeItem;
import com.atelier.project.model.WardrobeSource;
import com.atelier.project.validation.PayloadValidator;
import com.atelier.project.validation.ValidationResult;
import com.atelier.sync.core.blob.ExternalizationReport;
import com.atelier.sync.core.blob.InlineBinaryExternalizer;
import com.atelier.sync.core.config.SyncSettings;
import com.atelier.sync.core.history.HistoryPartitioner;
import com.atelier.sync.core.history.NodeRemoval;
import com.atelier.sync.core.history.RemoteDeletion;
import com.atelier.sync.core.merge.ConflictRegistry;
import com.atelier.sync.core.merge.MergeEngine;
import com.atelier.sync.core.merge.MergeStrategy;
import com.atelier.sync.core.queue.SyncCoordinator;
import com.atelier.sync.core.remote.PushLedger;
import com.atelier.sync.core.remote.PushResult;
import com.atelier.sync.core.remote.RemoteDeletionBacklog;
import com.atelier.sync.core.remote.RemoteProjectMapper;
import com.atelier.sync.core.remote.RemoteSnapshot;
import com.atelier.sync.core.session.SessionGuard;
import com.atelier.sync.core.session.SyncSession;
import com.atelier.sync.core.status.SyncStatusListener;
import com.atelier.sync.core.status.SyncStatusSnapshot;
import com.atelier.sync.core.status.SyncStatusTracker;
import com.atelier.sync.core.subscription.ProjectChangeListener;
import com.atelier.sync.core.subscription.SubscriptionManager;
import com.atelier.sync.core.subscription.SyncSubscription;
import com.atelier.sync.core.validation.InlineBinaryDetector;
import com.atelier.sync.spi.LocalStore;
import com.atelier.sync.spi.RemoteProjectDocument;
import com.atelier.sync.spi.RemoteStore;
import com.atelier.sync.spi.blob.BlobStore;
import com.atelier.sync.spi.error.MalformedEntityException;
import com.atelier.sync.spi.error.RemoteUnavailableException;
import com.atelier.sync.spi.error.SyncException;
import com.atelier.sync.spi.error.ValidationRejectedException;
import com.atelier.sync.spi.identity.IdentityProvider;
import com.atelier.sync.spi.identity.UserIdentity;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for the application layer. Owns the local store, the write queue, the subscriptions and the session
 * lifecycle; callers request mutations and read snapshots but never write the stores directly.
 *
 * <p>Every local mutation is applied synchronously (a failed local write is thrown to the caller) and then queued
 * for a debounced push. Remote failures of queued pushes are absorbed and surface only through
 * {@link #statusOf(String)}; {@link #forceFlush(String)} throws them to its caller.
 */
@Slf4j
public class SyncEngine implements AutoCloseable {

    private final LocalStore local;
    private final RemoteStore remote;
    private final BlobStore blobs;
    private final SyncSettings settings;
    private final Clock clock;
    private final PayloadValidator validator;

    private final SessionGuard sessions = new SessionGuard();
    private final EntityLocks locks = new EntityLocks();
    private final HistoryPartitioner partitioner = new HistoryPartitioner();
    private final PushLedger ledger = new PushLedger();
    private final RemoteDeletionBacklog backlog = new RemoteDeletionBacklog();
    private final ConflictRegistry conflicts = new ConflictRegistry();
    private final SyncStatusTracker status;
    private final MergeEngine merge;
    private final RemoteProjectMapper mapper;
    private final SyncCoordinator coordinator;
    private final SubscriptionManager subscriptions;
    private final InlineBinaryExternalizer externalizer;

    private Runnable identityRegistration;

    private SyncEngine(Builder b) {
        this.local = Objects.requireNonNull(b.localStore, "localStore");
        this.remote = Objects.requireNonNull(b.remoteStore, "remoteStore");
        this.blobs = Objects.requireNonNull(b.blobStore, "blobStore");
        this.settings = b.settings == null ? new SyncSettings() : b.settings;
        this.clock = b.clock == null ? Clock.systemUTC() : b.clock;
        this.validator = b.validator == null ? new InlineBinaryDetector() : b.validator;
        this.status = new SyncStatusTracker(clock);
        this.merge = new MergeEngine(settings.getConflictWindow(), clock);
        this.mapper = new RemoteProjectMapper(remote, ledger);
        this.coordinator = new SyncCoordinator(
                this::push, sessions, status, settings.getDebounce(), settings.getWriterThreads());
        this.subscriptions = new SubscriptionManager(
                remote, mapper, merge, partitioner, local, locks, coordinator, conflicts, status, sessions, settings,
                clock);
        this.externalizer = new InlineBinaryExternalizer(blobs);
        b.statusListeners.forEach(status::addListener);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------- lifecycle

    /** Opens a session for {@code identity}, ending any session of a different identity first. */
    public synchronized SyncSession init(UserIdentity identity) {
        Optional<SyncSession> active = sessions.current();
        if (active.isPresent() && active.get().identity().equals(identity)) {
            return active.get();
        }
        if (active.isPresent()) {
            teardown();
        }
        SyncSession session = sessions.open(identity);
        log.info("Sync session opened uid={} epoch={}", identity.uid(), session.epoch());
        if (settings.isResumeOnInit()) {
            resumeUnsynced(session);
        }
        return session;
    }

    /**
     * Ends the active session: pending writes are dropped, subscriptions are closed, and results of writes still
     * running are discarded when they arrive.
     */
    public synchronized void teardown() {
        Optional<SyncSession> ended = sessions.close();
        int dropped = coordinator.cancelAll();
        subscriptions.closeAll();
        ledger.clear();
        backlog.clear();
        conflicts.clear();
        status.reset();
        ended.ifPresent(s -> log.info(
                "Sync session closed uid={} epoch={} droppedWrites={}", s.uid(), s.epoch(), dropped));
    }

    /** Follows {@code provider}: sign-in opens a session, sign-out or a different identity ends it. */
    public synchronized void bind(IdentityProvider provider) {
        unbind();
        provider.current().ifPresent(this::init);
        identityRegistration = provider.onChange(identity -> {
            if (identity.isPresent()) {
                init(identity.get());
            } else {
                teardown();
            }
        });
    }

    public synchronized void unbind() {
        if (identityRegistration != null) {
            identityRegistration.run();
            identityRegistration = null;
        }
    }

    public Optional<SyncSession> currentSession() {
        return sessions.current();
    }

    @Override
    public void close() {
        unbind();
        teardown();
        coordinator.close();
    }

    // ---------- entity operations

    /**
     * Applies {@code patch} to the local state of {@code projectId} (an empty state if none exists) and queues a
     * push. The result is stamped with a fresh {@code updatedAt}; its {@code syncVersion} is kept. A state that
     * fails validation is saved locally but not queued.
     */
    public ProjectState saveEntity(String projectId, UnaryOperator<ProjectState> patch) {
        Objects.requireNonNull(patch, "patch");
        return mutate(projectId, current -> Objects.requireNonNull(patch.apply(current), "patch result"));
    }

    /** Saves project metadata and queues a push. The owner defaults to the session identity. */
    public Project saveProject(Project project) {
        SyncSession session = sessions.require();
        Project saved = locks.withLock(project.id(), () -> writeProject(project, session));
        coordinator.enqueue(project.id());
        return saved;
    }

    /**
     * Creates a project locally and pushes it immediately.
     *
     * @throws SyncException if the immediate push fails; the project is kept locally and retried on the next
     *     mutation
     */
    public Project createProject(Project project) {
        SyncSession session = sessions.require();
        Project saved = locks.withLock(project.id(), () -> {
            Project written = writeProject(project, session);
            if (local.loadState(project.id()).isEmpty()) {
                local.saveState(ProjectState.builder()
                        .id(project.id())
                        .updatedAt(written.updatedAt())
                        .build());
            }
            return written;
        });
        log.info("Created project projectId={} owner={}", saved.id(), saved.ownerId());
        coordinator.forceFlush(saved.id());
        return saved;
    }

    /**
     * Returns the local state of {@code projectId}, first folding in the remote copy when it is newer. An
     * unreachable remote store is not an error: the local copy is returned.
     */
    public Optional<ProjectState> loadEntity(String projectId) {
        SyncSession session = sessions.require();
        Optional<RemoteSnapshot> fetched;
        try {
            fetched = mapper.read(projectId, session.uid());
        } catch (SyncException e) {
            log.warn("Serving local copy of project {}, remote read failed: {}", projectId, e.getMessage());
            return local.loadState(projectId);
        }
        if (!sessions.isCurrent(session)) {
            return local.loadState(projectId);
        }
        boolean[] push = new boolean[1];
        ProjectState result = locks.withLock(projectId, () -> {
            ProjectState localState = local.loadState(projectId).orElse(null);
            RemoteSnapshot snapshot = fetched.orElse(null);
            if (snapshot == null) {
                push[0] = localState != null;
                return localState;
            }
            Project localProject = local.loadProject(projectId).orElse(null);
            Project mergedProject = merge.mergeMetadata(localProject, snapshot.project());
            if (!Objects.equals(mergedProject, localProject)) local.saveProject(mergedProject);

            ProjectState remoteState = snapshot.state();
            if (localState == null) {
                local.saveState(remoteState);
                return remoteState;
            }
            boolean remoteNewer = remoteState.getSyncVersion() > localState.getSyncVersion()
                    || remoteState.getUpdatedAt() > localState.getUpdatedAt();
            if (!remoteNewer) {
                push[0] = !localState.sameContent(remoteState);
                return localState;
            }
            ProjectState merged = merge.merge(localState, remoteState, settings.getLoadStrategy());
            if (!merged.equals(localState)) local.saveState(merged);
            push[0] = !merged.sameContent(remoteState);
            log.debug("Loaded project {} merged with newer remote copy syncVersion={}", projectId, merged.getSyncVersion());
            return merged;
        });
        if (push[0]) queueIfValid(projectId, result);
        return Optional.ofNullable(result);
    }

    /**
     * Deletes a project everywhere: pending writes are cancelled, subscriptions closed, local records removed, the
     * remote project with all its collections deleted, and its owned blobs deleted. Remote and blob failures are
     * logged and do not undo the local deletion.
     *
     * @return whether the project existed locally
     */
    public boolean deleteEntity(String projectId) {
        sessions.require();
        awaitRunningPush(projectId);
        subscriptions.closeProject(projectId);
        conflicts.take(projectId);
        ProjectState[] removed = new ProjectState[1];
        boolean existed = locks.withLock(projectId, () -> {
            removed[0] = local.loadState(projectId).orElse(null);
            boolean present = removed[0] != null || local.loadProject(projectId).isPresent();
            local.delete(projectId);
            return present;
        });
        status.clear(projectId);
        backlog.forget(projectId);
        Set<String> roots = removed[0] == null ? Set.of() : removed[0].stylingRootIds();
        try {
            mapper.deleteProject(projectId, roots);
        } catch (SyncException e) {
            log.warn("Remote deletion of project {} failed, local copy already removed: {}", projectId, e.getMessage());
        }
        if (removed[0] != null) deleteOwnedBlobs(removed[0]);
        log.info("Deleted project projectId={} existedLocally={}", projectId, existed);
        return existed;
    }

    private void awaitRunningPush(String projectId) {
        try {
            Duration timeout = settings.getDeleteDrainTimeout();
            if (!coordinator.cancelAndAwait(projectId, timeout)) {
                log.warn("Push of project {} still running after {}, deleting anyway", projectId, timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted waiting for the push of project {}, deleting anyway", projectId);
        }
    }

    /**
     * Pushes {@code projectId} now on the calling thread.
     *
     * @return {@code false} if a push for the project was already running
     * @throws SyncException if the push fails
     */
    public boolean forceFlush(String projectId) {
        sessions.require();
        return coordinator.forceFlush(projectId);
    }

    /** Receives remote changes of {@code projectId}; with a {@code rootId} also styling changes of that root. */
    public SyncSubscription subscribe(String projectId, String rootId, ProjectChangeListener listener) {
        return subscriptions.subscribe(projectId, rootId, listener);
    }

    // ---------- lineage operations

    /** Saves the unified lineage of {@code rootId}, splitting it into the primary and styling partitions. */
    public ProjectState saveUnifiedHistory(String projectId, String rootId, List<HistoryItem> lineage) {
        return mutate(projectId, state -> partitioner.store(state, rootId, lineage));
    }

    public List<HistoryItem> loadUnifiedHistory(String projectId, String rootId) {
        return local.loadState(projectId)
                .map(state -> partitioner.unify(state, rootId))
                .orElse(List.of());
    }

    /**
     * Renames, stars or otherwise edits one lineage item in place. The patch may not change the item id.
     *
     * @return the updated item, empty if the item does not exist
     */
    public Optional<HistoryItem> updateHistoryItem(String projectId, String itemId, UnaryOperator<HistoryItem> patch) {
        HistoryItem[] updated = new HistoryItem[1];
        mutate(projectId, state -> {
            HistoryItem existing = state.allHistoryItems().stream()
                    .filter(i -> itemId.equals(i.id()))
                    .findFirst()
                    .orElse(null);
            if (existing == null) return null;
            HistoryItem next = Objects.requireNonNull(patch.apply(existing), "patch result");
            if (!itemId.equals(next.id())) {
                throw new MalformedEntityException(itemId, List.of("id"));
            }
            updated[0] = next.toBuilder().updatedAt(clock.millis()).build();
            return replaceItem(state, updated[0]);
        });
        return Optional.ofNullable(updated[0]);
    }

    /**
     * Deletes one lineage item. Its children are linked to its parent, the remote counterparts are deleted right
     * away (failures are retried on the next push of the project), and its owned blob is deleted.
     *
     * @return the state after deletion, empty if the item did not exist
     */
    public Optional<ProjectState> deleteHistoryItem(String projectId, String itemId) {
        sessions.require();
        NodeRemoval removal = locks.withLock(projectId, () -> {
            ProjectState state = local.loadState(projectId).orElse(null);
            if (state == null) return null;
            NodeRemoval result = partitioner.remove(state, itemId);
            if (!result.found()) return null;
            ProjectState stamped = result.state().toBuilder()
                    .updatedAt(nextTimestamp(state.getUpdatedAt()))
                    .build();
            local.saveState(stamped);
            return new NodeRemoval(stamped, result.removed(), result.deletions());
        });
        if (removal == null) return Optional.empty();
        for (RemoteDeletion deletion : removal.deletions()) {
            try {
                mapper.delete(projectId, deletion);
            } catch (SyncException e) {
                backlog.add(projectId, deletion);
                log.warn(
                        "Remote deletion of item {} in {} failed, retrying on next push: {}",
                        deletion.itemId(),
                        deletion.partition().collection(),
                        e.getMessage());
            }
        }
        deleteBlob(removal.removed().imageUrl());
        queueIfValid(projectId, removal.state());
        return Optional.of(removal.state());
    }

    // ---------- conflicts

    public Optional<ConflictRegistry.PendingConflict> pendingConflict(String projectId) {
        return conflicts.get(projectId);
    }

    /**
     * Resolves a parked remote change with {@code strategy}, saves the result locally and queues a push.
     *
     * @throws IllegalStateException if no change is parked for the project
     */
    public ProjectState resolveConflict(String projectId, MergeStrategy strategy) {
        sessions.require();
        ConflictRegistry.PendingConflict pending = conflicts.take(projectId)
                .orElseThrow(() -> new IllegalStateException("No pending conflict for project " + projectId));
        ProjectState resolved = locks.withLock(projectId, () -> {
            ProjectState current = local.loadState(projectId).orElse(pending.local());
            ProjectState merged = merge.merge(current, pending.remote(), strategy);
            ProjectState stamped = merged.toBuilder()
                    .updatedAt(nextTimestamp(merged.getUpdatedAt()))
                    .build();
            local.saveState(stamped);
            return stamped;
        });
        log.info("Resolved conflict projectId={} strategy={}", projectId, strategy);
        queueIfValid(projectId, resolved);
        return resolved;
    }

    // ---------- migrations

    /** Uploads inline images of {@code projectId} to the blob store and queues the now-valid state. */
    public ExternalizationReport externalizeInlineImages(String projectId) {
        SyncSession session = sessions.require();
        ExternalizationReport[] report = {ExternalizationReport.EMPTY};
        ProjectState saved = locks.withLock(projectId, () -> {
            ProjectState state = local.loadState(projectId).orElse(null);
            if (state == null) return null;
            InlineBinaryExternalizer.Result result = externalizer.externalize(state, session.uid());
            report[0] = result.report();
            if (result.report().uploaded() == 0) return null;
            ProjectState stamped = result.state().toBuilder()
                    .updatedAt(nextTimestamp(state.getUpdatedAt()))
                    .build();
            local.saveState(stamped);
            return stamped;
        });
        log.info(
                "Externalized inline images projectId={} total={} uploaded={} skipped={} errors={}",
                projectId,
                report[0].total(),
                report[0].uploaded(),
                report[0].skipped(),
                report[0].errors());
        if (saved != null) queueIfValid(projectId, saved);
        return report[0];
    }

    /** Assigns a type to lineage items stored without one. Returns the number of items repaired. */
    public int migrateHistoryTypes(String projectId) {
        int[] repaired = new int[1];
        mutate(projectId, state -> {
            long primary = LineageMigrations.countUntyped(state.getGeneratedModelHistory());
            long styling = state.getStylingHistory().values().stream()
                    .mapToLong(LineageMigrations::countUntyped)
                    .sum();
            if (primary + styling == 0) return null;
            repaired[0] = (int) (primary + styling);
            Map<String, List<HistoryItem>> typed = new LinkedHashMap<>();
            state.getStylingHistory()
                    .forEach((root, items) -> typed.put(root, LineageMigrations.inferMissingTypes(items, true)));
            return state.toBuilder()
                    .generatedModelHistory(LineageMigrations.inferMissingTypes(state.getGeneratedModelHistory(), false))
                    .stylingHistory(typed)
                    .build();
        });
        if (repaired[0] > 0) log.info("Repaired untyped lineage items projectId={} count={}", projectId, repaired[0]);
        return repaired[0];
    }

    /** Pushes every local project of the session identity that the remote store does not have yet. */
    public MigrationReport migrateLocalProjects() {
        SyncSession session = sessions.require();
        int total = 0;
        int migrated = 0;
        int skipped = 0;
        int errors = 0;
        for (Project project : local.listProjects()) {
            total++;
            if (project.ownerId() != null && !project.ownerId().equals(session.uid())) {
                skipped++;
                continue;
            }
            try {
                if (remote.fetchProject(project.id()).isPresent()) {
                    skipped++;
                    continue;
                }
                coordinator.forceFlush(project.id());
                migrated++;
            } catch (SyncException e) {
                errors++;
                log.warn("Migration of project {} failed: {}", project.id(), e.getMessage());
            }
        }
        MigrationReport report = new MigrationReport(total, migrated, skipped, errors);
        log.info("Local project migration finished {}", report);
        return report;
    }

    /** Copies remote projects of the session identity that are missing locally. Returns the number restored. */
    public int restoreProjects() {
        SyncSession session = sessions.require();
        int restored = 0;
        for (Project project : remote.listProjects(session.uid())) {
            if (local.loadProject(project.id()).isPresent()) continue;
            Optional<RemoteSnapshot> snapshot = mapper.read(project.id(), session.uid());
            if (snapshot.isEmpty()) continue;
            boolean saved = locks.withLock(project.id(), () -> {
                if (local.loadProject(project.id()).isPresent()) return false;
                local.saveProject(snapshot.get().project());
                if (local.loadState(project.id()).isEmpty()) local.saveState(snapshot.get().state());
                return true;
            });
            if (saved) restored++;
        }
        log.info("Restored {} project(s) from remote for uid={}", restored, session.uid());
        return restored;
    }

    // ---------- status

    public SyncStatusSnapshot statusOf(String projectId) {
        return status.get(projectId);
    }

    public void addStatusListener(SyncStatusListener listener) {
        status.addListener(listener);
    }

    public void removeStatusListener(SyncStatusListener listener) {
        status.removeListener(listener);
    }

    /** Waits until no push is pending or running. */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        return coordinator.awaitIdle(timeout);
    }

    // ---------- internals

    /** Read-modify-write of local state; {@code change} returning {@code null} means no change. */
    private ProjectState mutate(String projectId, UnaryOperator<ProjectState> change) {
        SyncSession session = sessions.require();
        ProjectState saved = locks.withLock(projectId, () -> {
            ProjectState current = local.loadState(projectId).orElseGet(() -> ProjectState.empty(projectId));
            ProjectState next = change.apply(current);
            if (next == null) return null;
            if (!projectId.equals(next.getId())) {
                throw new MalformedEntityException(projectId, List.of("id"));
            }
            ProjectState stamped = next.toBuilder()
                    .updatedAt(nextTimestamp(current.getUpdatedAt()))
                    .syncVersion(current.getSyncVersion())
                    .build();
            local.saveState(stamped);
            if (local.loadProject(projectId).isEmpty()) {
                long now = clock.millis();
                local.saveProject(Project.builder()
                        .id(projectId)
                        .ownerId(session.uid())
                        .status(ProjectStatus.DRAFT)
                        .createdAt(now)
                        .updatedAt(now)
                        .build());
            }
            return stamped;
        });
        if (saved == null) {
            return local.loadState(projectId).orElse(null);
        }
        queueIfValid(projectId, saved);
        return saved;
    }

    private Project writeProject(Project project, SyncSession session) {
        Project current = local.loadProject(project.id()).orElse(null);
        String owner = current != null && current.ownerId() != null
                ? current.ownerId()
                : project.ownerId() != null ? project.ownerId() : session.uid();
        long now = clock.millis();
        Project next = project.toBuilder()
                .ownerId(owner)
                .createdAt(current != null && current.createdAt() != null
                        ? current.createdAt()
                        : project.createdAt() != null ? project.createdAt() : now)
                .updatedAt(Math.max(now, current == null ? 0 : current.updatedAt() + 1))
                .syncVersion(current == null ? project.syncVersion() : current.syncVersion())
                .build();
        local.saveProject(next);
        return next;
    }

    private boolean queueIfValid(String projectId, ProjectState state) {
        ValidationResult result = validator.validate(state);
        if (result.isRejected()) {
            log.warn("Not queueing project {}: {}", projectId, result.reason());
            status.failed(projectId, new ValidationRejectedException(projectId, result.reason(), result.path()));
            return false;
        }
        coordinator.enqueue(projectId);
        return true;
    }

    /** Coordinator write path: pushes the freshest local snapshot of {@code projectId}. */
    private void push(String projectId, SyncSession session) {
        ProjectState[] state = new ProjectState[1];
        Project[] project = new Project[1];
        locks.run(projectId, () -> {
            state[0] = local.loadState(projectId).orElse(null);
            project[0] = local.loadProject(projectId).orElse(null);
        });
        if (state[0] == null && project[0] == null) {
            log.debug("Nothing to push for projectId={}, removed locally", projectId);
            return;
        }
        ProjectState snapshot = state[0] != null ? state[0] : ProjectState.empty(projectId);
        Project metadata = project[0] != null
                ? project[0]
                : Project.builder().id(projectId).ownerId(session.uid()).build();

        ValidationResult validation = validator.validate(snapshot);
        if (validation.isRejected()) {
            throw new ValidationRejectedException(projectId, validation.reason(), validation.path());
        }
        retryDeletions(projectId);

        subscriptions.expectEcho(projectId, snapshot.getSyncVersion() + 1, snapshot.getUpdatedAt());
        PushResult result = mapper.write(metadata, snapshot, session);
        if (!sessions.isCurrent(session)) {
            log.debug("Session changed during push, discarding result projectId={}", projectId);
            return;
        }
        boolean deletedMeanwhile = locks.withLock(
                projectId, () -> local.loadState(projectId).isEmpty() && local.loadProject(projectId).isEmpty());
        if (deletedMeanwhile) {
            removeOrphan(projectId, snapshot.stylingRootIds());
            return;
        }
        locks.run(projectId, () -> {
            local.loadState(projectId)
                    .filter(s -> s.getSyncVersion() < result.syncVersion())
                    .ifPresent(s -> local.saveState(s.toBuilder().syncVersion(result.syncVersion()).build()));
            local.loadProject(projectId)
                    .filter(p -> p.syncVersion() < result.syncVersion() || p.ownerId() == null)
                    .ifPresent(p -> local.saveProject(p.toBuilder()
                            .ownerId(p.ownerId() == null ? session.uid() : p.ownerId())
                            .syncVersion(Math.max(p.syncVersion(), result.syncVersion()))
                            .build()));
        });
    }

    /** The project was deleted locally while its push ran; the push must not leave a remote copy behind. */
    private void removeOrphan(String projectId, Set<String> stylingRootIds) {
        log.info("Project deleted during push, removing remote copy projectId={}", projectId);
        try {
            mapper.deleteProject(projectId, stylingRootIds);
        } catch (SyncException e) {
            log.warn("Remote deletion of project {} after push failed: {}", projectId, e.getMessage());
        }
    }

    private void retryDeletions(String projectId) {
        List<RemoteDeletion> pending = backlog.drain(projectId);
        for (RemoteDeletion deletion : pending) {
            try {
                mapper.delete(projectId, deletion);
            } catch (SyncException e) {
                backlog.add(projectId, deletion);
                log.warn("Remote deletion of item {} still failing: {}", deletion.itemId(), e.getMessage());
            }
        }
    }

    private int resumeUnsynced(SyncSession session) {
        int queued = 0;
        for (Project project : local.listProjects()) {
            if (project.ownerId() != null && !project.ownerId().equals(session.uid())) continue;
            ProjectState state = local.loadState(project.id()).orElse(null);
            if (state == null) continue;
            try {
                RemoteProjectDocument document = remote.fetchProject(project.id()).orElse(null);
                if (document == null
                        || document.updatedAt() < state.getUpdatedAt()
                        || document.syncVersion() < state.getSyncVersion()) {
                    if (queueIfValid(project.id(), state)) queued++;
                }
            } catch (RemoteUnavailableException e) {
                log.warn("Remote unavailable, not resuming unsynced projects: {}", e.getMessage());
                break;
            } catch (SyncException e) {
                log.warn("Could not check remote copy of project {}: {}", project.id(), e.getMessage());
            }
        }
        if (queued > 0) log.info("Queued {} unsynced project(s) on session start", queued);
        return queued;
    }

    private long nextTimestamp(long previous) {
        return Math.max(clock.millis(), previous + 1);
    }

    private static ProjectState replaceItem(ProjectState state, HistoryItem item) {
        List<HistoryItem> primary = new ArrayList<>(state.getGeneratedModelHistory());
        primary.replaceAll(i -> item.id().equals(i.id()) ? item : i);
        Map<String, List<HistoryItem>> styling = new LinkedHashMap<>();
        state.getStylingHistory().forEach((root, items) -> {
            List<HistoryItem> copy = new ArrayList<>(items);
            copy.replaceAll(i -> item.id().equals(i.id()) ? item : i);
            styling.put(root, copy);
        });
        return state.toBuilder()
                .generatedModelHistory(primary)
                .stylingHistory(styling)
                .build();
    }

    private void deleteOwnedBlobs(ProjectState state) {
        for (HistoryItem item : state.allHistoryItems()) {
            deleteBlob(item.imageUrl());
        }
        for (WardrobeItem item : state.getWardrobe()) {
            if (item.source() == null || item.source() == WardrobeSource.USER) {
                deleteBlob(item.url());
            }
        }
    }

    private void deleteBlob(String reference) {
        if (!blobs.owns(reference)) return;
        try {
            blobs.delete(reference);
        } catch (RuntimeException e) {
            log.warn("Failed to delete blob {}: {}", reference, e.getMessage());
        }
    }

    // ---------- Builder

    public static final class Builder {
        private LocalStore localStore;
        private RemoteStore remoteStore;
        private BlobStore blobStore;
        private SyncSettings settings;
        private Clock clock;
        private PayloadValidator validator;
        private final List<SyncStatusListener> statusListeners = new ArrayList<>();

        public Builder localStore(LocalStore v) {
            this.localStore = v;
            return this;
        }

        public Builder remoteStore(RemoteStore v) {
            this.remoteStore = v;
            return this;
        }

        public Builder blobStore(BlobStore v) {
            this.blobStore = v;
            return this;
        }

        public Builder settings(SyncSettings v) {
            this.settings = v;
            return this;
        }

        public Builder clock(Clock v) {
            this.clock = v;
            return this;
        }

        public Builder validator(PayloadValidator v) {
            this.validator = v;
            return this;
        }

        public Builder statusListener(SyncStatusListener v) {
            this.statusListeners.add(Objects.requireNonNull(v, "statusListener"));
            return this;
        }

        public SyncEngine build() {
            return new SyncEngine(this);
        }
    }
}
