package com.atelier.sync.core.merge;

import com.atelier.project.lineage.LineageClock;
import com.atelier.project.model.HistoryItem;
import com.atelier.project.model.Project;
import com.atelier.project.model.ProjectState;
import com.atelier.project.model.WardrobeItem;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.ToLongFunction;

/**
 * Reconciles a local and a remote snapshot of the same project.
 *
 * <p>Merging two snapshots with identical content returns the local snapshot with the larger clocks and no version
 * bump, so {@code merge(a, a, SMART)} is {@code a}. Otherwise the result version is one past the larger input
 * version for {@link MergeStrategy#SMART} and the larger input version for the prefer strategies.
 */
public class MergeEngine {

    private final Duration conflictWindow;
    private final Clock clock;

    public MergeEngine(Duration conflictWindow, Clock clock) {
        this.conflictWindow = Objects.requireNonNull(conflictWindow, "conflictWindow");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ProjectState merge(ProjectState local, ProjectState remote, MergeStrategy strategy) {
        if (remote == null) return local;
        if (local == null) return remote;
        long version = Math.max(local.getSyncVersion(), remote.getSyncVersion());
        long updatedAt = Math.max(local.getUpdatedAt(), remote.getUpdatedAt());
        if (local.sameContent(remote)) {
            return local.toBuilder().updatedAt(updatedAt).syncVersion(version).build();
        }
        return switch (strategy) {
            case PREFER_LOCAL -> local.toBuilder().updatedAt(updatedAt).syncVersion(version).build();
            case PREFER_REMOTE -> remote.toBuilder()
                    .id(local.getId())
                    .updatedAt(updatedAt)
                    .syncVersion(version)
                    .build();
            case SMART -> smart(local, remote, updatedAt, version + 1);
        };
    }

    private ProjectState smart(ProjectState local, ProjectState remote, long updatedAt, long version) {
        // ties go to remote
        ProjectState newer = local.getUpdatedAt() > remote.getUpdatedAt() ? local : remote;
        return ProjectState.builder()
                .id(local.getId())
                .modelDescription(newer.getModelDescription())
                .revisionPrompt(newer.getRevisionPrompt())
                .selectedModelName(newer.getSelectedModelName())
                .currentHistoryItemId(newer.getCurrentHistoryItemId())
                .generationSettings(newer.getGenerationSettings())
                .generatedModelHistory(mergeLineage(local.getGeneratedModelHistory(), remote.getGeneratedModelHistory()))
                .stylingHistory(mergeStyling(local.getStylingHistory(), remote.getStylingHistory()))
                .wardrobe(mergeWardrobe(local.getWardrobe(), remote.getWardrobe()))
                .updatedAt(updatedAt)
                .syncVersion(version)
                .build();
    }

    /** Union by id; a remote item replaces a local one only when strictly more recent. Sorted in lineage order. */
    public List<HistoryItem> mergeLineage(List<HistoryItem> local, List<HistoryItem> remote) {
        List<HistoryItem> merged = unionById(local, remote, HistoryItem::id, HistoryItem::recency);
        merged.sort(LineageClock.ORDER);
        return merged;
    }

    public Map<String, List<HistoryItem>> mergeStyling(
            Map<String, List<HistoryItem>> local, Map<String, List<HistoryItem>> remote) {
        Set<String> roots = new LinkedHashSet<>(local.keySet());
        roots.addAll(remote.keySet());
        Map<String, List<HistoryItem>> merged = new LinkedHashMap<>();
        for (String root : roots) {
            merged.put(root, mergeLineage(local.getOrDefault(root, List.of()), remote.getOrDefault(root, List.of())));
        }
        return merged;
    }

    public List<WardrobeItem> mergeWardrobe(List<WardrobeItem> local, List<WardrobeItem> remote) {
        List<WardrobeItem> merged = unionById(local, remote, WardrobeItem::id, WardrobeItem::recency);
        merged.sort(Comparator.comparingLong(WardrobeItem::recency));
        return merged;
    }

    /** Metadata merge: the newer record wins (ties go to remote) and the version is the larger one. */
    public Project mergeMetadata(Project local, Project remote) {
        if (remote == null) return local;
        if (local == null) return remote;
        long version = Math.max(local.syncVersion(), remote.syncVersion());
        Project newer = local.updatedAt() > remote.updatedAt() ? local : remote;
        return newer.withSyncVersion(version);
    }

    /**
     * Reports disagreements between two snapshots. Scalar fields are compared only when both snapshots were
     * updated within the conflict window; lineage and styling id sets are always compared. Never blocks a merge.
     */
    public List<MergeConflict> detectConflicts(ProjectState local, ProjectState remote) {
        List<MergeConflict> conflicts = new ArrayList<>();
        if (local == null || remote == null) return conflicts;
        Instant now = clock.instant();
        if (withinWindow(local.getUpdatedAt(), remote.getUpdatedAt())) {
            compare(conflicts, "modelDescription", local.getModelDescription(), remote.getModelDescription(), now);
            compare(conflicts, "revisionPrompt", local.getRevisionPrompt(), remote.getRevisionPrompt(), now);
            compare(conflicts, "selectedModelName", local.getSelectedModelName(), remote.getSelectedModelName(), now);
            compare(
                    conflicts,
                    "currentHistoryItemId",
                    local.getCurrentHistoryItemId(),
                    remote.getCurrentHistoryItemId(),
                    now);
            compare(
                    conflicts,
                    "generationSettings",
                    local.getGenerationSettings(),
                    remote.getGenerationSettings(),
                    now);
        }
        compareIds(
                conflicts, "generatedModelHistory", local.getGeneratedModelHistory(), remote.getGeneratedModelHistory(),
                now);
        Set<String> roots = new LinkedHashSet<>(local.getStylingHistory().keySet());
        roots.addAll(remote.getStylingHistory().keySet());
        for (String root : roots) {
            compareIds(
                    conflicts,
                    "stylingHistory[" + root + "]",
                    local.getStylingHistory().getOrDefault(root, List.of()),
                    remote.getStylingHistory().getOrDefault(root, List.of()),
                    now);
        }
        return conflicts;
    }

    public List<MergeConflict> detectConflicts(Project local, Project remote) {
        List<MergeConflict> conflicts = new ArrayList<>();
        if (local == null || remote == null || !withinWindow(local.updatedAt(), remote.updatedAt())) {
            return conflicts;
        }
        Instant now = clock.instant();
        compare(conflicts, "title", local.title(), remote.title(), now);
        compare(conflicts, "description", local.description(), remote.description(), now);
        compare(conflicts, "tags", local.tags(), remote.tags(), now);
        compare(conflicts, "status", local.status(), remote.status(), now);
        compare(conflicts, "deadline", local.deadline(), remote.deadline(), now);
        return conflicts;
    }

    private boolean withinWindow(long a, long b) {
        return Math.abs(a - b) < conflictWindow.toMillis();
    }

    private static void compare(List<MergeConflict> out, String field, Object local, Object remote, Instant now) {
        if (!Objects.equals(local, remote)) {
            out.add(new MergeConflict(field, local, remote, now));
        }
    }

    private static void compareIds(
            List<MergeConflict> out, String field, List<HistoryItem> local, List<HistoryItem> remote, Instant now) {
        Set<String> localIds = ids(local);
        Set<String> remoteIds = ids(remote);
        Set<String> onlyLocal = new LinkedHashSet<>(localIds);
        onlyLocal.removeAll(remoteIds);
        Set<String> onlyRemote = new LinkedHashSet<>(remoteIds);
        onlyRemote.removeAll(localIds);
        if (!onlyLocal.isEmpty() || !onlyRemote.isEmpty()) {
            out.add(new MergeConflict(field, List.copyOf(onlyLocal), List.copyOf(onlyRemote), now));
        }
    }

    private static Set<String> ids(List<HistoryItem> items) {
        Set<String> ids = new LinkedHashSet<>();
        for (HistoryItem item : items) ids.add(item.id());
        return ids;
    }

    private static <T> List<T> unionById(
            List<T> local, List<T> remote, Function<T, String> id, ToLongFunction<T> recency) {
        Map<String, T> byId = new LinkedHashMap<>();
        for (T item : local) byId.put(id.apply(item), item);
        for (T item : remote) {
            byId.merge(id.apply(item), item, (mine, theirs) ->
                    recency.applyAsLong(theirs) > recency.applyAsLong(mine) ? theirs : mine);
        }
        return new ArrayList<>(byId.values());
    }
}
