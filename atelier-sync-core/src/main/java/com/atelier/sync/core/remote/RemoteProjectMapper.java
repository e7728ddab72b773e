package com.atelier.sync.core.remote;

import com.atelier.project.lineage.LineageMigrations;
import com.atelier.project.model.HistoryItem;
import com.atelier.project.model.Project;
import com.atelier.project.model.ProjectState;
import com.atelier.project.model.WardrobeItem;
import com.atelier.sync.core.history.RemoteDeletion;
import com.atelier.sync.core.session.SyncSession;
import com.atelier.sync.core.validation.EntityRequirements;
import com.atelier.sync.spi.LineagePartition;
import com.atelier.sync.spi.RemoteProjectDocument;
import com.atelier.sync.spi.RemoteStore;
import com.atelier.sync.spi.error.PermissionDeniedException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Translates between a {@link ProjectState} and the remote layout: one project record, the primary lineage
 * collection, one styling collection per root, and the wardrobe collection.
 */
@Slf4j
@RequiredArgsConstructor
public class RemoteProjectMapper {

    static final String WARDROBE_COLLECTION = "wardrobe";

    private final RemoteStore remote;
    private final PushLedger ledger;

    /**
     * Reads the full remote view of a project. Absent when the project was never pushed, belongs to another
     * identity, or is not readable yet.
     */
    public Optional<RemoteSnapshot> read(String projectId, String uid) {
        RemoteProjectDocument document;
        try {
            document = remote.fetchProject(projectId).orElse(null);
        } catch (PermissionDeniedException e) {
            log.debug("Project {} not readable by {}, treating as not yet synced", projectId, uid);
            return Optional.empty();
        }
        if (document == null) return Optional.empty();
        if (!uid.equals(document.ownerId())) {
            log.warn("Project {} belongs to a different identity, ignoring remote copy", projectId);
            return Optional.empty();
        }

        List<HistoryItem> primary =
                LineageMigrations.inferMissingTypes(remote.fetchLineage(projectId, LineagePartition.primary()), false);
        ledger.record(projectId, LineagePartition.PRIMARY_COLLECTION, primary, HistoryItem::id);

        Set<String> declared = new LinkedHashSet<>(document.stylingRootIds());
        Set<String> roots = new LinkedHashSet<>(declared);
        for (HistoryItem item : primary) {
            if (item.baseModelId() != null) roots.add(item.baseModelId());
        }
        Map<String, List<HistoryItem>> styling = new LinkedHashMap<>();
        for (String root : roots) {
            List<HistoryItem> items = remote.fetchLineage(projectId, LineagePartition.styling(root));
            if (items.isEmpty() && !declared.contains(root)) continue;
            List<HistoryItem> typed = LineageMigrations.inferMissingTypes(items, true);
            ledger.record(projectId, root, typed, HistoryItem::id);
            styling.put(root, typed);
        }

        List<WardrobeItem> wardrobe = remote.fetchWardrobe(projectId);
        ledger.record(projectId, WARDROBE_COLLECTION, wardrobe, WardrobeItem::id);

        ProjectState state = ProjectState.builder()
                .id(projectId)
                .modelDescription(document.modelDescription())
                .revisionPrompt(document.revisionPrompt())
                .selectedModelName(document.selectedModelName())
                .currentHistoryItemId(document.currentHistoryItemId())
                .generationSettings(document.generationSettings())
                .generatedModelHistory(primary)
                .stylingHistory(styling)
                .wardrobe(wardrobe)
                .updatedAt(document.updatedAt())
                .syncVersion(document.syncVersion())
                .build();
        return Optional.of(new RemoteSnapshot(document.project(), state));
    }

    /**
     * Writes a project. Lineage and wardrobe items go first, skipping malformed ones and ones unchanged since this
     * session last wrote them; the project record goes last with {@code syncVersion + 1}.
     *
     * @throws PermissionDeniedException if the project is owned by another identity
     */
    public PushResult write(Project project, ProjectState state, SyncSession session) {
        String projectId = state.getId();
        String uid = session.uid();
        String owner = project.ownerId() == null ? uid : project.ownerId();
        if (!owner.equals(uid)) {
            throw new PermissionDeniedException(projectId, uid, owner);
        }

        int[] skipped = new int[1];
        int written = writeLineage(
                projectId, LineagePartition.primary(), state.getGeneratedModelHistory(), skipped);
        for (Map.Entry<String, List<HistoryItem>> entry : state.getStylingHistory().entrySet()) {
            written += writeLineage(projectId, LineagePartition.styling(entry.getKey()), entry.getValue(), skipped);
        }
        written += writeWardrobe(projectId, state.getWardrobe(), skipped);

        long version = state.getSyncVersion() + 1;
        RemoteProjectDocument document = new RemoteProjectDocument(
                project.toBuilder().ownerId(owner).syncVersion(version).build(),
                state.getModelDescription(),
                state.getRevisionPrompt(),
                state.getSelectedModelName(),
                state.getCurrentHistoryItemId(),
                state.getGenerationSettings(),
                new ArrayList<>(state.stylingRootIds()),
                state.getUpdatedAt(),
                version);
        remote.putProject(document);
        log.info(
                "Pushed project projectId={} syncVersion={} itemsWritten={} itemsSkipped={}",
                projectId,
                version,
                written,
                skipped[0]);
        return new PushResult(version, written, skipped[0]);
    }

    public void delete(String projectId, RemoteDeletion deletion) {
        remote.deleteLineageItem(projectId, deletion.partition(), deletion.itemId());
        ledger.forgetItem(projectId, deletion.partition().collection(), deletion.itemId());
    }

    public void deleteProject(String projectId, Collection<String> stylingRootIds) {
        remote.deleteProject(projectId, stylingRootIds);
        ledger.forget(projectId);
    }

    private int writeLineage(String projectId, LineagePartition partition, List<HistoryItem> items, int[] skipped) {
        List<HistoryItem> valid = new ArrayList<>(items.size());
        for (HistoryItem item : items) {
            List<String> missing = EntityRequirements.missing(item);
            if (missing.isEmpty()) {
                valid.add(item);
            } else {
                skipped[0]++;
                log.warn(
                        "Skipping malformed lineage item projectId={} collection={} itemId={} missing={}",
                        projectId,
                        partition.collection(),
                        item.id(),
                        missing);
            }
        }
        List<HistoryItem> changed = ledger.changed(projectId, partition.collection(), valid, HistoryItem::id);
        if (changed.isEmpty()) return 0;
        remote.putLineage(projectId, partition, changed);
        ledger.record(projectId, partition.collection(), changed, HistoryItem::id);
        return changed.size();
    }

    private int writeWardrobe(String projectId, List<WardrobeItem> items, int[] skipped) {
        List<WardrobeItem> valid = new ArrayList<>(items.size());
        for (WardrobeItem item : items) {
            List<String> missing = EntityRequirements.missing(item);
            if (missing.isEmpty()) {
                valid.add(item);
            } else {
                skipped[0]++;
                log.warn("Skipping malformed wardrobe item projectId={} itemId={} missing={}", projectId, item.id(), missing);
            }
        }
        List<WardrobeItem> changed = ledger.changed(projectId, WARDROBE_COLLECTION, valid, WardrobeItem::id);
        if (changed.isEmpty()) return 0;
        remote.putWardrobe(projectId, changed);
        ledger.record(projectId, WARDROBE_COLLECTION, changed, WardrobeItem::id);
        return changed.size();
    }
}
