package com.atelier.sync.spi;

import com.atelier.project.model.HistoryItem;
import com.atelier.project.model.Project;
import com.atelier.project.model.WardrobeItem;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Authoritative multi-client store.
 *
 * <p>Every call may block and may fail with {@link com.atelier.sync.spi.error.RemoteUnavailableException} or
 * {@link com.atelier.sync.spi.error.PermissionDeniedException}. Watch callbacks may run on any thread.
 */
public interface RemoteStore {

    Optional<RemoteProjectDocument> fetchProject(String projectId);

    /** Writes the project record. The store rejects writes whose owner differs from the stored owner. */
    void putProject(RemoteProjectDocument document);

    List<HistoryItem> fetchLineage(String projectId, LineagePartition partition);

    /** Upserts items by id; items not listed are left in place. */
    void putLineage(String projectId, LineagePartition partition, Collection<HistoryItem> items);

    void deleteLineageItem(String projectId, LineagePartition partition, String itemId);

    List<WardrobeItem> fetchWardrobe(String projectId);

    /** Upserts wardrobe items by id. */
    void putWardrobe(String projectId, Collection<WardrobeItem> items);

    /** Deletes the project record and its primary, styling and wardrobe collections. */
    void deleteProject(String projectId, Collection<String> stylingRootIds);

    List<Project> listProjects(String ownerId);

    RemoteSubscription watchProject(String projectId, Consumer<RemoteProjectDocument> onChange);

    RemoteSubscription watchLineage(
            String projectId, LineagePartition partition, Consumer<List<HistoryItem>> onChange);
}
