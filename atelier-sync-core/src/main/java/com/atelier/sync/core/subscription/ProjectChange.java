package com.atelier.sync.core.subscription;

import com.atelier.project.model.HistoryItem;
import com.atelier.project.model.ProjectState;
import com.atelier.sync.core.merge.MergeConflict;
import java.util.List;

/**
 * Notification that a remote change was folded into the local store.
 *
 * @param rootId root the receiving listener subscribed to, {@code null} for project-level listeners
 * @param state local state after the change
 * @param history unified lineage of {@code rootId}, empty for project-level listeners
 * @param conflicts disagreements detected between the two snapshots
 * @param awaitingResolution whether the remote change was parked instead of applied
 */
public record ProjectChange(
        String projectId,
        String rootId,
        ProjectState state,
        List<HistoryItem> history,
        List<MergeConflict> conflicts,
        boolean awaitingResolution) {

    public ProjectChange {
        history = List.copyOf(history);
        conflicts = List.copyOf(conflicts);
    }
}
