package com.atelier.sync.core.history;

import com.atelier.project.model.HistoryItem;
import com.atelier.project.model.ProjectState;
import java.util.List;

/**
 * Result of removing one lineage node.
 *
 * @param state the state with the node removed and its children re-parented
 * @param removed the removed node, {@code null} if it did not exist
 * @param deletions remote items to delete explicitly, including styling nodes that moved to another root
 */
public record NodeRemoval(ProjectState state, HistoryItem removed, List<RemoteDeletion> deletions) {

    public boolean found() {
        return removed != null;
    }
}
