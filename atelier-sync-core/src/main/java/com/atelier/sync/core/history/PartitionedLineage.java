package com.atelier.sync.core.history;

import com.atelier.project.model.HistoryItem;
import java.util.List;
import java.util.Map;

/**
 * A lineage split into its two physical collections.
 *
 * @param primary generation and revision nodes
 * @param styling styling nodes keyed by the id of their root ancestor
 */
public record PartitionedLineage(List<HistoryItem> primary, Map<String, List<HistoryItem>> styling) {

    public PartitionedLineage {
        primary = List.copyOf(primary);
        styling = Map.copyOf(styling);
    }
}
