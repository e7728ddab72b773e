package com.atelier.sync.core.history;

import com.atelier.project.lineage.LineageClock;
import com.atelier.project.lineage.LineageIndex;
import com.atelier.project.model.HistoryItem;
import com.atelier.project.model.ProjectState;
import com.atelier.sync.spi.LineagePartition;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits a unified lineage into the primary collection and the per-root styling collections, and reassembles it.
 *
 * <p>Round trip: for a lineage whose nodes all descend from {@code root},
 * {@code unify(store(empty, root, lineage), root)} equals the lineage sorted by {@link LineageClock#ORDER}.
 */
@Slf4j
public class HistoryPartitioner {

    /** Splits by type. Styling nodes are keyed by their resolved root; untyped nodes go to the primary side. */
    public PartitionedLineage partition(List<HistoryItem> unified) {
        LineageIndex index = LineageIndex.of(unified);
        List<HistoryItem> primary = new ArrayList<>();
        Map<String, List<HistoryItem>> styling = new LinkedHashMap<>();
        for (HistoryItem item : unified) {
            if (item.type() == null || item.id() == null) {
                log.debug("Untyped lineage item {} kept in primary partition", item.id());
                primary.add(item);
            } else if (item.isStyling()) {
                styling.computeIfAbsent(index.resolveRoot(item.id()), k -> new ArrayList<>())
                        .add(item);
            } else {
                primary.add(item);
            }
        }
        return new PartitionedLineage(primary, styling);
    }

    /** Primary nodes that resolve to {@code rootId}, plus the styling partition of {@code rootId}, in lineage order. */
    public List<HistoryItem> unify(ProjectState state, String rootId) {
        LineageIndex index = LineageIndex.of(state.allHistoryItems());
        List<HistoryItem> out = new ArrayList<>();
        for (HistoryItem item : state.getGeneratedModelHistory()) {
            if (Objects.equals(index.resolveRoot(item.id()), rootId)) {
                out.add(item);
            }
        }
        out.addAll(state.getStylingHistory().getOrDefault(rootId, List.of()));
        out.sort(LineageClock.ORDER);
        return out;
    }

    /**
     * Saves the unified lineage of {@code rootId}: primary nodes are upserted into the primary lineage and styling
     * nodes into {@code styling[rootId]}, existing ids in place and new ids appended. Nodes not listed are kept.
     */
    public ProjectState store(ProjectState state, String rootId, List<HistoryItem> unified) {
        PartitionedLineage split = partition(unified);
        List<HistoryItem> incomingStyling = new ArrayList<>();
        split.styling().forEach((root, items) -> {
            if (!root.equals(rootId)) {
                log.debug("Styling items resolved to root {} stored under requested root {}", root, rootId);
            }
            incomingStyling.addAll(items);
        });
        Map<String, List<HistoryItem>> styling = new LinkedHashMap<>(state.getStylingHistory());
        List<HistoryItem> mergedStyling = upsert(styling.getOrDefault(rootId, List.of()), incomingStyling);
        if (!mergedStyling.isEmpty() || styling.containsKey(rootId)) {
            styling.put(rootId, mergedStyling);
        }
        return state.toBuilder()
                .generatedModelHistory(upsert(state.getGeneratedModelHistory(), split.primary()))
                .stylingHistory(styling)
                .build();
    }

    /**
     * Removes {@code itemId} from whichever partition holds it. Children are re-parented to the removed node's
     * parent, {@code baseModelId} is recomputed for the detached subtree, and styling nodes whose root changed move
     * to the partition of their new root. If the removed node was current, its parent becomes current.
     */
    public NodeRemoval remove(ProjectState state, String itemId) {
        LineageIndex index = LineageIndex.of(state.allHistoryItems());
        LineageIndex.Detachment detachment = index.detach(itemId);
        HistoryItem removed = detachment.removed();
        if (removed == null) {
            return new NodeRemoval(state, null, List.of());
        }
        Map<String, HistoryItem> updated = new HashMap<>();
        for (HistoryItem item : detachment.remaining()) {
            if (detachment.changedIds().contains(item.id())) updated.put(item.id(), item);
        }

        List<RemoteDeletion> deletions = new ArrayList<>();
        List<HistoryItem> primary = new ArrayList<>();
        for (HistoryItem item : state.getGeneratedModelHistory()) {
            if (item.id().equals(itemId)) {
                deletions.add(new RemoteDeletion(LineagePartition.primary(), itemId));
            } else {
                primary.add(updated.getOrDefault(item.id(), item));
            }
        }

        Map<String, List<HistoryItem>> styling = new LinkedHashMap<>();
        List<HistoryItem> moved = new ArrayList<>();
        for (Map.Entry<String, List<HistoryItem>> entry : state.getStylingHistory().entrySet()) {
            String root = entry.getKey();
            List<HistoryItem> kept = new ArrayList<>();
            for (HistoryItem item : entry.getValue()) {
                if (item.id().equals(itemId)) {
                    deletions.add(new RemoteDeletion(LineagePartition.styling(root), itemId));
                    continue;
                }
                HistoryItem next = updated.getOrDefault(item.id(), item);
                if (next != item && next.baseModelId() != null && !next.baseModelId().equals(root)) {
                    deletions.add(new RemoteDeletion(LineagePartition.styling(root), item.id()));
                    moved.add(next);
                } else {
                    kept.add(next);
                }
            }
            if (!kept.isEmpty()) styling.put(root, kept);
        }
        for (HistoryItem item : moved) {
            styling.computeIfAbsent(item.baseModelId(), k -> new ArrayList<>()).add(item);
        }
        styling.replaceAll((root, items) -> {
            List<HistoryItem> sorted = new ArrayList<>(items);
            sorted.sort(LineageClock.ORDER);
            return sorted;
        });

        String current = state.getCurrentHistoryItemId();
        if (itemId.equals(current)) {
            current = removed.parentId();
        }
        ProjectState next = state.toBuilder()
                .generatedModelHistory(primary)
                .stylingHistory(styling)
                .currentHistoryItemId(current)
                .build();
        log.debug(
                "Removed lineage item {} relinked={} remoteDeletions={}",
                itemId,
                detachment.changedIds().size(),
                deletions.size());
        return new NodeRemoval(next, removed, deletions);
    }

    private static List<HistoryItem> upsert(List<HistoryItem> existing, List<HistoryItem> incoming) {
        List<HistoryItem> out = new ArrayList<>(existing);
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < out.size(); i++) position.put(out.get(i).id(), i);
        Set<String> seen = new HashSet<>();
        for (HistoryItem item : incoming) {
            if (!seen.add(item.id())) continue;
            Integer at = position.get(item.id());
            if (at != null) {
                out.set(at, item);
            } else {
                position.put(item.id(), out.size());
                out.add(item);
            }
        }
        return out;
    }
}
