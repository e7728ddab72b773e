package com.atelier.project.lineage;

import com.atelier.project.model.HistoryItem;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Id-indexed view over a lineage forest spanning both partitions.
 *
 * <p>Root resolution is bounded by the number of indexed items. A parent id that is not indexed counts as a root,
 * so {@link #resolveRoot(String)} returns the dangling parent id.
 */
public final class LineageIndex {

    private final Map<String, HistoryItem> byId = new LinkedHashMap<>();

    public LineageIndex(Collection<HistoryItem> items) {
        for (HistoryItem item : items) {
            if (item != null && item.id() != null) {
                byId.put(item.id(), item);
            }
        }
    }

    public static LineageIndex of(Collection<HistoryItem> items) {
        return new LineageIndex(items);
    }

    public Optional<HistoryItem> get(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public int size() {
        return byId.size();
    }

    /**
     * Walks {@code parentId} links from {@code id}.
     *
     * @throws MalformedLineageException if the walk revisits a node
     */
    public String resolveRoot(String id) {
        if (id == null) return null;
        Set<String> seen = new HashSet<>();
        String current = id;
        while (true) {
            if (!seen.add(current)) {
                throw new MalformedLineageException(id, "Parent cycle detected while resolving root of " + id);
            }
            HistoryItem item = byId.get(current);
            if (item == null || item.parentId() == null) {
                return current;
            }
            current = item.parentId();
        }
    }

    public List<HistoryItem> children(String parentId) {
        List<HistoryItem> out = new ArrayList<>();
        for (HistoryItem item : byId.values()) {
            if (Objects.equals(parentId, item.parentId())) out.add(item);
        }
        return out;
    }

    /** Every item below {@code id}, breadth first, excluding {@code id} itself. */
    public List<HistoryItem> descendants(String id) {
        List<HistoryItem> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(id);
        seen.add(id);
        while (!queue.isEmpty()) {
            String next = queue.poll();
            for (HistoryItem child : children(next)) {
                if (seen.add(child.id())) {
                    out.add(child);
                    queue.add(child.id());
                }
            }
        }
        return out;
    }

    /**
     * Removes one node, linking each of its children to the removed node's parent. {@code baseModelId} is
     * recomputed for the removed node's former descendants only; unrelated items are returned untouched.
     */
    public Detachment detach(String id) {
        HistoryItem removed = byId.get(id);
        if (removed == null) {
            return new Detachment(null, List.copyOf(byId.values()), Set.of());
        }
        String successor = removed.parentId();
        List<HistoryItem> formerDescendants = descendants(id);
        Map<String, HistoryItem> next = new LinkedHashMap<>(byId);
        next.remove(id);
        for (HistoryItem child : children(id)) {
            next.put(child.id(), child.withParent(successor, child.baseModelId()));
        }
        LineageIndex relinked = new LineageIndex(next.values());
        Set<String> changed = new LinkedHashSet<>();
        for (HistoryItem descendant : formerDescendants) {
            HistoryItem current = next.get(descendant.id());
            String root = relinked.resolveRoot(current.id());
            HistoryItem updated = current.withBaseModelId(root);
            next.put(current.id(), updated);
            if (!updated.equals(descendant)) changed.add(current.id());
        }
        return new Detachment(removed, List.copyOf(next.values()), changed);
    }

    /**
     * Outcome of {@link #detach(String)}.
     *
     * @param removed the removed node, or {@code null} if it was not indexed
     * @param remaining every other node after re-parenting
     * @param changedIds ids of nodes whose parent or base model changed
     */
    public record Detachment(HistoryItem removed, List<HistoryItem> remaining, Set<String> changedIds) {}
}
