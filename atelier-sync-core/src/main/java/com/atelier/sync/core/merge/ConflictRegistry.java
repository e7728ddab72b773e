package com.atelier.sync.core.merge;

import com.atelier.project.model.ProjectState;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Remote changes parked for manual resolution, at most one per project; a newer one replaces the older. */
public class ConflictRegistry {

    private final Map<String, PendingConflict> pending = new ConcurrentHashMap<>();

    public void park(PendingConflict conflict) {
        pending.put(conflict.projectId(), conflict);
    }

    public Optional<PendingConflict> get(String projectId) {
        return Optional.ofNullable(pending.get(projectId));
    }

    public Optional<PendingConflict> take(String projectId) {
        return Optional.ofNullable(pending.remove(projectId));
    }

    public void clear() {
        pending.clear();
    }

    public record PendingConflict(
            String projectId, ProjectState local, ProjectState remote, List<MergeConflict> conflicts, Instant detectedAt) {

        public PendingConflict {
            conflicts = List.copyOf(conflicts);
        }
    }
}
