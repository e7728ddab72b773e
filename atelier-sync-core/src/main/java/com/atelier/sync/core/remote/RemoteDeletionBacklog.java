package com.atelier.sync.core.remote;

import com.atelier.sync.core.history.RemoteDeletion;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Remote deletions that failed and are retried on the next push of the same project. Held in memory only. */
public class RemoteDeletionBacklog {

    private final Map<String, Set<RemoteDeletion>> backlog = new ConcurrentHashMap<>();

    public void add(String projectId, RemoteDeletion deletion) {
        backlog.compute(projectId, (id, set) -> {
            Set<RemoteDeletion> next = set == null ? new LinkedHashSet<>() : set;
            next.add(deletion);
            return next;
        });
    }

    public List<RemoteDeletion> drain(String projectId) {
        Set<RemoteDeletion> set = backlog.remove(projectId);
        return set == null ? List.of() : List.copyOf(set);
    }

    public int size(String projectId) {
        Set<RemoteDeletion> set = backlog.get(projectId);
        return set == null ? 0 : set.size();
    }

    public void forget(String projectId) {
        backlog.remove(projectId);
    }

    public void clear() {
        backlog.clear();
    }
}
