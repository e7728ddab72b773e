package com.atelier.sync.core.remote;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Remembers what was last written to each remote collection in this session, so pushes only rewrite items whose
 * content changed. Items are immutable values and are kept as written; a change is detected with {@code equals}.
 */
public class PushLedger {

    private final Map<String, Map<String, Object>> written = new ConcurrentHashMap<>();

    /** Items of {@code collection} that differ from what this session last wrote. */
    public <T> List<T> changed(String projectId, String collection, Collection<T> items, Function<T, String> id) {
        Map<String, Object> known = written.getOrDefault(key(projectId, collection), Map.of());
        List<T> out = new ArrayList<>();
        for (T item : items) {
            if (!Objects.equals(known.get(id.apply(item)), item)) out.add(item);
        }
        return out;
    }

    public <T> void record(String projectId, String collection, Collection<T> items, Function<T, String> id) {
        Map<String, Object> known = written.computeIfAbsent(key(projectId, collection), k -> new ConcurrentHashMap<>());
        for (T item : items) {
            known.put(id.apply(item), item);
        }
    }

    public void forgetItem(String projectId, String collection, String itemId) {
        Map<String, Object> known = written.get(key(projectId, collection));
        if (known != null) known.remove(itemId);
    }

    public void forget(String projectId) {
        written.keySet().removeIf(k -> k.startsWith(projectId + "/"));
    }

    public void clear() {
        written.clear();
    }

    private static String key(String projectId, String collection) {
        return projectId + "/" + collection;
    }
}
