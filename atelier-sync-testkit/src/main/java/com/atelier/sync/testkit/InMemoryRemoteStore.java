package com.atelier.sync.testkit;

import com.atelier.project.model.HistoryItem;
import com.atelier.project.model.Project;
import com.atelier.project.model.WardrobeItem;
import com.atelier.sync.spi.LineagePartition;
import com.atelier.sync.spi.RemoteProjectDocument;
import com.atelier.sync.spi.RemoteStore;
import com.atelier.sync.spi.RemoteSubscription;
import com.atelier.sync.spi.error.PermissionDeniedException;
import com.atelier.sync.spi.error.RemoteUnavailableException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Test double for the remote store.
 *
 * <p>Writes notify watchers synchronously on the writing thread, including the writer's own echo. The store can be
 * switched offline, can enforce the calling identity against project owners, and records how many project writes
 * each project received and how many of them overlapped.
 */
public class InMemoryRemoteStore implements RemoteStore {

    private final Map<String, RemoteProjectDocument> projects = new ConcurrentHashMap<>();
    private final Map<String, Map<String, HistoryItem>> lineage = new ConcurrentHashMap<>();
    private final Map<String, Map<String, WardrobeItem>> wardrobe = new ConcurrentHashMap<>();

    private final Map<String, List<Consumer<RemoteProjectDocument>>> projectWatchers = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<List<HistoryItem>>>> lineageWatchers = new ConcurrentHashMap<>();

    private final Map<String, List<RemoteProjectDocument>> projectWrites = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> maxInFlight = new ConcurrentHashMap<>();
    private final AtomicInteger lineageItemWrites = new AtomicInteger();
    private final List<String> deletedItems = new CopyOnWriteArrayList<>();

    private final AtomicBoolean offline = new AtomicBoolean();
    private volatile String caller;
    private volatile Duration writeLatency = Duration.ZERO;

    // ---------- RemoteStore

    @Override
    public Optional<RemoteProjectDocument> fetchProject(String projectId) {
        checkOnline(projectId);
        RemoteProjectDocument document = projects.get(projectId);
        if (document != null) checkCaller(projectId, document.ownerId());
        return Optional.ofNullable(document);
    }

    @Override
    public void putProject(RemoteProjectDocument document) {
        String projectId = document.projectId();
        checkOnline(projectId);
        checkCaller(projectId, document.ownerId());
        RemoteProjectDocument existing = projects.get(projectId);
        if (existing != null && !Objects.equals(existing.ownerId(), document.ownerId())) {
            throw new PermissionDeniedException(projectId, document.ownerId(), existing.ownerId());
        }
        int now = inFlight.computeIfAbsent(projectId, k -> new AtomicInteger()).incrementAndGet();
        maxInFlight.computeIfAbsent(projectId, k -> new AtomicInteger()).accumulateAndGet(now, Math::max);
        try {
            pause();
            projects.put(projectId, document);
            projectWrites
                    .computeIfAbsent(projectId, k -> new CopyOnWriteArrayList<>())
                    .add(document);
        } finally {
            inFlight.get(projectId).decrementAndGet();
        }
        notifyProject(projectId, document);
    }

    @Override
    public List<HistoryItem> fetchLineage(String projectId, LineagePartition partition) {
        checkOnline(projectId);
        Map<String, HistoryItem> items = lineage.get(key(projectId, partition));
        if (items == null) return List.of();
        synchronized (items) {
            return new ArrayList<>(items.values());
        }
    }

    @Override
    public void putLineage(String projectId, LineagePartition partition, Collection<HistoryItem> items) {
        checkOnline(projectId);
        checkOwnerOfExisting(projectId);
        Map<String, HistoryItem> target = lineage.computeIfAbsent(key(projectId, partition), k -> new LinkedHashMap<>());
        List<HistoryItem> snapshot;
        synchronized (target) {
            for (HistoryItem item : items) {
                target.put(item.id(), item);
            }
            snapshot = new ArrayList<>(target.values());
        }
        lineageItemWrites.addAndGet(items.size());
        notifyLineage(key(projectId, partition), snapshot);
    }

    @Override
    public void deleteLineageItem(String projectId, LineagePartition partition, String itemId) {
        checkOnline(projectId);
        checkOwnerOfExisting(projectId);
        Map<String, HistoryItem> target = lineage.get(key(projectId, partition));
        if (target == null) return;
        List<HistoryItem> snapshot;
        synchronized (target) {
            if (target.remove(itemId) == null) return;
            snapshot = new ArrayList<>(target.values());
        }
        deletedItems.add(itemId);
        notifyLineage(key(projectId, partition), snapshot);
    }

    @Override
    public List<WardrobeItem> fetchWardrobe(String projectId) {
        checkOnline(projectId);
        Map<String, WardrobeItem> items = wardrobe.get(projectId);
        if (items == null) return List.of();
        synchronized (items) {
            return new ArrayList<>(items.values());
        }
    }

    @Override
    public void putWardrobe(String projectId, Collection<WardrobeItem> items) {
        checkOnline(projectId);
        checkOwnerOfExisting(projectId);
        Map<String, WardrobeItem> target = wardrobe.computeIfAbsent(projectId, k -> new LinkedHashMap<>());
        synchronized (target) {
            for (WardrobeItem item : items) {
                target.put(item.id(), item);
            }
        }
    }

    @Override
    public void deleteProject(String projectId, Collection<String> stylingRootIds) {
        checkOnline(projectId);
        checkOwnerOfExisting(projectId);
        projects.remove(projectId);
        wardrobe.remove(projectId);
        lineage.keySet().removeIf(k -> k.startsWith(projectId + "/"));
    }

    @Override
    public List<Project> listProjects(String ownerId) {
        checkOnline(ownerId);
        List<Project> out = new ArrayList<>();
        for (RemoteProjectDocument document : projects.values()) {
            if (Objects.equals(ownerId, document.ownerId())) out.add(document.project());
        }
        return out;
    }

    @Override
    public RemoteSubscription watchProject(String projectId, Consumer<RemoteProjectDocument> onChange) {
        List<Consumer<RemoteProjectDocument>> list =
                projectWatchers.computeIfAbsent(projectId, k -> new CopyOnWriteArrayList<>());
        list.add(onChange);
        return () -> list.remove(onChange);
    }

    @Override
    public RemoteSubscription watchLineage(
            String projectId, LineagePartition partition, Consumer<List<HistoryItem>> onChange) {
        List<Consumer<List<HistoryItem>>> list =
                lineageWatchers.computeIfAbsent(key(projectId, partition), k -> new CopyOnWriteArrayList<>());
        list.add(onChange);
        return () -> list.remove(onChange);
    }

    // ---------- Test controls

    /** Seeds a project as another device would, notifying watchers. Bypasses failure injection. */
    public void seedProject(RemoteProjectDocument document) {
        projects.put(document.projectId(), document);
        notifyProject(document.projectId(), document);
    }

    /** Seeds lineage items as another device would, notifying watchers. Bypasses failure injection. */
    public void seedLineage(String projectId, LineagePartition partition, Collection<HistoryItem> items) {
        Map<String, HistoryItem> target = lineage.computeIfAbsent(key(projectId, partition), k -> new LinkedHashMap<>());
        List<HistoryItem> snapshot;
        synchronized (target) {
            items.forEach(i -> target.put(i.id(), i));
            snapshot = new ArrayList<>(target.values());
        }
        notifyLineage(key(projectId, partition), snapshot);
    }

    public void setOffline(boolean value) {
        offline.set(value);
    }

    /** Identity every call is made as; {@code null} disables the check. */
    public void setCaller(String uid) {
        this.caller = uid;
    }

    public void setWriteLatency(Duration latency) {
        this.writeLatency = latency == null ? Duration.ZERO : latency;
    }

    public List<RemoteProjectDocument> projectWrites(String projectId) {
        return List.copyOf(projectWrites.getOrDefault(projectId, List.of()));
    }

    public int maxConcurrentWrites(String projectId) {
        AtomicInteger max = maxInFlight.get(projectId);
        return max == null ? 0 : max.get();
    }

    public int lineageItemWrites() {
        return lineageItemWrites.get();
    }

    public List<String> deletedItems() {
        return List.copyOf(deletedItems);
    }

    public boolean hasProject(String projectId) {
        return projects.containsKey(projectId);
    }

    public int watcherCount(String projectId) {
        int count = projectWatchers.getOrDefault(projectId, List.of()).size();
        for (Map.Entry<String, List<Consumer<List<HistoryItem>>>> e : lineageWatchers.entrySet()) {
            if (e.getKey().startsWith(projectId + "/")) count += e.getValue().size();
        }
        return count;
    }

    // ---------- internals

    private static String key(String projectId, LineagePartition partition) {
        return projectId + "/" + partition.collection();
    }

    private void notifyProject(String projectId, RemoteProjectDocument document) {
        for (Consumer<RemoteProjectDocument> watcher : projectWatchers.getOrDefault(projectId, List.of())) {
            watcher.accept(document);
        }
    }

    private void notifyLineage(String key, List<HistoryItem> snapshot) {
        for (Consumer<List<HistoryItem>> watcher : lineageWatchers.getOrDefault(key, List.of())) {
            watcher.accept(List.copyOf(snapshot));
        }
    }

    private void checkOnline(String id) {
        if (offline.get()) {
            throw new RemoteUnavailableException(id, "Remote store is offline");
        }
    }

    private void checkCaller(String projectId, String owner) {
        String who = caller;
        if (who != null && !who.equals(owner)) {
            throw new PermissionDeniedException(projectId, who, owner);
        }
    }

    private void checkOwnerOfExisting(String projectId) {
        RemoteProjectDocument existing = projects.get(projectId);
        if (existing != null) checkCaller(projectId, existing.ownerId());
    }

    private void pause() {
        Duration latency = writeLatency;
        if (latency.isZero()) return;
        try {
            Thread.sleep(latency.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteUnavailableException(null, "Interrupted during remote write", e);
        }
    }
}
