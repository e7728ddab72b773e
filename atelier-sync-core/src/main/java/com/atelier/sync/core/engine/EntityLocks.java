package com.atelier.sync.core.engine;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per entity id, serializing every read-modify-write of that entity's local records. A lock
 * exists only while some thread holds or waits for it.
 */
public final class EntityLocks {
    private final ConcurrentMap<String, Holder> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String entityId, Supplier<T> work) {
        Holder holder = locks.compute(entityId, (id, existing) -> {
            Holder h = existing == null ? new Holder() : existing;
            h.users++;
            return h;
        });
        holder.lock.lock();
        try {
            return work.get();
        } finally {
            holder.lock.unlock();
            locks.computeIfPresent(entityId, (id, h) -> --h.users == 0 ? null : h);
        }
    }

    public void run(String entityId, Runnable work) {
        withLock(entityId, () -> {
            work.run();
            return null;
        });
    }

    int size() {
        return locks.size();
    }

    /** Guarded by the map's per-key compute. */
    private static final class Holder {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }
}
