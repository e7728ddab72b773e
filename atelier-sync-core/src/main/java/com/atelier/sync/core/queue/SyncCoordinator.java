package com.atelier.sync.core.queue;

import com.atelier.sync.core.session.SessionGuard;
import com.atelier.sync.core.session.SyncSession;
import com.atelier.sync.core.status.SyncStatusTracker;
import com.atelier.sync.spi.error.SyncErrorKind;
import com.atelier.sync.spi.error.SyncException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Debounced write queue with at most one in-flight write per entity.
 *
 * <p>Each entity moves through {@code Idle -> Pending -> InFlight -> Idle}. A mutation that arrives while a write
 * is in flight restarts the debounce timer; if the timer fires before the write finishes, the next write starts as
 * soon as the current one completes. Failed writes are not retried: the entity stays unsynced until the next
 * mutation or {@link #forceFlush(String)}.
 */
public final class SyncCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SyncCoordinator.class);

    private final EntityWriter writer;
    private final SessionGuard sessions;
    private final SyncStatusTracker status;
    private final Duration debounce;
    private final ScheduledExecutorService timers;
    private final ExecutorService writers;

    private final Object lock = new Object();
    private final Map<String, SyncQueueEntry> entries = new HashMap<>();
    private boolean closed;

    public SyncCoordinator(
            EntityWriter writer, SessionGuard sessions, SyncStatusTracker status, Duration debounce, int writerThreads) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.status = Objects.requireNonNull(status, "status");
        this.debounce = Objects.requireNonNull(debounce, "debounce");
        this.timers = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "atelier-sync-debounce");
            thread.setDaemon(true);
            return thread;
        });
        AtomicInteger seq = new AtomicInteger();
        this.writers = Executors.newFixedThreadPool(Math.max(1, writerThreads), runnable -> {
            Thread thread = new Thread(runnable, "atelier-sync-writer-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /** Records a mutation of {@code entityId} and (re)starts its debounce timer. */
    public void enqueue(String entityId) {
        synchronized (lock) {
            if (closed) return;
            SyncQueueEntry entry = entries.computeIfAbsent(entityId, SyncQueueEntry::new);
            entry.retired = false;
            entry.cancelTimer();
            long generation = ++entry.timerGeneration;
            entry.timer = timers.schedule(
                    () -> onTimer(entry, generation), debounce.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Queued sync entityId={} inFlight={} debounceMs={}", entityId, entry.inFlight, debounce.toMillis());
        }
        status.pending(entityId);
    }

    /**
     * Writes {@code entityId} on the calling thread, bypassing the debounce timer.
     *
     * @return {@code false} if a write for the entity is already running, in which case nothing is done
     * @throws SyncException if the write fails
     */
    public boolean forceFlush(String entityId) {
        SyncSession session = sessions.require();
        SyncQueueEntry entry;
        synchronized (lock) {
            if (closed) throw new IllegalStateException("Sync coordinator is closed");
            entry = entries.computeIfAbsent(entityId, SyncQueueEntry::new);
            if (entry.inFlight) {
                log.debug("Force flush skipped, write already running entityId={}", entityId);
                return false;
            }
            entry.cancelTimer();
            entry.rerunRequested = false;
            entry.inFlight = true;
        }
        status.syncing(entityId);
        try {
            writer.write(entityId, session);
            if (sessions.isCurrent(session)) status.synced(entityId);
            return true;
        } catch (SyncException e) {
            if (sessions.isCurrent(session)) status.failed(entityId, e);
            throw e;
        } catch (RuntimeException e) {
            if (sessions.isCurrent(session)) status.failed(entityId, e);
            throw e;
        } finally {
            complete(entry);
        }
    }

    /**
     * Drops any pending write for {@code entityId} and waits for a running one to return.
     *
     * @return {@code false} if the running write did not return within {@code timeout}
     */
    public boolean cancelAndAwait(String entityId, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (lock) {
            SyncQueueEntry entry = entries.get(entityId);
            if (entry == null) return true;
            retire(entry);
            while (entry.inFlight) {
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remaining <= 0) return false;
                lock.wait(remaining);
            }
            return true;
        }
    }

    /** Cancels every pending debounce timer without running its write. Returns the number of entities dropped. */
    public int cancelAll() {
        int dropped;
        synchronized (lock) {
            dropped = entries.size();
            for (SyncQueueEntry entry : entries.values().toArray(new SyncQueueEntry[0])) {
                retire(entry);
            }
        }
        if (dropped > 0) log.info("Cancelled pending syncs count={}", dropped);
        return dropped;
    }

    public boolean isPending(String entityId) {
        synchronized (lock) {
            SyncQueueEntry entry = entries.get(entityId);
            return entry != null && entry.isPending();
        }
    }

    public boolean isInFlight(String entityId) {
        synchronized (lock) {
            SyncQueueEntry entry = entries.get(entityId);
            return entry != null && entry.inFlight;
        }
    }

    public Set<String> activeEntities() {
        synchronized (lock) {
            return Set.copyOf(entries.keySet());
        }
    }

    /** Waits until no entity is pending or in flight. */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (lock) {
            while (!entries.isEmpty()) {
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remaining <= 0) return false;
                lock.wait(remaining);
            }
            return true;
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (closed) return;
            closed = true;
        }
        cancelAll();
        timers.shutdownNow();
        writers.shutdown();
        try {
            if (!writers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Sync writers did not finish within 5s, interrupting");
                writers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writers.shutdownNow();
        }
    }

    // ---------- internals

    private void onTimer(SyncQueueEntry entry, long generation) {
        synchronized (lock) {
            if (entry.retired || entry.timerGeneration != generation || entries.get(entry.entityId) != entry) return;
            entry.timer = null;
            if (entry.inFlight) {
                entry.rerunRequested = true;
                return;
            }
            dispatch(entry);
        }
    }

    /** Caller holds {@link #lock}. */
    private void dispatch(SyncQueueEntry entry) {
        SyncSession session = sessions.current().orElse(null);
        if (session == null || closed) {
            log.debug("No active session, dropping queued sync entityId={}", entry.entityId);
            retire(entry);
            return;
        }
        entry.rerunRequested = false;
        entry.inFlight = true;
        try {
            writers.execute(() -> runWrite(entry, session));
        } catch (RejectedExecutionException e) {
            log.warn("Sync writer pool rejected entityId={}", entry.entityId, e);
            entry.inFlight = false;
            retire(entry);
        }
    }

    private void runWrite(SyncQueueEntry entry, SyncSession session) {
        String entityId = entry.entityId;
        try {
            if (!sessions.isCurrent(session)) {
                log.debug("Session changed before write, skipping entityId={}", entityId);
                return;
            }
            status.syncing(entityId);
            writer.write(entityId, session);
            if (sessions.isCurrent(session)) {
                status.synced(entityId);
            } else {
                log.debug("Session changed during write, discarding result entityId={}", entityId);
            }
        } catch (SyncException e) {
            if (sessions.isCurrent(session)) status.failed(entityId, e);
            logFailure(entityId, e);
        } catch (RuntimeException e) {
            if (sessions.isCurrent(session)) status.failed(entityId, e);
            log.error("Unexpected failure syncing entityId={}", entityId, e);
        } finally {
            complete(entry);
        }
    }

    private void complete(SyncQueueEntry entry) {
        synchronized (lock) {
            entry.inFlight = false;
            if (entry.retired || entries.get(entry.entityId) != entry) {
                entries.remove(entry.entityId, entry);
                lock.notifyAll();
                return;
            }
            if (entry.rerunRequested && entry.timer == null) {
                dispatch(entry);
            } else if (!entry.isPending()) {
                entries.remove(entry.entityId);
            }
            lock.notifyAll();
        }
    }

    /** Caller holds {@link #lock}. A running entry stays registered until its write returns. */
    private void retire(SyncQueueEntry entry) {
        entry.cancelTimer();
        entry.rerunRequested = false;
        entry.retired = true;
        if (!entry.inFlight) {
            entries.remove(entry.entityId, entry);
        }
        lock.notifyAll();
    }

    private static void logFailure(String entityId, SyncException e) {
        SyncErrorKind kind = e.getKind();
        switch (kind) {
            case PERMISSION_DENIED -> log.error(
                    "Sync rejected, not retrying entityId={} kind={} reason={}", entityId, kind, e.getMessage());
            case REMOTE_UNAVAILABLE -> log.warn(
                    "Remote unavailable, leaving unsynced entityId={} reason={}", entityId, e.getMessage());
            default -> log.warn("Sync failed entityId={} kind={} reason={}", entityId, kind, e.getMessage());
        }
    }
}
