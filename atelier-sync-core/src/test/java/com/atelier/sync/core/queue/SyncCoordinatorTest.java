package com.atelier.sync.core.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import com.atelier.sync.core.session.SessionGuard;
import com.atelier.sync.core.session.SyncSession;
import com.atelier.sync.core.status.SyncStatus;
import com.atelier.sync.core.status.SyncStatusTracker;
import com.atelier.sync.spi.error.RemoteUnavailableException;
import com.atelier.sync.spi.identity.UserIdentity;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SyncCoordinatorTest {

    private static final Duration DEBOUNCE = Duration.ofMillis(80);

    private final SessionGuard sessions = new SessionGuard();
    private final SyncStatusTracker status = new SyncStatusTracker(Clock.systemUTC());
    private final RecordingWriter writer = new RecordingWriter();
    private SyncCoordinator coordinator;

    @BeforeEach
    void setUp() {
        sessions.open(UserIdentity.of("user-a"));
        coordinator = new SyncCoordinator(writer, sessions, status, DEBOUNCE, 4);
    }

    @AfterEach
    void tearDown() {
        coordinator.close();
    }

    @Test
    void burstOfEnqueuesProducesOneWrite() throws Exception {
        for (int i = 0; i < 10; i++) {
            coordinator.enqueue("p1");
        }
        assertThat(status.get("p1").status()).isEqualTo(SyncStatus.PENDING);

        assertThat(coordinator.awaitIdle(Duration.ofSeconds(2))).isTrue();
        assertThat(writer.writes).containsExactly("p1");
        assertThat(status.get("p1").status()).isEqualTo(SyncStatus.SYNCED);
    }

    @Test
    void separateEntitiesAreWrittenIndependently() throws Exception {
        coordinator.enqueue("p1");
        coordinator.enqueue("p2");

        assertThat(coordinator.awaitIdle(Duration.ofSeconds(2))).isTrue();
        assertThat(writer.writes).containsExactlyInAnyOrder("p1", "p2");
    }

    @Test
    void enqueueDuringWriteRunsOneFollowUpAndNeverOverlaps() throws Exception {
        writer.hold = new CountDownLatch(1);
        coordinator.enqueue("p1");
        await().atMost(2, TimeUnit.SECONDS).until(() -> coordinator.isInFlight("p1"));

        coordinator.enqueue("p1");
        coordinator.enqueue("p1");
        // debounce of the follow-up expires while the first write is still running
        Thread.sleep(DEBOUNCE.toMillis() * 3);
        assertThat(writer.maxConcurrent.get()).isEqualTo(1);
        writer.hold.countDown();

        assertThat(coordinator.awaitIdle(Duration.ofSeconds(2))).isTrue();
        assertThat(writer.writes).containsExactly("p1", "p1");
        assertThat(writer.maxConcurrent.get()).isEqualTo(1);
    }

    @Test
    void forceFlushWritesImmediatelyAndDropsPendingTimer() throws Exception {
        coordinator.enqueue("p1");

        assertThat(coordinator.forceFlush("p1")).isTrue();
        assertThat(writer.writes).containsExactly("p1");

        Thread.sleep(DEBOUNCE.toMillis() * 2);
        assertThat(writer.writes).containsExactly("p1");
        assertThat(coordinator.activeEntities()).isEmpty();
    }

    @Test
    void forceFlushPropagatesWriteFailure() {
        writer.failure = new RemoteUnavailableException("p1", "offline");

        assertThatThrownBy(() -> coordinator.forceFlush("p1")).isInstanceOf(RemoteUnavailableException.class);
        assertThat(status.get("p1").status()).isEqualTo(SyncStatus.OFFLINE);
        assertThat(status.get("p1").lastError()).isEqualTo("offline");
    }

    @Test
    void forceFlushReturnsFalseWhileWriteIsRunning() throws Exception {
        writer.hold = new CountDownLatch(1);
        coordinator.enqueue("p1");
        await().atMost(2, TimeUnit.SECONDS).until(() -> coordinator.isInFlight("p1"));

        assertThat(coordinator.forceFlush("p1")).isFalse();
        writer.hold.countDown();

        assertThat(coordinator.awaitIdle(Duration.ofSeconds(2))).isTrue();
        assertThat(writer.writes).containsExactly("p1");
    }

    @Test
    void failedDebouncedWriteIsNotRetried() throws Exception {
        writer.failure = new RemoteUnavailableException("p1", "offline");
        coordinator.enqueue("p1");

        assertThat(coordinator.awaitIdle(Duration.ofSeconds(2))).isTrue();
        Thread.sleep(DEBOUNCE.toMillis() * 2);
        assertThat(writer.attempts.get()).isEqualTo(1);
        assertThat(status.get("p1").status()).isEqualTo(SyncStatus.OFFLINE);
    }

    @Test
    void cancelAllDropsPendingWrites() throws Exception {
        coordinator.enqueue("p1");
        coordinator.enqueue("p2");

        assertThat(coordinator.cancelAll()).isEqualTo(2);

        Thread.sleep(DEBOUNCE.toMillis() * 3);
        assertThat(writer.writes).isEmpty();
        assertThat(coordinator.isPending("p1")).isFalse();
    }

    @Test
    void cancelAndAwaitWaitsForRunningWriteAndDropsFollowUp() throws Exception {
        writer.hold = new CountDownLatch(1);
        coordinator.enqueue("p1");
        await().atMost(2, TimeUnit.SECONDS).until(() -> coordinator.isInFlight("p1"));
        coordinator.enqueue("p1");

        assertThat(coordinator.cancelAndAwait("p1", Duration.ofMillis(100))).isFalse();
        assertThat(coordinator.forceFlush("p1")).isFalse();
        writer.hold.countDown();

        assertThat(coordinator.cancelAndAwait("p1", Duration.ofSeconds(2))).isTrue();
        assertThat(coordinator.isInFlight("p1")).isFalse();
        Thread.sleep(DEBOUNCE.toMillis() * 3);
        assertThat(writer.maxConcurrent.get()).isEqualTo(1);
        assertThat(writer.writes).containsExactly("p1");
    }

    @Test
    void cancelAndAwaitOfIdleEntityReturnsAtOnce() throws Exception {
        assertThat(coordinator.cancelAndAwait("p9", Duration.ZERO)).isTrue();
    }

    @Test
    void queuedWriteIsDroppedWhenSessionEnds() throws Exception {
        coordinator.enqueue("p1");
        sessions.close();

        assertThat(coordinator.awaitIdle(Duration.ofSeconds(2))).isTrue();
        assertThat(writer.writes).isEmpty();
    }

    @Test
    void forceFlushRequiresSession() {
        sessions.close();

        assertThatThrownBy(() -> coordinator.forceFlush("p1"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("init");
    }

    private static final class RecordingWriter implements EntityWriter {
        final List<String> writes = new CopyOnWriteArrayList<>();
        final AtomicInteger attempts = new AtomicInteger();
        final AtomicInteger running = new AtomicInteger();
        final AtomicInteger maxConcurrent = new AtomicInteger();
        volatile CountDownLatch hold;
        volatile RuntimeException failure;

        @Override
        public void write(String entityId, SyncSession session) {
            attempts.incrementAndGet();
            int now = running.incrementAndGet();
            maxConcurrent.accumulateAndGet(now, Math::max);
            try {
                CountDownLatch latch = hold;
                if (latch != null) {
                    latch.await(5, TimeUnit.SECONDS);
                    hold = null;
                }
                if (failure != null) throw failure;
                writes.add(entityId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                running.decrementAndGet();
            }
        }
    }
}
