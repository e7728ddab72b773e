package com.atelier.sync.core.session;

import com.atelier.sync.spi.identity.UserIdentity;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/** Holds the active {@link SyncSession}. */
public final class SessionGuard {
    private final AtomicReference<SyncSession> current = new AtomicReference<>();
    private final AtomicLong epochs = new AtomicLong();

    public SyncSession open(UserIdentity identity) {
        SyncSession session = new SyncSession(Objects.requireNonNull(identity, "identity"), epochs.incrementAndGet());
        current.set(session);
        return session;
    }

    /** Ends the active session and returns it, if any. */
    public Optional<SyncSession> close() {
        return Optional.ofNullable(current.getAndSet(null));
    }

    public Optional<SyncSession> current() {
        return Optional.ofNullable(current.get());
    }

    public SyncSession require() {
        SyncSession session = current.get();
        if (session == null) {
            throw new IllegalStateException("Sync engine has no active session; call init(identity) first");
        }
        return session;
    }

    public boolean isCurrent(SyncSession session) {
        return session != null && session.equals(current.get());
    }
}
