package com.atelier.sync.core.subscription;

import java.util.concurrent.atomic.AtomicBoolean;

/** Handle returned by a subscribe call. Closing more than once has no further effect. */
public final class SyncSubscription implements AutoCloseable {
    private final Runnable unsubscribe;
    private final AtomicBoolean closed = new AtomicBoolean();

    SyncSubscription(Runnable unsubscribe) {
        this.unsubscribe = unsubscribe;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            unsubscribe.run();
        }
    }
}
