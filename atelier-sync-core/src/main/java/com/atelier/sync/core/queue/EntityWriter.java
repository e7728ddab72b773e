package com.atelier.sync.core.queue;

import com.atelier.sync.core.session.SyncSession;

/**
 * Pushes the freshest local snapshot of one entity to the remote store.
 *
 * <p>Implementations re-read local state on every call and throw a
 * {@link com.atelier.sync.spi.error.SyncException} on failure.
 */
@FunctionalInterface
public interface EntityWriter {

    void write(String entityId, SyncSession session);
}
