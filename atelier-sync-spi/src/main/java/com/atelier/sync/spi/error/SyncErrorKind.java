package com.atelier.sync.spi.error;

/** Failure taxonomy shared by the engine and its collaborators. */
public enum SyncErrorKind {
    /** Payload embeds inline binary; recoverable by externalizing it first. */
    VALIDATION_REJECTED,
    /** Network or service failure; the entity stays unsynced until the next mutation. */
    REMOTE_UNAVAILABLE,
    /** Identity or ownership mismatch; fatal for that write. */
    PERMISSION_DENIED,
    /** Required fields missing; the entity is skipped, others proceed. */
    MALFORMED_ENTITY,
    /** The local store could not persist a mutation. */
    LOCAL_STORE
}
