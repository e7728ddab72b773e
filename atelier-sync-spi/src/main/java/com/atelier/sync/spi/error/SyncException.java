package com.atelier.sync.spi.error;

/**
 * Base class of every failure raised by the sync engine or its store collaborators.
 */
public class SyncException extends RuntimeException {

    private final SyncErrorKind kind;
    private final String entityId;

    public SyncException(SyncErrorKind kind, String entityId, String message) {
        super(message);
        this.kind = kind;
        this.entityId = entityId;
    }

    public SyncException(SyncErrorKind kind, String entityId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.entityId = entityId;
    }

    public SyncErrorKind getKind() {
        return kind;
    }

    public String getEntityId() {
        return entityId;
    }
}
