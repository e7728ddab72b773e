package com.atelier.sync.spi.error;

public class RemoteUnavailableException extends SyncException {

    public RemoteUnavailableException(String entityId, String message) {
        super(SyncErrorKind.REMOTE_UNAVAILABLE, entityId, message);
    }

    public RemoteUnavailableException(String entityId, String message, Throwable cause) {
        super(SyncErrorKind.REMOTE_UNAVAILABLE, entityId, message, cause);
    }
}
