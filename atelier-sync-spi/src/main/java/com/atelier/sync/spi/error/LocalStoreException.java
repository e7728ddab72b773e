package com.atelier.sync.spi.error;

public class LocalStoreException extends SyncException {

    public LocalStoreException(String entityId, String message, Throwable cause) {
        super(SyncErrorKind.LOCAL_STORE, entityId, message, cause);
    }
}
