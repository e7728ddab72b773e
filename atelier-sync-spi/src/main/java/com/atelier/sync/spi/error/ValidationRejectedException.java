package com.atelier.sync.spi.error;

public class ValidationRejectedException extends SyncException {

    private final String path;

    public ValidationRejectedException(String entityId, String reason, String path) {
        super(SyncErrorKind.VALIDATION_REJECTED, entityId, reason);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
