package com.atelier.sync.spi.error;

public class PermissionDeniedException extends SyncException {

    private final String identity;
    private final String owner;

    public PermissionDeniedException(String entityId, String identity, String owner) {
        super(
                SyncErrorKind.PERMISSION_DENIED,
                entityId,
                "Identity " + identity + " may not write " + entityId + " owned by " + owner);
        this.identity = identity;
        this.owner = owner;
    }

    public String getIdentity() {
        return identity;
    }

    public String getOwner() {
        return owner;
    }
}
