package com.atelier.sync.spi.error;

import java.util.List;

public class MalformedEntityException extends SyncException {

    private final List<String> missingFields;

    public MalformedEntityException(String entityId, List<String> missingFields) {
        super(SyncErrorKind.MALFORMED_ENTITY, entityId, "Entity " + entityId + " is missing " + missingFields);
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
