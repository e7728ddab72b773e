package com.atelier.project.lineage;

/** Raised when following {@code parentId} links does not terminate at a root. */
public class MalformedLineageException extends IllegalStateException {

    private final String itemId;

    public MalformedLineageException(String itemId, String message) {
        super(message);
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
