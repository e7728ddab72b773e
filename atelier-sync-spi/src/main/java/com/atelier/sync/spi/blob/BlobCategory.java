package com.atelier.sync.spi.blob;

/** Storage folder a blob is uploaded into. */
public enum BlobCategory {
    MODELS("models"),
    TRYONS("tryons"),
    WARDROBE("wardrobe");

    private final String folder;

    BlobCategory(String folder) {
        this.folder = folder;
    }

    public String folder() {
        return folder;
    }
}
