package com.atelier.sync.spi.blob;

import java.util.Objects;

/**
 * Binary payload to externalize.
 *
 * @param ownerId identity the blob is stored under
 * @param category destination folder
 * @param name file name without folder
 * @param contentType MIME type of {@code data}
 * @param data raw bytes
 */
public record BlobUpload(String ownerId, BlobCategory category, String name, String contentType, byte[] data) {

    public BlobUpload {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(data, "data");
    }

    public int size() {
        return data.length;
    }
}
