package com.atelier.sync.spi.blob;

/** Object store accepting large binary payloads in exchange for stable references. */
public interface BlobStore {

    /** Stores the payload and returns a stable reference (typically a URL). */
    String upload(BlobUpload upload);

    void delete(String reference);

    /** Whether {@code reference} points into this store, as opposed to inline data or a foreign URL. */
    default boolean owns(String reference) {
        return reference != null && (reference.startsWith("https://") || reference.startsWith("gs://"));
    }
}
