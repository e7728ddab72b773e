package com.atelier.sync.testkit;

import com.atelier.sync.spi.blob.BlobStore;
import com.atelier.sync.spi.blob.BlobUpload;
import com.atelier.sync.spi.error.RemoteUnavailableException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/** Test double that stores blobs in memory under {@code https://blobs.test/} references. */
public class InMemoryBlobStore implements BlobStore {
    public static final String BASE = "https://blobs.test/";

    private final Map<String, BlobUpload> blobs = new ConcurrentHashMap<>();
    private final List<String> deleted = Collections.synchronizedList(new ArrayList<>());
    private final AtomicBoolean failUploads = new AtomicBoolean();

    @Override
    public String upload(BlobUpload upload) {
        if (failUploads.get()) {
            throw new RemoteUnavailableException(upload.name(), "Blob store unavailable");
        }
        String reference = BASE + upload.ownerId() + "/" + upload.category().folder() + "/" + upload.name();
        blobs.put(reference, upload);
        return reference;
    }

    @Override
    public void delete(String reference) {
        blobs.remove(reference);
        deleted.add(reference);
    }

    @Override
    public boolean owns(String reference) {
        return reference != null && reference.startsWith(BASE);
    }

    public Map<String, BlobUpload> blobs() {
        return Collections.unmodifiableMap(blobs);
    }

    public List<String> deleted() {
        synchronized (deleted) {
            return List.copyOf(deleted);
        }
    }

    public void failUploads(boolean fail) {
        failUploads.set(fail);
    }
}
