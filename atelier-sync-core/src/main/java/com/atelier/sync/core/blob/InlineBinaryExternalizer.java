package com.atelier.sync.core.blob;

import com.atelier.project.model.HistoryItem;
import com.atelier.project.model.ProjectState;
import com.atelier.project.model.WardrobeItem;
import com.atelier.sync.core.validation.InlineBinaryDetector;
import com.atelier.sync.spi.blob.BlobCategory;
import com.atelier.sync.spi.blob.BlobStore;
import com.atelier.sync.spi.blob.BlobUpload;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Uploads inline {@code data:} images found in a project state to the blob store and swaps in the returned
 * references. Failures leave the item inline and are counted; the pass never throws for a single item.
 */
@Slf4j
public class InlineBinaryExternalizer {

    private final BlobStore blobs;

    public InlineBinaryExternalizer(BlobStore blobs) {
        this.blobs = Objects.requireNonNull(blobs, "blobs");
    }

    public Result externalize(ProjectState state, String ownerId) {
        Counter counter = new Counter();
        List<HistoryItem> primary = new ArrayList<>();
        for (HistoryItem item : state.getGeneratedModelHistory()) {
            primary.add(externalize(item, ownerId, BlobCategory.MODELS, counter));
        }
        Map<String, List<HistoryItem>> styling = new LinkedHashMap<>();
        state.getStylingHistory().forEach((root, items) -> {
            List<HistoryItem> out = new ArrayList<>(items.size());
            for (HistoryItem item : items) out.add(externalize(item, ownerId, BlobCategory.TRYONS, counter));
            styling.put(root, out);
        });
        List<WardrobeItem> wardrobe = new ArrayList<>();
        for (WardrobeItem item : state.getWardrobe()) {
            String url = upload(item.id(), item.url(), ownerId, BlobCategory.WARDROBE, counter);
            wardrobe.add(Objects.equals(url, item.url()) ? item : item.withUrl(url));
        }
        ExternalizationReport report = counter.report();
        if (report.uploaded() == 0) {
            return new Result(state, report);
        }
        ProjectState next = state.toBuilder()
                .generatedModelHistory(primary)
                .stylingHistory(styling)
                .wardrobe(wardrobe)
                .build();
        return new Result(next, report);
    }

    private HistoryItem externalize(HistoryItem item, String ownerId, BlobCategory category, Counter counter) {
        String url = upload(item.id(), item.imageUrl(), ownerId, category, counter);
        return Objects.equals(url, item.imageUrl()) ? item : item.withImageUrl(url);
    }

    private String upload(String id, String url, String ownerId, BlobCategory category, Counter counter) {
        if (url == null || url.isEmpty()) return url;
        counter.total++;
        if (!InlineBinaryDetector.isInlineBinary(url)) {
            counter.skipped++;
            return url;
        }
        InlinePayload payload = InlinePayload.parse(url).orElse(null);
        if (payload == null) {
            counter.errors++;
            log.warn("Could not decode inline payload for item {}", id);
            return url;
        }
        try {
            String reference = blobs.upload(new BlobUpload(
                    ownerId, category, (id == null ? "item" : id) + "." + payload.extension(), payload.contentType(),
                    payload.data()));
            counter.uploaded++;
            log.debug("Externalized item {} bytes={} -> {}", id, payload.data().length, reference);
            return reference;
        } catch (RuntimeException e) {
            counter.errors++;
            log.warn("Failed to externalize item {} into {}: {}", id, category.folder(), e.getMessage());
            return url;
        }
    }

    /** Externalized state and its counts. */
    public record Result(ProjectState state, ExternalizationReport report) {}

    private static final class Counter {
        int total;
        int uploaded;
        int skipped;
        int errors;

        ExternalizationReport report() {
            return new ExternalizationReport(total, uploaded, skipped, errors);
        }
    }
}
