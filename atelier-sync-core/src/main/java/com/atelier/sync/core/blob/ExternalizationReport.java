package com.atelier.sync.core.blob;

/**
 * Counts from one externalization pass.
 *
 * @param total items carrying an image reference
 * @param uploaded inline payloads replaced by a blob reference
 * @param skipped items already holding an external reference
 * @param errors inline payloads that could not be decoded or uploaded and were left in place
 */
public record ExternalizationReport(int total, int uploaded, int skipped, int errors) {

    public static final ExternalizationReport EMPTY = new ExternalizationReport(0, 0, 0, 0);

    public boolean complete() {
        return errors == 0;
    }
}
