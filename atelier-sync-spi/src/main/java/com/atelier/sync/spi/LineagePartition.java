package com.atelier.sync.spi;

import java.util.Objects;

/**
 * Physical remote collection holding part of a project lineage: the shared primary collection, or the styling
 * collection of one lineage root.
 */
public record LineagePartition(String collection, String rootId) {

    public static final String PRIMARY_COLLECTION = "generatedModelHistory";

    private static final LineagePartition PRIMARY = new LineagePartition(PRIMARY_COLLECTION, null);

    public LineagePartition {
        Objects.requireNonNull(collection, "collection");
    }

    public static LineagePartition primary() {
        return PRIMARY;
    }

    public static LineagePartition styling(String rootId) {
        return new LineagePartition(Objects.requireNonNull(rootId, "rootId"), rootId);
    }

    public boolean isPrimary() {
        return rootId == null;
    }
}
