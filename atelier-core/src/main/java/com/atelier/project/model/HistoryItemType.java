package com.atelier.project.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

/**
 * Kind of node in a project lineage. Generation kinds live in the primary lineage, styling kinds live in the
 * per-root styling partition.
 */
public enum HistoryItemType {
    MODEL_GENERATION("model-generation", false),
    MODEL_REVISION("model-revision", false),
    TRY_ON("try-on", true),
    TRY_ON_REVISION("try-on-revision", true);

    private final String wireValue;
    private final boolean styling;

    HistoryItemType(String wireValue, boolean styling) {
        this.wireValue = wireValue;
        this.styling = styling;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isStyling() {
        return styling;
    }

    public boolean isPrimary() {
        return !styling;
    }

    public boolean isRevision() {
        return this == MODEL_REVISION || this == TRY_ON_REVISION;
    }

    /** Unknown wire values decode to {@code null} so callers can treat the item as malformed. */
    @JsonCreator
    public static HistoryItemType fromWire(String value) {
        return parse(value).orElse(null);
    }

    public static Optional<HistoryItemType> parse(String value) {
        if (value == null) return Optional.empty();
        for (HistoryItemType type : values()) {
            if (type.wireValue.equals(value) || type.name().equalsIgnoreCase(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Infers the type of a legacy item that was stored without one.
     *
     * @param styling whether the item was found in a styling partition
     * @param hasParent whether the item has a parent node
     */
    public static HistoryItemType infer(boolean styling, boolean hasParent) {
        if (styling) {
            return hasParent ? TRY_ON_REVISION : TRY_ON;
        }
        return hasParent ? MODEL_REVISION : MODEL_GENERATION;
    }
}
