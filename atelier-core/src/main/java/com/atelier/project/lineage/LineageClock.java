package com.atelier.project.lineage;

import com.atelier.project.model.HistoryItem;
import java.util.Comparator;

/**
 * Ordering helpers for lineage ids of the form {@code <prefix>-<epochMillis>}.
 *
 * <p>The numeric suffix is the total order key of an item that carries no explicit {@code createdAt}. Ids whose
 * suffix does not parse sort first.
 */
public final class LineageClock {

    /** Lineage total order: order key, then id. */
    public static final Comparator<HistoryItem> ORDER = Comparator.comparingLong(HistoryItem::orderKey)
            .thenComparing(HistoryItem::id, Comparator.nullsFirst(Comparator.naturalOrder()));

    private LineageClock() {}

    public static long fromId(String id) {
        if (id == null) return 0L;
        int idx = id.lastIndexOf('-');
        String suffix = idx < 0 ? id : id.substring(idx + 1);
        if (suffix.isEmpty()) return 0L;
        try {
            return Long.parseLong(suffix);
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    public static String newId(String prefix, long epochMillis) {
        return prefix + "-" + epochMillis;
    }
}
