package com.atelier.project.lineage;

import com.atelier.project.model.HistoryItem;
import com.atelier.project.model.HistoryItemType;
import java.util.ArrayList;
import java.util.List;

/** Repairs legacy lineage items written before every item carried a type. */
public final class LineageMigrations {

    private LineageMigrations() {}

    public static List<HistoryItem> inferMissingTypes(List<HistoryItem> items, boolean styling) {
        List<HistoryItem> out = new ArrayList<>(items.size());
        for (HistoryItem item : items) {
            if (item.type() == null) {
                out.add(item.withType(HistoryItemType.infer(styling, item.parentId() != null)));
            } else {
                out.add(item);
            }
        }
        return out;
    }

    public static long countUntyped(List<HistoryItem> items) {
        return items.stream().filter(i -> i.type() == null).count();
    }
}
