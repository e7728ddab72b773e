package com.atelier.sync.core.validation;

import com.atelier.project.model.HistoryItem;
import com.atelier.project.model.WardrobeItem;
import java.util.ArrayList;
import java.util.List;

/** Fields an item must carry before it may be written remotely. */
public final class EntityRequirements {

    private EntityRequirements() {}

    public static List<String> missing(HistoryItem item) {
        List<String> missing = new ArrayList<>(3);
        if (isBlank(item.id())) missing.add("id");
        if (item.type() == null) missing.add("type");
        if (isBlank(item.imageUrl())) missing.add("imageUrl");
        return missing;
    }

    public static List<String> missing(WardrobeItem item) {
        List<String> missing = new ArrayList<>(2);
        if (isBlank(item.id())) missing.add("id");
        if (isBlank(item.url())) missing.add("url");
        return missing;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
