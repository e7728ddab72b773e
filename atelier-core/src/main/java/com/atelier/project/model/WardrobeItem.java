package com.atelier.project.model;

import com.atelier.project.lineage.LineageClock;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/** Reusable garment or accessory asset referenced by styling applications. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WardrobeItem(
        String id,
        String name,
        String url,
        String category,
        String subcategory,
        WardrobeSource source,
        String notes,
        Long updatedAt) {

    @JsonIgnore
    public long recency() {
        return updatedAt != null ? updatedAt : LineageClock.fromId(id);
    }

    public WardrobeItem withUrl(String newUrl) {
        return new WardrobeItem(id, name, newUrl, category, subcategory, source, notes, updatedAt);
    }
}
