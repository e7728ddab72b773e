package com.atelier.project.model;

import com.atelier.project.lineage.LineageClock;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Node in a project lineage forest.
 *
 * <p>{@code baseModelId} is denormalized: it must equal the id reached by walking {@code parentId} links to a
 * root. {@code createdAt}/{@code updatedAt} are optional explicit clocks; when absent the timestamp suffix of
 * {@code id} orders the item.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistoryItem(
        String id,
        String parentId,
        HistoryItemType type,
        String imageUrl,
        String baseModelId,
        @JsonProperty("isStarred") boolean starred,
        String name,
        String prompt,
        List<String> outfitGarmentIds,
        Long createdAt,
        Long updatedAt) {

    public HistoryItem {
        outfitGarmentIds = outfitGarmentIds == null ? null : List.copyOf(outfitGarmentIds);
    }

    /** Position of this item in the lineage total order. */
    @JsonIgnore
    public long orderKey() {
        return createdAt != null ? createdAt : LineageClock.fromId(id);
    }

    /** Clock used to pick a winner when two replicas hold the same id. */
    @JsonIgnore
    public long recency() {
        return updatedAt != null ? updatedAt : orderKey();
    }

    @JsonIgnore
    public boolean isRoot() {
        return parentId == null;
    }

    @JsonIgnore
    public boolean isStyling() {
        return type != null && type.isStyling();
    }

    public HistoryItem withParent(String newParentId, String newBaseModelId) {
        return toBuilder().parentId(newParentId).baseModelId(newBaseModelId).build();
    }

    public HistoryItem withBaseModelId(String newBaseModelId) {
        return toBuilder().baseModelId(newBaseModelId).build();
    }

    public HistoryItem withImageUrl(String newImageUrl) {
        return toBuilder().imageUrl(newImageUrl).build();
    }

    public HistoryItem withType(HistoryItemType newType) {
        return toBuilder().type(newType).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .parentId(parentId)
                .type(type)
                .imageUrl(imageUrl)
                .baseModelId(baseModelId)
                .starred(starred)
                .name(name)
                .prompt(prompt)
                .outfitGarmentIds(outfitGarmentIds)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static final class Builder {
        private String id;
        private String parentId;
        private HistoryItemType type;
        private String imageUrl;
        private String baseModelId;
        private boolean starred;
        private String name;
        private String prompt;
        private List<String> outfitGarmentIds;
        private Long createdAt;
        private Long updatedAt;

        public Builder id(String v) {
            this.id = v;
            return this;
        }

        public Builder parentId(String v) {
            this.parentId = v;
            return this;
        }

        public Builder type(HistoryItemType v) {
            this.type = v;
            return this;
        }

        public Builder imageUrl(String v) {
            this.imageUrl = v;
            return this;
        }

        public Builder baseModelId(String v) {
            this.baseModelId = v;
            return this;
        }

        public Builder starred(boolean v) {
            this.starred = v;
            return this;
        }

        public Builder name(String v) {
            this.name = v;
            return this;
        }

        public Builder prompt(String v) {
            this.prompt = v;
            return this;
        }

        public Builder outfitGarmentIds(List<String> v) {
            this.outfitGarmentIds = v;
            return this;
        }

        public Builder createdAt(Long v) {
            this.createdAt = v;
            return this;
        }

        public Builder updatedAt(Long v) {
            this.updatedAt = v;
            return this;
        }

        public HistoryItem build() {
            return new HistoryItem(
                    id,
                    parentId,
                    type,
                    imageUrl,
                    baseModelId,
                    starred,
                    name,
                    prompt,
                    outfitGarmentIds,
                    createdAt,
                    updatedAt);
        }
    }
}
