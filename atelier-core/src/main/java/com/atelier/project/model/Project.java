package com.atelier.project.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Project metadata record. Owned by exactly one identity; {@code syncVersion} only ever grows.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Project(
        String id,
        String ownerId,
        String title,
        String description,
        String organization,
        List<String> tags,
        ProjectStatus status,
        LocalDate deadline,
        Long createdAt,
        long updatedAt,
        long syncVersion) {

    public Project {
        Objects.requireNonNull(id, "id");
        tags = tags == null ? List.of() : List.copyOf(tags);
        status = status == null ? ProjectStatus.DRAFT : status;
    }

    public Project withSyncVersion(long version) {
        return toBuilder().syncVersion(version).build();
    }

    public Project withOwner(String owner) {
        return toBuilder().ownerId(owner).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .ownerId(ownerId)
                .title(title)
                .description(description)
                .organization(organization)
                .tags(tags)
                .status(status)
                .deadline(deadline)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .syncVersion(syncVersion);
    }

    public static final class Builder {
        private String id;
        private String ownerId;
        private String title;
        private String description;
        private String organization;
        private List<String> tags;
        private ProjectStatus status;
        private LocalDate deadline;
        private Long createdAt;
        private long updatedAt;
        private long syncVersion;

        public Builder id(String v) {
            this.id = v;
            return this;
        }

        public Builder ownerId(String v) {
            this.ownerId = v;
            return this;
        }

        public Builder title(String v) {
            this.title = v;
            return this;
        }

        public Builder description(String v) {
            this.description = v;
            return this;
        }

        public Builder organization(String v) {
            this.organization = v;
            return this;
        }

        public Builder tags(List<String> v) {
            this.tags = v;
            return this;
        }

        public Builder status(ProjectStatus v) {
            this.status = v;
            return this;
        }

        public Builder deadline(LocalDate v) {
            this.deadline = v;
            return this;
        }

        public Builder createdAt(Long v) {
            this.createdAt = v;
            return this;
        }

        public Builder updatedAt(long v) {
            this.updatedAt = v;
            return this;
        }

        public Builder syncVersion(long v) {
            this.syncVersion = v;
            return this;
        }

        public Project build() {
            return new Project(
                    id, ownerId, title, description, organization, tags, status, deadline, createdAt, updatedAt,
                    syncVersion);
        }
    }
}
