package com.atelier.project.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Working set attached to a project: scalar editor fields, the primary lineage, the styling partition keyed by
 * lineage root id, and the project wardrobe.
 *
 * <p>Instances are immutable; use {@link #toBuilder()} to derive a modified copy.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = ProjectState.Builder.class)
public final class ProjectState {

    // -------- Scalars
    private final String id;
    private final String modelDescription;
    private final String revisionPrompt;
    private final String selectedModelName;
    private final String currentHistoryItemId;
    private final Map<String, Object> generationSettings;

    // -------- Collections
    private final List<HistoryItem> generatedModelHistory;
    private final Map<String, List<HistoryItem>> stylingHistory;
    private final List<WardrobeItem> wardrobe;

    // -------- Clocks
    private final long updatedAt; // wall clock of the last local mutation
    private final long syncVersion; // monotonic, bumped by merges and pushes

    private ProjectState(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.modelDescription = b.modelDescription;
        this.revisionPrompt = b.revisionPrompt;
        this.selectedModelName = b.selectedModelName;
        this.currentHistoryItemId = b.currentHistoryItemId;
        this.generationSettings = b.generationSettings == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(b.generationSettings));
        this.generatedModelHistory =
                b.generatedModelHistory == null ? List.of() : List.copyOf(b.generatedModelHistory);
        this.stylingHistory = copyStyling(b.stylingHistory);
        this.wardrobe = b.wardrobe == null ? List.of() : List.copyOf(b.wardrobe);
        this.updatedAt = b.updatedAt;
        this.syncVersion = b.syncVersion;
    }

    private static Map<String, List<HistoryItem>> copyStyling(Map<String, List<HistoryItem>> source) {
        if (source == null || source.isEmpty()) return Map.of();
        Map<String, List<HistoryItem>> copy = new LinkedHashMap<>();
        source.forEach((root, items) -> copy.put(root, items == null ? List.of() : List.copyOf(items)));
        return Collections.unmodifiableMap(copy);
    }

    public static ProjectState empty(String projectId) {
        return builder().id(projectId).build();
    }

    public String getId() {
        return id;
    }

    public String getModelDescription() {
        return modelDescription;
    }

    public String getRevisionPrompt() {
        return revisionPrompt;
    }

    public String getSelectedModelName() {
        return selectedModelName;
    }

    public String getCurrentHistoryItemId() {
        return currentHistoryItemId;
    }

    public Map<String, Object> getGenerationSettings() {
        return generationSettings;
    }

    public List<HistoryItem> getGeneratedModelHistory() {
        return generatedModelHistory;
    }

    public Map<String, List<HistoryItem>> getStylingHistory() {
        return stylingHistory;
    }

    public List<WardrobeItem> getWardrobe() {
        return wardrobe;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public long getSyncVersion() {
        return syncVersion;
    }

    /** Root ids that own a styling partition. */
    public Set<String> stylingRootIds() {
        return new LinkedHashSet<>(stylingHistory.keySet());
    }

    /** Every lineage node across both partitions, primary first. */
    public List<HistoryItem> allHistoryItems() {
        List<HistoryItem> all = new ArrayList<>(generatedModelHistory);
        stylingHistory.values().forEach(all::addAll);
        return all;
    }

    /** Equality ignoring {@code updatedAt} and {@code syncVersion}. */
    public boolean sameContent(ProjectState other) {
        if (other == null) return false;
        return Objects.equals(id, other.id)
                && Objects.equals(modelDescription, other.modelDescription)
                && Objects.equals(revisionPrompt, other.revisionPrompt)
                && Objects.equals(selectedModelName, other.selectedModelName)
                && Objects.equals(currentHistoryItemId, other.currentHistoryItemId)
                && Objects.equals(generationSettings, other.generationSettings)
                && Objects.equals(generatedModelHistory, other.generatedModelHistory)
                && Objects.equals(stylingHistory, other.stylingHistory)
                && Objects.equals(wardrobe, other.wardrobe);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectState other)) return false;
        return updatedAt == other.updatedAt && syncVersion == other.syncVersion && sameContent(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                id,
                modelDescription,
                revisionPrompt,
                selectedModelName,
                currentHistoryItemId,
                generationSettings,
                generatedModelHistory,
                stylingHistory,
                wardrobe,
                updatedAt,
                syncVersion);
    }

    @Override
    public String toString() {
        return "ProjectState{id=" + id + ", primary=" + generatedModelHistory.size() + ", stylingRoots="
                + stylingHistory.size() + ", wardrobe=" + wardrobe.size() + ", updatedAt=" + updatedAt
                + ", syncVersion=" + syncVersion + '}';
    }

    // ---------- Builder

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .modelDescription(modelDescription)
                .revisionPrompt(revisionPrompt)
                .selectedModelName(selectedModelName)
                .currentHistoryItemId(currentHistoryItemId)
                .generationSettings(generationSettings)
                .generatedModelHistory(generatedModelHistory)
                .stylingHistory(stylingHistory)
                .wardrobe(wardrobe)
                .updatedAt(updatedAt)
                .syncVersion(syncVersion);
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Builder {
        private String id;
        private String modelDescription;
        private String revisionPrompt;
        private String selectedModelName;
        private String currentHistoryItemId;
        private Map<String, Object> generationSettings;
        private List<HistoryItem> generatedModelHistory;
        private Map<String, List<HistoryItem>> stylingHistory;
        private List<WardrobeItem> wardrobe;
        private long updatedAt;
        private long syncVersion;

        public Builder id(String v) {
            this.id = v;
            return this;
        }

        public Builder modelDescription(String v) {
            this.modelDescription = v;
            return this;
        }

        public Builder revisionPrompt(String v) {
            this.revisionPrompt = v;
            return this;
        }

        public Builder selectedModelName(String v) {
            this.selectedModelName = v;
            return this;
        }

        public Builder currentHistoryItemId(String v) {
            this.currentHistoryItemId = v;
            return this;
        }

        public Builder generationSettings(Map<String, Object> v) {
            this.generationSettings = v;
            return this;
        }

        public Builder generatedModelHistory(List<HistoryItem> v) {
            this.generatedModelHistory = v;
            return this;
        }

        public Builder stylingHistory(Map<String, List<HistoryItem>> v) {
            this.stylingHistory = v;
            return this;
        }

        public Builder wardrobe(List<WardrobeItem> v) {
            this.wardrobe = v;
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

        public ProjectState build() {
            return new ProjectState(this);
        }
    }
}
