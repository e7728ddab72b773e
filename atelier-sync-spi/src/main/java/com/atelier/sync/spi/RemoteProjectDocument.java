package com.atelier.sync.spi;

import com.atelier.project.model.Project;
import java.util.List;
import java.util.Map;

/**
 * Project-level remote record: metadata plus the scalar part of the working state. Lineage and wardrobe live in
 * their own collections.
 *
 * @param stylingRootIds roots that own a styling collection
 */
public record RemoteProjectDocument(
        Project project,
        String modelDescription,
        String revisionPrompt,
        String selectedModelName,
        String currentHistoryItemId,
        Map<String, Object> generationSettings,
        List<String> stylingRootIds,
        long updatedAt,
        long syncVersion) {

    public RemoteProjectDocument {
        generationSettings = generationSettings == null ? Map.of() : generationSettings;
        stylingRootIds = stylingRootIds == null ? List.of() : List.copyOf(stylingRootIds);
    }

    public String projectId() {
        return project.id();
    }

    public String ownerId() {
        return project.ownerId();
    }
}
