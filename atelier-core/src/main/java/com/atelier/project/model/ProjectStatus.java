package com.atelier.project.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ProjectStatus {
    DRAFT("Draft"),
    IN_PROGRESS("In Progress"),
    IN_REVIEW("In Review"),
    ON_HOLD("On Hold"),
    COMPLETED("Completed");

    private final String label;

    ProjectStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ProjectStatus fromLabel(String value) {
        if (value == null) return null;
        for (ProjectStatus status : values()) {
            if (status.label.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        return DRAFT;
    }
}
