package com.atelier.project.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Where a wardrobe asset came from. Only project-owned assets are replicated. */
public enum WardrobeSource {
    USER("user"),
    PREDEFINED("predefined"),
    USER_GLOBAL("user-global");

    private final String wireValue;

    WardrobeSource(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static WardrobeSource fromWire(String value) {
        if (value == null) return null;
        for (WardrobeSource source : values()) {
            if (source.wireValue.equals(value)) return source;
        }
        return USER;
    }
}
