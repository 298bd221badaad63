package com.xksgroup.playlistsync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ContentCategory {
    CHANNELS("channels"),
    MOVIES("movies"),
    SERIES("series");

    private final String key;

    ContentCategory(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Resolve a category from its key ("movies") or enum name ("MOVIES").
     */
    @JsonCreator
    public static ContentCategory fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Category is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ContentCategory category : values()) {
            if (category.key.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown category: " + value);
    }
}
