package com.example.cloudmedia.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum MediaCategory {
    IMAGE,
    VIDEO;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<MediaCategory> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (MediaCategory category : values()) {
            if (category.wireName().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
