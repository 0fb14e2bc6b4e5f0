package com.example.cloudmedia.persistence;

import java.time.Instant;
import java.util.List;

public record MediaPatch(String description, List<String> tags, Instant updatedAt) {

    public boolean hasDescription() {
        return description != null;
    }

    public boolean hasTags() {
        return tags != null;
    }
}
