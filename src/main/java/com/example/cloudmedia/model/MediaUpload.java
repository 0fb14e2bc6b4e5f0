package com.example.cloudmedia.model;

public record MediaUpload(
    String ownerId,
    String filename,
    String contentType,
    long size,
    ContentSource content,
    String description,
    String tagsJson
) {
}
