package com.example.cloudmedia.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class MediaItem {

    String id;
    String userId;
    String fileName;
    String originalFileName;
    MediaCategory mediaType;
    long fileSize;
    String mimeType;
    String blobUrl;
    String thumbnailUrl;
    String description;
    List<String> tags;
    Instant uploadedAt;
    Instant updatedAt;
}
