package com.example.cloudmedia.persistence.document;

import com.example.cloudmedia.model.MediaCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "media")
@CompoundIndex(name = "owner_uploaded", def = "{'ownerId': 1, 'uploadedAt': -1}")
public class MediaDocument {

    @Id
    private String id;

    private String ownerId;

    @Indexed(unique = true)
    private String storedName;

    private String originalName;
    private MediaCategory mediaType;
    private long sizeBytes;
    private String mimeType;
    private String objectUrl;
    private String thumbnailStoredName;
    private String thumbnailUrl;
    private String description;
    private List<String> tags;
    private Instant uploadedAt;
    private Instant updatedAt;
}
