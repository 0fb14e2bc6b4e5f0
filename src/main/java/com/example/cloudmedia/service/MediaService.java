package com.example.cloudmedia.service;

import com.example.cloudmedia.exception.BackendUnavailableException;
import com.example.cloudmedia.exception.ForbiddenException;
import com.example.cloudmedia.exception.NotFoundException;
import com.example.cloudmedia.exception.ValidationException;
import com.example.cloudmedia.model.MediaCategory;
import com.example.cloudmedia.model.MediaItem;
import com.example.cloudmedia.model.MediaPage;
import com.example.cloudmedia.model.MediaUpload;
import com.example.cloudmedia.persistence.MediaPatch;
import com.example.cloudmedia.persistence.MetadataStore;
import com.example.cloudmedia.persistence.PageSlice;
import com.example.cloudmedia.persistence.document.MediaDocument;
import com.example.cloudmedia.storage.ObjectStore;
import com.example.cloudmedia.storage.StoredObject;
import com.example.cloudmedia.util.MediaValidator;
import com.example.cloudmedia.util.ThumbnailGenerator;
import lombok.RequiredArgsConstructor;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class MediaService {

    private static final Logger log = LoggerFactory.getLogger(MediaService.class);
    private static final int MAX_PAGE_SIZE = 100;
    private static final String THUMBNAIL_PREFIX = "thumb_";
    private static final String THUMBNAIL_CONTENT_TYPE = "image/jpeg";

    private final MetadataStore metadataStore;
    private final ObjectStore objectStore;
    private final MediaValidator validator;
    private final ThumbnailGenerator thumbnailGenerator;
    private final Clock clock;

    public MediaItem upload(MediaUpload upload) {
        if (!StringUtils.hasText(upload.filename())) {
            throw new ValidationException("File name is required");
        }
        MediaCategory category = validator.classify(upload.contentType());
        validator.checkSize(upload.size());
        List<String> tags = validator.parseTags(upload.tagsJson());
        String description = validator.checkDescription(upload.description());

        StoredObject original;
        try (InputStream in = upload.content().open()) {
            original = objectStore.upload(in, upload.size(), upload.ownerId(), upload.filename(), upload.contentType());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read upload content", ex);
        }

        StoredObject thumbnail = null;
        if (category == MediaCategory.IMAGE) {
            thumbnail = storeThumbnail(upload, original.storedName()).orElse(null);
        }

        Instant now = now();
        MediaDocument document = MediaDocument.builder()
            .id(UUID.randomUUID().toString())
            .ownerId(upload.ownerId())
            .storedName(original.storedName())
            .originalName(upload.filename())
            .mediaType(category)
            .sizeBytes(upload.size())
            .mimeType(upload.contentType())
            .objectUrl(original.url())
            .thumbnailStoredName(thumbnail != null ? thumbnail.storedName() : null)
            .thumbnailUrl(thumbnail != null ? thumbnail.url() : null)
            .description(description)
            .tags(tags)
            .uploadedAt(now)
            .updatedAt(now)
            .build();

        MediaDocument saved = metadataStore.createMedia(document)
            .createdValue()
            .orElseThrow(() -> new IllegalStateException("Media record " + document.getId() + " already exists"));
        log.info("Stored {} {} for user {}", category.wireName(), saved.getId(), saved.getOwnerId());
        return toMediaItem(saved);
    }

    public MediaItem get(String callerId, String mediaId) {
        return toMediaItem(requireOwnedMedia(callerId, mediaId));
    }

    public MediaItem update(String callerId, String mediaId, String description, List<String> tags) {
        MediaDocument existing = requireOwnedMedia(callerId, mediaId);
        MediaPatch patch = new MediaPatch(
            validator.checkDescription(description),
            validator.normalizeTags(tags),
            nextUpdateTime(existing.getUpdatedAt()));

        MediaDocument updated = metadataStore.updateMedia(mediaId, callerId, patch)
            .orElseThrow(() -> new NotFoundException("Media not found"));
        return toMediaItem(updated);
    }

    public void delete(String callerId, String mediaId) {
        MediaDocument existing = requireOwnedMedia(callerId, mediaId);

        objectStore.delete(existing.getStoredName());
        if (existing.getThumbnailStoredName() != null) {
            objectStore.delete(existing.getThumbnailStoredName());
        }

        if (metadataStore.deleteMedia(mediaId, callerId)) {
            log.info("Deleted media {} for user {}", mediaId, callerId);
        } else {
            log.info("Media {} was already removed", mediaId);
        }
    }

    public MediaPage list(String callerId, int page, int pageSize, String mediaType) {
        validatePaging(page, pageSize);
        MediaCategory filter = null;
        if (StringUtils.hasText(mediaType)) {
            filter = MediaCategory.fromWireName(mediaType)
                .orElseThrow(() -> new ValidationException("mediaType must be 'image' or 'video'"));
        }
        PageSlice<MediaDocument> slice = metadataStore.listMedia(callerId, page, pageSize, filter);
        return toMediaPage(slice, page, pageSize);
    }

    public MediaPage search(String callerId, String query, int page, int pageSize) {
        if (!StringUtils.hasText(query)) {
            throw new ValidationException("Search query must not be empty");
        }
        validatePaging(page, pageSize);
        PageSlice<MediaDocument> slice = metadataStore.searchMedia(callerId, query.trim(), page, pageSize);
        return toMediaPage(slice, page, pageSize);
    }

    private MediaDocument requireOwnedMedia(String callerId, String mediaId) {
        MediaDocument document = metadataStore.findMedia(mediaId, callerId)
            .orElseThrow(() -> new NotFoundException("Media not found"));
        if (!Objects.equals(document.getOwnerId(), callerId)) {
            log.warn("User {} was denied access to media {}", callerId, mediaId);
            throw new ForbiddenException("You don't have permission to access this media");
        }
        return document;
    }

    private Optional<StoredObject> storeThumbnail(MediaUpload upload, String storedName) {
        Optional<byte[]> thumbnail;
        try (InputStream in = upload.content().open()) {
            thumbnail = thumbnailGenerator.generate(storedName, in);
        } catch (IOException ex) {
            log.warn("Failed to read {} for thumbnail: {}", storedName, ex.getMessage());
            return Optional.empty();
        }
        if (thumbnail.isEmpty()) {
            return Optional.empty();
        }

        byte[] data = thumbnail.get();
        try {
            return Optional.of(objectStore.upload(new ByteArrayInputStream(data), data.length,
                upload.ownerId(), thumbnailFilename(upload.filename()), THUMBNAIL_CONTENT_TYPE));
        } catch (BackendUnavailableException ex) {
            log.warn("Failed to store thumbnail for {}: {}", storedName, ex.getMessage());
            return Optional.empty();
        }
    }

    private String thumbnailFilename(String filename) {
        return THUMBNAIL_PREFIX + FilenameUtils.getBaseName(filename) + ".jpg";
    }

    // Mongo keeps millisecond precision, and updatedAt must move forward even when the clock has not.
    private Instant nextUpdateTime(Instant previous) {
        Instant now = now();
        if (previous != null && !now.isAfter(previous)) {
            return previous.plusMillis(1);
        }
        return now;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private void validatePaging(int page, int pageSize) {
        if (page < 1) {
            throw new ValidationException("page must be at least 1");
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new ValidationException("pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }
    }

    private MediaPage toMediaPage(PageSlice<MediaDocument> slice, int page, int pageSize) {
        List<MediaItem> items = slice.items().stream()
            .map(this::toMediaItem)
            .toList();
        return MediaPage.builder()
            .items(items)
            .total(slice.total())
            .page(page)
            .pageSize(pageSize)
            .build();
    }

    private MediaItem toMediaItem(MediaDocument doc) {
        return MediaItem.builder()
            .id(doc.getId())
            .userId(doc.getOwnerId())
            .fileName(doc.getStoredName())
            .originalFileName(doc.getOriginalName())
            .mediaType(doc.getMediaType())
            .fileSize(doc.getSizeBytes())
            .mimeType(doc.getMimeType())
            .blobUrl(doc.getObjectUrl())
            .thumbnailUrl(doc.getThumbnailUrl())
            .description(doc.getDescription())
            .tags(doc.getTags())
            .uploadedAt(doc.getUploadedAt())
            .updatedAt(doc.getUpdatedAt())
            .build();
    }
}
