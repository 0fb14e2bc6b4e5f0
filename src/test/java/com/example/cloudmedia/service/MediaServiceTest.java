package com.example.cloudmedia.service;

import com.example.cloudmedia.config.MediaProperties;
import com.example.cloudmedia.config.StorageProperties;
import com.example.cloudmedia.exception.ForbiddenException;
import com.example.cloudmedia.exception.NotFoundException;
import com.example.cloudmedia.exception.PayloadTooLargeException;
import com.example.cloudmedia.exception.UnsupportedMediaTypeException;
import com.example.cloudmedia.exception.ValidationException;
import com.example.cloudmedia.model.MediaCategory;
import com.example.cloudmedia.model.MediaItem;
import com.example.cloudmedia.model.MediaPage;
import com.example.cloudmedia.model.MediaUpload;
import com.example.cloudmedia.testsupport.InMemoryMetadataStore;
import com.example.cloudmedia.testsupport.InMemoryObjectStore;
import com.example.cloudmedia.testsupport.MutableClock;
import com.example.cloudmedia.testsupport.TestImages;
import com.example.cloudmedia.util.MediaValidator;
import com.example.cloudmedia.util.ThumbnailGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MediaServiceTest {

    private static final String OWNER = "user-a";
    private static final String OTHER = "user-b";

    private InMemoryMetadataStore metadataStore;
    private InMemoryObjectStore objectStore;
    private MutableClock clock;
    private MediaService mediaService;

    @BeforeEach
    void setUp() {
        metadataStore = new InMemoryMetadataStore();
        objectStore = new InMemoryObjectStore();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        MediaValidator validator = new MediaValidator(new MediaProperties(), new ObjectMapper());
        ThumbnailGenerator thumbnails = new ThumbnailGenerator(new StorageProperties());
        mediaService = new MediaService(metadataStore, objectStore, validator, thumbnails, clock);
    }

    @Test
    void should_ClassifyUploadsByContentType() {
        MediaItem image = mediaService.upload(upload("a.png", "image/png", TestImages.jpeg(20, 20)));
        MediaItem video = mediaService.upload(upload("b.mp4", "video/mp4", bytes("not really a video")));

        assertThat(image.getMediaType()).isEqualTo(MediaCategory.IMAGE);
        assertThat(video.getMediaType()).isEqualTo(MediaCategory.VIDEO);
        assertThat(video.getThumbnailUrl()).isNull();
        assertThat(image.getUserId()).isEqualTo(OWNER);
        assertThat(image.getUploadedAt()).isEqualTo(image.getUpdatedAt());
    }

    @Test
    void should_RejectUnsupportedType_When_NothingIsStored() {
        assertThatThrownBy(() -> mediaService.upload(upload("notes.txt", "text/plain", bytes("hello"))))
            .isInstanceOf(UnsupportedMediaTypeException.class)
            .hasMessageContaining("text/plain")
            .extracting("code").isEqualTo("UNSUPPORTED_MEDIA_TYPE");

        assertThat(objectStore.objectCount()).isZero();
        assertThat(metadataStore.mediaCount()).isZero();
    }

    @Test
    void should_RejectOversizedUpload_When_SizeExceedsLimit() {
        long twoHundredMb = 200L * 1024 * 1024;
        MediaUpload huge = new MediaUpload(OWNER, "big.mp4", "video/mp4", twoHundredMb,
            () -> {
                throw new IOException("content must not be read");
            }, null, null);

        assertThatThrownBy(() -> mediaService.upload(huge))
            .isInstanceOf(PayloadTooLargeException.class)
            .hasMessageContaining("100 MB");

        assertThat(objectStore.objectCount()).isZero();
        assertThat(metadataStore.mediaCount()).isZero();
    }

    @Test
    void should_RejectMalformedTags_When_TagsAreNotAJsonArray() {
        MediaUpload badTags = new MediaUpload(OWNER, "a.jpg", "image/jpeg", 3,
            () -> new ByteArrayInputStream(new byte[3]), null, "{\"tag\": 1}");

        assertThatThrownBy(() -> mediaService.upload(badTags))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("JSON array");
        assertThat(objectStore.objectCount()).isZero();
    }

    @Test
    void should_StoreJpegThumbnail_When_ImageIsDecodable() throws IOException {
        MediaItem item = mediaService.upload(upload("holiday.jpg", "image/jpeg", TestImages.jpeg(1200, 600)));

        assertThat(item.getThumbnailUrl()).isNotNull();
        assertThat(objectStore.objectCount()).isEqualTo(2);
        String thumbnailName = objectStore.contentTypes().keySet().stream()
            .filter(name -> name.contains("thumb_holiday.jpg"))
            .findFirst()
            .orElseThrow();
        assertThat(objectStore.contentTypes()).containsEntry(thumbnailName, "image/jpeg");

        BufferedImage thumbnail = TestImages.decode(objectStore.open(thumbnailName).stream().readAllBytes());
        assertThat(thumbnail.getWidth()).isEqualTo(300);
        assertThat(thumbnail.getHeight()).isEqualTo(150);
    }

    @Test
    void should_KeepUpload_When_ImageCannotBeDecoded() {
        MediaItem item = mediaService.upload(upload("broken.jpg", "image/jpeg", bytes("definitely not a jpeg")));

        assertThat(item.getThumbnailUrl()).isNull();
        assertThat(item.getBlobUrl()).isNotNull();
        assertThat(metadataStore.mediaCount()).isEqualTo(1);
    }

    @Test
    void should_KeepUpload_When_ThumbnailStorageFails() {
        objectStore.failUploadsWhen("image/jpeg"::equals);

        MediaItem item = mediaService.upload(upload("icon.png", "image/png", TestImages.transparentPng(40, 40)));

        assertThat(item.getThumbnailUrl()).isNull();
        assertThat(objectStore.objectCount()).isEqualTo(1);
    }

    @Test
    void should_ParseAndNormalizeTags_When_Uploading() {
        MediaUpload tagged = new MediaUpload(OWNER, "a.mp4", "video/mp4", 3,
            () -> new ByteArrayInputStream(new byte[3]), "trip", "[\" beach \", \"beach\", \"\", \"sun\"]");

        MediaItem item = mediaService.upload(tagged);

        assertThat(item.getTags()).containsExactly("beach", "sun");
        assertThat(item.getDescription()).isEqualTo("trip");
    }

    @Test
    void should_Forbid_When_CallerDoesNotOwnMedia() {
        MediaItem item = mediaService.upload(upload("a.mp4", "video/mp4", bytes("x")));

        assertThatThrownBy(() -> mediaService.get(OTHER, item.getId())).isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> mediaService.update(OTHER, item.getId(), "mine now", null))
            .isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> mediaService.delete(OTHER, item.getId())).isInstanceOf(ForbiddenException.class);

        assertThat(mediaService.get(OWNER, item.getId()).getDescription()).isNull();
        assertThat(objectStore.deletedNames()).isEmpty();
    }

    @Test
    void should_ReturnNotFound_When_MediaIsMissing() {
        assertThatThrownBy(() -> mediaService.get(OWNER, "missing")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void should_CoverEveryRecordOnce_When_PagingThroughList() {
        List<String> uploaded = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            uploaded.add(mediaService.upload(upload("clip" + i + ".mp4", "video/mp4", bytes("v" + i))).getId());
            clock.advance(Duration.ofSeconds(1));
        }
        mediaService.upload(new MediaUpload(OTHER, "foreign.mp4", "video/mp4", 1,
            () -> new ByteArrayInputStream(new byte[1]), null, null));

        List<MediaItem> seen = new ArrayList<>();
        for (int page = 1; page <= 3; page++) {
            MediaPage result = mediaService.list(OWNER, page, 2, null);
            assertThat(result.getTotal()).isEqualTo(5);
            assertThat(result.getPage()).isEqualTo(page);
            assertThat(result.getPageSize()).isEqualTo(2);
            seen.addAll(result.getItems());
        }

        assertThat(seen).extracting(MediaItem::getId)
            .doesNotHaveDuplicates()
            .containsExactlyElementsOf(reversed(uploaded));
        assertThat(seen).extracting(MediaItem::getUploadedAt).isSortedAccordingTo((a, b) -> b.compareTo(a));
        assertThat(mediaService.list(OWNER, 4, 2, null).getItems()).isEmpty();
    }

    @Test
    void should_FilterByMediaType_When_Listing() {
        mediaService.upload(upload("a.jpg", "image/jpeg", TestImages.jpeg(10, 10)));
        mediaService.upload(upload("b.mp4", "video/mp4", bytes("v")));

        MediaPage videos = mediaService.list(OWNER, 1, 20, "video");

        assertThat(videos.getTotal()).isEqualTo(1);
        assertThat(videos.getItems()).extracting(MediaItem::getMediaType).containsOnly(MediaCategory.VIDEO);
        assertThatThrownBy(() -> mediaService.list(OWNER, 1, 20, "audio")).isInstanceOf(ValidationException.class);
    }

    @Test
    void should_RejectInvalidPaging() {
        assertThatThrownBy(() -> mediaService.list(OWNER, 0, 20, null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> mediaService.list(OWNER, 1, 0, null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> mediaService.list(OWNER, 1, 101, null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> mediaService.search(OWNER, "x", 1, 101)).isInstanceOf(ValidationException.class);
    }

    @Test
    void should_MatchNameDescriptionAndTags_When_Searching() {
        mediaService.upload(new MediaUpload(OWNER, "Beach-Sunset.mp4", "video/mp4", 1,
            () -> new ByteArrayInputStream(new byte[1]), null, null));
        mediaService.upload(new MediaUpload(OWNER, "b.mp4", "video/mp4", 1,
            () -> new ByteArrayInputStream(new byte[1]), "A day at the BEACH", null));
        mediaService.upload(new MediaUpload(OWNER, "c.mp4", "video/mp4", 1,
            () -> new ByteArrayInputStream(new byte[1]), null, "[\"beach\"]"));
        mediaService.upload(new MediaUpload(OWNER, "d.mp4", "video/mp4", 1,
            () -> new ByteArrayInputStream(new byte[1]), null, "[\"beaches\"]"));
        mediaService.upload(new MediaUpload(OTHER, "beach.mp4", "video/mp4", 1,
            () -> new ByteArrayInputStream(new byte[1]), null, null));

        MediaPage result = mediaService.search(OWNER, "  beach ", 1, 20);

        assertThat(result.getTotal()).isEqualTo(3);
        assertThat(result.getItems()).extracting(MediaItem::getOriginalFileName)
            .containsExactlyInAnyOrder("Beach-Sunset.mp4", "b.mp4", "c.mp4");
        assertThatThrownBy(() -> mediaService.search(OWNER, "   ", 1, 20)).isInstanceOf(ValidationException.class);
    }

    @Test
    void should_LeaveOtherFieldsAlone_When_UpdatingPartially() {
        MediaItem item = mediaService.upload(new MediaUpload(OWNER, "a.mp4", "video/mp4", 1,
            () -> new ByteArrayInputStream(new byte[1]), "first", "[\"one\"]"));

        MediaItem tagsOnly = mediaService.update(OWNER, item.getId(), null, List.of("two", " two ", "three"));
        assertThat(tagsOnly.getDescription()).isEqualTo("first");
        assertThat(tagsOnly.getTags()).containsExactly("two", "three");

        MediaItem descriptionOnly = mediaService.update(OWNER, item.getId(), "second", null);
        assertThat(descriptionOnly.getDescription()).isEqualTo("second");
        assertThat(descriptionOnly.getTags()).containsExactly("two", "three");
    }

    @Test
    void should_AdvanceUpdatedAt_When_ClockDoesNotMove() {
        MediaItem item = mediaService.upload(upload("a.mp4", "video/mp4", bytes("x")));

        MediaItem first = mediaService.update(OWNER, item.getId(), "one", null);
        MediaItem second = mediaService.update(OWNER, item.getId(), "two", null);

        assertThat(first.getUpdatedAt()).isAfter(item.getUpdatedAt());
        assertThat(second.getUpdatedAt()).isAfter(first.getUpdatedAt());
        assertThat(second.getUploadedAt()).isEqualTo(item.getUploadedAt());
    }

    @Test
    void should_RejectLongDescription_When_Updating() {
        MediaItem item = mediaService.upload(upload("a.mp4", "video/mp4", bytes("x")));

        assertThatThrownBy(() -> mediaService.update(OWNER, item.getId(), "x".repeat(501), null))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void should_RemoveObjectsAndRecord_When_Deleting() {
        MediaItem item = mediaService.upload(upload("photo.jpg", "image/jpeg", TestImages.jpeg(50, 50)));

        mediaService.delete(OWNER, item.getId());

        assertThat(objectStore.deletedNames()).hasSize(2).contains(item.getFileName());
        assertThat(objectStore.objectCount()).isZero();
        assertThatThrownBy(() -> mediaService.get(OWNER, item.getId())).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> mediaService.delete(OWNER, item.getId())).isInstanceOf(NotFoundException.class);
    }

    private MediaUpload upload(String filename, String contentType, byte[] data) {
        return new MediaUpload(OWNER, filename, contentType, data.length, () -> new ByteArrayInputStream(data),
            null, null);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static List<String> reversed(List<String> ids) {
        List<String> copy = new ArrayList<>(ids);
        Collections.reverse(copy);
        return copy;
    }
}
