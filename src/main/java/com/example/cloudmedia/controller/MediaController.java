package com.example.cloudmedia.controller;

import com.example.cloudmedia.model.MediaItem;
import com.example.cloudmedia.model.MediaPage;
import com.example.cloudmedia.model.MediaUpload;
import com.example.cloudmedia.service.MediaService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

import static com.example.cloudmedia.security.BearerTokenInterceptor.CALLER_ATTRIBUTE;

@RestController
@RequestMapping("/api/media")
@RequiredArgsConstructor
@Validated
public class MediaController {

    private final MediaService mediaService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<MediaItem> upload(
        @RequestAttribute(CALLER_ATTRIBUTE) String callerId,
        @RequestParam("file") MultipartFile file,
        @RequestParam(value = "description", required = false) String description,
        @RequestParam(value = "tags", required = false) String tags
    ) {
        MediaUpload upload = new MediaUpload(
            callerId,
            file.getOriginalFilename(),
            file.getContentType(),
            file.getSize(),
            file::getInputStream,
            description,
            tags
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(mediaService.upload(upload));
    }

    @GetMapping
    public MediaPage list(
        @RequestAttribute(CALLER_ATTRIBUTE) String callerId,
        @RequestParam(defaultValue = "1") int page,
        @RequestParam(defaultValue = "20") int pageSize,
        @RequestParam(required = false) String mediaType
    ) {
        return mediaService.list(callerId, page, pageSize, mediaType);
    }

    @GetMapping("/search")
    public MediaPage search(
        @RequestAttribute(CALLER_ATTRIBUTE) String callerId,
        @RequestParam String query,
        @RequestParam(defaultValue = "1") int page,
        @RequestParam(defaultValue = "20") int pageSize
    ) {
        return mediaService.search(callerId, query, page, pageSize);
    }

    @GetMapping("/{id}")
    public MediaItem get(
        @RequestAttribute(CALLER_ATTRIBUTE) String callerId,
        @PathVariable String id
    ) {
        return mediaService.get(callerId, id);
    }

    @PutMapping("/{id}")
    public MediaItem update(
        @RequestAttribute(CALLER_ATTRIBUTE) String callerId,
        @PathVariable String id,
        @Valid @RequestBody UpdateMediaRequest request
    ) {
        return mediaService.update(callerId, id, request.description(), request.tags());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(
        @RequestAttribute(CALLER_ATTRIBUTE) String callerId,
        @PathVariable String id
    ) {
        mediaService.delete(callerId, id);
        return ResponseEntity.noContent().build();
    }

    public record UpdateMediaRequest(@Size(max = 500) String description, List<String> tags) {
    }
}
