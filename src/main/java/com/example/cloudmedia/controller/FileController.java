package com.example.cloudmedia.controller;

import com.example.cloudmedia.exception.ForbiddenException;
import com.example.cloudmedia.storage.ObjectStore;
import com.example.cloudmedia.storage.StoredContent;
import com.example.cloudmedia.storage.UrlSigner;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.InputStreamResource;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

@RestController
@RequestMapping("/api/files")
@RequiredArgsConstructor
public class FileController {

    private final ObjectStore objectStore;
    private final UrlSigner urlSigner;

    @GetMapping("/{ownerId}/{fileName}")
    public ResponseEntity<InputStreamResource> download(
        @PathVariable String ownerId,
        @PathVariable String fileName,
        @RequestParam long expires,
        @RequestParam String signature
    ) {
        String storedName = ownerId + "/" + fileName;
        if (!urlSigner.verify(storedName, expires, signature)) {
            throw new ForbiddenException("Invalid or expired file signature");
        }
        return buildStreamResponse(objectStore.open(storedName));
    }

    private ResponseEntity<InputStreamResource> buildStreamResponse(StoredContent content) {
        MediaType mediaType = MediaType.APPLICATION_OCTET_STREAM;
        if (content.contentType() != null) {
            try {
                mediaType = MediaType.parseMediaType(content.contentType());
            } catch (InvalidMediaTypeException ex) {
                mediaType = MediaType.APPLICATION_OCTET_STREAM;
            }
        }
        return ResponseEntity.ok()
            .header(HttpHeaders.CACHE_CONTROL, CacheControl.maxAge(Duration.ofHours(1)).cachePrivate().getHeaderValue())
            .contentType(mediaType)
            .contentLength(content.size())
            .body(new InputStreamResource(content.stream()));
    }
}
