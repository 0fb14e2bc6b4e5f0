package com.example.cloudmedia.util;

import com.example.cloudmedia.config.MediaProperties;
import com.example.cloudmedia.exception.PayloadTooLargeException;
import com.example.cloudmedia.exception.UnsupportedMediaTypeException;
import com.example.cloudmedia.exception.ValidationException;
import com.example.cloudmedia.model.MediaCategory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class MediaValidator {

    public static final int MAX_DESCRIPTION_LENGTH = 500;

    private final MediaProperties props;
    private final ObjectMapper objectMapper;

    public MediaCategory classify(String contentType) {
        String normalized = normalizeContentType(contentType);
        if (props.getAllowedImageTypes().contains(normalized)) {
            return MediaCategory.IMAGE;
        }
        if (props.getAllowedVideoTypes().contains(normalized)) {
            return MediaCategory.VIDEO;
        }
        throw new UnsupportedMediaTypeException("File type '" + contentType + "' is not allowed. Allowed types: "
            + String.join(",", props.getAllowedImageTypes()) + ", "
            + String.join(",", props.getAllowedVideoTypes()));
    }

    public void checkSize(long sizeBytes) {
        long max = props.getMaxFileSizeBytes();
        if (sizeBytes > max) {
            throw new PayloadTooLargeException("File size (" + FileSizeFormatter.format(sizeBytes)
                + ") exceeds maximum allowed size (" + props.getMaxFileSizeMb() + " MB)");
        }
    }

    public List<String> parseTags(String tagsJson) {
        if (!StringUtils.hasText(tagsJson)) {
            return null;
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(tagsJson);
        } catch (JsonProcessingException ex) {
            throw new ValidationException("Invalid tags format. Must be a JSON array.");
        }
        if (node == null || !node.isArray()) {
            throw new ValidationException("Invalid tags format. Must be a JSON array.");
        }
        List<String> tags = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new ValidationException("Invalid tags format. Tags must be strings.");
            }
            tags.add(element.asText());
        }
        return normalizeTags(tags);
    }

    public List<String> normalizeTags(List<String> tags) {
        if (tags == null) {
            return null;
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String tag : tags) {
            if (StringUtils.hasText(tag)) {
                unique.add(tag.trim());
            }
        }
        return new ArrayList<>(unique);
    }

    public String checkDescription(String description) {
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("Description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return description;
    }

    private String normalizeContentType(String contentType) {
        if (contentType == null) {
            return "";
        }
        int parameters = contentType.indexOf(';');
        String base = parameters >= 0 ? contentType.substring(0, parameters) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
