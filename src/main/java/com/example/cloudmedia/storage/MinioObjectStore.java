package com.example.cloudmedia.storage;

import com.example.cloudmedia.config.StorageProperties;
import com.example.cloudmedia.exception.BackendUnavailableException;
import com.example.cloudmedia.exception.NotFoundException;
import io.minio.GetObjectArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.StatObjectArgs;
import io.minio.StatObjectResponse;
import io.minio.errors.ErrorResponseException;
import io.minio.errors.MinioException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class MinioObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(MinioObjectStore.class);

    private final MinioClient client;
    private final StorageProperties props;
    private final ObjectNameGenerator objectNames;
    private final UrlSigner urlSigner;

    @Override
    public StoredObject upload(InputStream content, long size, String ownerId, String originalFilename, String contentType) {
        String storedName = objectNames.generate(ownerId, originalFilename);
        try {
            client.putObject(PutObjectArgs.builder()
                .bucket(props.getBucket())
                .object(storedName)
                .stream(content, size, -1)
                .contentType(contentType)
                .userMetadata(Map.of(
                    "original-name", URLEncoder.encode(originalFilename, StandardCharsets.UTF_8)
                ))
                .build());
        } catch (MinioException | IOException | GeneralSecurityException ex) {
            log.error("Failed to upload object {}", storedName, ex);
            throw new BackendUnavailableException("Object store failed to upload " + storedName, ex);
        }
        log.info("Stored object {} ({} bytes)", storedName, size);
        return new StoredObject(storedName, signUrl(storedName));
    }

    @Override
    public boolean delete(String storedName) {
        try {
            client.removeObject(RemoveObjectArgs.builder()
                .bucket(props.getBucket())
                .object(storedName)
                .build());
            log.info("Deleted object {}", storedName);
            return true;
        } catch (MinioException | IOException | GeneralSecurityException ex) {
            log.warn("Failed to delete object {}: {}", storedName, ex.getMessage());
            return false;
        }
    }

    @Override
    public StoredContent open(String storedName) {
        try {
            StatObjectResponse stat = client.statObject(StatObjectArgs.builder()
                .bucket(props.getBucket())
                .object(storedName)
                .build());
            InputStream stream = client.getObject(GetObjectArgs.builder()
                .bucket(props.getBucket())
                .object(storedName)
                .build());
            return new StoredContent(stream, stat.contentType(), stat.size());
        } catch (ErrorResponseException ex) {
            if ("NoSuchKey".equals(ex.errorResponse().code())) {
                throw new NotFoundException("File not found");
            }
            log.error("Failed to open object {}", storedName, ex);
            throw new BackendUnavailableException("Object store failed to open " + storedName, ex);
        } catch (MinioException | IOException | GeneralSecurityException ex) {
            log.error("Failed to open object {}", storedName, ex);
            throw new BackendUnavailableException("Object store failed to open " + storedName, ex);
        }
    }

    @Override
    public String signUrl(String storedName) {
        return signUrl(storedName, props.getUrlTtl());
    }

    @Override
    public String signUrl(String storedName, Duration ttl) {
        return urlSigner.sign(storedName, ttl);
    }
}
