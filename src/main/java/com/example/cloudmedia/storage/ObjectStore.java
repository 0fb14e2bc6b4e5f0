package com.example.cloudmedia.storage;

import java.io.InputStream;
import java.time.Duration;

public interface ObjectStore {

    StoredObject upload(InputStream content, long size, String ownerId, String originalFilename, String contentType);

    boolean delete(String storedName);

    StoredContent open(String storedName);

    String signUrl(String storedName);

    String signUrl(String storedName, Duration ttl);
}
