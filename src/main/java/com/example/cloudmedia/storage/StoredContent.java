package com.example.cloudmedia.storage;

import java.io.InputStream;

public record StoredContent(InputStream stream, String contentType, long size) {
}
