package com.example.cloudmedia.storage;

public record StoredObject(String storedName, String url) {
}
