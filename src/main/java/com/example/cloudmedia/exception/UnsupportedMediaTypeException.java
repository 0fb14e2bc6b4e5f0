package com.example.cloudmedia.exception;

public class UnsupportedMediaTypeException extends ValidationException {

    public UnsupportedMediaTypeException(String message) {
        super("UNSUPPORTED_MEDIA_TYPE", message);
    }
}
