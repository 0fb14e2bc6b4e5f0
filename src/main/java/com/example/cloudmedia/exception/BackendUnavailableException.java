package com.example.cloudmedia.exception;

import org.springframework.http.HttpStatus;

public class BackendUnavailableException extends ApiException {

    public BackendUnavailableException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "BACKEND_UNAVAILABLE", message, cause);
    }
}
