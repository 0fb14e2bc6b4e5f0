package com.example.cloudmedia.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
    }

    protected ValidationException(String code, String message) {
        super(HttpStatus.BAD_REQUEST, code, message);
    }
}
