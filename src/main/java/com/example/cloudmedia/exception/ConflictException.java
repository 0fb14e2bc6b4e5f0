package com.example.cloudmedia.exception;

import org.springframework.http.HttpStatus;

public class ConflictException extends ApiException {

    public ConflictException(String message) {
        super(HttpStatus.BAD_REQUEST, "ALREADY_EXISTS", message);
    }
}
