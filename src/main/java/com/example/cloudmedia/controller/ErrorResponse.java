package com.example.cloudmedia.controller;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

public record ErrorResponse(Error error) {

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(new Error(code, message, null));
    }

    public static ErrorResponse of(String code, String message, List<String> details) {
        return new ErrorResponse(new Error(code, message, details));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Error(String code, String message, List<String> details) {
    }
}
