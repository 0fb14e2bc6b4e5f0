package com.example.cloudmedia.controller;

import com.example.cloudmedia.config.ApiProperties;
import com.example.cloudmedia.exception.ApiException;
import com.example.cloudmedia.exception.BackendUnavailableException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.util.ArrayList;
import java.util.List;

@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final ApiProperties apiProperties;

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApi(ApiException ex) {
        List<String> details = null;
        if (ex instanceof BackendUnavailableException) {
            log.error("Backend failure: {}", ex.getMessage(), ex);
            details = causeDetails(ex);
        } else {
            log.debug("Request rejected with {}: {}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getStatus()).body(ErrorResponse.of(ex.getCode(), ex.getMessage(), details));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAll(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of("INTERNAL_SERVER_ERROR", "An unexpected error occurred", causeDetails(ex)));
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
        MethodArgumentNotValidException ex, HttpHeaders headers, HttpStatusCode status, WebRequest request
    ) {
        List<String> fieldErrors = new ArrayList<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.add(fe.getField() + ": " + fe.getDefaultMessage());
        }
        ErrorResponse body = ErrorResponse.of("VALIDATION_ERROR", "Invalid request data", fieldErrors);
        return new ResponseEntity<>(body, headers, HttpStatus.BAD_REQUEST);
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
        Exception ex, Object body, HttpHeaders headers, HttpStatusCode statusCode, WebRequest request
    ) {
        if (body instanceof ErrorResponse) {
            return new ResponseEntity<>(body, headers, statusCode);
        }
        log.debug("Request failed with {}: {}", statusCode.value(), ex.getMessage());
        ErrorResponse envelope = ErrorResponse.of(codeFor(statusCode), ex.getMessage());
        return new ResponseEntity<>(envelope, headers, statusCode);
    }

    static String codeFor(HttpStatusCode statusCode) {
        return switch (statusCode.value()) {
            case 400 -> "VALIDATION_ERROR";
            case 404 -> "NOT_FOUND";
            case 405 -> "METHOD_NOT_ALLOWED";
            case 413 -> "PAYLOAD_TOO_LARGE";
            case 415 -> "UNSUPPORTED_MEDIA_TYPE";
            default -> statusCode.is5xxServerError() ? "INTERNAL_SERVER_ERROR" : "REQUEST_ERROR";
        };
    }

    private List<String> causeDetails(Exception ex) {
        if (!apiProperties.isExposeErrorDetails()) {
            return null;
        }
        Throwable root = ex.getCause() != null ? ex.getCause() : ex;
        return List.of(String.valueOf(root.getMessage()));
    }
}
