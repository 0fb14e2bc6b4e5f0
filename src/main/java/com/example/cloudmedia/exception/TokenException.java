package com.example.cloudmedia.exception;

import org.springframework.http.HttpStatus;

public class TokenException extends ApiException {

    public enum Reason {
        EXPIRED("TOKEN_EXPIRED"),
        INVALID("TOKEN_INVALID");

        private final String code;

        Reason(String code) {
            this.code = code;
        }
    }

    private final Reason reason;

    public TokenException(Reason reason, String message) {
        super(HttpStatus.UNAUTHORIZED, reason.code, message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
