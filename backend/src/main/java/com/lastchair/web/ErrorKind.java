package com.lastchair.web;

import org.springframework.http.HttpStatus;

public enum ErrorKind {
    AUTHORIZATION(HttpStatus.FORBIDDEN),
    STATE_MISMATCH(HttpStatus.CONFLICT),
    DUPLICATE_ACTION(HttpStatus.CONFLICT),
    VALUE_MISMATCH(HttpStatus.UNPROCESSABLE_ENTITY),
    VALIDATION(HttpStatus.BAD_REQUEST),
    CRYPTOGRAPHIC(HttpStatus.UNPROCESSABLE_ENTITY),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    LEDGER_REJECTED(HttpStatus.PAYMENT_REQUIRED);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
