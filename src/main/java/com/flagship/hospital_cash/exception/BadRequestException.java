package com.flagship.hospital_cash.exception;

/**
 * A request the client must fix before resubmitting. Mapped to HTTP 400.
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }
}
