package com.flagship.hospital_cash.exception;

/**
 * The caller has no valid session or supplied bad credentials. Mapped to HTTP 401.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
