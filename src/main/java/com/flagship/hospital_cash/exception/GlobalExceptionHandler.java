package com.flagship.hospital_cash.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Translates exceptions thrown by controllers and services into {@link ApiError} responses.
 *
 * Services never write responses themselves; they throw and this class decides
 * the status. Database failures arrive here untouched.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * SQLSTATE raised by {@code SIGNAL} in the posting procedures for business rule violations.
     */
    static final String USER_DEFINED_SQL_STATE = "45000";

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ApiError> handleBadRequest(BadRequestException e) {
        log.warn("Bad request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", e.getMessage(), null);
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ApiError> handleUnauthorized(UnauthorizedException e) {
        log.warn("Unauthorized: {}", e.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, "Unauthorized", e.getMessage(), null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException e) {
        log.debug("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Malformed request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed Request", "Request body could not be read", null);
    }

    @ExceptionHandler(ServletRequestBindingException.class)
    public ResponseEntity<ApiError> handleBindingException(ServletRequestBindingException e) {
        log.warn("Request binding failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for {}: {}", e.getName(), e.getValue());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request",
                "Invalid value for parameter '" + e.getName() + "'", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiError> handleDataAccess(DataAccessException e) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);

        if (cause instanceof SQLException sqlException
                && USER_DEFINED_SQL_STATE.equals(sqlException.getSQLState())) {
            log.warn("Stored procedure rejected the request: {}", sqlException.getMessage());
            return respond(HttpStatus.BAD_REQUEST, "Database Rule Violation", sqlException.getMessage(), null);
        }

        log.error("Database operation failed", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "A database error occurred", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", null);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String error, String message,
                                             Map<String, String> details) {
        ApiError body = ApiError.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
