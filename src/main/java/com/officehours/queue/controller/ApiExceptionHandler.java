package com.officehours.queue.controller;

import com.officehours.queue.dto.ApiError;
import com.officehours.queue.exception.BookingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(BookingException.class)
    public ResponseEntity<ApiError> handleBooking(BookingException e) {
        // INTERNAL errors were logged with their cause where they were raised
        return ResponseEntity.status(e.getError().status())
                .body(new ApiError(e.getMessage(), e.getDetails()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleBadPathVariable(MethodArgumentTypeMismatchException e) {
        log.warn("Failed to parse {} \"{}\"", e.getName(), e.getValue());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiError.of("Invalid " + e.getName() + " \"" + e.getValue() + "\""));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Failed to decode request body: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(ApiError.of("We couldn't read the request body."));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingIdentity(MissingRequestHeaderException e) {
        log.warn("Request without {} header", e.getHeaderName());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(ApiError.of("We couldn't tell who you are. Please sign in again."));
    }

    @ExceptionHandler(ErrorResponseException.class)
    public ResponseEntity<ApiError> handleFrameworkError(ErrorResponseException e) {
        // Unknown routes (NoResourceFoundException) and ResponseStatusException
        log.warn("Request rejected: {}", e.getMessage());
        return ResponseEntity.status(e.getStatusCode())
                .body(ApiError.of(e.getBody().getTitle()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiError> handleWrongMethod(HttpRequestMethodNotSupportedException e) {
        log.warn("Unsupported method {}", e.getMethod());
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(ApiError.of("That method isn't supported here."));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiError> handleWrongContentType(HttpMediaTypeNotSupportedException e) {
        log.warn("Unsupported content type {}", e.getContentType());
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(ApiError.of("Please send JSON."));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception e) {
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.of("Something went wrong on our end. Please try again."));
    }
}
