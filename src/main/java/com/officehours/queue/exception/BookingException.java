package com.officehours.queue.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A violated business rule or a failed store call, carrying a message fit for end users
 * and the ids/counts that explain it.
 */
@Getter
public class BookingException extends RuntimeException {

    private final BookingError error;
    private final Map<String, Object> details = new LinkedHashMap<>();

    public BookingException(BookingError error, String message) {
        super(message);
        this.error = error;
    }

    public BookingException(BookingError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public BookingException with(String key, Object value) {
        details.put(key, value);
        return this;
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }

    public static BookingException badRequest(String message) {
        return new BookingException(BookingError.BAD_REQUEST, message);
    }

    public static BookingException forbidden(String message) {
        return new BookingException(BookingError.FORBIDDEN, message);
    }

    public static BookingException notFound(String message) {
        return new BookingException(BookingError.NOT_FOUND, message);
    }

    public static BookingException conflict(String message) {
        return new BookingException(BookingError.CONFLICT, message);
    }

    public static BookingException internal(String message, Throwable cause) {
        return new BookingException(BookingError.INTERNAL, message, cause);
    }
}
