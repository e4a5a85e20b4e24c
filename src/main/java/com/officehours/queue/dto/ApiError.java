package com.officehours.queue.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ApiError(String message, Map<String, Object> details) {

    public static ApiError of(String message) {
        return new ApiError(message, Map.of());
    }
}
