package com.collab.sync.jetstream.admin;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Stable error body of the admin API.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ApiError(String code, String message, List<String> fields) {

    public ApiError(String code, String message) {
        this(code, message, List.of());
    }
}
