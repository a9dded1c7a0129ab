package com.policyparser.discovery.api;

import java.time.Instant;

public record ApiError(int status, String error, String message, Instant timestamp) {
    public static ApiError of(int status, String error, String message) {
        return new ApiError(status, error, message, Instant.now());
    }
}
