package io.crimeradar.pipeline.api.exception;

public enum ErrorCategory {
    TIMEOUT,              // Connection/read timeout
    CONNECTION_REFUSED,   // Connection refused
    DNS_ERROR,            // Unknown host
    NETWORK_ERROR,        // Other network issues
    IO_ERROR,             // I/O problems
    INVALID_URL,          // Malformed URL
    NOT_FOUND,            // 404 error
    ACCESS_FORBIDDEN,     // 403 error
    AUTH_REQUIRED,        // 401 error
    SERVER_ERROR,         // 5xx errors
    SERVER_UNAVAILABLE,   // Temporary server issues
    HTTP_ERROR,           // Other HTTP errors
    PARSE_ERROR,          // Feed or page parsing issues
    EMPTY_CONTENT,        // Page had no readable text
    RATE_LIMITED,         // 429 Too Many Requests
    UNKNOWN;              // Unexpected errors

    public static ErrorCategory fromStatus(int responseCode) {
        return switch (responseCode) {
            case 404 -> NOT_FOUND;
            case 403 -> ACCESS_FORBIDDEN;
            case 401 -> AUTH_REQUIRED;
            case 429 -> RATE_LIMITED;
            case 500 -> SERVER_ERROR;
            case 502, 503, 504 -> SERVER_UNAVAILABLE;
            default -> HTTP_ERROR;
        };
    }
}
