package io.pulsereader.ingestion.api.exception;

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
    SERVER_UNAVAILABLE,   // 502/503/504
    HTTP_ERROR,           // Other HTTP errors
    PARSE_ERROR,          // XML/RSS/Atom parsing issues
    RATE_LIMITED,         // 429 Too Many Requests
    UNKNOWN;              // Unexpected errors

    /**
     * Whether a failure of this category happened before any request reached
     * the feed server.
     */
    public boolean isPreRequest() {
        return this == INVALID_URL || this == DNS_ERROR || this == CONNECTION_REFUSED;
    }
}
