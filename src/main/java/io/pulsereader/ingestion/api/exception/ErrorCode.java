package io.pulsereader.ingestion.api.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    CONFIGURATION_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    AUTHENTICATION_REQUIRED(HttpStatus.UNAUTHORIZED),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    RUN_IN_PROGRESS(HttpStatus.CONFLICT),
    STORAGE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
