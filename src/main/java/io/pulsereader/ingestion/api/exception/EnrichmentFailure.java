package io.pulsereader.ingestion.api.exception;

public enum EnrichmentFailure {
    MISSING_CREDENTIAL,
    PROVIDER_UNREACHABLE,
    PROVIDER_ERROR,
    TIMEOUT,
    RATE_LIMITED,
    INSUFFICIENT_CREDITS,
    MALFORMED_RESPONSE;

    public boolean isPreRequest() {
        return this == MISSING_CREDENTIAL || this == PROVIDER_UNREACHABLE;
    }
}
