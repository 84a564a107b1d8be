package io.pulsereader.ingestion.api.exception;

public class EnrichmentException extends RuntimeException {

    private final EnrichmentFailure failure;

    public EnrichmentException(String message, EnrichmentFailure failure) {
        super(message);
        this.failure = failure;
    }

    public EnrichmentException(String message, Throwable cause, EnrichmentFailure failure) {
        super(message, cause);
        this.failure = failure;
    }

    public EnrichmentFailure getFailure() {
        return failure;
    }

    public boolean isRequestIssued() {
        return !failure.isPreRequest();
    }
}
