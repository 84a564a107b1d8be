package io.pulsereader.ingestion.api.exception;

/**
 * Failure that aborts a run before any source is processed. Everything that
 * goes wrong later is recorded in the run summary instead.
 */
public class IngestionException extends RuntimeException {

    private final ErrorCode code;

    public IngestionException(String message, ErrorCode code) {
        super(message);
        this.code = code;
    }

    public IngestionException(String message, Throwable cause, ErrorCode code) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
