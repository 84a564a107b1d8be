package io.pulsereader.ingestion.api.service;

public record EnrichmentOutcome(
        int attempted,
        int succeeded,
        int failed
) {
    public static EnrichmentOutcome skipped() {
        return new EnrichmentOutcome(0, 0, 0);
    }
}
