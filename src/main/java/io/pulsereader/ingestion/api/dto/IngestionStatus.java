package io.pulsereader.ingestion.api.dto;

public record IngestionStatus(
        String service,
        int operationBudget,
        int maxSourcesPerRun,
        int batchSize,
        boolean enrichmentEnabled,
        boolean schedulingEnabled,
        boolean leaseEnabled
) {}
