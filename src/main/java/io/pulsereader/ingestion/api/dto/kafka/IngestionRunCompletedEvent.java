package io.pulsereader.ingestion.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.pulsereader.ingestion.api.dto.RunSummary;

import java.time.Instant;

public record IngestionRunCompletedEvent(
        @JsonProperty("runId") String runId,
        @JsonProperty("sourcesProcessed") int sourcesProcessed,
        @JsonProperty("sourcesFailed") int sourcesFailed,
        @JsonProperty("articlesCreated") int articlesCreated,
        @JsonProperty("duplicatesSkipped") int duplicatesSkipped,
        @JsonProperty("articlesEnriched") int articlesEnriched,
        @JsonProperty("hasMoreWork") boolean hasMoreWork,
        @JsonProperty("stoppedEarly") boolean stoppedEarly,
        @JsonProperty("operationsUsed") int operationsUsed,
        @JsonProperty("startedAt") @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant startedAt,
        @JsonProperty("completedAt") @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant completedAt
) {
    public static IngestionRunCompletedEvent from(RunSummary summary, Instant completedAt) {
        return new IngestionRunCompletedEvent(
                summary.runId(),
                summary.processed(),
                summary.failed(),
                summary.articlesCreated(),
                summary.duplicatesSkipped(),
                summary.aiAnalysis().successful(),
                summary.hasMoreWork(),
                summary.stoppedEarly(),
                summary.operationsUsed(),
                summary.startedAt(),
                completedAt
        );
    }
}
