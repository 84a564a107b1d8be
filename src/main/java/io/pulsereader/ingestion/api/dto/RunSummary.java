package io.pulsereader.ingestion.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one ingestion run as returned to the trigger. Built fresh for
 * every run and never persisted.
 */
public record RunSummary(
        @JsonProperty("runId") String runId,
        @JsonProperty("processed") int processed,
        @JsonProperty("succeeded") int succeeded,
        @JsonProperty("failed") int failed,
        @JsonProperty("articlesCreated") int articlesCreated,
        @JsonProperty("duplicatesSkipped") int duplicatesSkipped,
        @JsonProperty("errors") List<SourceError> errors,
        @JsonProperty("skippedSources") int skippedSources,
        @JsonProperty("skippedArticles") List<SkippedArticles> skippedArticles,
        @JsonProperty("hasMoreWork") boolean hasMoreWork,
        @JsonProperty("stoppedEarly") boolean stoppedEarly,
        @JsonProperty("aiAnalysis") AiAnalysisStats aiAnalysis,
        @JsonProperty("operationsUsed") int operationsUsed,
        @JsonProperty("operationBudget") int operationBudget,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt
) {
    public RunSummary {
        errors = List.copyOf(errors);
        skippedArticles = List.copyOf(skippedArticles);
    }
}
