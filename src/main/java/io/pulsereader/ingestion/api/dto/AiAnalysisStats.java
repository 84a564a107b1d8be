package io.pulsereader.ingestion.api.dto;

public record AiAnalysisStats(
        int attempted,
        int successful,
        int failed
) {
    public static AiAnalysisStats none() {
        return new AiAnalysisStats(0, 0, 0);
    }
}
