package io.pulsereader.ingestion.api.service;

import io.pulsereader.ingestion.domain.Sentiment;

import java.util.List;

public record ArticleAnalysis(
        Sentiment sentiment,
        List<String> topics
) {
    public ArticleAnalysis {
        topics = List.copyOf(topics);
    }
}
