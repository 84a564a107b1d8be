package io.pulsereader.ingestion.api.service;

import io.pulsereader.ingestion.api.exception.ErrorCategory;
import io.pulsereader.ingestion.domain.FeedItem;

import java.util.List;

/**
 * Result of fetching one feed. {@code requestIssued} tells the caller whether
 * the fetch reached the network and has to be charged to the budget.
 */
public record FeedFetchResult(
        boolean success,
        List<FeedItem> items,
        String error,
        ErrorCategory category,
        boolean requestIssued
) {
    public static FeedFetchResult success(List<FeedItem> items) {
        return new FeedFetchResult(true, List.copyOf(items), null, null, true);
    }

    public static FeedFetchResult failure(String error, ErrorCategory category, boolean requestIssued) {
        return new FeedFetchResult(false, List.of(), error, category, requestIssued);
    }
}
