package io.pulsereader.ingestion.api.service;

import io.pulsereader.ingestion.domain.Article;

import java.util.List;

/**
 * What happened to the items of one feed: rows created, links that already
 * existed, items left out because the budget ran out, and items whose insert failed.
 */
public record PersistenceOutcome(
        List<Article> created,
        int duplicatesSkipped,
        int skippedForBudget,
        int failedItems
) {
    public PersistenceOutcome {
        created = List.copyOf(created);
    }

    public static PersistenceOutcome empty() {
        return new PersistenceOutcome(List.of(), 0, 0, 0);
    }

    /**
     * @return whether the store rejected every item it was given
     */
    public boolean nothingStored() {
        return failedItems > 0 && created.isEmpty() && duplicatesSkipped == 0;
    }
}
