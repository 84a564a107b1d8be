package io.pulsereader.ingestion.api.service;

import io.pulsereader.ingestion.domain.Source;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the sources for one run: least recently fetched first, never-fetched
 * sources ahead of everything else. Ties keep the registry order.
 */
@Component
public class SourceScheduler {

    private static final Comparator<Source> LEAST_RECENTLY_FETCHED =
            Comparator.comparing(Source::lastFetchedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));

    public List<Source> select(List<Source> activeSources, int maxSources) {
        if (maxSources < 1) {
            return List.of();
        }
        return activeSources.stream()
                .filter(Source::active)
                .sorted(LEAST_RECENTLY_FETCHED)
                .limit(maxSources)
                .toList();
    }
}
