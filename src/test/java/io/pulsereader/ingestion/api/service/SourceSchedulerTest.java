package io.pulsereader.ingestion.api.service;

import io.pulsereader.ingestion.domain.Source;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SourceSchedulerTest {

    private static final Instant NOW = Instant.parse("2025-07-29T10:00:00Z");

    private final SourceScheduler scheduler = new SourceScheduler();

    @Test
    @DisplayName("Should pick a never-fetched source before one fetched yesterday")
    void shouldPreferNeverFetchedSources() {
        Source fetchedYesterday = source("B", NOW.minus(Duration.ofDays(1)));
        Source neverFetched = source("A", null);

        List<Source> selected = scheduler.select(List.of(fetchedYesterday, neverFetched), 1);

        assertThat(selected).containsExactly(neverFetched);
    }

    @Test
    @DisplayName("Should order by last fetch time ascending and cap the selection")
    void shouldOrderByLastFetchAndCap() {
        Source recent = source("recent", NOW.minus(Duration.ofMinutes(5)));
        Source old = source("old", NOW.minus(Duration.ofHours(5)));
        Source older = source("older", NOW.minus(Duration.ofHours(10)));
        Source never = source("never", null);

        List<Source> selected = scheduler.select(List.of(recent, old, never, older), 3);

        assertThat(selected).containsExactly(never, older, old);
    }

    @Test
    @DisplayName("Should keep registry order between sources with the same fetch time")
    void shouldKeepRegistryOrderOnTies() {
        Source first = source("first", null);
        Source second = source("second", null);
        Source third = source("third", null);

        assertThat(scheduler.select(List.of(first, second, third), 2)).containsExactly(first, second);
    }

    @Test
    @DisplayName("Should skip inactive sources and handle an empty registry")
    void shouldSkipInactiveSources() {
        Source inactive = new Source(UUID.randomUUID(), "inactive", "https://inactive.test/rss", false, null, null);
        Source active = source("active", NOW);

        assertThat(scheduler.select(List.of(inactive, active), 5)).containsExactly(active);
        assertThat(scheduler.select(List.of(), 5)).isEmpty();
        assertThat(scheduler.select(List.of(active), 0)).isEmpty();
    }

    private static Source source(String name, Instant lastFetchedAt) {
        return new Source(UUID.randomUUID(), name, "https://" + name + ".test/rss", true, lastFetchedAt, null);
    }
}
