package io.pulsereader.ingestion.api.service;

import io.pulsereader.ingestion.TestConfigs;
import io.pulsereader.ingestion.api.repository.ArticleRepository;
import io.pulsereader.ingestion.domain.Article;
import io.pulsereader.ingestion.domain.FeedItem;
import io.pulsereader.ingestion.domain.Source;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ArticlePersistenceServiceTest {

    private static final Instant PUBLISHED = Instant.parse("2025-07-29T10:00:00Z");

    @Mock
    private ArticleRepository articleRepository;

    private final Source source = new Source(UUID.randomUUID(), "Example", "https://example.com/rss", true, null, null);
    private final List<List<Article>> createdBatches = new ArrayList<>();

    private ArticlePersistenceService service;

    @BeforeEach
    void setUp() {
        service = new ArticlePersistenceService(articleRepository, new Pacer(), TestConfigs.config(45, 0, 1, 2, ""));
    }

    @Test
    @DisplayName("Should store items in fixed-size batches, one budget unit each")
    void shouldStoreInBatches() {
        List<FeedItem> items = items(5);
        when(articleRepository.insertBatch(eq(source.id()), anyList()))
                .thenAnswer(invocation -> toArticles(invocation.getArgument(1)));
        RunContext run = run(10);

        PersistenceOutcome outcome = service.persist(source, items, run, createdBatches::add);

        assertThat(outcome.created()).hasSize(5);
        assertThat(outcome.duplicatesSkipped()).isZero();
        assertThat(outcome.skippedForBudget()).isZero();
        assertThat(run.budget().used()).isEqualTo(3);
        assertThat(createdBatches).extracting(List::size).containsExactly(2, 2, 1);
        verify(articleRepository, times(3)).insertBatch(eq(source.id()), anyList());
    }

    @Test
    @DisplayName("Should keep storing later batches when handling a created batch fails")
    void shouldContinueWhenCreatedBatchHandlingFails() {
        List<FeedItem> items = items(4);
        when(articleRepository.insertBatch(eq(source.id()), anyList()))
                .thenAnswer(invocation -> toArticles(invocation.getArgument(1)));
        RunContext run = run(10);

        PersistenceOutcome outcome = service.persist(source, items, run, created -> {
            createdBatches.add(created);
            throw new IllegalStateException("enrichment store unavailable");
        });

        assertThat(outcome.created()).hasSize(4);
        assertThat(outcome.failedItems()).isZero();
        assertThat(createdBatches).hasSize(2);
        assertThat(run.budget().used()).isEqualTo(2);
        verify(articleRepository, times(2)).insertBatch(eq(source.id()), anyList());
    }

    @Test
    @DisplayName("Should count existing links as duplicates")
    void shouldCountDuplicates() {
        service = new ArticlePersistenceService(articleRepository, new Pacer(), TestConfigs.config(45, 0, 1, 20, ""));
        List<FeedItem> items = items(3);
        when(articleRepository.insertBatch(source.id(), items))
                .thenReturn(toArticles(items.subList(0, 2)));

        PersistenceOutcome outcome = service.persist(source, items, run(10), createdBatches::add);

        assertThat(outcome.created()).hasSize(2);
        assertThat(outcome.duplicatesSkipped()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should send a link repeated within one feed only once")
    void shouldDeduplicateWithinFeed() {
        service = new ArticlePersistenceService(articleRepository, new Pacer(), TestConfigs.config(45, 0, 1, 20, ""));
        FeedItem original = item(1);
        FeedItem repeated = new FeedItem("Repeated title", null, original.link(), PUBLISHED);
        when(articleRepository.insertBatch(eq(source.id()), anyList()))
                .thenAnswer(invocation -> toArticles(invocation.getArgument(1)));

        PersistenceOutcome outcome = service.persist(source, List.of(original, repeated, item(2)), run(10),
                createdBatches::add);

        assertThat(outcome.created()).hasSize(2);
        assertThat(outcome.duplicatesSkipped()).isEqualTo(1);
        verify(articleRepository).insertBatch(eq(source.id()), argThat(batch -> batch.size() == 2));
    }

    @Test
    @DisplayName("Should fall back to individual inserts when a batch fails")
    void shouldFallBackToIndividualInserts() {
        service = new ArticlePersistenceService(articleRepository, new Pacer(), TestConfigs.config(45, 0, 1, 20, ""));
        List<FeedItem> items = items(20);
        FeedItem bad = items.get(7);
        FeedItem existing = items.get(12);

        when(articleRepository.insertBatch(source.id(), items))
                .thenThrow(new QueryTimeoutException("statement timeout"));
        when(articleRepository.insertOne(eq(source.id()), any(FeedItem.class)))
                .thenAnswer(invocation -> {
                    FeedItem item = invocation.getArgument(1);
                    if (item.equals(bad)) {
                        throw new DataIntegrityViolationException("value too long");
                    }
                    return item.equals(existing) ? Optional.empty() : Optional.of(toArticle(item));
                });
        RunContext run = run(45);

        PersistenceOutcome outcome = service.persist(source, items, run, createdBatches::add);

        assertThat(outcome.created()).hasSize(18);
        assertThat(outcome.duplicatesSkipped()).isEqualTo(1);
        assertThat(outcome.failedItems()).isEqualTo(1);
        assertThat(outcome.nothingStored()).isFalse();
        assertThat(run.budget().used()).isEqualTo(21);
        assertThat(createdBatches).singleElement().satisfies(batch -> assertThat(batch).hasSize(18));
        verify(articleRepository, times(20)).insertOne(eq(source.id()), any(FeedItem.class));
    }

    @Test
    @DisplayName("Should skip remaining items when the budget runs out between batches")
    void shouldSkipItemsWhenBudgetRunsOut() {
        List<FeedItem> items = items(5);
        when(articleRepository.insertBatch(eq(source.id()), anyList()))
                .thenAnswer(invocation -> toArticles(invocation.getArgument(1)));
        RunContext run = run(1);

        PersistenceOutcome outcome = service.persist(source, items, run, createdBatches::add);

        assertThat(outcome.created()).hasSize(2);
        assertThat(outcome.skippedForBudget()).isEqualTo(3);
        assertThat(run.isStoppedEarly()).isTrue();
        assertThat(run.budget().used()).isEqualTo(1);
        verify(articleRepository, times(1)).insertBatch(eq(source.id()), anyList());
    }

    @Test
    @DisplayName("Should stop the individual fallback when the budget runs out")
    void shouldStopFallbackWhenBudgetRunsOut() {
        List<FeedItem> items = items(4);
        when(articleRepository.insertBatch(eq(source.id()), anyList()))
                .thenThrow(new QueryTimeoutException("statement timeout"));
        when(articleRepository.insertOne(eq(source.id()), any(FeedItem.class)))
                .thenAnswer(invocation -> Optional.of(toArticle(invocation.getArgument(1))));
        RunContext run = run(2);

        PersistenceOutcome outcome = service.persist(source, items, run, createdBatches::add);

        assertThat(outcome.created()).hasSize(1);
        assertThat(outcome.skippedForBudget()).isEqualTo(3);
        assertThat(run.isStoppedEarly()).isTrue();
        assertThat(run.budget().used()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should not charge calls that never reached the database")
    void shouldNotChargeUnsentCalls() {
        List<FeedItem> items = items(2);
        when(articleRepository.insertBatch(source.id(), items))
                .thenThrow(new CannotGetJdbcConnectionException("pool exhausted"));
        when(articleRepository.insertOne(eq(source.id()), any(FeedItem.class)))
                .thenThrow(new CannotGetJdbcConnectionException("pool exhausted"));
        RunContext run = run(10);

        PersistenceOutcome outcome = service.persist(source, items, run, createdBatches::add);

        assertThat(outcome.failedItems()).isEqualTo(2);
        assertThat(outcome.nothingStored()).isTrue();
        assertThat(run.budget().used()).isZero();
        assertThat(createdBatches).isEmpty();
    }

    @Test
    @DisplayName("Should do nothing for an empty item list")
    void shouldHandleEmptyList() {
        PersistenceOutcome outcome = service.persist(source, List.of(), run(10), createdBatches::add);

        assertThat(outcome).isEqualTo(PersistenceOutcome.empty());
        verify(articleRepository, never()).insertBatch(any(), anyList());
    }

    private RunContext run(int ceiling) {
        return new RunContext("run-1", PUBLISHED, new BudgetTracker(ceiling, 0));
    }

    private static List<FeedItem> items(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(ArticlePersistenceServiceTest::item).toList();
    }

    private static FeedItem item(int n) {
        return new FeedItem("Title " + n, "Description " + n, "https://example.com/news/" + n, PUBLISHED);
    }

    private List<Article> toArticles(List<FeedItem> items) {
        return items.stream().map(this::toArticle).toList();
    }

    private Article toArticle(FeedItem item) {
        return new Article(UUID.randomUUID(), source.id(), item.title(), item.description(), item.link(),
                item.publishedAt(), null, PUBLISHED, PUBLISHED);
    }
}
