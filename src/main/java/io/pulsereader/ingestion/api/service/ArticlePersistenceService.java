package io.pulsereader.ingestion.api.service;

import io.pulsereader.ingestion.api.repository.ArticleRepository;
import io.pulsereader.ingestion.config.IngestionConfig;
import io.pulsereader.ingestion.config.ProcessingConfig;
import io.pulsereader.ingestion.domain.Article;
import io.pulsereader.ingestion.domain.FeedItem;
import io.pulsereader.ingestion.domain.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Stores the items of one feed in batches. A batch that the store rejects is
 * replayed item by item so one bad row does not cost the whole batch.
 */
@Service
public class ArticlePersistenceService {

    private static final Logger logger = LoggerFactory.getLogger(ArticlePersistenceService.class);

    private final ArticleRepository articleRepository;
    private final Pacer pacer;
    private final ProcessingConfig processing;

    public ArticlePersistenceService(ArticleRepository articleRepository,
                                     Pacer pacer,
                                     IngestionConfig config) {
        this.articleRepository = articleRepository;
        this.pacer = pacer;
        this.processing = config.processing();
    }

    /**
     * Persist the items of {@code source}, charging every issued insert to the run budget.
     *
     * @param onCreated called with the articles created by each batch, in order
     */
    public PersistenceOutcome persist(Source source, List<FeedItem> items, RunContext run,
                                      Consumer<List<Article>> onCreated) {
        Map<String, FeedItem> byLink = new LinkedHashMap<>();
        for (FeedItem item : items) {
            byLink.putIfAbsent(item.link(), item);
        }
        int duplicates = items.size() - byLink.size();
        if (duplicates > 0) {
            logger.debug("Source {} repeats {} links within one feed", source.name(), duplicates);
        }

        List<FeedItem> unique = new ArrayList<>(byLink.values());
        List<Article> created = new ArrayList<>();
        int skipped = 0;
        int failedItems = 0;

        for (int start = 0; start < unique.size(); start += processing.batchSize()) {
            List<FeedItem> batch = unique.subList(start, Math.min(start + processing.batchSize(), unique.size()));

            if (!run.budget().reserve(1)) {
                skipped = unique.size() - start;
                run.markStoppedEarly();
                logger.warn("Budget exhausted while storing {}: {} items left for a later run",
                        source.name(), skipped);
                break;
            }

            BatchAttempt attempt = attemptBatch(source, batch);
            if (attempt.requestIssued()) {
                run.budget().consume(1);
            }

            if (attempt.succeeded()) {
                created.addAll(attempt.created());
                duplicates += batch.size() - attempt.created().size();
                notify(source, onCreated, attempt.created());
                continue;
            }

            logger.warn("Batch insert failed for {} ({} items), storing individually: {}",
                    source.name(), batch.size(), attempt.error());

            IndividualResult individual = attemptIndividually(source, batch, run);
            created.addAll(individual.created());
            duplicates += individual.duplicates();
            failedItems += individual.failed();
            notify(source, onCreated, individual.created());

            if (individual.notAttempted() > 0) {
                skipped = individual.notAttempted() + (unique.size() - start - batch.size());
                run.markStoppedEarly();
                logger.warn("Budget exhausted while storing {}: {} items left for a later run",
                        source.name(), skipped);
                break;
            }
        }

        logger.info("Stored {}: {} created, {} duplicates, {} failed, {} skipped",
                source.name(), created.size(), duplicates, failedItems, skipped);

        return new PersistenceOutcome(created, duplicates, skipped, failedItems);
    }

    private BatchAttempt attemptBatch(Source source, List<FeedItem> batch) {
        try {
            return BatchAttempt.success(articleRepository.insertBatch(source.id(), batch));
        } catch (DataAccessException e) {
            return BatchAttempt.failure(e.getMessage(), wasIssued(e));
        }
    }

    private IndividualResult attemptIndividually(Source source, List<FeedItem> batch, RunContext run) {
        List<Article> created = new ArrayList<>();
        int duplicates = 0;
        int failed = 0;

        for (int i = 0; i < batch.size(); i++) {
            FeedItem item = batch.get(i);

            if (!run.budget().reserve(1)) {
                return new IndividualResult(created, duplicates, failed, batch.size() - i);
            }
            if (i > 0 && !pacer.pause(processing.fallbackDelay())) {
                return new IndividualResult(created, duplicates, failed, batch.size() - i);
            }

            try {
                Optional<Article> article = articleRepository.insertOne(source.id(), item);
                run.budget().consume(1);
                if (article.isPresent()) {
                    created.add(article.get());
                } else {
                    duplicates++;
                }
            } catch (DataAccessException e) {
                if (wasIssued(e)) {
                    run.budget().consume(1);
                }
                failed++;
                logger.warn("Failed to store item {} from {}: {}", item.link(), source.name(), e.getMessage());
            }
        }

        return new IndividualResult(created, duplicates, failed, 0);
    }

    private void notify(Source source, Consumer<List<Article>> onCreated, List<Article> articles) {
        if (articles.isEmpty()) {
            return;
        }
        try {
            onCreated.accept(List.copyOf(articles));
        } catch (RuntimeException e) {
            // stored articles stay stored; the next batch still runs
            logger.error("Post-insert step failed for {} new articles from {}: {}",
                    articles.size(), source.name(), e.getMessage(), e);
        }
    }

    private static boolean wasIssued(DataAccessException e) {
        return !(e instanceof CannotGetJdbcConnectionException);
    }

    private record BatchAttempt(boolean succeeded, List<Article> created, String error, boolean requestIssued) {
        static BatchAttempt success(List<Article> created) {
            return new BatchAttempt(true, created, null, true);
        }

        static BatchAttempt failure(String error, boolean requestIssued) {
            return new BatchAttempt(false, List.of(), error, requestIssued);
        }
    }

    private record IndividualResult(List<Article> created, int duplicates, int failed, int notAttempted) {}
}
