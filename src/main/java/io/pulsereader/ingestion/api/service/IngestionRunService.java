package io.pulsereader.ingestion.api.service;

import io.pulsereader.ingestion.api.dto.RunSummary;
import io.pulsereader.ingestion.api.exception.ErrorCode;
import io.pulsereader.ingestion.api.exception.IngestionException;
import io.pulsereader.ingestion.api.repository.SourceRepository;
import io.pulsereader.ingestion.config.IngestionConfig;
import io.pulsereader.ingestion.domain.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Drives one ingestion run: select sources, then fetch, store and enrich them
 * one at a time under the operation budget, then record the outcome.
 * <p>
 * Only failures before the first source is touched propagate to the caller.
 * Everything after that ends up in the {@link RunSummary}.
 */
@Service
public class IngestionRunService {

    private static final Logger logger = LoggerFactory.getLogger(IngestionRunService.class);

    private final SourceRepository sourceRepository;
    private final SourceScheduler sourceScheduler;
    private final FeedFetchService feedFetchService;
    private final ArticlePersistenceService persistenceService;
    private final ArticleEnrichmentService enrichmentService;
    private final EventPublisherService eventPublisher;
    private final RunLeaseService leaseService;
    private final Pacer pacer;
    private final IngestionConfig config;
    private final Clock clock;

    public IngestionRunService(SourceRepository sourceRepository,
                               SourceScheduler sourceScheduler,
                               FeedFetchService feedFetchService,
                               ArticlePersistenceService persistenceService,
                               ArticleEnrichmentService enrichmentService,
                               EventPublisherService eventPublisher,
                               RunLeaseService leaseService,
                               Pacer pacer,
                               IngestionConfig config,
                               Clock clock) {
        this.sourceRepository = sourceRepository;
        this.sourceScheduler = sourceScheduler;
        this.feedFetchService = feedFetchService;
        this.persistenceService = persistenceService;
        this.enrichmentService = enrichmentService;
        this.eventPublisher = eventPublisher;
        this.leaseService = leaseService;
        this.pacer = pacer;
        this.config = config;
        this.clock = clock;
    }

    /**
     * @throws IngestionException when the run cannot start: lease held elsewhere or source registry unreachable
     */
    public RunSummary run() {
        String runId = UUID.randomUUID().toString();

        leaseService.acquire(runId);
        try {
            return execute(runId);
        } finally {
            leaseService.release(runId);
        }
    }

    private RunSummary execute(String runId) {
        RunContext run = new RunContext(runId, clock.instant(),
                new BudgetTracker(config.budget().ceiling(), config.budget().finalizeReserve()));

        run.transitionTo(RunState.SELECTING_SOURCES);
        List<Source> activeSources;
        try {
            activeSources = sourceRepository.findActive();
        } catch (DataAccessException e) {
            logger.error("Run {} aborted: source registry unavailable: {}", runId, e.getMessage());
            throw new IngestionException("Source registry unavailable", e, ErrorCode.STORAGE_UNAVAILABLE);
        }

        List<Source> selected = sourceScheduler.select(activeSources, config.processing().maxSourcesPerRun());
        logger.info("Run {} started: {} of {} active sources selected, budget {}",
                runId, selected.size(), activeSources.size(), config.budget().ceiling());

        if (!enrichmentService.isEnabled()) {
            logger.warn("Run {}: no enrichment API key configured, articles will be stored without analysis", runId);
        }

        for (int i = 0; i < selected.size(); i++) {
            Source source = selected.get(i);

            if (!run.budget().reserve(1)) {
                run.markStoppedEarly();
                logger.warn("Run {}: budget exhausted after {} sources, {} remaining",
                        runId, i, selected.size() - i);
                break;
            }
            if (i > 0 && !pacer.pause(config.processing().sourceDelay())) {
                run.markStoppedEarly();
                logger.warn("Run {} interrupted after {} sources", runId, i);
                break;
            }

            run.transitionTo(RunState.PROCESSING_SOURCE);
            processSource(source, run);
        }

        run.transitionTo(RunState.FINALIZING);
        recordSourceOutcomes(run);

        RunSummary summary = run.toSummary(activeSources.size(), clock.instant());
        publishCompletion(run, summary);

        run.transitionTo(RunState.DONE);
        logger.info("Run {} finished: {} processed, {} failed, {} articles created, {} duplicates, "
                        + "{} of {} operations used, more work: {}",
                runId, summary.processed(), summary.failed(), summary.articlesCreated(),
                summary.duplicatesSkipped(), run.budget().used(), run.budget().ceiling(), summary.hasMoreWork());

        // the event carries the count before its own publish
        return run.toSummary(activeSources.size(), summary.finishedAt());
    }

    private void processSource(Source source, RunContext run) {
        logger.debug("Processing source {} ({})", source.name(), source.url());
        try {
            FeedFetchResult fetched = feedFetchService.fetch(source.url());
            if (fetched.requestIssued()) {
                run.budget().consume(1);
            }

            if (!fetched.success()) {
                run.recordSourceFailed(source, fetched.error());
                return;
            }

            if (fetched.items().isEmpty()) {
                logger.info("Source {} returned an empty feed", source.name());
                run.recordSourceSucceeded(source);
                return;
            }

            PersistenceOutcome outcome = persistenceService.persist(source, fetched.items(), run,
                    created -> run.recordEnrichment(enrichmentService.enrich(created, run)));
            run.recordPersistence(outcome, source);

            if (outcome.nothingStored()) {
                run.recordSourceFailed(source, "Article store rejected all " + outcome.failedItems() + " items");
            } else {
                run.recordSourceSucceeded(source);
            }

        } catch (RuntimeException e) {
            logger.error("Unexpected error processing source {}: {}", source.name(), e.getMessage(), e);
            run.recordSourceFailed(source, "Unexpected error: " + e.getMessage());
        }
    }

    private void recordSourceOutcomes(RunContext run) {
        run.budget().releaseHeld();

        if (run.processed() == 0) {
            return;
        }
        if (!run.budget().reserve(1)) {
            logger.warn("Run {}: no budget left to record source outcomes, {} sources keep their old fetch time",
                    run.runId(), run.processed());
            return;
        }

        try {
            int updated = sourceRepository.recordRunOutcome(
                    run.succeededSourceIds(), run.failedSources(), clock.instant());
            run.budget().consume(1);
            logger.debug("Run {}: recorded outcome for {} sources", run.runId(), updated);
        } catch (CannotGetJdbcConnectionException e) {
            logger.error("Run {}: could not record source outcomes: {}", run.runId(), e.getMessage());
        } catch (DataAccessException e) {
            run.budget().consume(1);
            logger.error("Run {}: could not record source outcomes: {}", run.runId(), e.getMessage());
        }
    }

    private void publishCompletion(RunContext run, RunSummary summary) {
        if (!config.isEventsEnabled()) {
            return;
        }
        if (!run.budget().reserve(1)) {
            logger.warn("Run {}: no budget left to publish the completion event", run.runId());
            return;
        }
        if (eventPublisher.publishRunCompleted(summary)) {
            run.budget().consume(1);
        }
    }
}
