package io.pulsereader.ingestion.api.service;

import io.pulsereader.ingestion.api.dto.AiAnalysisStats;
import io.pulsereader.ingestion.api.dto.RunSummary;
import io.pulsereader.ingestion.api.dto.SkippedArticles;
import io.pulsereader.ingestion.api.dto.SourceError;
import io.pulsereader.ingestion.domain.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * State of a single run, handed through the pipeline by reference: the
 * operation budget plus the counters that end up in the {@link RunSummary}.
 */
public class RunContext {

    private static final Logger logger = LoggerFactory.getLogger(RunContext.class);

    private final String runId;
    private final Instant startedAt;
    private final BudgetTracker budget;

    private int processed;
    private int succeeded;
    private int failed;
    private int articlesCreated;
    private int duplicatesSkipped;
    private int enrichmentAttempted;
    private int enrichmentSucceeded;
    private int enrichmentFailed;
    private boolean stoppedEarly;
    private RunState state = RunState.IDLE;

    private final List<SourceError> errors = new ArrayList<>();
    private final List<SkippedArticles> skippedArticles = new ArrayList<>();
    private final List<UUID> succeededSourceIds = new ArrayList<>();
    private final Map<UUID, String> failedSources = new LinkedHashMap<>();

    public RunContext(String runId, Instant startedAt, BudgetTracker budget) {
        this.runId = runId;
        this.startedAt = startedAt;
        this.budget = budget;
    }

    public BudgetTracker budget() {
        return budget;
    }

    public String runId() {
        return runId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public void transitionTo(RunState next) {
        if (next != state) {
            logger.debug("Run {}: {} -> {}", runId, state, next);
            state = next;
        }
    }

    public void recordSourceSucceeded(Source source) {
        processed++;
        succeeded++;
        succeededSourceIds.add(source.id());
    }

    public void recordSourceFailed(Source source, String error) {
        processed++;
        failed++;
        errors.add(new SourceError(source.id(), source.name(), error));
        failedSources.put(source.id(), error);
    }

    public void recordPersistence(PersistenceOutcome outcome, Source source) {
        articlesCreated += outcome.created().size();
        duplicatesSkipped += outcome.duplicatesSkipped();
        if (outcome.skippedForBudget() > 0) {
            skippedArticles.add(new SkippedArticles(source.id(), source.name(), outcome.skippedForBudget()));
        }
    }

    public void recordEnrichment(EnrichmentOutcome outcome) {
        enrichmentAttempted += outcome.attempted();
        enrichmentSucceeded += outcome.succeeded();
        enrichmentFailed += outcome.failed();
    }

    public void markStoppedEarly() {
        stoppedEarly = true;
    }

    public boolean isStoppedEarly() {
        return stoppedEarly;
    }

    public int processed() {
        return processed;
    }

    public List<UUID> succeededSourceIds() {
        return List.copyOf(succeededSourceIds);
    }

    public Map<UUID, String> failedSources() {
        return Map.copyOf(failedSources);
    }

    public RunSummary toSummary(int totalActiveSources, Instant finishedAt) {
        int skippedSources = Math.max(0, totalActiveSources - processed);

        return new RunSummary(
                runId,
                processed,
                succeeded,
                failed,
                articlesCreated,
                duplicatesSkipped,
                errors,
                skippedSources,
                skippedArticles,
                skippedSources > 0 || stoppedEarly,
                stoppedEarly,
                new AiAnalysisStats(enrichmentAttempted, enrichmentSucceeded, enrichmentFailed),
                budget.used(),
                budget.ceiling(),
                startedAt,
                finishedAt
        );
    }
}
