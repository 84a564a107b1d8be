package io.pulsereader.ingestion.api.service;

import io.pulsereader.ingestion.api.exception.EnrichmentException;
import io.pulsereader.ingestion.api.repository.ArticleRepository;
import io.pulsereader.ingestion.api.repository.TopicRepository;
import io.pulsereader.ingestion.config.IngestionConfig;
import io.pulsereader.ingestion.domain.Article;
import io.pulsereader.ingestion.domain.Topic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Attaches sentiment and topics to freshly created articles.
 * <p>
 * Articles go to the provider in batches; a batch call that fails as a whole,
 * and any article the batch answer leaves out, is analyzed individually.
 * Budget: a batch costs one call plus one write-back per article, an
 * individual analysis costs one call plus one write-back.
 */
@Service
public class ArticleEnrichmentService {

    private static final Logger logger = LoggerFactory.getLogger(ArticleEnrichmentService.class);

    private final AiAnalysisService aiAnalysisService;
    private final ArticleRepository articleRepository;
    private final TopicRepository topicRepository;
    private final Pacer pacer;
    private final IngestionConfig config;

    public ArticleEnrichmentService(AiAnalysisService aiAnalysisService,
                                    ArticleRepository articleRepository,
                                    TopicRepository topicRepository,
                                    Pacer pacer,
                                    IngestionConfig config) {
        this.aiAnalysisService = aiAnalysisService;
        this.articleRepository = articleRepository;
        this.topicRepository = topicRepository;
        this.pacer = pacer;
        this.config = config;
    }

    public boolean isEnabled() {
        return config.isEnrichmentEnabled();
    }

    public EnrichmentOutcome enrich(List<Article> articles, RunContext run) {
        if (!isEnabled() || articles.isEmpty()) {
            return EnrichmentOutcome.skipped();
        }

        Tally tally = new Tally();
        int batchSize = config.enrichment().batchSize();

        for (int start = 0; start < articles.size(); start += batchSize) {
            List<Article> chunk = articles.subList(start, Math.min(start + batchSize, articles.size()));

            int notAttempted = chunk.size() == 1
                    ? enrichIndividually(chunk, run, tally)
                    : enrichBatch(chunk, run, tally);

            if (notAttempted > 0) {
                int left = articles.size() - start - chunk.size() + notAttempted;
                run.markStoppedEarly();
                logger.warn("Budget exhausted during enrichment: {} articles left without analysis", left);
                break;
            }
        }

        logger.info("Enrichment finished: {} attempted, {} succeeded, {} failed",
                tally.attempted, tally.succeeded, tally.failed);

        return new EnrichmentOutcome(tally.attempted, tally.succeeded, tally.failed);
    }

    /**
     * @return number of articles in the chunk left unanalyzed because the budget ran out
     */
    private int enrichBatch(List<Article> chunk, RunContext run, Tally tally) {
        if (!run.budget().reserve(1 + chunk.size())) {
            return enrichIndividually(chunk, run, tally);
        }

        Map<UUID, ArticleAnalysis> analyses;
        try {
            analyses = aiAnalysisService.analyzeBatch(chunk);
            run.budget().consume(1);
        } catch (EnrichmentException e) {
            if (e.isRequestIssued()) {
                run.budget().consume(1);
            }
            logger.warn("Batch analysis of {} articles failed ({}), analyzing individually: {}",
                    chunk.size(), e.getFailure(), e.getMessage());
            return enrichIndividually(chunk, run, tally);
        }

        List<Article> missing = new ArrayList<>();
        for (Article article : chunk) {
            ArticleAnalysis analysis = analyses.get(article.id());
            if (analysis == null) {
                missing.add(article);
                continue;
            }
            tally.attempted++;
            run.budget().consume(1);
            if (store(article, analysis)) {
                tally.succeeded++;
            } else {
                tally.failed++;
            }
        }

        return missing.isEmpty() ? 0 : enrichIndividually(missing, run, tally);
    }

    private int enrichIndividually(List<Article> articles, RunContext run, Tally tally) {
        for (int i = 0; i < articles.size(); i++) {
            Article article = articles.get(i);

            if (!run.budget().reserve(2)
                    || (i > 0 && !pacer.pause(config.processing().fallbackDelay()))) {
                return articles.size() - i;
            }

            tally.attempted++;
            ArticleAnalysis analysis;
            try {
                analysis = aiAnalysisService.analyze(article);
                run.budget().consume(1);
            } catch (EnrichmentException e) {
                if (e.isRequestIssued()) {
                    run.budget().consume(1);
                }
                tally.failed++;
                logger.warn("Analysis failed for article {} ({}): {}", article.id(), e.getFailure(), e.getMessage());
                continue;
            }

            run.budget().consume(1);
            if (store(article, analysis)) {
                tally.succeeded++;
            } else {
                tally.failed++;
            }
        }
        return 0;
    }

    private boolean store(Article article, ArticleAnalysis analysis) {
        try {
            List<Topic> topics = topicRepository.findOrCreateAll(analysis.topics());
            articleRepository.applyEnrichment(article.id(), analysis.sentiment(),
                    topics.stream().map(Topic::id).toList());

            logger.debug("Stored analysis for article {}: {} with {} topics",
                    article.id(), analysis.sentiment(), topics.size());
            return true;

        } catch (DataAccessException | TransactionException e) {
            logger.warn("Failed to store analysis for article {}: {}", article.id(), e.getMessage());
            return false;
        }
    }

    private static final class Tally {
        int attempted;
        int succeeded;
        int failed;
    }
}
