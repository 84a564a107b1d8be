package io.pulsereader.ingestion.api.service;

import io.pulsereader.ingestion.api.dto.RunSummary;
import io.pulsereader.ingestion.api.exception.ErrorCode;
import io.pulsereader.ingestion.api.exception.IngestionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * In-process trigger for deployments without an external scheduler.
 */
@Service
@ConditionalOnProperty(prefix = "ingestion.processing", name = "enable-scheduling", havingValue = "true")
public class ScheduledIngestionService {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledIngestionService.class);

    private final IngestionRunService ingestionRunService;

    public ScheduledIngestionService(IngestionRunService ingestionRunService) {
        this.ingestionRunService = ingestionRunService;
    }

    @Scheduled(
            fixedRateString = "#{@ingestionProps.scheduleIntervalMs}",
            initialDelayString = "#{@ingestionProps.initialDelayMs}"
    )
    public void runScheduledIngestion() {
        logger.info("Starting scheduled ingestion run");
        try {
            RunSummary summary = ingestionRunService.run();
            logger.info("Scheduled run {} completed: {} sources, {} new articles, more work: {}",
                    summary.runId(), summary.processed(), summary.articlesCreated(), summary.hasMoreWork());

        } catch (IngestionException e) {
            if (e.getCode() == ErrorCode.RUN_IN_PROGRESS) {
                logger.info("Skipping scheduled run: {}", e.getMessage());
            } else {
                logger.error("Scheduled run failed ({}): {}", e.getCode(), e.getMessage(), e);
            }
        }
    }
}
