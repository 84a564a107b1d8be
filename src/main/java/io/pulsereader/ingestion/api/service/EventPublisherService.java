package io.pulsereader.ingestion.api.service;

import io.pulsereader.ingestion.api.dto.RunSummary;
import io.pulsereader.ingestion.api.dto.kafka.IngestionRunCompletedEvent;
import io.pulsereader.ingestion.config.KafkaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

@Service
public class EventPublisherService {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisherService.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaProperties kafkaProperties;
    private final Clock clock;

    public EventPublisherService(KafkaTemplate<String, Object> kafkaTemplate,
                                 KafkaProperties kafkaProperties,
                                 Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.kafkaProperties = kafkaProperties;
        this.clock = clock;
    }

    /**
     * Hands the run-completed event to the producer. Delivery is reported asynchronously.
     *
     * @return whether the send was issued
     */
    public boolean publishRunCompleted(RunSummary summary) {
        try {
            IngestionRunCompletedEvent event = IngestionRunCompletedEvent.from(summary, clock.instant());

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(kafkaProperties.runCompleted(), summary.runId(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Sent run completed event: {} to partition: {}",
                            summary.runId(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to send run completed event: {}", summary.runId(), ex);
                }
            });
            return true;

        } catch (Exception e) {
            logger.error("Error publishing run completed event for run: {}", summary.runId(), e);
            return false;
        }
    }
}
