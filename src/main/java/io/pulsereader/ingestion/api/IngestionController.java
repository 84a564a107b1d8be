package io.pulsereader.ingestion.api;

import io.pulsereader.ingestion.api.dto.IngestionStatus;
import io.pulsereader.ingestion.api.dto.RunSummary;
import io.pulsereader.ingestion.api.service.IngestionRunService;
import io.pulsereader.ingestion.api.service.RunLeaseService;
import io.pulsereader.ingestion.api.util.ServiceTokenVerifier;
import io.pulsereader.ingestion.config.IngestionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/ingestion")
public class IngestionController {

    private static final Logger logger = LoggerFactory.getLogger(IngestionController.class);

    private final IngestionRunService ingestionRunService;
    private final RunLeaseService runLeaseService;
    private final ServiceTokenVerifier tokenVerifier;
    private final IngestionConfig config;

    public IngestionController(IngestionRunService ingestionRunService,
                               RunLeaseService runLeaseService,
                               ServiceTokenVerifier tokenVerifier,
                               IngestionConfig config) {
        this.ingestionRunService = ingestionRunService;
        this.runLeaseService = runLeaseService;
        this.tokenVerifier = tokenVerifier;
        this.config = config;
    }

    /**
     * Runs the pipeline once. Partial failures still answer 200 with the summary.
     */
    @PostMapping("/runs")
    public ResponseEntity<RunSummary> triggerRun(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        tokenVerifier.verify(authorization);

        logger.info("Ingestion run triggered via API");
        return ResponseEntity.ok(ingestionRunService.run());
    }

    @GetMapping("/status")
    public ResponseEntity<IngestionStatus> status() {
        return ResponseEntity.ok(new IngestionStatus(
                "PulseReader Feed Ingestion Service",
                config.budget().ceiling(),
                config.processing().maxSourcesPerRun(),
                config.processing().batchSize(),
                config.isEnrichmentEnabled(),
                config.processing().enableScheduling(),
                runLeaseService.isEnabled()
        ));
    }
}
