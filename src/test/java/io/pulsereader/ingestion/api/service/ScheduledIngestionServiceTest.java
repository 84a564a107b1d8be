package io.pulsereader.ingestion.api.service;

import io.pulsereader.ingestion.api.dto.AiAnalysisStats;
import io.pulsereader.ingestion.api.dto.RunSummary;
import io.pulsereader.ingestion.api.exception.ErrorCode;
import io.pulsereader.ingestion.api.exception.IngestionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduledIngestionServiceTest {

    @Mock
    private IngestionRunService ingestionRunService;

    private ScheduledIngestionService service;

    @BeforeEach
    void setUp() {
        service = new ScheduledIngestionService(ingestionRunService);
    }

    @Test
    @DisplayName("Should run the pipeline once per tick")
    void shouldRunPipeline() {
        Instant now = Instant.parse("2025-07-30T12:00:00Z");
        when(ingestionRunService.run()).thenReturn(new RunSummary("run-1", 1, 1, 0, 3, 0, List.of(), 0,
                List.of(), false, false, AiAnalysisStats.none(), 3, 45, now, now));

        service.runScheduledIngestion();

        verify(ingestionRunService).run();
    }

    @Test
    @DisplayName("Should skip the tick quietly while another run holds the lease")
    void shouldSkipWhenRunInProgress() {
        when(ingestionRunService.run()).thenThrow(new IngestionException("busy", ErrorCode.RUN_IN_PROGRESS));

        assertThatCode(service::runScheduledIngestion).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should not let a failed run escape the scheduler thread")
    void shouldContainStructuralFailures() {
        when(ingestionRunService.run())
                .thenThrow(new IngestionException("db down", ErrorCode.STORAGE_UNAVAILABLE));

        assertThatCode(service::runScheduledIngestion).doesNotThrowAnyException();
    }
}
