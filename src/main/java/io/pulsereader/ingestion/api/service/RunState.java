package io.pulsereader.ingestion.api.service;

public enum RunState {
    IDLE,
    SELECTING_SOURCES,
    PROCESSING_SOURCE,
    FINALIZING,
    DONE
}
