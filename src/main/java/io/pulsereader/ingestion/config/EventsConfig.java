package io.pulsereader.ingestion.config;

public record EventsConfig(boolean enabled) {}
