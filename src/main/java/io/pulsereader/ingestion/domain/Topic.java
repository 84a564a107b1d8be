package io.pulsereader.ingestion.domain;

import java.util.UUID;

public record Topic(UUID id, String name) {}
