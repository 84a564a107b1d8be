package io.pulsereader.ingestion.domain;

import java.util.Locale;
import java.util.Optional;

public enum Sentiment {
    POSITIVE,
    NEUTRAL,
    NEGATIVE;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Sentiment> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "positive" -> Optional.of(POSITIVE);
            case "neutral" -> Optional.of(NEUTRAL);
            case "negative" -> Optional.of(NEGATIVE);
            default -> Optional.empty();
        };
    }
}
