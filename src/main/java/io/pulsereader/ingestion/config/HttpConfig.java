package io.pulsereader.ingestion.config;

import java.util.List;

public record HttpConfig(
        int connectTimeout,
        int readTimeout,
        List<String> userAgents,
        int maxDescriptionLength
) {
    public HttpConfig {
        userAgents = userAgents == null || userAgents.isEmpty()
                ? List.of("Mozilla/5.0 (compatible; PulseReader/1.0)")
                : List.copyOf(userAgents);
        if (maxDescriptionLength <= 0) {
            maxDescriptionLength = 5000;
        }
    }
}
