package io.pulsereader.ingestion.api.util;

import io.pulsereader.ingestion.api.exception.ErrorCode;
import io.pulsereader.ingestion.api.exception.IngestionException;
import io.pulsereader.ingestion.config.IngestionConfig;
import io.pulsereader.ingestion.config.SecurityConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the bearer token of a run trigger against the configured service token.
 */
@Component
public class ServiceTokenVerifier {

    private static final Logger logger = LoggerFactory.getLogger(ServiceTokenVerifier.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final SecurityConfig security;

    public ServiceTokenVerifier(IngestionConfig config) {
        this.security = config.security();
    }

    public void verify(String authorizationHeader) {
        if (security == null || !security.hasServiceToken()) {
            logger.error("Run trigger rejected: no service token configured");
            throw new IngestionException("Service token is not configured", ErrorCode.CONFIGURATION_ERROR);
        }

        if (authorizationHeader == null
                || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())
                || authorizationHeader.length() == BEARER_PREFIX.length()) {
            throw new IngestionException("Bearer token required", ErrorCode.AUTHENTICATION_REQUIRED);
        }

        String presented = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        boolean matches = MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                security.serviceToken().getBytes(StandardCharsets.UTF_8));

        if (!matches) {
            logger.warn("Run trigger rejected: invalid service token");
            throw new IngestionException("Invalid service token", ErrorCode.FORBIDDEN);
        }
    }
}
