package io.pulsereader.ingestion.api.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.pulsereader.ingestion.api.exception.EnrichmentException;
import io.pulsereader.ingestion.api.exception.EnrichmentFailure;
import io.pulsereader.ingestion.config.EnrichmentConfig;
import io.pulsereader.ingestion.config.IngestionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal client for an OpenRouter-compatible chat completions endpoint.
 * Every call is a single HTTP request; failures surface as {@link EnrichmentException}.
 */
@Component
public class OpenRouterClient {

    private static final Logger logger = LoggerFactory.getLogger(OpenRouterClient.class);

    private final RestTemplate restTemplate;
    private final EnrichmentConfig config;

    public OpenRouterClient(@Qualifier("enrichmentRestTemplate") RestTemplate restTemplate,
                            IngestionConfig ingestionConfig) {
        this.restTemplate = restTemplate;
        this.config = ingestionConfig.enrichment();
    }

    public record ChatMessage(String role, String content) {
        public static ChatMessage system(String content) {
            return new ChatMessage("system", content);
        }

        public static ChatMessage user(String content) {
            return new ChatMessage("user", content);
        }
    }

    /**
     * @return the content of the first choice
     */
    public String chatCompletion(List<ChatMessage> messages, int maxTokens) {
        if (!config.hasApiKey()) {
            throw new EnrichmentException("No API key configured for the enrichment provider",
                    EnrichmentFailure.MISSING_CREDENTIAL);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(config.apiKey());
        if (config.referer() != null && !config.referer().isBlank()) {
            headers.set("HTTP-Referer", config.referer());
        }
        if (config.appTitle() != null && !config.appTitle().isBlank()) {
            headers.set("X-Title", config.appTitle());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", config.model());
        body.put("messages", messages);
        body.put("temperature", config.temperature());
        body.put("max_tokens", maxTokens);
        body.put("response_format", Map.of("type", "json_object"));

        String url = config.baseUrl() + "/chat/completions";
        ResponseEntity<JsonNode> response;
        try {
            response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), JsonNode.class);

        } catch (HttpStatusCodeException e) {
            throw mapStatus(e);

        } catch (ResourceAccessException e) {
            throw mapAccessFailure(e);

        } catch (RestClientException e) {
            throw new EnrichmentException("Unreadable provider response: " + e.getMessage(), e,
                    EnrichmentFailure.MALFORMED_RESPONSE);
        }

        return extractContent(response.getBody());
    }

    private String extractContent(JsonNode body) {
        if (body == null) {
            throw new EnrichmentException("Empty provider response", EnrichmentFailure.MALFORMED_RESPONSE);
        }

        JsonNode choices = body.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new EnrichmentException("Provider response has no choices", EnrichmentFailure.MALFORMED_RESPONSE);
        }

        JsonNode content = choices.get(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new EnrichmentException("Provider response has no message content",
                    EnrichmentFailure.MALFORMED_RESPONSE);
        }

        JsonNode usage = body.path("usage");
        if (usage.has("total_tokens")) {
            logger.debug("Provider call used {} tokens", usage.get("total_tokens").asInt());
        }

        return content.asText();
    }

    private EnrichmentException mapStatus(HttpStatusCodeException e) {
        int status = e.getStatusCode().value();
        EnrichmentFailure failure = switch (status) {
            case 429 -> EnrichmentFailure.RATE_LIMITED;
            case 402 -> EnrichmentFailure.INSUFFICIENT_CREDITS;
            case 408, 504 -> EnrichmentFailure.TIMEOUT;
            default -> EnrichmentFailure.PROVIDER_ERROR;
        };
        return new EnrichmentException("Provider returned HTTP " + status, e, failure);
    }

    private EnrichmentException mapAccessFailure(ResourceAccessException e) {
        Throwable cause = e.getCause();
        if (cause instanceof SocketTimeoutException) {
            return new EnrichmentException("Provider timed out", e, EnrichmentFailure.TIMEOUT);
        }
        if (cause instanceof UnknownHostException || cause instanceof ConnectException) {
            return new EnrichmentException("Provider unreachable: " + cause.getMessage(), e,
                    EnrichmentFailure.PROVIDER_UNREACHABLE);
        }
        return new EnrichmentException("Provider I/O error: " + e.getMessage(), e, EnrichmentFailure.PROVIDER_ERROR);
    }
}
