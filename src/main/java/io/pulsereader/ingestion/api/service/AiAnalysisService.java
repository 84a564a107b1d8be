package io.pulsereader.ingestion.api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pulsereader.ingestion.api.exception.EnrichmentException;
import io.pulsereader.ingestion.api.exception.EnrichmentFailure;
import io.pulsereader.ingestion.api.service.OpenRouterClient.ChatMessage;
import io.pulsereader.ingestion.config.EnrichmentConfig;
import io.pulsereader.ingestion.config.IngestionConfig;
import io.pulsereader.ingestion.domain.Article;
import io.pulsereader.ingestion.domain.Sentiment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Sentiment classification and topic extraction through the chat completions
 * provider. Responses are validated strictly; anything off-schema is a
 * {@link EnrichmentFailure#MALFORMED_RESPONSE}.
 */
@Service
public class AiAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(AiAnalysisService.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern CODE_FENCE = Pattern.compile("^```(?:json)?\\s*|\\s*```$");

    private static final String SYSTEM_PROMPT = """
            You are an expert news analyst specializing in sentiment analysis and topic classification.

            Analyze news articles and answer in JSON only.

            Guidelines:
            - Be objective and consistent in sentiment classification
            - Focus on factual content rather than sensational headlines
            - Extract specific, meaningful topics rather than generic categories
            - If uncertain about sentiment, use "neutral"
            - Topics should be useful for filtering content

            Return ONLY the JSON response, no additional text.""";

    private final OpenRouterClient client;
    private final ObjectMapper objectMapper;
    private final EnrichmentConfig config;

    public AiAnalysisService(OpenRouterClient client, ObjectMapper objectMapper, IngestionConfig ingestionConfig) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.config = ingestionConfig.enrichment();
    }

    public ArticleAnalysis analyze(Article article) {
        String content = client.chatCompletion(
                List.of(ChatMessage.system(SYSTEM_PROMPT), ChatMessage.user(buildSinglePrompt(article))),
                config.maxTokens());

        JsonNode root = readJson(content);
        ArticleAnalysis analysis = toAnalysis(root);

        logger.debug("Analyzed article {}: {} {}", article.id(), analysis.sentiment(), analysis.topics());
        return analysis;
    }

    /**
     * Analyzes several articles with one provider call. Entries the provider
     * leaves out or gets wrong are absent from the result; the caller decides
     * what to do with them.
     *
     * @throws EnrichmentException when the call fails or the response is unusable as a whole
     */
    public Map<UUID, ArticleAnalysis> analyzeBatch(List<Article> articles) {
        if (articles.isEmpty()) {
            return Map.of();
        }

        String content = client.chatCompletion(
                List.of(ChatMessage.system(SYSTEM_PROMPT), ChatMessage.user(buildBatchPrompt(articles))),
                config.maxTokens() * articles.size());

        JsonNode results = readJson(content).path("results");
        if (!results.isArray()) {
            throw new EnrichmentException("Batch response has no results array", EnrichmentFailure.MALFORMED_RESPONSE);
        }

        Map<UUID, ArticleAnalysis> analyses = new LinkedHashMap<>();
        for (JsonNode entry : results) {
            int index = entry.path("id").asInt(-1);
            if (index < 1 || index > articles.size()) {
                logger.warn("Batch response refers to unknown article index {}", entry.path("id"));
                continue;
            }
            UUID articleId = articles.get(index - 1).id();
            try {
                analyses.putIfAbsent(articleId, toAnalysis(entry));
            } catch (EnrichmentException e) {
                logger.warn("Invalid analysis for article {}: {}", articleId, e.getMessage());
            }
        }

        logger.info("Batch analysis returned {} of {} articles", analyses.size(), articles.size());
        return analyses;
    }

    private String buildSinglePrompt(Article article) {
        return """
                Analyze this news article: classify its sentiment and extract its topics.

                Article Title: %s

                Article Content: %s

                Instructions:
                1. Classify the overall sentiment as exactly one of: "positive", "neutral", "negative"
                2. Extract 2-3 main topics (1-3 words each, lowercase unless proper nouns)
                3. Return only JSON in this format:
                {"sentiment": "positive|neutral|negative", "topics": ["topic1", "topic2"]}"""
                .formatted(article.title().trim(), prepareText(article.title(), article.description()));
    }

    private String buildBatchPrompt(List<Article> articles) {
        StringBuilder prompt = new StringBuilder("""
                Analyze each of the following news articles: classify its sentiment and extract its topics.

                """);

        for (int i = 0; i < articles.size(); i++) {
            Article article = articles.get(i);
            prompt.append("Article ").append(i + 1).append('\n')
                    .append("Title: ").append(article.title().trim()).append('\n')
                    .append("Content: ").append(prepareText(article.title(), article.description()))
                    .append("\n\n");
        }

        prompt.append("""
                Instructions:
                1. For every article classify the overall sentiment as exactly one of: "positive", "neutral", "negative"
                2. Extract 2-3 main topics per article (1-3 words each, lowercase unless proper nouns)
                3. Return only JSON in this format, using the article number as id:
                {"results": [{"id": 1, "sentiment": "neutral", "topics": ["topic1", "topic2"]}]}""");

        return prompt.toString();
    }

    /**
     * Combines title and description into the text sent to the provider,
     * whitespace-collapsed and cut to the configured input length.
     */
    String prepareText(String title, String description) {
        String safeTitle = title == null ? "" : title.trim();
        String combined = safeTitle;

        if (description != null && !description.isBlank()) {
            String trimmed = description.trim();
            if (trimmed.length() > safeTitle.length() * 2 || !trimmed.contains(safeTitle)) {
                combined = safeTitle + "\n\n" + trimmed;
            } else {
                combined = trimmed;
            }
        }

        if (combined.length() > config.maxInputLength()) {
            combined = combined.substring(0, config.maxInputLength()) + "...";
        }

        return WHITESPACE.matcher(combined).replaceAll(" ").trim();
    }

    private JsonNode readJson(String content) {
        String json = CODE_FENCE.matcher(content.trim()).replaceAll("");
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new EnrichmentException("Provider response is not a JSON object",
                        EnrichmentFailure.MALFORMED_RESPONSE);
            }
            return root;
        } catch (JsonProcessingException e) {
            logger.debug("Unparseable provider content: {}", json.length() > 500 ? json.substring(0, 500) : json);
            throw new EnrichmentException("Provider response is not valid JSON", e,
                    EnrichmentFailure.MALFORMED_RESPONSE);
        }
    }

    ArticleAnalysis toAnalysis(JsonNode node) {
        Sentiment sentiment = Sentiment.fromLabel(node.path("sentiment").asText(null))
                .orElseThrow(() -> new EnrichmentException(
                        "Invalid sentiment: " + node.path("sentiment"), EnrichmentFailure.MALFORMED_RESPONSE));

        JsonNode topicsNode = node.path("topics");
        if (!topicsNode.isArray()) {
            throw new EnrichmentException("Topics must be an array", EnrichmentFailure.MALFORMED_RESPONSE);
        }

        List<String> topics = normalizeTopics(topicsNode);
        if (topics.isEmpty()) {
            throw new EnrichmentException("No usable topics in response", EnrichmentFailure.MALFORMED_RESPONSE);
        }

        return new ArticleAnalysis(sentiment, topics);
    }

    private List<String> normalizeTopics(JsonNode topicsNode) {
        Map<String, String> unique = new LinkedHashMap<>();

        for (JsonNode topicNode : topicsNode) {
            if (!topicNode.isTextual()) {
                continue;
            }
            String topic = WHITESPACE.matcher(topicNode.asText().trim()).replaceAll(" ");
            if (topic.isEmpty() || topic.length() > config.maxTopicLength()) {
                continue;
            }
            unique.putIfAbsent(topic.toLowerCase(Locale.ROOT), topic);
            if (unique.size() == config.maxTopics()) {
                break;
            }
        }

        return new ArrayList<>(unique.values());
    }
}
