package io.pulsereader.ingestion.api;

import io.pulsereader.ingestion.IntegrationTestSupport;
import io.pulsereader.ingestion.api.dto.RunSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.context.TestPropertySource;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ContextConfiguration(initializers = IntegrationTestSupport.Initializer.class)
@TestPropertySource(properties = {
        "ingestion.enrichment.api-key=sk-integration",
        "ingestion.enrichment.batch-size=10"
})
class EnrichmentIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    @DisplayName("Should store sentiment and shared topics from a batch analysis")
    void shouldEnrichCreatedArticles() {
        insertSource("World", feedUrl("/world.xml"));
        stubFeed("/world.xml", rss("https://news.example.com/1", "https://news.example.com/2"));
        stubProvider("""
                {"results": [
                    {"id": 1, "sentiment": "positive", "topics": ["Climate", "energy"]},
                    {"id": 2, "sentiment": "negative", "topics": ["climate"]}
                ]}""");

        RunSummary summary = trigger();

        assertThat(summary.articlesCreated()).isEqualTo(2);
        assertThat(summary.aiAnalysis().attempted()).isEqualTo(2);
        assertThat(summary.aiAnalysis().successful()).isEqualTo(2);
        assertThat(jdbcTemplate.queryForList(
                "SELECT sentiment FROM articles ORDER BY link", String.class))
                .containsExactly("positive", "negative");
        assertThat(jdbcTemplate.queryForList("SELECT name FROM topics ORDER BY name", String.class))
                .containsExactly("Climate", "energy");
        assertThat(jdbcTemplate.queryForObject("SELECT count(*) FROM article_topics", Integer.class))
                .isEqualTo(3);
    }

    @Test
    @DisplayName("Should keep articles when the provider fails")
    void shouldKeepArticlesWhenProviderFails() {
        insertSource("World", feedUrl("/world.xml"));
        stubFeed("/world.xml", rss("https://news.example.com/1", "https://news.example.com/2"));
        wireMock().stubFor(post(urlEqualTo("/chat/completions")).willReturn(aResponse().withStatus(500)));

        RunSummary summary = trigger();

        assertThat(summary.articlesCreated()).isEqualTo(2);
        assertThat(summary.aiAnalysis().attempted()).isEqualTo(2);
        assertThat(summary.aiAnalysis().failed()).isEqualTo(2);
        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(jdbcTemplate.queryForList("SELECT sentiment FROM articles", String.class))
                .containsOnly((String) null);
    }

    private void stubProvider(String content) {
        String escaped = content.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
        wireMock().stubFor(post(urlEqualTo("/chat/completions"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\""
                                + escaped + "\"}}]}")));
    }

    private RunSummary trigger() {
        ResponseEntity<RunSummary> response = restTemplate.exchange(
                "/api/v1/ingestion/runs", HttpMethod.POST, authorized(), RunSummary.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        return response.getBody();
    }
}
