package io.pulsereader.ingestion;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.support.TestPropertySourceUtils;
import org.testcontainers.containers.PostgreSQLContainer;

import java.util.UUID;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;

/**
 * Shared PostgreSQL container and WireMock server for the end-to-end tests.
 * WireMock serves both the feeds and the enrichment provider.
 */
public abstract class IntegrationTestSupport {

    protected static final String SERVICE_TOKEN = "integration-token";

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    public static class Initializer implements ApplicationContextInitializer<ConfigurableApplicationContext> {

        static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

        static final WireMockServer wireMock = new WireMockServer(options().dynamicPort().gzipDisabled(true));

        @Override
        public void initialize(ConfigurableApplicationContext context) {
            if (!postgres.isRunning()) {
                postgres.start();
            }
            if (!wireMock.isRunning()) {
                wireMock.start();
            }

            TestPropertySourceUtils.addInlinedPropertiesToEnvironment(context,
                    "spring.datasource.url=" + postgres.getJdbcUrl(),
                    "spring.datasource.username=" + postgres.getUsername(),
                    "spring.datasource.password=" + postgres.getPassword(),
                    "ingestion.enrichment.base-url=http://localhost:" + wireMock.port(),
                    "ingestion.security.service-token=" + SERVICE_TOKEN,
                    "ingestion.lease.enabled=false",
                    "ingestion.events.enabled=false",
                    "ingestion.processing.max-sources-per-run=5",
                    "ingestion.processing.source-delay=0ms",
                    "ingestion.processing.fallback-delay=0ms",
                    "ingestion.processing.enable-scheduling=false");
        }
    }

    @BeforeEach
    void resetState() {
        jdbcTemplate.execute("TRUNCATE article_topics, articles, topics, rss_sources CASCADE");
        wireMock().resetAll();
    }

    protected static WireMockServer wireMock() {
        return Initializer.wireMock;
    }

    protected static String feedUrl(String path) {
        return "http://localhost:" + wireMock().port() + path;
    }

    protected UUID insertSource(String name, String url) {
        return jdbcTemplate.queryForObject(
                "INSERT INTO rss_sources (name, url) VALUES (?, ?) RETURNING id", UUID.class, name, url);
    }

    protected static void stubFeed(String path, String body) {
        wireMock().stubFor(get(urlEqualTo(path))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/rss+xml")
                        .withBody(body)));
    }

    protected static String rss(String... links) {
        StringBuilder items = new StringBuilder();
        for (int i = 0; i < links.length; i++) {
            items.append("""
                    <item>
                        <title>Story %d</title>
                        <link>%s</link>
                        <description>Description of story %d</description>
                        <pubDate>Tue, 29 Jul 2025 10:00:00 GMT</pubDate>
                    </item>
                    """.formatted(i + 1, links[i], i + 1));
        }
        return """
                <?xml version="1.0" encoding="UTF-8"?>
                <rss version="2.0"><channel><title>Test feed</title>%s</channel></rss>
                """.formatted(items);
    }

    protected static HttpEntity<Void> authorized() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(SERVICE_TOKEN);
        return new HttpEntity<>(headers);
    }
}
