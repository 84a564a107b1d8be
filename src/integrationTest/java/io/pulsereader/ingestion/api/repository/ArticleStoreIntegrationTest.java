package io.pulsereader.ingestion.api.repository;

import io.pulsereader.ingestion.IntegrationTestSupport;
import io.pulsereader.ingestion.domain.Article;
import io.pulsereader.ingestion.domain.FeedItem;
import io.pulsereader.ingestion.domain.Sentiment;
import io.pulsereader.ingestion.domain.Topic;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ContextConfiguration;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ContextConfiguration(initializers = IntegrationTestSupport.Initializer.class)
class ArticleStoreIntegrationTest extends IntegrationTestSupport {

    private static final Instant PUBLISHED = Instant.parse("2025-07-29T10:00:00Z");

    @Autowired
    private ArticleRepository articleRepository;

    @Autowired
    private TopicRepository topicRepository;

    @Test
    @DisplayName("Should return only newly created rows and ignore existing links")
    void shouldInsertBatchOnce() {
        UUID sourceId = insertSource("World", "https://world.test/rss");
        List<FeedItem> items = List.of(
                new FeedItem("First", "Body", "https://world.test/1", PUBLISHED),
                new FeedItem("Second", null, "https://world.test/2", PUBLISHED));

        List<Article> first = articleRepository.insertBatch(sourceId, items);
        List<Article> second = articleRepository.insertBatch(sourceId, items);

        assertThat(first).extracting(Article::link).containsExactlyInAnyOrder(
                "https://world.test/1", "https://world.test/2");
        assertThat(second).isEmpty();
        assertThat(articleRepository.insertOne(sourceId, items.get(0))).isEmpty();
        assertThat(articleRepository.findByLink("https://world.test/2"))
                .hasValueSatisfying(article -> {
                    assertThat(article.title()).isEqualTo("Second");
                    assertThat(article.description()).isNull();
                    assertThat(article.publishedAt()).isEqualTo(PUBLISHED);
                    assertThat(article.sentiment()).isNull();
                });
        assertThat(articleRepository.findByLink("https://world.test/missing")).isEmpty();
    }

    @Test
    @DisplayName("Should resolve topic names ignoring case and keep the first spelling")
    void shouldFindOrCreateTopicsIgnoringCase() {
        Topic climate = topicRepository.findOrCreate("Climate");

        Topic again = topicRepository.findOrCreate("  CLIMATE ");
        List<Topic> mixed = topicRepository.findOrCreateAll(List.of("climate", "Energy", "energy"));

        assertThat(again).isEqualTo(climate);
        assertThat(mixed).hasSize(2);
        assertThat(mixed.get(0)).isEqualTo(climate);
        assertThat(mixed.get(1).name()).isEqualTo("Energy");
        assertThat(jdbcTemplate.queryForObject("SELECT count(*) FROM topics", Integer.class)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should store sentiment and topic links together")
    void shouldApplyEnrichment() {
        UUID sourceId = insertSource("World", "https://world.test/rss");
        Article article = articleRepository.insertOne(sourceId,
                new FeedItem("Story", null, "https://world.test/story", PUBLISHED)).orElseThrow();
        List<Topic> topics = topicRepository.findOrCreateAll(List.of("Markets", "Energy"));

        articleRepository.applyEnrichment(article.id(), Sentiment.NEGATIVE, topics.stream().map(Topic::id).toList());

        assertThat(articleRepository.findByLink("https://world.test/story"))
                .hasValueSatisfying(stored -> assertThat(stored.sentiment()).isEqualTo(Sentiment.NEGATIVE));
        assertThat(jdbcTemplate.queryForObject(
                "SELECT count(*) FROM article_topics WHERE article_id = ?", Integer.class, article.id()))
                .isEqualTo(2);
    }
}
