package io.pulsereader.ingestion.api.repository;

import io.pulsereader.ingestion.domain.Article;
import io.pulsereader.ingestion.domain.FeedItem;
import io.pulsereader.ingestion.domain.Sentiment;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Types;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Article store. Inserts never fail on an existing link: the unique
 * constraint on {@code link} plus {@code ON CONFLICT DO NOTHING} turns
 * duplicates into rows that are simply not returned.
 */
@Repository
public class ArticleRepository {

    private static final String RETURNING_COLUMNS =
            " RETURNING id, source_id, title, description, link, publication_date, sentiment, created_at, updated_at";

    private static final RowMapper<Article> ARTICLE_ROW_MAPPER = (rs, rowNum) -> new Article(
            rs.getObject("id", UUID.class),
            rs.getObject("source_id", UUID.class),
            rs.getString("title"),
            rs.getString("description"),
            rs.getString("link"),
            rs.getObject("publication_date", OffsetDateTime.class).toInstant(),
            Sentiment.fromLabel(rs.getString("sentiment")).orElse(null),
            rs.getObject("created_at", OffsetDateTime.class).toInstant(),
            rs.getObject("updated_at", OffsetDateTime.class).toInstant()
    );

    private final NamedParameterJdbcTemplate jdbc;

    public ArticleRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Inserts all items with a single multi-row statement.
     *
     * @return the articles actually created; items whose link already exists are absent
     */
    public List<Article> insertBatch(UUID sourceId, List<FeedItem> items) {
        if (items.isEmpty()) {
            return List.of();
        }

        StringBuilder sql = new StringBuilder(
                "INSERT INTO articles (source_id, title, description, link, publication_date) VALUES ");
        MapSqlParameterSource params = new MapSqlParameterSource("sourceId", sourceId);

        for (int i = 0; i < items.size(); i++) {
            FeedItem item = items.get(i);
            if (i > 0) {
                sql.append(", ");
            }
            sql.append("(:sourceId, :title").append(i)
                    .append(", :description").append(i)
                    .append(", :link").append(i)
                    .append(", :publishedAt").append(i).append(')');

            params.addValue("title" + i, item.title())
                    .addValue("description" + i, item.description(), Types.VARCHAR)
                    .addValue("link" + i, item.link())
                    .addValue("publishedAt" + i, OffsetDateTime.ofInstant(item.publishedAt(), ZoneOffset.UTC));
        }

        sql.append(" ON CONFLICT (link) DO NOTHING").append(RETURNING_COLUMNS);

        return jdbc.query(sql.toString(), params, ARTICLE_ROW_MAPPER);
    }

    /**
     * @return the created article, or empty when the link already exists
     */
    public Optional<Article> insertOne(UUID sourceId, FeedItem item) {
        SqlParameterSource params = new MapSqlParameterSource()
                .addValue("sourceId", sourceId)
                .addValue("title", item.title())
                .addValue("description", item.description(), Types.VARCHAR)
                .addValue("link", item.link())
                .addValue("publishedAt", OffsetDateTime.ofInstant(item.publishedAt(), ZoneOffset.UTC));

        return jdbc.query("""
                        INSERT INTO articles (source_id, title, description, link, publication_date)
                        VALUES (:sourceId, :title, :description, :link, :publishedAt)
                        ON CONFLICT (link) DO NOTHING""" + RETURNING_COLUMNS,
                params, ARTICLE_ROW_MAPPER).stream().findFirst();
    }

    /**
     * Stores the sentiment and links the topics in one transaction, so an
     * article never ends up with topics but no sentiment.
     */
    @Transactional
    public void applyEnrichment(UUID articleId, Sentiment sentiment, Collection<UUID> topicIds) {
        updateSentiment(articleId, sentiment);
        linkTopics(articleId, topicIds);
    }

    void updateSentiment(UUID articleId, Sentiment sentiment) {
        int updated = jdbc.update("""
                UPDATE articles SET sentiment = :sentiment, updated_at = now()
                WHERE id = :id
                """, new MapSqlParameterSource()
                .addValue("id", articleId)
                .addValue("sentiment", sentiment.dbValue()));

        if (updated == 0) {
            throw new EmptyResultDataAccessException("Article not found: " + articleId, 1);
        }
    }

    void linkTopics(UUID articleId, Collection<UUID> topicIds) {
        if (topicIds.isEmpty()) {
            return;
        }

        SqlParameterSource[] batch = topicIds.stream()
                .map(topicId -> new MapSqlParameterSource()
                        .addValue("articleId", articleId)
                        .addValue("topicId", topicId))
                .toArray(SqlParameterSource[]::new);

        jdbc.batchUpdate("""
                INSERT INTO article_topics (article_id, topic_id)
                VALUES (:articleId, :topicId)
                ON CONFLICT DO NOTHING
                """, batch);
    }

    public Optional<Article> findByLink(String link) {
        return jdbc.query("""
                        SELECT id, source_id, title, description, link, publication_date, sentiment, created_at, updated_at
                        FROM articles WHERE link = :link
                        """, new MapSqlParameterSource("link", link), ARTICLE_ROW_MAPPER)
                .stream().findFirst();
    }
}
