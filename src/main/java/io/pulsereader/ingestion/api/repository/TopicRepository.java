package io.pulsereader.ingestion.api.repository;

import io.pulsereader.ingestion.domain.Topic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.IncorrectResultSizeDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Topic dictionary. Names are unique ignoring case; the unique index on
 * {@code lower(name)} settles concurrent creation of the same topic.
 */
@Repository
public class TopicRepository {

    private static final Logger logger = LoggerFactory.getLogger(TopicRepository.class);

    private static final RowMapper<Topic> TOPIC_ROW_MAPPER = (rs, rowNum) -> new Topic(
            rs.getObject("id", UUID.class),
            rs.getString("name")
    );

    private final NamedParameterJdbcTemplate jdbc;

    public TopicRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Topic findOrCreate(String name) {
        return findOrCreateAll(List.of(name)).get(0);
    }

    /**
     * Resolves every name to a topic, creating the ones that do not exist yet.
     * Existing topics keep their stored spelling.
     *
     * @return topics in the order of {@code names}, one per distinct name ignoring case
     */
    public List<Topic> findOrCreateAll(Collection<String> names) {
        Map<String, String> byKey = new LinkedHashMap<>();
        for (String name : names) {
            byKey.putIfAbsent(normalize(name), name);
        }
        if (byKey.isEmpty()) {
            return List.of();
        }

        Map<String, Topic> resolved = findByNormalizedNames(byKey.keySet());

        for (Map.Entry<String, String> entry : byKey.entrySet()) {
            if (resolved.containsKey(entry.getKey())) {
                continue;
            }
            List<Topic> created = jdbc.query("""
                            INSERT INTO topics (name) VALUES (:name)
                            ON CONFLICT DO NOTHING
                            RETURNING id, name
                            """, new MapSqlParameterSource("name", entry.getValue()), TOPIC_ROW_MAPPER);

            if (!created.isEmpty()) {
                logger.debug("Created topic '{}'", entry.getValue());
                resolved.put(entry.getKey(), created.get(0));
            }
        }

        List<String> missing = byKey.keySet().stream()
                .filter(key -> !resolved.containsKey(key))
                .toList();
        if (!missing.isEmpty()) {
            // lost a creation race; the winner's row is there now
            resolved.putAll(findByNormalizedNames(missing));
        }

        List<Topic> topics = new ArrayList<>();
        for (String key : byKey.keySet()) {
            Topic topic = resolved.get(key);
            if (topic == null) {
                throw new IncorrectResultSizeDataAccessException("Topic could not be resolved: " + byKey.get(key), 1, 0);
            }
            topics.add(topic);
        }
        return topics;
    }

    private Map<String, Topic> findByNormalizedNames(Collection<String> normalizedNames) {
        Map<String, Topic> found = new LinkedHashMap<>();
        jdbc.query("SELECT id, name FROM topics WHERE lower(name) IN (:names)",
                        new MapSqlParameterSource("names", normalizedNames), TOPIC_ROW_MAPPER)
                .forEach(topic -> found.put(normalize(topic.name()), topic));
        return found;
    }

    static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
