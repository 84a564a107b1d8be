package io.pulsereader.ingestion.api.repository;

import io.pulsereader.ingestion.domain.Source;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Repository
public class SourceRepository {

    private static final RowMapper<Source> SOURCE_ROW_MAPPER = (rs, rowNum) -> {
        OffsetDateTime lastFetchedAt = rs.getObject("last_fetched_at", OffsetDateTime.class);
        return new Source(
                rs.getObject("id", UUID.class),
                rs.getString("name"),
                rs.getString("url"),
                rs.getBoolean("is_active"),
                lastFetchedAt != null ? lastFetchedAt.toInstant() : null,
                rs.getString("last_fetch_error")
        );
    };

    private final NamedParameterJdbcTemplate jdbc;

    public SourceRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<Source> findActive() {
        return jdbc.query("""
                SELECT id, name, url, is_active, last_fetched_at, last_fetch_error
                FROM rss_sources
                WHERE is_active = TRUE
                ORDER BY last_fetched_at ASC NULLS FIRST, name
                """, SOURCE_ROW_MAPPER);
    }

    /**
     * Writes the outcome of a run in one JDBC batch: succeeded sources get
     * {@code last_fetched_at = at} and a cleared error, failed sources keep their
     * timestamp and get the error message.
     *
     * @return number of rows updated
     */
    public int recordRunOutcome(Collection<UUID> succeeded, Map<UUID, String> failed, Instant at) {
        OffsetDateTime timestamp = OffsetDateTime.ofInstant(at, ZoneOffset.UTC);
        List<SqlParameterSource> batch = new ArrayList<>();

        for (UUID id : succeeded) {
            batch.add(outcomeParams(id, true, null, timestamp));
        }
        failed.forEach((id, error) -> batch.add(outcomeParams(id, false, error, timestamp)));

        if (batch.isEmpty()) {
            return 0;
        }

        int[] counts = jdbc.batchUpdate("""
                UPDATE rss_sources
                SET last_fetched_at = CASE WHEN CAST(:success AS BOOLEAN) THEN :at ELSE last_fetched_at END,
                    last_fetch_error = :error,
                    updated_at = :at
                WHERE id = :id
                """, batch.toArray(SqlParameterSource[]::new));

        return Arrays.stream(counts).map(count -> Math.max(count, 0)).sum();
    }

    private static SqlParameterSource outcomeParams(UUID id, boolean success, String error, OffsetDateTime at) {
        return new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("success", success)
                .addValue("error", error, Types.VARCHAR)
                .addValue("at", at);
    }
}
