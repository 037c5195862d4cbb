package com.siteintel.scrape.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Repository
public class JdbcCheckpointStore implements CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointStore.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean postgres;

    public JdbcCheckpointStore(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper, Clock clock) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.postgres = detectPostgres(jdbc);
    }

    @Override
    @Transactional
    public void upsert(String sessionId, String key, Object payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Unable to serialize checkpoint " + key + " for session " + sessionId, e);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sessionId", sessionId)
            .addValue("key", key)
            .addValue("payload", json)
            .addValue("updatedAt", Timestamp.from(clock.instant()));
        try {
            if (postgres) {
                jdbc.update(
                    """
                        INSERT INTO scrape_session_checkpoint (session_id, checkpoint_key, payload, updated_at)
                        VALUES (:sessionId, :key, :payload, :updatedAt)
                        ON CONFLICT (session_id, checkpoint_key)
                        DO UPDATE SET
                            payload = EXCLUDED.payload,
                            updated_at = EXCLUDED.updated_at
                        """,
                    params
                );
            } else {
                int updated = jdbc.update(
                    """
                        UPDATE scrape_session_checkpoint
                        SET payload = :payload, updated_at = :updatedAt
                        WHERE session_id = :sessionId AND checkpoint_key = :key
                        """,
                    params
                );
                if (updated == 0) {
                    jdbc.update(
                        """
                            INSERT INTO scrape_session_checkpoint (session_id, checkpoint_key, payload, updated_at)
                            VALUES (:sessionId, :key, :payload, :updatedAt)
                            """,
                        params
                    );
                }
            }
        } catch (DataAccessException e) {
            throw new CheckpointException("Unable to write checkpoint " + key + " for session " + sessionId, e);
        }
        log.debug("checkpoint saved session={} key={} bytes={}", sessionId, key, json.length());
    }

    @Override
    public <T> Optional<T> find(String sessionId, String key, TypeReference<T> type) {
        List<String> payloads;
        try {
            payloads = jdbc.queryForList(
                """
                    SELECT payload
                    FROM scrape_session_checkpoint
                    WHERE session_id = :sessionId AND checkpoint_key = :key
                    """,
                new MapSqlParameterSource()
                    .addValue("sessionId", sessionId)
                    .addValue("key", key),
                String.class
            );
        } catch (DataAccessException e) {
            throw new CheckpointException("Unable to read checkpoint " + key + " for session " + sessionId, e);
        }
        if (payloads.isEmpty() || payloads.get(0) == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(payloads.get(0), type));
        } catch (JsonProcessingException e) {
            throw new CheckpointException("Unable to parse checkpoint " + key + " for session " + sessionId, e);
        }
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (SQLException e) {
            log.warn("Unable to detect database product; using portable upsert", e);
            return false;
        }
    }
}
