package com.siteintel.scrape.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.siteintel.scrape.model.DiscoveredUrl;
import com.siteintel.scrape.model.DiscoverySource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JdbcCheckpointStoreTest {
    private static final TypeReference<List<String>> URL_LIST = new TypeReference<>() {
    };

    @Autowired
    private CheckpointStore checkpointStore;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void upsertReplacesPayloadForTheSameSessionAndKey() {
        String sessionId = "session-" + UUID.randomUUID();

        checkpointStore.upsert(sessionId, CheckpointStore.SCRAPED_URLS, List.of("https://acme.test/"));
        checkpointStore.upsert(sessionId, CheckpointStore.SCRAPED_URLS, List.of("https://acme.test/", "https://acme.test/about"));

        Optional<List<String>> stored = checkpointStore.find(sessionId, CheckpointStore.SCRAPED_URLS, URL_LIST);
        assertEquals(List.of("https://acme.test/", "https://acme.test/about"), stored.orElseThrow());

        Integer rows = jdbc.queryForObject(
            "SELECT COUNT(*) FROM scrape_session_checkpoint WHERE session_id = :sessionId",
            new MapSqlParameterSource("sessionId", sessionId),
            Integer.class
        );
        assertEquals(1, rows);
    }

    @Test
    void sessionsAreIsolated() {
        String first = "session-" + UUID.randomUUID();
        String second = "session-" + UUID.randomUUID();
        checkpointStore.upsert(first, CheckpointStore.SCRAPED_URLS, List.of("https://acme.test/a"));

        assertTrue(checkpointStore.find(second, CheckpointStore.SCRAPED_URLS, URL_LIST).isEmpty());
        assertTrue(checkpointStore.find(first, CheckpointStore.DATASET, URL_LIST).isEmpty());
    }

    @Test
    void storesStructuredPayloads() {
        String sessionId = "session-" + UUID.randomUUID();
        List<DiscoveredUrl> urls = List.of(DiscoveredUrl.of("https://acme.test/pricing", "Pricing", 0.9, DiscoverySource.SITEMAP));

        checkpointStore.upsert(sessionId, CheckpointStore.DISCOVERED_URLS, urls);

        List<DiscoveredUrl> stored = checkpointStore
            .find(sessionId, CheckpointStore.DISCOVERED_URLS, new TypeReference<List<DiscoveredUrl>>() {
            })
            .orElseThrow();
        assertEquals(urls, stored);
    }

    @Test
    void unreadablePayloadSurfacesAsCheckpointException() {
        String sessionId = "session-" + UUID.randomUUID();
        checkpointStore.upsert(sessionId, CheckpointStore.SCRAPED_URLS, "not a list");

        assertThrows(CheckpointException.class,
            () -> checkpointStore.find(sessionId, CheckpointStore.SCRAPED_URLS, URL_LIST));
    }
}
