package com.siteintel.scrape.persistence;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.Optional;

/**
 * Session-scoped checkpoint storage. Writing an existing (session, key) pair replaces its payload.
 *
 * @throws CheckpointException from any method when the underlying store fails
 */
public interface CheckpointStore {
    String DISCOVERED_URLS = "discovered_urls";
    String SCRAPED_URLS = "scraped_urls";
    String DATASET = "dataset";

    void upsert(String sessionId, String key, Object payload);

    <T> Optional<T> find(String sessionId, String key, TypeReference<T> type);
}
