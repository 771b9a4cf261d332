package com.chanakya.littleyears.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Collection-oriented access to the document database.
 *
 * <p>Failures to reach the database surface as
 * {@link com.chanakya.littleyears.exception.StorageUnavailableException}; nothing is retried.
 */
public interface DocumentStore {

    /**
     * Inserts a new record and emits the identifier the store assigned to it.
     */
    <T extends StoredDocument> Mono<String> insert(String collection, T record);

    <T> Flux<T> query(String collection, DocumentFilter filter, Class<T> type);

    /**
     * Looks up a single record. Emits empty when absent and
     * {@link com.chanakya.littleyears.exception.InvalidIdentifierException} when {@code id}
     * is not a well-formed store identifier.
     */
    <T> Mono<T> findById(String collection, String id, Class<T> type);

    <T> Mono<Long> deleteMany(String collection, DocumentFilter filter, Class<T> type);

    Flux<String> collectionNames();
}
