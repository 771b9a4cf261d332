package com.chanakya.littleyears.store;

import com.chanakya.littleyears.exception.InvalidIdentifierException;
import com.chanakya.littleyears.exception.StorageUnavailableException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.result.DeleteResult;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public class MongoDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(MongoDocumentStore.class);

    private final ReactiveMongoTemplate mongoTemplate;

    public MongoDocumentStore(ReactiveMongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public <T extends StoredDocument> Mono<String> insert(String collection, T record) {
        return mongoTemplate.insert(record, collection)
                .map(StoredDocument::getId)
                .onErrorMap(MongoDocumentStore::isUnavailable, e -> unavailable(collection, e));
    }

    @Override
    public <T> Flux<T> query(String collection, DocumentFilter filter, Class<T> type) {
        return mongoTemplate.find(filter.toQuery(), type, collection)
                .onErrorMap(MongoDocumentStore::isUnavailable, e -> unavailable(collection, e));
    }

    @Override
    public <T> Mono<T> findById(String collection, String id, Class<T> type) {
        if (id == null || !ObjectId.isValid(id)) {
            return Mono.error(new InvalidIdentifierException(id));
        }
        return mongoTemplate.findById(id, type, collection)
                .onErrorMap(MongoDocumentStore::isUnavailable, e -> unavailable(collection, e));
    }

    @Override
    public <T> Mono<Long> deleteMany(String collection, DocumentFilter filter, Class<T> type) {
        return mongoTemplate.remove(filter.toQuery(), type, collection)
                .map(DeleteResult::getDeletedCount)
                .onErrorMap(MongoDocumentStore::isUnavailable, e -> unavailable(collection, e));
    }

    @Override
    public Flux<String> collectionNames() {
        return mongoTemplate.getCollectionNames()
                .onErrorMap(MongoDocumentStore::isUnavailable, e -> unavailable("*", e));
    }

    static boolean isUnavailable(Throwable e) {
        return e instanceof DataAccessResourceFailureException
                || e instanceof MongoTimeoutException
                || e instanceof MongoSocketException;
    }

    private static StorageUnavailableException unavailable(String collection, Throwable cause) {
        log.error("event=storage_unavailable collection={} error={}", collection, cause.getMessage());
        return new StorageUnavailableException("Database not reachable", cause);
    }
}
