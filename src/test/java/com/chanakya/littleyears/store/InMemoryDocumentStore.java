package com.chanakya.littleyears.store;

import com.chanakya.littleyears.exception.InvalidIdentifierException;
import org.bson.types.ObjectId;
import org.springframework.beans.BeanWrapper;
import org.springframework.beans.PropertyAccessorFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Map-backed store for service tests. Assigns ids and a strictly increasing {@code createdAt}
 * on insert, mirroring Mongo auditing.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, List<Object>> collections = new LinkedHashMap<>();
    private Instant clock = Instant.parse("2024-05-01T08:00:00Z");

    @Override
    public synchronized <T extends StoredDocument> Mono<String> insert(String collection, T record) {
        BeanWrapper wrapper = PropertyAccessorFactory.forBeanPropertyAccess(record);
        String id = new ObjectId().toHexString();
        wrapper.setPropertyValue("id", id);
        if (wrapper.isWritableProperty("createdAt") && wrapper.getPropertyValue("createdAt") == null) {
            clock = clock.plus(Duration.ofMinutes(1));
            wrapper.setPropertyValue("createdAt", clock);
        }
        collections.computeIfAbsent(collection, name -> new ArrayList<>()).add(record);
        return Mono.just(id);
    }

    /**
     * Stores a record as-is, without assigning timestamps.
     */
    public synchronized <T extends StoredDocument> T put(String collection, T record) {
        if (record.getId() == null) {
            PropertyAccessorFactory.forBeanPropertyAccess(record)
                    .setPropertyValue("id", new ObjectId().toHexString());
        }
        collections.computeIfAbsent(collection, name -> new ArrayList<>()).add(record);
        return record;
    }

    @Override
    public synchronized <T> Flux<T> query(String collection, DocumentFilter filter, Class<T> type) {
        List<T> matches = snapshot(collection).stream()
                .filter(record -> matches(record, filter))
                .map(type::cast)
                .toList();
        return Flux.fromIterable(matches);
    }

    @Override
    public synchronized <T> Mono<T> findById(String collection, String id, Class<T> type) {
        if (id == null || !ObjectId.isValid(id)) {
            return Mono.error(new InvalidIdentifierException(id));
        }
        return Mono.justOrEmpty(snapshot(collection).stream()
                .filter(record -> id.equals(property(record, "id")))
                .map(type::cast)
                .findFirst());
    }

    @Override
    public synchronized <T> Mono<Long> deleteMany(String collection, DocumentFilter filter, Class<T> type) {
        List<Object> records = collections.getOrDefault(collection, new ArrayList<>());
        long before = records.size();
        records.removeIf(record -> matches(record, filter));
        return Mono.just(before - records.size());
    }

    @Override
    public synchronized Flux<String> collectionNames() {
        return Flux.fromIterable(new ArrayList<>(collections.keySet()));
    }

    public synchronized int count(String collection) {
        return snapshot(collection).size();
    }

    private List<Object> snapshot(String collection) {
        return new ArrayList<>(collections.getOrDefault(collection, List.of()));
    }

    private static boolean matches(Object record, DocumentFilter filter) {
        for (DocumentFilter.Condition condition : filter.conditions()) {
            Object actual = property(record, condition.field());
            boolean ok = switch (condition.operator()) {
                case EQ -> Objects.equals(actual, condition.value());
                case CONTAINS -> actual instanceof Collection<?> values && values.contains(condition.value());
            };
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    private static Object property(Object record, String field) {
        return PropertyAccessorFactory.forBeanPropertyAccess(record).getPropertyValue(field);
    }
}
