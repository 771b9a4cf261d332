package com.chanakya.littleyears.service;

import com.chanakya.littleyears.access.MomentQuery;
import com.chanakya.littleyears.config.LittleYearsProperties;
import com.chanakya.littleyears.config.RequestCorrelation;
import com.chanakya.littleyears.exception.SeedingDisabledException;
import com.chanakya.littleyears.model.document.KidDocument;
import com.chanakya.littleyears.model.document.MomentDocument;
import com.chanakya.littleyears.model.dto.response.SeedResponse;
import com.chanakya.littleyears.store.DocumentFilter;
import com.chanakya.littleyears.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Loads the demo family. Re-running replaces the previous demo records instead of adding to them.
 * Concurrent runs are not coordinated.
 */
@Service
public class SeedService {

    private static final Logger log = LoggerFactory.getLogger(SeedService.class);

    private static final DocumentFilter DEMO_KIDS = DocumentFilter.where("name", DemoFixtures.KID_NAME);

    private final DocumentStore documentStore;
    private final LittleYearsProperties properties;

    public SeedService(DocumentStore documentStore, LittleYearsProperties properties) {
        this.documentStore = documentStore;
        this.properties = properties;
    }

    public Mono<SeedResponse> seedDemo() {
        if (!properties.seed().enabled()) {
            return Mono.error(new SeedingDisabledException());
        }
        return clearDemoData()
                .then(Mono.defer(this::insertDemoData))
                .flatMap(response -> Mono.deferContextual(context -> {
                    RequestCorrelation.runWithMdc(context, () -> log.info("event=demo_seeded kidId={} inserted={}",
                            response.inserted().get(0), response.inserted().size()));
                    return Mono.just(response);
                }));
    }

    private Mono<Void> clearDemoData() {
        return documentStore.query(KidDocument.COLLECTION, DEMO_KIDS, KidDocument.class)
                .map(KidDocument::getId)
                .concatMap(kidId -> documentStore.deleteMany(MomentDocument.COLLECTION,
                        new MomentQuery.ByKid(kidId).toFilter(), MomentDocument.class))
                .then(Mono.defer(() -> documentStore.deleteMany(
                        KidDocument.COLLECTION, DEMO_KIDS, KidDocument.class)))
                .then();
    }

    private Mono<SeedResponse> insertDemoData() {
        return documentStore.insert(KidDocument.COLLECTION, DemoFixtures.kid())
                .flatMap(kidId -> Flux.fromIterable(DemoFixtures.moments(kidId))
                        .concatMap(moment -> documentStore.insert(MomentDocument.COLLECTION, moment))
                        .collectList()
                        .map(momentIds -> {
                            List<String> inserted = new ArrayList<>();
                            inserted.add(kidId);
                            inserted.addAll(momentIds);
                            return new SeedResponse(inserted);
                        }));
    }
}
