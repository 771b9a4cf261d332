package com.chanakya.littleyears.service;

import com.chanakya.littleyears.access.AccessDecision;
import com.chanakya.littleyears.access.TimelineAccessPolicy;
import com.chanakya.littleyears.config.RequestCorrelation;
import com.chanakya.littleyears.exception.KidNotFoundException;
import com.chanakya.littleyears.model.document.KidDocument;
import com.chanakya.littleyears.model.document.MomentDocument;
import com.chanakya.littleyears.model.dto.response.KidResponse;
import com.chanakya.littleyears.model.dto.response.MomentResponse;
import com.chanakya.littleyears.model.dto.response.TimelineResponse;
import com.chanakya.littleyears.store.DocumentStore;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;

@Service
public class TimelineService {

    /**
     * Newest first. Moments without a timestamp go last, ordered by id so repeated reads agree.
     */
    static final Comparator<MomentDocument> NEWEST_FIRST = Comparator
            .comparing(MomentDocument::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(MomentDocument::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final DocumentStore documentStore;
    private final TimelineAccessPolicy accessPolicy;

    public TimelineService(DocumentStore documentStore, TimelineAccessPolicy accessPolicy) {
        this.documentStore = documentStore;
        this.accessPolicy = accessPolicy;
    }

    public Mono<TimelineResponse> getTimeline(String kidId, boolean includePrivate, String grandparentEmail) {
        return documentStore.findById(KidDocument.COLLECTION, kidId, KidDocument.class)
                .switchIfEmpty(Mono.error(() -> new KidNotFoundException(kidId)))
                .flatMap(kid -> Mono.deferContextual(context -> {
                    AccessDecision decision = RequestCorrelation.withMdc(context,
                            () -> accessPolicy.decide(kid, includePrivate, grandparentEmail));
                    return documentStore.query(MomentDocument.COLLECTION,
                                    decision.query().toFilter(), MomentDocument.class)
                            .collectSortedList(NEWEST_FIRST)
                            .map(moments -> toResponse(kid, moments, decision.includesPrivate()));
                }));
    }

    private TimelineResponse toResponse(KidDocument kid, List<MomentDocument> moments, boolean includesPrivate) {
        return new TimelineResponse(
                KidResponse.from(kid),
                moments.stream().map(MomentResponse::from).toList(),
                includesPrivate
        );
    }
}
