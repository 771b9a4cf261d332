package com.chanakya.littleyears.service;

import com.chanakya.littleyears.model.document.KidDocument;
import com.chanakya.littleyears.model.dto.response.KidResponse;
import com.chanakya.littleyears.store.DocumentFilter;
import com.chanakya.littleyears.store.DocumentStore;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

@Service
public class KidService {

    static final String ALLOWED_GRANDPARENTS = "allowedGrandparents";

    private final DocumentStore documentStore;

    public KidService(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    /**
     * Lists kids, narrowed to those sharing with {@code grandparent} when one is given.
     */
    public Flux<KidResponse> listKids(String grandparent) {
        DocumentFilter filter = (grandparent == null || grandparent.isEmpty())
                ? DocumentFilter.all()
                : DocumentFilter.all().andContains(ALLOWED_GRANDPARENTS, grandparent);
        return documentStore.query(KidDocument.COLLECTION, filter, KidDocument.class)
                .map(KidResponse::from);
    }
}
