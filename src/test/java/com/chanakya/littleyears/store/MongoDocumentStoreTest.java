package com.chanakya.littleyears.store;

import com.chanakya.littleyears.exception.InvalidIdentifierException;
import com.chanakya.littleyears.exception.StorageUnavailableException;
import com.chanakya.littleyears.model.document.KidDocument;
import com.chanakya.littleyears.model.document.MomentDocument;
import com.mongodb.client.result.DeleteResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("MongoDocumentStore")
class MongoDocumentStoreTest {

    private static final String KID_ID = "65f1c0a1b2c3d4e5f6a7b8c9";

    @Mock
    private ReactiveMongoTemplate mongoTemplate;

    private MongoDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new MongoDocumentStore(mongoTemplate);
    }

    @Test
    @DisplayName("insert should emit the id assigned by the database")
    void insertEmitsAssignedId() {
        KidDocument kid = KidDocument.builder().name("Ava").parentEmail("parent@littleyears.demo").build();
        KidDocument saved = KidDocument.builder().id(KID_ID).name("Ava").parentEmail("parent@littleyears.demo").build();
        when(mongoTemplate.insert(kid, KidDocument.COLLECTION)).thenReturn(Mono.just(saved));

        StepVerifier.create(store.insert(KidDocument.COLLECTION, kid))
                .expectNext(KID_ID)
                .verifyComplete();
    }

    @Test
    @DisplayName("findById should reject malformed ids without touching the database")
    void findByIdRejectsMalformedId() {
        StepVerifier.create(store.findById(KidDocument.COLLECTION, "not-an-id", KidDocument.class))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(InvalidIdentifierException.class)
                        .hasMessage("Invalid id: not-an-id"))
                .verify();

        StepVerifier.create(store.findById(KidDocument.COLLECTION, null, KidDocument.class))
                .expectError(InvalidIdentifierException.class)
                .verify();

        verifyNoInteractions(mongoTemplate);
    }

    @Test
    @DisplayName("findById should complete empty when the record is absent")
    void findByIdCompletesEmptyWhenAbsent() {
        when(mongoTemplate.findById(KID_ID, KidDocument.class, KidDocument.COLLECTION)).thenReturn(Mono.empty());

        StepVerifier.create(store.findById(KidDocument.COLLECTION, KID_ID, KidDocument.class))
                .verifyComplete();
    }

    @Test
    @DisplayName("query should translate the filter into a Mongo query")
    void queryTranslatesFilter() {
        ArgumentCaptor<Query> captor = ArgumentCaptor.forClass(Query.class);
        when(mongoTemplate.find(captor.capture(), eq(MomentDocument.class), eq(MomentDocument.COLLECTION)))
                .thenReturn(Flux.empty());

        StepVerifier.create(store.query(MomentDocument.COLLECTION,
                        DocumentFilter.where("kidId", KID_ID), MomentDocument.class))
                .verifyComplete();

        assertThat(captor.getValue().getQueryObject()).containsEntry("kidId", KID_ID);
    }

    @Test
    @DisplayName("deleteMany should emit the deleted count")
    void deleteManyEmitsCount() {
        when(mongoTemplate.remove(any(Query.class), eq(KidDocument.class), eq(KidDocument.COLLECTION)))
                .thenReturn(Mono.just(DeleteResult.acknowledged(2)));

        StepVerifier.create(store.deleteMany(KidDocument.COLLECTION,
                        DocumentFilter.where("name", "Ava"), KidDocument.class))
                .expectNext(2L)
                .verifyComplete();
    }

    @Test
    @DisplayName("connection failures should surface as StorageUnavailableException")
    void connectionFailuresSurfaceAsStorageUnavailable() {
        when(mongoTemplate.find(any(Query.class), eq(KidDocument.class), eq(KidDocument.COLLECTION)))
                .thenReturn(Flux.error(new DataAccessResourceFailureException("Timed out")));

        StepVerifier.create(store.query(KidDocument.COLLECTION, DocumentFilter.all(), KidDocument.class))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(StorageUnavailableException.class);
                    assertThat(error.getCause()).isInstanceOf(DataAccessResourceFailureException.class);
                })
                .verify();
    }

    @Test
    @DisplayName("other failures should propagate unchanged")
    void otherFailuresPropagateUnchanged() {
        IllegalStateException failure = new IllegalStateException("boom");
        when(mongoTemplate.getCollectionNames()).thenReturn(Flux.error(failure));

        StepVerifier.create(store.collectionNames())
                .expectErrorMatches(error -> error == failure)
                .verify();
    }
}
