package com.chanakya.littleyears.service;

import com.chanakya.littleyears.config.RequestCorrelation;
import com.chanakya.littleyears.model.dto.response.DiagnosticsResponse;
import com.chanakya.littleyears.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Connectivity report for operators. Database failures are reported in the body, never raised.
 */
@Service
public class DiagnosticsService {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsService.class);

    static final String BACKEND_RUNNING = "running";
    static final String DATABASE_CONNECTED = "connected";
    private static final int MAX_ERROR_LENGTH = 80;

    private final DocumentStore documentStore;

    public DiagnosticsService(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    public Mono<DiagnosticsResponse> checkDatabase() {
        return documentStore.collectionNames()
                .sort()
                .collectList()
                .map(names -> new DiagnosticsResponse(BACKEND_RUNNING, DATABASE_CONNECTED, names))
                .onErrorResume(e -> Mono.deferContextual(context -> {
                    RequestCorrelation.runWithMdc(context,
                            () -> log.warn("event=database_check_failed error={}", e.getMessage()));
                    return Mono.just(new DiagnosticsResponse(BACKEND_RUNNING, "error: " + truncate(e), null));
                }));
    }

    private static String truncate(Throwable e) {
        String message = String.valueOf(e.getMessage());
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
