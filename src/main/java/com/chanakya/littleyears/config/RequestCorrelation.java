package com.chanakya.littleyears.config;

import org.slf4j.MDC;
import reactor.util.context.ContextView;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Carries the request's correlation id from {@link RequestTracingFilter} to log lines written
 * further down the pipeline. The id travels in the Reactor context because a reactive request
 * hops threads; it is copied into the MDC only for the duration of a logging section.
 */
public final class RequestCorrelation {

    public static final String HEADER = "X-Correlation-ID";
    public static final String MDC_KEY = "correlationId";

    private RequestCorrelation() {
    }

    static String resolve(String incoming) {
        return (incoming == null || incoming.isBlank()) ? UUID.randomUUID().toString() : incoming;
    }

    public static <T> T withMdc(ContextView context, Supplier<T> section) {
        if (!context.hasKey(MDC_KEY)) {
            return section.get();
        }
        String previous = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, context.get(MDC_KEY));
        try {
            return section.get();
        } finally {
            if (previous == null) {
                MDC.remove(MDC_KEY);
            } else {
                MDC.put(MDC_KEY, previous);
            }
        }
    }

    public static void runWithMdc(ContextView context, Runnable section) {
        withMdc(context, () -> {
            section.run();
            return null;
        });
    }
}
