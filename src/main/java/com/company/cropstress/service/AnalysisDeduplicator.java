package com.company.cropstress.service;

import com.company.cropstress.domain.AnalysisKey;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * At most one computation in flight per analysis key. Callers arriving while it runs share its
 * outcome; the key is released as soon as the computation settles, so nothing is cached.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnalysisDeduplicator {

    private final ConcurrentMap<AnalysisKey, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    private final MeterRegistry meterRegistry;

    @SuppressWarnings("unchecked")
    public <T> T execute(AnalysisKey key, Supplier<T> computation) {
        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(key, mine);

        if (existing != null) {
            log.info("Duplicate analysis request for {}, awaiting in-flight computation", key);
            meterRegistry.counter("cropstress.analyses.duplicate").increment();
            return (T) await(existing);
        }

        try {
            T result = computation.get();
            mine.complete(result);
            return result;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private static Object await(CompletableFuture<Object> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }
}
