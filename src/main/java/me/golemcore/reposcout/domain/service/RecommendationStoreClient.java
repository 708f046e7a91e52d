package me.golemcore.reposcout.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reposcout.domain.exception.StoreUnavailableException;
import me.golemcore.reposcout.domain.model.CandidateSignature;
import me.golemcore.reposcout.domain.model.Diagnostic;
import me.golemcore.reposcout.domain.model.RecommendationResult;
import me.golemcore.reposcout.domain.model.RecommendationSession;
import me.golemcore.reposcout.infrastructure.config.ReposcoutProperties;
import me.golemcore.reposcout.infrastructure.metrics.RecommendationMetrics;
import me.golemcore.reposcout.port.outbound.RecommendationStorePort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Bounded access to the {@link RecommendationStorePort}.
 *
 * <p>
 * Every call is limited by {@code reposcout.store.timeout} and retried once
 * with exponential backoff. Pipeline calls never fail the request: a store
 * failure is logged, counted and reported as a {@code CACHE_UNAVAILABLE}
 * diagnostic, and the caller continues with request-scoped state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationStoreClient {

    private static final int MAX_RETRIES = 1;

    private final RecommendationStorePort storePort;
    private final ReposcoutProperties properties;
    private final RecommendationMetrics metrics;

    public Optional<RecommendationSession> loadSession(String sessionId, List<Diagnostic> diagnostics) {
        StoreResult<Optional<RecommendationSession>> result = invoke(RecommendationMetrics.TIER_SESSION,
                "getSession", () -> storePort.getSession(sessionId), diagnostics);
        Optional<RecommendationSession> session = result.valueOr(Optional.empty());
        recordLookup(RecommendationMetrics.TIER_SESSION, result, session.isPresent());
        return session;
    }

    /**
     * @return {@code true} when the session was persisted
     */
    public boolean saveSession(RecommendationSession session, List<Diagnostic> diagnostics) {
        return !invoke(RecommendationMetrics.TIER_SESSION, "putSession",
                () -> storePort.putSession(session, properties.getStore().getSessionTtl()), diagnostics).failed();
    }

    /**
     * Explicit close requested by the caller; failures propagate.
     *
     * @return {@code true} when a session existed
     */
    public boolean closeSession(String sessionId) {
        Boolean deleted = execute("deleteSession", () -> storePort.deleteSession(sessionId)).block();
        return Boolean.TRUE.equals(deleted);
    }

    public int evictExpired() {
        Integer removed = execute("evictExpired", storePort::evictExpired).block();
        return removed != null ? removed : 0;
    }

    public Optional<RecommendationResult> cachedResult(String key, List<Diagnostic> diagnostics) {
        StoreResult<Optional<RecommendationResult>> result = invoke(RecommendationMetrics.TIER_REQUEST,
                "getCachedResult", () -> storePort.getCachedResult(key), diagnostics);
        Optional<RecommendationResult> cached = result.valueOr(Optional.empty());
        recordLookup(RecommendationMetrics.TIER_REQUEST, result, cached.isPresent());
        return cached;
    }

    public void cacheResult(String key, RecommendationResult value, List<Diagnostic> diagnostics) {
        invoke(RecommendationMetrics.TIER_REQUEST, "putCachedResult",
                () -> storePort.putCachedResult(key, value, properties.getStore().getRequestTtl()), diagnostics);
    }

    public Map<String, CandidateSignature> cachedSignatures(String policyFingerprint, Collection<String> candidateIds,
            List<Diagnostic> diagnostics) {
        StoreResult<Map<String, CandidateSignature>> result = invoke(RecommendationMetrics.TIER_SIGNATURE,
                "getSignatures", () -> storePort.getSignatures(policyFingerprint, candidateIds), diagnostics);
        Map<String, CandidateSignature> found = result.valueOr(Map.of());
        recordLookup(RecommendationMetrics.TIER_SIGNATURE, result, !found.isEmpty());
        return found;
    }

    public void cacheSignatures(String policyFingerprint, List<CandidateSignature> signatures,
            List<Diagnostic> diagnostics) {
        if (signatures.isEmpty()) {
            return;
        }
        invoke(RecommendationMetrics.TIER_SIGNATURE, "putSignatures",
                () -> storePort.putSignatures(policyFingerprint, signatures, properties.getStore().getSignatureTtl()),
                diagnostics);
    }

    <T> Mono<T> execute(String operation, Supplier<CompletableFuture<T>> call) {
        ReposcoutProperties.StoreProperties store = properties.getStore();
        return Mono.defer(() -> Mono.fromFuture(call.get()))
                .timeout(store.getTimeout())
                .retryWhen(Retry.backoff(MAX_RETRIES, store.getFirstBackoff())
                        .doBeforeRetry(signal -> log.debug("[Store] Retrying {} (attempt {}): {}",
                                operation, signal.totalRetries() + 1, signal.failure().toString()))
                        .onRetryExhaustedThrow((spec, signal) -> new StoreUnavailableException(operation,
                                signal.failure())));
    }

    private <T> StoreResult<T> invoke(String tier, String operation, Supplier<CompletableFuture<T>> call,
            List<Diagnostic> diagnostics) {
        try {
            return new StoreResult<>(execute(operation, call).block(), false);
        } catch (StoreUnavailableException e) {
            log.warn("[Store] {} unavailable, continuing with request-scoped state: {}", operation, e.getMessage());
            metrics.recordCacheRequest(tier, RecommendationMetrics.RESULT_ERROR);
            diagnostics.add(Diagnostic.cacheUnavailable(operation, e.getMessage()));
            return new StoreResult<>(null, true);
        }
    }

    private void recordLookup(String tier, StoreResult<?> result, boolean hit) {
        if (!result.failed()) {
            metrics.recordCacheRequest(tier, hit ? RecommendationMetrics.RESULT_HIT : RecommendationMetrics.RESULT_MISS);
        }
    }

    private record StoreResult<T>(T value, boolean failed) {

        T valueOr(T fallback) {
            return value != null ? value : fallback;
        }
    }
}
