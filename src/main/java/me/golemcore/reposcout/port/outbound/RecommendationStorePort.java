package me.golemcore.reposcout.port.outbound;

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

import me.golemcore.reposcout.domain.model.CandidateSignature;
import me.golemcore.reposcout.domain.model.RecommendationResult;
import me.golemcore.reposcout.domain.model.RecommendationSession;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Session and cache store with tiered expiry.
 *
 * <p>
 * Three tiers share one store:
 * <ul>
 * <li>sessions - running state of a recommendation thread, evicted after the
 * session TTL or on explicit close</li>
 * <li>request results - materialized results keyed by request fingerprint,
 * short-lived (minutes)</li>
 * <li>signatures - per-candidate signatures keyed by policy fingerprint,
 * long-lived (hours)</li>
 * </ul>
 *
 * <p>
 * Expired entries are never returned, even before {@link #evictExpired()}
 * removes them.
 */
public interface RecommendationStorePort {

    CompletableFuture<Optional<RecommendationSession>> getSession(String sessionId);

    CompletableFuture<Void> putSession(RecommendationSession session, Duration ttl);

    /**
     * Close a session. Completes with {@code true} when a session existed.
     */
    CompletableFuture<Boolean> deleteSession(String sessionId);

    /**
     * Remove expired entries from every tier.
     *
     * @return number of entries removed
     */
    CompletableFuture<Integer> evictExpired();

    CompletableFuture<Optional<RecommendationResult>> getCachedResult(String key);

    CompletableFuture<Void> putCachedResult(String key, RecommendationResult result, Duration ttl);

    /**
     * Cached signatures for the given candidates under a policy. Candidates
     * without a live entry are absent from the map.
     */
    CompletableFuture<Map<String, CandidateSignature>> getSignatures(String policyFingerprint,
            Collection<String> candidateIds);

    CompletableFuture<Void> putSignatures(String policyFingerprint, List<CandidateSignature> signatures,
            Duration ttl);
}
