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
import me.golemcore.reposcout.domain.exception.RecommendationException;
import me.golemcore.reposcout.domain.model.CandidateProfile;
import me.golemcore.reposcout.domain.model.CandidateSignature;
import me.golemcore.reposcout.domain.model.DetectedConflict;
import me.golemcore.reposcout.domain.model.Diagnostic;
import me.golemcore.reposcout.domain.model.DiagnosticKind;
import me.golemcore.reposcout.domain.model.Objective;
import me.golemcore.reposcout.domain.model.PipelineSettings;
import me.golemcore.reposcout.domain.model.ProcessingPreset;
import me.golemcore.reposcout.domain.model.RecommendationRequest;
import me.golemcore.reposcout.domain.model.RecommendationResult;
import me.golemcore.reposcout.domain.model.RecommendationSession;
import me.golemcore.reposcout.domain.model.ResolvedPolicy;
import me.golemcore.reposcout.domain.model.ScoringBatch;
import me.golemcore.reposcout.infrastructure.config.ReposcoutProperties;
import me.golemcore.reposcout.infrastructure.metrics.RecommendationMetrics;
import me.golemcore.reposcout.port.outbound.CandidateSourcePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs the recommendation pipeline for one request.
 *
 * <p>
 * Stages: extract objectives, detect and resolve conflicts, score candidates
 * in parallel, aggregate, materialize. The store is consulted at stage
 * boundaries:
 * <ul>
 * <li>signatures cached for the same policy are reused instead of
 * re-scored</li>
 * <li>requests without a session are answered from the short-lived result
 * cache when possible</li>
 * <li>requests with a session merge into the session's running aggregate,
 * serialized per session id</li>
 * </ul>
 * Objective and conflict failures are thrown before any session state is
 * read or written. Store failures degrade the result instead of failing it; a
 * session that could not be read is never written back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationService {

    private final ObjectiveExtractor objectiveExtractor;
    private final ConflictDetector conflictDetector;
    private final ConflictResolver conflictResolver;
    private final CandidateScorer candidateScorer;
    private final ResultAggregator resultAggregator;
    private final OutputMaterializer outputMaterializer;
    private final RecommendationStoreClient storeClient;
    private final SessionCoordinator sessionCoordinator;
    private final CandidateSourcePort candidateSource;
    private final ReposcoutProperties properties;
    private final RecommendationMetrics metrics;
    private final Clock clock;

    public RecommendationResult recommend(RecommendationRequest request) {
        PipelineSettings settings = resolveSettings(request);
        String sessionId = request.hasSession() ? SessionIdValidator.normalizeOrThrow(request.getSessionId()) : null;
        ResolvedPolicy policy = resolvePolicy(request, settings);

        if (sessionId == null) {
            return recommendWithoutSession(policy, settings);
        }
        return sessionCoordinator.runExclusive(sessionId, () -> recommendInSession(sessionId, policy, settings));
    }

    /**
     * Close a session explicitly.
     *
     * @return {@code true} when the session existed
     */
    public boolean closeSession(String sessionId) {
        String id = SessionIdValidator.normalizeOrThrow(sessionId);
        boolean closed = sessionCoordinator.runExclusive(id, () -> storeClient.closeSession(id));
        log.info("[Session] Close requested for {} (existed={})", id, closed);
        return closed;
    }

    PipelineSettings resolveSettings(RecommendationRequest request) {
        ReposcoutProperties.PipelineProperties pipeline = properties.getPipeline();
        ReposcoutProperties.ScoringProperties scoring = properties.getScoring();
        ProcessingPreset preset = request.getPreset() != null ? request.getPreset() : pipeline.getDefaultPreset();

        PipelineSettings settings = PipelineSettings.forPreset(preset, Runtime.getRuntime().availableProcessors());
        if (preset == ProcessingPreset.BALANCED) {
            settings = settings.toBuilder()
                    .minHarmony(pipeline.getMinHarmony())
                    .resultLimit(pipeline.getResultLimit())
                    .scoringTimeout(scoring.getTimeout())
                    .parallelism(scoring.getParallelism() > 0 ? scoring.getParallelism() : settings.getParallelism())
                    .build();
        }

        int parallelism = request.getParallelism() != null ? request.getParallelism() : settings.getParallelism();
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        int limit = request.getLimit() != null ? request.getLimit() : settings.getResultLimit();
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, got " + limit);
        }
        return settings.toBuilder()
                .parallelism(Math.min(parallelism, Math.max(1, scoring.getMaxParallelism())))
                .resultLimit(limit)
                .build();
    }

    private ResolvedPolicy resolvePolicy(RecommendationRequest request, PipelineSettings settings) {
        try {
            List<Objective> objectives = objectiveExtractor.extract(request.getIntent(),
                    request.getObjectiveOverrides(), properties.getPipeline().isSubstituteUnknown());
            List<DetectedConflict> conflicts = conflictDetector.detect(objectives);
            ResolvedPolicy policy = conflictResolver.resolve(objectives, conflicts, settings.getMinHarmony());
            metrics.recordHarmony(policy.getHarmonyScore());
            return policy;
        } catch (RecommendationException e) {
            metrics.recordResolutionFailure(e.getKind());
            throw e;
        }
    }

    private RecommendationResult recommendWithoutSession(ResolvedPolicy policy, PipelineSettings settings) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        String cacheKey = TelemetrySupport.fingerprint(policy.getFingerprint(),
                String.valueOf(settings.getResultLimit()));

        Optional<RecommendationResult> cached = storeClient.cachedResult(cacheKey, diagnostics);
        if (cached.isPresent()) {
            log.debug("[Pipeline] Serving cached result {}", cacheKey);
            return cached.get().toBuilder().cached(true).build();
        }

        ScoredCandidates scored = scoreCandidates(policy, settings, diagnostics);
        List<CandidateSignature> ranked = resultAggregator.aggregate(settings.getResultLimit(), scored.signatures());
        RecommendationResult result = materialize(null, policy, ranked, scored.profiles(), diagnostics);

        if (!result.isDegraded() && !scored.partial()) {
            int before = diagnostics.size();
            storeClient.cacheResult(cacheKey, result, diagnostics);
            if (diagnostics.size() > before) {
                result = materialize(null, policy, ranked, scored.profiles(), diagnostics);
            }
        }
        return result;
    }

    private RecommendationResult recommendInSession(String sessionId, ResolvedPolicy policy,
            PipelineSettings settings) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        Instant now = Instant.now(clock);
        int before = diagnostics.size();
        Optional<RecommendationSession> existing = storeClient.loadSession(sessionId, diagnostics)
                .filter(session -> !session.isExpired(now));
        boolean readFailed = diagnostics.size() > before;

        List<CandidateSignature> previous = List.of();
        if (existing.isPresent()) {
            RecommendationSession session = existing.get();
            if (session.getPolicy() != null && policy.getFingerprint().equals(session.getPolicy().getFingerprint())) {
                previous = session.getAggregate();
            } else {
                log.info("[Session] Policy changed for session {}, resetting aggregate", sessionId);
            }
        }

        ScoredCandidates scored = scoreCandidates(policy, settings, diagnostics);
        int aggregateLimit = Math.max(properties.getPipeline().getSessionAggregateLimit(), settings.getResultLimit());
        List<CandidateSignature> aggregate = resultAggregator.aggregate(aggregateLimit, previous,
                scored.signatures());
        List<CandidateSignature> ranked = resultAggregator.aggregate(settings.getResultLimit(), aggregate);

        if (readFailed) {
            // The stored session may still hold an aggregate; answer from this request only.
            log.warn("[Session] Session {} could not be read, skipping save", sessionId);
            return materialize(sessionId, policy, ranked, scored.profiles(), diagnostics);
        }

        RecommendationSession.RecommendationSessionBuilder builder = existing
                .map(RecommendationSession::toBuilder)
                .orElseGet(() -> RecommendationSession.builder().id(sessionId).createdAt(now));
        RecommendationSession updated = builder
                .policy(policy)
                .aggregate(aggregate)
                .requestCount(existing.map(RecommendationSession::getRequestCount).orElse(0) + 1)
                .updatedAt(now)
                .expiresAt(now.plus(properties.getStore().getSessionTtl()))
                .build();
        if (storeClient.saveSession(updated, diagnostics)) {
            log.debug("[Session] Session {} saved (request #{}, {} aggregated)", sessionId,
                    updated.getRequestCount(), aggregate.size());
        }

        return materialize(sessionId, policy, ranked, scored.profiles(), diagnostics);
    }

    private ScoredCandidates scoreCandidates(ResolvedPolicy policy, PipelineSettings settings,
            List<Diagnostic> diagnostics) {
        List<CandidateProfile> candidates = candidateSource.fetchCandidates(policy.getObjectives());
        Map<String, CandidateProfile> profiles = new LinkedHashMap<>();
        for (CandidateProfile candidate : candidates) {
            if (candidate != null && candidate.getId() != null) {
                profiles.putIfAbsent(candidate.getId(), candidate);
            }
        }

        Map<String, CandidateSignature> cached = storeClient.cachedSignatures(policy.getFingerprint(),
                profiles.keySet(), diagnostics);
        List<CandidateSignature> reused = new ArrayList<>();
        List<CandidateProfile> pending = new ArrayList<>();
        for (CandidateProfile candidate : candidates) {
            CandidateSignature hit = candidate != null && candidate.getId() != null
                    ? cached.get(candidate.getId())
                    : null;
            if (hit != null && Arrays.equals(hit.getMetrics(), candidate.getMetrics())) {
                reused.add(hit);
            } else {
                pending.add(candidate);
            }
        }

        ScoringBatch batch = candidateScorer.score(policy, pending, settings.getParallelism(),
                settings.getScoringTimeout(), new ScoringCancellation());
        metrics.recordScoring(batch);
        diagnostics.addAll(batch.getDiagnostics());
        storeClient.cacheSignatures(policy.getFingerprint(), batch.getSignatures(), diagnostics);

        log.debug("[Pipeline] Policy {}: {} candidate(s), {} reused, {} scored", policy.getFingerprint(),
                candidates.size(), reused.size(), batch.getSignatures().size());
        List<CandidateSignature> signatures = resultAggregator.aggregate(Integer.MAX_VALUE, reused,
                batch.getSignatures());
        return new ScoredCandidates(signatures, profiles, batch.isPartial());
    }

    private RecommendationResult materialize(String sessionId, ResolvedPolicy policy,
            List<CandidateSignature> ranked, Map<String, CandidateProfile> profiles, List<Diagnostic> diagnostics) {
        boolean degraded = diagnostics.stream().anyMatch(d -> d.getKind() == DiagnosticKind.CACHE_UNAVAILABLE);
        return outputMaterializer.materialize(sessionId, policy, ranked, profiles, List.copyOf(diagnostics),
                degraded);
    }

    private record ScoredCandidates(List<CandidateSignature> signatures, Map<String, CandidateProfile> profiles,
            boolean partial) {
    }
}
