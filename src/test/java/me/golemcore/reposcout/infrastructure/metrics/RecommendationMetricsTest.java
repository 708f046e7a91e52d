package me.golemcore.reposcout.infrastructure.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import me.golemcore.reposcout.domain.model.CandidateSignature;
import me.golemcore.reposcout.domain.model.Diagnostic;
import me.golemcore.reposcout.domain.model.RecommendationFailureKind;
import me.golemcore.reposcout.domain.model.ScoringBatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class RecommendationMetricsTest {

    private SimpleMeterRegistry registry;
    private RecommendationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RecommendationMetrics(registry);
    }

    @Test
    void shouldRecordHarmonyDistribution() {
        metrics.recordHarmony(0.65);
        metrics.recordHarmony(1.0);

        assertEquals(2, registry.get(RecommendationMetrics.HARMONY_SCORE).summary().count());
        assertEquals(1.65, registry.get(RecommendationMetrics.HARMONY_SCORE).summary().totalAmount(), 1e-9);
    }

    @Test
    void shouldCountResolutionFailuresByKind() {
        metrics.recordResolutionFailure(RecommendationFailureKind.UNKNOWN_OBJECTIVE);
        metrics.recordResolutionFailure(RecommendationFailureKind.UNKNOWN_OBJECTIVE);
        metrics.recordResolutionFailure(RecommendationFailureKind.UNRESOLVABLE_CONFLICT);

        assertEquals(2.0, registry.get(RecommendationMetrics.RESOLUTION_FAILURES)
                .tag("kind", "unknown_objective").counter().count(), 0.0);
        assertEquals(1.0, registry.get(RecommendationMetrics.RESOLUTION_FAILURES)
                .tag("kind", "unresolvable_conflict").counter().count(), 0.0);
    }

    @Test
    void shouldCountScoringOutcomes() {
        ScoringBatch batch = ScoringBatch.builder()
                .signature(CandidateSignature.builder().candidateId("a").metrics(new double[] { 0.5 }).build())
                .signature(CandidateSignature.builder().candidateId("b").metrics(new double[] { 0.5 }).build())
                .diagnostic(Diagnostic.malformedCandidate("c", "metric vector missing"))
                .submitted(5)
                .unscored(2)
                .elapsed(Duration.ofMillis(40))
                .build();

        metrics.recordScoring(batch);

        assertEquals(2.0, registry.get(RecommendationMetrics.SCORER_CANDIDATES)
                .tag("outcome", "scored").counter().count(), 0.0);
        assertEquals(1.0, registry.get(RecommendationMetrics.SCORER_CANDIDATES)
                .tag("outcome", "malformed").counter().count(), 0.0);
        assertEquals(2.0, registry.get(RecommendationMetrics.SCORER_CANDIDATES)
                .tag("outcome", "skipped").counter().count(), 0.0);
        assertEquals(1, registry.get(RecommendationMetrics.SCORER_DURATION).timer().count());
    }

    @Test
    void shouldOnlyRegisterOutcomesThatOccurred() {
        metrics.recordScoring(ScoringBatch.builder().submitted(0).build());

        assertNull(registry.find(RecommendationMetrics.SCORER_CANDIDATES).counter());
        assertEquals(0, registry.get(RecommendationMetrics.SCORER_DURATION).timer().count());
    }

    @Test
    void shouldCountCacheRequestsPerTierAndResult() {
        metrics.recordCacheRequest(RecommendationMetrics.TIER_SIGNATURE, RecommendationMetrics.RESULT_HIT);
        metrics.recordCacheRequest(RecommendationMetrics.TIER_SIGNATURE, RecommendationMetrics.RESULT_HIT);
        metrics.recordCacheRequest(RecommendationMetrics.TIER_SIGNATURE, RecommendationMetrics.RESULT_MISS);
        metrics.recordCacheRequest(RecommendationMetrics.TIER_SESSION, RecommendationMetrics.RESULT_ERROR);

        assertEquals(2.0, registry.get(RecommendationMetrics.CACHE_REQUESTS)
                .tag("tier", "signature").tag("result", "hit").counter().count(), 0.0);
        assertEquals(1.0, registry.get(RecommendationMetrics.CACHE_REQUESTS)
                .tag("tier", "signature").tag("result", "miss").counter().count(), 0.0);
        assertEquals(1.0, registry.get(RecommendationMetrics.CACHE_REQUESTS)
                .tag("tier", "session").tag("result", "error").counter().count(), 0.0);
    }
}
