package me.golemcore.reposcout.domain.service;

import me.golemcore.reposcout.domain.model.CandidateProfile;
import me.golemcore.reposcout.domain.model.CandidateSignature;
import me.golemcore.reposcout.domain.model.Diagnostic;
import me.golemcore.reposcout.domain.model.RankedRecommendation;
import me.golemcore.reposcout.domain.model.RecommendationResult;
import me.golemcore.reposcout.domain.model.ResolvedPolicy;
import me.golemcore.reposcout.testsupport.PolicyFixtures;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutputMaterializerTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final OutputMaterializer materializer = new OutputMaterializer(
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));

    @Test
    void shouldClassifyRecommendationTypes() {
        assertEquals(OutputMaterializer.QUICK_INTEGRATION,
                OutputMaterializer.recommendationType(0.95, 0.1, "security"));
        assertEquals(OutputMaterializer.HIGH_VALUE_INTEGRATION,
                OutputMaterializer.recommendationType(0.95, 0.5, "security"));
        assertEquals(OutputMaterializer.SECURITY_ENHANCEMENT,
                OutputMaterializer.recommendationType(0.7, 0.5, "security"));
        assertEquals(OutputMaterializer.STRATEGIC_INTEGRATION,
                OutputMaterializer.recommendationType(0.7, 0.5, "speed"));
    }

    @Test
    void shouldLabelIntegrationEffort() {
        assertEquals(OutputMaterializer.EFFORT_LOW, OutputMaterializer.effortLabel(0.29));
        assertEquals(OutputMaterializer.EFFORT_MEDIUM, OutputMaterializer.effortLabel(0.3));
        assertEquals(OutputMaterializer.EFFORT_HIGH, OutputMaterializer.effortLabel(0.6));
    }

    @Test
    void shouldMaterializeRankedRecommendations() {
        ResolvedPolicy policy = PolicyFixtures.policy(Map.of("security", 0.7, "documentation", 0.3));
        double[] metrics = PolicyFixtures.with(0.5, "security", 0.95);
        CandidateProfile profile = PolicyFixtures.candidate("vault", metrics);
        CandidateSignature signature = CandidateScorer.scoreOne(policy, profile).withRank(1);

        RecommendationResult result = materializer.materialize("s-1", policy, List.of(signature),
                Map.of("vault", profile), List.of(), false);

        assertEquals("s-1", result.getSessionId());
        assertEquals(1.0, result.getHarmonyScore(), 0.0);
        assertEquals(FIXED_NOW, result.getGeneratedAt());
        RankedRecommendation recommendation = result.getRecommendations().get(0);
        assertEquals(1, recommendation.getPriority());
        assertEquals("https://example.org/vault", recommendation.getUrl());
        assertEquals("security", recommendation.getStrongestObjective());
        assertEquals(OutputMaterializer.SECURITY_ENHANCEMENT, recommendation.getRecommendationType());
        assertEquals(OutputMaterializer.EFFORT_MEDIUM, recommendation.getIntegrationEffort());
        assertTrue(recommendation.getImplementationNotes().contains("Wire into CI as a security gate"));
        assertTrue(recommendation.getImplementationNotes().get(0).contains("Maven"));
        assertTrue(result.getNextActions().get(0).startsWith("Evaluate vault first"));
        assertFalse(result.isDegraded());
        assertFalse(result.isCached());
    }

    @Test
    void shouldExplainEachResolvedConflict() {
        ResolvedPolicy policy = PolicyFixtures.policy(Map.of("breadth", 0.5, "precision", 0.5));

        RecommendationResult result = materializer.materialize(null, policy, List.of(), Map.of(), List.of(),
                false);

        assertEquals(2, result.getExplanations().size());
        assertTrue(result.getExplanations().get(0).contains("breadth vs precision (hard)"));
        assertTrue(result.getNextActions().stream().anyMatch(a -> a.startsWith("Relax '")));
        assertNull(result.getSessionId());
    }

    @Test
    void shouldSuggestFixesForMalformedCandidatesAndDegradedStore() {
        ResolvedPolicy policy = PolicyFixtures.relevancePolicy();
        List<Diagnostic> diagnostics = List.of(
                Diagnostic.malformedCandidate("bad", "metric vector is missing"),
                Diagnostic.cacheUnavailable("putSession", "timeout"));

        RecommendationResult result = materializer.materialize("s-2", policy, List.of(), Map.of(), diagnostics,
                true);

        assertTrue(result.isDegraded());
        assertEquals(2, result.getDiagnostics().size());
        assertTrue(result.getNextActions().contains("Fix 1 malformed candidate record(s) in the candidate source"));
        assertTrue(result.getNextActions().stream().anyMatch(a -> a.contains("not persisted")));
    }

    @Test
    void shouldListQuickIntegrations() {
        ResolvedPolicy policy = PolicyFixtures.relevancePolicy();
        CandidateProfile quick = PolicyFixtures.candidate("quick", PolicyFixtures.with(0.6, "integration_effort", 0.1));
        CandidateSignature signature = CandidateScorer.scoreOne(policy, quick).withRank(1);

        RecommendationResult result = materializer.materialize(null, policy, List.of(signature),
                Map.of("quick", quick), List.of(), false);

        assertEquals(OutputMaterializer.QUICK_INTEGRATION,
                result.getRecommendations().get(0).getRecommendationType());
        assertTrue(result.getNextActions().contains("Prototype the quick integration(s) first: quick"));
    }
}
