package me.golemcore.reposcout.domain.service;

import me.golemcore.reposcout.domain.exception.UnresolvableConflictException;
import me.golemcore.reposcout.domain.model.ConflictResolution;
import me.golemcore.reposcout.domain.model.DetectedConflict;
import me.golemcore.reposcout.domain.model.Objective;
import me.golemcore.reposcout.domain.model.ObjectiveDirection;
import me.golemcore.reposcout.domain.model.ResolvedPolicy;
import me.golemcore.reposcout.testsupport.PolicyFixtures;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConflictResolverTest {

    private final ConflictDetector detector = new ConflictDetector(PolicyFixtures.CONFLICTS);
    private final ConflictResolver resolver = new ConflictResolver(PolicyFixtures.REGISTRY);

    @Test
    void shouldReportFullHarmonyWithoutConflicts() {
        List<Objective> objectives = PolicyFixtures.objectives(Map.of("security", 0.6, "documentation", 0.4));

        ResolvedPolicy policy = resolver.resolve(objectives, List.of(), 0.5);

        assertEquals(1.0, policy.getHarmonyScore(), 0.0);
        assertEquals(0.6, policy.weightOf("security"), 1e-12);
        assertEquals(0.4, policy.weightOf("documentation"), 1e-12);
        assertTrue(policy.getResolutions().isEmpty());
    }

    @Test
    void shouldResolveEqualHardConflictIntoModerateHarmony() {
        List<Objective> objectives = PolicyFixtures.objectives(Map.of("breadth", 0.9, "precision", 0.9));

        ResolvedPolicy policy = resolver.resolve(objectives, detector.detect(objectives), 0.5);

        assertTrue(policy.getHarmonyScore() > 0.5 && policy.getHarmonyScore() < 0.9,
                "harmony " + policy.getHarmonyScore());
        assertTrue(Math.abs(policy.weightOf("breadth") - policy.weightOf("precision")) < 0.2);
        assertEquals(1, policy.getResolutions().size());
    }

    @Test
    void shouldShrinkGapOfHardConflict() {
        List<Objective> objectives = PolicyFixtures.objectives(Map.of("breadth", 0.8, "precision", 0.2));

        ResolvedPolicy policy = resolver.resolve(objectives, detector.detect(objectives), 0.0);

        ConflictResolution resolution = policy.getResolutions().get(0);
        assertTrue(resolution.gapAfter() < resolution.gapBefore());
        assertEquals(resolution.getFirstWeightBefore() + resolution.getSecondWeightBefore(),
                resolution.getFirstWeightAfter() + resolution.getSecondWeightAfter(), 1e-12);
    }

    @Test
    void shouldFailBelowMinimumHarmonyWithOffendingPairs() {
        List<Objective> objectives = PolicyFixtures.objectives(Map.of("breadth", 0.9, "precision", 0.9));
        List<DetectedConflict> conflicts = detector.detect(objectives);

        UnresolvableConflictException ex = assertThrows(UnresolvableConflictException.class,
                () -> resolver.resolve(objectives, conflicts, 0.7));

        assertEquals(conflicts, ex.getOffendingPairs());
        assertTrue(ex.getHarmonyScore() < 0.7);
        assertEquals(0.7, ex.getMinimumHarmony(), 0.0);
    }

    @Test
    void shouldOrderTieBreakByWeightThenRegistration() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("innovation", 0.25);
        weights.put("security", 0.5);
        weights.put("relevance", 0.25);

        ResolvedPolicy policy = resolver.resolve(PolicyFixtures.objectives(weights), List.of(), 0.5);

        assertEquals(List.of("security", "relevance", "innovation"), policy.getTieBreakOrder());
    }

    @Test
    void shouldLayOutOrientationsOnDimensionBasis() {
        ResolvedPolicy policy = PolicyFixtures.relevancePolicy();

        assertEquals(PolicyFixtures.REGISTRY.dimensions(), policy.getDimensions());
        assertEquals(ObjectiveDirection.MINIMIZE,
                policy.getOrientations().get(PolicyFixtures.REGISTRY.orderOf("integration_effort")));
    }

    @Test
    void shouldProduceStableFingerprints() {
        ResolvedPolicy first = PolicyFixtures.policy(Map.of("speed", 0.5, "security", 0.5));
        ResolvedPolicy second = PolicyFixtures.policy(Map.of("security", 0.5, "speed", 0.5));
        ResolvedPolicy other = PolicyFixtures.policy(Map.of("speed", 0.6, "security", 0.4));

        assertEquals(first.getFingerprint(), second.getFingerprint());
        assertNotEquals(first.getFingerprint(), other.getFingerprint());
    }
}
