package me.golemcore.reposcout.domain.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ObjectiveModelTest {

    @Test
    void shouldMergeKeepingHigherWeightAndExplicitSource() {
        Objective inferred = objective(0.8, ObjectiveSource.INFERRED);
        Objective explicit = objective(0.3, ObjectiveSource.EXPLICIT);

        Objective merged = inferred.mergeWith(explicit);

        assertEquals(0.8, merged.getWeight(), 0.0);
        assertEquals(ObjectiveSource.EXPLICIT, merged.getSource());
        assertEquals(inferred, inferred.mergeWith(null));
    }

    @Test
    void shouldOrderConflictPairCanonically() {
        ConflictPair pair = ConflictPair.of("precision", "breadth", ConflictSeverity.HARD, "scope");

        assertEquals("breadth", pair.getFirst());
        assertEquals("precision", pair.getSecond());
        assertEquals("breadth|precision", pair.key());
        assertTrue(pair.involves("precision"));
        assertFalse(pair.involves("speed"));
    }

    @Test
    void shouldScalePresets() {
        PipelineSettings minimal = PipelineSettings.forPreset(ProcessingPreset.MINIMAL, 8);
        PipelineSettings balanced = PipelineSettings.forPreset(ProcessingPreset.BALANCED, 8);
        PipelineSettings maximal = PipelineSettings.forPreset(ProcessingPreset.MAXIMAL, 8);

        assertEquals(1, minimal.getParallelism());
        assertEquals(8, balanced.getParallelism());
        assertEquals(16, maximal.getParallelism());
        assertEquals(PipelineSettings.DEFAULT_MIN_HARMONY, balanced.getMinHarmony(), 0.0);
        assertEquals(1, PipelineSettings.forPreset(ProcessingPreset.BALANCED, 0).getParallelism());
    }

    @Test
    void shouldCopyMetricVectors() {
        double[] metrics = { 0.1, 0.2 };
        CandidateSignature signature = CandidateSignature.builder().candidateId("a").metrics(metrics).build();

        metrics[0] = 0.9;
        signature.getMetrics()[1] = 0.9;

        assertArrayEquals(new double[] { 0.1, 0.2 }, signature.getMetrics());
        assertEquals(3, signature.withRank(3).getRank());
    }

    @Test
    void shouldExpireSessionAtDeadline() {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");
        RecommendationSession session = RecommendationSession.builder()
                .id("s-1")
                .expiresAt(now.plus(Duration.ofMinutes(1)))
                .build();

        assertFalse(session.isExpired(now));
        assertTrue(session.isExpired(now.plus(Duration.ofMinutes(1))));
        assertTrue(session.getAggregate().isEmpty());
    }

    private static Objective objective(double weight, ObjectiveSource source) {
        return Objective.builder()
                .name("security")
                .weight(weight)
                .direction(ObjectiveDirection.MAXIMIZE)
                .source(source)
                .build();
    }
}
