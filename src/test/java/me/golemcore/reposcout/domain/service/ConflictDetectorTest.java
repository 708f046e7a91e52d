package me.golemcore.reposcout.domain.service;

import me.golemcore.reposcout.domain.model.ConflictSeverity;
import me.golemcore.reposcout.domain.model.DetectedConflict;
import me.golemcore.reposcout.testsupport.PolicyFixtures;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConflictDetectorTest {

    private final ConflictDetector detector = new ConflictDetector(PolicyFixtures.CONFLICTS);

    @Test
    void shouldReturnEmptyListWithoutConflicts() {
        assertTrue(detector.detect(PolicyFixtures.objectives(Map.of("security", 0.5, "documentation", 0.5)))
                .isEmpty());
    }

    @Test
    void shouldDetectConflictsInCanonicalOrder() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put("speed", 0.3);
        weights.put("thoroughness", 0.3);
        weights.put("breadth", 0.2);
        weights.put("precision", 0.2);

        List<DetectedConflict> conflicts = detector.detect(PolicyFixtures.objectives(weights));

        assertEquals(List.of("breadth vs precision (hard)", "breadth vs speed (moderate)",
                "speed vs thoroughness (hard)"),
                conflicts.stream().map(DetectedConflict::describe).toList());
        assertEquals(ConflictSeverity.HARD, conflicts.get(0).getSeverity());
    }
}
