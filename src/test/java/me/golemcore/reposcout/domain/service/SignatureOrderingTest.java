package me.golemcore.reposcout.domain.service;

import me.golemcore.reposcout.domain.model.CandidateSignature;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class SignatureOrderingTest {

    @Test
    void shouldBreakTiesWithinBucketByTieBreakRank() {
        CandidateSignature higherScore = signature("a", 0.5000000004, 1);
        CandidateSignature strongerObjective = signature("b", 0.5000000001, 0);
        assertEquals(SignatureOrdering.scoreBucket(0.5000000004), SignatureOrdering.scoreBucket(0.5000000001));

        List<CandidateSignature> ranked = SignatureOrdering.rank(List.of(higherScore, strongerObjective), 2);

        assertEquals(List.of("b", "a"), ids(ranked));
    }

    @Test
    void shouldOrderByScoreAcrossBucketBoundary() {
        CandidateSignature belowBoundary = signature("a", 0.5000000004, 0);
        CandidateSignature aboveBoundary = signature("b", 0.5000000006, 1);
        assertNotEquals(SignatureOrdering.scoreBucket(0.5000000004), SignatureOrdering.scoreBucket(0.5000000006));

        List<CandidateSignature> ranked = SignatureOrdering.rank(List.of(belowBoundary, aboveBoundary), 2);

        assertEquals(List.of("b", "a"), ids(ranked));
    }

    @Test
    void shouldFallBackToCandidateIdForIdenticalSignatures() {
        List<CandidateSignature> ranked = SignatureOrdering.rank(List.of(
                signature("zeta", 0.7, 0),
                signature("alpha", 0.7, 0),
                signature("mid", 0.7, 0)), 2);

        assertEquals(List.of("alpha", "mid"), ids(ranked));
        assertEquals(List.of(1, 2), ranked.stream().map(CandidateSignature::getRank).toList());
    }

    private static CandidateSignature signature(String id, double score, int tieBreakRank) {
        return CandidateSignature.builder()
                .candidateId(id)
                .metrics(new double[] { score })
                .computedScore(score)
                .tieBreakRank(tieBreakRank)
                .build();
    }

    private static List<String> ids(List<CandidateSignature> ranked) {
        return ranked.stream().map(CandidateSignature::getCandidateId).toList();
    }
}
