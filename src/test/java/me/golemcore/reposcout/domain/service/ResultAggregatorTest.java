package me.golemcore.reposcout.domain.service;

import me.golemcore.reposcout.domain.model.CandidateSignature;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ResultAggregatorTest {

    private final ResultAggregator aggregator = new ResultAggregator();

    @Test
    void shouldKeepHighestScorePerCandidate() {
        List<CandidateSignature> first = List.of(signature("a", 0.4, 0), signature("b", 0.9, 0));
        List<CandidateSignature> second = List.of(signature("a", 0.7, 0));

        List<CandidateSignature> merged = aggregator.aggregate(10, first, second);

        assertEquals(List.of("b", "a"), ids(merged));
        assertEquals(0.7, merged.get(1).getComputedScore(), 0.0);
        assertEquals(List.of(1, 2), merged.stream().map(CandidateSignature::getRank).toList());
    }

    @Test
    void shouldBeIdempotent() {
        List<CandidateSignature> input = sample();

        List<CandidateSignature> once = aggregator.aggregate(5, input);
        List<CandidateSignature> twice = aggregator.aggregate(5, once);

        assertEquals(once, twice);
    }

    @Test
    void shouldNotDependOnInputOrder() {
        List<CandidateSignature> input = sample();
        List<CandidateSignature> reversed = new ArrayList<>(input);
        Collections.reverse(reversed);

        assertEquals(aggregator.aggregate(10, input), aggregator.aggregate(10, reversed));
        assertEquals(aggregator.aggregate(10, input.subList(0, 3), input.subList(3, input.size())),
                aggregator.aggregate(10, input.subList(3, input.size()), input.subList(0, 3)));
    }

    @Test
    void shouldPreferLowerTieBreakRankOnEqualScores() {
        CandidateSignature weaker = signature("a", 0.5, 3);
        CandidateSignature stronger = signature("a", 0.5, 1);

        assertEquals(1, aggregator.aggregate(1, List.of(weaker), List.of(stronger)).get(0).getTieBreakRank());
        assertEquals(1, aggregator.aggregate(1, List.of(stronger), List.of(weaker)).get(0).getTieBreakRank());
    }

    @Test
    void shouldTruncateToLimitAndRerank() {
        List<CandidateSignature> ranked = aggregator.aggregate(2, sample());

        assertEquals(2, ranked.size());
        assertEquals(List.of(1, 2), ranked.stream().map(CandidateSignature::getRank).toList());
    }

    @Test
    void shouldOrderEqualScoresByTieBreakRankThenId() {
        List<CandidateSignature> ranked = aggregator.aggregate(10, List.of(
                signature("c", 0.5, 0), signature("b", 0.5, 1), signature("a", 0.5, 1)));

        assertEquals(List.of("c", "a", "b"), ids(ranked));
    }

    private static List<CandidateSignature> sample() {
        return List.of(
                signature("alpha", 0.81, 0),
                signature("beta", 0.42, 1),
                signature("gamma", 0.81, 2),
                signature("alpha", 0.65, 0),
                signature("delta", 0.13, 0),
                signature("beta", 0.55, 2));
    }

    private static CandidateSignature signature(String id, double score, int tieBreakRank) {
        return CandidateSignature.builder()
                .candidateId(id)
                .metrics(new double[] { score })
                .computedScore(score)
                .tieBreakRank(tieBreakRank)
                .build();
    }

    private static List<String> ids(List<CandidateSignature> signatures) {
        return signatures.stream().map(CandidateSignature::getCandidateId).toList();
    }
}
