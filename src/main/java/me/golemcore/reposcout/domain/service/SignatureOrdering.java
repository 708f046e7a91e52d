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

import me.golemcore.reposcout.domain.model.CandidateSignature;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Total ranking order shared by the scorer and the aggregator.
 *
 * <p>
 * Scores are compared by bucket {@code round(score / SCORE_EPSILON)}. Within a
 * bucket, signatures are separated by the policy tie-break rank, then by exact
 * score, then by candidate id.
 *
 * <p>
 * Buckets have fixed boundaries, so two scores less than
 * {@link #SCORE_EPSILON} apart can still straddle a boundary (for example
 * {@code 0.5000000004} and {@code 0.5000000006}); such a pair is ordered by
 * score and the tie-break rank is not consulted. A pairwise tolerance
 * comparison would avoid that but is not transitive, which sorting requires.
 */
public final class SignatureOrdering {

    public static final double SCORE_EPSILON = 1e-9;

    public static final Comparator<CandidateSignature> RANKING = Comparator
            .comparingLong((CandidateSignature s) -> scoreBucket(s.getComputedScore())).reversed()
            .thenComparingInt(CandidateSignature::getTieBreakRank)
            .thenComparing(Comparator.comparingDouble(CandidateSignature::getComputedScore).reversed())
            .thenComparing(CandidateSignature::getCandidateId);

    private SignatureOrdering() {
    }

    static long scoreBucket(double score) {
        return Math.round(score / SCORE_EPSILON);
    }

    /**
     * Sorts the signatures, keeps the first {@code limit} and assigns ranks
     * starting at 1.
     */
    public static List<CandidateSignature> rank(Collection<CandidateSignature> signatures, int limit) {
        List<CandidateSignature> sorted = new ArrayList<>(signatures);
        sorted.sort(RANKING);
        int size = Math.min(Math.max(0, limit), sorted.size());
        List<CandidateSignature> ranked = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            ranked.add(sorted.get(i).withRank(i + 1));
        }
        return List.copyOf(ranked);
    }
}
