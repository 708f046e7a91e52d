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
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges signature sequences into one ranked list.
 *
 * <p>
 * Reduction keeps one signature per candidate id: the higher score, then the
 * lower tie-break rank, then the lexicographically smaller metric vector. The
 * preference is a total order, so merging is commutative and associative and
 * re-aggregating an aggregate returns the same list.
 */
@Service
public class ResultAggregator {

    public List<CandidateSignature> aggregate(int limit, List<CandidateSignature> signatures) {
        return aggregate(limit, List.of(signatures));
    }

    public List<CandidateSignature> aggregate(int limit, List<CandidateSignature> first,
            List<CandidateSignature> second) {
        return aggregate(limit, List.of(first, second));
    }

    public List<CandidateSignature> aggregate(int limit, Collection<? extends List<CandidateSignature>> sequences) {
        Map<String, CandidateSignature> best = new HashMap<>();
        for (List<CandidateSignature> sequence : sequences) {
            if (sequence == null) {
                continue;
            }
            for (CandidateSignature signature : sequence) {
                if (signature == null || signature.getCandidateId() == null) {
                    continue;
                }
                best.merge(signature.getCandidateId(), signature, ResultAggregator::preferred);
            }
        }
        return SignatureOrdering.rank(best.values(), limit);
    }

    static CandidateSignature preferred(CandidateSignature left, CandidateSignature right) {
        int byScore = Double.compare(left.getComputedScore(), right.getComputedScore());
        if (byScore != 0) {
            return byScore > 0 ? left : right;
        }
        if (left.getTieBreakRank() != right.getTieBreakRank()) {
            return left.getTieBreakRank() < right.getTieBreakRank() ? left : right;
        }
        return Arrays.compare(left.getMetrics(), right.getMetrics()) <= 0 ? left : right;
    }
}
