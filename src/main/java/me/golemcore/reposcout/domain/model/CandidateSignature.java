package me.golemcore.reposcout.domain.model;

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

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Scored representation of one candidate under a given policy. Never mutated:
 * re-scoring or re-ranking produces a new signature.
 */
@Value
public class CandidateSignature {

    String candidateId;
    double[] metrics;
    double computedScore;

    /**
     * Position of the candidate's strongest objective in the policy tie-break
     * order. Lower ranks win score ties.
     */
    int tieBreakRank;

    /** 1-based position in the ranked sequence, 0 while unranked. */
    int rank;

    @Builder(toBuilder = true)
    @Jacksonized
    public CandidateSignature(String candidateId, double[] metrics, double computedScore, int tieBreakRank,
            int rank) {
        this.candidateId = candidateId;
        this.metrics = metrics == null ? new double[0] : metrics.clone();
        this.computedScore = computedScore;
        this.tieBreakRank = tieBreakRank;
        this.rank = rank;
    }

    public double[] getMetrics() {
        return metrics.clone();
    }

    public CandidateSignature withRank(int newRank) {
        return toBuilder().rank(newRank).build();
    }
}
