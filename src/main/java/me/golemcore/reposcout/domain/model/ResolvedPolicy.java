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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Coherent scoring policy produced by the conflict resolver for one request.
 *
 * <p>
 * The weight vector is indexed by the scoring-dimension basis of the objective
 * registry. A policy is immutable and is shared read-only by all scoring
 * workers of a batch.
 */
@Value
public class ResolvedPolicy {

    /** Normalized objectives in registration order, before harmonization. */
    List<Objective> objectives;

    /** Objective name per scoring dimension. */
    List<String> dimensionNames;

    List<ObjectiveDirection> orientations;

    double[] weights;

    List<String> tieBreakOrder;

    double harmonyScore;

    List<ConflictResolution> resolutions;

    String fingerprint;

    @Builder
    @Jacksonized
    public ResolvedPolicy(List<Objective> objectives, List<String> dimensionNames,
            List<ObjectiveDirection> orientations, double[] weights, List<String> tieBreakOrder,
            double harmonyScore, List<ConflictResolution> resolutions, String fingerprint) {
        this.objectives = objectives == null ? List.of() : List.copyOf(objectives);
        this.dimensionNames = dimensionNames == null ? List.of() : List.copyOf(dimensionNames);
        this.orientations = orientations == null ? List.of() : List.copyOf(orientations);
        this.weights = weights == null ? new double[0] : weights.clone();
        this.tieBreakOrder = tieBreakOrder == null ? List.of() : List.copyOf(tieBreakOrder);
        this.harmonyScore = harmonyScore;
        this.resolutions = resolutions == null ? List.of() : List.copyOf(resolutions);
        this.fingerprint = fingerprint;
        if (this.dimensionNames.size() != this.weights.length
                || this.orientations.size() != this.weights.length) {
            throw new IllegalArgumentException("Policy basis mismatch: " + this.dimensionNames.size()
                    + " names, " + this.orientations.size() + " orientations, " + this.weights.length + " weights");
        }
    }

    public double[] getWeights() {
        return weights.clone();
    }

    @JsonIgnore
    public int getDimensions() {
        return weights.length;
    }

    public double weightAt(int dimension) {
        return weights[dimension];
    }

    public double orientedMetric(int dimension, double rawMetric) {
        return orientations.get(dimension).orient(rawMetric);
    }

    /**
     * Position of an objective in the tie-break order, or the order size when the
     * objective is not part of it.
     */
    public int tieBreakRank(String objectiveName) {
        int index = tieBreakOrder.indexOf(objectiveName);
        return index >= 0 ? index : tieBreakOrder.size();
    }

    public double weightOf(String objectiveName) {
        int index = dimensionNames.indexOf(objectiveName);
        return index >= 0 ? weights[index] : 0.0;
    }
}
