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
 * A named, weighted scoring dimension requested for a recommendation.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Objective {

    String name;

    /** Weight in [0,1]. Normalized to sum to 1.0 across a request. */
    double weight;

    ObjectiveDirection direction;

    ObjectiveSource source;

    public Objective withWeight(double newWeight) {
        return toBuilder().weight(newWeight).build();
    }

    /**
     * Merges two objectives with the same name by keeping the higher weight. An
     * explicit source wins over an inferred one.
     */
    public Objective mergeWith(Objective other) {
        if (other == null) {
            return this;
        }
        ObjectiveSource mergedSource = source == ObjectiveSource.EXPLICIT || other.source == ObjectiveSource.EXPLICIT
                ? ObjectiveSource.EXPLICIT
                : ObjectiveSource.INFERRED;
        return toBuilder()
                .weight(Math.max(weight, other.weight))
                .source(mergedSource)
                .build();
    }
}
