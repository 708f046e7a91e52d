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
 * Record of one harmonization step, kept on the policy for explanations.
 */
@Value
@Builder
@Jacksonized
public class ConflictResolution {

    DetectedConflict conflict;
    double firstWeightBefore;
    double secondWeightBefore;
    double firstWeightAfter;
    double secondWeightAfter;

    /** 1 - residual imbalance of the pair after harmonization. */
    double harmonyComponent;

    public double gapBefore() {
        return Math.abs(firstWeightBefore - secondWeightBefore);
    }

    public double gapAfter() {
        return Math.abs(firstWeightAfter - secondWeightAfter);
    }
}
