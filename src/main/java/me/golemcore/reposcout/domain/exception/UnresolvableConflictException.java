package me.golemcore.reposcout.domain.exception;

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

import me.golemcore.reposcout.domain.model.DetectedConflict;
import me.golemcore.reposcout.domain.model.RecommendationFailureKind;

import java.util.List;
import java.util.Locale;

/**
 * Thrown when harmonized objectives still fall below the minimum harmony
 * score. Carries the offending pairs so the caller can relax one side.
 */
public class UnresolvableConflictException extends RecommendationException {

    private static final long serialVersionUID = 1L;

    private final transient List<DetectedConflict> offendingPairs;
    private final double harmonyScore;
    private final double minimumHarmony;

    public UnresolvableConflictException(List<DetectedConflict> offendingPairs, double harmonyScore,
            double minimumHarmony) {
        super(RecommendationFailureKind.UNRESOLVABLE_CONFLICT, String.format(Locale.ROOT,
                "Harmony %.3f is below minimum %.3f for: %s", harmonyScore, minimumHarmony,
                String.join(", ", offendingPairs.stream().map(DetectedConflict::describe).toList())));
        this.offendingPairs = List.copyOf(offendingPairs);
        this.harmonyScore = harmonyScore;
        this.minimumHarmony = minimumHarmony;
    }

    public List<DetectedConflict> getOffendingPairs() {
        return offendingPairs;
    }

    public double getHarmonyScore() {
        return harmonyScore;
    }

    public double getMinimumHarmony() {
        return minimumHarmony;
    }
}
