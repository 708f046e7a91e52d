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

/**
 * Severity of a registered objective trade-off.
 *
 * <p>
 * Each severity carries two parameters used by the conflict resolver:
 * <ul>
 * <li>{@code pull} - fraction of the distance to the pair midpoint that each
 * weight moves during harmonization</li>
 * <li>{@code tension} - residual imbalance that remains even when the pair is
 * perfectly balanced</li>
 * </ul>
 */
public enum ConflictSeverity {

    LOW(0.25, 0.10),

    MODERATE(0.50, 0.20),

    HARD(0.75, 0.35);

    private final double pull;
    private final double tension;

    ConflictSeverity(double pull, double tension) {
        this.pull = pull;
        this.tension = tension;
    }

    public double getPull() {
        return pull;
    }

    public double getTension() {
        return tension;
    }
}
