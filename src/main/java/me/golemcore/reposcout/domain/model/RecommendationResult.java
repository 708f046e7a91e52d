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
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Structured, practical output of the recommendation pipeline.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RecommendationResult {

    String sessionId;

    double harmonyScore;

    List<Objective> objectives;

    @Singular
    List<RankedRecommendation> recommendations;

    /** Human-readable account of how conflicts were resolved. */
    @Singular
    List<String> explanations;

    @Singular
    List<String> nextActions;

    @Singular
    List<Diagnostic> diagnostics;

    /** Served from the short-lived request cache. */
    boolean cached;

    /** Session state could not be read or persisted. */
    boolean degraded;

    Instant generatedAt;

    public boolean hasDiagnostic(DiagnosticKind kind) {
        return diagnostics.stream().anyMatch(d -> d.getKind() == kind);
    }
}
