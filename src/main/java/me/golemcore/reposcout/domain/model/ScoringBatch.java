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

import java.time.Duration;
import java.util.List;

/**
 * Output of one candidate scoring pass: ranked signatures plus per-item and
 * batch-level diagnostics.
 */
@Value
@Builder
public class ScoringBatch {

    @Singular
    List<CandidateSignature> signatures;

    @Singular
    List<Diagnostic> diagnostics;

    int submitted;

    /** Candidates never scored because the batch was cancelled or timed out. */
    int unscored;

    Duration elapsed;

    public boolean isPartial() {
        return unscored > 0;
    }

    public long malformedCount() {
        return diagnostics.stream()
                .filter(d -> d.getKind() == DiagnosticKind.MALFORMED_CANDIDATE)
                .count();
    }
}
