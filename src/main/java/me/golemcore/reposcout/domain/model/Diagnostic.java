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
 * A non-fatal condition surfaced alongside a recommendation result.
 */
@Value
@Builder
@Jacksonized
public class Diagnostic {

    DiagnosticKind kind;

    /** Candidate id, session id or store operation the diagnostic refers to. */
    String subject;

    String message;

    public static Diagnostic malformedCandidate(String candidateId, String message) {
        return Diagnostic.builder()
                .kind(DiagnosticKind.MALFORMED_CANDIDATE)
                .subject(candidateId)
                .message(message)
                .build();
    }

    public static Diagnostic cacheUnavailable(String operation, String message) {
        return Diagnostic.builder()
                .kind(DiagnosticKind.CACHE_UNAVAILABLE)
                .subject(operation)
                .message(message)
                .build();
    }
}
