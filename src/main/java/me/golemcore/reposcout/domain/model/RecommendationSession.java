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

import java.time.Instant;
import java.util.List;

/**
 * Continuity state for a sequence of related recommendation requests: the most
 * recent policy and the running aggregate of ranked signatures.
 *
 * <p>
 * Sessions are owned by the store and replaced as a whole on every update.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RecommendationSession {

    String id;

    ResolvedPolicy policy;

    @Builder.Default
    List<CandidateSignature> aggregate = List.of();

    int requestCount;

    Instant createdAt;
    Instant updatedAt;
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
