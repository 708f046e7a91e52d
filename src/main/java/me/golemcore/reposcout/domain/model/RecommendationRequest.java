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

import java.util.Map;

/**
 * Inbound recommendation request: free-text intent, optional explicit objective
 * weights, optional session for continuity and optional processing overrides.
 */
@Value
@Builder
public class RecommendationRequest {

    String intent;

    /** Explicit objective weights by name, each in [0,1]. */
    @Builder.Default
    Map<String, Double> objectiveOverrides = Map.of();

    String sessionId;

    /** Worker count for scoring, or null for the preset default. */
    Integer parallelism;

    /** Processing preset, or null for the configured default. */
    ProcessingPreset preset;

    /** Result-size cap, or null for the preset default. */
    Integer limit;

    public boolean hasSession() {
        return sessionId != null && !sessionId.isBlank();
    }
}
