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

import java.util.Comparator;
import java.util.Locale;

/**
 * A conflict found among the objectives of one request. Names are in canonical
 * order.
 */
@Value
@Builder
@Jacksonized
public class DetectedConflict {

    /**
     * Canonical processing order: objective pair first, then severity.
     */
    public static final Comparator<DetectedConflict> CANONICAL_ORDER = Comparator
            .comparing(DetectedConflict::getFirst)
            .thenComparing(DetectedConflict::getSecond)
            .thenComparing(DetectedConflict::getSeverity);

    String first;
    String second;
    ConflictSeverity severity;

    public static DetectedConflict from(ConflictPair pair) {
        return DetectedConflict.builder()
                .first(pair.getFirst())
                .second(pair.getSecond())
                .severity(pair.getSeverity())
                .build();
    }

    public String describe() {
        return first + " vs " + second + " (" + severity.name().toLowerCase(Locale.ROOT) + ")";
    }
}
