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

/**
 * A registered pair of objectives known to trade off against each other. The
 * two names are stored in canonical (lexicographic) order.
 */
@Value
@Builder
public class ConflictPair {

    String first;
    String second;
    ConflictSeverity severity;
    String rationale;

    public static ConflictPair of(String a, String b, ConflictSeverity severity, String rationale) {
        boolean ordered = a.compareTo(b) <= 0;
        return ConflictPair.builder()
                .first(ordered ? a : b)
                .second(ordered ? b : a)
                .severity(severity)
                .rationale(rationale)
                .build();
    }

    public boolean involves(String objectiveName) {
        return first.equals(objectiveName) || second.equals(objectiveName);
    }

    public String key() {
        return first + "|" + second;
    }
}
