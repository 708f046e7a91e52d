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
 * A recommendation candidate as supplied by the candidate source: identity,
 * presentation attributes and its raw metric vector (one scalar per scoring
 * dimension, each in [0,1]).
 */
@Value
public class CandidateProfile {

    String id;
    String name;
    String url;
    String primaryLanguage;
    double[] metrics;

    @Builder
    @Jacksonized
    public CandidateProfile(String id, String name, String url, String primaryLanguage, double[] metrics) {
        this.id = id;
        this.name = name;
        this.url = url;
        this.primaryLanguage = primaryLanguage;
        this.metrics = metrics == null ? null : metrics.clone();
    }

    public double[] getMetrics() {
        return metrics == null ? null : metrics.clone();
    }

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
