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

import java.time.Duration;

/**
 * Concrete numeric parameters for one pipeline run.
 */
@Value
@Builder(toBuilder = true)
public class PipelineSettings {

    public static final double DEFAULT_MIN_HARMONY = 0.5;

    ProcessingPreset preset;
    int parallelism;
    double minHarmony;
    int resultLimit;
    Duration scoringTimeout;

    public static PipelineSettings forPreset(ProcessingPreset preset, int availableProcessors) {
        int processors = Math.max(1, availableProcessors);
        return switch (preset) {
        case MINIMAL -> PipelineSettings.builder()
                .preset(preset)
                .parallelism(1)
                .minHarmony(0.6)
                .resultLimit(5)
                .scoringTimeout(Duration.ofSeconds(2))
                .build();
        case BALANCED -> PipelineSettings.builder()
                .preset(preset)
                .parallelism(processors)
                .minHarmony(DEFAULT_MIN_HARMONY)
                .resultLimit(10)
                .scoringTimeout(Duration.ofSeconds(5))
                .build();
        case MAXIMAL -> PipelineSettings.builder()
                .preset(preset)
                .parallelism(processors * 2)
                .minHarmony(0.4)
                .resultLimit(25)
                .scoringTimeout(Duration.ofSeconds(15))
                .build();
        };
    }
}
