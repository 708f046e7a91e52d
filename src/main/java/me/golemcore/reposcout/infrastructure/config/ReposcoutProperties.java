package me.golemcore.reposcout.infrastructure.config;

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

import lombok.Data;
import me.golemcore.reposcout.domain.model.PipelineSettings;
import me.golemcore.reposcout.domain.model.ProcessingPreset;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Service configuration bound from {@code reposcout.*} properties.
 *
 * <ul>
 * <li>{@link PipelineProperties} - default preset and balanced-preset
 * overrides</li>
 * <li>{@link ScoringProperties} - parallelism cap and scoring time budget</li>
 * <li>{@link StoreProperties} - session/cache store location, I/O bounds and
 * expiry tiers</li>
 * <li>{@link CatalogProperties} - candidate catalog location</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "reposcout")
@Data
public class ReposcoutProperties {

    private PipelineProperties pipeline = new PipelineProperties();
    private ScoringProperties scoring = new ScoringProperties();
    private StoreProperties store = new StoreProperties();
    private CatalogProperties catalog = new CatalogProperties();

    @Data
    public static class PipelineProperties {
        private ProcessingPreset defaultPreset = ProcessingPreset.BALANCED;
        private double minHarmony = PipelineSettings.DEFAULT_MIN_HARMONY;
        private int resultLimit = 10;
        /** Substitute the fallback objective for unknown override names instead of rejecting them. */
        private boolean substituteUnknown = false;
        /** Running-aggregate cap per session. */
        private int sessionAggregateLimit = 100;
    }

    @Data
    public static class ScoringProperties {
        /** Balanced parallelism; 0 means available processors. */
        private int parallelism = 0;
        private int maxParallelism = 32;
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class StoreProperties {
        private String directory = "${user.home}/.reposcout/store";
        private Duration timeout = Duration.ofSeconds(2);
        private Duration firstBackoff = Duration.ofMillis(100);
        private Duration sessionTtl = Duration.ofHours(24);
        private Duration requestTtl = Duration.ofMinutes(10);
        private Duration signatureTtl = Duration.ofHours(6);
        private Duration evictionInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class CatalogProperties {
        private String location = "classpath:catalog/repositories.json";
    }
}
