package me.golemcore.reposcout.infrastructure.metrics;

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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import me.golemcore.reposcout.domain.model.RecommendationFailureKind;
import me.golemcore.reposcout.domain.model.ScoringBatch;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer meters for the recommendation pipeline. Tags are bounded enums or
 * fixed strings.
 */
@Component
public class RecommendationMetrics {

    public static final String HARMONY_SCORE = "reposcout.harmony.score";
    public static final String RESOLUTION_FAILURES = "reposcout.resolution.failures";
    public static final String SCORER_CANDIDATES = "reposcout.scorer.candidates";
    public static final String SCORER_DURATION = "reposcout.scorer.duration";
    public static final String CACHE_REQUESTS = "reposcout.cache.requests";

    public static final String TIER_SESSION = "session";
    public static final String TIER_REQUEST = "request";
    public static final String TIER_SIGNATURE = "signature";

    public static final String RESULT_HIT = "hit";
    public static final String RESULT_MISS = "miss";
    public static final String RESULT_ERROR = "error";

    private final MeterRegistry registry;
    private final DistributionSummary harmony;
    private final Timer scorerDuration;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public RecommendationMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.harmony = DistributionSummary.builder(HARMONY_SCORE)
                .description("Harmony score of resolved policies")
                .register(registry);
        this.scorerDuration = Timer.builder(SCORER_DURATION)
                .description("Wall time of a scoring batch")
                .register(registry);
    }

    public void recordHarmony(double harmonyScore) {
        harmony.record(harmonyScore);
    }

    public void recordResolutionFailure(RecommendationFailureKind kind) {
        counter(RESOLUTION_FAILURES, "kind", kind.name().toLowerCase(Locale.ROOT)).increment();
    }

    public void recordScoring(ScoringBatch batch) {
        int scored = batch.getSignatures().size();
        long malformed = batch.malformedCount();
        if (scored > 0) {
            counter(SCORER_CANDIDATES, "outcome", "scored").increment(scored);
        }
        if (malformed > 0) {
            counter(SCORER_CANDIDATES, "outcome", "malformed").increment(malformed);
        }
        if (batch.getUnscored() > 0) {
            counter(SCORER_CANDIDATES, "outcome", "skipped").increment(batch.getUnscored());
        }
        if (batch.getElapsed() != null) {
            scorerDuration.record(batch.getElapsed());
        }
    }

    public void recordCacheRequest(String tier, String result) {
        String cacheKey = CACHE_REQUESTS + "|" + tier + "|" + result;
        counters.computeIfAbsent(cacheKey, k -> Counter.builder(CACHE_REQUESTS)
                .tag("tier", tier)
                .tag("result", result)
                .register(registry))
                .increment();
    }

    private Counter counter(String name, String tagKey, String tagValue) {
        return counters.computeIfAbsent(name + "|" + tagValue, k -> Counter.builder(name)
                .tag(tagKey, tagValue)
                .register(registry));
    }
}
