package me.golemcore.reposcout.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reposcout.domain.exception.UnknownObjectiveException;
import me.golemcore.reposcout.domain.model.Objective;
import me.golemcore.reposcout.domain.model.ObjectiveDefinition;
import me.golemcore.reposcout.domain.model.ObjectiveSource;
import me.golemcore.reposcout.objective.IntentClassifier;
import me.golemcore.reposcout.objective.ObjectiveRegistry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Turns an intent plus optional explicit weights into a validated, normalized
 * objective set.
 *
 * <p>
 * Explicit overrides are checked against the {@link ObjectiveRegistry}. Unknown
 * names fail the request with {@link UnknownObjectiveException} unless
 * substitution is enabled, in which case the fallback objective takes their
 * weight. Inferred and explicit objectives merge by name keeping the higher
 * weight. The result is ordered by registration order and its weights sum to
 * 1.0.
 *
 * <p>
 * Pure function of its inputs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ObjectiveExtractor {

    private final ObjectiveRegistry objectiveRegistry;
    private final IntentClassifier intentClassifier;

    public List<Objective> extract(String intent, Map<String, Double> overrides, boolean substituteUnknown) {
        Map<String, Objective> merged = new LinkedHashMap<>();

        TreeSet<String> unknown = new TreeSet<>();
        if (overrides != null) {
            for (Map.Entry<String, Double> entry : overrides.entrySet()) {
                String name = entry.getKey() == null ? "" : entry.getKey().trim();
                if (!objectiveRegistry.contains(name)) {
                    unknown.add(name);
                    if (substituteUnknown) {
                        log.debug("[Extractor] Substituting '{}' with fallback objective", name);
                        merge(merged, explicit(objectiveRegistry.get(ObjectiveRegistry.FALLBACK),
                                validateWeight(name, entry.getValue())));
                    }
                    continue;
                }
                merge(merged, explicit(objectiveRegistry.get(name), validateWeight(name, entry.getValue())));
            }
        }
        if (!unknown.isEmpty() && !substituteUnknown) {
            throw new UnknownObjectiveException(new ArrayList<>(unknown));
        }

        for (Objective inferred : intentClassifier.classify(intent)) {
            if (!objectiveRegistry.contains(inferred.getName())) {
                log.warn("[Extractor] Classifier returned unregistered objective '{}', ignoring", inferred.getName());
                continue;
            }
            merge(merged, inferred);
        }

        List<Objective> objectives = normalize(merged.values());
        log.debug("[Extractor] Objectives: {}", objectives.stream()
                .map(o -> o.getName() + "=" + String.format(Locale.ROOT, "%.3f", o.getWeight()))
                .toList());
        return objectives;
    }

    private List<Objective> normalize(Iterable<Objective> candidates) {
        List<Objective> positive = new ArrayList<>();
        double total = 0.0;
        for (Objective objective : candidates) {
            if (objective.getWeight() > 0.0) {
                positive.add(objective);
                total += objective.getWeight();
            }
        }

        if (positive.isEmpty()) {
            ObjectiveDefinition fallback = objectiveRegistry.get(ObjectiveRegistry.FALLBACK);
            return List.of(Objective.builder()
                    .name(fallback.getName())
                    .weight(1.0)
                    .direction(fallback.getDirection())
                    .source(ObjectiveSource.INFERRED)
                    .build());
        }

        double sum = total;
        return positive.stream()
                .sorted(Comparator.comparingInt(o -> objectiveRegistry.orderOf(o.getName())))
                .map(o -> o.withWeight(o.getWeight() / sum))
                .toList();
    }

    private static double validateWeight(String name, Double weight) {
        if (weight == null || !Double.isFinite(weight) || weight < 0.0 || weight > 1.0) {
            throw new IllegalArgumentException("Weight for objective '" + name + "' must be within [0,1], got "
                    + weight);
        }
        return weight;
    }

    private static Objective explicit(ObjectiveDefinition definition, double weight) {
        return Objective.builder()
                .name(definition.getName())
                .weight(weight)
                .direction(definition.getDirection())
                .source(ObjectiveSource.EXPLICIT)
                .build();
    }

    private static void merge(Map<String, Objective> merged, Objective objective) {
        merged.merge(objective.getName(), objective, Objective::mergeWith);
    }
}
