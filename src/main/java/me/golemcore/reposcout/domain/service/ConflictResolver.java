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
import me.golemcore.reposcout.domain.exception.UnresolvableConflictException;
import me.golemcore.reposcout.domain.model.ConflictResolution;
import me.golemcore.reposcout.domain.model.ConflictSeverity;
import me.golemcore.reposcout.domain.model.DetectedConflict;
import me.golemcore.reposcout.domain.model.Objective;
import me.golemcore.reposcout.domain.model.ObjectiveDefinition;
import me.golemcore.reposcout.domain.model.ObjectiveDirection;
import me.golemcore.reposcout.domain.model.ResolvedPolicy;
import me.golemcore.reposcout.objective.ObjectiveRegistry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Resolves possibly-conflicting objectives into a single scoring policy.
 *
 * <p>
 * Algorithm:
 * <ol>
 * <li>Start from the normalized objective weights laid out on the
 * scoring-dimension basis.</li>
 * <li>Process conflicts in canonical order (pair names, then severity). Each
 * step pulls both weights toward their midpoint by the severity's pull factor;
 * the pair's combined weight is preserved.</li>
 * <li>Each step yields a harmony component {@code 1 - r} where the residual
 * imbalance {@code r = share * (tension + (1 - tension) * gap)}, {@code share}
 * is the pair's fraction of the total weight and {@code gap} the normalized
 * weight difference left after the pull.</li>
 * <li>The harmony score is the product of all components, 1.0 without
 * conflicts.</li>
 * </ol>
 *
 * <p>
 * Harmonization is not associative across pairs that share an objective, so
 * the canonical order is what makes the result deterministic.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConflictResolver {

    private static final double EPSILON = 1e-12;

    private final ObjectiveRegistry objectiveRegistry;

    public ResolvedPolicy resolve(List<Objective> objectives, List<DetectedConflict> conflicts, double minHarmony) {
        int dimensions = objectiveRegistry.dimensions();
        double[] weights = new double[dimensions];
        for (Objective objective : objectives) {
            weights[objectiveRegistry.orderOf(objective.getName())] = objective.getWeight();
        }

        List<DetectedConflict> ordered = new ArrayList<>(conflicts);
        ordered.sort(DetectedConflict.CANONICAL_ORDER);

        List<ConflictResolution> resolutions = new ArrayList<>();
        double harmony = 1.0;
        for (DetectedConflict conflict : ordered) {
            ConflictResolution resolution = harmonize(weights, conflict);
            resolutions.add(resolution);
            harmony *= resolution.getHarmonyComponent();
        }
        harmony = Math.min(1.0, harmony);

        if (harmony < minHarmony) {
            List<DetectedConflict> offending = resolutions.stream()
                    .filter(r -> r.getHarmonyComponent() < 1.0)
                    .map(ConflictResolution::getConflict)
                    .toList();
            log.info("[Resolver] Unresolvable: harmony {} < minimum {} ({} offending pair(s))",
                    format(harmony), format(minHarmony), offending.size());
            throw new UnresolvableConflictException(offending, harmony, minHarmony);
        }

        List<String> tieBreakOrder = objectives.stream()
                .sorted(Comparator.comparingDouble(Objective::getWeight).reversed()
                        .thenComparingInt(o -> objectiveRegistry.orderOf(o.getName())))
                .map(Objective::getName)
                .toList();

        List<String> dimensionNames = objectiveRegistry.names();
        List<ObjectiveDirection> orientations = objectiveRegistry.all().stream()
                .map(ObjectiveDefinition::getDirection)
                .toList();

        ResolvedPolicy policy = ResolvedPolicy.builder()
                .objectives(objectives)
                .dimensionNames(dimensionNames)
                .orientations(orientations)
                .weights(weights)
                .tieBreakOrder(tieBreakOrder)
                .harmonyScore(harmony)
                .resolutions(resolutions)
                .fingerprint(fingerprint(weights, orientations, tieBreakOrder))
                .build();

        log.debug("[Resolver] Policy {} resolved {} conflict(s), harmony {}", policy.getFingerprint(),
                resolutions.size(), format(harmony));
        return policy;
    }

    private ConflictResolution harmonize(double[] weights, DetectedConflict conflict) {
        int a = objectiveRegistry.orderOf(conflict.getFirst());
        int b = objectiveRegistry.orderOf(conflict.getSecond());
        ConflictSeverity severity = conflict.getSeverity();

        double wa = weights[a];
        double wb = weights[b];
        double mid = (wa + wb) / 2.0;
        double waAfter = wa + severity.getPull() * (mid - wa);
        double wbAfter = wb + severity.getPull() * (mid - wb);
        weights[a] = waAfter;
        weights[b] = wbAfter;

        double share = waAfter + wbAfter;
        double gap = share > EPSILON ? Math.abs(waAfter - wbAfter) / share : 0.0;
        double residual = share * (severity.getTension() + (1.0 - severity.getTension()) * gap);
        double component = 1.0 - Math.max(0.0, Math.min(1.0, residual));

        return ConflictResolution.builder()
                .conflict(conflict)
                .firstWeightBefore(wa)
                .secondWeightBefore(wb)
                .firstWeightAfter(waAfter)
                .secondWeightAfter(wbAfter)
                .harmonyComponent(component)
                .build();
    }

    private static String fingerprint(double[] weights, List<ObjectiveDirection> orientations,
            List<String> tieBreakOrder) {
        StringBuilder weightPart = new StringBuilder();
        for (double weight : weights) {
            weightPart.append(String.format(Locale.ROOT, "%.9f", weight)).append(',');
        }
        return TelemetrySupport.fingerprint(
                weightPart.toString(),
                orientations.toString(),
                String.join(">", tieBreakOrder));
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
