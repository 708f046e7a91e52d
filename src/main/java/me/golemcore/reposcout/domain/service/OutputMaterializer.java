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
import me.golemcore.reposcout.domain.model.CandidateProfile;
import me.golemcore.reposcout.domain.model.CandidateSignature;
import me.golemcore.reposcout.domain.model.ConflictResolution;
import me.golemcore.reposcout.domain.model.Diagnostic;
import me.golemcore.reposcout.domain.model.DiagnosticKind;
import me.golemcore.reposcout.domain.model.RankedRecommendation;
import me.golemcore.reposcout.domain.model.RecommendationResult;
import me.golemcore.reposcout.domain.model.ResolvedPolicy;
import me.golemcore.reposcout.objective.ObjectiveRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns ranked signatures into the caller-facing recommendation result:
 * annotated recommendations, one explanation line per resolved conflict plus a
 * summary, and suggested next actions.
 */
@Service
@RequiredArgsConstructor
public class OutputMaterializer {

    static final String QUICK_INTEGRATION = "Quick Integration";
    static final String HIGH_VALUE_INTEGRATION = "High-Value Integration";
    static final String SECURITY_ENHANCEMENT = "Security Enhancement";
    static final String STRATEGIC_INTEGRATION = "Strategic Integration";

    static final String EFFORT_LOW = "Low (1-2 days)";
    static final String EFFORT_MEDIUM = "Medium (3-7 days)";
    static final String EFFORT_HIGH = "High (1-2 weeks)";

    private static final double QUICK_EFFORT_THRESHOLD = 0.3;
    private static final double MEDIUM_EFFORT_THRESHOLD = 0.6;
    private static final double PROTOTYPE_EFFORT_THRESHOLD = 0.7;
    private static final double HIGH_VALUE_SCORE = 0.9;
    private static final double SECURITY_GATE_THRESHOLD = 0.9;
    private static final double COMFORTABLE_HARMONY = 0.75;

    private final Clock clock;

    public RecommendationResult materialize(String sessionId, ResolvedPolicy policy,
            List<CandidateSignature> ranked, Map<String, CandidateProfile> profiles, List<Diagnostic> diagnostics,
            boolean degraded) {
        List<RankedRecommendation> recommendations = new ArrayList<>(ranked.size());
        for (CandidateSignature signature : ranked) {
            recommendations.add(toRecommendation(policy, signature, profiles.get(signature.getCandidateId())));
        }

        return RecommendationResult.builder()
                .sessionId(sessionId)
                .harmonyScore(policy.getHarmonyScore())
                .objectives(policy.getObjectives())
                .recommendations(recommendations)
                .explanations(explanations(policy, recommendations))
                .nextActions(nextActions(policy, recommendations, diagnostics, degraded))
                .diagnostics(diagnostics)
                .cached(false)
                .degraded(degraded)
                .generatedAt(Instant.now(clock))
                .build();
    }

    private RankedRecommendation toRecommendation(ResolvedPolicy policy, CandidateSignature signature,
            CandidateProfile profile) {
        double[] metrics = signature.getMetrics();
        String strongest = CandidateScorer.strongestObjective(policy, metrics);
        double effort = metric(policy, metrics, ObjectiveRegistry.INTEGRATION_EFFORT);
        double security = metric(policy, metrics, ObjectiveRegistry.SECURITY);

        return RankedRecommendation.builder()
                .priority(signature.getRank())
                .candidateId(signature.getCandidateId())
                .name(profile != null ? profile.displayName() : signature.getCandidateId())
                .url(profile != null ? profile.getUrl() : null)
                .score(signature.getComputedScore())
                .strongestObjective(strongest)
                .recommendationType(recommendationType(signature.getComputedScore(), effort, strongest))
                .integrationEffort(effortLabel(effort))
                .implementationNotes(implementationNotes(profile, effort, security))
                .build();
    }

    static String recommendationType(double score, double integrationEffort, String strongestObjective) {
        if (integrationEffort < QUICK_EFFORT_THRESHOLD) {
            return QUICK_INTEGRATION;
        }
        if (score > HIGH_VALUE_SCORE) {
            return HIGH_VALUE_INTEGRATION;
        }
        if (ObjectiveRegistry.SECURITY.equals(strongestObjective)) {
            return SECURITY_ENHANCEMENT;
        }
        return STRATEGIC_INTEGRATION;
    }

    static String effortLabel(double integrationEffort) {
        if (integrationEffort < QUICK_EFFORT_THRESHOLD) {
            return EFFORT_LOW;
        }
        if (integrationEffort < MEDIUM_EFFORT_THRESHOLD) {
            return EFFORT_MEDIUM;
        }
        return EFFORT_HIGH;
    }

    private static List<String> implementationNotes(CandidateProfile profile, double effort, double security) {
        List<String> notes = new ArrayList<>();
        String language = profile != null && profile.getPrimaryLanguage() != null
                ? profile.getPrimaryLanguage().toLowerCase(Locale.ROOT)
                : "";
        String hint = switch (language) {
        case "java" -> "Add as a Maven or Gradle dependency and pin the version";
        case "python" -> "Install with pip into an isolated virtual environment";
        case "javascript", "typescript" -> "Add via npm and review the bundle size impact";
        case "go" -> "Add with go get and pin the module version in go.mod";
        default -> null;
        };
        if (hint != null) {
            notes.add(hint);
        }
        if (effort > PROTOTYPE_EFFORT_THRESHOLD) {
            notes.add("Prototype in a spike branch before committing: integration effort is high");
        }
        if (security >= SECURITY_GATE_THRESHOLD) {
            notes.add("Wire into CI as a security gate");
        }
        return notes;
    }

    private static List<String> explanations(ResolvedPolicy policy, List<RankedRecommendation> recommendations) {
        List<String> lines = new ArrayList<>();
        for (ConflictResolution resolution : policy.getResolutions()) {
            lines.add(String.format(Locale.ROOT,
                    "Resolved %s: weights %.3f/%.3f -> %.3f/%.3f, harmony component %.3f",
                    resolution.getConflict().describe(),
                    resolution.getFirstWeightBefore(), resolution.getSecondWeightBefore(),
                    resolution.getFirstWeightAfter(), resolution.getSecondWeightAfter(),
                    resolution.getHarmonyComponent()));
        }
        lines.add(String.format(Locale.ROOT,
                "Ranked %d candidate(s) for %d objective(s) with %d conflict(s); harmony %.3f",
                recommendations.size(), policy.getObjectives().size(), policy.getResolutions().size(),
                policy.getHarmonyScore()));
        return lines;
    }

    private static List<String> nextActions(ResolvedPolicy policy, List<RankedRecommendation> recommendations,
            List<Diagnostic> diagnostics, boolean degraded) {
        List<String> actions = new ArrayList<>();
        if (recommendations.isEmpty()) {
            actions.add("Broaden the intent or lower the minimum harmony: no candidate was ranked");
        } else {
            RankedRecommendation top = recommendations.get(0);
            actions.add(String.format(Locale.ROOT, "Evaluate %s first: strongest on %s with score %.3f",
                    top.getName(), top.getStrongestObjective(), top.getScore()));
        }

        List<String> quick = recommendations.stream()
                .filter(r -> QUICK_INTEGRATION.equals(r.getRecommendationType()))
                .map(RankedRecommendation::getName)
                .toList();
        if (!quick.isEmpty()) {
            actions.add("Prototype the quick integration(s) first: " + String.join(", ", quick));
        }

        if (policy.getHarmonyScore() < COMFORTABLE_HARMONY && !policy.getResolutions().isEmpty()) {
            ConflictResolution weakest = policy.getResolutions().stream()
                    .min(Comparator.comparingDouble(ConflictResolution::getHarmonyComponent))
                    .orElseThrow();
            String first = weakest.getConflict().getFirst();
            String second = weakest.getConflict().getSecond();
            boolean relaxFirst = weakest.getFirstWeightBefore() < weakest.getSecondWeightBefore();
            String relax = relaxFirst ? first : second;
            String keep = relaxFirst ? second : first;
            actions.add("Relax '" + relax + "' (conflicts with '" + keep + "') to raise the harmony score");
        }

        long malformed = diagnostics.stream().filter(d -> d.getKind() == DiagnosticKind.MALFORMED_CANDIDATE).count();
        if (malformed > 0) {
            actions.add("Fix " + malformed + " malformed candidate record(s) in the candidate source");
        }
        if (degraded) {
            actions.add("Session state was not persisted; repeat the request once the store is available");
        }
        return actions;
    }

    private static double metric(ResolvedPolicy policy, double[] metrics, String objective) {
        int index = policy.getDimensionNames().indexOf(objective);
        return index >= 0 && index < metrics.length ? metrics[index] : 0.0;
    }
}
