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
import me.golemcore.reposcout.domain.model.CandidateProfile;
import me.golemcore.reposcout.domain.model.CandidateSignature;
import me.golemcore.reposcout.domain.model.Diagnostic;
import me.golemcore.reposcout.domain.model.DiagnosticKind;
import me.golemcore.reposcout.domain.model.ResolvedPolicy;
import me.golemcore.reposcout.domain.model.ScoringBatch;
import me.golemcore.reposcout.objective.ObjectiveRegistry;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Scores a candidate set against a resolved policy on the shared scoring
 * executor.
 *
 * <p>
 * The candidate list is split into contiguous chunks, one task per chunk. Each
 * worker writes only the result slots of its own chunk, so the output does not
 * depend on the parallelism budget or on scheduling: ranks are assigned after
 * all slots are collected.
 *
 * <p>
 * Malformed candidates are skipped with a diagnostic. When the batch is
 * cancelled or its time budget elapses, workers stop taking new candidates and
 * the signatures produced so far are returned with a {@code CANCELLED} or
 * {@code TIMEOUT} diagnostic counting the unscored candidates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CandidateScorer {

    private static final Duration STOP_GRACE = Duration.ofMillis(250);
    private static final String BATCH_SUBJECT = "scoring-batch";

    private final ExecutorService scoringExecutor;

    public ScoringBatch score(ResolvedPolicy policy, List<CandidateProfile> candidates, int parallelism) {
        return score(policy, candidates, parallelism, null, new ScoringCancellation());
    }

    public ScoringBatch score(ResolvedPolicy policy, List<CandidateProfile> candidates, int parallelism,
            Duration timeout, ScoringCancellation cancellation) {
        long startedAt = System.nanoTime();
        int total = candidates.size();
        if (total == 0) {
            return ScoringBatch.builder().submitted(0).unscored(0).elapsed(Duration.ZERO).build();
        }

        ScoringCancellation handle = cancellation != null ? cancellation : new ScoringCancellation();
        long deadline = timeout != null ? startedAt + timeout.toNanos() : Long.MAX_VALUE;
        AtomicReferenceArray<Outcome> outcomes = new AtomicReferenceArray<>(total);

        int chunks = Math.min(Math.max(1, parallelism), total);
        int chunkSize = (total + chunks - 1) / chunks;
        List<CompletableFuture<Void>> futures = new ArrayList<>(chunks);
        for (int from = 0; from < total; from += chunkSize) {
            int start = from;
            int end = Math.min(total, from + chunkSize);
            futures.add(CompletableFuture.runAsync(
                    () -> scoreChunk(policy, candidates, start, end, outcomes, handle, deadline),
                    scoringExecutor));
        }

        awaitWorkers(CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])), handle, deadline);
        ScoringBatch batch = collect(outcomes, total, handle, Duration.ofNanos(System.nanoTime() - startedAt));

        log.debug("[Scorer] Scored {}/{} candidate(s) in {} chunk(s), {} malformed, {} unscored ({} ms)",
                batch.getSignatures().size(), total, futures.size(), batch.malformedCount(), batch.getUnscored(),
                batch.getElapsed().toMillis());
        return batch;
    }

    private void scoreChunk(ResolvedPolicy policy, List<CandidateProfile> candidates, int start, int end,
            AtomicReferenceArray<Outcome> outcomes, ScoringCancellation handle, long deadline) {
        for (int i = start; i < end; i++) {
            if (handle.isStopped()) {
                return;
            }
            if (System.nanoTime() - deadline >= 0) {
                handle.expire();
                return;
            }
            CandidateProfile candidate = candidates.get(i);
            Optional<String> problem = malformation(policy, candidate);
            if (problem.isPresent()) {
                String subject = candidate != null && candidate.getId() != null ? candidate.getId() : "#" + i;
                outcomes.set(i, Outcome.malformed(Diagnostic.malformedCandidate(subject, problem.get())));
            } else {
                outcomes.set(i, Outcome.scored(scoreOne(policy, candidate)));
            }
        }
    }

    private void awaitWorkers(CompletableFuture<Void> all, ScoringCancellation handle, long deadline) {
        CompletableFuture<Object> finishedOrStopped = CompletableFuture.anyOf(all, handle.whenStopped());
        try {
            if (deadline == Long.MAX_VALUE) {
                finishedOrStopped.get();
            } else {
                finishedOrStopped.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            }
        } catch (TimeoutException e) {
            handle.expire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.cancel();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Scoring worker failed", e.getCause());
        }
        if (all.isDone()) {
            return;
        }

        // Workers observe the stop flag between candidates; in-flight items get a
        // short grace period.
        try {
            all.get(STOP_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[Scorer] Workers still running {} ms after stop", STOP_GRACE.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("[Scorer] Worker failed after stop: {}", e.getCause() != null
                    ? e.getCause().getMessage()
                    : e.getMessage());
        }
    }

    private ScoringBatch collect(AtomicReferenceArray<Outcome> outcomes, int total, ScoringCancellation handle,
            Duration elapsed) {
        List<CandidateSignature> signatures = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        int unscored = 0;
        for (int i = 0; i < total; i++) {
            Outcome outcome = outcomes.get(i);
            if (outcome == null) {
                unscored++;
            } else if (outcome.signature() != null) {
                signatures.add(outcome.signature());
            } else {
                diagnostics.add(outcome.diagnostic());
            }
        }

        if (unscored > 0) {
            DiagnosticKind kind = handle.getReason() != null ? handle.getReason() : DiagnosticKind.CANCELLED;
            String reason = kind == DiagnosticKind.TIMEOUT ? "time budget elapsed" : "batch cancelled";
            diagnostics.add(Diagnostic.builder()
                    .kind(kind)
                    .subject(BATCH_SUBJECT)
                    .message(unscored + " of " + total + " candidate(s) not scored: " + reason)
                    .build());
            log.warn("[Scorer] {} of {} candidate(s) not scored: {}", unscored, total, reason);
        }

        return ScoringBatch.builder()
                .signatures(SignatureOrdering.rank(signatures, signatures.size()))
                .diagnostics(diagnostics)
                .submitted(total)
                .unscored(unscored)
                .elapsed(elapsed)
                .build();
    }

    /**
     * Describes why a candidate cannot be scored under the policy, or empty when
     * it is well-formed.
     */
    static Optional<String> malformation(ResolvedPolicy policy, CandidateProfile candidate) {
        if (candidate == null) {
            return Optional.of("candidate record is null");
        }
        if (candidate.getId() == null || candidate.getId().isBlank()) {
            return Optional.of("candidate id is missing");
        }
        double[] metrics = candidate.getMetrics();
        if (metrics == null) {
            return Optional.of("metric vector is missing");
        }
        if (metrics.length != policy.getDimensions()) {
            return Optional.of("metric vector has " + metrics.length + " dimension(s), expected "
                    + policy.getDimensions());
        }
        for (int i = 0; i < metrics.length; i++) {
            if (!Double.isFinite(metrics[i])) {
                return Optional.of("metric '" + policy.getDimensionNames().get(i) + "' is not a finite number");
            }
        }
        return Optional.empty();
    }

    /**
     * Scores a well-formed candidate. Weighted terms are summed in dimension
     * order.
     */
    static CandidateSignature scoreOne(ResolvedPolicy policy, CandidateProfile candidate) {
        double[] metrics = candidate.getMetrics();
        double score = 0.0;
        for (int i = 0; i < metrics.length; i++) {
            score += policy.weightAt(i) * policy.orientedMetric(i, metrics[i]);
        }
        String strongest = strongestObjective(policy, metrics);
        return CandidateSignature.builder()
                .candidateId(candidate.getId())
                .metrics(metrics)
                .computedScore(score)
                .tieBreakRank(policy.tieBreakRank(strongest))
                .build();
    }

    /**
     * Objective with the highest oriented metric among the positively weighted
     * policy dimensions. Ties go to the earlier registered objective.
     */
    public static String strongestObjective(ResolvedPolicy policy, double[] metrics) {
        int best = -1;
        double bestValue = Double.NEGATIVE_INFINITY;
        int dimensions = Math.min(policy.getDimensions(), metrics.length);
        for (int i = 0; i < dimensions; i++) {
            if (policy.weightAt(i) <= 0.0) {
                continue;
            }
            double oriented = policy.orientedMetric(i, metrics[i]);
            if (oriented > bestValue) {
                bestValue = oriented;
                best = i;
            }
        }
        return best >= 0 ? policy.getDimensionNames().get(best) : ObjectiveRegistry.FALLBACK;
    }

    private record Outcome(CandidateSignature signature, Diagnostic diagnostic) {

        static Outcome scored(CandidateSignature signature) {
            return new Outcome(signature, null);
        }

        static Outcome malformed(Diagnostic diagnostic) {
            return new Outcome(null, diagnostic);
        }
    }
}
