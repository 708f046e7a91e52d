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

import me.golemcore.reposcout.domain.model.DiagnosticKind;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation handle for a scoring batch.
 *
 * <p>
 * Cancelling only stops workers from starting further candidates; signatures
 * already produced stay usable. The first reason recorded wins.
 */
public final class ScoringCancellation {

    private final AtomicReference<DiagnosticKind> reason = new AtomicReference<>();
    private final CompletableFuture<DiagnosticKind> stopped = new CompletableFuture<>();

    /**
     * Caller-initiated cancellation.
     */
    public void cancel() {
        stop(DiagnosticKind.CANCELLED);
    }

    void expire() {
        stop(DiagnosticKind.TIMEOUT);
    }

    private void stop(DiagnosticKind kind) {
        if (reason.compareAndSet(null, kind)) {
            stopped.complete(kind);
        }
    }

    CompletableFuture<DiagnosticKind> whenStopped() {
        return stopped;
    }

    public boolean isStopped() {
        return reason.get() != null;
    }

    DiagnosticKind getReason() {
        return reason.get();
    }
}
