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

/**
 * Non-fatal conditions recorded while serving a recommendation request.
 */
public enum DiagnosticKind {

    /**
     * A candidate had a metric vector of the wrong dimensionality or with
     * non-finite values and was skipped.
     */
    MALFORMED_CANDIDATE,

    /**
     * The session/cache store failed or timed out; request-scoped state was used
     * instead.
     */
    CACHE_UNAVAILABLE,

    /**
     * The scoring time budget elapsed before every candidate was scored.
     */
    TIMEOUT,

    /**
     * The scoring batch was cancelled by the caller.
     */
    CANCELLED
}
