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
 * Classification of request-level failures returned to the caller.
 */
public enum RecommendationFailureKind {

    /**
     * The request named an objective that is not registered. User-correctable.
     */
    UNKNOWN_OBJECTIVE,

    /**
     * Requested objectives conflict too strongly to reach the minimum harmony
     * score. The caller should relax one side of an offending pair.
     */
    UNRESOLVABLE_CONFLICT
}
