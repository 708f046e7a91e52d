package me.golemcore.reposcout.domain.exception;

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

import me.golemcore.reposcout.domain.model.RecommendationFailureKind;

import java.util.List;

/**
 * Thrown when a request names objectives that are not in the registry.
 */
public class UnknownObjectiveException extends RecommendationException {

    private static final long serialVersionUID = 1L;

    private final List<String> unknownObjectives;

    public UnknownObjectiveException(List<String> unknownObjectives) {
        super(RecommendationFailureKind.UNKNOWN_OBJECTIVE,
                "Unknown objective(s): " + String.join(", ", unknownObjectives));
        this.unknownObjectives = List.copyOf(unknownObjectives);
    }

    public List<String> getUnknownObjectives() {
        return unknownObjectives;
    }
}
