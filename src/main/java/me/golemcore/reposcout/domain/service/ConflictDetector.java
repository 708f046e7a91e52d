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
import me.golemcore.reposcout.domain.model.DetectedConflict;
import me.golemcore.reposcout.domain.model.Objective;
import me.golemcore.reposcout.objective.ConflictRegistry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds registered trade-offs among the objectives of a request.
 *
 * <p>
 * Every unordered pair of present objectives is looked up in the
 * {@link ConflictRegistry}. An empty result is a success state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConflictDetector {

    private final ConflictRegistry conflictRegistry;

    public List<DetectedConflict> detect(List<Objective> objectives) {
        List<String> present = objectives.stream()
                .filter(o -> o.getWeight() > 0.0)
                .map(Objective::getName)
                .distinct()
                .toList();

        List<DetectedConflict> conflicts = new ArrayList<>();
        for (int i = 0; i < present.size(); i++) {
            for (int j = i + 1; j < present.size(); j++) {
                conflictRegistry.find(present.get(i), present.get(j))
                        .map(DetectedConflict::from)
                        .ifPresent(conflicts::add);
            }
        }
        conflicts.sort(DetectedConflict.CANONICAL_ORDER);

        if (!conflicts.isEmpty()) {
            log.debug("[Detector] {} conflict(s): {}", conflicts.size(),
                    conflicts.stream().map(DetectedConflict::describe).toList());
        }
        return List.copyOf(conflicts);
    }
}
