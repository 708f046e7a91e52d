package me.golemcore.reposcout.objective;

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
import me.golemcore.reposcout.domain.model.Objective;
import me.golemcore.reposcout.domain.model.ObjectiveDefinition;
import me.golemcore.reposcout.domain.model.ObjectiveSource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword-based intent classifier.
 *
 * <p>
 * Each registered objective lists keywords (single tokens, hyphenated tokens or
 * space-separated phrases). An objective is inferred when at least one keyword
 * occurs in the intent; its weight starts at {@value #BASE_WEIGHT} and grows by
 * {@value #EXTRA_HIT_WEIGHT} per additional distinct keyword, capped at 1.0.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KeywordIntentClassifier implements IntentClassifier {

    static final double BASE_WEIGHT = 0.6;
    static final double EXTRA_HIT_WEIGHT = 0.1;

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^a-z0-9-]+");

    private final ObjectiveRegistry objectiveRegistry;

    @Override
    public List<Objective> classify(String intent) {
        if (intent == null || intent.isBlank()) {
            return List.of();
        }

        List<String> tokens = Arrays.stream(TOKEN_SEPARATOR.split(intent.toLowerCase(Locale.ROOT)))
                .filter(token -> !token.isEmpty())
                .toList();
        Set<String> tokenSet = new HashSet<>(tokens);
        String normalized = " " + String.join(" ", tokens) + " ";

        List<Objective> inferred = new ArrayList<>();
        for (ObjectiveDefinition definition : objectiveRegistry.all()) {
            int hits = 0;
            for (String keyword : definition.getKeywords()) {
                boolean matched = keyword.indexOf(' ') >= 0
                        ? normalized.contains(" " + keyword + " ")
                        : tokenSet.contains(keyword);
                if (matched) {
                    hits++;
                }
            }
            if (hits > 0) {
                double weight = Math.min(1.0, BASE_WEIGHT + EXTRA_HIT_WEIGHT * (hits - 1));
                inferred.add(Objective.builder()
                        .name(definition.getName())
                        .weight(weight)
                        .direction(definition.getDirection())
                        .source(ObjectiveSource.INFERRED)
                        .build());
            }
        }

        log.debug("[Classifier] Inferred {} objective(s) from intent: {}", inferred.size(),
                inferred.stream().map(Objective::getName).toList());
        return inferred;
    }
}
