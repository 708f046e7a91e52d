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

import me.golemcore.reposcout.domain.model.ConflictPair;
import me.golemcore.reposcout.domain.model.ConflictSeverity;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static registry of objective pairs that trade off against each other.
 *
 * <p>
 * Every pair must reference objectives known to the {@link ObjectiveRegistry}.
 * The registry is immutable once built.
 *
 * @since 1.0
 */
@Component
public class ConflictRegistry {

    private final List<ConflictPair> pairs;
    private final Map<String, ConflictPair> byKey;

    @Autowired
    public ConflictRegistry(ObjectiveRegistry objectiveRegistry) {
        this(objectiveRegistry, defaultPairs());
    }

    public ConflictRegistry(ObjectiveRegistry objectiveRegistry, List<ConflictPair> pairs) {
        Map<String, ConflictPair> index = new LinkedHashMap<>();
        for (ConflictPair pair : pairs) {
            if (pair.getFirst().equals(pair.getSecond())) {
                throw new IllegalArgumentException("Objective cannot conflict with itself: " + pair.getFirst());
            }
            if (!objectiveRegistry.contains(pair.getFirst()) || !objectiveRegistry.contains(pair.getSecond())) {
                throw new IllegalArgumentException("Conflict references unregistered objective: " + pair.key());
            }
            if (index.putIfAbsent(pair.key(), pair) != null) {
                throw new IllegalArgumentException("Duplicate conflict pair: " + pair.key());
            }
        }
        this.pairs = List.copyOf(pairs);
        this.byKey = Collections.unmodifiableMap(index);
    }

    public List<ConflictPair> all() {
        return pairs;
    }

    public Optional<ConflictPair> find(String a, String b) {
        if (a == null || b == null || a.equals(b)) {
            return Optional.empty();
        }
        String key = a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
        return Optional.ofNullable(byKey.get(key));
    }

    static List<ConflictPair> defaultPairs() {
        List<ConflictPair> list = new ArrayList<>();
        list.add(ConflictPair.of(ObjectiveRegistry.BREADTH, ObjectiveRegistry.PRECISION, ConflictSeverity.HARD,
                "Infinite scope versus laser-precise answers"));
        list.add(ConflictPair.of(ObjectiveRegistry.SPEED, ObjectiveRegistry.THOROUGHNESS, ConflictSeverity.HARD,
                "Exhaustive analysis versus instant results"));
        list.add(ConflictPair.of(ObjectiveRegistry.CAPABILITY, ObjectiveRegistry.SIMPLICITY,
                ConflictSeverity.MODERATE, "Sophisticated processing versus a simple interface"));
        list.add(ConflictPair.of(ObjectiveRegistry.BREADTH, ObjectiveRegistry.SPEED, ConflictSeverity.MODERATE,
                "Covering everything versus answering quickly"));
        list.add(ConflictPair.of(ObjectiveRegistry.INNOVATION, ObjectiveRegistry.STABILITY,
                ConflictSeverity.MODERATE, "Cutting-edge approaches versus production maturity"));
        list.add(ConflictPair.of(ObjectiveRegistry.CAPABILITY, ObjectiveRegistry.INTEGRATION_EFFORT,
                ConflictSeverity.LOW, "Feature-rich tools cost more to integrate"));
        list.add(ConflictPair.of(ObjectiveRegistry.SIMPLICITY, ObjectiveRegistry.THOROUGHNESS, ConflictSeverity.LOW,
                "Deep analysis versus an easy-to-follow answer"));
        return list;
    }
}
