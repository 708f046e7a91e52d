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

import me.golemcore.reposcout.domain.model.ObjectiveDefinition;
import me.golemcore.reposcout.domain.model.ObjectiveDirection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Closed, ordered vocabulary of objectives a request may ask for.
 *
 * <p>
 * Registration order defines the scoring-dimension basis: the objective
 * registered at position {@code i} owns dimension {@code i} of every candidate
 * metric vector and of every policy weight vector. The vocabulary is extended
 * only by constructing a registry with a different definition list, never at
 * request time.
 *
 * @since 1.0
 * @see ConflictRegistry
 */
@Component
public class ObjectiveRegistry {

    public static final String RELEVANCE = "relevance";
    public static final String BREADTH = "breadth";
    public static final String PRECISION = "precision";
    public static final String SIMPLICITY = "simplicity";
    public static final String CAPABILITY = "capability";
    public static final String SPEED = "speed";
    public static final String THOROUGHNESS = "thoroughness";
    public static final String SECURITY = "security";
    public static final String STABILITY = "stability";
    public static final String COMMUNITY = "community";
    public static final String DOCUMENTATION = "documentation";
    public static final String INTEGRATION_EFFORT = "integration_effort";
    public static final String INNOVATION = "innovation";

    /**
     * Objective substituted for unknown names and used when an intent yields
     * nothing.
     */
    public static final String FALLBACK = RELEVANCE;

    private final List<ObjectiveDefinition> definitions;
    private final Map<String, ObjectiveDefinition> byName;

    public ObjectiveRegistry() {
        this(defaultDefinitions());
    }

    public ObjectiveRegistry(List<ObjectiveDefinition> definitions) {
        Map<String, ObjectiveDefinition> index = new LinkedHashMap<>();
        for (int i = 0; i < definitions.size(); i++) {
            ObjectiveDefinition definition = definitions.get(i);
            if (definition.getDimension() != i) {
                throw new IllegalArgumentException("Objective '" + definition.getName()
                        + "' declares dimension " + definition.getDimension() + " but is registered at " + i);
            }
            if (index.putIfAbsent(definition.getName(), definition) != null) {
                throw new IllegalArgumentException("Duplicate objective: " + definition.getName());
            }
        }
        if (!index.containsKey(FALLBACK)) {
            throw new IllegalArgumentException("Registry must define the fallback objective '" + FALLBACK + "'");
        }
        this.definitions = List.copyOf(definitions);
        this.byName = Collections.unmodifiableMap(index);
    }

    public List<ObjectiveDefinition> all() {
        return definitions;
    }

    public Optional<ObjectiveDefinition> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public ObjectiveDefinition get(String name) {
        ObjectiveDefinition definition = byName.get(name);
        if (definition == null) {
            throw new IllegalArgumentException("Unregistered objective: " + name);
        }
        return definition;
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    /**
     * Size of the scoring-dimension basis.
     */
    public int dimensions() {
        return definitions.size();
    }

    /**
     * Registration position of an objective, used for deterministic ordering.
     */
    public int orderOf(String name) {
        return get(name).getDimension();
    }

    public List<String> names() {
        return definitions.stream().map(ObjectiveDefinition::getName).toList();
    }

    static List<ObjectiveDefinition> defaultDefinitions() {
        List<ObjectiveDefinition> list = new ArrayList<>();
        list.add(define(list, RELEVANCE, ObjectiveDirection.MAXIMIZE,
                "General relevance to the stated intent",
                "relevant", "best", "top", "recommended"));
        list.add(define(list, BREADTH, ObjectiveDirection.MAXIMIZE,
                "Covers a wide range of use cases",
                "comprehensive", "all", "everything", "exhaustive", "broad", "complete", "full coverage"));
        list.add(define(list, PRECISION, ObjectiveDirection.MAXIMIZE,
                "Solves exactly the stated problem",
                "precise", "exact", "exactly", "specific", "laser", "focused", "targeted"));
        list.add(define(list, SIMPLICITY, ObjectiveDirection.MAXIMIZE,
                "Small surface, easy to adopt",
                "simple", "easy", "minimal", "lightweight", "intuitive"));
        list.add(define(list, CAPABILITY, ObjectiveDirection.MAXIMIZE,
                "Rich feature set",
                "powerful", "sophisticated", "advanced", "full-featured", "feature-rich"));
        list.add(define(list, SPEED, ObjectiveDirection.MAXIMIZE,
                "Fast results and low latency",
                "fast", "instant", "instantly", "quick", "quickly", "real-time", "low-latency"));
        list.add(define(list, THOROUGHNESS, ObjectiveDirection.MAXIMIZE,
                "Deep, exhaustive analysis",
                "thorough", "deep", "detailed", "in-depth", "rigorous"));
        list.add(define(list, SECURITY, ObjectiveDirection.MAXIMIZE,
                "Security posture and audit history",
                "secure", "security", "audit", "vulnerability", "safe"));
        list.add(define(list, STABILITY, ObjectiveDirection.MAXIMIZE,
                "Maturity and production readiness",
                "stable", "mature", "production", "reliable", "battle-tested"));
        list.add(define(list, COMMUNITY, ObjectiveDirection.MAXIMIZE,
                "Community size and activity",
                "community", "popular", "active", "maintained"));
        list.add(define(list, DOCUMENTATION, ObjectiveDirection.MAXIMIZE,
                "Quality of documentation and examples",
                "documented", "docs", "documentation", "examples", "tutorial"));
        list.add(define(list, INTEGRATION_EFFORT, ObjectiveDirection.MINIMIZE,
                "Effort needed to integrate into an existing stack",
                "integrate", "integration", "api", "sdk", "drop-in"));
        list.add(define(list, INNOVATION, ObjectiveDirection.MAXIMIZE,
                "Novel or cutting-edge approach",
                "innovative", "cutting-edge", "novel", "modern", "experimental"));
        return list;
    }

    private static ObjectiveDefinition define(List<ObjectiveDefinition> preceding, String name,
            ObjectiveDirection direction, String description, String... keywords) {
        return ObjectiveDefinition.builder()
                .name(name)
                .dimension(preceding.size())
                .direction(direction)
                .description(description)
                .keywords(List.of(keywords))
                .build();
    }
}
