package me.golemcore.reposcout.adapter.outbound.catalog;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reposcout.domain.model.CandidateProfile;
import me.golemcore.reposcout.domain.model.Objective;
import me.golemcore.reposcout.infrastructure.config.ReposcoutProperties;
import me.golemcore.reposcout.objective.ObjectiveRegistry;
import me.golemcore.reposcout.port.outbound.CandidateSourcePort;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Candidate source backed by a JSON catalog ({@code reposcout.catalog.location}).
 *
 * <p>
 * Catalog metrics are keyed by objective name and laid out on the registry's
 * scoring-dimension basis. A missing metric becomes {@code NaN}, so the scorer
 * reports the entry as malformed instead of silently scoring it as zero.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CatalogCandidateSource implements CandidateSourcePort {

    private final ReposcoutProperties properties;
    private final ObjectiveRegistry objectiveRegistry;
    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    private volatile List<CandidateProfile> candidates = List.of();

    @PostConstruct
    public void init() {
        String location = properties.getCatalog().getLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("[Catalog] No catalog found at {}, candidate set is empty", location);
            return;
        }
        try (InputStream in = resource.getInputStream()) {
            CatalogFile catalog = objectMapper.readValue(in, CatalogFile.class);
            this.candidates = toProfiles(catalog);
            log.info("[Catalog] Loaded {} candidate(s) from {}", candidates.size(), location);
        } catch (IOException e) {
            log.warn("[Catalog] Failed to load {}: {}", location, e.getMessage());
        }
    }

    @Override
    public List<CandidateProfile> fetchCandidates(List<Objective> objectives) {
        return candidates;
    }

    private List<CandidateProfile> toProfiles(CatalogFile catalog) {
        if (catalog.getRepositories() == null) {
            return List.of();
        }
        List<CandidateProfile> profiles = new ArrayList<>(catalog.getRepositories().size());
        Set<String> unknownMetrics = new TreeSet<>();
        for (CatalogEntry entry : catalog.getRepositories()) {
            profiles.add(CandidateProfile.builder()
                    .id(entry.getId())
                    .name(entry.getName())
                    .url(entry.getUrl())
                    .primaryLanguage(entry.getPrimaryLanguage())
                    .metrics(toVector(entry.getMetrics(), unknownMetrics))
                    .build());
        }
        if (!unknownMetrics.isEmpty()) {
            log.warn("[Catalog] Ignoring unknown metric(s): {}", unknownMetrics);
        }
        return List.copyOf(profiles);
    }

    private double[] toVector(Map<String, Double> metrics, Set<String> unknownMetrics) {
        if (metrics == null) {
            return null;
        }
        double[] vector = new double[objectiveRegistry.dimensions()];
        for (int i = 0; i < vector.length; i++) {
            Double value = metrics.get(objectiveRegistry.names().get(i));
            vector[i] = value != null ? value : Double.NaN;
        }
        for (String name : metrics.keySet()) {
            if (!objectiveRegistry.contains(name)) {
                unknownMetrics.add(name);
            }
        }
        return vector;
    }

    @Data
    @NoArgsConstructor
    static class CatalogFile {
        private List<CatalogEntry> repositories;
    }

    @Data
    @NoArgsConstructor
    static class CatalogEntry {
        private String id;
        private String name;
        private String url;
        private String primaryLanguage;
        private Map<String, Double> metrics;
    }
}
