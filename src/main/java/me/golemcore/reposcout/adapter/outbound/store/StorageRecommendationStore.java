package me.golemcore.reposcout.adapter.outbound.store;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reposcout.domain.model.CandidateSignature;
import me.golemcore.reposcout.domain.model.RecommendationResult;
import me.golemcore.reposcout.domain.model.RecommendationSession;
import me.golemcore.reposcout.port.outbound.RecommendationStorePort;
import me.golemcore.reposcout.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * {@link RecommendationStorePort} backed by JSON files through the
 * {@link StoragePort}.
 *
 * <p>
 * Every entry is an envelope {@code {expiresAt, payload}} stored as
 * {@code <tier>/<key>.json}. An in-memory index mirrors every entry written or
 * read, so repeated lookups in one process do not touch the disk. Unreadable
 * files are treated as missing and removed by the next eviction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageRecommendationStore implements RecommendationStorePort {

    static final String SESSIONS_DIR = "sessions";
    static final String RESULTS_DIR = "results";
    static final String SIGNATURES_DIR = "signatures";

    private static final String SUFFIX = ".json";
    private static final Pattern KEY_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,128}$");

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, StoredEntry<RecommendationSession>> sessions = new ConcurrentHashMap<>();
    private final Map<String, StoredEntry<RecommendationResult>> results = new ConcurrentHashMap<>();
    private final Map<String, StoredEntry<List<CandidateSignature>>> signatures = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> signatureWrites = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Optional<RecommendationSession>> getSession(String sessionId) {
        return read(SESSIONS_DIR, sessionId, sessions, RecommendationSession.class);
    }

    @Override
    public CompletableFuture<Void> putSession(RecommendationSession session, Duration ttl) {
        return write(SESSIONS_DIR, session.getId(), sessions, new StoredEntry<>(expiry(ttl), session));
    }

    /**
     * Removes the session and its file.
     *
     * @return {@code true} only when a live (unexpired) session existed
     */
    @Override
    public CompletableFuture<Boolean> deleteSession(String sessionId) {
        return getSession(sessionId).thenCompose(live -> {
            sessions.remove(sessionId);
            return storagePort.deleteObject(SESSIONS_DIR, sessionId + SUFFIX)
                    .thenApply(ignored -> {
                        if (live.isPresent()) {
                            log.debug("[Store] Session {} closed", sessionId);
                        }
                        return live.isPresent();
                    });
        });
    }

    @Override
    public CompletableFuture<Optional<RecommendationResult>> getCachedResult(String key) {
        return read(RESULTS_DIR, key, results, RecommendationResult.class);
    }

    @Override
    public CompletableFuture<Void> putCachedResult(String key, RecommendationResult result, Duration ttl) {
        return write(RESULTS_DIR, key, results, new StoredEntry<>(expiry(ttl), result));
    }

    @Override
    public CompletableFuture<Map<String, CandidateSignature>> getSignatures(String policyFingerprint,
            Collection<String> candidateIds) {
        return read(SIGNATURES_DIR, policyFingerprint, signatures, signatureListType())
                .thenApply(stored -> {
                    Map<String, CandidateSignature> found = new LinkedHashMap<>();
                    if (stored.isEmpty()) {
                        return found;
                    }
                    Set<String> wanted = Set.copyOf(candidateIds);
                    for (CandidateSignature signature : stored.get()) {
                        if (wanted.contains(signature.getCandidateId())) {
                            found.put(signature.getCandidateId(), signature);
                        }
                    }
                    return found;
                });
    }

    /**
     * Merges into the stored signatures of the fingerprint. Merges for one
     * fingerprint run one after another, each starting once the previous write
     * has settled.
     */
    @Override
    public CompletableFuture<Void> putSignatures(String policyFingerprint, List<CandidateSignature> fresh,
            Duration ttl) {
        requireKey(policyFingerprint);
        CompletableFuture<Void> merge = signatureWrites.compute(policyFingerprint, (key, previous) -> {
            CompletableFuture<Void> settled = previous != null
                    ? previous.exceptionally(error -> null)
                    : CompletableFuture.completedFuture(null);
            return settled.thenCompose(ignored -> mergeSignatures(key, fresh, ttl));
        });
        merge.whenComplete((ignored, error) -> signatureWrites.remove(policyFingerprint, merge));
        return merge;
    }

    private CompletableFuture<Void> mergeSignatures(String policyFingerprint, List<CandidateSignature> fresh,
            Duration ttl) {
        return read(SIGNATURES_DIR, policyFingerprint, signatures, signatureListType())
                .thenCompose(existing -> {
                    Map<String, CandidateSignature> merged = new LinkedHashMap<>();
                    existing.ifPresent(list -> list.forEach(s -> merged.put(s.getCandidateId(), s)));
                    fresh.forEach(s -> merged.put(s.getCandidateId(), s));
                    StoredEntry<List<CandidateSignature>> entry = new StoredEntry<>(expiry(ttl),
                            List.copyOf(merged.values()));
                    return write(SIGNATURES_DIR, policyFingerprint, signatures, entry);
                });
    }

    @Override
    public CompletableFuture<Integer> evictExpired() {
        Instant now = Instant.now(clock);
        return evictTier(SESSIONS_DIR, sessions, now)
                .thenCombine(evictTier(RESULTS_DIR, results, now), Integer::sum)
                .thenCombine(evictTier(SIGNATURES_DIR, signatures, now), Integer::sum)
                .whenComplete((removed, error) -> {
                    if (removed != null && removed > 0) {
                        log.info("[Store] Evicted {} expired entr(ies)", removed);
                    }
                });
    }

    private <T> CompletableFuture<Optional<T>> read(String directory, String key,
            Map<String, StoredEntry<T>> index, Class<T> payloadType) {
        return read(directory, key, index, objectMapper.getTypeFactory().constructType(payloadType));
    }

    private <T> CompletableFuture<Optional<T>> read(String directory, String key,
            Map<String, StoredEntry<T>> index, JavaType payloadType) {
        requireKey(key);
        Instant now = Instant.now(clock);
        StoredEntry<T> cached = index.get(key);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached.isExpired(now)
                    ? Optional.empty()
                    : Optional.of(cached.payload()));
        }
        return storagePort.getText(directory, key + SUFFIX).thenApply(json -> {
            if (json == null) {
                return Optional.empty();
            }
            StoredEntry<T> entry = parse(directory, key, json, payloadType);
            if (entry == null || entry.isExpired(now)) {
                return Optional.empty();
            }
            index.putIfAbsent(key, entry);
            return Optional.of(entry.payload());
        });
    }

    private <T> CompletableFuture<Void> write(String directory, String key, Map<String, StoredEntry<T>> index,
            StoredEntry<T> entry) {
        requireKey(key);
        String json;
        try {
            json = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Failed to serialize " + directory + "/" + key, e));
        }
        return storagePort.putTextAtomic(directory, key + SUFFIX, json)
                .thenRun(() -> index.put(key, entry));
    }

    private <T> StoredEntry<T> parse(String directory, String key, String json, JavaType payloadType) {
        JavaType entryType = objectMapper.getTypeFactory().constructParametricType(StoredEntry.class, payloadType);
        try {
            return objectMapper.readValue(json, entryType);
        } catch (JsonProcessingException e) {
            log.warn("[Store] Ignoring unreadable entry {}/{}: {}", directory, key, e.getOriginalMessage());
            return null;
        }
    }

    private <T> CompletableFuture<Integer> evictTier(String directory, Map<String, StoredEntry<T>> index,
            Instant now) {
        Set<String> removed = ConcurrentHashMap.newKeySet();
        index.entrySet().removeIf(e -> {
            if (e.getValue().isExpired(now)) {
                removed.add(e.getKey());
                return true;
            }
            return false;
        });

        return storagePort.listObjects(directory).thenCompose(files -> {
            List<CompletableFuture<Void>> deletions = new ArrayList<>();
            for (String file : files) {
                if (!file.endsWith(SUFFIX)) {
                    continue;
                }
                String key = file.substring(0, file.length() - SUFFIX.length());
                deletions.add(storagePort.getText(directory, file)
                        .thenCompose(json -> json != null && isStale(json, now)
                                ? storagePort.deleteObject(directory, file)
                                : CompletableFuture.completedFuture(false))
                        .thenAccept(deleted -> {
                            if (Boolean.TRUE.equals(deleted)) {
                                index.remove(key);
                                removed.add(key);
                            }
                        }));
            }
            return CompletableFuture.allOf(deletions.toArray(new CompletableFuture[0]))
                    .thenApply(ignored -> removed.size());
        });
    }

    private boolean isStale(String json, Instant now) {
        try {
            JsonNode expiresAt = objectMapper.readTree(json).path("expiresAt");
            return !expiresAt.isTextual() || !Instant.parse(expiresAt.asText()).isAfter(now);
        } catch (JsonProcessingException | DateTimeException e) {
            return true;
        }
    }

    private JavaType signatureListType() {
        return objectMapper.getTypeFactory().constructCollectionType(List.class, CandidateSignature.class);
    }

    private Instant expiry(Duration ttl) {
        return Instant.now(clock).plus(ttl);
    }

    private static void requireKey(String key) {
        if (key == null || !KEY_PATTERN.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid store key: " + key);
        }
    }

    record StoredEntry<T>(Instant expiresAt, T payload) {

        boolean isExpired(Instant now) {
            return !expiresAt.isAfter(now);
        }
    }
}
