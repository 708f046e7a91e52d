package me.golemcore.reposcout.adapter.outbound.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.reposcout.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.reposcout.domain.model.CandidateSignature;
import me.golemcore.reposcout.domain.model.RecommendationResult;
import me.golemcore.reposcout.domain.model.RecommendationSession;
import me.golemcore.reposcout.infrastructure.config.AutoConfiguration;
import me.golemcore.reposcout.infrastructure.config.ReposcoutProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StorageRecommendationStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Duration HOUR = Duration.ofHours(1);

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private StorageRecommendationStore store;

    @BeforeEach
    void setUp() {
        ReposcoutProperties properties = new ReposcoutProperties();
        properties.getStore().setDirectory(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        store = storeAt(NOW);
    }

    @Test
    void sessionSurvivesRestart() throws Exception {
        store.putSession(session("s-1"), HOUR).get();

        Optional<RecommendationSession> loaded = storeAt(NOW.plusSeconds(60)).getSession("s-1").get();

        assertTrue(loaded.isPresent());
        assertEquals(3, loaded.get().getRequestCount());
        assertEquals(NOW, loaded.get().getCreatedAt());
        assertTrue(Files.exists(tempDir.resolve("sessions").resolve("s-1.json")));
    }

    @Test
    void expiredSessionIsMissing() throws Exception {
        store.putSession(session("s-1"), HOUR).get();

        assertTrue(storeAt(NOW.plus(HOUR)).getSession("s-1").get().isEmpty());
    }

    @Test
    void deleteSessionReportsExistence() throws Exception {
        store.putSession(session("s-1"), HOUR).get();

        assertTrue(store.deleteSession("s-1").get());
        assertFalse(store.deleteSession("s-1").get());
        assertTrue(store.getSession("s-1").get().isEmpty());
    }

    @Test
    void closingExpiredSessionReportsNothingClosed() throws Exception {
        store.putSession(session("s-1"), Duration.ZERO).get();

        assertFalse(store.deleteSession("s-1").get());
        assertFalse(Files.exists(tempDir.resolve("sessions").resolve("s-1.json")));
    }

    @Test
    void closingSessionAfterRestartFindsItOnDisk() throws Exception {
        store.putSession(session("s-1"), HOUR).get();

        assertTrue(storeAt(NOW.plusSeconds(60)).deleteSession("s-1").get());
    }

    @Test
    void cachedResultRoundTripsThroughDisk() throws Exception {
        RecommendationResult result = RecommendationResult.builder()
                .harmonyScore(0.65)
                .explanation("Ranked 0 candidate(s)")
                .generatedAt(NOW)
                .build();
        store.putCachedResult("abc123", result, HOUR).get();

        Optional<RecommendationResult> loaded = storeAt(NOW).getCachedResult("abc123").get();

        assertTrue(loaded.isPresent());
        assertEquals(0.65, loaded.get().getHarmonyScore(), 1e-12);
        assertEquals(List.of("Ranked 0 candidate(s)"), loaded.get().getExplanations());
    }

    @Test
    void signaturesMergeAcrossWrites() throws Exception {
        store.putSignatures("fp1", List.of(signature("a", 0.4), signature("b", 0.5)), HOUR).get();
        store.putSignatures("fp1", List.of(signature("b", 0.9), signature("c", 0.1)), HOUR).get();

        Map<String, CandidateSignature> found = storeAt(NOW).getSignatures("fp1", List.of("a", "b", "z")).get();

        assertEquals(2, found.size());
        assertEquals(0.4, found.get("a").getComputedScore(), 1e-12);
        assertEquals(0.9, found.get("b").getComputedScore(), 1e-12);
        assertArrayEquals(new double[] { 0.9, 0.1 }, found.get("b").getMetrics());
    }

    @Test
    void concurrentSignatureWritesForSamePolicyAreAllRetained() throws Exception {
        List<CompletableFuture<Void>> writes = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            String id = "c" + i;
            ids.add(id);
            writes.add(store.putSignatures("fp", List.of(signature(id, i / 20.0)), HOUR));
        }

        CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);

        assertEquals(20, store.getSignatures("fp", ids).get().size());
        assertEquals(20, storeAt(NOW).getSignatures("fp", ids).get().size());
    }

    @Test
    void signaturesAreScopedByPolicy() throws Exception {
        store.putSignatures("fp1", List.of(signature("a", 0.4)), HOUR).get();

        assertTrue(store.getSignatures("fp2", List.of("a")).get().isEmpty());
    }

    @Test
    void evictionRemovesExpiredAndUnreadableEntries() throws Exception {
        store.putSession(session("old"), Duration.ofMinutes(5)).get();
        store.putSession(session("fresh"), HOUR).get();
        store.putCachedResult("r1", RecommendationResult.builder().generatedAt(NOW).build(), Duration.ofMinutes(1))
                .get();
        Files.writeString(tempDir.resolve("signatures").resolve("broken.json"), "{not json");

        StorageRecommendationStore later = storeAt(NOW.plus(Duration.ofMinutes(10)));
        int removed = later.evictExpired().get();

        assertEquals(3, removed);
        assertEquals(List.of("fresh.json"), storage.listObjects("sessions").get());
        assertTrue(storage.listObjects("results").get().isEmpty());
        assertTrue(storage.listObjects("signatures").get().isEmpty());
    }

    @Test
    void unreadableEntryIsTreatedAsMissing() throws Exception {
        Files.writeString(tempDir.resolve("sessions").resolve("s-9.json"), "garbage");

        assertTrue(store.getSession("s-9").get().isEmpty());
    }

    @Test
    void invalidKeyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.getSession("../escape"));
        assertThrows(IllegalArgumentException.class, () -> store.getCachedResult(""));
    }

    private StorageRecommendationStore storeAt(Instant instant) {
        return new StorageRecommendationStore(storage, objectMapper, Clock.fixed(instant, ZoneOffset.UTC));
    }

    private static RecommendationSession session(String id) {
        return RecommendationSession.builder()
                .id(id)
                .requestCount(3)
                .aggregate(List.of(signature("a", 0.7)))
                .createdAt(NOW)
                .updatedAt(NOW)
                .expiresAt(NOW.plus(HOUR))
                .build();
    }

    private static CandidateSignature signature(String id, double score) {
        return CandidateSignature.builder()
                .candidateId(id)
                .metrics(new double[] { score, 0.1 })
                .computedScore(score)
                .tieBreakRank(0)
                .build();
    }
}
