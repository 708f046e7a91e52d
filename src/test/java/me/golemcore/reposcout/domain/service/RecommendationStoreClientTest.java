package me.golemcore.reposcout.domain.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import me.golemcore.reposcout.domain.exception.StoreUnavailableException;
import me.golemcore.reposcout.domain.model.Diagnostic;
import me.golemcore.reposcout.domain.model.DiagnosticKind;
import me.golemcore.reposcout.domain.model.RecommendationSession;
import me.golemcore.reposcout.infrastructure.config.ReposcoutProperties;
import me.golemcore.reposcout.infrastructure.metrics.RecommendationMetrics;
import me.golemcore.reposcout.port.outbound.RecommendationStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RecommendationStoreClientTest {

    private RecommendationStorePort storePort;
    private SimpleMeterRegistry meterRegistry;
    private RecommendationStoreClient client;

    @BeforeEach
    void setUp() {
        storePort = mock(RecommendationStorePort.class);
        ReposcoutProperties properties = new ReposcoutProperties();
        properties.getStore().setTimeout(Duration.ofMillis(50));
        properties.getStore().setFirstBackoff(Duration.ofMillis(10));
        meterRegistry = new SimpleMeterRegistry();
        client = new RecommendationStoreClient(storePort, properties, new RecommendationMetrics(meterRegistry));
    }

    @Test
    void shouldReportCacheUnavailableWhenSaveTimesOut() {
        when(storePort.putSession(any(), any())).thenAnswer(invocation -> new CompletableFuture<Void>());
        List<Diagnostic> diagnostics = new ArrayList<>();

        boolean saved = client.saveSession(session("s-1"), diagnostics);

        assertFalse(saved);
        assertEquals(1, diagnostics.size());
        assertEquals(DiagnosticKind.CACHE_UNAVAILABLE, diagnostics.get(0).getKind());
        assertEquals("putSession", diagnostics.get(0).getSubject());
        verify(storePort, times(2)).putSession(any(), any());
        assertEquals(1.0, meterRegistry.get(RecommendationMetrics.CACHE_REQUESTS)
                .tag("tier", RecommendationMetrics.TIER_SESSION)
                .tag("result", RecommendationMetrics.RESULT_ERROR)
                .counter().count(), 0.0);
    }

    @Test
    void shouldSucceedOnRetryAfterTransientFailure() {
        RecommendationSession session = session("s-2");
        when(storePort.getSession("s-2"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk busy")))
                .thenReturn(CompletableFuture.completedFuture(Optional.of(session)));
        List<Diagnostic> diagnostics = new ArrayList<>();

        Optional<RecommendationSession> loaded = client.loadSession("s-2", diagnostics);

        assertTrue(loaded.isPresent());
        assertTrue(diagnostics.isEmpty());
        assertEquals(1.0, meterRegistry.get(RecommendationMetrics.CACHE_REQUESTS)
                .tag("tier", RecommendationMetrics.TIER_SESSION)
                .tag("result", RecommendationMetrics.RESULT_HIT)
                .counter().count(), 0.0);
    }

    @Test
    void shouldFallBackToEmptyResultWhenLookupFails() {
        when(storePort.getCachedResult(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
        List<Diagnostic> diagnostics = new ArrayList<>();

        assertTrue(client.cachedResult("abc", diagnostics).isEmpty());
        assertEquals(DiagnosticKind.CACHE_UNAVAILABLE, diagnostics.get(0).getKind());
    }

    @Test
    void shouldPropagateFailureOnExplicitClose() {
        when(storePort.deleteSession("s-3"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        StoreUnavailableException ex = assertThrows(StoreUnavailableException.class,
                () -> client.closeSession("s-3"));

        assertEquals("deleteSession", ex.getOperation());
    }

    @Test
    void shouldSkipEmptySignatureWrites() {
        client.cacheSignatures("fp", List.of(), new ArrayList<>());

        verify(storePort, times(0)).putSignatures(anyString(), any(), any());
    }

    private static RecommendationSession session(String id) {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");
        return RecommendationSession.builder()
                .id(id)
                .requestCount(1)
                .createdAt(now)
                .updatedAt(now)
                .expiresAt(now.plusSeconds(3600))
                .build();
    }
}
