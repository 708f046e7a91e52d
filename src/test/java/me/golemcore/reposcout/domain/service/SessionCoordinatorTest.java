package me.golemcore.reposcout.domain.service;

import me.golemcore.reposcout.domain.exception.SessionBusyException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionCoordinatorTest {

    @Test
    void shouldSerializeWorkOnSameSession() throws Exception {
        SessionCoordinator coordinator = new SessionCoordinator();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        try {
            Future<?>[] futures = new Future<?>[16];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = executor.submit(() -> coordinator.runExclusive("s-1", () -> {
                    int now = concurrent.incrementAndGet();
                    maxConcurrent.accumulateAndGet(now, Math::max);
                    sleep(5);
                    concurrent.decrementAndGet();
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, maxConcurrent.get());
        assertEquals(0, coordinator.activeSessions());
    }

    @Test
    void shouldRunDistinctSessionsIndependently() throws Exception {
        SessionCoordinator coordinator = new SessionCoordinator();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch bothInside = new CountDownLatch(2);
        try {
            Future<Boolean> first = executor.submit(() -> coordinator.runExclusive("a", () -> await(bothInside)));
            Future<Boolean> second = executor.submit(() -> coordinator.runExclusive("b", () -> await(bothInside)));

            assertTrue(first.get(10, TimeUnit.SECONDS));
            assertTrue(second.get(10, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldFailWhenSessionStaysBusy() throws Exception {
        SessionCoordinator coordinator = new SessionCoordinator(Duration.ofMillis(50));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        try {
            Future<Object> holder = executor.submit(() -> coordinator.runExclusive("s-1", () -> {
                holding.countDown();
                await(release);
                return null;
            }));
            assertTrue(holding.await(5, TimeUnit.SECONDS));

            SessionBusyException ex = assertThrows(SessionBusyException.class,
                    () -> coordinator.runExclusive("s-1", () -> "never"));
            assertEquals("s-1", ex.getSessionId());

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
        assertEquals(0, coordinator.activeSessions());
    }

    private static boolean await(CountDownLatch latch) {
        latch.countDown();
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
