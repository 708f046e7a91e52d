package me.golemcore.reposcout.infrastructure.scheduling;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reposcout.domain.exception.StoreUnavailableException;
import me.golemcore.reposcout.domain.service.RecommendationStoreClient;
import me.golemcore.reposcout.infrastructure.config.ReposcoutProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically removes expired sessions, cached results and signatures from
 * the store ({@code reposcout.store.eviction-interval}).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StoreEvictionScheduler {

    private final RecommendationStoreClient storeClient;
    private final ReposcoutProperties properties;

    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> evictionTask;

    @PostConstruct
    public void init() {
        long intervalMillis = properties.getStore().getEvictionInterval().toMillis();
        if (intervalMillis <= 0) {
            log.info("[Eviction] Store eviction disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "store-eviction");
            t.setDaemon(true);
            return t;
        });
        evictionTask = scheduler.scheduleAtFixedRate(this::tick, intervalMillis, intervalMillis,
                TimeUnit.MILLISECONDS);
        log.info("[Eviction] Started with interval: {} ms", intervalMillis);
    }

    @PreDestroy
    public void shutdown() {
        if (evictionTask != null) {
            evictionTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Eviction] Tick skipped: previous run still in progress");
            return;
        }
        try {
            int removed = storeClient.evictExpired();
            log.debug("[Eviction] Removed {} expired entr(ies)", removed);
        } catch (StoreUnavailableException e) {
            log.warn("[Eviction] Store unavailable: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Eviction] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }
}
