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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.reposcout.domain.exception.SessionBusyException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes read-modify-write work per session id.
 *
 * <p>
 * Work on one session runs one at a time; distinct sessions proceed
 * independently. A lock lives only while some caller holds or waits for it.
 */
@Service
@Slf4j
public class SessionCoordinator {

    private static final Duration DEFAULT_LOCK_WAIT = Duration.ofSeconds(30);

    private final Duration lockWait;
    private final Map<String, SessionLock> locks = new ConcurrentHashMap<>();

    public SessionCoordinator() {
        this(DEFAULT_LOCK_WAIT);
    }

    SessionCoordinator(Duration lockWait) {
        this.lockWait = lockWait;
    }

    public <T> T runExclusive(String sessionId, Supplier<T> work) {
        SessionLock sessionLock = locks.compute(sessionId, (id, existing) -> {
            SessionLock lock = existing != null ? existing : new SessionLock();
            lock.users++;
            return lock;
        });
        try {
            if (!sessionLock.lock.tryLock(lockWait.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[Session] Timed out waiting {} ms for session {}", lockWait.toMillis(), sessionId);
                throw new SessionBusyException(sessionId);
            }
            try {
                return work.get();
            } finally {
                sessionLock.lock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for session " + sessionId, e);
        } finally {
            locks.computeIfPresent(sessionId, (id, lock) -> --lock.users == 0 ? null : lock);
        }
    }

    int activeSessions() {
        return locks.size();
    }

    private static final class SessionLock {

        private final ReentrantLock lock = new ReentrantLock();

        // guarded by the map's per-key compute
        private int users;
    }
}
