package me.golemcore.hindsight.domain.service;

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

import me.golemcore.hindsight.domain.exception.ConflictException;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.MemoryRepositoryPort;
import me.golemcore.hindsight.port.outbound.MemoryTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Single-writer gate per bank.
 *
 * <p>
 * Every mutating commit (retain, opinion write-back, deletions, profile
 * updates) runs its check-then-write sequence while holding the bank's lock,
 * so two writers can never both decide that a near-duplicate is missing. Writers of different
 * banks never contend. Waiting longer than
 * {@code hindsight.retain.write-lock-timeout-ms} fails with
 * {@link ConflictException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BankWriteCoordinator {

    private final MemoryRepositoryPort repository;
    private final HindsightProperties properties;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T write(String bankId, String operation, Function<MemoryTransaction, T> work) {
        return exclusive(bankId, operation, () -> {
            long start = System.nanoTime();
            T result = repository.inTransaction(bankId, work);
            log.trace("[Bank] {} on bank {} committed in {}ms", operation, bankId,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            return result;
        });
    }

    /**
     * Runs {@code work} while holding the bank's lock, without opening a
     * transaction. Used for read-modify-write of the bank profile.
     */
    public <T> T exclusive(String bankId, String operation, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(bankId, id -> new ReentrantLock(true));
        long timeoutMs = properties.getRetain().getWriteLockTimeoutMs();
        boolean acquired;
        try {
            acquired = lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConflictException("Interrupted while waiting to write bank " + bankId, e);
        }
        if (!acquired) {
            log.warn("[Bank] {} on bank {} gave up after waiting {}ms for the writer lock",
                    operation, bankId, timeoutMs);
            throw new ConflictException("Bank " + bankId + " is busy with another writer");
        }
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}
