package me.golemcore.hindsight.adapter.outbound.repository;

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

import me.golemcore.hindsight.domain.model.Bank;
import me.golemcore.hindsight.port.outbound.BankReadView;
import me.golemcore.hindsight.port.outbound.MemoryRepositoryPort;
import me.golemcore.hindsight.port.outbound.MemoryTransaction;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * In-memory {@link MemoryRepositoryPort} with copy-on-write transactions.
 *
 * <p>
 * Each bank holds one published, frozen {@link BankState}. A transaction
 * copies it, applies the work to the copy and swaps the reference; readers
 * keep whatever state they already grabbed. Commits of one bank are
 * serialized by a per-bank lock, banks never share state.
 *
 * <p>
 * When snapshots are enabled, the committed state is written through
 * {@link BankSnapshotStore} before it is published, so a failed write leaves
 * the bank unchanged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemoryMemoryRepository implements MemoryRepositoryPort {

    private final BankSnapshotStore snapshotStore;

    private final Map<String, BankHolder> holders = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        for (BankSnapshot snapshot : snapshotStore.loadAll()) {
            String bankId = snapshot.bank().getBankId();
            try {
                BankHolder holder = new BankHolder();
                holder.bank = copyOf(snapshot.bank());
                holder.state = BankState.restore(snapshot).freeze();
                holders.put(bankId, holder);
            } catch (IllegalArgumentException e) {
                log.warn("[Repository] Discarding inconsistent snapshot of bank {}: {}", bankId, e.getMessage());
            }
        }
    }

    @Override
    public Optional<Bank> findBank(String bankId) {
        BankHolder holder = holders.get(bankId);
        if (holder == null || holder.bank == null) {
            return Optional.empty();
        }
        return Optional.of(copyOf(holder.bank));
    }

    @Override
    public void saveBank(Bank bank) {
        BankHolder holder = holderOf(bank.getBankId());
        holder.commitLock.lock();
        try {
            Bank stored = copyOf(bank);
            snapshotStore.save(holder.state.toSnapshot(stored));
            holder.bank = stored;
        } finally {
            holder.commitLock.unlock();
        }
    }

    @Override
    public List<Bank> listBanks() {
        return holders.values().stream()
                .map(holder -> holder.bank)
                .filter(bank -> bank != null)
                .map(InMemoryMemoryRepository::copyOf)
                .sorted(Comparator.comparing(Bank::getBankId))
                .toList();
    }

    @Override
    public BankReadView snapshot(String bankId) {
        BankHolder holder = holders.get(bankId);
        return holder != null ? holder.state : BankState.empty(bankId).freeze();
    }

    @Override
    public <T> T inTransaction(String bankId, Function<MemoryTransaction, T> work) {
        BankHolder holder = holderOf(bankId);
        holder.commitLock.lock();
        try {
            BankState working = holder.state.copy();
            T result = work.apply(working);
            working.freeze();
            if (holder.bank != null) {
                snapshotStore.save(working.toSnapshot(holder.bank));
            }
            holder.state = working;
            return result;
        } finally {
            holder.commitLock.unlock();
        }
    }

    private BankHolder holderOf(String bankId) {
        return holders.computeIfAbsent(bankId, id -> {
            BankHolder holder = new BankHolder();
            holder.state = BankState.empty(id).freeze();
            return holder;
        });
    }

    private static Bank copyOf(Bank bank) {
        return bank.toBuilder()
                .personality(bank.getPersonality().toBuilder().build())
                .disposition(bank.getDisposition().toBuilder().build())
                .build();
    }

    private static final class BankHolder {
        private final ReentrantLock commitLock = new ReentrantLock();
        private volatile Bank bank;
        private volatile BankState state;
    }
}
