package me.golemcore.hindsight.port.outbound;

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

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Transactional store of banks and their memory graphs. Every operation is
 * scoped to a single bank.
 */
public interface MemoryRepositoryPort {

    Optional<Bank> findBank(String bankId);

    void saveBank(Bank bank);

    List<Bank> listBanks();

    /**
     * Consistent read-only snapshot of a bank; empty for unknown banks.
     */
    BankReadView snapshot(String bankId);

    /**
     * Runs {@code work} against a private working copy of the bank and publishes
     * it atomically when {@code work} returns. If {@code work} throws, nothing is
     * applied and the exception propagates.
     */
    <T> T inTransaction(String bankId, Function<MemoryTransaction, T> work);
}
