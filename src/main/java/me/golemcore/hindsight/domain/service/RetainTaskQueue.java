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
import me.golemcore.hindsight.domain.exception.NotFoundException;
import me.golemcore.hindsight.domain.exception.ValidationException;
import me.golemcore.hindsight.domain.model.AsyncOperation;
import me.golemcore.hindsight.domain.model.OperationState;
import me.golemcore.hindsight.domain.model.RetainBatchResult;
import me.golemcore.hindsight.domain.model.RetainItem;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Background execution of retain batches.
 *
 * <p>
 * Each bank has its own FIFO runner that executes at most one operation at a
 * time, so queued batches of one bank are applied in submission order. Runners
 * of different banks share {@code retainQueueExecutor}, whose pool size bounds
 * concurrency across banks.
 *
 * <p>
 * State machine: {@code pending -> processing -> completed | failed} and
 * {@code pending -> cancelled}. An operation turns {@code processing} only when
 * a worker thread starts it, so one waiting for a free worker can still be
 * cancelled. A
 * batch in which every item failed ends {@code failed}; otherwise
 * {@code completed} with per-item outcomes.
 */
@Service
@Slf4j
public class RetainTaskQueue {

    private final RetainService retainService;
    private final ExecutorService retainQueueExecutor;
    private final HindsightProperties properties;
    private final Clock clock;

    private final Map<String, AsyncOperation> operations = new ConcurrentHashMap<>();
    private final Map<String, BankRunner> runners = new ConcurrentHashMap<>();

    public RetainTaskQueue(RetainService retainService, ExecutorService retainQueueExecutor,
            HindsightProperties properties, Clock clock) {
        this.retainService = retainService;
        this.retainQueueExecutor = retainQueueExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Queues a batch and returns a snapshot of its operation handle.
     */
    public AsyncOperation submit(String bankId, List<RetainItem> items) {
        String id = BankService.requireBankId(bankId);
        if (items == null || items.isEmpty()) {
            throw new ValidationException("Retain batch must contain at least one item");
        }
        AsyncOperation operation = AsyncOperation.builder()
                .id(UUID.randomUUID().toString())
                .bankId(id)
                .itemCount(items.size())
                .createdAt(clock.instant())
                .build();
        runners.computeIfAbsent(id, BankRunner::new).enqueue(operation, List.copyOf(items));
        log.info("[TaskQueue] Queued operation {} for bank {} ({} item(s))", operation.getId(), id, items.size());
        return copyOf(operation);
    }

    /**
     * Cancels a pending operation. An operation that already left the pending
     * state is returned unchanged.
     *
     * @throws NotFoundException
     *             if the operation does not exist
     */
    public AsyncOperation cancel(String operationId) {
        AsyncOperation operation = require(operationId);
        if (!runners.get(operation.getBankId()).cancel(operation)) {
            log.info("[TaskQueue] Cancellation of operation {} refused, state is {}",
                    operationId, currentState(operation));
        }
        return copyOf(operation);
    }

    public Optional<AsyncOperation> getOperation(String operationId) {
        AsyncOperation operation = operationId != null ? operations.get(operationId) : null;
        return Optional.ofNullable(operation).map(this::copyOf);
    }

    /**
     * Every operation of the bank, oldest first.
     */
    public List<AsyncOperation> listOperations(String bankId) {
        String id = BankService.requireBankId(bankId);
        return operations.values().stream()
                .filter(operation -> id.equals(operation.getBankId()))
                .map(this::copyOf)
                .sorted(Comparator.comparing(AsyncOperation::getCreatedAt).thenComparing(AsyncOperation::getId))
                .toList();
    }

    public int countInState(String bankId, OperationState state) {
        return (int) operations.values().stream()
                .filter(operation -> bankId.equals(operation.getBankId()))
                .filter(operation -> currentState(operation) == state)
                .count();
    }

    private AsyncOperation require(String operationId) {
        AsyncOperation operation = operationId != null ? operations.get(operationId) : null;
        if (operation == null) {
            throw new NotFoundException("Operation not found: " + operationId);
        }
        return operation;
    }

    private OperationState currentState(AsyncOperation operation) {
        return copyOf(operation).getState();
    }

    // Operations are mutated only under their bank runner's lock
    private AsyncOperation copyOf(AsyncOperation operation) {
        BankRunner runner = runners.get(operation.getBankId());
        synchronized (runner.lock) {
            return operation.toBuilder().build();
        }
    }

    private record QueuedBatch(AsyncOperation operation, List<RetainItem> items) {
    }

    private final class BankRunner {

        private final String bankId;
        private final Object lock = new Object();
        private final Deque<QueuedBatch> queue = new ArrayDeque<>();

        private boolean running;

        private BankRunner(String bankId) {
            this.bankId = bankId;
        }

        void enqueue(AsyncOperation operation, List<RetainItem> items) {
            synchronized (lock) {
                if (queue.size() >= properties.getQueue().getMaxQueuedPerBank()) {
                    throw new ConflictException("Too many queued operations for bank " + bankId);
                }
                operations.put(operation.getId(), operation);
                queue.addLast(new QueuedBatch(operation, items));
                if (running) {
                    return;
                }
                running = true;
            }
            scheduleNext();
        }

        boolean cancel(AsyncOperation operation) {
            synchronized (lock) {
                if (!operation.getState().canTransitionTo(OperationState.CANCELLED)) {
                    return false;
                }
                queue.removeIf(batch -> batch.operation() == operation);
                transition(operation, OperationState.CANCELLED);
                operation.setFinishedAt(clock.instant());
            }
            log.info("[TaskQueue] Cancelled operation {} for bank {}", operation.getId(), bankId);
            return true;
        }

        private void scheduleNext() {
            QueuedBatch next;
            synchronized (lock) {
                next = queue.pollFirst();
                if (next == null) {
                    running = false;
                    return;
                }
            }
            // Stays pending, and cancellable, until a worker picks it up
            QueuedBatch batch = next;
            try {
                retainQueueExecutor.submit(() -> run(batch));
            } catch (RejectedExecutionException e) {
                log.error("[TaskQueue] Executor rejected operation {} for bank {}", batch.operation().getId(),
                        bankId, e);
                if (start(batch.operation())) {
                    finish(batch.operation(), null, "Task queue is shut down");
                }
            }
        }

        private void run(QueuedBatch batch) {
            AsyncOperation operation = batch.operation();
            if (!start(operation)) {
                log.debug("[TaskQueue] Skipping operation {} for bank {}, cancelled before start",
                        operation.getId(), bankId);
                scheduleNext();
                return;
            }
            try {
                RetainBatchResult result = retainService.retainBatch(bankId, batch.items());
                String error = result.getSucceeded() == 0
                        ? "All " + result.getOutcomes().size() + " item(s) failed: "
                                + result.getOutcomes().get(0).getErrorMessage()
                        : null;
                finish(operation, result, error);
            } catch (Exception e) { // NOSONAR - must not kill executor thread
                log.error("[TaskQueue] Operation {} for bank {} failed", operation.getId(), bankId, e);
                finish(operation, null, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            } finally {
                scheduleNext();
            }
        }

        private boolean start(AsyncOperation operation) {
            synchronized (lock) {
                if (operation.getState() != OperationState.PENDING) {
                    return false;
                }
                transition(operation, OperationState.PROCESSING);
                operation.setStartedAt(clock.instant());
                return true;
            }
        }

        private void finish(AsyncOperation operation, RetainBatchResult result, String errorMessage) {
            synchronized (lock) {
                operation.setResult(result);
                operation.setErrorMessage(errorMessage);
                operation.setFinishedAt(clock.instant());
                transition(operation, errorMessage == null ? OperationState.COMPLETED : OperationState.FAILED);
            }
            log.info("[TaskQueue] Operation {} for bank {} {}", operation.getId(), bankId,
                    errorMessage == null ? "completed" : "failed: " + errorMessage);
        }

        private void transition(AsyncOperation operation, OperationState next) {
            if (!operation.getState().canTransitionTo(next)) {
                throw new IllegalStateException("Operation " + operation.getId() + " cannot move from "
                        + operation.getState() + " to " + next);
            }
            operation.setState(next);
        }
    }
}
