package me.golemcore.hindsight.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Handle of a queued batch retain. State changes are made by the task queue
 * under its own lock; callers receive copies.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class AsyncOperation {

    public enum Kind {
        RETAIN_BATCH
    }

    private String id;
    private String bankId;

    @Builder.Default
    private Kind kind = Kind.RETAIN_BATCH;

    @Builder.Default
    private OperationState state = OperationState.PENDING;

    private int itemCount;
    private String errorMessage;
    private RetainBatchResult result;
    private Instant createdAt;
    private Instant startedAt;
    private Instant finishedAt;
}
