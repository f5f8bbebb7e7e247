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

import me.golemcore.hindsight.domain.exception.ErrorKind;

/**
 * External capabilities the engine calls through
 * {@link me.golemcore.hindsight.domain.service.CapabilityInvoker}.
 */
public enum Capability {

    EXTRACTION("extraction", ErrorKind.EXTRACTION_FAILURE),
    EMBEDDING("embedding", ErrorKind.EMBEDDING_FAILURE),
    RERANK("rerank", ErrorKind.RERANK_FAILURE),
    TEMPORAL("temporal", ErrorKind.TEMPORAL_FAILURE),
    REASONING("reasoning", ErrorKind.REASONING_FAILURE);

    private final String key;
    private final ErrorKind failureKind;

    Capability(String key, ErrorKind failureKind) {
        this.key = key;
        this.failureKind = failureKind;
    }

    public String getKey() {
        return key;
    }

    public ErrorKind getFailureKind() {
        return failureKind;
    }
}
