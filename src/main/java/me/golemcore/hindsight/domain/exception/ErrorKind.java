package me.golemcore.hindsight.domain.exception;

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

/**
 * Error taxonomy reported to callers, per item for batch retains.
 */
public enum ErrorKind {

    /**
     * Malformed input.
     */
    VALIDATION,

    /**
     * Bank, document or unit does not exist.
     */
    NOT_FOUND,

    EXTRACTION_FAILURE,
    EMBEDDING_FAILURE,
    RERANK_FAILURE,
    TEMPORAL_FAILURE,
    REASONING_FAILURE,

    /**
     * Concurrent write could not be serialized or applied.
     */
    CONFLICT,

    /**
     * Capability kept throttling after every retry.
     */
    RATE_LIMITED,

    INTERNAL;

    public boolean isCapabilityFailure() {
        return this == EXTRACTION_FAILURE || this == EMBEDDING_FAILURE || this == RERANK_FAILURE
                || this == TEMPORAL_FAILURE || this == REASONING_FAILURE;
    }
}
