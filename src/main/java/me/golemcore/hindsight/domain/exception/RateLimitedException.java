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

import java.time.Duration;

/**
 * Capability call was throttled, either by the local token bucket or by the
 * provider.
 */
public class RateLimitedException extends MemoryEngineException {

    private static final long serialVersionUID = 1L;

    private final transient Duration retryAfter;

    public RateLimitedException(String message, Duration retryAfter) {
        super(ErrorKind.RATE_LIMITED, message);
        this.retryAfter = retryAfter != null ? retryAfter : Duration.ZERO;
    }

    public RateLimitedException(String message, Duration retryAfter, Throwable cause) {
        super(ErrorKind.RATE_LIMITED, message, cause);
        this.retryAfter = retryAfter != null ? retryAfter : Duration.ZERO;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
