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

import me.golemcore.hindsight.domain.exception.CapabilityException;
import me.golemcore.hindsight.domain.exception.ErrorKind;
import me.golemcore.hindsight.domain.exception.MemoryEngineException;
import me.golemcore.hindsight.domain.exception.RateLimitedException;
import me.golemcore.hindsight.domain.model.Capability;
import me.golemcore.hindsight.domain.model.RateLimitResult;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.RateLimitPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Calls external capabilities (extraction, embedding, rerank, temporal
 * parsing, reasoning) with a per-capability timeout, token-bucket admission
 * and exponential-backoff retries.
 *
 * <p>
 * When attempts run out the call fails with a {@link CapabilityException} of
 * the capability's error kind, or with a {@link RateLimitedException} when the
 * last attempt was throttled. Validation errors raised by an adapter are not
 * retried.
 *
 * <p>
 * Settings come from {@code hindsight.capabilities.<capability>.*}.
 */
@Component
@Slf4j
public class CapabilityInvoker {

    private final HindsightProperties properties;
    private final RateLimitPort rateLimitPort;
    private final Sleeper sleeper;

    @Autowired
    public CapabilityInvoker(HindsightProperties properties, RateLimitPort rateLimitPort) {
        this(properties, rateLimitPort, Thread::sleep);
    }

    CapabilityInvoker(HindsightProperties properties, RateLimitPort rateLimitPort, Sleeper sleeper) {
        this.properties = properties;
        this.rateLimitPort = rateLimitPort;
        this.sleeper = sleeper;
    }

    /**
     * Invokes {@code call} until it succeeds or attempts are exhausted. Blocks
     * the calling thread for the duration of the call and any backoff.
     *
     * @param capability
     *            which capability is being called
     * @param operation
     *            short label for logs
     * @param call
     *            starts one attempt; invoked once per attempt
     */
    public <T> T invoke(Capability capability, String operation, Supplier<CompletableFuture<T>> call) {
        HindsightProperties.CapabilityProperties settings = properties.capability(capability);
        int maxAttempts = Math.max(1, settings.getMaxAttempts());

        Throwable lastError = null;
        Duration retryAfter = Duration.ZERO;
        boolean lastThrottled = false;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long backoffMs = backoffMs(settings, attempt);

            RateLimitResult admission = rateLimitPort.tryConsume(capability);
            if (!admission.isAllowed()) {
                lastThrottled = true;
                retryAfter = admission.getWaitTime();
                lastError = null;
                if (attempt < maxAttempts) {
                    long waitMs = Math.max(backoffMs, retryAfter.toMillis());
                    log.warn("[{}] {} throttled (attempt {}/{}), retrying in {}ms",
                            capability.getKey(), operation, attempt, maxAttempts, waitMs);
                    pause(capability, waitMs, attempt);
                }
                continue;
            }

            CompletableFuture<T> future = null;
            try {
                future = call.get();
                return future.get(settings.getTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                lastError = e;
                lastThrottled = false;
                log.warn("[{}] {} timed out after {}ms (attempt {}/{})",
                        capability.getKey(), operation, settings.getTimeoutMs(), attempt, maxAttempts);
            } catch (ExecutionException | RuntimeException e) {
                Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
                ErrorKind kind = MemoryEngineException.kindOf(cause);
                if (kind == ErrorKind.VALIDATION) {
                    throw (RuntimeException) (cause instanceof RuntimeException ? cause
                            : new CapabilityException(capability, attempt, cause.getMessage(), cause));
                }
                lastError = cause;
                lastThrottled = kind == ErrorKind.RATE_LIMITED;
                if (cause instanceof RateLimitedException rateLimited) {
                    retryAfter = rateLimited.getRetryAfter();
                }
                log.warn("[{}] {} failed (attempt {}/{}): {}",
                        capability.getKey(), operation, attempt, maxAttempts, cause.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CapabilityException(capability, attempt,
                        capability.getKey() + " " + operation + " interrupted", e);
            }

            if (attempt < maxAttempts) {
                long waitMs = lastThrottled ? Math.max(backoffMs, retryAfter.toMillis()) : backoffMs;
                pause(capability, waitMs, attempt);
            }
        }

        if (lastThrottled) {
            throw new RateLimitedException(capability.getKey() + " " + operation + " rate limited after "
                    + maxAttempts + " attempt(s)", retryAfter, lastError);
        }
        String reason = lastError != null ? lastError.getMessage() : "unknown error";
        throw new CapabilityException(capability, maxAttempts, capability.getKey() + " " + operation
                + " failed after " + maxAttempts + " attempt(s): " + reason, lastError);
    }

    private static long backoffMs(HindsightProperties.CapabilityProperties settings, int attempt) {
        double raw = settings.getInitialBackoffMs() * Math.pow(settings.getBackoffMultiplier(), attempt - 1.0);
        return (long) Math.min(raw, settings.getMaxBackoffMs());
    }

    private void pause(Capability capability, long waitMs, int attempt) {
        if (waitMs <= 0) {
            return;
        }
        try {
            sleeper.sleep(waitMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapabilityException(capability, attempt,
                    capability.getKey() + " interrupted during retry backoff", e);
        }
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
