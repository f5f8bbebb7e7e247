package me.golemcore.hindsight.ratelimit;

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

import me.golemcore.hindsight.domain.model.RateLimitResult;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Thread-safe token bucket.
 *
 * <p>
 * Starts full with {@code capacity} tokens and refills continuously over
 * {@code refillPeriod}. Refill is computed lazily on each
 * {@link #tryConsume()} from the time elapsed since the last refill. A denied
 * call reports how long until the next token.
 *
 * @since 1.0
 */
public class TokenBucket {

    private final long capacity;
    private final Duration refillPeriod;
    private final LongSupplier nanoClock;
    private long tokens;
    private long lastRefillNanos;

    public TokenBucket(long capacity, Duration refillPeriod) {
        this(capacity, refillPeriod, System::nanoTime);
    }

    TokenBucket(long capacity, Duration refillPeriod, LongSupplier nanoClock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.refillPeriod = refillPeriod;
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    /**
     * Try to consume one token.
     */
    public synchronized RateLimitResult tryConsume() {
        refill();

        if (tokens > 0) {
            tokens--;
            return RateLimitResult.allowed(tokens);
        }
        return RateLimitResult.denied(Duration.ofNanos(nanosPerToken()));
    }

    public long getCapacity() {
        return capacity;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsedNanos = now - lastRefillNanos;
        if (elapsedNanos <= 0) {
            return;
        }

        long tokensToAdd = elapsedNanos / nanosPerToken();
        if (tokensToAdd > 0) {
            tokens = Math.min(capacity, tokens + tokensToAdd);
            // Keep the fractional remainder so slow trickles still accumulate
            lastRefillNanos = tokens == capacity ? now : lastRefillNanos + tokensToAdd * nanosPerToken();
        }
    }

    private long nanosPerToken() {
        return Math.max(1, refillPeriod.toNanos() / capacity);
    }
}
