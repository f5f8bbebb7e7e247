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

import me.golemcore.hindsight.domain.model.Capability;
import me.golemcore.hindsight.domain.model.RateLimitResult;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.RateLimitPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token bucket based admission control, one bucket per capability.
 *
 * <p>
 * The bucket size comes from {@code hindsight.capabilities.<capability>.requests-per-minute};
 * zero or a negative value disables throttling for that capability. Buckets
 * are rebuilt when the configured rate changes.
 *
 * @since 1.0
 * @see TokenBucket
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TokenBucketRateLimiter implements RateLimitPort {

    private static final Duration PERIOD = Duration.ofMinutes(1);

    private final HindsightProperties properties;

    private final Map<Capability, TokenBucket> buckets = new ConcurrentHashMap<>();

    @Override
    public RateLimitResult tryConsume(Capability capability) {
        int perMinute = properties.capability(capability).getRequestsPerMinute();
        if (perMinute <= 0) {
            return RateLimitResult.allowed(Long.MAX_VALUE);
        }

        TokenBucket bucket = buckets.compute(capability, (key, existing) -> existing != null
                && existing.getCapacity() == perMinute ? existing : new TokenBucket(perMinute, PERIOD));
        RateLimitResult result = bucket.tryConsume();
        if (!result.isAllowed()) {
            log.debug("[RateLimit] {} throttled, retry in {} ms", capability.getKey(), result.getWaitTime().toMillis());
        }
        return result;
    }
}
