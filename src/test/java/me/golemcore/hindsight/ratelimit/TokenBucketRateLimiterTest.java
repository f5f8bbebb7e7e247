package me.golemcore.hindsight.ratelimit;

import me.golemcore.hindsight.domain.model.Capability;
import me.golemcore.hindsight.domain.model.RateLimitResult;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketRateLimiterTest {

    private HindsightProperties properties;
    private TokenBucketRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        properties = new HindsightProperties();
        rateLimiter = new TokenBucketRateLimiter(properties);
    }

    @Test
    void shouldAlwaysAllowWhenUnlimited() {
        for (int i = 0; i < 100; i++) {
            RateLimitResult result = rateLimiter.tryConsume(Capability.EMBEDDING);
            assertTrue(result.isAllowed());
            assertEquals(Long.MAX_VALUE, result.getRemainingTokens());
        }
    }

    @Test
    void shouldThrottleCapabilityAfterConfiguredRequests() {
        properties.capability(Capability.REASONING).setRequestsPerMinute(3);

        for (int i = 0; i < 3; i++) {
            assertTrue(rateLimiter.tryConsume(Capability.REASONING).isAllowed());
        }
        RateLimitResult denied = rateLimiter.tryConsume(Capability.REASONING);

        assertFalse(denied.isAllowed());
        assertTrue(denied.getWaitTime().toMillis() > 0);
    }

    @Test
    void shouldKeepCapabilitiesIndependent() {
        properties.capability(Capability.REASONING).setRequestsPerMinute(1);
        properties.capability(Capability.EXTRACTION).setRequestsPerMinute(1);

        assertTrue(rateLimiter.tryConsume(Capability.REASONING).isAllowed());
        assertFalse(rateLimiter.tryConsume(Capability.REASONING).isAllowed());

        assertTrue(rateLimiter.tryConsume(Capability.EXTRACTION).isAllowed());
    }

    @Test
    void shouldRebuildBucketWhenRateChanges() {
        properties.capability(Capability.RERANK).setRequestsPerMinute(1);
        assertTrue(rateLimiter.tryConsume(Capability.RERANK).isAllowed());
        assertFalse(rateLimiter.tryConsume(Capability.RERANK).isAllowed());

        properties.capability(Capability.RERANK).setRequestsPerMinute(5);

        assertTrue(rateLimiter.tryConsume(Capability.RERANK).isAllowed());
    }
}
