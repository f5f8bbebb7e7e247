package me.golemcore.hindsight.adapter.outbound.llm;

import me.golemcore.hindsight.domain.exception.ErrorKind;
import me.golemcore.hindsight.domain.exception.RateLimitedException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ProviderErrorsTest {

    // ===== isRateLimitError =====

    @Test
    void shouldDetectRateLimitErrors() {
        assertTrue(ProviderErrors.isRateLimitError(new RuntimeException("rate_limit exceeded")));
        assertTrue(ProviderErrors.isRateLimitError(new RuntimeException("token_quota_exceeded")));
        assertTrue(ProviderErrors.isRateLimitError(new RuntimeException("Too Many Requests")));
        assertTrue(ProviderErrors.isRateLimitError(new RuntimeException("HTTP 429")));
    }

    @Test
    void shouldDetectRateLimitInCauseChain() {
        RuntimeException inner = new RuntimeException("rate_limit");
        RuntimeException outer = new RuntimeException("Wrapper", inner);

        assertTrue(ProviderErrors.isRateLimitError(outer));
    }

    @Test
    void shouldNotDetectNonRateLimitErrors() {
        assertFalse(ProviderErrors.isRateLimitError(new RuntimeException("Connection refused")));
        assertFalse(ProviderErrors.isRateLimitError(new RuntimeException((String) null)));
    }

    // ===== translate =====

    @Test
    void shouldTranslateThrottlingWithServerRequestedWait() {
        RuntimeException error = new RuntimeException("429 Too Many Requests {\"retry_after\": 7}");

        RuntimeException translated = ProviderErrors.translate("openai", error);

        RateLimitedException limited = assertInstanceOf(RateLimitedException.class, translated);
        assertEquals(ErrorKind.RATE_LIMITED, limited.getKind());
        assertEquals(Duration.ofSeconds(7), limited.getRetryAfter());
        assertSame(error, limited.getCause());
    }

    @Test
    void shouldTranslateThrottlingWithoutWait() {
        RateLimitedException limited = assertInstanceOf(RateLimitedException.class,
                ProviderErrors.translate("openai", new RuntimeException("rate_limit")));

        assertEquals(Duration.ZERO, limited.getRetryAfter());
    }

    @Test
    void shouldPassOtherErrorsThrough() {
        RuntimeException error = new IllegalStateException("Connection refused");

        assertSame(error, ProviderErrors.translate("openai", error));
    }

    @Test
    void shouldReturnMinusOneWhenNoWaitGiven() {
        assertEquals(-1, ProviderErrors.extractResetSeconds(new RuntimeException("rate_limit")));
        assertEquals(30, ProviderErrors.extractResetSeconds(
                new RuntimeException("outer", new RuntimeException("reset_seconds=30"))));
    }
}
