package me.golemcore.hindsight.adapter.outbound.llm;

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

import me.golemcore.hindsight.domain.exception.RateLimitedException;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps provider client failures onto the engine's exceptions so that the
 * capability invoker can tell throttling from other errors.
 */
public final class ProviderErrors {

    private static final Pattern RESET_SECONDS_PATTERN = Pattern
            .compile("\"?(?:reset_seconds|retry_after)\"?\\s*[:=]\\s*(\\d+)");

    private ProviderErrors() {
    }

    /**
     * Wraps {@code error} into {@link RateLimitedException} when it signals
     * throttling, otherwise returns it unchanged.
     */
    public static RuntimeException translate(String provider, RuntimeException error) {
        if (!isRateLimitError(error)) {
            return error;
        }
        long resetSeconds = extractResetSeconds(error);
        Duration retryAfter = resetSeconds > 0 ? Duration.ofSeconds(resetSeconds) : Duration.ZERO;
        return new RateLimitedException(provider + " rate limit hit: " + error.getMessage(), retryAfter, error);
    }

    static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof dev.langchain4j.exception.RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429") || msg.contains("token_quota_exceeded"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Server-requested wait in seconds, or -1 when the error carries none.
     */
    static long extractResetSeconds(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null) {
                Matcher matcher = RESET_SECONDS_PATTERN.matcher(msg);
                if (matcher.find()) {
                    try {
                        return Long.parseLong(matcher.group(1));
                    } catch (NumberFormatException ignored) {
                        // fall through
                    }
                }
            }
            current = current.getCause();
        }
        return -1;
    }
}
