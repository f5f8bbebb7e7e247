package me.golemcore.hindsight.domain.entity;

import me.golemcore.hindsight.domain.model.Capability;
import me.golemcore.hindsight.domain.model.Entity;
import me.golemcore.hindsight.domain.model.EntityMention;
import me.golemcore.hindsight.domain.model.LlmResponse;
import me.golemcore.hindsight.domain.service.CapabilityInvoker;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.LlmPort;
import me.golemcore.hindsight.ratelimit.TokenBucketRateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmAssistedResolutionStrategyTest {

    private static final Entity JON = Entity.builder()
            .id("e1")
            .bankId("bank")
            .name("Jon")
            .type("person")
            .canonicalName("jon")
            .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
            .build();

    private LlmPort llmPort;
    private LlmAssistedResolutionStrategy strategy;

    @BeforeEach
    void setUp() {
        HindsightProperties properties = new HindsightProperties();
        properties.capability(Capability.REASONING).setMaxAttempts(1);
        llmPort = mock(LlmPort.class);
        when(llmPort.isAvailable()).thenReturn(true);
        CapabilityInvoker invoker = new CapabilityInvoker(properties, new TokenBucketRateLimiter(properties));
        strategy = new LlmAssistedResolutionStrategy(new CanonicalNameResolutionStrategy(properties), llmPort,
                invoker, properties);
    }

    @Test
    void shouldAskLlmInsideAmbiguityBand() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("Yes.").build()));

        assertEquals(JON, strategy.resolve(EntityMention.of("John", "person"), List.of(JON),
                "John said hi").orElseThrow());
    }

    @Test
    void shouldCreateNewEntityWhenLlmSaysNo() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("no").build()));

        assertTrue(strategy.resolve(EntityMention.of("John", "person"), List.of(JON), "").isEmpty());
    }

    @Test
    void shouldTreatLlmFailureAsDifferentEntity() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        assertTrue(strategy.resolve(EntityMention.of("John", "person"), List.of(JON), "").isEmpty());
    }

    @Test
    void shouldSkipLlmForConfidentMatchesAndClearMisses() {
        assertEquals(JON, strategy.resolve(EntityMention.of("JON", "person"), List.of(JON), "").orElseThrow());
        assertTrue(strategy.resolve(EntityMention.of("Margaret", "person"), List.of(JON), "").isEmpty());

        verify(llmPort, never()).chat(any());
    }
}
