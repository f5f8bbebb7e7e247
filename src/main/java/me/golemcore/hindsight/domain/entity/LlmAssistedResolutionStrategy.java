package me.golemcore.hindsight.domain.entity;

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

import me.golemcore.hindsight.domain.exception.MemoryEngineException;
import me.golemcore.hindsight.domain.model.Capability;
import me.golemcore.hindsight.domain.model.Entity;
import me.golemcore.hindsight.domain.model.EntityMention;
import me.golemcore.hindsight.domain.model.LlmRequest;
import me.golemcore.hindsight.domain.model.LlmResponse;
import me.golemcore.hindsight.domain.service.CapabilityInvoker;
import me.golemcore.hindsight.domain.service.TextSupport;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.LlmPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * Canonical-name resolution with an LLM tie-breaker for the ambiguity band.
 *
 * <p>
 * Matches at or above the resolution threshold and misses below
 * {@code hindsight.entity.ambiguity-floor} are decided by name alone. In
 * between, the LLM is asked whether both names denote the same thing; any
 * capability failure counts as "no" and yields a new entity.
 *
 * <p>
 * Enabled by {@code hindsight.entity.llm-disambiguation-enabled=true}.
 */
@Component
@Primary
@ConditionalOnProperty(prefix = "hindsight.entity", name = "llm-disambiguation-enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class LlmAssistedResolutionStrategy implements EntityResolutionStrategy {

    private static final String SYSTEM_PROMPT = """
            You decide whether two names refer to the same real-world entity.
            Answer with a single word: yes or no.""";

    private final CanonicalNameResolutionStrategy canonicalStrategy;
    private final LlmPort llmPort;
    private final CapabilityInvoker capabilityInvoker;
    private final HindsightProperties properties;

    @Override
    public Optional<Entity> resolve(EntityMention mention, Collection<Entity> candidates, String contextText) {
        Optional<EntityMatch> best = canonicalStrategy.bestMatch(mention, candidates);
        if (best.isEmpty()) {
            return Optional.empty();
        }
        EntityMatch match = best.get();
        if (match.score() >= properties.getEntity().getResolutionThreshold()) {
            return Optional.of(match.entity());
        }
        if (match.score() < properties.getEntity().getAmbiguityFloor() || !llmPort.isAvailable()) {
            return Optional.empty();
        }
        return sameEntity(mention, match.entity(), contextText) ? Optional.of(match.entity()) : Optional.empty();
    }

    private boolean sameEntity(EntityMention mention, Entity entity, String contextText) {
        String prompt = String.format(
                "Name A: %s (%s)%nName B: %s (%s)%nSentence mentioning A: %s%nSame entity?",
                mention.getName(), mention.getType(), entity.getName(), entity.getType(),
                TextSupport.truncate(contextText, 500));
        LlmRequest request = LlmRequest.builder()
                .systemPrompt(SYSTEM_PROMPT)
                .userMessage(prompt)
                .temperature(0.0)
                .maxTokens(5)
                .build();
        try {
            LlmResponse response = capabilityInvoker.invoke(Capability.REASONING, "entity disambiguation",
                    () -> llmPort.chat(request));
            String answer = response.getContent() != null ? response.getContent().trim().toLowerCase(Locale.ROOT) : "";
            boolean same = answer.startsWith("yes");
            log.debug("[Entity] '{}' vs '{}': {}", mention.getName(), entity.getName(), same ? "same" : "different");
            return same;
        } catch (MemoryEngineException e) {
            log.warn("[Entity] Disambiguation of '{}' failed, creating a new entity: {}",
                    mention.getName(), e.getMessage());
            return false;
        }
    }
}
