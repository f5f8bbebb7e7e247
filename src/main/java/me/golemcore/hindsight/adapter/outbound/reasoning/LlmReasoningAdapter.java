package me.golemcore.hindsight.adapter.outbound.reasoning;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.hindsight.domain.model.EntityMention;
import me.golemcore.hindsight.domain.model.FactType;
import me.golemcore.hindsight.domain.model.LlmRequest;
import me.golemcore.hindsight.domain.model.LlmResponse;
import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.domain.model.OpinionCandidate;
import me.golemcore.hindsight.domain.model.ReasoningOutput;
import me.golemcore.hindsight.domain.model.ReasoningRequest;
import me.golemcore.hindsight.domain.service.TextSupport;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.LlmPort;
import me.golemcore.hindsight.port.outbound.ReasoningPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Answer and opinion generation through the configured LLM.
 *
 * <p>
 * Every retrieved fact is shown to the model with its unit id so that
 * candidate opinions can cite the facts supporting them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmReasoningAdapter implements ReasoningPort {

    private static final String SYSTEM_PROMPT = """
            You are an AI agent answering from your own long-term memory.
            Use only the facts provided. Where they are insufficient, say so.
            Besides the answer, you may form new opinions: judgements or beliefs that follow from
            the facts. Each opinion cites the ids of the facts supporting it and names the entities
            it concerns. Do not repeat opinions you already hold.
            Reply with JSON only:
            {"answer": "...", "opinions": [{"text": "...", "confidence": 0.7,
              "supporting_fact_ids": ["..."], "entities": [{"name": "...", "type": "person"}]}]}""";

    private final LlmPort llmPort;
    private final ObjectMapper objectMapper;
    private final HindsightProperties properties;

    @Override
    public CompletableFuture<ReasoningOutput> reason(ReasoningRequest request) {
        if (!llmPort.isAvailable()) {
            return CompletableFuture.failedFuture(new IllegalStateException("No LLM available for reasoning"));
        }
        LlmRequest llmRequest = LlmRequest.builder()
                .systemPrompt(SYSTEM_PROMPT + "\n\n" + request.getStyleGuidance())
                .userMessage(buildPrompt(request))
                .temperature(properties.getLlm().getTemperature())
                .maxTokens(properties.getLlm().getMaxTokens())
                .jsonResponse(true)
                .build();
        return llmPort.chat(llmRequest).thenApply(this::parse);
    }

    static String buildPrompt(ReasoningRequest request) {
        StringBuilder prompt = new StringBuilder();
        if (request.getBackground() != null && !request.getBackground().isBlank()) {
            prompt.append("## Your background\n").append(request.getBackground().trim()).append("\n\n");
        }
        appendFacts(prompt, "## Things you did or experienced", request.getAgentFacts());
        appendFacts(prompt, "## Facts about the world", request.getWorldFacts());
        appendFacts(prompt, "## Opinions you already hold", request.getOpinions());
        if (request.getContext() != null && !request.getContext().isBlank()) {
            prompt.append("## Context\n").append(request.getContext().trim()).append("\n\n");
        }
        prompt.append("## Question\n").append(request.getQuery().trim());
        return prompt.toString();
    }

    private static void appendFacts(StringBuilder prompt, String title, List<MemoryUnit> units) {
        prompt.append(title).append('\n');
        if (units == null || units.isEmpty()) {
            prompt.append("(none)\n\n");
            return;
        }
        for (MemoryUnit unit : units) {
            prompt.append("- [").append(unit.getId()).append("] ").append(unit.getText());
            if (unit.getOccurredStart() != null) {
                prompt.append(" (when: ").append(unit.getOccurredStart()).append(')');
            }
            if (unit.getFactType() == FactType.OPINION) {
                prompt.append(String.format(Locale.ROOT, " (confidence: %.2f)", unit.getConfidence()));
            }
            prompt.append('\n');
        }
        prompt.append('\n');
    }

    ReasoningOutput parse(LlmResponse response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(TextSupport.stripCodeFence(response.getContent()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Reasoning reply is not valid JSON: " + e.getOriginalMessage(), e);
        }
        String answer = root.path("answer").asText(null);
        if (answer == null) {
            throw new IllegalStateException("Reasoning reply has no answer");
        }

        List<OpinionCandidate> opinions = new ArrayList<>();
        for (JsonNode node : root.path("opinions")) {
            String text = node.path("text").asText("").trim();
            if (text.isEmpty()) {
                continue;
            }
            List<String> supporting = new ArrayList<>();
            node.path("supporting_fact_ids").forEach(id -> supporting.add(id.asText()));
            List<EntityMention> entities = new ArrayList<>();
            for (JsonNode entity : node.path("entities")) {
                String name = entity.isTextual() ? entity.asText() : entity.path("name").asText("");
                if (!name.isBlank()) {
                    entities.add(EntityMention.of(name.trim(),
                            entity.path("type").asText(EntityMention.TYPE_OTHER).toLowerCase(Locale.ROOT)));
                }
            }
            double confidence = node.path("confidence").isNumber() ? node.path("confidence").asDouble() : 0.5;
            opinions.add(OpinionCandidate.builder()
                    .text(text)
                    .confidence(Math.max(0.0, Math.min(1.0, confidence)))
                    .supportingUnitIds(supporting)
                    .entities(entities)
                    .build());
        }
        log.debug("[Reflect] Reasoning produced {} opinion candidate(s)", opinions.size());
        return ReasoningOutput.builder()
                .answer(answer)
                .opinions(opinions)
                .build();
    }
}
