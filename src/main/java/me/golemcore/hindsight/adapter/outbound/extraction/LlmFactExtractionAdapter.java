package me.golemcore.hindsight.adapter.outbound.extraction;

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
import me.golemcore.hindsight.domain.model.ExtractedFact;
import me.golemcore.hindsight.domain.model.FactType;
import me.golemcore.hindsight.domain.model.LlmRequest;
import me.golemcore.hindsight.domain.model.LlmResponse;
import me.golemcore.hindsight.domain.service.TextSupport;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.ExtractionPort;
import me.golemcore.hindsight.port.outbound.LlmPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Fact extraction through the configured LLM. The model is asked for a JSON
 * list of self-contained facts with type, confidence, occurrence time and
 * entity mentions.
 *
 * <p>
 * A reply that is not valid JSON fails the call. Individual malformed facts
 * are skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmFactExtractionAdapter implements ExtractionPort {

    private static final String SYSTEM_PROMPT = """
            You extract atomic, self-contained facts from text for the long-term memory of an AI agent.
            Rules:
            - Each fact must be understandable on its own: resolve pronouns to names.
            - fact_type is "agent" for things the agent itself did or experienced, "opinion" for
              judgements or beliefs, and "world" for everything else.
            - confidence is a number between 0 and 1.
            - occurred_start / occurred_end are ISO-8601 dates or timestamps of when the described
              event happened, or null when unknown. Resolve relative dates against TODAY.
            - entities lists the people, organizations, places and things the fact is about, with a
              type of person, organization, place, object, concept or other.
            Reply with JSON only:
            {"facts": [{"text": "...", "fact_type": "world", "confidence": 0.9,
              "occurred_start": null, "occurred_end": null,
              "entities": [{"name": "...", "type": "person"}]}]}""";

    private final LlmPort llmPort;
    private final ObjectMapper objectMapper;
    private final HindsightProperties properties;
    private final Clock clock;

    @Override
    public CompletableFuture<List<ExtractedFact>> extract(String text, String context) {
        if (!llmPort.isAvailable()) {
            return CompletableFuture.failedFuture(new IllegalStateException("No LLM available for fact extraction"));
        }
        StringBuilder prompt = new StringBuilder();
        prompt.append("TODAY: ").append(LocalDate.now(clock.withZone(ZoneOffset.UTC))).append('\n');
        if (context != null && !context.isBlank()) {
            prompt.append("CONTEXT: ").append(context.trim()).append('\n');
        }
        prompt.append("TEXT:\n").append(text);

        LlmRequest request = LlmRequest.builder()
                .systemPrompt(SYSTEM_PROMPT)
                .userMessage(prompt.toString())
                .temperature(0.0)
                .maxTokens(properties.getLlm().getMaxTokens())
                .jsonResponse(true)
                .build();
        return llmPort.chat(request).thenApply(this::parse);
    }

    List<ExtractedFact> parse(LlmResponse response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(TextSupport.stripCodeFence(response.getContent()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Extraction reply is not valid JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode facts = root.isArray() ? root : root.path("facts");
        List<ExtractedFact> result = new ArrayList<>();
        for (JsonNode node : facts) {
            String factText = node.path("text").asText("").trim();
            if (factText.isEmpty()) {
                continue;
            }
            try {
                result.add(ExtractedFact.builder()
                        .text(factText)
                        .factType(FactType.fromValue(node.path("fact_type").asText(null)))
                        .confidence(node.path("confidence").isNumber() ? node.path("confidence").asDouble() : null)
                        .occurredStart(parseInstant(node.path("occurred_start"), false))
                        .occurredEnd(parseInstant(node.path("occurred_end"), true))
                        .entities(parseEntities(node.path("entities")))
                        .build());
            } catch (IllegalArgumentException e) {
                log.debug("[Retain] Skipping malformed extracted fact '{}': {}", TextSupport.truncate(factText, 60),
                        e.getMessage());
            }
        }
        return result;
    }

    private static List<EntityMention> parseEntities(JsonNode entities) {
        List<EntityMention> mentions = new ArrayList<>();
        for (JsonNode entity : entities) {
            String name = entity.isTextual() ? entity.asText() : entity.path("name").asText("");
            if (!name.isBlank()) {
                String type = entity.path("type").asText(EntityMention.TYPE_OTHER);
                mentions.add(EntityMention.of(name.trim(), type.trim().toLowerCase(Locale.ROOT)));
            }
        }
        return mentions;
    }

    /**
     * Accepts an ISO instant or an ISO date; a date maps to the start of the
     * day, or to its last millisecond for {@code endOfDay}.
     */
    static Instant parseInstant(JsonNode node, boolean endOfDay) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        String raw = node.asText().trim();
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException ignored) {
            // not a full timestamp
        }
        try {
            LocalDate date = LocalDate.parse(raw.length() > 10 ? raw.substring(0, 10) : raw);
            Instant start = date.atStartOfDay(ZoneOffset.UTC).toInstant();
            return endOfDay ? date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusMillis(1) : start;
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unparseable date: " + raw, e);
        }
    }
}
