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

import me.golemcore.hindsight.domain.model.Capability;
import me.golemcore.hindsight.domain.model.LlmRequest;
import me.golemcore.hindsight.domain.model.LlmResponse;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LLM adapter using the langchain4j OpenAI client. Works with any
 * OpenAI-compatible endpoint through {@code hindsight.llm.base-url}.
 *
 * <p>
 * The client is built with retries disabled: timeouts, throttling and backoff
 * are handled by the capability invoker. HTTP 429 responses surface as
 * {@link me.golemcore.hindsight.domain.exception.RateLimitedException}.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 *
 * @see LlmProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private final HindsightProperties properties;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!isAvailable()) {
                throw new IllegalStateException("Langchain4j adapter not available: hindsight.llm.api-key is not set");
            }
            String modelName = request.getModel() != null ? request.getModel() : getCurrentModel();
            ChatModel model = models.computeIfAbsent(modelName, this::createModel);

            ChatRequest.Builder chatRequest = ChatRequest.builder()
                    .messages(convertMessages(request))
                    .temperature(request.getTemperature());
            Integer maxTokens = request.getMaxTokens() != null
                    ? request.getMaxTokens()
                    : properties.getLlm().getMaxTokens();
            if (maxTokens != null) {
                chatRequest.maxOutputTokens(maxTokens);
            }
            if (request.isJsonResponse()) {
                chatRequest.responseFormat(ResponseFormat.JSON);
            }

            try {
                ChatResponse response = model.chat(chatRequest.build());
                return convertResponse(response, modelName);
            } catch (RuntimeException e) {
                log.debug("[LLM] Chat with {} failed: {}", modelName, e.getMessage());
                throw ProviderErrors.translate(getProviderId(), e);
            }
        });
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    private ChatModel createModel(String modelName) {
        HindsightProperties.LlmProperties llm = properties.getLlm();
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // Retry handled by CapabilityInvoker
                .timeout(Duration.ofMillis(properties.capability(Capability.REASONING).getTimeoutMs()));
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        log.info("[LLM] Created chat model: {}", modelName);
        return builder.build();
    }

    private static List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        messages.add(UserMessage.from(request.getUserMessage() != null ? request.getUserMessage() : ""));
        return messages;
    }

    private static LlmResponse convertResponse(ChatResponse response, String modelName) {
        String finishReason = response.finishReason() != null
                ? response.finishReason().name().toLowerCase(Locale.ROOT)
                : null;
        return LlmResponse.builder()
                .content(response.aiMessage() != null ? response.aiMessage().text() : null)
                .model(response.modelName() != null ? response.modelName() : modelName)
                .finishReason(finishReason)
                .build();
    }
}
