package me.golemcore.hindsight.adapter.outbound.embedding;

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

import me.golemcore.hindsight.adapter.outbound.llm.ProviderErrors;
import me.golemcore.hindsight.domain.model.Capability;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.EmbeddingPort;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j and an OpenAI-compatible embeddings
 * endpoint.
 *
 * <p>
 * Default model: text-embedding-3-small (1536 dimensions). The API key falls
 * back to {@code hindsight.llm.api-key} when {@code hindsight.embedding.api-key}
 * is not set. Every returned vector is checked against the configured
 * dimension.
 *
 * @see EmbeddingPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private final HindsightProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        String apiKey = apiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Embedding API key not configured, embedding service unavailable");
            initialized = true;
            return;
        }

        HindsightProperties.EmbeddingProperties config = properties.getEmbedding();
        try {
            var builder = OpenAiEmbeddingModel.builder()
                    .apiKey(apiKey)
                    .modelName(getModel())
                    .maxRetries(0)
                    .timeout(Duration.ofMillis(properties.capability(Capability.EMBEDDING).getTimeoutMs()));
            String baseUrl = config.getBaseUrl() != null ? config.getBaseUrl() : properties.getLlm().getBaseUrl();
            if (baseUrl != null && !baseUrl.isBlank()) {
                builder.baseUrl(baseUrl);
            }
            embeddingModel = builder.build();
            log.info("Embedding model initialized: {} ({} dimensions)", getModel(), getDimension());
        } catch (RuntimeException e) {
            log.error("Failed to initialize embedding model", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            EmbeddingModel model = requireModel();
            try {
                Response<Embedding> response = model.embed(text);
                return checkDimension(response.content().vector());
            } catch (RuntimeException e) {
                throw ProviderErrors.translate("embedding", e);
            }
        });
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        return CompletableFuture.supplyAsync(() -> {
            if (texts.isEmpty()) {
                return List.of();
            }
            EmbeddingModel model = requireModel();
            List<TextSegment> segments = texts.stream()
                    .map(TextSegment::from)
                    .toList();
            try {
                Response<List<Embedding>> response = model.embedAll(segments);
                return response.content().stream()
                        .map(Embedding::vector)
                        .map(this::checkDimension)
                        .toList();
            } catch (RuntimeException e) {
                throw ProviderErrors.translate("embedding", e);
            }
        });
    }

    @Override
    public int getDimension() {
        return properties.getEmbedding().getDimension();
    }

    @Override
    public String getModel() {
        String model = properties.getEmbedding().getModel();
        return model != null && !model.isBlank() ? model : "text-embedding-3-small";
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }

    private EmbeddingModel requireModel() {
        ensureInitialized();
        if (embeddingModel == null) {
            throw new IllegalStateException("Embedding model not available");
        }
        return embeddingModel;
    }

    private float[] checkDimension(float[] vector) {
        if (vector.length != getDimension()) {
            throw new IllegalStateException("Embedding model returned " + vector.length
                    + " dimensions, expected " + getDimension());
        }
        return vector;
    }

    private String apiKey() {
        String apiKey = properties.getEmbedding().getApiKey();
        return apiKey != null && !apiKey.isBlank() ? apiKey : properties.getLlm().getApiKey();
    }
}
