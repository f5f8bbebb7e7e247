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

import me.golemcore.hindsight.domain.model.LlmRequest;
import me.golemcore.hindsight.domain.model.LlmResponse;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.LlmPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the active LLM adapter from {@code hindsight.llm.provider}:
 * <ul>
 * <li>langchain4j - OpenAI-compatible endpoints via langchain4j
 * <li>none - no LLM, callers fall back to non-LLM behaviour
 * </ul>
 *
 * <p>
 * An unknown provider falls back to {@code none}.
 *
 * @see Langchain4jAdapter
 * @see NoOpLlmAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private static final String PROVIDER_NONE = "none";

    private final HindsightProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private final Map<String, LlmProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private LlmProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (LlmProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered LLM adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getLlm().getProvider();
        activeAdapter = adaptersByProvider.get(provider);
        if (activeAdapter == null) {
            activeAdapter = adaptersByProvider.get(PROVIDER_NONE);
            log.warn("Provider '{}' not found, using: {}", provider, PROVIDER_NONE);
        } else {
            log.info("Active LLM provider: {}", provider);
        }
    }

    public LlmPort getActiveAdapter() {
        return activeAdapter;
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return activeAdapter.chat(request);
    }

    @Override
    public String getCurrentModel() {
        return activeAdapter != null ? activeAdapter.getCurrentModel() : PROVIDER_NONE;
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
