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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter used when no provider is configured. Reports itself
 * unavailable and fails every call, so callers take their non-LLM fallback.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("[LLM] chat() called but no LLM is configured");
        return CompletableFuture.failedFuture(new IllegalStateException("No LLM configured"));
    }

    @Override
    public String getCurrentModel() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
