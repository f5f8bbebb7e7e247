package me.golemcore.hindsight.infrastructure.config;

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
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code hindsight.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - LLM provider settings</li>
 * <li>{@link EmbeddingProperties} - embedding model and dimension</li>
 * <li>{@link RetainProperties} - dedup and linking thresholds</li>
 * <li>{@link EntityProperties} - entity resolution thresholds</li>
 * <li>{@link RecallProperties} - fusion, rerank and graph traversal</li>
 * <li>{@link ReflectProperties} - context budgets and opinion limits</li>
 * <li>{@link CapabilityProperties} - timeout/retry/throttle per capability</li>
 * <li>{@link QueueProperties} - background retain workers</li>
 * <li>{@link StorageProperties} - local snapshot persistence</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "hindsight")
@Data
public class HindsightProperties {

    private LlmProperties llm = new LlmProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private RetainProperties retain = new RetainProperties();
    private EntityProperties entity = new EntityProperties();
    private RecallProperties recall = new RecallProperties();
    private ReflectProperties reflect = new ReflectProperties();
    private Map<Capability, CapabilityProperties> capabilities = new EnumMap<>(Capability.class);
    private QueueProperties queue = new QueueProperties();
    private StorageProperties storage = new StorageProperties();

    /**
     * Settings of one capability, falling back to defaults when not configured.
     */
    public CapabilityProperties capability(Capability capability) {
        return capabilities.computeIfAbsent(capability, key -> new CapabilityProperties());
    }

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private String model = "gpt-4o-mini";
        private String apiKey;
        private String baseUrl;
        private double temperature = 0.2;
        private Integer maxTokens = 2048;
    }

    @Data
    public static class EmbeddingProperties {
        private String model = "text-embedding-3-small";
        private int dimension = 1536;
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class RetainProperties {
        private double dedupThreshold = 0.92;
        private double semanticLinkThreshold = 0.75;
        private int maxSemanticLinks = 5;
        private long temporalLinkWindowHours = 24;
        private int maxTemporalLinks = 10;
        private double defaultConfidence = 0.8;
        private double mergeConfidenceBoost = 0.05;
        private long writeLockTimeoutMs = 60_000;
    }

    @Data
    public static class EntityProperties {
        private double resolutionThreshold = 0.85;
        private double ambiguityFloor = 0.6;
        private boolean llmDisambiguationEnabled = false;
    }

    @Data
    public static class RecallProperties {
        private int rrfK = 60;
        private int perStrategyTopK = 50;
        private int rerankTopN = 30;
        private long strategyTimeoutMs = 3_000;
        private int defaultMaxResults = 10;
        private double rerankWeight = 0.8;
        private boolean rerankFallbackEnabled = true;
        private int executorThreads = 8;
        private GraphProperties graph = new GraphProperties();
    }

    @Data
    public static class GraphProperties {
        private int maxHops = 3;
        private double decay = 0.5;
        private double minActivation = 0.01;
        private int maxVisited = 500;
        private int semanticSeeds = 3;
    }

    @Data
    public static class ReflectProperties {
        private int agentFactsBudget = 10;
        private int worldFactsBudget = 20;
        private int opinionsBudget = 10;
        private int maxNewOpinions = 3;
        private double opinionDedupThreshold = 0.92;
    }

    @Data
    public static class CapabilityProperties {
        private long timeoutMs = 30_000;
        private int maxAttempts = 3;
        private long initialBackoffMs = 500;
        private double backoffMultiplier = 2.0;
        private long maxBackoffMs = 10_000;
        private int requestsPerMinute = 0;
    }

    @Data
    public static class QueueProperties {
        private int concurrency = 4;
        private int maxQueuedPerBank = 1000;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.hindsight/workspace";
        private String directory = "banks";
        private boolean snapshotsEnabled = false;
    }
}
