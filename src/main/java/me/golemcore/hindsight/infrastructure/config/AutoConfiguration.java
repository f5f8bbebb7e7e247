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

import me.golemcore.hindsight.port.outbound.EmbeddingPort;
import me.golemcore.hindsight.port.outbound.LlmPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared beans and the startup summary.
 *
 * <p>
 * Executors:
 * <ul>
 * <li>{@code recallExecutor} - runs the recall strategies of a query in
 * parallel ({@code hindsight.recall.executor-threads})</li>
 * <li>{@code retainQueueExecutor} - background retain batches
 * ({@code hindsight.queue.concurrency})</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final HindsightProperties properties;
    private final LlmPort llmPort;
    private final EmbeddingPort embeddingPort;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService recallExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, properties.getRecall().getExecutorThreads()),
                daemonThreads("hindsight-recall"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService retainQueueExecutor() {
        return Executors.newFixedThreadPool(Math.max(1, properties.getQueue().getConcurrency()),
                daemonThreads("hindsight-retain"));
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("Hindsight v{} starting...", version);
        log.info("LLM Provider: {} (model: {}, available: {})", llmPort.getProviderId(), llmPort.getCurrentModel(),
                llmPort.isAvailable());
        log.info("Embedding Model: {} ({} dimensions)", embeddingPort.getModel(), embeddingPort.getDimension());
        log.info("Snapshots: {}", properties.getStorage().isSnapshotsEnabled()
                ? properties.getStorage().getBasePath() + "/" + properties.getStorage().getDirectory()
                : "disabled");
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
