package me.golemcore.hindsight;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Hindsight, a persistent memory engine for AI
 * agents.
 *
 * <h2>Operations</h2>
 * <ul>
 * <li><b>Retain</b> - extract facts from text, deduplicate, resolve entities
 * and link them into a per-bank memory graph, synchronously or through the
 * background task queue</li>
 * <li><b>Recall</b> - semantic, lexical, graph and temporal retrieval fused by
 * reciprocal rank and reranked</li>
 * <li><b>Reflect</b> - answer from memory in the bank's personality and store
 * new opinions filtered by its disposition</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Domain Layer       → RetainService, RecallService, ReflectService, RetainTaskQueue
 * Ports              → repository, LLM, embedding, rerank, extraction, temporal
 * Infrastructure     → in-memory repository with JSON snapshots, langchain4j adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code hindsight.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class HindsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(HindsightApplication.class, args);
    }

}
