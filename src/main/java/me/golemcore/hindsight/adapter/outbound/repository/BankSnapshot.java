package me.golemcore.hindsight.adapter.outbound.repository;

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

import me.golemcore.hindsight.domain.model.Bank;
import me.golemcore.hindsight.domain.model.Document;
import me.golemcore.hindsight.domain.model.Entity;
import me.golemcore.hindsight.domain.model.EntityLink;
import me.golemcore.hindsight.domain.model.MemoryLink;
import me.golemcore.hindsight.domain.model.MemoryUnit;

import java.util.List;

/**
 * Serialized form of one bank: profile plus the full memory graph.
 */
public record BankSnapshot(
        Bank bank,
        List<MemoryUnit> units,
        List<Document> documents,
        List<Entity> entities,
        List<EntityLink> entityLinks,
        List<MemoryLink> links) {

    public BankSnapshot {
        units = units != null ? units : List.of();
        documents = documents != null ? documents : List.of();
        entities = entities != null ? entities : List.of();
        entityLinks = entityLinks != null ? entityLinks : List.of();
        links = links != null ? links : List.of();
    }
}
