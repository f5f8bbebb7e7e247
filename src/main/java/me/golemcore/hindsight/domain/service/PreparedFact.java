package me.golemcore.hindsight.domain.service;

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

import me.golemcore.hindsight.domain.model.EntityMention;
import me.golemcore.hindsight.domain.model.FactType;

import java.time.Instant;
import java.util.List;

/**
 * Fact ready to be written: text, type and confidence settled, embedding
 * computed outside the bank's writer lock.
 */
public record PreparedFact(
        String text,
        FactType factType,
        double confidence,
        float[] embedding,
        Instant occurredStart,
        Instant occurredEnd,
        String context,
        List<EntityMention> entities) {

    public PreparedFact {
        entities = entities != null ? List.copyOf(entities) : List.of();
    }
}
