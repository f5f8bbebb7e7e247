package me.golemcore.hindsight.domain.entity;

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

import me.golemcore.hindsight.domain.model.Entity;
import me.golemcore.hindsight.domain.model.EntityMention;

import java.util.Collection;
import java.util.Optional;

/**
 * Decides which existing entity, if any, a mention refers to.
 *
 * <p>
 * Implementations must be deterministic for a given mention, candidate set
 * and context; the resolver creates a new entity when this returns empty.
 */
public interface EntityResolutionStrategy {

    /**
     * @param mention
     *            entity as named in the fact
     * @param candidates
     *            entities already known in the bank
     * @param contextText
     *            text of the fact that mentions it
     * @return the entity the mention resolves to, or empty for a new entity
     */
    Optional<Entity> resolve(EntityMention mention, Collection<Entity> candidates, String contextText);
}
