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
import me.golemcore.hindsight.domain.model.EntityLink;
import me.golemcore.hindsight.domain.model.EntityMention;
import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.port.outbound.BankReadView;
import me.golemcore.hindsight.port.outbound.MemoryTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Maintains the entity graph of a bank: resolves mentions to canonical
 * entities, creates entities for unseen names and links units to them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityResolutionService {

    private final EntityResolutionStrategy resolutionStrategy;
    private final Clock clock;

    /**
     * Resolves each mention against the bank's entities (including ones created
     * earlier in the same transaction) and links the unit to the result.
     *
     * @return ids of the entities the unit is now linked to
     */
    public List<String> linkMentions(MemoryTransaction tx, MemoryUnit unit, List<EntityMention> mentions) {
        Set<String> linked = new LinkedHashSet<>();
        if (mentions == null) {
            return List.of();
        }
        for (EntityMention mention : mentions) {
            if (mention == null || mention.getName() == null || EntityNames.canonicalize(mention.getName()).isEmpty()) {
                continue;
            }
            Entity entity = resolutionStrategy.resolve(mention, tx.entities(), unit.getText())
                    .orElseGet(() -> createEntity(tx, mention));
            if (linked.add(entity.getId())) {
                tx.putEntityLink(EntityLink.builder()
                        .bankId(tx.bankId())
                        .unitId(unit.getId())
                        .entityId(entity.getId())
                        .build());
            }
        }
        return List.copyOf(linked);
    }

    /**
     * Entities whose canonical name occurs as a whole phrase in the query,
     * longest names first.
     */
    public List<Entity> entitiesInQuery(BankReadView view, String query) {
        String padded = " " + EntityNames.canonicalize(query) + " ";
        if (padded.isBlank()) {
            return List.of();
        }
        return view.entities().stream()
                .filter(entity -> !entity.getCanonicalName().isEmpty()
                        && padded.contains(" " + entity.getCanonicalName() + " "))
                .sorted(Comparator.comparingInt((Entity e) -> e.getCanonicalName().length()).reversed()
                        .thenComparing(Entity::getId))
                .toList();
    }

    private Entity createEntity(MemoryTransaction tx, EntityMention mention) {
        Entity entity = Entity.builder()
                .id(UUID.randomUUID().toString())
                .bankId(tx.bankId())
                .name(mention.getName().trim())
                .type(mention.getType() != null ? mention.getType() : EntityMention.TYPE_OTHER)
                .canonicalName(EntityNames.canonicalize(mention.getName()))
                .createdAt(clock.instant())
                .build();
        tx.putEntity(entity);
        log.trace("[Entity] Created '{}' ({}) in bank {}", entity.getName(), entity.getType(), tx.bankId());
        return entity;
    }
}
