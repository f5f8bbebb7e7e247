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
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Deterministic resolution by canonical name: an exact canonical match wins,
 * otherwise the most similar type-compatible entity at or above
 * {@code hindsight.entity.resolution-threshold}. Ties go to the oldest entity,
 * then the smallest id.
 */
@Component
@RequiredArgsConstructor
public class CanonicalNameResolutionStrategy implements EntityResolutionStrategy {

    private static final Comparator<EntityMatch> BEST_MATCH = Comparator
            .comparingDouble(EntityMatch::score).reversed()
            .thenComparing(match -> match.entity().getCreatedAt(),
                    Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(match -> match.entity().getId());

    private final HindsightProperties properties;

    @Override
    public Optional<Entity> resolve(EntityMention mention, Collection<Entity> candidates, String contextText) {
        double threshold = properties.getEntity().getResolutionThreshold();
        return bestMatch(mention, candidates)
                .filter(match -> match.score() >= threshold)
                .map(EntityMatch::entity);
    }

    /**
     * Most similar type-compatible candidate regardless of threshold.
     */
    public Optional<EntityMatch> bestMatch(EntityMention mention, Collection<Entity> candidates) {
        String canonical = EntityNames.canonicalize(mention.getName());
        if (canonical.isEmpty()) {
            return Optional.empty();
        }
        return candidates.stream()
                .filter(entity -> EntityNames.typesCompatible(mention.getType(), entity.getType()))
                .map(entity -> new EntityMatch(entity, EntityNames.similarity(canonical, entity.getCanonicalName())))
                .filter(match -> match.score() > 0.0)
                .min(BEST_MATCH);
    }
}
