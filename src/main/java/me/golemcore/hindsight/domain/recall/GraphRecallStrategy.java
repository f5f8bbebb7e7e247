package me.golemcore.hindsight.domain.recall;

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

import me.golemcore.hindsight.domain.entity.EntityResolutionService;
import me.golemcore.hindsight.domain.model.Entity;
import me.golemcore.hindsight.domain.model.MemoryLink;
import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.domain.model.RecallStrategyType;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.BankReadView;
import me.golemcore.hindsight.port.outbound.BankReadView.ScoredUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Spreading activation over the unit graph.
 *
 * <p>
 * Seeds are the units linked to entities named in the query, each with
 * activation 1. When the query names no known entity, the top
 * {@code semantic-seeds} semantic hits seed the walk with their similarity.
 * Each hop passes {@code activation * decay * edgeWeight} to neighbours
 * reached through a shared entity (weight 1) or a temporal/semantic link (the
 * link's weight). Activation below {@code min-activation} stops spreading;
 * the walk ends after {@code max-hops} hops or once {@code max-visited} units
 * have been reached. A unit's score is the sum of all activation it received.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GraphRecallStrategy implements RecallStrategy {

    private static final double ENTITY_EDGE_WEIGHT = 1.0;

    private final EntityResolutionService entityResolutionService;
    private final HindsightProperties properties;

    @Override
    public RecallStrategyType type() {
        return RecallStrategyType.GRAPH;
    }

    @Override
    public List<RankedCandidate> search(RecallContext context) {
        HindsightProperties.GraphProperties graph = properties.getRecall().getGraph();
        BankReadView view = context.view();

        Map<String, Double> frontier = seeds(context, graph);
        if (frontier.isEmpty()) {
            return List.of();
        }
        Map<String, Double> activation = new LinkedHashMap<>(frontier);

        for (int hop = 1; hop <= graph.getMaxHops() && !frontier.isEmpty(); hop++) {
            Map<String, Double> next = new LinkedHashMap<>();
            for (Map.Entry<String, Double> entry : frontier.entrySet()) {
                String unitId = entry.getKey();
                double passed = entry.getValue() * graph.getDecay();
                for (Neighbour neighbour : neighbours(view, unitId)) {
                    double received = passed * neighbour.weight();
                    if (received < graph.getMinActivation()) {
                        continue;
                    }
                    if (!activation.containsKey(neighbour.unitId()) && activation.size() >= graph.getMaxVisited()) {
                        continue;
                    }
                    next.merge(neighbour.unitId(), received, Double::sum);
                    activation.merge(neighbour.unitId(), received, Double::sum);
                }
            }
            frontier = next;
        }

        List<RankedCandidate> ranked = new ArrayList<>();
        for (Map.Entry<String, Double> entry : activation.entrySet()) {
            Optional<MemoryUnit> unit = view.findUnit(entry.getKey());
            if (unit.isPresent() && context.admission().test(unit.get())) {
                ranked.add(new RankedCandidate(unit.get(), entry.getValue()));
            }
        }
        ranked.sort(Comparator.comparingDouble(RankedCandidate::score).reversed()
                .thenComparing(candidate -> candidate.unit().getId()));
        log.trace("[Recall] Graph walk reached {} unit(s), {} admitted", activation.size(), ranked.size());
        return ranked.size() > context.topK() ? List.copyOf(ranked.subList(0, context.topK())) : ranked;
    }

    private Map<String, Double> seeds(RecallContext context, HindsightProperties.GraphProperties graph) {
        Map<String, Double> seeds = new LinkedHashMap<>();
        List<Entity> entities = entityResolutionService.entitiesInQuery(context.view(), context.queryText());
        for (Entity entity : entities) {
            for (String unitId : context.view().unitIdsOf(entity.getId())) {
                seeds.put(unitId, 1.0);
            }
        }
        if (seeds.isEmpty() && context.queryEmbedding() != null && graph.getSemanticSeeds() > 0) {
            for (ScoredUnit hit : context.view().nearest(context.queryEmbedding(), graph.getSemanticSeeds(),
                    Double.MIN_VALUE, unit -> true)) {
                seeds.put(hit.unit().getId(), hit.score());
            }
        }
        return seeds;
    }

    private static List<Neighbour> neighbours(BankReadView view, String unitId) {
        List<Neighbour> neighbours = new ArrayList<>();
        for (String entityId : view.entityIdsOf(unitId)) {
            for (String other : view.unitIdsOf(entityId)) {
                if (!other.equals(unitId)) {
                    neighbours.add(new Neighbour(other, ENTITY_EDGE_WEIGHT));
                }
            }
        }
        for (MemoryLink link : view.linksOf(unitId)) {
            neighbours.add(new Neighbour(link.otherEnd(unitId), link.getWeight()));
        }
        return neighbours;
    }

    private record Neighbour(String unitId, double weight) {
    }
}
