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

import me.golemcore.hindsight.domain.model.DateRange;
import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.domain.model.RecallStrategyType;
import me.golemcore.hindsight.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Units whose occurrence intersects the query's time range, most similar to
 * the query first, then closest to the middle of the range. Returns nothing
 * when the query has no time range.
 */
@Component
public class TemporalRecallStrategy implements RecallStrategy {

    @Override
    public RecallStrategyType type() {
        return RecallStrategyType.TEMPORAL;
    }

    @Override
    public List<RankedCandidate> search(RecallContext context) {
        DateRange range = context.range();
        if (range == null) {
            return List.of();
        }
        Instant middle = range.midpoint();
        List<Scored> hits = new ArrayList<>();
        for (MemoryUnit unit : context.view().units()) {
            if (!range.intersects(unit.getOccurredStart(), unit.getOccurredEnd()) || !context.admission().test(unit)) {
                continue;
            }
            double similarity = similarity(context.queryEmbedding(), unit.getEmbedding());
            hits.add(new Scored(unit, similarity, distance(unit, middle)));
        }
        hits.sort(Comparator.comparingDouble(Scored::similarity).reversed()
                .thenComparing(Scored::distance)
                .thenComparing(scored -> scored.unit().getId()));
        return hits.stream()
                .limit(context.topK())
                .map(scored -> new RankedCandidate(scored.unit(), scored.similarity()))
                .toList();
    }

    private static double similarity(float[] query, float[] embedding) {
        if (query == null || embedding == null || query.length != embedding.length) {
            return 0.0;
        }
        return EmbeddingPort.cosineSimilarity(query, embedding);
    }

    private static Duration distance(MemoryUnit unit, Instant middle) {
        Instant start = unit.getOccurredStart() != null ? unit.getOccurredStart() : unit.getOccurredEnd();
        Instant end = unit.getOccurredEnd() != null ? unit.getOccurredEnd() : unit.getOccurredStart();
        Instant unitMiddle = start.plusMillis((end.toEpochMilli() - start.toEpochMilli()) / 2);
        return Duration.between(unitMiddle, middle).abs();
    }

    private record Scored(MemoryUnit unit, double similarity, Duration distance) {
    }
}
