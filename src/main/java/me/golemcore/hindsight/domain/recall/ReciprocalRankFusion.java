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

import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.domain.model.RecallStrategyType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal-rank fusion: {@code score(u) = sum over strategies of 1 / (k + rank)}
 * with 1-based ranks; a strategy that did not return {@code u} adds nothing.
 *
 * <p>
 * Output order is score descending, then more recent {@code mentionedAt}, then
 * higher confidence, then unit id, so equal inputs always fuse to the same
 * sequence.
 */
public final class ReciprocalRankFusion {

    static final Comparator<FusedCandidate> FUSED_ORDER = Comparator
            .comparingDouble(FusedCandidate::score).reversed()
            .thenComparing(candidate -> candidate.unit().getMentionedAt(),
                    Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(candidate -> candidate.unit().getConfidence(), Comparator.reverseOrder())
            .thenComparing(candidate -> candidate.unit().getId());

    private final int k;

    public ReciprocalRankFusion(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("RRF constant must not be negative: " + k);
        }
        this.k = k;
    }

    public int getK() {
        return k;
    }

    public List<FusedCandidate> fuse(Map<RecallStrategyType, List<RankedCandidate>> rankings) {
        Map<String, MemoryUnit> units = new LinkedHashMap<>();
        Map<String, Double> scores = new LinkedHashMap<>();
        Map<String, Map<RecallStrategyType, Integer>> ranks = new LinkedHashMap<>();

        for (Map.Entry<RecallStrategyType, List<RankedCandidate>> entry : rankings.entrySet()) {
            int rank = 0;
            for (RankedCandidate candidate : entry.getValue()) {
                String id = candidate.unit().getId();
                Map<RecallStrategyType, Integer> unitRanks = ranks.computeIfAbsent(id,
                        key -> new EnumMap<>(RecallStrategyType.class));
                if (unitRanks.containsKey(entry.getKey())) {
                    continue;
                }
                rank++;
                unitRanks.put(entry.getKey(), rank);
                units.putIfAbsent(id, candidate.unit());
                scores.merge(id, 1.0 / (k + rank), Double::sum);
            }
        }

        List<FusedCandidate> fused = new ArrayList<>(units.size());
        for (Map.Entry<String, MemoryUnit> entry : units.entrySet()) {
            String id = entry.getKey();
            fused.add(new FusedCandidate(entry.getValue(), scores.get(id), Collections.unmodifiableMap(ranks.get(id))));
        }
        fused.sort(FUSED_ORDER);
        return fused;
    }

    /**
     * Highest score a unit can reach when ranked first by every strategy.
     */
    public double maxScore(int strategyCount) {
        return strategyCount / (double) (k + 1);
    }
}
