package me.golemcore.hindsight.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Answer, the facts it was based on, and the opinions persisted while forming
 * it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReflectResult {

    private String answer;

    @Builder.Default
    private List<ScoredMemory> factsUsed = new ArrayList<>();

    @Builder.Default
    private List<MemoryUnit> newOpinions = new ArrayList<>();

    public Map<FactType, List<ScoredMemory>> getFactsUsedByType() {
        Map<FactType, List<ScoredMemory>> grouped = new EnumMap<>(FactType.class);
        for (ScoredMemory fact : factsUsed) {
            grouped.computeIfAbsent(fact.getUnit().getFactType(), type -> new ArrayList<>()).add(fact);
        }
        return grouped;
    }
}
