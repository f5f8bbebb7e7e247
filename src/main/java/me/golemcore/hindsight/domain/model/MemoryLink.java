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

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Weighted temporal or semantic edge between two memory units of the same bank.
 */
@Value
@Builder
@Jacksonized
public class MemoryLink {

    String bankId;
    String fromUnitId;
    String toUnitId;
    LinkKind kind;
    double weight;

    /**
     * Stable identity of the edge. Undirected kinds share one key for both
     * orientations.
     */
    public String key() {
        String first = fromUnitId;
        String second = toUnitId;
        if (!kind.isDirected() && first.compareTo(second) > 0) {
            first = toUnitId;
            second = fromUnitId;
        }
        return kind.getValue() + ":" + first + "->" + second;
    }

    public String otherEnd(String unitId) {
        return unitId.equals(fromUnitId) ? toUnitId : fromUnitId;
    }
}
