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

import java.util.EnumMap;
import java.util.Map;

/**
 * Node and link counts of one bank.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BankStats {

    private String bankId;
    private int totalUnits;

    @Builder.Default
    private Map<FactType, Integer> unitsByFactType = new EnumMap<>(FactType.class);

    @Builder.Default
    private Map<LinkKind, Integer> linksByKind = new EnumMap<>(LinkKind.class);

    private int entities;
    private int entityLinks;
    private int documents;
    private int pendingOperations;
    private int failedOperations;
}
