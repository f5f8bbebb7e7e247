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

import java.time.Instant;

/**
 * Isolation boundary that owns every unit, document, entity and link of one
 * agent, together with the agent's traits and background.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Bank {

    private String bankId;

    @Builder.Default
    private PersonalityTraits personality = PersonalityTraits.neutral();

    @Builder.Default
    private DispositionTraits disposition = DispositionTraits.neutral();

    @Builder.Default
    private String background = "";

    private Instant createdAt;
    private Instant updatedAt;
}
