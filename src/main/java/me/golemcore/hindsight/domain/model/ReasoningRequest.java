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
import java.util.List;

/**
 * Assembled context handed to the reasoning capability.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReasoningRequest {

    private String bankId;
    private String query;
    private String context;
    private String background;
    private String styleGuidance;

    @Builder.Default
    private List<MemoryUnit> agentFacts = new ArrayList<>();

    @Builder.Default
    private List<MemoryUnit> worldFacts = new ArrayList<>();

    @Builder.Default
    private List<MemoryUnit> opinions = new ArrayList<>();
}
