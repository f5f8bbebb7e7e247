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

/**
 * Big Five personality traits plus bias strength, each in {@code [0, 1]}.
 * Shapes the style of generated answers only.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class PersonalityTraits {

    public static final double NEUTRAL = 0.5;

    @Builder.Default
    private double openness = NEUTRAL;

    @Builder.Default
    private double conscientiousness = NEUTRAL;

    @Builder.Default
    private double extraversion = NEUTRAL;

    @Builder.Default
    private double agreeableness = NEUTRAL;

    @Builder.Default
    private double neuroticism = NEUTRAL;

    @Builder.Default
    private double biasStrength = NEUTRAL;

    public static PersonalityTraits neutral() {
        return PersonalityTraits.builder().build();
    }
}
