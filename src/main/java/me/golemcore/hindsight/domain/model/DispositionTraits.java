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
 * Disposition traits on a {@code [1, 5]} scale. Consumed only when reflection
 * decides which candidate opinions to keep.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class DispositionTraits {

    public static final int MIN = 1;
    public static final int MAX = 5;
    public static final int NEUTRAL = 3;

    @Builder.Default
    private int skepticism = NEUTRAL;

    @Builder.Default
    private int literalism = NEUTRAL;

    @Builder.Default
    private int empathy = NEUTRAL;

    public static DispositionTraits neutral() {
        return DispositionTraits.builder().build();
    }
}
