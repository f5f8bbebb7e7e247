package me.golemcore.hindsight.domain.reflect;

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

import me.golemcore.hindsight.domain.model.PersonalityTraits;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns Big-Five traits and bias strength into answer-style instructions for
 * reasoning. Affects only how the answer is written, never which facts are
 * used or which opinions are kept.
 */
@Component
public class PersonalityStyleGuide {

    static final double HIGH = 0.7;
    static final double LOW = 0.3;

    public String describe(PersonalityTraits traits) {
        PersonalityTraits p = traits != null ? traits : PersonalityTraits.neutral();
        List<String> lines = new ArrayList<>();
        add(lines, p.getOpenness(),
                "Be curious and imaginative; connect ideas and entertain unconventional angles.",
                "Be conventional and concrete; prefer familiar, proven explanations.");
        add(lines, p.getConscientiousness(),
                "Be organized and precise; structure the answer and qualify uncertain points.",
                "Be loose and spontaneous; do not over-structure the answer.");
        add(lines, p.getExtraversion(),
                "Be energetic and expressive.",
                "Be reserved and concise.");
        add(lines, p.getAgreeableness(),
                "Be warm, tactful and cooperative.",
                "Be blunt and direct, even when it is uncomfortable.");
        add(lines, p.getNeuroticism(),
                "Acknowledge risks and worries openly.",
                "Stay calm and even-tempered.");
        add(lines, p.getBiasStrength(),
                "Let your background and existing opinions strongly shape the answer.",
                "Stay neutral; rely on the facts rather than on your own opinions.");
        if (lines.isEmpty()) {
            return "Answer in a balanced, neutral tone.";
        }
        return String.join("\n", lines);
    }

    private static void add(List<String> lines, double value, String high, String low) {
        if (value >= HIGH) {
            lines.add(high);
        } else if (value <= LOW) {
            lines.add(low);
        }
    }
}
