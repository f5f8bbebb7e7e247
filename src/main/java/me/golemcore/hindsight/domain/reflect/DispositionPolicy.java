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

import me.golemcore.hindsight.domain.model.DispositionTraits;
import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.domain.model.OpinionCandidate;

import java.util.List;
import java.util.Map;

/**
 * Decides which candidate opinions a bank keeps and with what confidence.
 *
 * <p>
 * Contract: for fixed candidates and facts, raising skepticism must never
 * raise the confidence of an accepted opinion. Implementations must be
 * deterministic.
 */
public interface DispositionPolicy {

    /**
     * @param candidates
     *            opinions proposed by reasoning, in proposal order
     * @param disposition
     *            the bank's disposition traits
     * @param retrievedFacts
     *            facts given to reasoning, by unit id
     * @param budget
     *            maximum number of opinions to accept
     * @return one decision per candidate, in proposal order
     */
    List<OpinionDecision> evaluate(List<OpinionCandidate> candidates, DispositionTraits disposition,
            Map<String, MemoryUnit> retrievedFacts, int budget);
}
