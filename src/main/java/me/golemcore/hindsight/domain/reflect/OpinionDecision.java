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

import me.golemcore.hindsight.domain.model.OpinionCandidate;

import java.util.List;

/**
 * Verdict of a {@link DispositionPolicy} on one candidate opinion.
 *
 * @param candidate
 *            the opinion as proposed by reasoning
 * @param accepted
 *            whether it should be persisted
 * @param confidence
 *            confidence to store when accepted
 * @param priority
 *            ordering key used when the per-call budget is exceeded
 * @param supportingUnitIds
 *            cited facts that were actually retrieved
 * @param reason
 *            why it was rejected, null when accepted
 */
public record OpinionDecision(
        OpinionCandidate candidate,
        boolean accepted,
        double confidence,
        double priority,
        List<String> supportingUnitIds,
        String reason) {
}
