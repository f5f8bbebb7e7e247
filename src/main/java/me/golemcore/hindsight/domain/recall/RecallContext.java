package me.golemcore.hindsight.domain.recall;

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

import me.golemcore.hindsight.domain.model.DateRange;
import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.port.outbound.BankReadView;

import java.util.function.Predicate;

/**
 * Inputs shared by all strategies of one recall.
 *
 * @param view
 *            immutable snapshot of the bank
 * @param queryText
 *            the query as given
 * @param queryEmbedding
 *            embedding of the query, computed once before the fan-out
 * @param range
 *            resolved time range, or null when the query has none
 * @param admission
 *            fact-type and time filter; strategies only emit admitted units
 * @param topK
 *            maximum list length per strategy
 */
public record RecallContext(
        BankReadView view,
        String queryText,
        float[] queryEmbedding,
        DateRange range,
        Predicate<MemoryUnit> admission,
        int topK) {
}
