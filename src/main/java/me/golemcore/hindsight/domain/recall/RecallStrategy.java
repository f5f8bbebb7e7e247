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

import me.golemcore.hindsight.domain.model.RecallStrategyType;

import java.util.List;

/**
 * One retrieval strategy. Implementations only read the snapshot in the
 * context and return at most {@code topK} admitted units, best first, with a
 * deterministic order for equal scores.
 */
public interface RecallStrategy {

    RecallStrategyType type();

    List<RankedCandidate> search(RecallContext context);
}
