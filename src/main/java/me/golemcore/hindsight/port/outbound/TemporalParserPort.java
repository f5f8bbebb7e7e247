package me.golemcore.hindsight.port.outbound;

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

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves natural-language time expressions ("last spring", "in March 2024")
 * to date ranges.
 */
public interface TemporalParserPort {

    /**
     * @return the resolved range, or empty when the expression is unresolved
     */
    CompletableFuture<Optional<DateRange>> parse(String expression);
}
