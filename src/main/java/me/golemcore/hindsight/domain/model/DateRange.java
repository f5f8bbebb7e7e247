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

import java.time.Instant;
import java.util.Objects;

/**
 * Closed interval {@code [start, end]} resolved from a time expression.
 */
public record DateRange(Instant start, Instant end) {

    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Range start " + start + " is after end " + end);
        }
    }

    /**
     * Whether an occurrence span intersects this range. A span with only one
     * bound is treated as a single instant; a span with no bounds never
     * intersects.
     */
    public boolean intersects(Instant occurredStart, Instant occurredEnd) {
        Instant from = occurredStart != null ? occurredStart : occurredEnd;
        Instant to = occurredEnd != null ? occurredEnd : occurredStart;
        if (from == null) {
            return false;
        }
        return !from.isAfter(end) && !to.isBefore(start);
    }

    public Instant midpoint() {
        return start.plusMillis((end.toEpochMilli() - start.toEpochMilli()) / 2);
    }
}
