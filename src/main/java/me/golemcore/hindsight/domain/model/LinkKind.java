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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of edge between two memory units.
 */
public enum LinkKind {

    /**
     * Directed from the earlier unit to the later one.
     */
    TEMPORAL_SEQUENCE("temporal-sequence", true),

    SEMANTIC_SIMILARITY("semantic-similarity", false);

    private final String value;
    private final boolean directed;

    LinkKind(String value, boolean directed) {
        this.value = value;
        this.directed = directed;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isDirected() {
        return directed;
    }
}
