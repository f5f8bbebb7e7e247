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

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an asynchronous operation. Transitions only move forward:
 * {@code pending -> processing -> completed|failed}, or
 * {@code pending -> cancelled}.
 */
public enum OperationState {

    PENDING("pending"), PROCESSING("processing"), COMPLETED("completed"), FAILED("failed"), CANCELLED("cancelled");

    private final String value;

    OperationState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(OperationState next) {
        return allowedNext().contains(next);
    }

    private Set<OperationState> allowedNext() {
        return switch (this) {
        case PENDING -> EnumSet.of(PROCESSING, CANCELLED);
        case PROCESSING -> EnumSet.of(COMPLETED, FAILED);
        case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(OperationState.class);
        };
    }
}
