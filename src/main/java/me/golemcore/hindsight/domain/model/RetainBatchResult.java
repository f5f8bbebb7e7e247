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

import java.util.ArrayList;
import java.util.List;

/**
 * Per-item outcomes of a batch retain. A batch never aborts as a whole; each
 * item succeeds or fails on its own.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetainBatchResult {

    private String bankId;

    @Builder.Default
    private List<RetainItemOutcome> outcomes = new ArrayList<>();

    public long getSucceeded() {
        return outcomes.stream().filter(RetainItemOutcome::isSuccess).count();
    }

    public long getFailed() {
        return outcomes.size() - getSucceeded();
    }

    public boolean isAllSucceeded() {
        return getFailed() == 0;
    }

    public List<String> getCreatedUnitIds() {
        List<String> ids = new ArrayList<>();
        for (RetainItemOutcome outcome : outcomes) {
            ids.addAll(outcome.getCreatedUnitIds());
        }
        return ids;
    }
}
