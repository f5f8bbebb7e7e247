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

import me.golemcore.hindsight.domain.exception.ErrorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of retaining a single batch item.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetainItemOutcome {

    private int index;
    private String documentId;
    private boolean success;

    @Builder.Default
    private List<String> createdUnitIds = new ArrayList<>();

    @Builder.Default
    private List<String> mergedUnitIds = new ArrayList<>();

    private boolean documentReplaced;
    private ErrorKind errorKind;
    private String errorMessage;

    public static RetainItemOutcome failure(int index, String documentId, ErrorKind kind, String message) {
        return RetainItemOutcome.builder()
                .index(index)
                .documentId(documentId)
                .success(false)
                .errorKind(kind)
                .errorMessage(message)
                .build();
    }
}
