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

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * One piece of content to retain. {@code occurredStart}/{@code occurredEnd} are
 * a hint applied to extracted facts that carry no time span of their own.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetainItem {

    private String content;
    private String documentId;
    private String context;
    private Instant occurredStart;
    private Instant occurredEnd;

    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    public static RetainItem of(String content) {
        return RetainItem.builder().content(content).build();
    }
}
