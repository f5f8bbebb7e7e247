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

/**
 * Entity name as it appears in a fact, before resolution.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EntityMention {

    public static final String TYPE_PERSON = "person";
    public static final String TYPE_OTHER = "other";

    private String name;
    private String type;

    public static EntityMention of(String name, String type) {
        return new EntityMention(name, type);
    }
}
