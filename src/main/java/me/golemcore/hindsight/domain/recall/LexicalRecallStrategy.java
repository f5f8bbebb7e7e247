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
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * BM25 full-text ranking of unit text against the query terms.
 */
@Component
public class LexicalRecallStrategy implements RecallStrategy {

    @Override
    public RecallStrategyType type() {
        return RecallStrategyType.LEXICAL;
    }

    @Override
    public List<RankedCandidate> search(RecallContext context) {
        return context.view()
                .fullText(context.queryText(), context.topK(), context.admission())
                .stream()
                .map(hit -> new RankedCandidate(hit.unit(), hit.score()))
                .toList();
    }
}
