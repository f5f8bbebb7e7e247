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
 * Nearest neighbours of the query embedding by cosine similarity. Units with
 * no positive similarity are not returned.
 */
@Component
public class SemanticRecallStrategy implements RecallStrategy {

    @Override
    public RecallStrategyType type() {
        return RecallStrategyType.SEMANTIC;
    }

    @Override
    public List<RankedCandidate> search(RecallContext context) {
        if (context.queryEmbedding() == null) {
            return List.of();
        }
        return context.view()
                .nearest(context.queryEmbedding(), context.topK(), Double.MIN_VALUE, context.admission())
                .stream()
                .map(hit -> new RankedCandidate(hit.unit(), hit.score()))
                .toList();
    }
}
