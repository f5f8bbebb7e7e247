package me.golemcore.hindsight.adapter.outbound.rerank;

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

import me.golemcore.hindsight.adapter.outbound.llm.ProviderErrors;
import me.golemcore.hindsight.port.outbound.EmbeddingPort;
import me.golemcore.hindsight.port.outbound.RerankPort;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Cross-encoder reranking through a langchain4j {@link ScoringModel} bean.
 *
 * <p>
 * Without a scoring model the adapter scores each candidate by cosine
 * similarity between query and candidate embeddings, mapped to [0, 1]. Scores
 * are returned in candidate order.
 *
 * <p>
 * Scoring models either return probabilities or raw cross-encoder logits. A
 * batch whose scores all lie in [0, 1] is passed through; otherwise every score
 * of the batch goes through the logistic function, which keeps the model's
 * order.
 */
@Component
@Slf4j
public class ScoringModelRerankAdapter implements RerankPort {

    private final ObjectProvider<ScoringModel> scoringModelProvider;
    private final EmbeddingPort embeddingPort;

    public ScoringModelRerankAdapter(ObjectProvider<ScoringModel> scoringModelProvider,
            EmbeddingPort embeddingPort) {
        this.scoringModelProvider = scoringModelProvider;
        this.embeddingPort = embeddingPort;
    }

    @Override
    public CompletableFuture<List<Double>> rerank(String query, List<String> candidates) {
        if (candidates.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        ScoringModel scoringModel = scoringModelProvider.getIfAvailable();
        if (scoringModel != null) {
            return CompletableFuture.supplyAsync(() -> score(scoringModel, query, candidates));
        }
        log.trace("[Recall] No scoring model, reranking {} candidate(s) by embedding similarity",
                candidates.size());
        return embeddingPort.embed(query)
                .thenCombine(embeddingPort.embedBatch(candidates), ScoringModelRerankAdapter::cosineScores);
    }

    private static List<Double> score(ScoringModel scoringModel, String query, List<String> candidates) {
        List<TextSegment> segments = candidates.stream().map(TextSegment::from).toList();
        try {
            Response<List<Double>> response = scoringModel.scoreAll(segments, query);
            return toUnitInterval(response.content());
        } catch (RuntimeException e) {
            throw ProviderErrors.translate("scoring", e);
        }
    }

    static List<Double> toUnitInterval(List<Double> scores) {
        if (scores == null) {
            return null;
        }
        boolean probabilities = scores.stream()
                .allMatch(score -> score != null && score >= 0.0 && score <= 1.0);
        if (probabilities) {
            return scores;
        }
        List<Double> mapped = new ArrayList<>(scores.size());
        for (Double score : scores) {
            mapped.add(score == null || score.isNaN() ? 0.0 : 1.0 / (1.0 + Math.exp(-score)));
        }
        return mapped;
    }

    static List<Double> cosineScores(float[] query, List<float[]> candidates) {
        List<Double> scores = new ArrayList<>(candidates.size());
        for (float[] candidate : candidates) {
            double cosine = EmbeddingPort.cosineSimilarity(query, candidate);
            scores.add(Math.max(0.0, Math.min(1.0, (cosine + 1.0) / 2.0)));
        }
        return scores;
    }
}
