package me.golemcore.hindsight.adapter.outbound.repository;

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

import me.golemcore.hindsight.domain.service.TextSupport;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Incrementally maintained BM25 statistics over the texts of one bank.
 *
 * <p>
 * Document frequencies and lengths are updated on every add/remove, so
 * scoring never rescans the corpus. Uses {@code k1 = 1.2}, {@code b = 0.75}
 * and the non-negative idf {@code ln((N - df + 0.5) / (df + 0.5) + 1)}.
 */
final class Bm25Index {

    private static final double K1 = 1.2;
    private static final double B = 0.75;

    private final Map<String, Map<String, Integer>> termFrequencies;
    private final Map<String, Integer> lengths;
    private final Map<String, Integer> documentFrequencies;
    private long totalLength;

    Bm25Index() {
        this.termFrequencies = new HashMap<>();
        this.lengths = new HashMap<>();
        this.documentFrequencies = new HashMap<>();
        this.totalLength = 0;
    }

    private Bm25Index(Bm25Index other) {
        // Per-document maps are never mutated after insertion, so sharing them is safe
        this.termFrequencies = new HashMap<>(other.termFrequencies);
        this.lengths = new HashMap<>(other.lengths);
        this.documentFrequencies = new HashMap<>(other.documentFrequencies);
        this.totalLength = other.totalLength;
    }

    Bm25Index copy() {
        return new Bm25Index(this);
    }

    void add(String id, String text) {
        remove(id);
        List<String> tokens = TextSupport.tokenize(text);
        Map<String, Integer> tf = new HashMap<>();
        for (String token : tokens) {
            tf.merge(token, 1, Integer::sum);
        }
        termFrequencies.put(id, Map.copyOf(tf));
        lengths.put(id, tokens.size());
        totalLength += tokens.size();
        for (String term : tf.keySet()) {
            documentFrequencies.merge(term, 1, Integer::sum);
        }
    }

    void remove(String id) {
        Map<String, Integer> tf = termFrequencies.remove(id);
        if (tf == null) {
            return;
        }
        Integer length = lengths.remove(id);
        totalLength -= length != null ? length : 0;
        for (String term : tf.keySet()) {
            documentFrequencies.computeIfPresent(term, (k, v) -> v > 1 ? v - 1 : null);
        }
    }

    /**
     * Distinct query terms in first-occurrence order.
     */
    static Set<String> queryTerms(String query) {
        return new LinkedHashSet<>(TextSupport.tokenize(query));
    }

    /**
     * BM25 score of one indexed text; 0 when no query term matches.
     */
    double score(String id, Set<String> queryTerms) {
        Map<String, Integer> tf = termFrequencies.get(id);
        if (tf == null || tf.isEmpty() || queryTerms.isEmpty()) {
            return 0.0;
        }
        int n = termFrequencies.size();
        double avgLength = n == 0 ? 1.0 : Math.max(1.0, (double) totalLength / n);
        int length = lengths.getOrDefault(id, 0);
        double score = 0.0;
        for (String term : queryTerms) {
            Integer f = tf.get(term);
            if (f == null) {
                continue;
            }
            int df = documentFrequencies.getOrDefault(term, 0);
            double idf = Math.log((n - df + 0.5) / (df + 0.5) + 1.0);
            double norm = f * (K1 + 1) / (f + K1 * (1 - B + B * length / avgLength));
            score += idf * norm;
        }
        return score;
    }
}
