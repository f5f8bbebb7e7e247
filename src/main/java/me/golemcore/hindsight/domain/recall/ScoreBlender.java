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

/**
 * Final relevance weight of a recalled unit.
 *
 * <pre>
 * weight = rerankWeight * clamp(rerank, 0, 1) + (1 - rerankWeight) * fused / maxFused
 * </pre>
 *
 * where {@code maxFused} is the fusion score of a unit ranked first by every
 * strategy, so both terms lie in {@code [0, 1]}. Without a reranker score the
 * weight is the normalized fusion score alone.
 */
public final class ScoreBlender {

    private final double rerankWeight;
    private final double maxFused;

    public ScoreBlender(double rerankWeight, double maxFused) {
        if (rerankWeight < 0.0 || rerankWeight > 1.0) {
            throw new IllegalArgumentException("rerank weight must be within [0, 1]: " + rerankWeight);
        }
        this.rerankWeight = rerankWeight;
        this.maxFused = maxFused;
    }

    public double blend(double fusedScore, Double rerankScore) {
        double fused = normalizedFused(fusedScore);
        if (rerankScore == null) {
            return fused;
        }
        double rerank = Double.isNaN(rerankScore) ? 0.0 : Math.max(0.0, Math.min(1.0, rerankScore));
        return rerankWeight * rerank + (1.0 - rerankWeight) * fused;
    }

    public double normalizedFused(double fusedScore) {
        if (maxFused <= 0.0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, fusedScore / maxFused));
    }
}
