package me.golemcore.hindsight.domain.service;

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
import me.golemcore.hindsight.domain.exception.MemoryEngineException;
import me.golemcore.hindsight.domain.exception.ValidationException;
import me.golemcore.hindsight.domain.model.Capability;
import me.golemcore.hindsight.domain.model.DateRange;
import me.golemcore.hindsight.domain.model.FactType;
import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.domain.model.RecallQuery;
import me.golemcore.hindsight.domain.model.RecallStrategyType;
import me.golemcore.hindsight.domain.model.ScoredMemory;
import me.golemcore.hindsight.domain.recall.FusedCandidate;
import me.golemcore.hindsight.domain.recall.RankedCandidate;
import me.golemcore.hindsight.domain.recall.RecallContext;
import me.golemcore.hindsight.domain.recall.RecallStrategy;
import me.golemcore.hindsight.domain.recall.ReciprocalRankFusion;
import me.golemcore.hindsight.domain.recall.ScoreBlender;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.BankReadView;
import me.golemcore.hindsight.port.outbound.EmbeddingPort;
import me.golemcore.hindsight.port.outbound.MemoryRepositoryPort;
import me.golemcore.hindsight.port.outbound.RerankPort;
import me.golemcore.hindsight.port.outbound.TemporalParserPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Hybrid retrieval: four strategies in parallel, reciprocal-rank fusion, then
 * a cross-encoder rerank of the top candidates.
 *
 * <p>
 * The fact-type filter and the time range are applied inside every strategy,
 * before fusion, so they never shift the rank of an admitted unit. A strategy
 * that fails or exceeds {@code hindsight.recall.strategy-timeout-ms}
 * contributes an empty list. Recall never writes to the bank.
 *
 * <p>
 * Final weight, see {@link ScoreBlender}:
 * {@code 0.8 * rerank + 0.2 * fused / maxFused} by default. Results are ordered
 * by weight, then by fused order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecallService {

    private final BankService bankService;
    private final MemoryRepositoryPort repository;
    private final EmbeddingPort embeddingPort;
    private final RerankPort rerankPort;
    private final TemporalParserPort temporalParserPort;
    private final CapabilityInvoker capabilityInvoker;
    private final List<RecallStrategy> strategies;
    private final ExecutorService recallExecutor;
    private final HindsightProperties properties;

    /**
     * Lazy, finite ranked sequence. Nothing runs until subscription; every
     * subscription re-runs the query against the bank's current snapshot.
     */
    public Flux<ScoredMemory> recall(RecallQuery query) {
        return Flux.defer(() -> Flux.fromIterable(execute(query)));
    }

    /**
     * Runs the query immediately.
     */
    public List<ScoredMemory> execute(RecallQuery query) {
        validate(query);
        String bankId = BankService.requireBankId(query.getBankId());
        bankService.getProfile(bankId);
        long start = System.nanoTime();

        HindsightProperties.RecallProperties settings = properties.getRecall();
        int maxResults = query.getMaxResults() != null ? query.getMaxResults() : settings.getDefaultMaxResults();

        BankReadView view = repository.snapshot(bankId);
        DateRange range = resolveRange(query);
        float[] queryEmbedding = capabilityInvoker.invoke(Capability.EMBEDDING, "embed query",
                () -> embeddingPort.embed(query.getQueryText()));

        RecallContext context = new RecallContext(view, query.getQueryText(), queryEmbedding, range,
                admission(query.getFactTypes(), range), settings.getPerStrategyTopK());

        Map<RecallStrategyType, List<RankedCandidate>> rankings = runStrategies(context, settings);

        ReciprocalRankFusion fusion = new ReciprocalRankFusion(settings.getRrfK());
        List<FusedCandidate> fused = fusion.fuse(rankings);
        int rerankCount = Math.min(fused.size(), Math.max(settings.getRerankTopN(), maxResults));
        List<FusedCandidate> head = fused.subList(0, rerankCount);

        ScoreBlender blender = new ScoreBlender(settings.getRerankWeight(), fusion.maxScore(strategies.size()));
        List<ScoredMemory> ranked = rerankAndBlend(query.getQueryText(), head, blender);
        List<ScoredMemory> results = applyBudget(ranked, maxResults, query.getMaxTokens());

        log.info("[Recall] Bank {}: {} result(s) from {} fused candidate(s){} in {}ms",
                bankId, results.size(), fused.size(), range != null ? " within " + range : "",
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return results;
    }

    private Map<RecallStrategyType, List<RankedCandidate>> runStrategies(RecallContext context,
            HindsightProperties.RecallProperties settings) {
        Map<RecallStrategyType, CompletableFuture<List<RankedCandidate>>> futures = new LinkedHashMap<>();
        for (RecallStrategy strategy : strategies) {
            futures.put(strategy.type(), CompletableFuture
                    .supplyAsync(() -> strategy.search(context), recallExecutor)
                    .orTimeout(settings.getStrategyTimeoutMs(), TimeUnit.MILLISECONDS)
                    .exceptionally(error -> {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause()
                                : error;
                        if (cause instanceof TimeoutException) {
                            log.warn("[Recall] {} strategy timed out after {}ms, using no candidates",
                                    strategy.type(), settings.getStrategyTimeoutMs());
                        } else {
                            log.warn("[Recall] {} strategy failed, using no candidates: {}",
                                    strategy.type(), cause.getMessage());
                        }
                        return List.of();
                    }));
        }
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        Map<RecallStrategyType, List<RankedCandidate>> rankings = new EnumMap<>(RecallStrategyType.class);
        futures.forEach((type, future) -> {
            List<RankedCandidate> candidates = future.join();
            rankings.put(type, candidates);
            log.debug("[Recall] {} strategy returned {} candidate(s)", type, candidates.size());
        });
        return rankings;
    }

    private List<ScoredMemory> rerankAndBlend(String queryText, List<FusedCandidate> head, ScoreBlender blender) {
        if (head.isEmpty()) {
            return List.of();
        }
        List<Double> rerankScores = rerank(queryText, head);

        List<ScoredMemory> ranked = new ArrayList<>(head.size());
        for (int i = 0; i < head.size(); i++) {
            FusedCandidate candidate = head.get(i);
            Double rerankScore = rerankScores != null ? rerankScores.get(i) : null;
            ranked.add(ScoredMemory.builder()
                    .unit(candidate.unit())
                    .fusedScore(candidate.score())
                    .rerankScore(rerankScore)
                    .weight(blender.blend(candidate.score(), rerankScore))
                    .strategyRanks(new EnumMap<>(candidate.ranks()))
                    .build());
        }
        // List.sort is stable, so equal weights keep their fused order
        ranked.sort(Comparator.comparingDouble(ScoredMemory::getWeight).reversed());
        return ranked;
    }

    private List<Double> rerank(String queryText, List<FusedCandidate> head) {
        List<String> texts = head.stream().map(candidate -> candidate.unit().getText()).toList();
        try {
            List<Double> scores = capabilityInvoker.invoke(Capability.RERANK, "rerank",
                    () -> rerankPort.rerank(queryText, texts));
            if (scores == null || scores.size() != texts.size()) {
                throw new MemoryEngineException(ErrorKind.RERANK_FAILURE, "Reranker returned "
                        + (scores == null ? 0 : scores.size()) + " score(s) for " + texts.size() + " candidate(s)");
            }
            return scores;
        } catch (MemoryEngineException e) {
            if (!properties.getRecall().isRerankFallbackEnabled()) {
                throw e;
            }
            log.warn("[Recall] Reranking failed, ranking by fused score only: {}", e.getMessage());
            return null;
        }
    }

    private DateRange resolveRange(RecallQuery query) {
        boolean explicit = query.getTimeExpression() != null && !query.getTimeExpression().isBlank();
        String expression = explicit ? query.getTimeExpression() : query.getQueryText();
        try {
            Optional<DateRange> range = capabilityInvoker.invoke(Capability.TEMPORAL, "parse time",
                    () -> temporalParserPort.parse(expression));
            if (range.isEmpty() && explicit) {
                log.debug("[Recall] Time expression '{}' did not resolve, no time filter applied", expression);
            }
            return range.orElse(null);
        } catch (MemoryEngineException e) {
            if (explicit) {
                throw e;
            }
            log.warn("[Recall] Time detection in query failed, no time filter applied: {}", e.getMessage());
            return null;
        }
    }

    static Predicate<MemoryUnit> admission(Set<FactType> factTypes, DateRange range) {
        Set<FactType> admitted = factTypes == null || factTypes.isEmpty()
                ? EnumSet.allOf(FactType.class)
                : EnumSet.copyOf(factTypes);
        return unit -> admitted.contains(unit.getFactType())
                && (range == null || range.intersects(unit.getOccurredStart(), unit.getOccurredEnd()));
    }

    private static List<ScoredMemory> applyBudget(List<ScoredMemory> ranked, int maxResults, Integer maxTokens) {
        List<ScoredMemory> results = new ArrayList<>();
        int tokens = 0;
        for (ScoredMemory memory : ranked) {
            if (results.size() >= maxResults) {
                break;
            }
            if (maxTokens != null) {
                int cost = TextSupport.estimateTokens(memory.getUnit().getText());
                if (tokens + cost > maxTokens) {
                    break;
                }
                tokens += cost;
            }
            results.add(memory);
        }
        return Collections.unmodifiableList(results);
    }

    private static void validate(RecallQuery query) {
        if (query == null) {
            throw new ValidationException("Recall query is required");
        }
        if (query.getQueryText() == null || query.getQueryText().isBlank()) {
            throw new ValidationException("Query text must not be blank");
        }
        if (query.getMaxResults() != null && query.getMaxResults() <= 0) {
            throw new ValidationException("maxResults must be positive");
        }
        if (query.getMaxTokens() != null && query.getMaxTokens() <= 0) {
            throw new ValidationException("maxTokens must be positive");
        }
    }
}
