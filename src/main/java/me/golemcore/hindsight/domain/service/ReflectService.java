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
import me.golemcore.hindsight.domain.model.Bank;
import me.golemcore.hindsight.domain.model.Capability;
import me.golemcore.hindsight.domain.model.FactType;
import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.domain.model.OpinionCandidate;
import me.golemcore.hindsight.domain.model.ReasoningOutput;
import me.golemcore.hindsight.domain.model.ReasoningRequest;
import me.golemcore.hindsight.domain.model.RecallQuery;
import me.golemcore.hindsight.domain.model.ReflectRequest;
import me.golemcore.hindsight.domain.model.ReflectResult;
import me.golemcore.hindsight.domain.model.ScoredMemory;
import me.golemcore.hindsight.domain.reflect.DispositionPolicy;
import me.golemcore.hindsight.domain.reflect.OpinionDecision;
import me.golemcore.hindsight.domain.reflect.PersonalityStyleGuide;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.EmbeddingPort;
import me.golemcore.hindsight.port.outbound.ReasoningPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Opinion synthesis: recalls agent facts, world facts and existing opinions,
 * asks the reasoning capability for an answer and candidate opinions, filters
 * them through the bank's {@link DispositionPolicy} and appends the accepted
 * ones as new opinion units.
 *
 * <p>
 * Accepted opinions are written in one transaction through the bank's writer
 * lock. An opinion that nearly duplicates an existing one is skipped; existing
 * units are never modified. If reasoning fails nothing is written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReflectService {

    private final BankService bankService;
    private final RecallService recallService;
    private final ReasoningPort reasoningPort;
    private final EmbeddingPort embeddingPort;
    private final CapabilityInvoker capabilityInvoker;
    private final DispositionPolicy dispositionPolicy;
    private final PersonalityStyleGuide styleGuide;
    private final BankWriteCoordinator writeCoordinator;
    private final FactWriter factWriter;
    private final HindsightProperties properties;
    private final Clock clock;

    public ReflectResult reflect(ReflectRequest request) {
        if (request == null || request.getQuery() == null || request.getQuery().isBlank()) {
            throw new ValidationException("Reflect query must not be blank");
        }
        Bank bank = bankService.getProfile(request.getBankId());
        String bankId = bank.getBankId();
        HindsightProperties.ReflectProperties settings = properties.getReflect();

        List<ScoredMemory> agentFacts = recall(bankId, request.getQuery(), FactType.AGENT,
                settings.getAgentFactsBudget());
        List<ScoredMemory> worldFacts = recall(bankId, request.getQuery(), FactType.WORLD,
                settings.getWorldFactsBudget());
        List<ScoredMemory> opinions = recall(bankId, request.getQuery(), FactType.OPINION,
                settings.getOpinionsBudget());

        List<ScoredMemory> factsUsed = new ArrayList<>(agentFacts);
        factsUsed.addAll(worldFacts);
        factsUsed.addAll(opinions);
        Map<String, MemoryUnit> retrieved = new LinkedHashMap<>();
        factsUsed.forEach(fact -> retrieved.put(fact.getUnit().getId(), fact.getUnit()));

        ReasoningRequest reasoningRequest = ReasoningRequest.builder()
                .bankId(bankId)
                .query(request.getQuery())
                .context(request.getContext())
                .background(bank.getBackground())
                .styleGuidance(styleGuide.describe(bank.getPersonality()))
                .agentFacts(units(agentFacts))
                .worldFacts(units(worldFacts))
                .opinions(units(opinions))
                .build();
        ReasoningOutput output = capabilityInvoker.invoke(Capability.REASONING, "reflect",
                () -> reasoningPort.reason(reasoningRequest));
        if (output == null) {
            throw new MemoryEngineException(ErrorKind.REASONING_FAILURE, "Reasoning returned no output");
        }

        List<OpinionCandidate> candidates = output.getOpinions() != null ? output.getOpinions() : List.of();
        List<OpinionDecision> decisions = dispositionPolicy.evaluate(candidates, bank.getDisposition(), retrieved,
                settings.getMaxNewOpinions());
        List<OpinionDecision> accepted = decisions.stream().filter(OpinionDecision::accepted).toList();
        decisions.stream()
                .filter(decision -> !decision.accepted())
                .forEach(decision -> log.debug("[Reflect] Rejected opinion '{}': {}",
                        TextSupport.truncate(decision.candidate().getText(), 80), decision.reason()));

        List<MemoryUnit> newOpinions = persist(bankId, accepted, request.getContext());
        log.info("[Reflect] Bank {}: {} fact(s) used, {}/{} opinion(s) accepted, {} persisted",
                bankId, factsUsed.size(), accepted.size(), candidates.size(), newOpinions.size());

        return ReflectResult.builder()
                .answer(output.getAnswer())
                .factsUsed(factsUsed)
                .newOpinions(newOpinions)
                .build();
    }

    private List<ScoredMemory> recall(String bankId, String query, FactType type, int budget) {
        if (budget <= 0) {
            return List.of();
        }
        return recallService.execute(RecallQuery.builder()
                .bankId(bankId)
                .queryText(query)
                .factTypes(EnumSet.of(type))
                .maxResults(budget)
                .build());
    }

    private List<MemoryUnit> persist(String bankId, List<OpinionDecision> accepted, String context) {
        if (accepted.isEmpty()) {
            return List.of();
        }
        List<String> texts = accepted.stream().map(decision -> decision.candidate().getText().trim()).toList();
        List<float[]> embeddings = capabilityInvoker.invoke(Capability.EMBEDDING, "embed opinions",
                () -> embeddingPort.embedBatch(texts));
        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new MemoryEngineException(ErrorKind.EMBEDDING_FAILURE,
                    "Embedding returned a wrong number of vectors for " + texts.size() + " opinion(s)");
        }

        List<PreparedFact> facts = new ArrayList<>(accepted.size());
        for (int i = 0; i < accepted.size(); i++) {
            OpinionDecision decision = accepted.get(i);
            facts.add(new PreparedFact(texts.get(i), FactType.OPINION, decision.confidence(), embeddings.get(i),
                    null, null, context, decision.candidate().getEntities()));
        }

        double duplicateThreshold = properties.getReflect().getOpinionDedupThreshold();
        return writeCoordinator.write(bankId, "reflect", tx -> {
            Instant now = clock.instant();
            List<MemoryUnit> created = new ArrayList<>();
            for (PreparedFact fact : facts) {
                FactWriter.Result result = factWriter.write(tx, fact, null, null,
                        FactWriter.DuplicatePolicy.SKIP, duplicateThreshold, now);
                if (result.outcome() == FactWriter.Outcome.CREATED) {
                    created.add(result.unit());
                }
            }
            return created;
        });
    }

    private static List<MemoryUnit> units(List<ScoredMemory> memories) {
        return memories.stream().map(ScoredMemory::getUnit).toList();
    }
}
