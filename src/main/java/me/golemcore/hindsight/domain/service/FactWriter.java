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

import me.golemcore.hindsight.domain.entity.EntityResolutionService;
import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.BankReadView.ScoredUnit;
import me.golemcore.hindsight.port.outbound.MemoryTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Writes one prepared fact inside a bank transaction: near-duplicate check
 * against units of the same fact type, then either a merge into the existing
 * unit or a new unit with its entity, temporal and semantic links.
 *
 * <p>
 * Must run under the bank's writer lock (see {@link BankWriteCoordinator}) so
 * the duplicate check and the write are not interleaved with another writer.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FactWriter {

    private final EntityResolutionService entityResolutionService;
    private final FactLinker factLinker;
    private final HindsightProperties properties;

    public enum DuplicatePolicy {
        /**
         * Boost the existing unit's confidence and add provenance.
         */
        MERGE,
        /**
         * Leave the existing unit untouched and write nothing.
         */
        SKIP
    }

    public enum Outcome {
        CREATED, MERGED, SKIPPED
    }

    public record Result(MemoryUnit unit, Outcome outcome) {
    }

    /**
     * @param documentId
     *            provenance document, may be null
     * @param predecessor
     *            previous fact written for the same item, may be null
     * @param now
     *            ingestion time recorded as {@code mentionedAt}
     */
    public Result write(MemoryTransaction tx, PreparedFact fact, String documentId, MemoryUnit predecessor,
            DuplicatePolicy policy, Instant now) {
        return write(tx, fact, documentId, predecessor, policy, properties.getRetain().getDedupThreshold(), now);
    }

    /**
     * Same as {@link #write(MemoryTransaction, PreparedFact, String, MemoryUnit, DuplicatePolicy, Instant)}
     * with an explicit near-duplicate similarity threshold.
     */
    public Result write(MemoryTransaction tx, PreparedFact fact, String documentId, MemoryUnit predecessor,
            DuplicatePolicy policy, double duplicateThreshold, Instant now) {
        Optional<ScoredUnit> duplicate = findDuplicate(tx, fact, duplicateThreshold);
        if (duplicate.isPresent()) {
            MemoryUnit existing = duplicate.get().unit();
            if (policy == DuplicatePolicy.SKIP) {
                log.trace("[Retain] Skipped near-duplicate of {} (similarity {})",
                        existing.getId(), duplicate.get().score());
                return new Result(existing, Outcome.SKIPPED);
            }
            double merged = Math.min(1.0, Math.max(existing.getConfidence(), fact.confidence())
                    + properties.getRetain().getMergeConfidenceBoost());
            MemoryUnit updated = existing.withMerge(merged, documentId);
            tx.putUnit(updated);
            entityResolutionService.linkMentions(tx, updated, fact.entities());
            factLinker.linkSequence(tx, predecessor, updated);
            log.trace("[Retain] Merged into {} (similarity {}, confidence {} -> {})", existing.getId(),
                    duplicate.get().score(), existing.getConfidence(), merged);
            return new Result(updated, Outcome.MERGED);
        }

        MemoryUnit unit = MemoryUnit.builder()
                .id(UUID.randomUUID().toString())
                .bankId(tx.bankId())
                .text(fact.text())
                .factType(fact.factType())
                .confidence(fact.confidence())
                .embedding(fact.embedding())
                .occurredStart(fact.occurredStart())
                .occurredEnd(fact.occurredEnd())
                .mentionedAt(now)
                .context(fact.context())
                .documentId(documentId)
                .documentIds(documentId != null ? List.of(documentId) : List.of())
                .undocumented(documentId == null)
                .build();
        tx.putUnit(unit);
        entityResolutionService.linkMentions(tx, unit, fact.entities());
        factLinker.link(tx, unit, predecessor);
        return new Result(unit, Outcome.CREATED);
    }

    private Optional<ScoredUnit> findDuplicate(MemoryTransaction tx, PreparedFact fact, double threshold) {
        return tx.nearest(fact.embedding(), 1, threshold, unit -> unit.getFactType() == fact.factType())
                .stream()
                .findFirst();
    }
}
