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
import me.golemcore.hindsight.domain.model.Document;
import me.golemcore.hindsight.domain.model.ExtractedFact;
import me.golemcore.hindsight.domain.model.FactType;
import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.domain.model.RetainBatchResult;
import me.golemcore.hindsight.domain.model.RetainItem;
import me.golemcore.hindsight.domain.model.RetainItemOutcome;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.EmbeddingPort;
import me.golemcore.hindsight.port.outbound.ExtractionPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ingestion pipeline: extraction, embedding, dedup, entity resolution, linking
 * and persistence.
 *
 * <p>
 * Extraction and embedding run outside the bank's writer lock. Everything that
 * reads-then-writes the bank (document replace, duplicate check, linking) runs
 * in one transaction under the lock, so each item is applied completely or not
 * at all. A batch reports one outcome per item; a failed item never aborts the
 * others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetainService {

    private final BankService bankService;
    private final BankWriteCoordinator writeCoordinator;
    private final FactWriter factWriter;
    private final ExtractionPort extractionPort;
    private final EmbeddingPort embeddingPort;
    private final CapabilityInvoker capabilityInvoker;
    private final HindsightProperties properties;
    private final Clock clock;

    public RetainBatchResult retainBatch(String bankId, List<RetainItem> items) {
        String id = BankService.requireBankId(bankId);
        if (items == null || items.isEmpty()) {
            throw new ValidationException("Retain batch must contain at least one item");
        }
        bankService.getProfile(id);

        List<RetainItemOutcome> outcomes = new ArrayList<>(items.size());
        for (int index = 0; index < items.size(); index++) {
            RetainItem item = items.get(index);
            String documentId = item != null ? item.getDocumentId() : null;
            try {
                outcomes.add(retainItem(id, index, item));
            } catch (MemoryEngineException e) {
                log.warn("[Retain] Item {} of batch for bank {} failed ({}): {}",
                        index, id, e.getKind(), e.getMessage());
                outcomes.add(RetainItemOutcome.failure(index, documentId, e.getKind(), e.getMessage()));
            } catch (RuntimeException e) { // NOSONAR - one bad item must not abort the batch
                log.error("[Retain] Item {} of batch for bank {} failed unexpectedly", index, id, e);
                outcomes.add(RetainItemOutcome.failure(index, documentId, ErrorKind.INTERNAL, e.getMessage()));
            }
        }

        RetainBatchResult result = RetainBatchResult.builder()
                .bankId(id)
                .outcomes(outcomes)
                .build();
        log.info("[Retain] Bank {}: {}/{} item(s) retained, {} unit(s) created",
                id, result.getSucceeded(), items.size(), result.getCreatedUnitIds().size());
        return result;
    }

    /**
     * Retains a single item.
     *
     * @throws MemoryEngineException
     *             if the item fails
     */
    public RetainItemOutcome retain(String bankId, RetainItem item) {
        String id = BankService.requireBankId(bankId);
        bankService.getProfile(id);
        return retainItem(id, 0, item);
    }

    private RetainItemOutcome retainItem(String bankId, int index, RetainItem item) {
        validate(item);
        String content = item.getContent().trim();

        List<ExtractedFact> extracted = capabilityInvoker.invoke(Capability.EXTRACTION, "extract",
                () -> extractionPort.extract(content, item.getContext()));
        List<PreparedFact> facts = prepare(item, extracted);
        log.debug("[Retain] Item {} for bank {}: {} fact(s) extracted", index, bankId, facts.size());

        return writeCoordinator.write(bankId, "retain", tx -> {
            Instant now = clock.instant();
            String documentId = item.getDocumentId();
            boolean replaced = false;
            if (documentId != null) {
                Optional<Document> existing = tx.findDocument(documentId);
                if (existing.isPresent()) {
                    int removed = tx.deleteDocumentCascade(documentId);
                    replaced = true;
                    log.debug("[Retain] Replacing document {} in bank {} ({} unit(s) removed)",
                            documentId, bankId, removed);
                }
                tx.putDocument(Document.builder()
                        .id(documentId)
                        .bankId(bankId)
                        .text(content)
                        .metadata(item.getMetadata() != null ? Map.copyOf(item.getMetadata()) : Map.of())
                        .createdAt(existing.map(Document::getCreatedAt).orElse(now))
                        .updatedAt(now)
                        .build());
            }

            List<String> created = new ArrayList<>();
            List<String> merged = new ArrayList<>();
            MemoryUnit previous = null;
            for (PreparedFact fact : facts) {
                FactWriter.Result written = factWriter.write(tx, fact, documentId, previous,
                        FactWriter.DuplicatePolicy.MERGE, now);
                if (written.outcome() == FactWriter.Outcome.CREATED) {
                    created.add(written.unit().getId());
                } else if (!merged.contains(written.unit().getId())) {
                    merged.add(written.unit().getId());
                }
                previous = written.unit();
            }
            return RetainItemOutcome.builder()
                    .index(index)
                    .documentId(documentId)
                    .success(true)
                    .createdUnitIds(created)
                    .mergedUnitIds(merged)
                    .documentReplaced(replaced)
                    .build();
        });
    }

    private List<PreparedFact> prepare(RetainItem item, List<ExtractedFact> extracted) {
        List<ExtractedFact> usable = new ArrayList<>();
        if (extracted != null) {
            for (ExtractedFact fact : extracted) {
                if (fact != null && fact.getText() != null && !fact.getText().isBlank()) {
                    usable.add(fact);
                }
            }
        }
        if (usable.isEmpty()) {
            return List.of();
        }

        List<String> texts = usable.stream().map(fact -> fact.getText().trim()).toList();
        List<float[]> embeddings = capabilityInvoker.invoke(Capability.EMBEDDING, "embed",
                () -> embeddingPort.embedBatch(texts));
        checkEmbeddings(embeddings, texts.size());

        List<PreparedFact> prepared = new ArrayList<>(usable.size());
        for (int i = 0; i < usable.size(); i++) {
            ExtractedFact fact = usable.get(i);
            Instant start = fact.getOccurredStart() != null ? fact.getOccurredStart() : item.getOccurredStart();
            Instant end = fact.getOccurredEnd() != null ? fact.getOccurredEnd() : item.getOccurredEnd();
            if (start != null && end != null && start.isAfter(end)) {
                Instant swap = start;
                start = end;
                end = swap;
            }
            double confidence = fact.getConfidence() != null
                    ? fact.getConfidence()
                    : properties.getRetain().getDefaultConfidence();
            prepared.add(new PreparedFact(
                    texts.get(i),
                    fact.getFactType() != null ? fact.getFactType() : FactType.WORLD,
                    Math.max(0.0, Math.min(1.0, confidence)),
                    embeddings.get(i),
                    start,
                    end,
                    item.getContext(),
                    fact.getEntities()));
        }
        return prepared;
    }

    private void checkEmbeddings(List<float[]> embeddings, int expected) {
        if (embeddings == null || embeddings.size() != expected) {
            throw new MemoryEngineException(ErrorKind.EMBEDDING_FAILURE, "Embedding returned "
                    + (embeddings == null ? 0 : embeddings.size()) + " vector(s) for " + expected + " text(s)");
        }
        int dimension = embeddingPort.getDimension();
        for (float[] vector : embeddings) {
            if (vector == null || vector.length != dimension) {
                throw new MemoryEngineException(ErrorKind.EMBEDDING_FAILURE, "Embedding has dimension "
                        + (vector == null ? 0 : vector.length) + ", expected " + dimension);
            }
        }
    }

    private static void validate(RetainItem item) {
        if (item == null) {
            throw new ValidationException("Retain item must not be null");
        }
        if (item.getContent() == null || item.getContent().isBlank()) {
            throw new ValidationException("Retain item content must not be blank");
        }
        if (item.getDocumentId() != null && item.getDocumentId().isBlank()) {
            throw new ValidationException("Document id must not be blank when present");
        }
        if (item.getOccurredStart() != null && item.getOccurredEnd() != null
                && item.getOccurredStart().isAfter(item.getOccurredEnd())) {
            throw new ValidationException("occurredStart must not be after occurredEnd");
        }
    }
}
