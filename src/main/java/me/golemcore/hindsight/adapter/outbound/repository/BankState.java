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

import me.golemcore.hindsight.domain.model.Bank;
import me.golemcore.hindsight.domain.model.Document;
import me.golemcore.hindsight.domain.model.Entity;
import me.golemcore.hindsight.domain.model.EntityLink;
import me.golemcore.hindsight.domain.model.FactType;
import me.golemcore.hindsight.domain.model.MemoryLink;
import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.port.outbound.EmbeddingPort;
import me.golemcore.hindsight.port.outbound.MemoryTransaction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Arena of one bank: units, documents and entities keyed by id, with entity
 * links and unit-to-unit links held in separate edge tables plus adjacency
 * indexes.
 *
 * <p>
 * A state is either a private working copy (mutable) or a published snapshot
 * (frozen). Published snapshots are never mutated; a transaction works on
 * {@link #copy()} and the copy replaces the snapshot on commit.
 */
final class BankState implements MemoryTransaction {

    private static final Comparator<ScoredUnit> BEST_FIRST = Comparator
            .comparingDouble(ScoredUnit::score).reversed()
            .thenComparing(s -> s.unit().getId());

    private final String bankId;
    private final Map<String, MemoryUnit> units;
    private final Map<String, Document> documents;
    private final Map<String, Entity> entities;
    private final Map<String, EntityLink> entityLinks;
    private final Map<String, Set<String>> entitiesByUnit;
    private final Map<String, Set<String>> unitsByEntity;
    private final Map<String, MemoryLink> links;
    private final Map<String, Set<String>> linkKeysByUnit;
    private final Bm25Index textIndex;
    private Integer dimension;
    private boolean frozen;

    private BankState(String bankId) {
        this.bankId = bankId;
        this.units = new LinkedHashMap<>();
        this.documents = new LinkedHashMap<>();
        this.entities = new LinkedHashMap<>();
        this.entityLinks = new LinkedHashMap<>();
        this.entitiesByUnit = new LinkedHashMap<>();
        this.unitsByEntity = new LinkedHashMap<>();
        this.links = new LinkedHashMap<>();
        this.linkKeysByUnit = new LinkedHashMap<>();
        this.textIndex = new Bm25Index();
    }

    private BankState(BankState other) {
        this.bankId = other.bankId;
        this.units = new LinkedHashMap<>(other.units);
        this.documents = new LinkedHashMap<>(other.documents);
        this.entities = new LinkedHashMap<>(other.entities);
        this.entityLinks = new LinkedHashMap<>(other.entityLinks);
        this.entitiesByUnit = deepCopy(other.entitiesByUnit);
        this.unitsByEntity = deepCopy(other.unitsByEntity);
        this.links = new LinkedHashMap<>(other.links);
        this.linkKeysByUnit = deepCopy(other.linkKeysByUnit);
        this.textIndex = other.textIndex.copy();
        this.dimension = other.dimension;
    }

    static BankState empty(String bankId) {
        return new BankState(bankId);
    }

    BankState copy() {
        return new BankState(this);
    }

    BankState freeze() {
        this.frozen = true;
        return this;
    }

    /**
     * Rebuilds a state from a snapshot, re-validating every record on the way
     * in.
     */
    static BankState restore(BankSnapshot snapshot) {
        BankState state = new BankState(snapshot.bank().getBankId());
        snapshot.units().forEach(state::putUnit);
        snapshot.documents().forEach(state::putDocument);
        snapshot.entities().forEach(state::putEntity);
        snapshot.entityLinks().forEach(state::putEntityLink);
        snapshot.links().forEach(state::putLink);
        return state;
    }

    BankSnapshot toSnapshot(Bank bank) {
        return new BankSnapshot(bank,
                List.copyOf(units.values()),
                List.copyOf(documents.values()),
                List.copyOf(entities.values()),
                List.copyOf(entityLinks.values()),
                List.copyOf(links.values()));
    }

    // ==================== Read ====================

    @Override
    public String bankId() {
        return bankId;
    }

    @Override
    public Optional<MemoryUnit> findUnit(String unitId) {
        return Optional.ofNullable(units.get(unitId));
    }

    @Override
    public Collection<MemoryUnit> units() {
        return Collections.unmodifiableCollection(units.values());
    }

    @Override
    public Optional<Document> findDocument(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    @Override
    public Collection<Document> documents() {
        return Collections.unmodifiableCollection(documents.values());
    }

    @Override
    public Collection<Entity> entities() {
        return Collections.unmodifiableCollection(entities.values());
    }

    @Override
    public Optional<Entity> findEntity(String entityId) {
        return Optional.ofNullable(entities.get(entityId));
    }

    @Override
    public List<String> entityIdsOf(String unitId) {
        return List.copyOf(entitiesByUnit.getOrDefault(unitId, Set.of()));
    }

    @Override
    public List<String> unitIdsOf(String entityId) {
        return List.copyOf(unitsByEntity.getOrDefault(entityId, Set.of()));
    }

    @Override
    public List<MemoryLink> linksOf(String unitId) {
        Set<String> keys = linkKeysByUnit.getOrDefault(unitId, Set.of());
        List<MemoryLink> result = new ArrayList<>(keys.size());
        for (String key : keys) {
            result.add(links.get(key));
        }
        return result;
    }

    @Override
    public Collection<MemoryLink> links() {
        return Collections.unmodifiableCollection(links.values());
    }

    @Override
    public Collection<EntityLink> entityLinks() {
        return Collections.unmodifiableCollection(entityLinks.values());
    }

    @Override
    public List<MemoryUnit> unitsOfDocument(String documentId) {
        return units.values().stream()
                .filter(unit -> documentId.equals(unit.getDocumentId())
                        || unit.getDocumentIds().contains(documentId))
                .toList();
    }

    @Override
    public List<ScoredUnit> nearest(float[] query, int limit, double minSimilarity, Predicate<MemoryUnit> filter) {
        if (query == null || limit <= 0) {
            return List.of();
        }
        List<ScoredUnit> scored = new ArrayList<>();
        for (MemoryUnit unit : units.values()) {
            float[] embedding = unit.getEmbedding();
            if (embedding == null || embedding.length != query.length || !filter.test(unit)) {
                continue;
            }
            double similarity = EmbeddingPort.cosineSimilarity(query, embedding);
            if (similarity >= minSimilarity) {
                scored.add(new ScoredUnit(unit, similarity));
            }
        }
        scored.sort(BEST_FIRST);
        return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : scored;
    }

    @Override
    public List<ScoredUnit> fullText(String query, int limit, Predicate<MemoryUnit> filter) {
        Set<String> terms = Bm25Index.queryTerms(query);
        if (terms.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<ScoredUnit> scored = new ArrayList<>();
        for (MemoryUnit unit : units.values()) {
            if (!filter.test(unit)) {
                continue;
            }
            double score = textIndex.score(unit.getId(), terms);
            if (score > 0) {
                scored.add(new ScoredUnit(unit, score));
            }
        }
        scored.sort(BEST_FIRST);
        return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : scored;
    }

    // ==================== Write ====================

    @Override
    public void putUnit(MemoryUnit unit) {
        checkWritable();
        checkBank(unit.getBankId(), "unit");
        if (unit.getConfidence() < 0.0 || unit.getConfidence() > 1.0) {
            throw new IllegalArgumentException("Confidence out of [0, 1]: " + unit.getConfidence());
        }
        if (unit.getOccurredStart() != null && unit.getOccurredEnd() != null
                && unit.getOccurredStart().isAfter(unit.getOccurredEnd())) {
            throw new IllegalArgumentException("occurredStart is after occurredEnd for unit " + unit.getId());
        }
        float[] embedding = unit.getEmbedding();
        if (embedding != null) {
            if (dimension == null || units.isEmpty()) {
                dimension = embedding.length;
            } else if (dimension != embedding.length) {
                throw new IllegalArgumentException("Embedding dimension " + embedding.length
                        + " does not match bank dimension " + dimension);
            }
        }
        // The stored vector is owned by the bank, callers keep theirs
        MemoryUnit stored = embedding != null ? unit.toBuilder().embedding(embedding.clone()).build() : unit;
        MemoryUnit previous = units.put(stored.getId(), stored);
        if (previous == null || !previous.getText().equals(stored.getText())) {
            textIndex.add(stored.getId(), stored.getText());
        }
    }

    @Override
    public boolean deleteUnit(String unitId) {
        checkWritable();
        MemoryUnit removed = units.remove(unitId);
        if (removed == null) {
            return false;
        }
        textIndex.remove(unitId);

        Set<String> linkedEntities = entitiesByUnit.remove(unitId);
        if (linkedEntities != null) {
            for (String entityId : linkedEntities) {
                entityLinks.remove(entityLinkKey(unitId, entityId));
                Set<String> entityUnits = unitsByEntity.get(entityId);
                if (entityUnits != null) {
                    entityUnits.remove(unitId);
                    if (entityUnits.isEmpty()) {
                        // Entities exist only through the units that mention them
                        unitsByEntity.remove(entityId);
                        entities.remove(entityId);
                    }
                }
            }
        }

        Set<String> linkKeys = linkKeysByUnit.remove(unitId);
        if (linkKeys != null) {
            for (String key : linkKeys) {
                MemoryLink link = links.remove(key);
                if (link != null) {
                    Set<String> otherKeys = linkKeysByUnit.get(link.otherEnd(unitId));
                    if (otherKeys != null) {
                        otherKeys.remove(key);
                    }
                }
            }
        }
        return true;
    }

    @Override
    public void putDocument(Document document) {
        checkWritable();
        checkBank(document.getBankId(), "document");
        documents.put(document.getId(), document);
    }

    @Override
    public int deleteDocumentCascade(String documentId) {
        checkWritable();
        int deleted = 0;
        for (MemoryUnit unit : unitsOfDocument(documentId)) {
            MemoryUnit remaining = unit.withoutDocument(documentId);
            if (!remaining.hasProvenance()) {
                deleteUnit(unit.getId());
                deleted++;
            } else {
                putUnit(remaining);
            }
        }
        documents.remove(documentId);
        return deleted;
    }

    @Override
    public void putEntity(Entity entity) {
        checkWritable();
        checkBank(entity.getBankId(), "entity");
        entities.put(entity.getId(), entity);
    }

    @Override
    public void putEntityLink(EntityLink link) {
        checkWritable();
        checkBank(link.getBankId(), "entity link");
        if (!units.containsKey(link.getUnitId())) {
            throw new IllegalArgumentException("Unknown unit: " + link.getUnitId());
        }
        if (!entities.containsKey(link.getEntityId())) {
            throw new IllegalArgumentException("Unknown entity: " + link.getEntityId());
        }
        entityLinks.put(entityLinkKey(link.getUnitId(), link.getEntityId()), link);
        entitiesByUnit.computeIfAbsent(link.getUnitId(), k -> new LinkedHashSet<>()).add(link.getEntityId());
        unitsByEntity.computeIfAbsent(link.getEntityId(), k -> new LinkedHashSet<>()).add(link.getUnitId());
    }

    @Override
    public void putLink(MemoryLink link) {
        checkWritable();
        checkBank(link.getBankId(), "link");
        if (link.getFromUnitId().equals(link.getToUnitId())) {
            throw new IllegalArgumentException("Self link on unit " + link.getFromUnitId());
        }
        if (!units.containsKey(link.getFromUnitId()) || !units.containsKey(link.getToUnitId())) {
            throw new IllegalArgumentException("Link endpoints must be units of bank " + bankId);
        }
        String key = link.key();
        links.put(key, link);
        linkKeysByUnit.computeIfAbsent(link.getFromUnitId(), k -> new LinkedHashSet<>()).add(key);
        linkKeysByUnit.computeIfAbsent(link.getToUnitId(), k -> new LinkedHashSet<>()).add(key);
    }

    @Override
    public int clearUnits(FactType factType) {
        checkWritable();
        List<String> doomed = units.values().stream()
                .filter(unit -> factType == null || unit.getFactType() == factType)
                .map(MemoryUnit::getId)
                .toList();
        doomed.forEach(this::deleteUnit);

        Set<String> referenced = new LinkedHashSet<>();
        for (MemoryUnit unit : units.values()) {
            referenced.addAll(unit.getDocumentIds());
            if (unit.getDocumentId() != null) {
                referenced.add(unit.getDocumentId());
            }
        }
        documents.keySet().removeIf(id -> !referenced.contains(id));
        return doomed.size();
    }

    private void checkWritable() {
        if (frozen) {
            throw new IllegalStateException("Published snapshot of bank " + bankId + " is read-only");
        }
    }

    private void checkBank(String ownerBankId, String what) {
        if (!bankId.equals(ownerBankId)) {
            throw new IllegalArgumentException("Cannot store " + what + " of bank " + ownerBankId
                    + " in bank " + bankId);
        }
    }

    private static String entityLinkKey(String unitId, String entityId) {
        return unitId + "|" + entityId;
    }

    private static Map<String, Set<String>> deepCopy(Map<String, Set<String>> source) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        source.forEach((key, values) -> copy.put(key, new LinkedHashSet<>(values)));
        return copy;
    }
}
