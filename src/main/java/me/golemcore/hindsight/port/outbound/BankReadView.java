package me.golemcore.hindsight.port.outbound;

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

import me.golemcore.hindsight.domain.model.Document;
import me.golemcore.hindsight.domain.model.Entity;
import me.golemcore.hindsight.domain.model.EntityLink;
import me.golemcore.hindsight.domain.model.MemoryLink;
import me.golemcore.hindsight.domain.model.MemoryUnit;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Read access to the data of exactly one bank. A view obtained outside a
 * transaction is a consistent snapshot that later commits do not change.
 */
public interface BankReadView {

    String bankId();

    Optional<MemoryUnit> findUnit(String unitId);

    Collection<MemoryUnit> units();

    Optional<Document> findDocument(String documentId);

    Collection<Document> documents();

    Collection<Entity> entities();

    Optional<Entity> findEntity(String entityId);

    /**
     * Entity ids linked to a unit.
     */
    List<String> entityIdsOf(String unitId);

    /**
     * Unit ids linked to an entity.
     */
    List<String> unitIdsOf(String entityId);

    /**
     * Temporal and semantic links touching a unit, in either direction.
     */
    List<MemoryLink> linksOf(String unitId);

    Collection<MemoryLink> links();

    Collection<EntityLink> entityLinks();

    /**
     * Units derived from a document (origin or provenance).
     */
    List<MemoryUnit> unitsOfDocument(String documentId);

    /**
     * Nearest neighbours by cosine similarity, best first, ties broken by id.
     */
    List<ScoredUnit> nearest(float[] query, int limit, double minSimilarity, Predicate<MemoryUnit> filter);

    /**
     * BM25-ranked full-text search over unit text, best first, ties broken by
     * id.
     */
    List<ScoredUnit> fullText(String query, int limit, Predicate<MemoryUnit> filter);

    record ScoredUnit(MemoryUnit unit, double score) {
    }
}
