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
import me.golemcore.hindsight.domain.model.FactType;
import me.golemcore.hindsight.domain.model.MemoryLink;
import me.golemcore.hindsight.domain.model.MemoryUnit;

/**
 * Mutable working copy of one bank. Reads see the transaction's own writes.
 * Nothing is visible to other readers until the enclosing
 * {@link MemoryRepositoryPort#inTransaction} returns normally.
 */
public interface MemoryTransaction extends BankReadView {

    void putUnit(MemoryUnit unit);

    /**
     * Removes the unit with its entity links and temporal/semantic links.
     *
     * @return whether the unit existed
     */
    boolean deleteUnit(String unitId);

    void putDocument(Document document);

    /**
     * Removes the document and every unit whose provenance becomes empty, with
     * their links. Units also asserted by other documents lose only this
     * provenance entry.
     *
     * @return number of units deleted
     */
    int deleteDocumentCascade(String documentId);

    void putEntity(Entity entity);

    void putEntityLink(EntityLink link);

    void putLink(MemoryLink link);

    /**
     * Deletes every unit (or every unit of one type when {@code factType} is
     * not null) and documents left without units.
     *
     * @return number of units deleted
     */
    int clearUnits(FactType factType);
}
