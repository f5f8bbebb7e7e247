package me.golemcore.hindsight.domain.model;

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

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Atomic stored fact or opinion.
 *
 * <p>
 * Units are immutable. The only field that changes after creation is
 * {@code confidence}, which a dedup merge replaces by storing a rebuilt copy
 * (see {@link #withMerge(double, String)}).
 *
 * <p>
 * {@code documentId} is the document that first produced the unit;
 * {@code documentIds} lists every document that has asserted it since.
 * {@code undocumented} is set once the unit has been asserted without any
 * document, so removing its documents never removes the unit itself.
 *
 * <p>
 * {@code embedding} is shared with every reader of a published bank state and
 * must be treated as read-only.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MemoryUnit {

    String id;
    String bankId;
    String text;
    FactType factType;
    double confidence;
    float[] embedding;
    Instant occurredStart;
    Instant occurredEnd;
    Instant mentionedAt;
    String context;
    String documentId;

    @Builder.Default
    List<String> documentIds = List.of();

    boolean undocumented;

    /**
     * Returns a copy with the given confidence and, when present, one more
     * provenance document.
     */
    public MemoryUnit withMerge(double mergedConfidence, String provenanceDocumentId) {
        List<String> provenance = documentIds;
        if (provenanceDocumentId != null && !documentIds.contains(provenanceDocumentId)) {
            provenance = new ArrayList<>(documentIds);
            provenance.add(provenanceDocumentId);
            provenance = List.copyOf(provenance);
        }
        return toBuilder()
                .confidence(mergedConfidence)
                .documentIds(provenance)
                .undocumented(undocumented || provenanceDocumentId == null)
                .build();
    }

    /**
     * Returns a copy without the given provenance document.
     */
    public MemoryUnit withoutDocument(String removedDocumentId) {
        List<String> remaining = documentIds.stream()
                .filter(id -> !id.equals(removedDocumentId))
                .toList();
        String origin = documentId;
        if (removedDocumentId.equals(origin)) {
            origin = remaining.isEmpty() ? null : remaining.get(0);
        }
        return toBuilder()
                .documentId(origin)
                .documentIds(remaining)
                .build();
    }

    /**
     * Whether a document, or a retain without one, still asserts this unit.
     */
    public boolean hasProvenance() {
        return !documentIds.isEmpty() || undocumented;
    }

    public boolean hasOccurrence() {
        return occurredStart != null || occurredEnd != null;
    }
}
