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

import me.golemcore.hindsight.domain.model.LinkKind;
import me.golemcore.hindsight.domain.model.MemoryLink;
import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.BankReadView.ScoredUnit;
import me.golemcore.hindsight.port.outbound.MemoryTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Creates temporal-sequence and semantic-similarity links for a freshly
 * written unit.
 *
 * <p>
 * Temporal candidates are units whose occurrence lies within
 * {@code temporal-link-window-hours} of the new unit's, or that share a
 * document with it; the closest ones in time win. Links point from the earlier
 * unit to the later one and weigh {@code 1 / (1 + gap / window)}.
 *
 * <p>
 * Semantic candidates are units at or above {@code semantic-link-threshold}
 * that were not dedup targets; the link weight is the cosine similarity.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FactLinker {

    private final HindsightProperties properties;

    /**
     * Links the unit to the previous fact of the same item, then to temporal
     * and semantic neighbours.
     *
     * @return number of links written
     */
    public int link(MemoryTransaction tx, MemoryUnit unit, MemoryUnit predecessor) {
        int written = 0;
        if (predecessor != null && !predecessor.getId().equals(unit.getId())) {
            tx.putLink(sequenceLink(tx.bankId(), predecessor, unit, 1.0));
            written++;
        }
        written += linkTemporal(tx, unit, predecessor);
        written += linkSemantic(tx, unit);
        return written;
    }

    /**
     * Links two consecutive facts of one item without searching for
     * neighbours.
     */
    public void linkSequence(MemoryTransaction tx, MemoryUnit predecessor, MemoryUnit unit) {
        if (predecessor != null && !predecessor.getId().equals(unit.getId())) {
            tx.putLink(sequenceLink(tx.bankId(), predecessor, unit, 1.0));
        }
    }

    private int linkTemporal(MemoryTransaction tx, MemoryUnit unit, MemoryUnit predecessor) {
        HindsightProperties.RetainProperties retain = properties.getRetain();
        int budget = retain.getMaxTemporalLinks() - (predecessor != null ? 1 : 0);
        if (budget <= 0) {
            return 0;
        }
        Duration window = Duration.ofHours(Math.max(1, retain.getTemporalLinkWindowHours()));
        Instant anchor = anchorOf(unit);

        List<Candidate> candidates = new ArrayList<>();
        for (MemoryUnit other : tx.units()) {
            if (other.getId().equals(unit.getId())
                    || (predecessor != null && other.getId().equals(predecessor.getId()))) {
                continue;
            }
            boolean sharedDocument = !Collections.disjoint(unit.getDocumentIds(), other.getDocumentIds());
            boolean nearInTime = unit.hasOccurrence() && other.hasOccurrence()
                    && gapBetweenOccurrences(unit, other).compareTo(window) <= 0;
            if (sharedDocument || nearInTime) {
                Duration gap = unit.hasOccurrence() && other.hasOccurrence()
                        ? gapBetweenOccurrences(unit, other)
                        : Duration.between(anchor, anchorOf(other)).abs();
                candidates.add(new Candidate(other, gap));
            }
        }
        candidates.sort(Comparator.comparing(Candidate::gap).thenComparing(c -> c.unit().getId()));

        int written = 0;
        for (Candidate candidate : candidates) {
            if (written >= budget) {
                break;
            }
            double weight = 1.0 / (1.0 + (double) candidate.gap().toMillis() / window.toMillis());
            MemoryUnit other = candidate.unit();
            boolean otherFirst = anchorOf(other).isBefore(anchor)
                    || (anchorOf(other).equals(anchor) && other.getId().compareTo(unit.getId()) < 0);
            tx.putLink(otherFirst
                    ? sequenceLink(tx.bankId(), other, unit, weight)
                    : sequenceLink(tx.bankId(), unit, other, weight));
            written++;
        }
        return written;
    }

    private int linkSemantic(MemoryTransaction tx, MemoryUnit unit) {
        HindsightProperties.RetainProperties retain = properties.getRetain();
        if (unit.getEmbedding() == null || retain.getMaxSemanticLinks() <= 0) {
            return 0;
        }
        List<ScoredUnit> neighbours = tx.nearest(unit.getEmbedding(), retain.getMaxSemanticLinks() * 2 + 1,
                retain.getSemanticLinkThreshold(), other -> !other.getId().equals(unit.getId()));
        int written = 0;
        for (ScoredUnit neighbour : neighbours) {
            if (written >= retain.getMaxSemanticLinks()) {
                break;
            }
            boolean wouldHaveMerged = neighbour.score() >= retain.getDedupThreshold()
                    && neighbour.unit().getFactType() == unit.getFactType();
            if (wouldHaveMerged) {
                continue;
            }
            tx.putLink(MemoryLink.builder()
                    .bankId(tx.bankId())
                    .fromUnitId(unit.getId())
                    .toUnitId(neighbour.unit().getId())
                    .kind(LinkKind.SEMANTIC_SIMILARITY)
                    .weight(Math.min(1.0, neighbour.score()))
                    .build());
            written++;
        }
        return written;
    }

    /**
     * Zero when the occurrence spans overlap, otherwise the distance between
     * their closest ends.
     */
    static Duration gapBetweenOccurrences(MemoryUnit a, MemoryUnit b) {
        Instant aStart = a.getOccurredStart() != null ? a.getOccurredStart() : a.getOccurredEnd();
        Instant aEnd = a.getOccurredEnd() != null ? a.getOccurredEnd() : a.getOccurredStart();
        Instant bStart = b.getOccurredStart() != null ? b.getOccurredStart() : b.getOccurredEnd();
        Instant bEnd = b.getOccurredEnd() != null ? b.getOccurredEnd() : b.getOccurredStart();
        if (aEnd.isBefore(bStart)) {
            return Duration.between(aEnd, bStart);
        }
        if (bEnd.isBefore(aStart)) {
            return Duration.between(bEnd, aStart);
        }
        return Duration.ZERO;
    }

    private static Instant anchorOf(MemoryUnit unit) {
        if (unit.getOccurredStart() != null) {
            return unit.getOccurredStart();
        }
        if (unit.getOccurredEnd() != null) {
            return unit.getOccurredEnd();
        }
        return unit.getMentionedAt() != null ? unit.getMentionedAt() : Instant.EPOCH;
    }

    private static MemoryLink sequenceLink(String bankId, MemoryUnit from, MemoryUnit to, double weight) {
        return MemoryLink.builder()
                .bankId(bankId)
                .fromUnitId(from.getId())
                .toUnitId(to.getId())
                .kind(LinkKind.TEMPORAL_SEQUENCE)
                .weight(weight)
                .build();
    }

    private record Candidate(MemoryUnit unit, Duration gap) {
    }
}
