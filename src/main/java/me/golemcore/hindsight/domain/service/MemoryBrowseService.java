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

import me.golemcore.hindsight.domain.exception.NotFoundException;
import me.golemcore.hindsight.domain.exception.ValidationException;
import me.golemcore.hindsight.domain.model.BankStats;
import me.golemcore.hindsight.domain.model.FactType;
import me.golemcore.hindsight.domain.model.GraphSnapshot;
import me.golemcore.hindsight.domain.model.LinkKind;
import me.golemcore.hindsight.domain.model.MemoryLink;
import me.golemcore.hindsight.domain.model.MemoryPage;
import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.domain.model.OperationState;
import me.golemcore.hindsight.port.outbound.BankReadView;
import me.golemcore.hindsight.port.outbound.MemoryRepositoryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Read and maintenance operations over the memory units of a bank: paging,
 * deletion, graph export and statistics.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryBrowseService {

    public static final int DEFAULT_LIMIT = 100;

    static final Comparator<MemoryUnit> NEWEST_FIRST = Comparator
            .comparing(MemoryUnit::getMentionedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(MemoryUnit::getId);

    private final BankService bankService;
    private final MemoryRepositoryPort repository;
    private final BankWriteCoordinator writeCoordinator;
    private final RetainTaskQueue taskQueue;

    /**
     * Units of the bank, newest first.
     *
     * @param factType
     *            only this type, or every type when null
     * @param textFilter
     *            case-insensitive substring filter, ignored when blank
     */
    public MemoryPage<MemoryUnit> listMemories(String bankId, FactType factType, String textFilter, Integer limit,
            Integer offset) {
        bankService.requireExisting(bankId);
        int pageLimit = pageLimit(limit);
        int pageOffset = pageOffset(offset);
        String needle = textFilter != null && !textFilter.isBlank()
                ? textFilter.trim().toLowerCase(Locale.ROOT)
                : null;

        List<MemoryUnit> matching = repository.snapshot(bankId).units().stream()
                .filter(unit -> factType == null || unit.getFactType() == factType)
                .filter(unit -> needle == null || unit.getText().toLowerCase(Locale.ROOT).contains(needle))
                .sorted(NEWEST_FIRST)
                .toList();
        return new MemoryPage<>(page(matching, pageLimit, pageOffset), matching.size(), pageLimit, pageOffset);
    }

    public MemoryUnit getMemoryUnit(String bankId, String unitId) {
        bankService.requireExisting(bankId);
        return repository.snapshot(bankId).findUnit(unitId)
                .orElseThrow(() -> new NotFoundException("Memory unit not found: " + unitId));
    }

    /**
     * Removes a unit together with its temporal, semantic and entity links.
     */
    public void deleteMemoryUnit(String bankId, String unitId) {
        bankService.requireExisting(bankId);
        boolean deleted = writeCoordinator.write(bankId, "delete unit", tx -> tx.deleteUnit(unitId));
        if (!deleted) {
            throw new NotFoundException("Memory unit not found: " + unitId);
        }
        log.info("[Repository] Deleted unit {} from bank {}", unitId, bankId);
    }

    /**
     * Deletes every unit, or only units of {@code factType}, with their links
     * and the documents left without units. The bank profile is kept.
     *
     * @return number of units deleted
     */
    public int clearMemories(String bankId, FactType factType) {
        bankService.requireExisting(bankId);
        int deleted = writeCoordinator.write(bankId, "clear units", tx -> tx.clearUnits(factType));
        log.info("[Repository] Cleared {} {} unit(s) from bank {}", deleted,
                factType != null ? factType.getValue() : "memory", bankId);
        return deleted;
    }

    /**
     * Newest {@code limit} units as nodes with their entities, memory links
     * between included units and unit-to-entity edges.
     */
    public GraphSnapshot graph(String bankId, Integer limit) {
        bankService.requireExisting(bankId);
        BankReadView view = repository.snapshot(bankId);
        List<MemoryUnit> units = view.units().stream()
                .sorted(NEWEST_FIRST)
                .limit(pageLimit(limit))
                .toList();

        List<GraphSnapshot.Node> nodes = new ArrayList<>();
        List<GraphSnapshot.Edge> edges = new ArrayList<>();
        Set<String> included = new HashSet<>();
        for (MemoryUnit unit : units) {
            included.add(unit.getId());
            nodes.add(new GraphSnapshot.Node(unit.getId(), TextSupport.truncate(unit.getText(), 120),
                    unit.getFactType().getValue()));
        }

        Set<String> linkKeys = new HashSet<>();
        for (MemoryUnit unit : units) {
            for (MemoryLink link : view.linksOf(unit.getId())) {
                if (included.contains(link.getFromUnitId()) && included.contains(link.getToUnitId())
                        && linkKeys.add(link.key())) {
                    edges.add(new GraphSnapshot.Edge(link.getFromUnitId(), link.getToUnitId(),
                            link.getKind().getValue(), link.getWeight()));
                }
            }
        }

        Set<String> entityNodes = new HashSet<>();
        for (MemoryUnit unit : units) {
            for (String entityId : view.entityIdsOf(unit.getId())) {
                view.findEntity(entityId).ifPresent(entity -> {
                    if (entityNodes.add(entity.getId())) {
                        nodes.add(new GraphSnapshot.Node(entity.getId(), entity.getName(), "entity"));
                    }
                    edges.add(new GraphSnapshot.Edge(unit.getId(), entity.getId(), "entity", 1.0));
                });
            }
        }
        return new GraphSnapshot(List.copyOf(nodes), List.copyOf(edges));
    }

    public BankStats stats(String bankId) {
        bankService.requireExisting(bankId);
        BankReadView view = repository.snapshot(bankId);

        Map<FactType, Integer> unitsByType = new EnumMap<>(FactType.class);
        for (FactType type : FactType.values()) {
            unitsByType.put(type, 0);
        }
        view.units().forEach(unit -> unitsByType.merge(unit.getFactType(), 1, Integer::sum));

        Map<LinkKind, Integer> linksByKind = new EnumMap<>(LinkKind.class);
        for (LinkKind kind : LinkKind.values()) {
            linksByKind.put(kind, 0);
        }
        view.links().forEach(link -> linksByKind.merge(link.getKind(), 1, Integer::sum));

        return BankStats.builder()
                .bankId(bankId)
                .totalUnits(view.units().size())
                .unitsByFactType(unitsByType)
                .linksByKind(linksByKind)
                .entities(view.entities().size())
                .entityLinks(view.entityLinks().size())
                .documents(view.documents().size())
                .pendingOperations(taskQueue.countInState(bankId, OperationState.PENDING)
                        + taskQueue.countInState(bankId, OperationState.PROCESSING))
                .failedOperations(taskQueue.countInState(bankId, OperationState.FAILED))
                .build();
    }

    static int pageLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        if (limit <= 0) {
            throw new ValidationException("limit must be positive");
        }
        return limit;
    }

    static int pageOffset(Integer offset) {
        if (offset == null) {
            return 0;
        }
        if (offset < 0) {
            throw new ValidationException("offset must not be negative");
        }
        return offset;
    }

    static <T> List<T> page(List<T> items, int limit, int offset) {
        if (offset >= items.size()) {
            return List.of();
        }
        return List.copyOf(items.subList(offset, Math.min(items.size(), offset + limit)));
    }
}
