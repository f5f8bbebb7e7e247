package me.golemcore.hindsight.domain.entity;

import me.golemcore.hindsight.adapter.outbound.repository.BankSnapshotStore;
import me.golemcore.hindsight.adapter.outbound.repository.InMemoryMemoryRepository;
import me.golemcore.hindsight.domain.model.Entity;
import me.golemcore.hindsight.domain.model.EntityMention;
import me.golemcore.hindsight.domain.model.FactType;
import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.infrastructure.config.AutoConfiguration;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.BankReadView;
import me.golemcore.hindsight.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class EntityResolutionServiceTest {

    private static final String BANK = "bank";

    private InMemoryMemoryRepository repository;
    private EntityResolutionService service;

    @BeforeEach
    void setUp() {
        HindsightProperties properties = new HindsightProperties();
        repository = new InMemoryMemoryRepository(
                new BankSnapshotStore(mock(StoragePort.class), AutoConfiguration.objectMapper(), properties));
        service = new EntityResolutionService(new CanonicalNameResolutionStrategy(properties),
                Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldReuseEntityAcrossUnitsAndVariants() {
        List<String> first = link("u1", "Alice met Bob", EntityMention.of("Alice", "person"),
                EntityMention.of("Bob", "person"));
        List<String> second = link("u2", "alice went home", EntityMention.of("ALICE", "person"));

        BankReadView view = repository.snapshot(BANK);
        assertEquals(2, view.entities().size());
        assertEquals(first.get(0), second.get(0));
        assertEquals(List.of("u1", "u2"), view.unitIdsOf(first.get(0)));
    }

    @Test
    void shouldLinkUnitOnceWhenMentionRepeats() {
        List<String> linked = link("u1", "Alice and alice", EntityMention.of("Alice", "person"),
                EntityMention.of("alice", "person"));

        assertEquals(1, linked.size());
        assertEquals(1, repository.snapshot(BANK).entityLinks().size());
    }

    @Test
    void shouldIgnoreBlankMentionsAndDefaultMissingType() {
        List<String> linked = link("u1", "Something about Paris", EntityMention.of("  ", "place"),
                EntityMention.of("Paris", null));

        assertEquals(1, linked.size());
        Entity paris = repository.snapshot(BANK).findEntity(linked.get(0)).orElseThrow();
        assertEquals("other", paris.getType());
        assertEquals("paris", paris.getCanonicalName());
        assertEquals(Instant.parse("2024-06-15T12:00:00Z"), paris.getCreatedAt());
    }

    @Test
    void shouldFindEntitiesNamedInQueryLongestFirst() {
        link("u1", "Mary Jane met Mary", EntityMention.of("Mary Jane", "person"), EntityMention.of("Mary", "person"));

        List<Entity> found = service.entitiesInQuery(repository.snapshot(BANK), "What did Mary Jane say?");

        assertEquals(List.of("Mary Jane", "Mary"), found.stream().map(Entity::getName).toList());
        assertTrue(service.entitiesInQuery(repository.snapshot(BANK), "Maryland weather").isEmpty());
    }

    private List<String> link(String unitId, String text, EntityMention... mentions) {
        MemoryUnit unit = MemoryUnit.builder()
                .id(unitId)
                .bankId(BANK)
                .text(text)
                .factType(FactType.WORLD)
                .confidence(0.8)
                .build();
        return repository.inTransaction(BANK, tx -> {
            tx.putUnit(unit);
            return service.linkMentions(tx, unit, List.of(mentions));
        });
    }
}
