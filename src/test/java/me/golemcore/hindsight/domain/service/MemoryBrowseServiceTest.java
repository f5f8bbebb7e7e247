package me.golemcore.hindsight.domain.service;

import me.golemcore.hindsight.domain.exception.NotFoundException;
import me.golemcore.hindsight.domain.exception.ValidationException;
import me.golemcore.hindsight.domain.model.BankStats;
import me.golemcore.hindsight.domain.model.FactType;
import me.golemcore.hindsight.domain.model.GraphSnapshot;
import me.golemcore.hindsight.domain.model.LinkKind;
import me.golemcore.hindsight.domain.model.MemoryPage;
import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.domain.model.RetainItem;
import me.golemcore.hindsight.testsupport.MemoryEngineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MemoryBrowseServiceTest {

    private static final String BANK = "agent-1";

    private MemoryEngineFixture engine;
    private MemoryBrowseService browseService;

    @BeforeEach
    void setUp() {
        engine = new MemoryEngineFixture();
        browseService = engine.browseService;
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        engine.close();
    }

    // ===== Listing =====

    @Test
    void shouldListNewestFirst() {
        retainHourly("Alice works at Google.", "Bob plays tennis.", "I love bread.");

        MemoryPage<MemoryUnit> page = browseService.listMemories(BANK, null, null, null, null);

        assertEquals(List.of("I love bread.", "Bob plays tennis.", "Alice works at Google."), texts(page));
        assertEquals(3, page.total());
        assertEquals(MemoryBrowseService.DEFAULT_LIMIT, page.limit());
    }

    @Test
    void shouldPageThroughUnits() {
        retainHourly("Alice works at Google.", "Bob plays tennis.", "I love bread.");

        assertEquals(List.of("Bob plays tennis.", "Alice works at Google."),
                texts(browseService.listMemories(BANK, null, null, 2, 1)));
        MemoryPage<MemoryUnit> beyond = browseService.listMemories(BANK, null, null, 2, 5);
        assertTrue(beyond.items().isEmpty());
        assertEquals(3, beyond.total());
    }

    @Test
    void shouldFilterByTypeAndText() {
        retainHourly("Alice works at Google.", "Bob plays tennis.", "I love bread.");

        assertEquals(List.of("I love bread."), texts(browseService.listMemories(BANK, FactType.AGENT, null, null,
                null)));
        assertEquals(List.of("Bob plays tennis."), texts(browseService.listMemories(BANK, null, "TENNIS", null,
                null)));
        assertTrue(browseService.listMemories(BANK, FactType.OPINION, null, null, null).items().isEmpty());
    }

    @Test
    void shouldRejectInvalidPaging() {
        retainHourly("Bob plays tennis.");

        assertThrows(ValidationException.class, () -> browseService.listMemories(BANK, null, null, 0, null));
        assertThrows(ValidationException.class, () -> browseService.listMemories(BANK, null, null, null, -1));
    }

    @Test
    void shouldNotProvisionBankWhenBrowsing() {
        assertThrows(NotFoundException.class, () -> browseService.listMemories("unknown", null, null, null, null));
        assertTrue(engine.repository.findBank("unknown").isEmpty());
    }

    // ===== Deletion =====

    @Test
    void shouldDeleteUnitWithItsEntities() {
        retainHourly("Alice works at Google.", "Bob plays tennis.");
        MemoryUnit alice = unitWithText("Alice works at Google.");

        browseService.deleteMemoryUnit(BANK, alice.getId());

        assertThrows(NotFoundException.class, () -> browseService.getMemoryUnit(BANK, alice.getId()));
        BankStats stats = browseService.stats(BANK);
        assertEquals(1, stats.getTotalUnits());
        assertEquals(1, stats.getEntities());
    }

    @Test
    void shouldRejectDeletingUnknownUnit() {
        retainHourly("Bob plays tennis.");

        assertThrows(NotFoundException.class, () -> browseService.deleteMemoryUnit(BANK, "missing"));
    }

    @Test
    void shouldClearOnlyRequestedFactType() {
        retainHourly("Alice works at Google.", "I love bread.", "I bake on Sundays.");

        assertEquals(2, browseService.clearMemories(BANK, FactType.AGENT));

        assertEquals(List.of("Alice works at Google."), texts(browseService.listMemories(BANK, null, null, null,
                null)));
        assertEquals(1, browseService.clearMemories(BANK, null));
        assertTrue(engine.repository.findBank(BANK).isPresent());
    }

    // ===== Graph and stats =====

    @Test
    void shouldExportUnitsEntitiesAndLinks() {
        engine.retainService.retain(BANK, RetainItem.of("Alice met Bob. Alice laughed."));

        GraphSnapshot graph = browseService.graph(BANK, null);

        assertEquals(2, graph.nodes().stream().filter(node -> "world".equals(node.group())).count());
        assertEquals(List.of("Alice", "Bob"), graph.nodes().stream()
                .filter(node -> "entity".equals(node.group()))
                .map(GraphSnapshot.Node::label)
                .sorted()
                .toList());
        assertEquals(1, graph.edges().stream().filter(edge -> "temporal-sequence".equals(edge.kind())).count());
        assertEquals(3, graph.edges().stream().filter(edge -> "entity".equals(edge.kind())).count());
    }

    @Test
    void shouldLimitGraphToNewestUnits() {
        retainHourly("Alice works at Google.", "Bob plays tennis.");

        GraphSnapshot graph = browseService.graph(BANK, 1);

        List<GraphSnapshot.Node> units = graph.nodes().stream().filter(node -> "world".equals(node.group())).toList();
        assertEquals(1, units.size());
        assertEquals("Bob plays tennis.", units.get(0).label());
        assertTrue(graph.edges().stream().noneMatch(edge -> "temporal-sequence".equals(edge.kind())));
    }

    @Test
    void shouldCountUnitsLinksAndEntities() {
        engine.retainService.retain(BANK, RetainItem.of("Alice met Bob. Alice laughed."));
        engine.retainService.retain(BANK, RetainItem.builder().documentId("diary").content("I love bread.").build());

        BankStats stats = browseService.stats(BANK);

        assertEquals(BANK, stats.getBankId());
        assertEquals(3, stats.getTotalUnits());
        assertEquals(2, stats.getUnitsByFactType().get(FactType.WORLD));
        assertEquals(1, stats.getUnitsByFactType().get(FactType.AGENT));
        assertEquals(0, stats.getUnitsByFactType().get(FactType.OPINION));
        assertEquals(1, stats.getLinksByKind().get(LinkKind.TEMPORAL_SEQUENCE));
        assertEquals(2, stats.getEntities());
        assertEquals(3, stats.getEntityLinks());
        assertEquals(1, stats.getDocuments());
        assertEquals(0, stats.getPendingOperations());
    }

    private void retainHourly(String... contents) {
        for (String content : contents) {
            engine.retainService.retain(BANK, RetainItem.of(content));
            engine.clock.advance(Duration.ofHours(1));
        }
    }

    private MemoryUnit unitWithText(String text) {
        return engine.repository.snapshot(BANK).units().stream()
                .filter(unit -> text.equals(unit.getText()))
                .findFirst()
                .orElseThrow();
    }

    private static List<String> texts(MemoryPage<MemoryUnit> page) {
        return page.items().stream().map(MemoryUnit::getText).toList();
    }
}
