package me.golemcore.hindsight.domain.service;

import me.golemcore.hindsight.adapter.outbound.temporal.RuleBasedTemporalParser;
import me.golemcore.hindsight.domain.exception.ErrorKind;
import me.golemcore.hindsight.domain.exception.MemoryEngineException;
import me.golemcore.hindsight.domain.exception.ValidationException;
import me.golemcore.hindsight.domain.model.Bank;
import me.golemcore.hindsight.domain.model.FactType;
import me.golemcore.hindsight.domain.model.RecallQuery;
import me.golemcore.hindsight.domain.model.RecallStrategyType;
import me.golemcore.hindsight.domain.model.RetainItem;
import me.golemcore.hindsight.domain.model.ScoredMemory;
import me.golemcore.hindsight.domain.recall.RecallStrategy;
import me.golemcore.hindsight.domain.recall.SemanticRecallStrategy;
import me.golemcore.hindsight.domain.recall.TemporalRecallStrategy;
import me.golemcore.hindsight.testsupport.MemoryEngineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RecallServiceTest {

    private static final String BANK = "agent-1";

    private MemoryEngineFixture engine;
    private RecallService recallService;

    @BeforeEach
    void setUp() {
        engine = new MemoryEngineFixture();
        recallService = engine.recallService;
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        engine.close();
    }

    // ===== Ranking =====

    @Test
    void shouldRankMostRelevantFactFirst() {
        engine.retainService.retain(BANK, RetainItem.of("Alice works at Google."));
        engine.retainService.retain(BANK, RetainItem.of("Bob plays tennis with friends."));
        engine.retainService.retain(BANK, RetainItem.of("Carol bakes bread."));

        List<ScoredMemory> results = recallService.execute(query("Who plays tennis?"));

        assertFalse(results.isEmpty());
        ScoredMemory top = results.get(0);
        assertEquals("Bob plays tennis with friends.", top.getUnit().getText());
        assertNotNull(top.getRerankScore());
        assertTrue(top.getStrategyRanks().containsKey(RecallStrategyType.SEMANTIC));
        assertTrue(top.getStrategyRanks().containsKey(RecallStrategyType.LEXICAL));
        for (int i = 1; i < results.size(); i++) {
            assertTrue(results.get(i - 1).getWeight() >= results.get(i).getWeight());
        }
    }

    @Test
    void shouldReturnSameRankingForSameSnapshot() {
        engine.retainService.retain(BANK, RetainItem.of("Bob plays tennis with friends."));
        engine.retainService.retain(BANK, RetainItem.of("Bob coaches tennis juniors."));
        engine.retainService.retain(BANK, RetainItem.of("Carol bakes bread."));

        List<ScoredMemory> first = recallService.execute(query("tennis"));
        List<ScoredMemory> second = recallService.execute(query("tennis"));

        assertEquals(ids(first), ids(second));
        assertEquals(first.stream().map(ScoredMemory::getWeight).toList(),
                second.stream().map(ScoredMemory::getWeight).toList());
    }

    @Test
    void shouldAdmitOnlyRequestedFactTypes() {
        engine.retainService.retain(BANK, RetainItem.of("I love tennis."));
        engine.retainService.retain(BANK, RetainItem.of("Bob plays tennis with friends."));

        List<ScoredMemory> results = recallService.execute(query("tennis").toBuilder()
                .factTypes(EnumSet.of(FactType.AGENT))
                .build());

        assertEquals(List.of("I love tennis."), texts(results));
    }

    @Test
    void shouldNotWriteToBank() {
        engine.retainService.retain(BANK, RetainItem.of("Bob plays tennis with friends."));
        int before = engine.repository.snapshot(BANK).units().size();

        recallService.execute(query("tennis"));

        assertEquals(before, engine.repository.snapshot(BANK).units().size());
    }

    // ===== Time filter =====

    @Test
    void shouldFilterByTimeDetectedInQuery() {
        retainAt("Alice visited Paris.", "2024-03-10T10:00:00Z");
        retainAt("Alice visited Rome.", "2023-03-10T10:00:00Z");
        engine.retainService.retain(BANK, RetainItem.of("Alice likes trains."));

        List<ScoredMemory> results = recallService.execute(query("Where did Alice travel in March 2024?"));

        assertEquals(List.of("Alice visited Paris."), texts(results));
        assertTrue(results.get(0).getStrategyRanks().containsKey(RecallStrategyType.TEMPORAL));
    }

    @Test
    void shouldApplyExplicitTimeExpression() {
        retainAt("Alice visited Paris.", "2024-03-10T10:00:00Z");
        retainAt("Alice visited Rome.", "2023-03-10T10:00:00Z");

        List<ScoredMemory> results = recallService.execute(query("Alice visited").toBuilder()
                .timeExpression("2023")
                .build());

        assertEquals(List.of("Alice visited Rome."), texts(results));
    }

    @Test
    void shouldIgnoreUnresolvedTimeExpression() {
        retainAt("Alice visited Paris.", "2024-03-10T10:00:00Z");
        retainAt("Alice visited Rome.", "2023-03-10T10:00:00Z");

        List<ScoredMemory> results = recallService.execute(query("Alice visited").toBuilder()
                .timeExpression("someday soon")
                .build());

        assertEquals(2, results.size());
    }

    // ===== Budgets =====

    @Test
    void shouldCapResultCount() {
        for (String sport : List.of("tennis", "squash", "padel", "badminton")) {
            engine.retainService.retain(BANK, RetainItem.of("Bob plays " + sport + " with friends."));
        }

        List<ScoredMemory> results = recallService.execute(query("Bob plays").toBuilder().maxResults(2).build());

        assertEquals(2, results.size());
    }

    @Test
    void shouldStopAtTokenBudget() {
        engine.retainService.retain(BANK, RetainItem.of("Bob plays tennis with friends."));
        engine.retainService.retain(BANK, RetainItem.of("Bob plays squash with colleagues."));
        List<ScoredMemory> unlimited = recallService.execute(query("Bob plays"));
        assertEquals(2, unlimited.size());
        int firstCost = TextSupport.estimateTokens(unlimited.get(0).getUnit().getText());

        List<ScoredMemory> limited = recallService.execute(query("Bob plays").toBuilder()
                .maxTokens(firstCost)
                .build());

        assertEquals(ids(unlimited.subList(0, 1)), ids(limited));
    }

    // ===== Capability failures =====

    @Test
    void shouldFallBackToFusedScoreWhenRerankFails() {
        engine.retainService.retain(BANK, RetainItem.of("Bob plays tennis with friends."));
        engine.retainService.retain(BANK, RetainItem.of("Carol bakes bread."));
        engine.reranker.setFailing(true);

        List<ScoredMemory> results = recallService.execute(query("tennis"));

        assertFalse(results.isEmpty());
        assertEquals("Bob plays tennis with friends.", results.get(0).getUnit().getText());
        assertTrue(results.stream().allMatch(result -> result.getRerankScore() == null));
    }

    @Test
    void shouldFailWhenRerankFailsAndFallbackDisabled() {
        engine.retainService.retain(BANK, RetainItem.of("Bob plays tennis with friends."));
        engine.properties.getRecall().setRerankFallbackEnabled(false);
        engine.reranker.setFailing(true);

        MemoryEngineException error = assertThrows(MemoryEngineException.class,
                () -> recallService.execute(query("tennis")));

        assertEquals(ErrorKind.RERANK_FAILURE, error.getKind());
    }

    @Test
    void shouldFailWhenQueryCannotBeEmbedded() {
        engine.retainService.retain(BANK, RetainItem.of("Bob plays tennis with friends."));
        engine.embedding.setFailing(true);

        MemoryEngineException error = assertThrows(MemoryEngineException.class,
                () -> recallService.execute(query("tennis")));

        assertEquals(ErrorKind.EMBEDDING_FAILURE, error.getKind());
    }

    // ===== Validation and banks =====

    @Test
    void shouldRejectInvalidQueries() {
        assertThrows(ValidationException.class, () -> recallService.execute(query(" ")));
        assertThrows(ValidationException.class,
                () -> recallService.execute(query("tennis").toBuilder().maxResults(0).build()));
        assertThrows(ValidationException.class,
                () -> recallService.execute(query("tennis").toBuilder().maxTokens(-1).build()));
        assertThrows(ValidationException.class, () -> recallService.execute(null));
    }

    @Test
    void shouldProvisionUnknownBankAndReturnNothing() {
        List<ScoredMemory> results = recallService.execute(query("tennis").toBuilder().bankId("fresh").build());

        assertTrue(results.isEmpty());
        assertTrue(engine.bankService.listBanks().stream().map(Bank::getBankId).anyMatch("fresh"::equals));
    }

    // ===== Streaming =====

    @Test
    void shouldNotRunUntilSubscribed() {
        Flux<ScoredMemory> results = recallService.recall(query("tennis"));
        engine.retainService.retain(BANK, RetainItem.of("Bob plays tennis with friends."));

        StepVerifier.create(results)
                .assertNext(memory -> assertEquals("Bob plays tennis with friends.", memory.getUnit().getText()))
                .verifyComplete();
    }

    @Test
    void shouldSignalValidationErrorOnSubscription() {
        Flux<ScoredMemory> results = recallService.recall(query(""));

        StepVerifier.create(results)
                .expectError(ValidationException.class)
                .verify();
    }

    // ===== Isolation and degraded strategies =====

    @Test
    void shouldRecallOnlyUnitsOfQueriedBank() {
        engine.retainService.retain(BANK, RetainItem.of("Bob plays tennis with friends."));
        engine.retainService.retain("other-bank", RetainItem.of("Bob plays tennis at the club."));
        engine.retainService.retain("other-bank", RetainItem.of("Carol plays tennis too."));

        List<ScoredMemory> results = recallService.execute(query("Who plays tennis?"));

        assertEquals(List.of("Bob plays tennis with friends."), texts(results));
        assertTrue(results.stream().allMatch(result -> BANK.equals(result.getUnit().getBankId())));
        List<ScoredMemory> other = recallService.execute(query("Who plays tennis?").toBuilder()
                .bankId("other-bank")
                .build());
        assertEquals(2, other.size());
        assertTrue(other.stream().allMatch(result -> "other-bank".equals(result.getUnit().getBankId())));
    }

    @Test
    void shouldAnswerFromRemainingStrategiesWhenOneTimesOutAndOneFails() throws Exception {
        engine.retainService.retain(BANK, RetainItem.of("Bob plays tennis with friends."));
        engine.retainService.retain(BANK, RetainItem.of("Carol bakes bread."));
        engine.properties.getRecall().setStrategyTimeoutMs(200);

        CountDownLatch unblock = new CountDownLatch(1);
        RecallStrategy slow = mock(RecallStrategy.class);
        when(slow.type()).thenReturn(RecallStrategyType.GRAPH);
        when(slow.search(any())).thenAnswer(invocation -> {
            unblock.await(5, TimeUnit.SECONDS);
            return List.of();
        });
        RecallStrategy broken = mock(RecallStrategy.class);
        when(broken.type()).thenReturn(RecallStrategyType.LEXICAL);
        when(broken.search(any())).thenThrow(new IllegalStateException("index unavailable"));

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            RecallService degraded = new RecallService(engine.bankService, engine.repository, engine.embedding,
                    engine.reranker, new RuleBasedTemporalParser(engine.clock), engine.capabilityInvoker,
                    List.of(new SemanticRecallStrategy(), broken, slow, new TemporalRecallStrategy()),
                    executor, engine.properties);

            List<ScoredMemory> results = degraded.execute(query("Who plays tennis?"));

            assertEquals("Bob plays tennis with friends.", results.get(0).getUnit().getText());
            assertTrue(results.get(0).getStrategyRanks().containsKey(RecallStrategyType.SEMANTIC));
            assertFalse(results.get(0).getStrategyRanks().containsKey(RecallStrategyType.GRAPH));
            assertFalse(results.get(0).getStrategyRanks().containsKey(RecallStrategyType.LEXICAL));
        } finally {
            unblock.countDown();
            executor.shutdownNow();
        }
    }

    private void retainAt(String content, String occurredAt) {
        Instant instant = Instant.parse(occurredAt);
        engine.retainService.retain(BANK, RetainItem.builder()
                .content(content)
                .occurredStart(instant)
                .occurredEnd(instant)
                .build());
    }

    private static RecallQuery query(String text) {
        return RecallQuery.builder().bankId(BANK).queryText(text).build();
    }

    private static List<String> texts(List<ScoredMemory> results) {
        return results.stream().map(result -> result.getUnit().getText()).toList();
    }

    private static List<String> ids(List<ScoredMemory> results) {
        return results.stream().map(result -> result.getUnit().getId()).toList();
    }
}
