package me.golemcore.hindsight.domain.recall;

import me.golemcore.hindsight.domain.model.FactType;
import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.domain.model.RecallStrategyType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReciprocalRankFusionTest {

    private final ReciprocalRankFusion fusion = new ReciprocalRankFusion(60);

    @Test
    void shouldSumReciprocalRanksAcrossStrategies() {
        MemoryUnit a = unit("a", "2024-01-01T00:00:00Z", 0.5);
        MemoryUnit b = unit("b", "2024-01-01T00:00:00Z", 0.5);
        Map<RecallStrategyType, List<RankedCandidate>> rankings = new EnumMap<>(RecallStrategyType.class);
        rankings.put(RecallStrategyType.SEMANTIC, ranked(a, b));
        rankings.put(RecallStrategyType.LEXICAL, ranked(b));

        List<FusedCandidate> fused = fusion.fuse(rankings);

        assertEquals(List.of("b", "a"), ids(fused));
        assertEquals(1.0 / 62 + 1.0 / 61, fused.get(0).score(), 1e-12);
        assertEquals(1.0 / 61, fused.get(1).score(), 1e-12);
        assertEquals(Map.of(RecallStrategyType.SEMANTIC, 2, RecallStrategyType.LEXICAL, 1), fused.get(0).ranks());
    }

    @Test
    void shouldBreakScoreTiesByRecencyThenConfidenceThenId() {
        MemoryUnit old = unit("old", "2023-01-01T00:00:00Z", 0.9);
        MemoryUnit recentLow = unit("recent-low", "2024-01-01T00:00:00Z", 0.4);
        MemoryUnit recentHighB = unit("recent-high-b", "2024-01-01T00:00:00Z", 0.8);
        MemoryUnit undated = unit("undated", null, 1.0);
        Map<RecallStrategyType, List<RankedCandidate>> rankings = new LinkedHashMap<>();
        rankings.put(RecallStrategyType.SEMANTIC, ranked(old));
        rankings.put(RecallStrategyType.LEXICAL, ranked(recentLow));
        rankings.put(RecallStrategyType.GRAPH, ranked(recentHighB));
        rankings.put(RecallStrategyType.TEMPORAL, ranked(undated));

        List<FusedCandidate> fused = fusion.fuse(rankings);

        assertEquals(List.of("recent-high-b", "recent-low", "old", "undated"), ids(fused));
    }

    @Test
    void shouldProduceSameOrderForSameInputs() {
        MemoryUnit a = unit("a", "2024-01-01T00:00:00Z", 0.5);
        MemoryUnit b = unit("b", "2024-02-01T00:00:00Z", 0.5);
        MemoryUnit c = unit("c", "2024-03-01T00:00:00Z", 0.5);
        Map<RecallStrategyType, List<RankedCandidate>> rankings = new EnumMap<>(RecallStrategyType.class);
        rankings.put(RecallStrategyType.SEMANTIC, ranked(a, b, c));
        rankings.put(RecallStrategyType.LEXICAL, ranked(c, b, a));

        List<String> first = ids(fusion.fuse(rankings));
        for (int i = 0; i < 20; i++) {
            assertEquals(first, ids(fusion.fuse(rankings)));
        }
        // a and c tie on score; c is more recent
        assertEquals(List.of("c", "a", "b"), first);
    }

    @Test
    void shouldCountDuplicateWithinOneStrategyOnce() {
        MemoryUnit a = unit("a", "2024-01-01T00:00:00Z", 0.5);
        MemoryUnit b = unit("b", "2024-01-01T00:00:00Z", 0.5);
        Map<RecallStrategyType, List<RankedCandidate>> rankings = new EnumMap<>(RecallStrategyType.class);
        rankings.put(RecallStrategyType.SEMANTIC, ranked(a, a, b));

        List<FusedCandidate> fused = fusion.fuse(rankings);

        assertEquals(1.0 / 61, fused.get(0).score(), 1e-12);
        assertEquals(1.0 / 62, fused.get(1).score(), 1e-12);
    }

    @Test
    void shouldComputeMaxScoreForStrategyCount() {
        assertEquals(4.0 / 61, fusion.maxScore(4), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> new ReciprocalRankFusion(-1));
    }

    private static List<RankedCandidate> ranked(MemoryUnit... units) {
        return Arrays.stream(units).map(unit -> new RankedCandidate(unit, 1.0)).toList();
    }

    private static List<String> ids(List<FusedCandidate> fused) {
        return fused.stream().map(candidate -> candidate.unit().getId()).toList();
    }

    private static MemoryUnit unit(String id, String mentionedAt, double confidence) {
        return MemoryUnit.builder()
                .id(id)
                .bankId("bank")
                .text(id)
                .factType(FactType.WORLD)
                .confidence(confidence)
                .mentionedAt(mentionedAt != null ? Instant.parse(mentionedAt) : null)
                .build();
    }
}
