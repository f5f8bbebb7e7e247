package me.golemcore.hindsight.adapter.outbound.rerank;

import me.golemcore.hindsight.domain.exception.RateLimitedException;
import me.golemcore.hindsight.domain.recall.ScoreBlender;
import me.golemcore.hindsight.port.outbound.EmbeddingPort;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ScoringModelRerankAdapterTest {

    private ObjectProvider<ScoringModel> scoringModelProvider;
    private EmbeddingPort embeddingPort;
    private ScoringModelRerankAdapter adapter;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        scoringModelProvider = mock(ObjectProvider.class);
        embeddingPort = mock(EmbeddingPort.class);
        adapter = new ScoringModelRerankAdapter(scoringModelProvider, embeddingPort);
    }

    @Test
    void shouldScoreWithScoringModelWhenPresent() throws Exception {
        ScoringModel scoringModel = mock(ScoringModel.class);
        when(scoringModelProvider.getIfAvailable()).thenReturn(scoringModel);
        List<TextSegment> segments = List.of(TextSegment.from("Bob plays tennis."), TextSegment.from("Carol bakes."));
        when(scoringModel.scoreAll(eq(segments), eq("tennis"))).thenReturn(Response.from(List.of(0.9, 0.1)));

        List<Double> scores = adapter.rerank("tennis", List.of("Bob plays tennis.", "Carol bakes.")).get();

        assertEquals(List.of(0.9, 0.1), scores);
        verifyNoInteractions(embeddingPort);
    }

    @Test
    void shouldMapLogitsIntoUnitIntervalKeepingOrder() throws Exception {
        ScoringModel scoringModel = mock(ScoringModel.class);
        when(scoringModelProvider.getIfAvailable()).thenReturn(scoringModel);
        when(scoringModel.scoreAll(anyList(), eq("tennis"))).thenReturn(Response.from(List.of(-0.5, -7.0, 9.0, 3.0)));

        List<Double> scores = adapter.rerank("tennis", List.of("a", "b", "c", "d")).get();

        assertEquals(1.0 / (1.0 + Math.exp(0.5)), scores.get(0), 1e-12);
        assertTrue(scores.stream().allMatch(score -> score > 0.0 && score < 1.0));
        assertTrue(scores.get(0) > scores.get(1));
        assertTrue(scores.get(2) > scores.get(3));
    }

    @Test
    void shouldKeepRerankOrderAfterBlendingLogits() {
        List<Double> scores = ScoringModelRerankAdapter.toUnitInterval(List.of(-0.5, -7.0, 9.0, 3.0));
        ScoreBlender blender = new ScoreBlender(0.8, 4.0 / 61);

        assertTrue(blender.blend(1.0 / 62, scores.get(0)) > blender.blend(1.0 / 61, scores.get(1)));
        assertTrue(blender.blend(1.0 / 64, scores.get(2)) > blender.blend(1.0 / 63, scores.get(3)));
    }

    @Test
    void shouldPassProbabilitiesThrough() {
        assertEquals(List.of(0.0, 0.4, 1.0), ScoringModelRerankAdapter.toUnitInterval(List.of(0.0, 0.4, 1.0)));
    }

    @Test
    void shouldTranslateScoringModelThrottling() {
        ScoringModel scoringModel = mock(ScoringModel.class);
        when(scoringModelProvider.getIfAvailable()).thenReturn(scoringModel);
        when(scoringModel.scoreAll(anyList(), anyString())).thenThrow(new RuntimeException("429 Too Many Requests"));

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> adapter.rerank("tennis", List.of("Bob plays tennis.")).get());

        assertInstanceOf(RateLimitedException.class, ex.getCause());
    }

    @Test
    void shouldFallBackToEmbeddingSimilarity() throws Exception {
        when(embeddingPort.embed("tennis")).thenReturn(CompletableFuture.completedFuture(new float[] { 1f, 0f }));
        when(embeddingPort.embedBatch(List.of("same", "other"))).thenReturn(CompletableFuture.completedFuture(
                List.of(new float[] { 1f, 0f }, new float[] { 0f, 1f })));

        List<Double> scores = adapter.rerank("tennis", List.of("same", "other")).get();

        assertEquals(1.0, scores.get(0), 1e-9);
        assertEquals(0.5, scores.get(1), 1e-9);
    }

    @Test
    void shouldReturnNothingForNoCandidates() throws Exception {
        assertTrue(adapter.rerank("tennis", List.of()).get().isEmpty());
        verifyNoInteractions(scoringModelProvider, embeddingPort);
    }

    @Test
    void shouldMapCosineIntoUnitInterval() {
        List<Double> scores = ScoringModelRerankAdapter.cosineScores(new float[] { 1f, 0f },
                List.of(new float[] { 1f, 0f }, new float[] { -1f, 0f }, new float[] { 0f, 1f }));

        assertEquals(1.0, scores.get(0), 1e-9);
        assertEquals(0.0, scores.get(1), 1e-9);
        assertEquals(0.5, scores.get(2), 1e-9);
    }
}
