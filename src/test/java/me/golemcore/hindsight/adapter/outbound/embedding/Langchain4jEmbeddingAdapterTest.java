package me.golemcore.hindsight.adapter.outbound.embedding;

import me.golemcore.hindsight.domain.exception.RateLimitedException;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class Langchain4jEmbeddingAdapterTest {

    private HindsightProperties properties;
    private Langchain4jEmbeddingAdapter adapter;
    private EmbeddingModel model;

    @BeforeEach
    void setUp() {
        properties = new HindsightProperties();
        properties.getEmbedding().setDimension(3);
        adapter = new Langchain4jEmbeddingAdapter(properties);
        model = mock(EmbeddingModel.class);
    }

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        assertFalse(adapter.isAvailable());

        ExecutionException ex = assertThrows(ExecutionException.class, () -> adapter.embed("text").get());
        assertTrue(ex.getCause().getMessage().contains("not available"));
    }

    @Test
    void shouldDefaultModelName() {
        properties.getEmbedding().setModel(" ");

        assertEquals("text-embedding-3-small", adapter.getModel());
        assertEquals(3, adapter.getDimension());
    }

    @Test
    void shouldEmbedSingleText() throws Exception {
        injectModel();
        when(model.embed(anyString())).thenReturn(Response.from(Embedding.from(new float[] { 0.1f, 0.2f, 0.3f })));

        float[] vector = adapter.embed("Alice works at Google.").get();

        assertArrayEquals(new float[] { 0.1f, 0.2f, 0.3f }, vector);
    }

    @Test
    void shouldEmbedBatchInOrder() throws Exception {
        injectModel();
        when(model.embedAll(anyList())).thenReturn(Response.from(List.of(
                Embedding.from(new float[] { 1f, 0f, 0f }), Embedding.from(new float[] { 0f, 1f, 0f }))));

        List<float[]> vectors = adapter.embedBatch(List.of("first", "second")).get();

        assertEquals(2, vectors.size());
        assertArrayEquals(new float[] { 0f, 1f, 0f }, vectors.get(1));
    }

    @Test
    void shouldRejectWrongDimension() {
        injectModel();
        when(model.embed(anyString())).thenReturn(Response.from(Embedding.from(new float[] { 1f, 0f })));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> adapter.embed("text").get());

        assertTrue(ex.getCause().getMessage().contains("expected 3"));
    }

    @Test
    void shouldTranslateThrottling() {
        injectModel();
        when(model.embed(anyString())).thenThrow(new RuntimeException("rate_limit reached, retry_after: 2"));

        ExecutionException ex = assertThrows(ExecutionException.class, () -> adapter.embed("text").get());

        assertInstanceOf(RateLimitedException.class, ex.getCause());
    }

    @Test
    void shouldReturnEmptyBatchWithoutCallingModel() throws Exception {
        assertTrue(adapter.embedBatch(List.<String>of()).get().isEmpty());
    }

    private void injectModel() {
        ReflectionTestUtils.setField(adapter, "embeddingModel", model);
        ReflectionTestUtils.setField(adapter, "initialized", true);
    }
}
