package me.golemcore.hindsight.adapter.outbound.llm;

import me.golemcore.hindsight.domain.exception.RateLimitedException;
import me.golemcore.hindsight.domain.model.LlmRequest;
import me.golemcore.hindsight.domain.model.LlmResponse;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jAdapterTest {

    private static final String TEST_MODEL = "test-model";

    private HindsightProperties properties;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new HindsightProperties();
        properties.getLlm().setModel(TEST_MODEL);
        adapter = new Langchain4jAdapter(properties);
    }

    // ===== availability =====

    @Test
    void shouldReturnLangchain4jProviderId() {
        assertEquals("langchain4j", adapter.getProviderId());
        assertEquals(TEST_MODEL, adapter.getCurrentModel());
    }

    @Test
    void shouldBeAvailableOnlyWithApiKey() {
        assertFalse(adapter.isAvailable());
        properties.getLlm().setApiKey(" ");
        assertFalse(adapter.isAvailable());
        properties.getLlm().setApiKey("sk-test");
        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldFailChatWhenNotConfigured() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> adapter.chat(LlmRequest.builder().userMessage("Hi").build()).get());

        assertTrue(ex.getCause().getMessage().contains("not available"));
    }

    // ===== chat =====

    @Test
    void shouldSendSystemPromptAndJsonFormat() throws Exception {
        ChatModel model = injectChatModel();
        when(model.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("{\"facts\": []}"))
                .finishReason(FinishReason.STOP)
                .build());

        LlmResponse response = adapter.chat(LlmRequest.builder()
                .systemPrompt("Extract facts")
                .userMessage("Alice works at Google.")
                .temperature(0.0)
                .jsonResponse(true)
                .build()).get();

        assertEquals("{\"facts\": []}", response.getContent());
        assertEquals("stop", response.getFinishReason());
        assertEquals(TEST_MODEL, response.getModel());

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(model).chat(captor.capture());
        ChatRequest sent = captor.getValue();
        assertEquals(2, sent.messages().size());
        assertInstanceOf(SystemMessage.class, sent.messages().get(0));
        assertEquals(ResponseFormat.JSON, sent.responseFormat());
        assertEquals(2048, sent.maxOutputTokens());
    }

    @Test
    void shouldTranslateThrottlingToRateLimitedException() {
        ChatModel model = injectChatModel();
        when(model.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("HTTP 429 Too Many Requests"));

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> adapter.chat(LlmRequest.builder().userMessage("Hi").build()).get());

        assertInstanceOf(RateLimitedException.class, ex.getCause());
    }

    @Test
    void shouldPropagateOtherErrors() {
        ChatModel model = injectChatModel();
        when(model.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("Connection refused"));

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> adapter.chat(LlmRequest.builder().userMessage("Hi").build()).get());

        assertTrue(ex.getCause().getMessage().contains("Connection refused"));
    }

    @SuppressWarnings("unchecked")
    private ChatModel injectChatModel() {
        properties.getLlm().setApiKey("sk-test");
        ChatModel model = mock(ChatModel.class);
        Map<String, ChatModel> models = (Map<String, ChatModel>) ReflectionTestUtils.getField(adapter, "models");
        assertNotNull(models);
        models.put(TEST_MODEL, model);
        return model;
    }
}
