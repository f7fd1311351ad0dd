package me.golemcore.virality.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import me.golemcore.virality.domain.exception.LlmCompletionException;
import me.golemcore.virality.infrastructure.config.ViralityProperties;
import me.golemcore.virality.port.outbound.CompletionPort.CompletionRequest;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jCompletionAdapterTest {

    private static final CompletionRequest REQUEST = new CompletionRequest("system", "user", 0.3, 1000);

    @Test
    void isAvailable_requiresApiKey() {
        ViralityProperties properties = new ViralityProperties();
        assertFalse(new Langchain4jCompletionAdapter(properties).isAvailable());

        properties.getLlm().setApiKey("sk-test");
        assertTrue(new Langchain4jCompletionAdapter(properties).isAvailable());
    }

    @Test
    void complete_failsWithoutApiKey() {
        Langchain4jCompletionAdapter adapter = new Langchain4jCompletionAdapter(new ViralityProperties());

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> adapter.complete(REQUEST).get(5, TimeUnit.SECONDS));
        assertInstanceOf(LlmCompletionException.class, ex.getCause());
    }

    @Test
    void complete_sendsPromptsAndSamplingParameters() throws Exception {
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(any(ChatRequest.class)))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("{\"ok\":true}")).build());
        Langchain4jCompletionAdapter adapter = new Langchain4jCompletionAdapter(new ViralityProperties(), chatModel);

        assertEquals("{\"ok\":true}", adapter.complete(REQUEST).get(5, TimeUnit.SECONDS));

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        ChatRequest sent = captor.getValue();
        assertEquals(2, sent.messages().size());
        assertEquals("system", ((SystemMessage) sent.messages().get(0)).text());
        assertEquals("user", ((UserMessage) sent.messages().get(1)).singleText());
        assertEquals(0.3, sent.temperature());
        assertEquals(1000, sent.maxOutputTokens());
    }

    @Test
    void complete_wrapsProviderFailure() {
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("401 Unauthorized"));
        Langchain4jCompletionAdapter adapter = new Langchain4jCompletionAdapter(new ViralityProperties(), chatModel);

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> adapter.complete(REQUEST).get(5, TimeUnit.SECONDS));
        LlmCompletionException cause = assertInstanceOf(LlmCompletionException.class, ex.getCause());
        assertTrue(cause.getMessage().contains("401"));
    }

    @Test
    void complete_rejectsEmptyContent() {
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(any(ChatRequest.class)))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from(" ")).build());
        Langchain4jCompletionAdapter adapter = new Langchain4jCompletionAdapter(new ViralityProperties(), chatModel);

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> adapter.complete(REQUEST).get(5, TimeUnit.SECONDS));
        assertInstanceOf(LlmCompletionException.class, ex.getCause());
    }
}
