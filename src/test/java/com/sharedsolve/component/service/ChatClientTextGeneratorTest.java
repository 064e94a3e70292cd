package com.sharedsolve.component.service;

import com.sharedsolve.component.api.GenerationException;
import com.sharedsolve.component.model.GenerationRequest;
import com.sharedsolve.config.SharedSolveProperties;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ChatClientTextGeneratorTest {

    private final SharedSolveProperties properties = new SharedSolveProperties();
    private final GenerationRequest request = new GenerationRequest("prompt", "system", List.of(), 0.7, true);

    @Test
    void testStripsReasoningFromContent() {
        ChatClient chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        when(chatClient.prompt().options(any()).system(anyString()).messages(anyList()).user(anyString()).call().content())
                .thenReturn("<think>hmm</think>{\"reply\":\"x\"}");

        String output = new ChatClientTextGenerator(chatClient, properties).generate(request);

        assertEquals("{\"reply\":\"x\"}", output);
    }

    @Test
    void testNullContentBecomesEmpty() {
        ChatClient chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        when(chatClient.prompt().options(any()).system(anyString()).messages(anyList()).user(anyString()).call().content())
                .thenReturn(null);

        assertEquals("", new ChatClientTextGenerator(chatClient, properties).generate(request));
    }

    @Test
    void testProviderFailureIsWrapped() {
        ChatClient chatClient = mock(ChatClient.class);
        when(chatClient.prompt()).thenThrow(new IllegalStateException("connection refused"));

        GenerationException ex = assertThrows(GenerationException.class,
                () -> new ChatClientTextGenerator(chatClient, properties).generate(request));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    void testStructuredRequestAsksForJsonObject() {
        ChatClientTextGenerator generator = new ChatClientTextGenerator(mock(ChatClient.class), properties);

        OpenAiChatOptions options = generator.chatOptions(request);

        assertNotNull(options.getResponseFormat());
        assertEquals(ResponseFormat.Type.JSON_OBJECT, options.getResponseFormat().getType());
        assertEquals(0.7, options.getTemperature());
        assertEquals(4000, options.getMaxTokens());
    }

    @Test
    void testProseRequestLeavesFormatUnset() {
        ChatClientTextGenerator generator = new ChatClientTextGenerator(mock(ChatClient.class), properties);
        GenerationRequest feedback = new GenerationRequest("prompt", "system", List.of(), 0.7, false);

        assertNull(generator.chatOptions(feedback).getResponseFormat());
    }

    @Test
    void testJsonFormatCanBeDisabled() {
        properties.getGeneration().setJsonResponseFormat(false);
        ChatClientTextGenerator generator = new ChatClientTextGenerator(mock(ChatClient.class), properties);

        assertNull(generator.chatOptions(request).getResponseFormat());
    }
}
