package com.sharedsolve.component.service;

import com.sharedsolve.component.api.GenerationException;
import com.sharedsolve.component.api.TextGenerator;
import com.sharedsolve.component.model.GenerationRequest;
import com.sharedsolve.component.model.HistoryMessage;
import com.sharedsolve.config.SharedSolveProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

@Service
@Slf4j
public class ChatClientTextGenerator implements TextGenerator {

    private final ChatClient chatClient;
    private final SharedSolveProperties properties;

    public ChatClientTextGenerator(ChatClient chatClient, SharedSolveProperties properties) {
        this.chatClient = chatClient;
        this.properties = properties;
    }

    @Override
    public String generate(GenerationRequest request) {
        List<Message> history = request.history().stream()
                .map(ChatClientTextGenerator::toMessage)
                .toList();
        ChatOptions options = chatOptions(request);
        String output;
        try {
            ChatClient.ChatClientRequestSpec spec = chatClient.prompt().options(options);
            if (StringUtils.hasText(request.systemPrompt())) {
                spec = spec.system(request.systemPrompt());
            }
            output = spec.messages(history)
                    .user(request.prompt())
                    .call()
                    .content();
        } catch (RuntimeException ex) {
            log.error("Generator call failed: {}", ex.getMessage());
            throw new GenerationException("Text generation failed: " + ex.getMessage(), ex);
        }
        if (output == null) {
            log.warn("Generator returned no content");
            return "";
        }
        return properties.getGeneration().isStripReasoningTags() ? ReasoningTags.strip(output) : output;
    }

    OpenAiChatOptions chatOptions(GenerationRequest request) {
        OpenAiChatOptions.Builder options = OpenAiChatOptions.builder()
                .temperature(request.temperature())
                .maxTokens(properties.getGeneration().getMaxTokens());
        if (request.jsonOutput() && properties.getGeneration().isJsonResponseFormat()) {
            options.responseFormat(ResponseFormat.builder().type(ResponseFormat.Type.JSON_OBJECT).build());
        }
        return options.build();
    }

    private static Message toMessage(HistoryMessage message) {
        return message.fromUser() ? new UserMessage(message.content()) : new AssistantMessage(message.content());
    }
}
