package com.swarmgraph.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;

/**
 * {@link GenerationService} backed by a Spring AI {@link ChatClient}.
 */
public class ChatClientGenerationService implements GenerationService {

    private static final Logger log = LoggerFactory.getLogger(ChatClientGenerationService.class);

    private final String name;
    private final ChatClient chatClient;

    public ChatClientGenerationService(String name, ChatClient chatClient) {
        this.name = name;
        this.chatClient = chatClient;
    }

    @Override
    public String generate(String systemPrompt, String userMessage, GenerationOptions options) {
        long start = System.currentTimeMillis();
        var request = chatClient.prompt()
                .system(systemPrompt)
                .user(userMessage);
        if (options != null && !options.isEmpty()) {
            request = request.options(ChatOptions.builder()
                    .temperature(options.temperature())
                    .maxTokens(options.maxTokens())
                    .build());
        }
        String content = request.call().content();
        long elapsed = System.currentTimeMillis() - start;
        log.debug("{} responded in {}s", name, String.format("%.1f", elapsed / 1000.0));
        if (content == null || content.isBlank()) {
            throw new EmptyGenerationException(name + " returned empty content");
        }
        return content;
    }

    public String getName() {
        return name;
    }
}
