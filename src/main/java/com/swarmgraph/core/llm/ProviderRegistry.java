package com.swarmgraph.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the prioritized candidate list from {@link ProvidersProperties}.
 * <p>
 * Entries without an API key are skipped. Spring AI's own retry is disabled on each
 * model so that {@link RetryingCaller} is the single place retries happen.
 */
@Component
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final List<GenerationProvider> candidates;

    @Autowired
    public ProviderRegistry(ProvidersProperties properties) {
        this(buildCandidates(properties));
    }

    public ProviderRegistry(List<GenerationProvider> candidates) {
        this.candidates = List.copyOf(candidates);
    }

    public List<GenerationProvider> candidates() {
        return candidates;
    }

    private static List<GenerationProvider> buildCandidates(ProvidersProperties properties) {
        var result = new ArrayList<GenerationProvider>();
        for (var entry : properties.getProviders()) {
            if (!entry.hasApiKey()) {
                log.warn("Provider {} has no API key configured, skipping", entry.getName());
                continue;
            }
            var api = OpenAiApi.builder()
                    .baseUrl(entry.getBaseUrl())
                    .apiKey(entry.getApiKey())
                    .build();
            var chatModel = OpenAiChatModel.builder()
                    .openAiApi(api)
                    .defaultOptions(OpenAiChatOptions.builder().model(entry.getModel()).build())
                    .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
                    .build();
            var service = new ChatClientGenerationService(entry.getName(), ChatClient.create(chatModel));
            result.add(new GenerationProvider(entry.getName(), entry.getModel(), service));
            log.info("Registered provider {} (model {})", entry.getName(), entry.getModel());
        }
        return result;
    }
}
