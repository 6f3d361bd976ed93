package com.swarmgraph.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of candidate backends. Every entry is an OpenAI-compatible
 * chat-completions endpoint; list order is probe priority.
 */
@Component
@ConfigurationProperties(prefix = "swarm")
public class ProvidersProperties {

    private List<Entry> providers = new ArrayList<>();

    public List<Entry> getProviders() {
        return providers;
    }

    public void setProviders(List<Entry> providers) {
        this.providers = providers;
    }

    public static class Entry {

        private String name = "";
        private String baseUrl = "";
        private String apiKey = "";
        private String model = "";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
