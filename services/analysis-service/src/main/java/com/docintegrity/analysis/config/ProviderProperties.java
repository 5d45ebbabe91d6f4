package com.docintegrity.analysis.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "providers")
public class ProviderProperties {

    private Duration connectTimeout = Duration.ofSeconds(5);
    private final Endpoint openai = new Endpoint("https://api.openai.com", "gpt-4o-mini");
    private final Endpoint gemini = new Endpoint("https://generativelanguage.googleapis.com", "gemini-1.5-flash");
    private final Endpoint gptzero = new Endpoint("https://api.gptzero.me", null);
    private final GoogleSearch googleSearch = new GoogleSearch();

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Endpoint getOpenai() {
        return openai;
    }

    public Endpoint getGemini() {
        return gemini;
    }

    public Endpoint getGptzero() {
        return gptzero;
    }

    public GoogleSearch getGoogleSearch() {
        return googleSearch;
    }

    public static class Endpoint {

        private String apiKey;
        private String baseUrl;
        private String model;
        private boolean enabled = true;

        public Endpoint() {
        }

        Endpoint(String baseUrl, String model) {
            this.baseUrl = baseUrl;
            this.model = model;
        }

        public boolean isConfigured() {
            return enabled && apiKey != null && !apiKey.isBlank();
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class GoogleSearch extends Endpoint {

        private String engineId;

        public GoogleSearch() {
            super("https://www.googleapis.com", null);
        }

        @Override
        public boolean isConfigured() {
            return super.isConfigured() && engineId != null && !engineId.isBlank();
        }

        public String getEngineId() {
            return engineId;
        }

        public void setEngineId(String engineId) {
            this.engineId = engineId;
        }
    }
}
