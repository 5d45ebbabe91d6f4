package com.docintegrity.analysis.controller;

import com.docintegrity.analysis.client.ProviderRegistry;
import com.docintegrity.analysis.client.SearchProvider;
import com.docintegrity.analysis.config.ProviderProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final ProviderRegistry providerRegistry;
    private final ProviderProperties providerProperties;

    public HealthController(ProviderRegistry providerRegistry, ProviderProperties providerProperties) {
        this.providerRegistry = providerRegistry;
        this.providerProperties = providerProperties;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, String> keys = new LinkedHashMap<>();
        keys.put("openai", presence(providerProperties.getOpenai().getApiKey()));
        keys.put("gemini", presence(providerProperties.getGemini().getApiKey()));
        keys.put("gptzero", presence(providerProperties.getGptzero().getApiKey()));
        keys.put("google-cse", presence(providerProperties.getGoogleSearch().getApiKey()));

        return Map.of(
            "status", "ok",
            "service", "analysis-service",
            "classifierChain", providerRegistry.classifierIds(),
            "searchProvider", providerRegistry.search().map(SearchProvider::id).orElse("unconfigured"),
            "apiKeys", keys
        );
    }

    static String presence(String apiKey) {
        return apiKey == null || apiKey.isBlank() ? "missing" : "configured";
    }
}
