package com.docintegrity.analysis.config;

import com.docintegrity.analysis.client.ClassifierProvider;
import com.docintegrity.analysis.client.GeminiClassifierClient;
import com.docintegrity.analysis.client.GoogleSearchClient;
import com.docintegrity.analysis.client.GptZeroClassifierClient;
import com.docintegrity.analysis.client.OpenAiClassifierClient;
import com.docintegrity.analysis.client.ProviderRegistry;
import com.docintegrity.analysis.client.SearchProvider;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ClientConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientConfig.class);

    @Bean
    ProviderRegistry providerRegistry(ProviderProperties providers, AnalysisProperties analysis) {
        Duration readTimeout = analysis.getProviderTimeout();
        List<ClassifierProvider> classifiers = new ArrayList<>();

        ProviderProperties.Endpoint openai = providers.getOpenai();
        if (openai.isConfigured()) {
            classifiers.add(new OpenAiClassifierClient(
                restClient(openai.getBaseUrl(), providers.getConnectTimeout(), readTimeout)
                    .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + openai.getApiKey())
                    .build(),
                openai.getModel()
            ));
        }

        ProviderProperties.Endpoint gemini = providers.getGemini();
        if (gemini.isConfigured()) {
            classifiers.add(new GeminiClassifierClient(
                restClient(gemini.getBaseUrl(), providers.getConnectTimeout(), readTimeout).build(),
                gemini.getModel(),
                gemini.getApiKey()
            ));
        }

        ProviderProperties.Endpoint gptzero = providers.getGptzero();
        if (gptzero.isConfigured()) {
            classifiers.add(new GptZeroClassifierClient(
                restClient(gptzero.getBaseUrl(), providers.getConnectTimeout(), readTimeout)
                    .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + gptzero.getApiKey())
                    .build()
            ));
        }

        SearchProvider search = null;
        ProviderProperties.GoogleSearch google = providers.getGoogleSearch();
        if (google.isConfigured()) {
            search = new GoogleSearchClient(
                restClient(google.getBaseUrl(), providers.getConnectTimeout(), readTimeout).build(),
                google.getApiKey(),
                google.getEngineId()
            );
        }

        ProviderRegistry registry = new ProviderRegistry(classifiers, search);
        LOGGER.info("Classifier chain: {}; search provider: {}",
            registry.classifierIds().isEmpty() ? "none (heuristic only)" : registry.classifierIds(),
            registry.search().map(SearchProvider::id).orElse("none"));
        return registry;
    }

    private static RestClient.Builder restClient(String baseUrl, Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) connectTimeout.toMillis());
        requestFactory.setReadTimeout((int) readTimeout.toMillis());
        return RestClient.builder()
            .baseUrl(baseUrl)
            .requestFactory(requestFactory);
    }
}
