package com.docintegrity.analysis.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

public class GeminiClassifierClient implements ClassifierProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiClassifierClient.class);

    public static final String ID = "gemini";

    private final RestClient restClient;
    private final String model;
    private final String apiKey;

    public GeminiClassifierClient(RestClient restClient, String model, String apiKey) {
        this.restClient = restClient;
        this.model = model;
        this.apiKey = apiKey;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ClassifierVerdict classify(String excerpt) {
        GenerateContentResponse response;
        try {
            response = restClient.post()
                .uri(uriBuilder -> uriBuilder
                    .path("/v1beta/models/{model}:generateContent")
                    .queryParam("key", apiKey)
                    .build(model))
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of(
                    "systemInstruction", Map.of("parts", List.of(Map.of("text", DetectionPrompt.SYSTEM))),
                    "contents", List.of(Map.of(
                        "role", "user",
                        "parts", List.of(Map.of("text", DetectionPrompt.forExcerpt(excerpt)))
                    ))
                ))
                .retrieve()
                .body(GenerateContentResponse.class);
        } catch (RestClientException ex) {
            throw ProviderFailures.translate(ID, ex);
        }

        String reply = firstText(response);
        ClassifierVerdict verdict = DetectionPrompt.parseReply(ID, reply);
        LOGGER.debug("[{}] AI detection score: {}", ID, verdict.probability());
        return verdict;
    }

    private String firstText(GenerateContentResponse response) {
        if (response == null || response.candidates() == null) {
            return null;
        }
        return response.candidates().stream()
            .map(Candidate::content)
            .filter(content -> content != null && content.parts() != null)
            .flatMap(content -> content.parts().stream())
            .map(Part::text)
            .filter(text -> text != null && !text.isBlank())
            .findFirst()
            .orElse(null);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateContentResponse(List<Candidate> candidates) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Candidate(Content content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Content(List<Part> parts) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Part(String text) {}
}
