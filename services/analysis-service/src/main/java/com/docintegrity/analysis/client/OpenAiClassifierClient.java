package com.docintegrity.analysis.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

public class OpenAiClassifierClient implements ClassifierProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiClassifierClient.class);

    public static final String ID = "openai";

    private final RestClient restClient;
    private final String model;

    public OpenAiClassifierClient(RestClient restClient, String model) {
        this.restClient = restClient;
        this.model = model;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ClassifierVerdict classify(String excerpt) {
        ChatCompletionResponse response;
        try {
            response = restClient.post()
                .uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of(
                    "model", model,
                    "temperature", 0.3,
                    "max_tokens", 10,
                    "messages", List.of(
                        Map.of("role", "system", "content", DetectionPrompt.SYSTEM),
                        Map.of("role", "user", "content", DetectionPrompt.forExcerpt(excerpt))
                    )
                ))
                .retrieve()
                .body(ChatCompletionResponse.class);
        } catch (RestClientException ex) {
            throw ProviderFailures.translate(ID, ex);
        }

        if (response == null || response.choices() == null || response.choices().isEmpty()
            || response.choices().get(0).message() == null) {
            throw ProviderFailures.malformed(ID, "no choices in completion");
        }
        ClassifierVerdict verdict = DetectionPrompt.parseReply(ID, response.choices().get(0).message().content());
        LOGGER.debug("[{}] AI detection score: {}", ID, verdict.probability());
        return verdict;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatCompletionResponse(List<Choice> choices) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(Message message, @JsonProperty("finish_reason") String finishReason) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(String role, String content) {}
}
