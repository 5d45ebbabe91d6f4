package com.docintegrity.analysis.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

public class GptZeroClassifierClient implements ClassifierProvider {

    public static final String ID = "gptzero";

    private final RestClient restClient;

    public GptZeroClassifierClient(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ClassifierVerdict classify(String excerpt) {
        PredictResponse response;
        try {
            response = restClient.post()
                .uri("/v2/predict/text")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("document", excerpt))
                .retrieve()
                .body(PredictResponse.class);
        } catch (RestClientException ex) {
            throw ProviderFailures.translate(ID, ex);
        }

        if (response == null || response.documents() == null || response.documents().isEmpty()) {
            throw ProviderFailures.malformed(ID, "no documents in prediction");
        }
        DocumentPrediction prediction = response.documents().get(0);
        if (prediction.averageGeneratedProb() == null) {
            throw ProviderFailures.malformed(ID, "average_generated_prob missing");
        }
        double probability = Math.max(0.0, Math.min(100.0, prediction.averageGeneratedProb() * 100.0));
        Double completely = prediction.completelyGeneratedProb() == null
            ? null
            : prediction.completelyGeneratedProb() * 100.0;
        return new ClassifierVerdict(probability, prediction.predictedClass(), completely);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PredictResponse(List<DocumentPrediction> documents) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DocumentPrediction(
        @JsonProperty("completely_generated_prob") Double completelyGeneratedProb,
        @JsonProperty("average_generated_prob") Double averageGeneratedProb,
        @JsonProperty("predicted_class") String predictedClass
    ) {}
}
