package com.docintegrity.analysis.client;

import com.docintegrity.analysis.domain.SearchHit;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Objects;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

public class GoogleSearchClient implements SearchProvider {

    public static final String ID = "google-cse";

    // The API rejects num above this.
    private static final int MAX_RESULTS_PER_QUERY = 10;

    private final RestClient restClient;
    private final String apiKey;
    private final String engineId;

    public GoogleSearchClient(RestClient restClient, String apiKey, String engineId) {
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.engineId = engineId;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<SearchHit> search(String query, int maxResults) {
        int num = Math.max(1, Math.min(maxResults, MAX_RESULTS_PER_QUERY));
        SearchResponse response;
        try {
            response = restClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path("/customsearch/v1")
                    .queryParam("key", apiKey)
                    .queryParam("cx", engineId)
                    .queryParam("q", "{q}")
                    .queryParam("num", num)
                    .build(query))
                .retrieve()
                .body(SearchResponse.class);
        } catch (RestClientException ex) {
            throw ProviderFailures.translate(ID, ex);
        }

        if (response == null || response.items() == null) {
            return List.of();
        }
        return response.items().stream()
            .filter(item -> item.link() != null && !item.link().isBlank())
            .limit(num)
            .map(item -> new SearchHit(
                Objects.requireNonNullElse(item.title(), "Unknown"),
                item.link(),
                Objects.requireNonNullElse(item.snippet(), "")
            ))
            .toList();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SearchResponse(List<Item> items) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Item(String title, String link, String snippet) {}
}
