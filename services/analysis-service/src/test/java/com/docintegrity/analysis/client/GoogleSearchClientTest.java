package com.docintegrity.analysis.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.docintegrity.analysis.domain.SearchHit;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class GoogleSearchClientTest {

    private MockRestServiceServer server;
    private GoogleSearchClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://search.test");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new GoogleSearchClient(builder.build(), "search-key", "engine-1");
    }

    @Test
    @DisplayName("should send key, engine and result count and map the items")
    void mapsItems() {
        server.expect(requestTo(startsWith("https://search.test/customsearch/v1")))
            .andExpect(method(HttpMethod.GET))
            .andExpect(queryParam("key", "search-key"))
            .andExpect(queryParam("cx", "engine-1"))
            .andExpect(queryParam("num", "3"))
            .andRespond(withSuccess("""
                {"items":[
                  {"title":"Foraging","link":"https://pollinators.example.org/foraging","snippet":"Honey bees communicate"},
                  {"link":"https://other.example.org"},
                  {"title":"No link"}
                ]}
                """, MediaType.APPLICATION_JSON));

        List<SearchHit> hits = client.search("\"Honey bees communicate\"", 3);

        assertThat(hits).containsExactly(
            new SearchHit("Foraging", "https://pollinators.example.org/foraging", "Honey bees communicate"),
            new SearchHit("Unknown", "https://other.example.org", "")
        );
        server.verify();
    }

    @Test
    @DisplayName("should return no hits when the response has no items")
    void noItems() {
        server.expect(requestTo(startsWith("https://search.test/customsearch/v1")))
            .andRespond(withSuccess("{\"searchInformation\":{\"totalResults\":\"0\"}}", MediaType.APPLICATION_JSON));

        assertThat(client.search("query", 3)).isEmpty();
    }

    @Test
    @DisplayName("should never ask for more than ten results")
    void capsResultCount() {
        server.expect(requestTo(startsWith("https://search.test/customsearch/v1")))
            .andExpect(queryParam("num", "10"))
            .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        client.search("query", 50);

        server.verify();
    }

    @Test
    @DisplayName("should map an exhausted quota to a transient failure")
    void quota() {
        server.expect(requestTo(startsWith("https://search.test/customsearch/v1")))
            .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> client.search("query", 3)).isInstanceOf(ProviderTransientException.class);
    }
}
