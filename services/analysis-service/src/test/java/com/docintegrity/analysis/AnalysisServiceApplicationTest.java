package com.docintegrity.analysis;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.docintegrity.analysis.service.text.ContentFingerprint;
import com.docintegrity.analysis.service.text.TextNormalizer;
import com.docintegrity.analysis.testing.Fixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = {
    "providers.openai.api-key=",
    "providers.gemini.api-key=",
    "providers.gptzero.api-key=",
    "providers.google-search.api-key="
})
@AutoConfigureMockMvc
class AnalysisServiceApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("should analyze text end to end with the heuristic when no provider is configured")
    void heuristicOnlyAnalysis() throws Exception {
        String body = objectMapper.writeValueAsString(Map.of("text", Fixtures.humanEssay(), "sourceName", "essay.txt"));
        String fingerprint = ContentFingerprint.of(TextNormalizer.normalize(Fixtures.humanEssay()));

        mockMvc.perform(post("/v1/analysis/text").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.documentId").value(fingerprint))
            .andExpect(jsonPath("$.sourceName").value("essay.txt"))
            .andExpect(jsonPath("$.textStats.totalWords").value(606))
            .andExpect(jsonPath("$.aiDetection.source").value("HEURISTIC_ONLY"))
            .andExpect(jsonPath("$.aiDetection.confidence").value("MEDIUM"))
            .andExpect(jsonPath("$.plagiarism.note").value("search provider not configured"))
            .andExpect(jsonPath("$.overallVerdict.riskLevel").value("LOW"));

        mockMvc.perform(get("/v1/reports/{fingerprint}", fingerprint))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sourceName").value("essay.txt"));
    }

    @Test
    @DisplayName("should report an empty provider chain on the health endpoint")
    void health() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.classifierChain").isEmpty())
            .andExpect(jsonPath("$.searchProvider").value("unconfigured"))
            .andExpect(jsonPath("$.apiKeys.openai").value("missing"));
    }
}
