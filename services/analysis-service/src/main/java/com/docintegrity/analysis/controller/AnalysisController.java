package com.docintegrity.analysis.controller;

import com.docintegrity.analysis.domain.AnalysisInput;
import com.docintegrity.analysis.domain.AnalysisOptions;
import com.docintegrity.analysis.domain.AnalysisReport;
import com.docintegrity.analysis.domain.TextAnalysisRequest;
import com.docintegrity.analysis.service.DocumentAnalysisService;
import com.docintegrity.analysis.service.ExtractionException;
import com.docintegrity.analysis.service.ReportNotFoundException;
import jakarta.validation.Valid;
import java.io.IOException;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
public class AnalysisController {

    private final DocumentAnalysisService analysisService;

    public AnalysisController(DocumentAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping(value = "/v1/analysis/text", consumes = MediaType.APPLICATION_JSON_VALUE)
    public AnalysisReport analyzeText(@Valid @RequestBody TextAnalysisRequest request) {
        AnalysisOptions options = new AnalysisOptions(Boolean.TRUE.equals(request.bypassCache()));
        return analysisService.analyze(AnalysisInput.ofText(request.text(), request.sourceName()), options);
    }

    @PostMapping(value = "/v1/analysis/document", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public AnalysisReport analyzeDocument(
        @RequestParam("file") MultipartFile file,
        @RequestParam(name = "bypassCache", defaultValue = "false") boolean bypassCache
    ) {
        if (file.isEmpty() || file.getOriginalFilename() == null || file.getOriginalFilename().isBlank()) {
            throw new ExtractionException("No file selected");
        }
        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException ex) {
            throw new ExtractionException("Could not read uploaded file", ex);
        }
        return analysisService.analyze(
            AnalysisInput.ofDocument(bytes, file.getOriginalFilename()),
            new AnalysisOptions(bypassCache)
        );
    }

    @GetMapping("/v1/reports/{fingerprint}")
    public AnalysisReport getReport(@PathVariable String fingerprint) {
        return analysisService.getCachedReport(fingerprint)
            .orElseThrow(() -> new ReportNotFoundException(fingerprint));
    }
}
