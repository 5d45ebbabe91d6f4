package com.docintegrity.analysis.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record TextAnalysisRequest(
    @NotBlank(message = "text must not be blank")
    String text,

    @Size(max = 255, message = "sourceName must be <= 255 characters")
    String sourceName,

    Boolean bypassCache
) {
}
