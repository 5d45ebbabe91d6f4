package com.docintegrity.analysis.client;

import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

final class ProviderFailures {

    private ProviderFailures() {
    }

    static ProviderException translate(String providerId, RestClientException ex) {
        if (ex instanceof RestClientResponseException responseException) {
            HttpStatusCode status = responseException.getStatusCode();
            String message = "HTTP " + status.value();
            if (status.value() == 401 || status.value() == 403) {
                return new ProviderPermanentException(providerId, message + " (credentials rejected)", ex);
            }
            if (status.value() == 429 || status.is5xxServerError() || status.value() == 408) {
                return new ProviderTransientException(providerId, message, ex);
            }
            return new ProviderPermanentException(providerId, message, ex);
        }
        if (ex instanceof ResourceAccessException) {
            return new ProviderTransientException(providerId, "I/O error: " + ex.getMessage(), ex);
        }
        return new ProviderTransientException(providerId, "malformed response: " + ex.getMessage(), ex);
    }

    static ProviderTransientException malformed(String providerId, String detail) {
        return new ProviderTransientException(providerId, "malformed response: " + detail);
    }
}
