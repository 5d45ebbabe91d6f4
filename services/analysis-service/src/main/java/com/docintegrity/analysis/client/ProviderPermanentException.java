package com.docintegrity.analysis.client;

public class ProviderPermanentException extends ProviderException {

    public ProviderPermanentException(String providerId, String message) {
        super(providerId, message, null);
    }

    public ProviderPermanentException(String providerId, String message, Throwable cause) {
        super(providerId, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
