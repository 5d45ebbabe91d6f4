package com.docintegrity.analysis.client;

public abstract class ProviderException extends RuntimeException {

    private final String providerId;

    protected ProviderException(String providerId, String message, Throwable cause) {
        super(providerId + ": " + message, cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }

    public abstract boolean isRetryable();
}
