package com.docintegrity.analysis.client;

public class ProviderTransientException extends ProviderException {

    public ProviderTransientException(String providerId, String message) {
        super(providerId, message, null);
    }

    public ProviderTransientException(String providerId, String message, Throwable cause) {
        super(providerId, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
