package com.docintegrity.analysis.service.support;

import com.docintegrity.analysis.client.ProviderException;
import com.docintegrity.analysis.client.ProviderTransientException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ProviderCallRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProviderCallRunner.class);

    private final ExecutorService providerExecutor;
    private final Duration callTimeout;

    public ProviderCallRunner(ExecutorService providerExecutor, Duration callTimeout) {
        this.providerExecutor = providerExecutor;
        this.callTimeout = callTimeout;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public <T> T call(String providerId, Callable<T> call, TimeBudget budget) {
        if (budget.exhausted()) {
            throw new ProviderTransientException(providerId, "request budget exhausted before call");
        }
        long timeoutMs = callTimeout.toMillis();

        Future<T> future = providerExecutor.submit(call);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new ProviderTransientException(providerId, "timed out after " + timeoutMs + " ms", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof ProviderException providerException) {
                throw providerException;
            }
            throw new ProviderTransientException(providerId, "unexpected failure: " + cause, cause);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderTransientException(providerId, "interrupted", ex);
        }
    }

    public <T> T callWithRetry(String providerId, Callable<T> call, TimeBudget budget) {
        try {
            return call(providerId, call, budget);
        } catch (ProviderTransientException first) {
            if (budget.exhausted() || Thread.currentThread().isInterrupted()) {
                throw first;
            }
            LOGGER.debug("Retrying {} after transient failure: {}", providerId, first.getMessage());
            return call(providerId, call, budget);
        }
    }
}
