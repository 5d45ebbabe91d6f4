package com.docintegrity.analysis.testing;

import com.docintegrity.analysis.client.ProviderPermanentException;
import com.docintegrity.analysis.client.ProviderTransientException;
import com.docintegrity.analysis.client.SearchProvider;
import com.docintegrity.analysis.domain.SearchHit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory "web": a query matches every page whose snippet contains the unquoted query text.
 */
public class StubSearchProvider implements SearchProvider {

    private final List<SearchHit> pages = new ArrayList<>();
    private final List<String> queries = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile String failTransientlyOn;
    private volatile boolean failPermanently;
    private volatile CountDownLatch blockUntil;
    private volatile long delayMillis;

    public StubSearchProvider page(String title, String url, String snippet) {
        pages.add(new SearchHit(title, url, snippet));
        return this;
    }

    public StubSearchProvider failTransientlyOn(String queryFragment) {
        this.failTransientlyOn = queryFragment;
        return this;
    }

    public StubSearchProvider failPermanently() {
        this.failPermanently = true;
        return this;
    }

    public StubSearchProvider blockUntil(CountDownLatch release) {
        this.blockUntil = release;
        return this;
    }

    public StubSearchProvider delay(long millis) {
        this.delayMillis = millis;
        return this;
    }

    public List<String> queries() {
        return List.copyOf(queries);
    }

    public int maxConcurrentCalls() {
        return maxInFlight.get();
    }

    @Override
    public String id() {
        return "stub-search";
    }

    @Override
    public List<SearchHit> search(String query, int maxResults) {
        queries.add(query);
        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        try {
            pause();
            if (failPermanently) {
                throw new ProviderPermanentException(id(), "HTTP 403 (credentials rejected)");
            }
            if (failTransientlyOn != null && query.contains(failTransientlyOn)) {
                throw new ProviderTransientException(id(), "HTTP 500");
            }
            String phrase = query.replace("\"", "");
            return pages.stream()
                .filter(page -> page.snippet().contains(phrase))
                .limit(maxResults)
                .toList();
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void pause() {
        try {
            if (blockUntil != null) {
                blockUntil.await();
            }
            if (delayMillis > 0) {
                Thread.sleep(delayMillis);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ProviderTransientException(id(), "interrupted");
        }
    }
}
