package com.docintegrity.analysis.testing;

import com.docintegrity.analysis.client.ClassifierProvider;
import com.docintegrity.analysis.client.ClassifierVerdict;
import com.docintegrity.analysis.client.ProviderPermanentException;
import com.docintegrity.analysis.client.ProviderTransientException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Scripted classifier. Each call takes the next scripted behaviour; the last one repeats.
 */
public class StubClassifier implements ClassifierProvider {

    private final String id;
    private final Deque<Function<String, ClassifierVerdict>> script = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile String lastExcerpt;

    private StubClassifier(String id) {
        this.id = id;
    }

    public static StubClassifier named(String id) {
        return new StubClassifier(id);
    }

    public StubClassifier answers(double probability) {
        script.add(excerpt -> new ClassifierVerdict(probability, probability > 50 ? "ai" : "human", null));
        return this;
    }

    public StubClassifier failsTransiently() {
        script.add(excerpt -> {
            throw new ProviderTransientException(id, "HTTP 503");
        });
        return this;
    }

    public StubClassifier failsPermanently() {
        script.add(excerpt -> {
            throw new ProviderPermanentException(id, "HTTP 401 (credentials rejected)");
        });
        return this;
    }

    public StubClassifier blocksUntil(CountDownLatch release) {
        script.add(excerpt -> {
            try {
                release.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new ProviderTransientException(id, "interrupted");
            }
            throw new ProviderTransientException(id, "released without answer");
        });
        return this;
    }

    public int calls() {
        return calls.get();
    }

    public String lastExcerpt() {
        return lastExcerpt;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public ClassifierVerdict classify(String excerpt) {
        calls.incrementAndGet();
        lastExcerpt = excerpt;
        Function<String, ClassifierVerdict> next;
        synchronized (script) {
            next = script.size() > 1 ? script.poll() : script.peek();
        }
        if (next == null) {
            throw new IllegalStateException("No behaviour scripted for " + id);
        }
        return next.apply(excerpt);
    }
}
