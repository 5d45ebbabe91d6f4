package com.docintegrity.analysis.service.plagiarism;

import com.docintegrity.analysis.client.ProviderException;
import com.docintegrity.analysis.client.ProviderPermanentException;
import com.docintegrity.analysis.client.SearchProvider;
import com.docintegrity.analysis.domain.Chunk;
import com.docintegrity.analysis.domain.SearchHit;
import com.docintegrity.analysis.service.support.ProviderCallRunner;
import com.docintegrity.analysis.service.support.TimeBudget;
import com.docintegrity.analysis.service.text.SentenceSplitter;
import com.docintegrity.analysis.service.text.TextStatistics;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SourceSearcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceSearcher.class);

    private final SearchProvider provider;
    private final ProviderCallRunner callRunner;
    private final ExecutorService executor;
    private final int maxChunks;
    private final int fanOut;
    private final int resultsPerChunk;
    private final int queryMaxWords;
    private final boolean exactPhrase;

    public SourceSearcher(
        SearchProvider provider,
        ProviderCallRunner callRunner,
        ExecutorService executor,
        int maxChunks,
        int fanOut,
        int resultsPerChunk,
        int queryMaxWords,
        boolean exactPhrase
    ) {
        this.provider = provider;
        this.callRunner = callRunner;
        this.executor = executor;
        this.maxChunks = Math.max(1, maxChunks);
        this.fanOut = Math.max(1, fanOut);
        this.resultsPerChunk = Math.max(1, resultsPerChunk);
        this.queryMaxWords = Math.max(1, queryMaxWords);
        this.exactPhrase = exactPhrase;
    }

    public boolean isConfigured() {
        return provider != null;
    }

    /**
     * Starts the searches and returns immediately. At most {@code fanOut} pool threads work through
     * the sampled chunks in order, so a request never holds more threads than searches in flight.
     */
    public SearchRound start(List<Chunk> sampled, TimeBudget budget) {
        if (provider == null || sampled.isEmpty()) {
            return SearchRound.empty();
        }
        AtomicBoolean abandoned = new AtomicBoolean();
        AtomicBoolean providerDisabled = new AtomicBoolean();
        AtomicInteger nextChunk = new AtomicInteger();

        List<CompletableFuture<ChunkSearchOutcome>> searches = new ArrayList<>(sampled.size());
        for (int i = 0; i < sampled.size(); i++) {
            searches.add(new CompletableFuture<>());
        }
        int workers = Math.min(fanOut, sampled.size());
        for (int i = 0; i < workers; i++) {
            executor.execute(() -> drain(sampled, searches, nextChunk, budget, abandoned, providerDisabled));
        }
        return new SearchRound(sampled, searches, abandoned);
    }

    public List<Chunk> sample(List<Chunk> chunks) {
        if (chunks.size() <= maxChunks) {
            return List.copyOf(chunks);
        }
        if (maxChunks == 1) {
            return List.of(chunks.get(0));
        }
        Set<Chunk> picked = new LinkedHashSet<>();
        double step = (double) (chunks.size() - 1) / (maxChunks - 1);
        for (int i = 0; i < maxChunks; i++) {
            picked.add(chunks.get((int) Math.round(i * step)));
        }
        return List.copyOf(picked);
    }

    public String query(Chunk chunk) {
        String text = chunk.text().strip();
        String longest = SentenceSplitter.sentences(text).stream()
            .max(Comparator.comparingInt(String::length))
            .orElse(text);
        List<String> words = TextStatistics.words(longest.replace("\"", " "));
        String excerpt = String.join(" ", words.subList(0, Math.min(words.size(), queryMaxWords)));
        return exactPhrase ? "\"" + excerpt + "\"" : excerpt;
    }

    private void drain(
        List<Chunk> sampled,
        List<CompletableFuture<ChunkSearchOutcome>> searches,
        AtomicInteger nextChunk,
        TimeBudget budget,
        AtomicBoolean abandoned,
        AtomicBoolean providerDisabled
    ) {
        int index;
        while ((index = nextChunk.getAndIncrement()) < sampled.size()) {
            Chunk chunk = sampled.get(index);
            CompletableFuture<ChunkSearchOutcome> search = searches.get(index);
            try {
                search.complete(searchOrSkip(chunk, budget, abandoned, providerDisabled));
            } catch (RuntimeException ex) {
                LOGGER.warn("Search for chunk {} failed unexpectedly", chunk.index(), ex);
                search.completeExceptionally(ex);
            }
        }
    }

    private ChunkSearchOutcome searchOrSkip(
        Chunk chunk,
        TimeBudget budget,
        AtomicBoolean abandoned,
        AtomicBoolean providerDisabled
    ) {
        if (Thread.currentThread().isInterrupted()) {
            return ChunkSearchOutcome.failed(chunk, "interrupted while waiting to search");
        }
        if (abandoned.get() || budget.exhausted()) {
            return ChunkSearchOutcome.failed(chunk, "request budget exhausted");
        }
        if (providerDisabled.get()) {
            return ChunkSearchOutcome.failed(chunk, provider.id() + ": unavailable for this request");
        }
        return search(chunk, budget, providerDisabled);
    }

    private ChunkSearchOutcome search(Chunk chunk, TimeBudget budget, AtomicBoolean providerDisabled) {
        String query = query(chunk);
        try {
            List<SearchHit> hits = callRunner.callWithRetry(
                provider.id(),
                () -> provider.search(query, resultsPerChunk),
                budget
            );
            List<SearchHit> limited = hits.size() <= resultsPerChunk ? hits : hits.subList(0, resultsPerChunk);
            LOGGER.debug("Chunk {} search returned {} hit(s)", chunk.index(), limited.size());
            return ChunkSearchOutcome.searched(chunk, limited);
        } catch (ProviderPermanentException ex) {
            providerDisabled.set(true);
            LOGGER.warn("Search provider unavailable for this request: {}", ex.getMessage());
            return ChunkSearchOutcome.failed(chunk, ex.getMessage());
        } catch (ProviderException ex) {
            LOGGER.warn("Search error for chunk {}: {}", chunk.index(), ex.getMessage());
            return ChunkSearchOutcome.failed(chunk, ex.getMessage());
        }
    }
}
