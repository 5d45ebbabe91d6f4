package com.docintegrity.analysis.service.plagiarism;

import com.docintegrity.analysis.domain.Chunk;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The in-flight chunk searches of one request. Outcomes can be read at any time; chunks whose
 * search has not finished are reported as pending.
 */
public class SearchRound {

    private final List<Chunk> chunks;
    private final List<CompletableFuture<ChunkSearchOutcome>> searches;
    private final AtomicBoolean abandoned;

    SearchRound(List<Chunk> chunks, List<CompletableFuture<ChunkSearchOutcome>> searches, AtomicBoolean abandoned) {
        this.chunks = List.copyOf(chunks);
        this.searches = List.copyOf(searches);
        this.abandoned = abandoned;
    }

    static SearchRound empty() {
        return new SearchRound(List.of(), List.of(), new AtomicBoolean());
    }

    public CompletableFuture<Void> completion() {
        return CompletableFuture.allOf(searches.toArray(new CompletableFuture[0]));
    }

    public boolean isDone() {
        return searches.stream().allMatch(CompletableFuture::isDone);
    }

    public boolean anyFinished() {
        return searches.stream().anyMatch(CompletableFuture::isDone);
    }

    public List<ChunkSearchOutcome> outcomes() {
        List<ChunkSearchOutcome> outcomes = new ArrayList<>(searches.size());
        for (int i = 0; i < searches.size(); i++) {
            CompletableFuture<ChunkSearchOutcome> search = searches.get(i);
            outcomes.add(search.isDone() && !search.isCompletedExceptionally()
                ? search.join()
                : ChunkSearchOutcome.pending(chunks.get(i)));
        }
        return outcomes;
    }

    public void abandon() {
        abandoned.set(true);
    }
}
