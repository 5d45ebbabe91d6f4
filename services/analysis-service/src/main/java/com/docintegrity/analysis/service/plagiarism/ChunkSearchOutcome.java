package com.docintegrity.analysis.service.plagiarism;

import com.docintegrity.analysis.domain.Chunk;
import com.docintegrity.analysis.domain.SearchHit;
import java.util.List;

public record ChunkSearchOutcome(Chunk chunk, Status status, List<SearchHit> hits, String error) {

    public enum Status {
        SEARCHED,
        FAILED,
        PENDING
    }

    public ChunkSearchOutcome {
        hits = List.copyOf(hits);
    }

    public static ChunkSearchOutcome searched(Chunk chunk, List<SearchHit> hits) {
        return new ChunkSearchOutcome(chunk, Status.SEARCHED, hits, null);
    }

    public static ChunkSearchOutcome failed(Chunk chunk, String error) {
        return new ChunkSearchOutcome(chunk, Status.FAILED, List.of(), error);
    }

    public static ChunkSearchOutcome pending(Chunk chunk) {
        return new ChunkSearchOutcome(chunk, Status.PENDING, List.of(), null);
    }

    public boolean finished() {
        return status != Status.PENDING;
    }
}
