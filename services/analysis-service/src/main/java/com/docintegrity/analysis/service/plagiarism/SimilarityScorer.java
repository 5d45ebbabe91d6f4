package com.docintegrity.analysis.service.plagiarism;

import com.docintegrity.analysis.domain.PlagiarismResult;
import com.docintegrity.analysis.domain.SearchHit;
import com.docintegrity.analysis.domain.SourceMatch;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SimilarityScorer {

    private static final Comparator<SourceMatch> RANKING = Comparator
        .comparingDouble(SourceMatch::similarity).reversed()
        .thenComparingInt(SourceMatch::chunkIndex);

    private final SimilarityMetric metric;
    private final double minRelevance;
    private final int maxSources;

    public SimilarityScorer(SimilarityMetric metric, double minRelevance, int maxSources) {
        this.metric = metric;
        this.minRelevance = minRelevance;
        this.maxSources = Math.max(1, maxSources);
    }

    public double similarity(String first, String second) {
        return metric.score(first, second);
    }

    /**
     * Aggregates finished chunk searches.
     *
     * <p>The score is the character-length weighted mean of every finished chunk's best similarity,
     * where chunks without a match above {@code minRelevance} (or whose search failed) count as 0.
     * Pending chunks are left out of the mean.</p>
     */
    public PlagiarismResult aggregate(int chunksTotal, List<ChunkSearchOutcome> outcomes, boolean complete, String note) {
        List<SourceMatch> best = new ArrayList<>();
        double weightedSum = 0.0;
        long totalWeight = 0;
        int checked = 0;
        int failed = 0;

        for (ChunkSearchOutcome outcome : outcomes) {
            if (!outcome.finished()) {
                continue;
            }
            totalWeight += outcome.chunk().length();
            if (outcome.status() == ChunkSearchOutcome.Status.FAILED) {
                failed++;
                continue;
            }
            checked++;
            SourceMatch match = bestMatch(outcome);
            if (match != null) {
                best.add(match);
                weightedSum += match.similarity() * outcome.chunk().length();
            }
        }

        double score = totalWeight == 0 ? 0.0 : Math.round(weightedSum / totalWeight * 100.0) / 100.0;
        return new PlagiarismResult(score, rankSources(best), chunksTotal, checked, failed, complete, note);
    }

    private SourceMatch bestMatch(ChunkSearchOutcome outcome) {
        SourceMatch best = null;
        String chunkText = outcome.chunk().text();
        for (SearchHit hit : outcome.hits()) {
            double similarity = metric.score(chunkText, hit.snippet());
            if (similarity < minRelevance) {
                continue;
            }
            if (best == null || similarity > best.similarity()) {
                best = new SourceMatch(hit.title(), hit.url(), hit.snippet(), similarity, outcome.chunk().index());
            }
        }
        return best;
    }

    private List<SourceMatch> rankSources(List<SourceMatch> matches) {
        Map<String, SourceMatch> byUrl = new LinkedHashMap<>();
        for (SourceMatch match : matches) {
            byUrl.merge(match.url(), match, (kept, candidate) -> RANKING.compare(candidate, kept) < 0 ? candidate : kept);
        }
        return byUrl.values().stream()
            .sorted(RANKING)
            .limit(maxSources)
            .toList();
    }
}
