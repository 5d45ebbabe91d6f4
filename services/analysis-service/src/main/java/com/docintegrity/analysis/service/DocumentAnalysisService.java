package com.docintegrity.analysis.service;

import com.docintegrity.analysis.domain.AiDetectionResult;
import com.docintegrity.analysis.domain.AnalysisInput;
import com.docintegrity.analysis.domain.AnalysisOptions;
import com.docintegrity.analysis.domain.AnalysisReport;
import com.docintegrity.analysis.domain.Chunk;
import com.docintegrity.analysis.domain.ClassifierOutcome;
import com.docintegrity.analysis.domain.Document;
import com.docintegrity.analysis.domain.PlagiarismResult;
import com.docintegrity.analysis.domain.TextMetrics;
import com.docintegrity.analysis.domain.Verdict;
import com.docintegrity.analysis.service.cache.ReportCache;
import com.docintegrity.analysis.service.detection.AiDetectionScorer;
import com.docintegrity.analysis.service.detection.ClassifierGateway;
import com.docintegrity.analysis.service.detection.HeuristicScore;
import com.docintegrity.analysis.service.detection.HeuristicScorer;
import com.docintegrity.analysis.service.extraction.TextExtractor;
import com.docintegrity.analysis.service.plagiarism.Chunker;
import com.docintegrity.analysis.service.plagiarism.SearchRound;
import com.docintegrity.analysis.service.plagiarism.SimilarityScorer;
import com.docintegrity.analysis.service.plagiarism.SourceSearcher;
import com.docintegrity.analysis.service.support.TimeBudget;
import com.docintegrity.analysis.service.text.ContentFingerprint;
import com.docintegrity.analysis.service.text.TextNormalizer;
import com.docintegrity.analysis.service.text.TextStatistics;
import com.docintegrity.analysis.service.verdict.VerdictFusion;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

public class DocumentAnalysisService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentAnalysisService.class);

    static final String MDC_FINGERPRINT = "fingerprint";

    private final TextExtractor textExtractor;
    private final TextStatistics textStatistics;
    private final HeuristicScorer heuristicScorer;
    private final ClassifierGateway classifierGateway;
    private final AiDetectionScorer aiDetectionScorer;
    private final Chunker chunker;
    private final SourceSearcher sourceSearcher;
    private final SimilarityScorer similarityScorer;
    private final VerdictFusion verdictFusion;
    private final ReportCache reportCache;
    private final ExecutorService pipelineExecutor;
    private final Clock clock;
    private final Duration requestTimeout;

    public DocumentAnalysisService(
        TextExtractor textExtractor,
        TextStatistics textStatistics,
        HeuristicScorer heuristicScorer,
        ClassifierGateway classifierGateway,
        AiDetectionScorer aiDetectionScorer,
        Chunker chunker,
        SourceSearcher sourceSearcher,
        SimilarityScorer similarityScorer,
        VerdictFusion verdictFusion,
        ReportCache reportCache,
        ExecutorService pipelineExecutor,
        Clock clock,
        Duration requestTimeout
    ) {
        this.textExtractor = textExtractor;
        this.textStatistics = textStatistics;
        this.heuristicScorer = heuristicScorer;
        this.classifierGateway = classifierGateway;
        this.aiDetectionScorer = aiDetectionScorer;
        this.chunker = chunker;
        this.sourceSearcher = sourceSearcher;
        this.similarityScorer = similarityScorer;
        this.verdictFusion = verdictFusion;
        this.reportCache = reportCache;
        this.pipelineExecutor = pipelineExecutor;
        this.clock = clock;
        this.requestTimeout = requestTimeout;
    }

    public AnalysisReport analyze(AnalysisInput input, AnalysisOptions options) {
        String raw = input.hasText() ? input.text() : textExtractor.extract(input.bytes(), input.sourceName());
        String text = TextNormalizer.normalize(raw);
        TextMetrics metrics = textStatistics.compute(text);
        String fingerprint = ContentFingerprint.of(text);

        MDC.put(MDC_FINGERPRINT, fingerprint.substring(0, 12));
        try {
            if (!options.bypassCache()) {
                Optional<AnalysisReport> cached = reportCache.get(fingerprint);
                if (cached.isPresent()) {
                    LOGGER.info("Returning cached report for {}", input.sourceName());
                    return cached.get();
                }
            }

            Document document = new Document(
                text,
                metrics.totalWords(),
                metrics.totalCharacters(),
                metrics.totalSentences(),
                input.sourceName(),
                fingerprint
            );
            AnalysisReport report = run(document, metrics);
            reportCache.put(report);
            return report;
        } finally {
            MDC.remove(MDC_FINGERPRINT);
        }
    }

    public Optional<AnalysisReport> getCachedReport(String fingerprint) {
        return reportCache.get(fingerprint);
    }

    private AnalysisReport run(Document document, TextMetrics metrics) {
        TimeBudget budget = TimeBudget.start(requestTimeout);
        LOGGER.info("Analyzing {} ({} words, {} sentences)", document.sourceName(), document.wordCount(), document.sentenceCount());

        HeuristicScore heuristic = heuristicScorer.score(metrics);
        List<Chunk> chunks = chunker.split(document.text());

        CompletableFuture<ClassifierOutcome> classification = classify(document.text(), budget);
        List<Chunk> sampled = sourceSearcher.isConfigured() ? sourceSearcher.sample(chunks) : List.of();
        SearchRound searches = sourceSearcher.start(sampled, budget);

        boolean timedOut = awaitBranches(classification, searches, budget);
        if (timedOut) {
            searches.abandon();
        }

        ClassifierOutcome outcome = classification.isDone() ? classification.join() : null;
        if (timedOut && outcome == null && sourceSearcher.isConfigured() && !searches.anyFinished()) {
            classification.cancel(true);
            LOGGER.error("Neither AI detection nor plagiarism search finished within {} ms", budget.total().toMillis());
            throw new PipelineTimeoutException(budget.total());
        }

        AiDetectionResult aiDetection;
        if (outcome != null) {
            aiDetection = aiDetectionScorer.score(metrics, heuristic, outcome);
        } else {
            classification.cancel(true);
            LOGGER.warn("Classifier chain unfinished after {} ms, reporting heuristic score with low confidence", budget.total().toMillis());
            aiDetection = aiDetectionScorer.incomplete(metrics, heuristic, new ClassifierOutcome.Unavailable(
                List.of("classifier chain did not finish within the request budget")));
        }

        PlagiarismResult plagiarism = plagiarism(chunks, sampled, searches);
        Verdict verdict = verdictFusion.fuse(aiDetection, plagiarism);

        LOGGER.info("Analysis finished: ai={} ({}), plagiarism={}, risk={}",
            aiDetection.probability(), aiDetection.source(), plagiarism.score(), verdict.riskLevel());
        return new AnalysisReport(
            document.fingerprint(),
            document.sourceName(),
            clock.instant(),
            metrics,
            aiDetection,
            plagiarism,
            verdict
        );
    }

    private CompletableFuture<ClassifierOutcome> classify(String text, TimeBudget budget) {
        if (!classifierGateway.hasProviders()) {
            return CompletableFuture.completedFuture(
                new ClassifierOutcome.Unavailable(List.of("no classifier providers configured")));
        }
        return CompletableFuture
            .supplyAsync(() -> classifierGateway.classify(text, budget), pipelineExecutor)
            .exceptionally(ex -> {
                LOGGER.error("Classifier gateway failed unexpectedly", ex);
                return new ClassifierOutcome.Unavailable(List.of("classifier gateway error: " + ex.getMessage()));
            });
    }

    private boolean awaitBranches(CompletableFuture<ClassifierOutcome> classification, SearchRound searches, TimeBudget budget) {
        try {
            CompletableFuture.allOf(classification, searches.completion())
                .get(budget.remaining().toMillis(), TimeUnit.MILLISECONDS);
            return false;
        } catch (TimeoutException ex) {
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return true;
        } catch (ExecutionException ex) {
            LOGGER.error("Analysis branch failed unexpectedly, continuing with finished work", ex.getCause());
            return !classification.isDone() || !searches.isDone();
        }
    }

    private PlagiarismResult plagiarism(List<Chunk> chunks, List<Chunk> sampled, SearchRound searches) {
        if (!sourceSearcher.isConfigured()) {
            return PlagiarismResult.notChecked(chunks.size(), "search provider not configured");
        }
        boolean complete = searches.isDone();
        String note;
        if (!complete) {
            note = "search incomplete: request budget elapsed";
        } else if (sampled.size() < chunks.size()) {
            note = "searched " + sampled.size() + " of " + chunks.size() + " chunks";
        } else {
            note = null;
        }
        return similarityScorer.aggregate(chunks.size(), searches.outcomes(), complete, note);
    }
}
