package com.docintegrity.analysis.config;

import com.docintegrity.analysis.client.ProviderRegistry;
import com.docintegrity.analysis.service.DocumentAnalysisService;
import com.docintegrity.analysis.service.cache.ReportCache;
import com.docintegrity.analysis.service.detection.AiDetectionScorer;
import com.docintegrity.analysis.service.detection.ClassifierGateway;
import com.docintegrity.analysis.service.detection.HeuristicScorer;
import com.docintegrity.analysis.service.detection.HeuristicSettings;
import com.docintegrity.analysis.service.extraction.PdfTextExtractor;
import com.docintegrity.analysis.service.extraction.TextExtractor;
import com.docintegrity.analysis.service.plagiarism.Chunker;
import com.docintegrity.analysis.service.plagiarism.ShingleOverlapMetric;
import com.docintegrity.analysis.service.plagiarism.SimilarityMetric;
import com.docintegrity.analysis.service.plagiarism.SimilarityScorer;
import com.docintegrity.analysis.service.plagiarism.SourceSearcher;
import com.docintegrity.analysis.service.support.ProviderCallRunner;
import com.docintegrity.analysis.service.text.TextStatistics;
import com.docintegrity.analysis.service.verdict.ScoringThresholds;
import com.docintegrity.analysis.service.verdict.VerdictFusion;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PipelineConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    ScoringThresholds scoringThresholds(AnalysisProperties properties) {
        AnalysisProperties.Thresholds t = properties.getThresholds();
        return new ScoringThresholds(
            t.getAiLikelyAbove(),
            t.getHumanAtOrBelow(),
            t.getHighRiskAi(),
            t.getHighRiskPlagiarism(),
            t.getMediumRiskAi(),
            t.getMediumRiskPlagiarism(),
            t.getPlagiarizedAbove()
        );
    }

    @Bean
    HeuristicScorer heuristicScorer(AnalysisProperties properties) {
        AnalysisProperties.Heuristic h = properties.getHeuristic();
        return new HeuristicScorer(new HeuristicSettings(
            h.getUniformityWeight(),
            h.getRepetitionWeight(),
            h.getSmoothnessWeight(),
            h.getVarianceFullAt(),
            h.getVarianceZeroAt(),
            h.getUniqueRatioFullAt(),
            h.getUniqueRatioZeroAt(),
            h.getReadabilityDeviationFullAt(),
            h.getReadabilityDeviationZeroAt()
        ));
    }

    @Bean
    ProviderCallRunner providerCallRunner(
        @Qualifier("providerExecutor") ExecutorService providerExecutor,
        AnalysisProperties properties
    ) {
        return new ProviderCallRunner(providerExecutor, properties.getProviderTimeout());
    }

    @Bean
    ClassifierGateway classifierGateway(ProviderRegistry registry, ProviderCallRunner callRunner, AnalysisProperties properties) {
        return new ClassifierGateway(
            registry.classifiers(),
            callRunner,
            properties.getClassifier().getExcerptChars(),
            properties.getClassifier().isCorroborate()
        );
    }

    @Bean
    AiDetectionScorer aiDetectionScorer(ScoringThresholds thresholds, AnalysisProperties properties) {
        return new AiDetectionScorer(
            thresholds,
            properties.getClassifier().getWeight(),
            properties.getClassifier().getAgreementTolerance(),
            properties.getMinSentencesForConfidence()
        );
    }

    @Bean
    SourceSearcher sourceSearcher(
        ProviderRegistry registry,
        ProviderCallRunner callRunner,
        @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor,
        AnalysisProperties properties
    ) {
        AnalysisProperties.Search search = properties.getSearch();
        return new SourceSearcher(
            registry.search().orElse(null),
            callRunner,
            pipelineExecutor,
            properties.getMaxChunksSearched(),
            search.getFanOut(),
            search.getResultsPerChunk(),
            search.getQueryMaxWords(),
            search.isExactPhrase()
        );
    }

    @Bean
    SimilarityMetric similarityMetric(AnalysisProperties properties) {
        return new ShingleOverlapMetric(
            properties.getSimilarity().getShingleSize(),
            properties.getSimilarity().getMinShingles()
        );
    }

    @Bean
    SimilarityScorer similarityScorer(SimilarityMetric similarityMetric, AnalysisProperties properties) {
        return new SimilarityScorer(
            similarityMetric,
            properties.getSimilarity().getMinRelevance(),
            properties.getSimilarity().getMaxSources()
        );
    }

    @Bean
    ReportCache reportCache(AnalysisProperties properties) {
        return new ReportCache(properties.getCache().getTtl(), properties.getCache().getMaxEntries(), Ticker.systemTicker());
    }

    @Bean
    TextExtractor textExtractor() {
        return new PdfTextExtractor();
    }

    @Bean
    DocumentAnalysisService documentAnalysisService(
        TextExtractor textExtractor,
        HeuristicScorer heuristicScorer,
        ClassifierGateway classifierGateway,
        AiDetectionScorer aiDetectionScorer,
        SourceSearcher sourceSearcher,
        SimilarityScorer similarityScorer,
        ScoringThresholds thresholds,
        ReportCache reportCache,
        @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor,
        Clock clock,
        AnalysisProperties properties
    ) {
        return new DocumentAnalysisService(
            textExtractor,
            new TextStatistics(properties.getMinWords()),
            heuristicScorer,
            classifierGateway,
            aiDetectionScorer,
            new Chunker(properties.getMinChunkChars(), properties.getMaxChunkChars()),
            sourceSearcher,
            similarityScorer,
            new VerdictFusion(thresholds),
            reportCache,
            pipelineExecutor,
            clock,
            properties.getRequestTimeout()
        );
    }
}
