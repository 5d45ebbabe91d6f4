package com.docintegrity.analysis.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {

    private int minWords = 50;
    private int minSentencesForConfidence = 5;
    private int minChunkChars = 120;
    private int maxChunkChars = 320;
    private int maxChunksSearched = 5;
    private Duration providerTimeout = Duration.ofSeconds(10);
    private Duration requestTimeout = Duration.ofSeconds(60);
    private final Thresholds thresholds = new Thresholds();
    private final Classifier classifier = new Classifier();
    private final Heuristic heuristic = new Heuristic();
    private final Search search = new Search();
    private final Similarity similarity = new Similarity();
    private final Cache cache = new Cache();

    public int getMinWords() {
        return minWords;
    }

    public void setMinWords(int minWords) {
        this.minWords = minWords;
    }

    public int getMinSentencesForConfidence() {
        return minSentencesForConfidence;
    }

    public void setMinSentencesForConfidence(int minSentencesForConfidence) {
        this.minSentencesForConfidence = minSentencesForConfidence;
    }

    public int getMinChunkChars() {
        return minChunkChars;
    }

    public void setMinChunkChars(int minChunkChars) {
        this.minChunkChars = minChunkChars;
    }

    public int getMaxChunkChars() {
        return maxChunkChars;
    }

    public void setMaxChunkChars(int maxChunkChars) {
        this.maxChunkChars = maxChunkChars;
    }

    public int getMaxChunksSearched() {
        return maxChunksSearched;
    }

    public void setMaxChunksSearched(int maxChunksSearched) {
        this.maxChunksSearched = maxChunksSearched;
    }

    public Duration getProviderTimeout() {
        return providerTimeout;
    }

    public void setProviderTimeout(Duration providerTimeout) {
        this.providerTimeout = providerTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Thresholds getThresholds() {
        return thresholds;
    }

    public Classifier getClassifier() {
        return classifier;
    }

    public Heuristic getHeuristic() {
        return heuristic;
    }

    public Search getSearch() {
        return search;
    }

    public Similarity getSimilarity() {
        return similarity;
    }

    public Cache getCache() {
        return cache;
    }

    public static class Thresholds {

        private double aiLikelyAbove = 60;
        private double humanAtOrBelow = 40;
        private double highRiskAi = 60;
        private double highRiskPlagiarism = 50;
        private double mediumRiskAi = 40;
        private double mediumRiskPlagiarism = 30;
        private double plagiarizedAbove = 30;

        public double getAiLikelyAbove() {
            return aiLikelyAbove;
        }

        public void setAiLikelyAbove(double aiLikelyAbove) {
            this.aiLikelyAbove = aiLikelyAbove;
        }

        public double getHumanAtOrBelow() {
            return humanAtOrBelow;
        }

        public void setHumanAtOrBelow(double humanAtOrBelow) {
            this.humanAtOrBelow = humanAtOrBelow;
        }

        public double getHighRiskAi() {
            return highRiskAi;
        }

        public void setHighRiskAi(double highRiskAi) {
            this.highRiskAi = highRiskAi;
        }

        public double getHighRiskPlagiarism() {
            return highRiskPlagiarism;
        }

        public void setHighRiskPlagiarism(double highRiskPlagiarism) {
            this.highRiskPlagiarism = highRiskPlagiarism;
        }

        public double getMediumRiskAi() {
            return mediumRiskAi;
        }

        public void setMediumRiskAi(double mediumRiskAi) {
            this.mediumRiskAi = mediumRiskAi;
        }

        public double getMediumRiskPlagiarism() {
            return mediumRiskPlagiarism;
        }

        public void setMediumRiskPlagiarism(double mediumRiskPlagiarism) {
            this.mediumRiskPlagiarism = mediumRiskPlagiarism;
        }

        public double getPlagiarizedAbove() {
            return plagiarizedAbove;
        }

        public void setPlagiarizedAbove(double plagiarizedAbove) {
            this.plagiarizedAbove = plagiarizedAbove;
        }
    }

    public static class Classifier {

        private double weight = 0.7;
        private double agreementTolerance = 20;
        private int excerptChars = 2000;
        private boolean corroborate = false;

        public double getWeight() {
            return weight;
        }

        public void setWeight(double weight) {
            this.weight = weight;
        }

        public double getAgreementTolerance() {
            return agreementTolerance;
        }

        public void setAgreementTolerance(double agreementTolerance) {
            this.agreementTolerance = agreementTolerance;
        }

        public int getExcerptChars() {
            return excerptChars;
        }

        public void setExcerptChars(int excerptChars) {
            this.excerptChars = excerptChars;
        }

        public boolean isCorroborate() {
            return corroborate;
        }

        public void setCorroborate(boolean corroborate) {
            this.corroborate = corroborate;
        }
    }

    public static class Heuristic {

        private double uniformityWeight = 0.35;
        private double repetitionWeight = 0.30;
        private double smoothnessWeight = 0.35;
        private double varianceFullAt = 10;
        private double varianceZeroAt = 40;
        private double uniqueRatioFullAt = 0.45;
        private double uniqueRatioZeroAt = 0.72;
        private double readabilityDeviationFullAt = 6;
        private double readabilityDeviationZeroAt = 20;

        public double getUniformityWeight() {
            return uniformityWeight;
        }

        public void setUniformityWeight(double uniformityWeight) {
            this.uniformityWeight = uniformityWeight;
        }

        public double getRepetitionWeight() {
            return repetitionWeight;
        }

        public void setRepetitionWeight(double repetitionWeight) {
            this.repetitionWeight = repetitionWeight;
        }

        public double getSmoothnessWeight() {
            return smoothnessWeight;
        }

        public void setSmoothnessWeight(double smoothnessWeight) {
            this.smoothnessWeight = smoothnessWeight;
        }

        public double getVarianceFullAt() {
            return varianceFullAt;
        }

        public void setVarianceFullAt(double varianceFullAt) {
            this.varianceFullAt = varianceFullAt;
        }

        public double getVarianceZeroAt() {
            return varianceZeroAt;
        }

        public void setVarianceZeroAt(double varianceZeroAt) {
            this.varianceZeroAt = varianceZeroAt;
        }

        public double getUniqueRatioFullAt() {
            return uniqueRatioFullAt;
        }

        public void setUniqueRatioFullAt(double uniqueRatioFullAt) {
            this.uniqueRatioFullAt = uniqueRatioFullAt;
        }

        public double getUniqueRatioZeroAt() {
            return uniqueRatioZeroAt;
        }

        public void setUniqueRatioZeroAt(double uniqueRatioZeroAt) {
            this.uniqueRatioZeroAt = uniqueRatioZeroAt;
        }

        public double getReadabilityDeviationFullAt() {
            return readabilityDeviationFullAt;
        }

        public void setReadabilityDeviationFullAt(double readabilityDeviationFullAt) {
            this.readabilityDeviationFullAt = readabilityDeviationFullAt;
        }

        public double getReadabilityDeviationZeroAt() {
            return readabilityDeviationZeroAt;
        }

        public void setReadabilityDeviationZeroAt(double readabilityDeviationZeroAt) {
            this.readabilityDeviationZeroAt = readabilityDeviationZeroAt;
        }
    }

    public static class Search {

        private int fanOut = 4;
        private int resultsPerChunk = 3;
        private int queryMaxWords = 32;
        private boolean exactPhrase = true;

        public int getFanOut() {
            return fanOut;
        }

        public void setFanOut(int fanOut) {
            this.fanOut = fanOut;
        }

        public int getResultsPerChunk() {
            return resultsPerChunk;
        }

        public void setResultsPerChunk(int resultsPerChunk) {
            this.resultsPerChunk = resultsPerChunk;
        }

        public int getQueryMaxWords() {
            return queryMaxWords;
        }

        public void setQueryMaxWords(int queryMaxWords) {
            this.queryMaxWords = queryMaxWords;
        }

        public boolean isExactPhrase() {
            return exactPhrase;
        }

        public void setExactPhrase(boolean exactPhrase) {
            this.exactPhrase = exactPhrase;
        }
    }

    public static class Similarity {

        private double minRelevance = 20;
        private int maxSources = 10;
        private int shingleSize = 3;
        private int minShingles = 5;

        public double getMinRelevance() {
            return minRelevance;
        }

        public void setMinRelevance(double minRelevance) {
            this.minRelevance = minRelevance;
        }

        public int getMaxSources() {
            return maxSources;
        }

        public void setMaxSources(int maxSources) {
            this.maxSources = maxSources;
        }

        public int getShingleSize() {
            return shingleSize;
        }

        public void setShingleSize(int shingleSize) {
            this.shingleSize = shingleSize;
        }

        public int getMinShingles() {
            return minShingles;
        }

        public void setMinShingles(int minShingles) {
            this.minShingles = minShingles;
        }
    }

    public static class Cache {

        private Duration ttl = Duration.ofHours(24);
        private long maxEntries = 1_000;
        private boolean sweepEnabled = false;
        private long sweepFixedDelayMs = 600_000;

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public long getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(long maxEntries) {
            this.maxEntries = maxEntries;
        }

        public boolean isSweepEnabled() {
            return sweepEnabled;
        }

        public void setSweepEnabled(boolean sweepEnabled) {
            this.sweepEnabled = sweepEnabled;
        }

        public long getSweepFixedDelayMs() {
            return sweepFixedDelayMs;
        }

        public void setSweepFixedDelayMs(long sweepFixedDelayMs) {
            this.sweepFixedDelayMs = sweepFixedDelayMs;
        }
    }
}
