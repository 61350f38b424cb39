package com.groundgate.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tunables bound from {@code groundgate.*}.
 */
@Component
@ConfigurationProperties(prefix = "groundgate")
public class GroundgateProperties {

    private Citation citation = new Citation();
    private Gate gate = new Gate();
    private Retry retry = new Retry();
    private Budget budget = new Budget();
    private Store store = new Store();

    public Citation getCitation() { return citation; }
    public void setCitation(Citation citation) { this.citation = citation; }
    public Gate getGate() { return gate; }
    public void setGate(Gate gate) { this.gate = gate; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public Budget getBudget() { return budget; }
    public void setBudget(Budget budget) { this.budget = budget; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }

    public static class Citation {
        /** Minimum token overlap between answer and cited chunk. */
        private double relevanceThreshold = 0.1;
        private int quoteMaxLength = 200;

        public double getRelevanceThreshold() { return relevanceThreshold; }
        public void setRelevanceThreshold(double relevanceThreshold) { this.relevanceThreshold = relevanceThreshold; }
        public int getQuoteMaxLength() { return quoteMaxLength; }
        public void setQuoteMaxLength(int quoteMaxLength) { this.quoteMaxLength = quoteMaxLength; }
    }

    public static class Gate {
        private boolean requireCitations = true;
        private boolean requireLocators = true;
        private double minEvidenceCoverage = 0.5;
        private String locatorKey = "section";

        public boolean isRequireCitations() { return requireCitations; }
        public void setRequireCitations(boolean requireCitations) { this.requireCitations = requireCitations; }
        public boolean isRequireLocators() { return requireLocators; }
        public void setRequireLocators(boolean requireLocators) { this.requireLocators = requireLocators; }
        public double getMinEvidenceCoverage() { return minEvidenceCoverage; }
        public void setMinEvidenceCoverage(double minEvidenceCoverage) { this.minEvidenceCoverage = minEvidenceCoverage; }
        public String getLocatorKey() { return locatorKey; }
        public void setLocatorKey(String locatorKey) { this.locatorKey = locatorKey; }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long baseDelayMs = 500;
        private long maxDelayMs = 8000;
        private boolean jitter = true;
        /** Cumulative attempt cost after which no further retry is made. */
        private double costLimit = 10.0;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }
        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }
        public boolean isJitter() { return jitter; }
        public void setJitter(boolean jitter) { this.jitter = jitter; }
        public double getCostLimit() { return costLimit; }
        public void setCostLimit(double costLimit) { this.costLimit = costLimit; }
    }

    public static class Budget {
        private int maxToolCalls = 20;
        private int maxRetries = 10;

        public int getMaxToolCalls() { return maxToolCalls; }
        public void setMaxToolCalls(int maxToolCalls) { this.maxToolCalls = maxToolCalls; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    public static class Store {
        /** Characters of chunk text hashed into the chunk id. */
        private int textPrefixLength = 4096;

        public int getTextPrefixLength() { return textPrefixLength; }
        public void setTextPrefixLength(int textPrefixLength) { this.textPrefixLength = textPrefixLength; }
    }
}
