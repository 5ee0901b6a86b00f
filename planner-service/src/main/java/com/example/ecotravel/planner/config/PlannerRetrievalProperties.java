package com.example.ecotravel.planner.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Validated
@ConfigurationProperties(prefix = "planner.retrieval")
public class PlannerRetrievalProperties {
    @Min(1)
    private int topK = 5;
    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double relevanceThreshold = 0.55;
    @Min(1)
    private int maxContextChars = 2000;
    @Min(1)
    private long embeddingTimeoutMs = 10000;
    @Min(1)
    private long queryTimeoutMs = 2000;
    @Min(1)
    private long generationTimeoutMs = 60000;
    private boolean seedOnStartup = true;
    private String seedResource = "classpath:knowledge/sustainable-travel.json";
    @Min(50)
    private int chunkSize = 500;
    @Min(0)
    private int chunkOverlap = 50;

    public int getTopK() { return topK; }
    public void setTopK(int topK) { this.topK = topK; }
    public double getRelevanceThreshold() { return relevanceThreshold; }
    public void setRelevanceThreshold(double relevanceThreshold) { this.relevanceThreshold = relevanceThreshold; }
    public int getMaxContextChars() { return maxContextChars; }
    public void setMaxContextChars(int maxContextChars) { this.maxContextChars = maxContextChars; }
    public long getEmbeddingTimeoutMs() { return embeddingTimeoutMs; }
    public void setEmbeddingTimeoutMs(long embeddingTimeoutMs) { this.embeddingTimeoutMs = embeddingTimeoutMs; }
    public long getQueryTimeoutMs() { return queryTimeoutMs; }
    public void setQueryTimeoutMs(long queryTimeoutMs) { this.queryTimeoutMs = queryTimeoutMs; }
    public long getGenerationTimeoutMs() { return generationTimeoutMs; }
    public void setGenerationTimeoutMs(long generationTimeoutMs) { this.generationTimeoutMs = generationTimeoutMs; }
    public boolean isSeedOnStartup() { return seedOnStartup; }
    public void setSeedOnStartup(boolean seedOnStartup) { this.seedOnStartup = seedOnStartup; }
    public String getSeedResource() { return seedResource; }
    public void setSeedResource(String seedResource) { this.seedResource = seedResource; }
    public int getChunkSize() { return chunkSize; }
    public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }
    public int getChunkOverlap() { return chunkOverlap; }
    public void setChunkOverlap(int chunkOverlap) { this.chunkOverlap = chunkOverlap; }
}
