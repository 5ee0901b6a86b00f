package com.example.ecotravel.planner.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Validated
@ConfigurationProperties(prefix = "planner.nlu")
public class PlannerNluProperties {
    /** {@code rules} (keyword/regex classifier) or {@code llm} (chat model, rules as fallback). */
    private String provider = "rules";
    @Min(1)
    private long timeoutMs = 8000;
    private String gazetteerResource = "gazetteer/places.json";

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public long getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    public String getGazetteerResource() { return gazetteerResource; }
    public void setGazetteerResource(String gazetteerResource) { this.gazetteerResource = gazetteerResource; }
}
