package com.example.ecotravel.planner.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.Map;

@Component
@Validated
@ConfigurationProperties(prefix = "planner.tools")
public class PlannerToolsProperties {
    @Min(1)
    private long defaultTimeoutMs = 8000;
    @Min(1)
    private int executorThreads = 16;
    private Endpoint routing = new Endpoint("https://router.project-osrm.org", 8000);
    private Weather weather = new Weather();
    private Endpoint emissions = new Endpoint(null, 2000);

    /** Timeout for the named tool, falling back to {@link #getDefaultTimeoutMs()}. */
    public long timeoutFor(String toolName) {
        Endpoint e = Map.of("routing", routing, "weather", (Endpoint) weather, "emissions", emissions).get(toolName);
        return e != null && e.getTimeoutMs() > 0 ? e.getTimeoutMs() : defaultTimeoutMs;
    }

    public long getDefaultTimeoutMs() { return defaultTimeoutMs; }
    public void setDefaultTimeoutMs(long defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }
    public int getExecutorThreads() { return executorThreads; }
    public void setExecutorThreads(int executorThreads) { this.executorThreads = executorThreads; }
    public Endpoint getRouting() { return routing; }
    public void setRouting(Endpoint routing) { this.routing = routing; }
    public Weather getWeather() { return weather; }
    public void setWeather(Weather weather) { this.weather = weather; }
    public Endpoint getEmissions() { return emissions; }
    public void setEmissions(Endpoint emissions) { this.emissions = emissions; }

    public static class Endpoint {
        private String baseUrl;
        private long timeoutMs;

        public Endpoint() {}

        public Endpoint(String baseUrl, long timeoutMs) {
            this.baseUrl = baseUrl;
            this.timeoutMs = timeoutMs;
        }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    }

    public static class Weather extends Endpoint {
        private String apiKey = "";
        private int retries = 2;

        public Weather() {
            super("https://api.openweathermap.org", 8000);
        }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public int getRetries() { return retries; }
        public void setRetries(int retries) { this.retries = retries; }
    }
}
