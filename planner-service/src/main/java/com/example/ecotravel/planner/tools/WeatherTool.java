package com.example.ecotravel.planner.tools;

import com.example.ecotravel.planner.config.PlannerToolsProperties;
import com.example.ecotravel.planner.domain.Candidate;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Current weather at the destination from OpenWeatherMap, with activity suitability scores.
 * Retries server errors with exponential backoff; client errors (bad key, unknown place) fail at once.
 */
@Component
public class WeatherTool implements ToolHandler {

    private static final Logger log = LoggerFactory.getLogger(WeatherTool.class);

    public static final String NAME = "weather";

    private final WebClient webClient;
    private final String apiKey;
    private final long timeoutMs;
    private final int retries;
    private final ObjectMapper mapper = new ObjectMapper();

    @Autowired
    public WeatherTool(PlannerToolsProperties props) {
        this(WebClient.builder().baseUrl(props.getWeather().getBaseUrl()).build(),
                props.getWeather().getApiKey(), props.getWeather().getTimeoutMs(), props.getWeather().getRetries());
    }

    WeatherTool(WebClient webClient, String apiKey, long timeoutMs, int retries) {
        this.webClient = webClient;
        this.apiKey = apiKey;
        this.timeoutMs = Math.max(500, timeoutMs);
        this.retries = Math.max(0, retries);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> requiredInputs() {
        return Set.of("destination");
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> inputs) throws ToolException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ToolException("Weather API key is not configured");
        }
        Candidate place = PlaceInputs.place(inputs, "destination");
        Double lat = place.numericAttribute("lat");
        Double lon = place.numericAttribute("lon");

        String body;
        try {
            body = webClient.get()
                    .uri(b -> {
                        b.path("/data/2.5/weather").queryParam("appid", apiKey).queryParam("units", "metric");
                        if (lat != null && lon != null) {
                            b.queryParam("lat", lat).queryParam("lon", lon);
                        } else {
                            b.queryParam("q", PlaceInputs.label(place));
                        }
                        return b.build();
                    })
                    .retrieve()
                    .bodyToMono(String.class)
                    .retryWhen(Retry.backoff(retries, Duration.ofMillis(200))
                            .filter(WeatherTool::isRetryable))
                    .timeout(Duration.ofMillis(timeoutMs))
                    .block();
        } catch (Exception e) {
            throw new ToolException("Weather service call failed: " + e.getMessage(), e);
        }

        JsonNode root;
        try {
            root = mapper.readTree(body == null ? "{}" : body);
        } catch (Exception e) {
            throw new ToolException("Unreadable weather response", e);
        }
        JsonNode main = root.path("main");
        if (main.isMissingNode() || !main.has("temp")) {
            throw new ToolException("Weather response has no readings for " + place.getId());
        }
        String location = PlaceInputs.label(place);
        String condition = root.path("weather").path(0).path("description").asText("unknown conditions");
        String mainCondition = root.path("weather").path(0).path("main").asText("");
        double temp = main.path("temp").asDouble();
        double feels = main.path("feels_like").asDouble(temp);
        int humidity = main.path("humidity").asInt();
        double wind = root.path("wind").path("speed").asDouble();

        Map<String, Object> suitability = new LinkedHashMap<>();
        for (String activity : new String[]{"hiking", "beach", "sightseeing"}) {
            suitability.put(activity, suitabilityScore(temp, mainCondition, activity));
        }
        log.debug("[WeatherTool] {}: {} {}°C", place.getId(), condition, temp);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("location", location);
        payload.put("condition", condition);
        payload.put("temperatureC", temp);
        payload.put("feelsLikeC", feels);
        payload.put("humidity", humidity);
        payload.put("windSpeed", wind);
        payload.put("suitability", suitability);
        payload.put("summary", String.format(Locale.ROOT,
                "Right now in %s it's %s with %.1f°C (feels like %.1f°C), humidity %d%% and wind speed %.1f m/s.",
                location, condition, temp, feels, humidity, wind));
        return payload;
    }

    private static boolean isRetryable(Throwable t) {
        return !(t instanceof WebClientResponseException w) || w.getStatusCode().is5xxServerError();
    }

    /** 0-100 suitability of the current weather for an activity. */
    static int suitabilityScore(double temp, String mainCondition, String activity) {
        String desc = mainCondition == null ? "" : mainCondition.toLowerCase(Locale.ROOT);
        boolean rain = desc.contains("rain");
        switch (activity) {
            case "hiking":
                if (temp >= 10 && temp <= 25 && !rain) return 90;
                if (rain || temp < 5 || temp > 30) return 30;
                break;
            case "beach":
                if (temp >= 22 && temp <= 32 && desc.contains("clear")) return 95;
                if (temp < 18 || rain) return 40;
                break;
            case "sightseeing":
                if (temp >= 8 && temp <= 28 && !rain) return 85;
                if (temp < 5 || temp > 32 || rain) return 35;
                break;
            default:
                break;
        }
        return 60;
    }
}
