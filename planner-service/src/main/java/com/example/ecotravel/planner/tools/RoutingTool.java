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

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Route planning against an OSRM-compatible routing service.
 * Transport modes without a road profile (train, flight, ferry, bus) use the driving geometry.
 */
@Component
public class RoutingTool implements ToolHandler {

    private static final Logger log = LoggerFactory.getLogger(RoutingTool.class);

    public static final String NAME = "routing";

    private static final Map<String, String> PROFILES = Map.of(
            "car", "driving",
            "bike", "cycling",
            "walk", "foot"
    );

    private final WebClient webClient;
    private final long timeoutMs;
    private final ObjectMapper mapper = new ObjectMapper();

    @Autowired
    public RoutingTool(PlannerToolsProperties props) {
        this(WebClient.builder().baseUrl(props.getRouting().getBaseUrl()).build(), props.getRouting().getTimeoutMs());
    }

    RoutingTool(WebClient webClient, long timeoutMs) {
        this.webClient = webClient;
        this.timeoutMs = Math.max(500, timeoutMs);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> requiredInputs() {
        return Set.of("origin", "destination");
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> inputs) throws ToolException {
        Candidate origin = PlaceInputs.place(inputs, "origin");
        Candidate destination = PlaceInputs.place(inputs, "destination");
        String mode = PlaceInputs.canonicalMode(PlaceInputs.text(inputs, "transport_mode", "car"));
        String profile = PROFILES.getOrDefault(mode, "driving");
        double[] from = PlaceInputs.coordinates(origin);
        double[] to = PlaceInputs.coordinates(destination);

        String body;
        try {
            body = webClient.get()
                    .uri("/route/v1/{profile}/{lon1},{lat1};{lon2},{lat2}?overview=false",
                            profile, coord(from[1]), coord(from[0]), coord(to[1]), coord(to[0]))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(timeoutMs))
                    .block();
        } catch (Exception e) {
            throw new ToolException("Routing service call failed: " + e.getMessage(), e);
        }

        JsonNode route;
        try {
            JsonNode root = mapper.readTree(body == null ? "{}" : body);
            if (!"Ok".equalsIgnoreCase(root.path("code").asText())) {
                throw new ToolException("Routing service returned code " + root.path("code").asText("?"));
            }
            route = root.path("routes").path(0);
        } catch (ToolException e) {
            throw e;
        } catch (Exception e) {
            throw new ToolException("Unreadable routing response", e);
        }
        if (route.isMissingNode()) throw new ToolException("No route between " + origin.getId() + " and " + destination.getId());

        double distanceKm = PlaceInputs.round1(route.path("distance").asDouble() / 1000.0);
        long durationMin = Math.round(route.path("duration").asDouble() / 60.0);
        log.debug("[RoutingTool] {} -> {} by {} ({}): {} km, {} min", origin.getId(), destination.getId(), mode, profile, distanceKm, durationMin);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("origin", PlaceInputs.label(origin));
        payload.put("destination", PlaceInputs.label(destination));
        payload.put("mode", mode);
        payload.put("profile", profile);
        payload.put("distanceKm", distanceKm);
        payload.put("durationMinutes", durationMin);
        payload.put("summary", String.format(Locale.ROOT, "Route from %s to %s by %s: %.1f km, about %s.",
                PlaceInputs.label(origin), PlaceInputs.label(destination), mode, distanceKm, formatDuration(durationMin)));
        return payload;
    }

    private static String coord(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }

    static String formatDuration(long minutes) {
        if (minutes < 60) return minutes + " min";
        long h = minutes / 60;
        long m = minutes % 60;
        return m == 0 ? h + " h" : h + " h " + m + " min";
    }
}
