package com.example.ecotravel.planner.tools;

import com.example.ecotravel.planner.Places;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WeatherToolTest {

    private static final String CLEAR_SKY = "{\"weather\":[{\"main\":\"Clear\",\"description\":\"clear sky\"}],"
            + "\"main\":{\"temp\":18.0,\"feels_like\":17.2,\"humidity\":60},\"wind\":{\"speed\":3.4}}";

    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicReference<URI> requested = new AtomicReference<>();

    private WebClient clientAnswering(HttpStatus... statuses) {
        Deque<HttpStatus> queue = new ArrayDeque<>(List.of(statuses));
        return WebClient.builder()
                .baseUrl("http://weather.test")
                .exchangeFunction(request -> {
                    calls.incrementAndGet();
                    requested.set(request.url());
                    HttpStatus status = queue.size() > 1 ? queue.poll() : queue.peek();
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(status == HttpStatus.OK ? CLEAR_SKY : "{\"message\":\"nope\"}")
                            .build());
                })
                .build();
    }

    @Test
    void whenReadingsReturned_thenSummaryAndSuitability() throws ToolException {
        WeatherTool tool = new WeatherTool(clientAnswering(HttpStatus.OK), "key", 5000, 2);

        Map<String, Object> payload = tool.execute(Map.of("destination", Places.paris()));

        assertThat(requested.get().getQuery()).contains("appid=key", "units=metric", "lat=48.8566", "lon=2.3522");
        assertThat(payload.get("summary")).isEqualTo(
                "Right now in Paris, Ile-de-France it's clear sky with 18.0°C (feels like 17.2°C), humidity 60% and wind speed 3.4 m/s.");
        assertThat(payload.get("suitability")).isEqualTo(Map.of("hiking", 90, "beach", 60, "sightseeing", 85));
    }

    @Test
    void whenServerErrorOnce_thenRetriedAndServed() throws ToolException {
        WeatherTool tool = new WeatherTool(clientAnswering(HttpStatus.SERVICE_UNAVAILABLE, HttpStatus.OK), "key", 5000, 2);

        Map<String, Object> payload = tool.execute(Map.of("destination", Places.paris()));

        assertThat(payload).containsEntry("condition", "clear sky");
        assertThat(calls).hasValue(2);
    }

    @Test
    void whenClientError_thenFailsWithoutRetry() {
        WeatherTool tool = new WeatherTool(clientAnswering(HttpStatus.UNAUTHORIZED), "bad-key", 5000, 2);

        assertThatThrownBy(() -> tool.execute(Map.of("destination", Places.paris())))
                .isInstanceOf(ToolException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void whenApiKeyMissing_thenFailsWithoutCalling() {
        WeatherTool tool = new WeatherTool(clientAnswering(HttpStatus.OK), " ", 5000, 2);

        assertThatThrownBy(() -> tool.execute(Map.of("destination", Places.paris())))
                .isInstanceOf(ToolException.class)
                .hasMessageContaining("API key");
        assertThat(calls).hasValue(0);
    }

    @Test
    void suitabilityScore_penalisesRain() {
        assertThat(WeatherTool.suitabilityScore(15, "Rain", "hiking")).isEqualTo(30);
        assertThat(WeatherTool.suitabilityScore(26, "Clear", "beach")).isEqualTo(95);
        assertThat(WeatherTool.suitabilityScore(15, "Clouds", "kayaking")).isEqualTo(60);
    }
}
