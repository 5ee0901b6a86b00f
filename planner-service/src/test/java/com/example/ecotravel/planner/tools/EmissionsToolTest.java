package com.example.ecotravel.planner.tools;

import com.example.ecotravel.planner.Places;
import com.example.ecotravel.planner.domain.Candidate;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.LIST;

class EmissionsToolTest {

    private final EmissionsTool tool = new EmissionsTool();

    @Test
    void whenTrain_thenLowEmissionAndTopGrade() throws ToolException {
        Map<String, Object> payload = tool.execute(Map.of(
                "origin", Places.berlin(), "destination", Places.paris(), "transport_mode", "train"));

        assertThat((Double) payload.get("distanceKm")).isBetween(870.0, 890.0);
        assertThat((Double) payload.get("emissionKg")).isBetween(35.0, 37.0);
        assertThat(payload.get("sustainabilityGrade")).isEqualTo("A");
        assertThat((String) payload.get("summary"))
                .startsWith("Travelling ")
                .contains("from Berlin, Berlin to Paris, Ile-de-France by train")
                .endsWith("(grade A).");
        assertThat(payload.get("recommendations")).asInstanceOf(LIST).contains("Great job! This trip is highly sustainable.");
    }

    @Test
    void whenFlightSpelledAsPlane_thenFlightFactorAndTrainSuggested() throws ToolException {
        Map<String, Object> payload = tool.execute(Map.of(
                "origin", Places.berlin(), "destination", Places.paris(), "transport_mode", "Plane"));

        assertThat(payload.get("mode")).isEqualTo("flight");
        assertThat((Double) payload.get("emissionKg")).isBetween(220.0, 228.0);
        assertThat(payload.get("sustainabilityGrade")).isEqualTo("D");
        assertThat((Double) payload.get("offsetPrice")).isBetween(4.4, 4.6);
        assertThat(payload.get("recommendations")).asInstanceOf(LIST).anySatisfy(r -> assertThat((String) r).contains("by train"));
    }

    @Test
    void whenModeUnknown_thenToolException() {
        assertThatThrownBy(() -> tool.execute(Map.of(
                "origin", Places.berlin(), "destination", Places.paris(), "transport_mode", "rocket")))
                .isInstanceOf(ToolException.class)
                .hasMessageContaining("rocket");
    }

    @Test
    void whenPlaceHasNoCoordinates_thenToolException() {
        Candidate nowhere = new Candidate("nowhere", "Nowhere", Map.of(), 1.0);

        assertThatThrownBy(() -> tool.execute(Map.of(
                "origin", nowhere, "destination", Places.paris(), "transport_mode", "car")))
                .isInstanceOf(ToolException.class);
    }

    @Test
    void grade_boundariesAreInclusive() {
        assertThat(EmissionsTool.grade(0)).isEqualTo("A");
        assertThat(EmissionsTool.grade(50)).isEqualTo("A");
        assertThat(EmissionsTool.grade(50.1)).isEqualTo("B");
        assertThat(EmissionsTool.grade(800)).isEqualTo("E");
        assertThat(EmissionsTool.grade(801)).isEqualTo("F");
    }
}
