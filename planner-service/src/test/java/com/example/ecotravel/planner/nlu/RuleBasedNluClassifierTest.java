package com.example.ecotravel.planner.nlu;

import com.example.ecotravel.common.nlu.NluCandidate;
import com.example.ecotravel.common.nlu.NluEntity;
import com.example.ecotravel.common.nlu.NluResult;
import com.example.ecotravel.planner.config.PlannerNluProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class RuleBasedNluClassifierTest {

    private final RuleBasedNluClassifier classifier = new RuleBasedNluClassifier(
            new PlaceGazetteer(new PlannerNluProperties(), new ObjectMapper()),
            Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));

    @Test
    void routeRequest_hasOriginAndDestination() {
        NluResult r = classifier.classify("Plan a route from Berlin to London");

        assertThat(r.getIntent()).isEqualTo("plan_route");
        assertThat(r.getEntities()).extracting(NluEntity::getType, NluEntity::getRole, NluEntity::getText)
                .containsExactly(
                        tuple("place", "origin", "Berlin"),
                        tuple("place", "destination", "London"));
        assertThat(r.getEntities().get(1).getCandidates()).hasSize(2);
    }

    @Test
    void weatherRequest_readsDestinationAndRelativeDate() {
        NluResult r = classifier.classify("What's the weather in Paris tomorrow?");

        assertThat(r.getIntent()).isEqualTo("get_weather");
        assertThat(r.getEntities()).anySatisfy(e -> {
            assertThat(e.getType()).isEqualTo("place");
            assertThat(e.getRole()).isEqualTo("destination");
        });
        assertThat(r.getEntities()).anySatisfy(e -> {
            assertThat(e.getType()).isEqualTo("date");
            assertThat(e.getCandidates()).extracting(NluCandidate::getId).containsExactly("2024-05-02");
        });
    }

    @Test
    void emissionsRequest_readsTransportMode() {
        NluResult r = classifier.classify("How much CO2 does flying from Berlin to Madrid emit?");

        assertThat(r.getIntent()).isEqualTo("estimate_emissions");
        assertThat(r.getEntities()).anySatisfy(e -> {
            assertThat(e.getType()).isEqualTo("transport_mode");
            assertThat(e.getCandidates()).extracting(NluCandidate::getId).containsExactly("flight");
        });
    }

    @Test
    void shortReplies_areOptionsOrInformation() {
        assertThat(classifier.classify("the second one").getIntent()).isEqualTo("choose_option");
        assertThat(classifier.classify("2").getIntent()).isEqualTo("choose_option");
        assertThat(classifier.classify("Berlin").getIntent()).isEqualTo("inform");
        assertThat(classifier.classify("Berlin").getEntities()).singleElement()
                .satisfies(e -> assertThat(e.getRole()).isNull());
    }

    @Test
    void questionsAndSmallTalk() {
        assertThat(classifier.classify("Are night trains better than flying?").getIntent()).isEqualTo("ask_travel_knowledge");
        assertThat(classifier.classify("hello there").getIntent()).isEqualTo("greet");
        assertThat(classifier.classify("let's start over").getIntent()).isEqualTo("restart");
        assertThat(classifier.classify("bye").getIntent()).isEqualTo("goodbye");
        assertThat(classifier.classify("blah").getIntent()).isEqualTo(NluResult.FALLBACK_INTENT);
        assertThat(classifier.classify("   ").getIntent()).isEqualTo(NluResult.FALLBACK_INTENT);
    }

    @Test
    void role_followsThePrecedingWord() {
        assertThat(RuleBasedNluClassifier.role("a trip from")).isEqualTo("origin");
        assertThat(RuleBasedNluClassifier.role("i want to go to")).isEqualTo("destination");
        assertThat(RuleBasedNluClassifier.role("hmm")).isNull();
        assertThat(RuleBasedNluClassifier.role("")).isNull();
    }
}
