package com.example.ecotravel.planner.nlu;

import com.example.ecotravel.common.nlu.NluCandidate;
import com.example.ecotravel.planner.config.PlannerNluProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PlaceGazetteerTest {

    private final PlaceGazetteer gazetteer = new PlaceGazetteer(new PlannerNluProperties(), new ObjectMapper());

    @Test
    void lookup_sameNamedPlacesShareThePriorMass() {
        List<NluCandidate> london = gazetteer.lookup("London");

        assertThat(london).extracting(NluCandidate::getId).containsExactly("london-gb", "london-on-ca");
        assertThat(london).extracting(NluCandidate::getConfidence).containsExactly(0.55, 0.45);
        assertThat(london.get(1).getAttributes()).containsEntry("region", "Ontario").containsEntry("country", "Canada");
    }

    @Test
    void lookup_qualifierNarrowsToOnePlace() {
        assertThat(gazetteer.lookup("London, Ontario")).singleElement().satisfies(c -> {
            assertThat(c.getId()).isEqualTo("london-on-ca");
            assertThat(c.getConfidence()).isEqualTo(1.0);
        });
        assertThat(gazetteer.lookup("portland maine")).extracting(NluCandidate::getId).containsExactly("portland-me-us");
        assertThat(gazetteer.lookup("NYC")).extracting(NluCandidate::getId).containsExactly("new-york-us");
    }

    @Test
    void lookup_unknownPlaceHasNoCandidates() {
        assertThat(gazetteer.lookup("Atlantis")).isEmpty();
        assertThat(gazetteer.lookup("  ")).isEmpty();
    }

    @Test
    void findMentions_returnsPlacesInOrderWithQualifiers() {
        List<PlaceGazetteer.Mention> mentions = gazetteer.findMentions("From Berlin to London, Ontario please");

        assertThat(mentions).extracting(PlaceGazetteer.Mention::getSurface).containsExactly("Berlin", "London, Ontario");
        assertThat(mentions.get(1).getCandidates()).extracting(NluCandidate::getId).containsExactly("london-on-ca");
    }

    @Test
    void findMentions_prefersLongestName() {
        assertThat(gazetteer.findMentions("a weekend in new york city"))
                .singleElement()
                .satisfies(m -> assertThat(m.getCandidates()).extracting(NluCandidate::getId).containsExactly("new-york-us"));
    }

    @Test
    void findMentions_shortQualifierNeedsAComma() {
        List<PlaceGazetteer.Mention> mentions = gazetteer.findMentions("leaving london on monday");

        assertThat(mentions).singleElement().satisfies(m -> {
            assertThat(m.getSurface()).isEqualTo("London");
            assertThat(m.getCandidates()).hasSize(2);
        });
    }
}
