package com.example.ecotravel.planner.dialogue;

import com.example.ecotravel.planner.Places;
import com.example.ecotravel.planner.domain.Entity;
import com.example.ecotravel.planner.domain.Turn;
import com.example.ecotravel.planner.resolve.ClarificationOption;
import com.example.ecotravel.planner.resolve.EntityResolver;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ClarificationMatcherTest {

    private final ClarificationMatcher matcher = new ClarificationMatcher();
    private final List<ClarificationOption> londons =
            new EntityResolver(0.2, 3).resolve(Places.ambiguousLondon("destination")).getOptions();

    private Optional<String> pick(String text, Entity... entities) {
        return matcher.match(new Turn("choose_option", List.of(entities), text, null), londons)
                .map(o -> o.getCandidate().getId());
    }

    @Test
    void ordinalReplies_pickByPosition() {
        assertThat(pick("the second one")).contains("london-on-ca");
        assertThat(pick("2")).contains("london-on-ca");
        assertThat(pick("option 1")).contains("london-gb");
        assertThat(pick("1st please")).contains("london-gb");
        assertThat(pick("the last one")).contains("london-on-ca");
    }

    @Test
    void distinguishingWords_pickTheMatchingOption() {
        assertThat(pick("Ontario")).contains("london-on-ca");
        assertThat(pick("the one in Canada")).contains("london-on-ca");
        assertThat(pick("London, England")).contains("london-gb");
        assertThat(pick("england")).contains("london-gb");
    }

    @Test
    void entityCandidateId_picksThatOption() {
        assertThat(pick("that one", Places.place(null, Places.londonOntario(1.0)))).contains("london-on-ca");
    }

    @Test
    void vagueOrOutOfRangeReplies_matchNothing() {
        assertThat(pick("London")).isEmpty();
        assertThat(pick("hmm not sure")).isEmpty();
        assertThat(pick("7")).isEmpty();
        assertThat(pick("")).isEmpty();
        assertThat(matcher.match(new Turn("inform", List.of(), "1", null), List.of())).isEmpty();
    }

    @Test
    void mentionedMatch_ignoresOrdinalsAndDigitsInFreeText() {
        Turn weather = new Turn("get_weather", List.of(Places.place("destination", Places.paris())),
                "What's the weather in Paris for the first week of May, in 2 days?", null);

        assertThat(matcher.match(weather, londons)).isPresent();
        assertThat(matcher.matchMentioned(weather, londons)).isEmpty();
    }

    @Test
    void mentionedMatch_acceptsAnEntityNamingAnOption() {
        Turn byId = new Turn("get_weather", List.of(Places.place("destination", Places.londonOntario(1.0))),
                "Weather in London, Ontario", null);
        Turn byLabel = new Turn("get_weather", List.of(new Entity("place", "destination", "London, England", List.of(), 0.9)),
                "Weather in London, England", null);

        assertThat(matcher.matchMentioned(byId, londons)).map(o -> o.getCandidate().getId()).contains("london-on-ca");
        assertThat(matcher.matchMentioned(byLabel, londons)).map(o -> o.getCandidate().getId()).contains("london-gb");
    }

    @Test
    void parseOrdinal_readsWordsDigitsAndLast() {
        assertThat(ClarificationMatcher.parseOrdinal("third", 5)).isEqualTo(3);
        assertThat(ClarificationMatcher.parseOrdinal("number 4", 5)).isEqualTo(4);
        assertThat(ClarificationMatcher.parseOrdinal("#2", 5)).isEqualTo(2);
        assertThat(ClarificationMatcher.parseOrdinal("last", 5)).isEqualTo(5);
        assertThat(ClarificationMatcher.parseOrdinal("no idea", 5)).isNull();
    }
}
