package com.example.ecotravel.planner.service;

import com.example.ecotravel.common.turn.ResponseMessage;
import com.example.ecotravel.common.turn.TurnResponse;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full conversations against the wired application. Only offline capabilities are exercised:
 * the weather key is left blank and the knowledge base is not seeded.
 */
@SpringBootTest(properties = {
        "planner.retrieval.seed-on-startup=false",
        "planner.tools.weather.api-key=",
        "planner.nlu.provider=rules"
})
class PlannerConversationFlowTest {

    @Autowired
    private PlannerService plannerService;

    @Test
    void ambiguousDestination_isClarifiedBeforeTheToolRuns() {
        TurnResponse first = plannerService.handleTurn("flow-weather", "What's the weather in London?");

        assertThat(first.getMessages()).singleElement().satisfies(m -> {
            assertThat(m.getType()).isEqualTo(ResponseMessage.CHOICES);
            assertThat(m.getText()).startsWith("Which London do you mean for your destination?");
            assertThat(m.getOptions()).hasSize(2);
        });
        assertThat(plannerService.describe("flow-weather")).hasValueSatisfying(s ->
                assertThat(s).containsEntry("phase", "AWAITING_CLARIFICATION"));

        TurnResponse second = plannerService.handleTurn("flow-weather", "the second one");

        assertThat(second.getMessages()).extracting(ResponseMessage::getText)
                .containsExactly("Sorry, the weather service isn't available right now. Please try again later.");
        assertThat(plannerService.describe("flow-weather")).hasValueSatisfying(s -> assertThat(s)
                .containsEntry("phase", "AWAITING_INTENT")
                .doesNotContainKey("pendingClarification"));
    }

    @Test
    void emissionsEstimate_isComputedOffline() {
        TurnResponse response = plannerService.handleTurn("flow-emissions",
                "How much CO2 does the train from Berlin to Paris emit?");

        assertThat(response.getMessages()).isNotEmpty();
        assertThat(response.getMessages().get(0).getText())
                .startsWith("Travelling ")
                .contains("by train");
        assertThat(response.getMessages()).anySatisfy(m -> {
            assertThat(m.getType()).isEqualTo(ResponseMessage.DATA);
            assertThat(m.getData()).containsEntry("tool", "emissions").containsKey("emissionKg");
        });
    }

    @Test
    void knowledgeQuestion_withEmptyIndex_saysSo() {
        TurnResponse response = plannerService.handleTurn("flow-knowledge", "Are night trains better than flying?");

        assertThat(response.getMessages()).extracting(ResponseMessage::getText)
                .containsExactly("My travel knowledge base isn't loaded yet, so I can't answer that reliably right now.");
    }

    @Test
    void reset_startsAFreshConversation() {
        plannerService.handleTurn("flow-reset", "What's the weather in London?");

        assertThat(plannerService.reset("flow-reset")).isTrue();
        assertThat(plannerService.describe("flow-reset")).isEmpty();
        assertThat(plannerService.reset("flow-reset")).isFalse();
    }
}
