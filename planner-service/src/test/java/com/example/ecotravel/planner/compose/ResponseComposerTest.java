package com.example.ecotravel.planner.compose;

import com.example.ecotravel.common.turn.ResponseMessage;
import com.example.ecotravel.planner.Places;
import com.example.ecotravel.planner.dialogue.DialogueAction;
import com.example.ecotravel.planner.dialogue.PendingClarification;
import com.example.ecotravel.planner.domain.ErrorKind;
import com.example.ecotravel.planner.resolve.ClarificationOption;
import com.example.ecotravel.planner.resolve.EntityResolver;
import com.example.ecotravel.planner.retrieval.DocumentChunk;
import com.example.ecotravel.planner.retrieval.RetrievalResult;
import com.example.ecotravel.planner.retrieval.ScoredChunk;
import com.example.ecotravel.planner.slots.SlotDefinition;
import com.example.ecotravel.planner.slots.SlotType;
import com.example.ecotravel.planner.tools.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseComposerTest {

    private static final SlotDefinition DESTINATION = SlotDefinition.place("destination", "destination", "Where would you like to go?");

    private final ResponseComposer composer = new ResponseComposer();
    private final List<ClarificationOption> londons =
            new EntityResolver(0.2, 3).resolve(Places.ambiguousLondon("destination")).getOptions();

    @Test
    void clarification_listsNumberedOptions() {
        PendingClarification pending = new PendingClarification("destination", "London", londons, 0);

        List<ResponseMessage> out = composer.compose(DialogueAction.askClarification("plan_route", DESTINATION, pending, false));

        assertThat(out).singleElement().satisfies(m -> {
            assertThat(m.getType()).isEqualTo(ResponseMessage.CHOICES);
            assertThat(m.getText()).isEqualTo(
                    "Which London do you mean for your destination? 1) London, England or 2) London, Ontario");
            assertThat(m.getOptions()).containsExactly("London, England", "London, Ontario");
        });
    }

    @Test
    void clarificationRetry_apologisesFirst() {
        PendingClarification pending = new PendingClarification("destination", "London", londons, 1);

        List<ResponseMessage> out = composer.compose(DialogueAction.askClarification("plan_route", DESTINATION, pending, true));

        assertThat(out.get(0).getText()).startsWith("Sorry, I didn't catch which one you meant. Which London");
    }

    @Test
    void askForSlot_mentionsUnrecognizedText() {
        List<ResponseMessage> out = composer.compose(DialogueAction.askForSlot("get_weather", DESTINATION, List.of("Atlantis")));

        assertThat(out).extracting(ResponseMessage::getText)
                .containsExactly("I couldn't find \"Atlantis\". Where would you like to go?");
    }

    @Test
    void toolSuccess_givesSummaryDataAndFollowUp() {
        ToolResult weather = ToolResult.ok("weather", Map.of(
                "summary", "Right now in Paris it's sunny.",
                "location", "Paris, Ile-de-France",
                "suitability", Map.of("hiking", 90)));

        List<ResponseMessage> out = composer.compose(DialogueAction.toolResult("get_weather", weather));

        assertThat(out).hasSize(3);
        assertThat(out.get(0).getText()).isEqualTo("Right now in Paris it's sunny.");
        assertThat(out.get(1).getType()).isEqualTo(ResponseMessage.DATA);
        assertThat(out.get(1).getData()).containsEntry("tool", "weather")
                .containsEntry("location", "Paris, Ile-de-France")
                .doesNotContainKey("summary");
        assertThat(out.get(2).getText()).startsWith("Conditions look great for hiking.");
    }

    @Test
    void toolFailure_namesCapabilityWithoutInternals() {
        List<ResponseMessage> timeout = composer.compose(
                DialogueAction.toolResult("get_weather", ToolResult.failed("weather", ErrorKind.TOOL_TIMEOUT)));
        List<ResponseMessage> down = composer.compose(
                DialogueAction.toolResult("plan_route", ToolResult.failed("routing", ErrorKind.TOOL_UNAVAILABLE)));

        assertThat(timeout).extracting(ResponseMessage::getText)
                .containsExactly("Sorry, the weather service is taking too long right now. Please try again in a moment.");
        assertThat(down).extracting(ResponseMessage::getText)
                .containsExactly("Sorry, the route planning service isn't available right now. Please try again later.");
    }

    @Test
    void groundedAnswer_listsDistinctSources() {
        DocumentChunk a = new DocumentChunk("transportation#0", new float[]{1f}, "a", Map.of("source", "transportation"));
        DocumentChunk b = new DocumentChunk("transportation#1", new float[]{1f}, "b", Map.of("source", "transportation"));
        RetrievalResult result = RetrievalResult.grounded("Trains are greener.",
                List.of(new ScoredChunk(a, 0.9), new ScoredChunk(b, 0.8)), 0.9);

        List<ResponseMessage> out = composer.compose(DialogueAction.retrievalResult("ask_travel_knowledge", result));

        assertThat(out.get(0).getText()).isEqualTo("Trains are greener.");
        assertThat(out.get(1).getData()).containsEntry("sources", List.of("transportation"));
    }

    @Test
    void ungroundedAnswer_asksToNarrowDown() {
        List<ResponseMessage> out = composer.compose(DialogueAction.retrievalResult("ask_travel_knowledge",
                RetrievalResult.ungrounded(ErrorKind.NO_RELEVANT_CONTEXT, 0.1)));

        assertThat(out).singleElement()
                .extracting(ResponseMessage::getText)
                .isEqualTo("I don't have reliable information about that. " + ResponseComposer.NARROWING_TEXT);
    }

    @Test
    void resumedQuestion_followsTheAnswer() {
        DialogueAction action = DialogueAction.conversational("greet", "Hello!")
                .thenResume(DialogueAction.askForSlot("plan_route", DESTINATION, List.of()));

        assertThat(composer.compose(action)).extracting(ResponseMessage::getText)
                .containsExactly("Hello!", "Where would you like to go?");
    }

    @Test
    void exhaustedClarification_namesTheSlotItGaveUpOn() {
        SlotDefinition mode = new SlotDefinition("transport_mode", SlotType.TEXT, "transport_mode",
                "transport mode", "How will you travel?");
        SlotDefinition date = new SlotDefinition("travel_date", SlotType.DATE, "date", "travel date", "When?");

        assertThat(composer.compose(DialogueAction.clarificationExhausted("plan_route", DESTINATION)))
                .extracting(ResponseMessage::getText).singleElement().asString()
                .startsWith("I still couldn't tell which place you meant for your destination")
                .contains("\"London, Ontario\"");
        assertThat(composer.compose(DialogueAction.clarificationExhausted("estimate_emissions", mode)))
                .extracting(ResponseMessage::getText).singleElement().asString()
                .startsWith("I still couldn't tell which transport mode you meant for your transport mode")
                .doesNotContain("London");
        assertThat(composer.compose(DialogueAction.clarificationExhausted("get_weather", date)))
                .extracting(ResponseMessage::getText).singleElement().asString()
                .startsWith("I still couldn't tell which date you meant for your travel date")
                .contains("2024-05-02");
    }

    @Test
    void sameActionComposesIdentically() {
        DialogueAction action = DialogueAction.clarificationExhausted("plan_route", DESTINATION);

        assertThat(composer.compose(action)).extracting(ResponseMessage::getText)
                .isEqualTo(composer.compose(action).stream().map(ResponseMessage::getText).toList());
        assertThat(composer.compose(DialogueAction.failure())).extracting(ResponseMessage::getText)
                .containsExactly(ResponseComposer.FAILURE_TEXT);
    }
}
