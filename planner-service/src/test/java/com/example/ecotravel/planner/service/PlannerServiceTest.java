package com.example.ecotravel.planner.service;

import com.example.ecotravel.common.nlu.NluResult;
import com.example.ecotravel.common.turn.ResponseMessage;
import com.example.ecotravel.common.turn.TurnResponse;
import com.example.ecotravel.planner.compose.ResponseComposer;
import com.example.ecotravel.planner.conversation.Conversation;
import com.example.ecotravel.planner.conversation.ConversationRegistry;
import com.example.ecotravel.planner.dialogue.DialogueAction;
import com.example.ecotravel.planner.dialogue.DialogueStateMachine;
import com.example.ecotravel.planner.domain.Turn;
import com.example.ecotravel.planner.nlu.NluClassifier;
import com.example.ecotravel.planner.nlu.NluTurnMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlannerServiceTest {

    @Mock private ConversationRegistry conversations;
    @Mock private NluClassifier classifier;
    @Mock private NluTurnMapper turnMapper;
    @Mock private DialogueStateMachine stateMachine;
    @Mock private ResponseComposer composer;

    private PlannerService service;

    @BeforeEach
    void setUp() {
        service = new PlannerService(conversations, classifier, turnMapper, stateMachine, composer);
    }

    @SuppressWarnings("unchecked")
    private void runWorkOn(Conversation conversation, String sessionId) {
        when(conversations.execute(eq(sessionId), any(), any()))
                .thenAnswer(inv -> ((Function<Conversation, Object>) inv.getArgument(1)).apply(conversation));
    }

    @Test
    @DisplayName("A free-text turn is classified, decided and composed inside the session")
    void freeTextTurn() {
        Conversation conversation = new Conversation("s1", Instant.now());
        runWorkOn(conversation, "s1");
        NluResult nlu = new NluResult("greet", List.of());
        Turn turn = new Turn("greet", List.of(), "hi", Instant.now());
        DialogueAction action = DialogueAction.conversational("greet", "Hi!");
        when(classifier.classify("hi")).thenReturn(nlu);
        when(turnMapper.toTurn(nlu, "hi")).thenReturn(turn);
        when(stateMachine.handle(turn, conversation.getSlots(), conversation.getState())).thenReturn(action);
        when(composer.compose(action)).thenReturn(List.of(ResponseMessage.text("Hi!")));

        TurnResponse response = service.handleTurn("s1", "hi");

        assertThat(response.getSessionId()).isEqualTo("s1");
        assertThat(response.getMessages()).extracting(ResponseMessage::getText).containsExactly("Hi!");
    }

    @Test
    @DisplayName("A pre-classified turn skips the classifier")
    void classifiedTurn() {
        Conversation conversation = new Conversation("s2", Instant.now());
        runWorkOn(conversation, "s2");
        NluResult nlu = new NluResult("goodbye", List.of());
        Turn turn = new Turn("goodbye", List.of(), "bye", Instant.now());
        DialogueAction action = DialogueAction.conversational("goodbye", "Bye");
        when(turnMapper.toTurn(nlu, "bye")).thenReturn(turn);
        when(stateMachine.handle(turn, conversation.getSlots(), conversation.getState())).thenReturn(action);
        when(composer.compose(action)).thenReturn(List.of(ResponseMessage.text("Bye")));

        TurnResponse response = service.handleClassifiedTurn("s2", "bye", nlu);

        assertThat(response.getMessages()).hasSize(1);
        verify(classifier, never()).classify(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("A session that stays locked gets the busy reply")
    void busySession() {
        when(conversations.execute(eq("s3"), any(), any()))
                .thenAnswer(inv -> ((Supplier<Object>) inv.getArgument(2)).get());
        when(composer.compose(any(DialogueAction.class)))
                .thenAnswer(inv -> new ResponseComposer().compose(inv.getArgument(0)));

        TurnResponse response = service.handleTurn("s3", "hello");

        assertThat(response.getMessages()).singleElement()
                .satisfies(m -> assertThat(m.getText()).startsWith("I'm still working on your previous message"));
        verify(classifier, never()).classify(any());
        verify(stateMachine, never()).handle(any(), any(), any());
    }

    @Test
    void blankSessionIdFallsBackToDefault() {
        assertThat(PlannerService.sessionKey(null)).isEqualTo(PlannerService.DEFAULT_SESSION);
        assertThat(PlannerService.sessionKey("  ")).isEqualTo(PlannerService.DEFAULT_SESSION);
        assertThat(PlannerService.sessionKey(" abc ")).isEqualTo("abc");
    }

    @Test
    void resetDelegatesWithNormalizedKey() {
        when(conversations.reset("abc")).thenReturn(true);

        assertThat(service.reset(" abc ")).isTrue();
    }
}
