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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one user turn end to end: classify, decide, compose. Everything that touches a
 * conversation happens while holding that conversation's lock.
 */
@Service
public class PlannerService {

    private static final Logger log = LoggerFactory.getLogger(PlannerService.class);

    public static final String DEFAULT_SESSION = "default";

    private final ConversationRegistry conversations;
    private final NluClassifier classifier;
    private final NluTurnMapper turnMapper;
    private final DialogueStateMachine stateMachine;
    private final ResponseComposer composer;

    public PlannerService(ConversationRegistry conversations, NluClassifier classifier, NluTurnMapper turnMapper,
                          DialogueStateMachine stateMachine, ResponseComposer composer) {
        this.conversations = conversations;
        this.classifier = classifier;
        this.turnMapper = turnMapper;
        this.stateMachine = stateMachine;
        this.composer = composer;
    }

    public TurnResponse handleTurn(String sessionId, String message) {
        return run(sessionId, message, null);
    }

    /** Turn already classified by an external NLU. */
    public TurnResponse handleClassifiedTurn(String sessionId, String message, NluResult nlu) {
        return run(sessionId, message, nlu != null ? nlu : NluResult.fallback());
    }

    private TurnResponse run(String sessionId, String message, NluResult preClassified) {
        String id = sessionKey(sessionId);
        long start = System.currentTimeMillis();
        List<ResponseMessage> messages = conversations.execute(id,
                c -> respond(c, message, preClassified),
                () -> composer.compose(DialogueAction.busy()));
        log.debug("[PlannerService] Session {} turn done in {} ms", id, System.currentTimeMillis() - start);
        return new TurnResponse(id, messages);
    }

    private List<ResponseMessage> respond(Conversation conversation, String message, NluResult preClassified) {
        NluResult nlu = preClassified != null ? preClassified : classifier.classify(message);
        Turn turn = turnMapper.toTurn(nlu, message);
        DialogueAction action = stateMachine.handle(turn, conversation.getSlots(), conversation.getState());
        return composer.compose(action);
    }

    public boolean reset(String sessionId) {
        return conversations.reset(sessionKey(sessionId));
    }

    public Optional<Map<String, Object>> describe(String sessionId) {
        return conversations.snapshot(sessionKey(sessionId));
    }

    static String sessionKey(String sessionId) {
        return sessionId != null && !sessionId.isBlank() ? sessionId.trim() : DEFAULT_SESSION;
    }
}
