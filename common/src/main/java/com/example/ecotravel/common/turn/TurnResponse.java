package com.example.ecotravel.common.turn;

import java.util.ArrayList;
import java.util.List;

/** Ordered reply messages produced for one turn. */
public class TurnResponse {
    private String sessionId;
    private List<ResponseMessage> messages = new ArrayList<>();

    public TurnResponse() {}

    public TurnResponse(String sessionId, List<ResponseMessage> messages) {
        this.sessionId = sessionId;
        if (messages != null) this.messages = new ArrayList<>(messages);
    }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public List<ResponseMessage> getMessages() { return messages; }
    public void setMessages(List<ResponseMessage> messages) { this.messages = messages; }
}
