package com.example.ecotravel.common.turn;

/** Inbound user message for one conversation turn. */
public class TurnRequest {
    private String sessionId;
    private String message;

    public TurnRequest() {}

    public TurnRequest(String sessionId, String message) {
        this.sessionId = sessionId;
        this.message = message;
    }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
}
