package com.example.ecotravel.common.turn;

import com.example.ecotravel.common.nlu.NluResult;

/**
 * Turn whose message was already classified by an external NLU front-end.
 */
public class ClassifiedTurnRequest extends TurnRequest {
    private NluResult nlu;

    public ClassifiedTurnRequest() {}

    public ClassifiedTurnRequest(String sessionId, String message, NluResult nlu) {
        super(sessionId, message);
        this.nlu = nlu;
    }

    public NluResult getNlu() { return nlu; }
    public void setNlu(NluResult nlu) { this.nlu = nlu; }
}
