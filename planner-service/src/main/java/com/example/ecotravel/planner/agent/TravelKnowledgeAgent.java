package com.example.ecotravel.planner.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * LangChain4j AI service answering sustainable-travel questions from retrieved context only.
 */
@SystemMessage("You are a sustainable travel assistant. Answer the question using only the context provided. "
        + "If the context does not contain the answer, say you don't know; never make facts up. "
        + "Be concise, factual and eco-friendly. Plain text only.")
public interface TravelKnowledgeAgent {

    @UserMessage("Context:\n{{context}}\n\nQuestion: {{question}}")
    String answer(@V("context") String context, @V("question") String question);
}
