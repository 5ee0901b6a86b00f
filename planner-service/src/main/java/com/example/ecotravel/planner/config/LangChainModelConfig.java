package com.example.ecotravel.planner.config;

import com.example.ecotravel.planner.agent.TravelKnowledgeAgent;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LangChainModelConfig {

    @Bean
    public ChatLanguageModel chatLanguageModel(PlannerOllamaProperties props) {
        return OllamaChatModel.builder()
                .baseUrl(props.getBaseUrl())
                .modelName(props.getChatModel())
                .timeout(Duration.ofMillis(props.getRequestTimeoutMs()))
                .temperature(props.getTemperature())
                .build();
    }

    @Bean
    public EmbeddingModel embeddingModel(PlannerOllamaProperties props) {
        return OllamaEmbeddingModel.builder()
                .baseUrl(props.getBaseUrl())
                .modelName(props.getEmbeddingModel())
                .timeout(Duration.ofMillis(props.getRequestTimeoutMs()))
                .build();
    }

    @Bean
    public TravelKnowledgeAgent travelKnowledgeAgent(ChatLanguageModel model) {
        return AiServices.builder(TravelKnowledgeAgent.class)
                .chatLanguageModel(model)
                .build();
    }
}
