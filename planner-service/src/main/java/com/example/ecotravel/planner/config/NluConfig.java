package com.example.ecotravel.planner.config;

import com.example.ecotravel.planner.nlu.LlmNluClassifier;
import com.example.ecotravel.planner.nlu.NluClassifier;
import com.example.ecotravel.planner.nlu.RuleBasedNluClassifier;
import com.example.ecotravel.planner.slots.IntentSchemaTable;
import com.example.ecotravel.planner.support.ExternalCallGuard;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatLanguageModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
public class NluConfig {

    @Bean
    @Primary
    @ConditionalOnProperty(prefix = "planner.nlu", name = "provider", havingValue = "llm")
    public NluClassifier llmNluClassifier(ChatLanguageModel model, RuleBasedNluClassifier rules, ExternalCallGuard guard,
                                          ObjectMapper mapper, IntentSchemaTable schemas, PlannerNluProperties props) {
        return new LlmNluClassifier(model, rules, guard, mapper, schemas.intents(), props.getTimeoutMs());
    }
}
