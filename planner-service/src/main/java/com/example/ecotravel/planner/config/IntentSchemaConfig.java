package com.example.ecotravel.planner.config;

import com.example.ecotravel.planner.slots.IntentSchema;
import com.example.ecotravel.planner.slots.IntentSchemaTable;
import com.example.ecotravel.planner.slots.SlotDefinition;
import com.example.ecotravel.planner.slots.SlotType;
import com.example.ecotravel.planner.tools.EmissionsTool;
import com.example.ecotravel.planner.tools.RoutingTool;
import com.example.ecotravel.planner.tools.ToolRegistry;
import com.example.ecotravel.planner.tools.WeatherTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The intents the planner understands and what each one needs before it can be served.
 */
@Configuration
public class IntentSchemaConfig {

    private static final Logger log = LoggerFactory.getLogger(IntentSchemaConfig.class);

    public static final String PLAN_ROUTE = "plan_route";
    public static final String GET_WEATHER = "get_weather";
    public static final String ESTIMATE_EMISSIONS = "estimate_emissions";
    public static final String ASK_TRAVEL_KNOWLEDGE = "ask_travel_knowledge";
    public static final String GREET = "greet";
    public static final String GOODBYE = "goodbye";
    public static final String RESTART = "restart";

    static final SlotDefinition ORIGIN = SlotDefinition.place("origin", "starting point",
            "Where are you starting from?");
    static final SlotDefinition DESTINATION = SlotDefinition.place("destination", "destination",
            "Where would you like to go?");
    static final SlotDefinition TRANSPORT_MODE = new SlotDefinition("transport_mode", SlotType.TEXT, "transport_mode",
            "transport mode", "How will you travel: train, bus, car, ferry or flight?");
    static final SlotDefinition TRAVEL_DATE = new SlotDefinition("travel_date", SlotType.DATE, "date",
            "travel date", "When are you travelling?");

    @Bean
    public IntentSchemaTable intentSchemaTable(ToolRegistry registry) {
        IntentSchemaTable table = defaultTable();
        table.validate(registry::requiredInputsOf);
        log.info("[IntentSchemaConfig] Intents: {} over tools {}", table.intents(), registry.names());
        return table;
    }

    public static IntentSchemaTable defaultTable() {
        return IntentSchemaTable.of(
                IntentSchema.builder(PLAN_ROUTE)
                        .required(ORIGIN, DESTINATION)
                        .optional(TRANSPORT_MODE, TRAVEL_DATE)
                        .tool(RoutingTool.NAME)
                        .build(),
                IntentSchema.builder(GET_WEATHER)
                        .required(DESTINATION)
                        .optional(TRAVEL_DATE)
                        .tool(WeatherTool.NAME)
                        .build(),
                IntentSchema.builder(ESTIMATE_EMISSIONS)
                        .required(ORIGIN, DESTINATION, TRANSPORT_MODE)
                        .tool(EmissionsTool.NAME)
                        .build(),
                IntentSchema.builder(ASK_TRAVEL_KNOWLEDGE)
                        .retrieval()
                        .build(),
                IntentSchema.builder(GREET)
                        .conversational("Hi! I can plan routes, check the weather at your destination, estimate "
                                + "the carbon footprint of a trip and answer sustainable travel questions.", false)
                        .build(),
                IntentSchema.builder(GOODBYE)
                        .conversational("Have a great, green trip! Goodbye.", true)
                        .build(),
                IntentSchema.builder(RESTART)
                        .conversational("Okay, let's start over. Where would you like to go?", true)
                        .build()
        );
    }
}
