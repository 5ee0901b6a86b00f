package com.example.ecotravel.planner.slots;

import com.example.ecotravel.planner.config.IntentSchemaConfig;
import com.example.ecotravel.planner.config.PlannerToolsProperties;
import com.example.ecotravel.planner.tools.EmissionsTool;
import com.example.ecotravel.planner.tools.RoutingTool;
import com.example.ecotravel.planner.tools.ToolRegistry;
import com.example.ecotravel.planner.tools.WeatherTool;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntentSchemaTableTest {

    private static final SlotDefinition DESTINATION = SlotDefinition.place("destination", "destination", "Where to?");

    @Test
    void defaultTable_validatesAgainstTheRegisteredTools() {
        PlannerToolsProperties props = new PlannerToolsProperties();
        ToolRegistry registry = new ToolRegistry(List.of(new RoutingTool(props), new WeatherTool(props), new EmissionsTool()));

        IntentSchemaTable table = IntentSchemaConfig.defaultTable();

        assertThat(registry.names()).containsExactlyInAnyOrder("routing", "weather", "emissions");
        assertThatCode(() -> table.validate(registry::requiredInputsOf)).doesNotThrowAnyException();
        assertThat(table.find("ask_travel_knowledge")).get()
                .extracting(IntentSchema::getTarget).isEqualTo(TargetKind.RETRIEVAL);
        assertThat(table.find("plan_route")).get()
                .extracting(IntentSchema::getToolName).isEqualTo("routing");
    }

    @Test
    void whenIntentNamesUnregisteredTool_thenValidationFails() {
        IntentSchemaTable table = IntentSchemaTable.of(
                IntentSchema.builder("book_hotel").required(DESTINATION).tool("hotels").build());

        assertThatThrownBy(() -> table.validate(Map.of("weather", Set.of("destination"))::get))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("hotels");
    }

    @Test
    void whenToolNeedsUndeclaredInput_thenValidationFails() {
        IntentSchemaTable table = IntentSchemaTable.of(
                IntentSchema.builder("get_weather").optional(DESTINATION).tool("weather").build());

        assertThatThrownBy(() -> table.validate(Map.of("weather", Set.of("destination"))::get))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("destination");
    }

    @Test
    void whenIntentListedTwice_thenRejected() {
        IntentSchema a = IntentSchema.builder("greet").conversational("Hi", false).build();
        IntentSchema b = IntentSchema.builder("greet").conversational("Hello", false).build();

        assertThatThrownBy(() -> IntentSchemaTable.of(a, b)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void whenSlotDeclaredTwice_thenRejected() {
        assertThatThrownBy(() -> IntentSchema.builder("plan_route").required(DESTINATION).optional(DESTINATION).tool("routing").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownIntent_isAbsent() {
        assertThat(IntentSchemaConfig.defaultTable().find("order_pizza")).isEmpty();
        assertThat(IntentSchemaConfig.defaultTable().find(null)).isEmpty();
    }
}
