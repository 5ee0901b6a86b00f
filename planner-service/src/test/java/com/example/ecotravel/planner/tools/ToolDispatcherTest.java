package com.example.ecotravel.planner.tools;

import com.example.ecotravel.planner.config.PlannerToolsProperties;
import com.example.ecotravel.planner.domain.ErrorKind;
import com.example.ecotravel.planner.slots.IntentSchema;
import com.example.ecotravel.planner.slots.IntentSchemaTable;
import com.example.ecotravel.planner.slots.SlotDefinition;
import com.example.ecotravel.planner.slots.SlotType;
import com.example.ecotravel.planner.support.ExternalCallGuard;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ToolDispatcherTest {

    private static final SlotDefinition THING = new SlotDefinition("thing", SlotType.TEXT, "thing", null, "Count what?");

    private ExecutorService executor;
    private CountingTool tool;
    private ToolDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        tool = new CountingTool();
        IntentSchemaTable table = IntentSchemaTable.of(
                IntentSchema.builder("count_things").required(THING).tool("counter").build(),
                IntentSchema.builder("ask_question").retrieval().build(),
                IntentSchema.builder("ghost").required(THING).tool("missing").build());
        PlannerToolsProperties props = new PlannerToolsProperties();
        props.setDefaultTimeoutMs(300);
        dispatcher = new ToolDispatcher(table, new ToolRegistry(List.of(tool)), new ExternalCallGuard(executor), props);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void whenInputsComplete_thenHandlerPayloadReturned() {
        ToolResult r = dispatcher.dispatch("count_things", Map.of("thing", "trees"));

        assertThat(r.isSuccess()).isTrue();
        assertThat(r.getToolName()).isEqualTo("counter");
        assertThat(r.getPayload()).containsEntry("summary", "counted trees");
        assertThat(tool.calls).hasValue(1);
    }

    @Test
    void whenIntentHasNoToolTarget_thenUnknownIntentWithoutInvocation() {
        assertThat(dispatcher.dispatch("order_pizza", Map.of()).getErrorKind()).isEqualTo(ErrorKind.UNKNOWN_INTENT);
        assertThat(dispatcher.dispatch("ask_question", Map.of()).getErrorKind()).isEqualTo(ErrorKind.UNKNOWN_INTENT);
        assertThat(dispatcher.dispatch("ghost", Map.of("thing", "x")).getErrorKind()).isEqualTo(ErrorKind.UNKNOWN_INTENT);
        assertThat(tool.calls).hasValue(0);
    }

    @Test
    void whenRequiredInputMissing_thenIncompleteInputWithoutInvocation() {
        ToolResult r = dispatcher.dispatch("count_things", Map.of("other", "x"));

        assertThat(r.isSuccess()).isFalse();
        assertThat(r.getErrorKind()).isEqualTo(ErrorKind.INCOMPLETE_INPUT);
        assertThat(tool.calls).hasValue(0);
    }

    @Test
    void whenSameInputsWithinOneTurn_thenHandlerCalledOnce() {
        ToolCallCache turn = new ToolCallCache();

        ToolResult first = dispatcher.dispatch("count_things", Map.of("thing", "Trees "), turn);
        ToolResult second = dispatcher.dispatch("count_things", Map.of("thing", "trees"), turn);

        assertThat(second).isSameAs(first);
        assertThat(tool.calls).hasValue(1);
    }

    @Test
    void whenSameInputsInDifferentTurns_thenHandlerCalledEachTime() {
        dispatcher.dispatch("count_things", Map.of("thing", "trees"), new ToolCallCache());
        dispatcher.dispatch("count_things", Map.of("thing", "trees"), new ToolCallCache());

        assertThat(tool.calls).hasValue(2);
    }

    @Test
    void whenHandlerTooSlow_thenTimeoutAndNextCallStillServed() {
        ToolResult slow = dispatcher.dispatch("count_things", Map.of("thing", "slow"));
        ToolResult fast = dispatcher.dispatch("count_things", Map.of("thing", "bikes"));

        assertThat(slow.isSuccess()).isFalse();
        assertThat(slow.getErrorKind()).isEqualTo(ErrorKind.TOOL_TIMEOUT);
        assertThat(fast.isSuccess()).isTrue();
    }

    @Test
    void whenHandlerFails_thenFailureKindIsKept() {
        assertThat(dispatcher.dispatch("count_things", Map.of("thing", "broken")).getErrorKind())
                .isEqualTo(ErrorKind.TOOL_UNAVAILABLE);
        assertThat(dispatcher.dispatch("count_things", Map.of("thing", "crash")).getErrorKind())
                .isEqualTo(ErrorKind.TOOL_UNAVAILABLE);
    }

    static class CountingTool implements ToolHandler {
        final AtomicInteger calls = new AtomicInteger();

        @Override
        public String name() {
            return "counter";
        }

        @Override
        public Set<String> requiredInputs() {
            return Set.of("thing");
        }

        @Override
        public Map<String, Object> execute(Map<String, Object> inputs) throws ToolException {
            calls.incrementAndGet();
            String thing = String.valueOf(inputs.get("thing"));
            switch (thing) {
                case "slow":
                    try {
                        Thread.sleep(5000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    break;
                case "broken":
                    throw new ToolException("service down");
                case "crash":
                    throw new IllegalStateException("boom");
                default:
                    break;
            }
            return Map.of("summary", "counted " + thing.trim().toLowerCase());
        }
    }
}
