package me.golemcore.agentserver.adapter.inbound.framework;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentserver.domain.model.AgentEvent;
import me.golemcore.agentserver.domain.model.EventKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphEventConverterTest {

    private GraphEventConverter converter;

    @BeforeEach
    void setUp() {
        converter = new GraphEventConverter(new ObjectMapper());
    }

    private static Map<String, Object> streamEvent(String type, String name, String runId, Map<String, Object> data) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", type);
        if (name != null) {
            event.put("name", name);
        }
        if (runId != null) {
            event.put("run_id", runId);
        }
        event.put("data", data);
        return event;
    }

    private static Map<String, Object> modelChunk(Map<String, Object> chunk) {
        return streamEvent("on_chat_model_stream", "model", "llm-run", Map.of("chunk", chunk));
    }

    // --- streamed events ---

    @Test
    void shouldConvertModelTextChunk() {
        List<AgentEvent> events = converter.convert(modelChunk(Map.of("content", "Hello")));

        assertEquals(1, events.size());
        assertEquals(EventKind.TEXT, events.get(0).kind());
        assertEquals("Hello", events.get(0).getString(AgentEvent.DELTA));
    }

    @Test
    void shouldJoinTextParts() {
        List<AgentEvent> events = converter.convert(modelChunk(Map.of("content",
                List.of(Map.of("type", "text", "text", "a"), Map.of("type", "image"), "b"))));

        assertEquals("ab", events.get(0).getString(AgentEvent.DELTA));
    }

    @Test
    void shouldTrackToolCallChunksByIndex() {
        List<AgentEvent> first = converter.convert(modelChunk(Map.of("content", "", "tool_call_chunks",
                List.of(Map.of("index", 0, "id", "call_1", "name", "get_weather", "args", "{\"city\":")))));
        List<AgentEvent> second = converter.convert(modelChunk(Map.of("tool_call_chunks",
                List.of(Map.of("index", 0, "args", "\"Paris\"}")))));

        assertEquals(1, first.size());
        assertEquals(EventKind.TOOL_CALL_CHUNK, first.get(0).kind());
        assertEquals("call_1", first.get(0).getString(AgentEvent.ID));
        assertEquals("get_weather", first.get(0).getString(AgentEvent.NAME));
        assertEquals("call_1", second.get(0).getString(AgentEvent.ID));
        assertEquals("\"Paris\"}", second.get(0).getString(AgentEvent.ARGS_DELTA));
    }

    @Test
    void shouldFallBackToIndexWhenIdIsUnknown() {
        List<AgentEvent> events = converter.convert(modelChunk(Map.of("tool_call_chunks",
                List.of(Map.of("index", 3, "args", "{}")))));

        assertEquals("3", events.get(0).getString(AgentEvent.ID));
    }

    @Test
    void shouldMatchToolStartToAnnouncedCallByName() {
        converter.convert(modelChunk(Map.of("tool_call_chunks",
                List.of(Map.of("index", 0, "id", "call_1", "name", "search", "args", "{}")))));

        List<AgentEvent> started = converter.convert(streamEvent("on_tool_start", "search", "tool-run-1",
                Map.of("input", Map.of("q", "java"))));
        List<AgentEvent> ended = converter.convert(streamEvent("on_tool_end", "search", "tool-run-1",
                Map.of("output", Map.of("content", "found"))));

        assertTrue(started.isEmpty());
        assertEquals(1, ended.size());
        assertEquals(EventKind.TOOL_RESULT, ended.get(0).kind());
        assertEquals("call_1", ended.get(0).getString(AgentEvent.ID));
        assertEquals("found", ended.get(0).getString(AgentEvent.RESULT));
    }

    @Test
    void shouldPreferRuntimeToolCallId() {
        List<AgentEvent> started = converter.convert(streamEvent("on_tool_start", "search", "tool-run-1",
                Map.of("input", Map.of("q", "java", "runtime", Map.of("tool_call_id", "call_rt"), "_private", 1))));

        assertEquals(1, started.size());
        assertEquals("call_rt", started.get(0).getString(AgentEvent.ID));
        assertEquals("{\"q\":\"java\"}", started.get(0).getString(AgentEvent.ARGS_DELTA));
    }

    @Test
    void shouldUseRunIdForUnannouncedTool() {
        List<AgentEvent> started = converter.convert(streamEvent("on_tool_start", "calc", "tool-run-9",
                Map.of("input", Map.of("x", 1))));
        List<AgentEvent> ended = converter.convert(streamEvent("on_tool_end", "calc", "tool-run-9",
                Map.of("output", "2")));

        assertEquals("tool-run-9", started.get(0).getString(AgentEvent.ID));
        assertEquals("tool-run-9", ended.get(0).getString(AgentEvent.ID));
        assertEquals("2", ended.get(0).getString(AgentEvent.RESULT));
    }

    @Test
    void shouldConvertModelNodeStreamMessages() {
        List<AgentEvent> events = converter.convert(streamEvent("on_chain_stream", "model", null,
                Map.of("chunk", Map.of("messages", List.of(Map.of("type", "ai", "content", "Let me look.",
                        "tool_calls", List.of(Map.of("id", "call_2", "name", "search", "args", Map.of("q", "x")))))))));

        assertEquals(2, events.size());
        assertEquals("Let me look.", events.get(0).getString(AgentEvent.DELTA));
        assertEquals("call_2", events.get(1).getString(AgentEvent.ID));
        assertEquals("{\"q\":\"x\"}", events.get(1).getString(AgentEvent.ARGS_DELTA));
    }

    @Test
    void shouldIgnoreChainStreamOfOtherNodes() {
        assertTrue(converter.convert(streamEvent("on_chain_stream", "tools", null,
                Map.of("chunk", Map.of("messages", List.of(Map.of("type", "ai", "content", "x")))))).isEmpty());
    }

    @Test
    void shouldConvertToolErrorWithToolCallId() {
        converter.convert(streamEvent("on_tool_start", "search", "tool-run-1",
                Map.of("input", Map.of("runtime", Map.of("tool_call_id", "call_1")))));

        List<AgentEvent> events = converter.convert(streamEvent("on_tool_error", "search", "tool-run-1",
                Map.of("error", "timeout")));

        AgentEvent error = events.get(0);
        assertEquals(EventKind.ERROR, error.kind());
        assertEquals("TOOL_ERROR", error.getString(AgentEvent.CODE));
        assertEquals("Tool 'search' error: timeout", error.getString(AgentEvent.MESSAGE));
        assertEquals("call_1", error.getString(AgentEvent.TOOL_CALL_ID));
    }

    @Test
    void shouldConvertFrameworkErrors() {
        assertEquals("LLM_ERROR", converter.convert(streamEvent("on_llm_error", null, null,
                Map.of("error", "rate limited"))).get(0).getString(AgentEvent.CODE));
        AgentEvent chainError = converter.convert(streamEvent("on_chain_error", "planner", null,
                Map.of("error", new IllegalStateException("bad state")))).get(0);
        assertEquals("CHAIN_ERROR", chainError.getString(AgentEvent.CODE));
        assertEquals("Chain 'planner' error: IllegalStateException: bad state",
                chainError.getString(AgentEvent.MESSAGE));
        assertEquals("RETRIEVER_ERROR", converter.convert(streamEvent("on_retriever_error", "docs", null,
                Map.of("error", "index missing"))).get(0).getString(AgentEvent.CODE));
    }

    // --- node updates and state values ---

    @Test
    void shouldConvertNodeUpdates() {
        Map<String, Object> update = new LinkedHashMap<>();
        update.put("model", Map.of("messages", List.of(Map.of("type", "ai", "content", "",
                "tool_calls", List.of(Map.of("id", "call_1", "name", "search", "args", Map.of("q", "x")))))));
        update.put("tools", Map.of("messages", List.of(Map.of("type", "tool", "tool_call_id", "call_1",
                "content", "found"))));
        update.put("__end__", Map.of("messages", List.of(Map.of("type", "ai", "content", "ignored"))));

        List<AgentEvent> events = converter.convert(update);

        assertEquals(2, events.size());
        assertEquals(EventKind.TOOL_CALL_CHUNK, events.get(0).kind());
        assertEquals(EventKind.TOOL_RESULT, events.get(1).kind());
        assertEquals("found", events.get(1).getString(AgentEvent.RESULT));
    }

    @Test
    void shouldUseOutputFallbackInNodeUpdate() {
        List<AgentEvent> events = converter.convert(Map.of("agent",
                Map.of("output", Map.of("role", "assistant", "content", "Answer"))));

        assertEquals("Answer", events.get(0).getString(AgentEvent.DELTA));
    }

    @Test
    void shouldConvertOnlyLastMessageOfStateValues() {
        List<AgentEvent> events = converter.convert(Map.of("messages", List.of(
                Map.of("type", "human", "content", "Hi"),
                Map.of("type", "ai", "content", "Earlier"),
                Map.of("type", "ai", "content", "Latest"))));

        assertEquals(1, events.size());
        assertEquals("Latest", events.get(0).getString(AgentEvent.DELTA));
    }

    @Test
    void shouldHonorCustomMessagesKey() {
        GraphEventConverter custom = new GraphEventConverter(new ObjectMapper(), "history");

        List<AgentEvent> events = custom.convert(Map.of("history", List.of(Map.of("role", "assistant",
                "content", "ok"))));

        assertEquals("ok", events.get(0).getString(AgentEvent.DELTA));
    }

    @Test
    void shouldIgnoreUnknownInput() {
        assertTrue(converter.convert("plain string").isEmpty());
        assertTrue(converter.convert(Map.of("event", "custom_thing")).isEmpty());
        assertTrue(converter.convert(Map.of("status", "ok")).isEmpty());
    }

    // --- helpers ---

    @Test
    void shouldFormatToolOutput() {
        assertEquals("", converter.formatToolOutput(null));
        assertEquals("text", converter.formatToolOutput("text"));
        assertEquals("r", converter.formatToolOutput(Map.of("result", "r")));
        assertEquals("[1,2]", converter.formatToolOutput(Map.of("content", List.of(1, 2))));
        assertEquals("{\"a\":1}", converter.formatToolOutput(Map.of("a", 1)));
    }

    @Test
    void shouldFilterInternalInputKeys() {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("q", "x");
        input.put("config", Map.of());
        input.put("configurable", Map.of());
        input.put("runtime", Map.of());
        input.put("_state", 1);

        assertEquals(Map.of("q", "x"), GraphEventConverter.filterInput(input));
    }

    @Test
    void shouldForgetCorrelationsOnReset() {
        converter.convert(modelChunk(Map.of("tool_call_chunks",
                List.of(Map.of("index", 0, "id", "call_1", "name", "search", "args", "")))));
        converter.reset();

        List<AgentEvent> events = converter.convert(modelChunk(Map.of("tool_call_chunks",
                List.of(Map.of("index", 0, "args", "{}")))));

        assertEquals("0", events.get(0).getString(AgentEvent.ID));
    }

    @Test
    void shouldConvertWholeStream() {
        Flux<Object> upstream = Flux.just(
                modelChunk(Map.of("content", "Hel")),
                modelChunk(Map.of("content", "lo")),
                Map.of("event", "on_chain_start", "data", Map.of()));

        StepVerifier.create(converter.convertAll(upstream))
                .assertNext(event -> assertEquals("Hel", event.getString(AgentEvent.DELTA)))
                .assertNext(event -> assertEquals("lo", event.getString(AgentEvent.DELTA)))
                .verifyComplete();
    }
}
