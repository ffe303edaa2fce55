package me.golemcore.agentserver.adapter.inbound.web.openai;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentserver.adapter.inbound.web.SseFrames;
import me.golemcore.agentserver.adapter.inbound.web.SseTestFrames;
import me.golemcore.agentserver.domain.model.AdditionMergePolicy;
import me.golemcore.agentserver.domain.model.ProtocolType;
import me.golemcore.agentserver.domain.model.RunContext;
import me.golemcore.agentserver.domain.model.SignalType;
import me.golemcore.agentserver.domain.model.StreamSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenAiChunkEncoderTest {

    private OpenAiChunkEncoder encoder;
    private RunContext context;

    @BeforeEach
    void setUp() {
        encoder = new OpenAiChunkEncoder(new ObjectMapper());
        context = RunContext.builder()
                .runId("run-1")
                .protocol(ProtocolType.OPENAI)
                .responseId("chatcmpl-abc123def456")
                .model("agentrun")
                .created(1_700_000_000L)
                .build();
    }

    private Map<String, Object> single(StreamSignal signal) {
        List<String> frames = encoder.encode(signal, context);
        assertEquals(1, frames.size());
        return SseTestFrames.parse(SseTestFrames.data(frames.get(0)).get(0));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> choice(Map<String, Object> chunk) {
        return ((List<Map<String, Object>>) chunk.get("choices")).get(0);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> delta(Map<String, Object> chunk) {
        return (Map<String, Object>) choice(chunk).get("delta");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> firstToolCall(Map<String, Object> chunk) {
        return ((List<Map<String, Object>>) delta(chunk).get("tool_calls")).get(0);
    }

    // --- text ---

    @Test
    void shouldEncodeFirstTextChunkWithRole() {
        Map<String, Object> chunk = single(StreamSignal.builder()
                .type(SignalType.TEXT_MESSAGE_CONTENT).delta("Hello ").firstContent(true).build());

        assertEquals("chatcmpl-abc123def456", chunk.get("id"));
        assertEquals("chat.completion.chunk", chunk.get("object"));
        assertEquals(1_700_000_000, chunk.get("created"));
        assertEquals("agentrun", chunk.get("model"));
        assertEquals(Map.of("role", "assistant", "content", "Hello "), delta(chunk));
        assertEquals(0, choice(chunk).get("index"));
        assertTrue(choice(chunk).containsKey("finish_reason"));
        assertNull(choice(chunk).get("finish_reason"));
    }

    @Test
    void shouldOmitRoleAfterFirstContent() {
        Map<String, Object> chunk = single(StreamSignal.builder()
                .type(SignalType.TEXT_MESSAGE_CONTENT).delta("World").build());

        assertEquals(Map.of("content", "World"), delta(chunk));
    }

    @Test
    void shouldMergeAdditionIntoDelta() {
        Map<String, Object> chunk = single(StreamSignal.builder()
                .type(SignalType.TEXT_MESSAGE_CONTENT)
                .delta("x")
                .addition(Map.of("reasoning_content", "thinking", "content", "y"))
                .additionMergePolicy(AdditionMergePolicy.OVERRIDE_ONLY)
                .build());

        assertEquals(Map.of("content", "y"), delta(chunk));
    }

    @Test
    void shouldIgnoreMessageBoundaries() {
        assertTrue(encoder.encode(StreamSignal.builder().type(SignalType.TEXT_MESSAGE_START).build(), context)
                .isEmpty());
        assertTrue(encoder.encode(StreamSignal.builder().type(SignalType.TOOL_CALL_END).build(), context)
                .isEmpty());
        assertTrue(encoder.encode(StreamSignal.builder().type(SignalType.TOOL_CALL_RESULT).build(), context)
                .isEmpty());
        assertTrue(encoder.encode(StreamSignal.builder().type(SignalType.RUN_STARTED).build(), context).isEmpty());
    }

    // --- tool calls ---

    @Test
    void shouldEncodeToolCallStart() {
        Map<String, Object> chunk = single(StreamSignal.builder()
                .type(SignalType.TOOL_CALL_START)
                .toolCallId("tc-1")
                .toolCallName("get_weather")
                .toolCallIndex(0)
                .firstContent(true)
                .build());

        assertEquals("assistant", delta(chunk).get("role"));
        Map<String, Object> toolCall = firstToolCall(chunk);
        assertEquals(0, toolCall.get("index"));
        assertEquals("tc-1", toolCall.get("id"));
        assertEquals("function", toolCall.get("type"));
        assertEquals(Map.of("name", "get_weather", "arguments", ""), toolCall.get("function"));
    }

    @Test
    void shouldEncodeToolCallArguments() {
        Map<String, Object> chunk = single(StreamSignal.builder()
                .type(SignalType.TOOL_CALL_ARGS)
                .toolCallId("tc-1")
                .toolCallIndex(1)
                .delta("{\"city\":")
                .build());

        Map<String, Object> toolCall = firstToolCall(chunk);
        assertEquals(1, toolCall.get("index"));
        assertFalse(toolCall.containsKey("id"));
        assertEquals(Map.of("arguments", "{\"city\":"), toolCall.get("function"));
    }

    @Test
    void shouldSkipEmptyArgumentsAndHitlCalls() {
        assertTrue(encoder.encode(StreamSignal.builder().type(SignalType.TOOL_CALL_ARGS).delta("").build(), context)
                .isEmpty());
        assertTrue(encoder.encode(StreamSignal.builder()
                .type(SignalType.TOOL_CALL_START).toolCallId("h-1").hitl(true).build(), context).isEmpty());
        assertTrue(encoder.encode(StreamSignal.builder()
                .type(SignalType.TOOL_CALL_ARGS).toolCallId("h-1").delta("{}").hitl(true).build(), context)
                .isEmpty());
    }

    // --- run end ---

    @Test
    void shouldFinishWithStopAndDone() {
        List<String> frames = encoder.encode(StreamSignal.builder().type(SignalType.RUN_FINISHED).build(), context);

        assertEquals(2, frames.size());
        Map<String, Object> chunk = SseTestFrames.parse(SseTestFrames.data(frames.get(0)).get(0));
        assertEquals("stop", choice(chunk).get("finish_reason"));
        assertEquals(Map.of(), delta(chunk));
        assertEquals(SseFrames.DONE, frames.get(1));
    }

    @Test
    void shouldFinishWithToolCallsReason() {
        List<String> frames = encoder.encode(StreamSignal.builder()
                .type(SignalType.RUN_FINISHED).toolCallsEmitted(true).build(), context);

        Map<String, Object> chunk = SseTestFrames.parse(SseTestFrames.data(frames.get(0)).get(0));
        assertEquals("tool_calls", choice(chunk).get("finish_reason"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldEncodeErrorFrameAndDone() {
        List<String> frames = encoder.encode(StreamSignal.builder()
                .type(SignalType.RUN_ERROR).errorMessage("boom").errorCode("IllegalStateException").build(), context);

        assertEquals(2, frames.size());
        Map<String, Object> frame = SseTestFrames.parse(SseTestFrames.data(frames.get(0)).get(0));
        Map<String, Object> error = (Map<String, Object>) frame.get("error");
        assertEquals("boom", error.get("message"));
        assertEquals("server_error", error.get("type"));
        assertEquals("IllegalStateException", error.get("code"));
        assertEquals(SseFrames.DONE, frames.get(1));
    }

    @Test
    void shouldPassRawFrameThrough() {
        List<String> frames = encoder.encode(StreamSignal.builder()
                .type(SignalType.RAW).raw(": keep-alive").build(), context);

        assertEquals(List.of(": keep-alive\n\n"), frames);
    }
}
