package me.golemcore.agentserver.adapter.inbound.web.agui;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agentserver.adapter.inbound.web.JsonBodyReader;
import me.golemcore.agentserver.adapter.inbound.web.SseTestFrames;
import me.golemcore.agentserver.adapter.inbound.web.openai.OpenAiChatHandler;
import me.golemcore.agentserver.adapter.inbound.web.openai.OpenAiChunkEncoder;
import me.golemcore.agentserver.adapter.inbound.web.openai.OpenAiRequestParser;
import me.golemcore.agentserver.adapter.inbound.web.openai.OpenAiResponseAssembler;
import me.golemcore.agentserver.domain.invoke.AgentHandler;
import me.golemcore.agentserver.domain.invoke.AgentInvoker;
import me.golemcore.agentserver.domain.invoke.AgentOutputNormalizer;
import me.golemcore.agentserver.domain.model.AgentEvent;
import me.golemcore.agentserver.domain.model.ToolCallPolicy;
import me.golemcore.agentserver.domain.service.RunPipelineService;
import me.golemcore.agentserver.infrastructure.config.AgentServerProperties;
import me.golemcore.agentserver.infrastructure.config.ProtocolRoutesConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AguiRunHandlerWebTest {

    private static final String RUN_BODY = """
            {"threadId":"thread-1","runId":"run-1","messages":[{"id":"m-1","role":"user","content":"Hi"}]}
            """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private AgentServerProperties properties;
    private Scheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new AgentServerProperties();
        scheduler = Schedulers.newBoundedElastic(4, 100, "agent-invoker");
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private WebTestClient client(AgentHandler handler) {
        JsonBodyReader bodyReader = new JsonBodyReader(objectMapper);
        RunPipelineService pipeline = new RunPipelineService(
                new AgentInvoker(handler, scheduler, new AgentOutputNormalizer(objectMapper)), objectMapper);
        OpenAiChatHandler openAiHandler = new OpenAiChatHandler(pipeline, bodyReader, new OpenAiRequestParser(),
                new OpenAiChunkEncoder(objectMapper), new OpenAiResponseAssembler(), properties, Clock.systemUTC());
        AguiRunHandler aguiHandler = new AguiRunHandler(pipeline, bodyReader, new AguiRequestParser(),
                new AguiEventEncoder(objectMapper), properties, Clock.systemUTC());
        return WebTestClient.bindToRouterFunction(ProtocolRoutesConfig.routes(properties, openAiHandler, aguiHandler))
                .build();
    }

    private List<Map<String, Object>> run(AgentHandler handler) {
        byte[] content = client(handler).post().uri("/ag-ui/agent")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(RUN_BODY)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .expectHeader().valueEquals("Cache-Control", "no-cache")
                .expectHeader().valueEquals("X-Accel-Buffering", "no")
                .expectBody().returnResult().getResponseBodyContent();
        assertNotNull(content);
        return SseTestFrames.json(new String(content, StandardCharsets.UTF_8));
    }

    private static List<String> types(List<Map<String, Object>> frames) {
        List<String> types = new ArrayList<>();
        for (Map<String, Object> frame : frames) {
            types.add((String) frame.get("type"));
        }
        return types;
    }

    private static List<Map<String, Object>> ofType(List<Map<String, Object>> frames, String type) {
        return frames.stream().filter(frame -> type.equals(frame.get("type"))).toList();
    }

    // --- runs ---

    @Test
    void shouldStreamToolCallLifecycle() {
        List<Map<String, Object>> frames = run(AgentHandler.reactiveStream(req -> Flux.just(
                AgentEvent.toolCallChunk("tc-1", "get_weather", "{\"city\":\"Paris\"}"),
                AgentEvent.toolResult("tc-1", "Sunny"))));

        assertEquals(List.of("RUN_STARTED", "TOOL_CALL_START", "TOOL_CALL_ARGS", "TOOL_CALL_END",
                "TOOL_CALL_RESULT", "RUN_FINISHED"), types(frames));
        assertEquals("thread-1", frames.get(0).get("threadId"));
        assertEquals("run-1", frames.get(0).get("runId"));
        for (Map<String, Object> frame : frames.subList(1, 5)) {
            assertEquals("tc-1", frame.get("toolCallId"));
        }
        assertEquals("Sunny", frames.get(4).get("content"));
    }

    @Test
    void shouldSplitTextAroundToolCall() {
        List<Map<String, Object>> frames = run(AgentHandler.reactiveStream(req -> Flux.just(
                "Checking. ",
                AgentEvent.toolCall("tc-1", "search", "{}"),
                AgentEvent.toolResult("tc-1", "found"),
                "Done.")));

        List<String> types = types(frames);
        List<Map<String, Object>> starts = ofType(frames, "TEXT_MESSAGE_START");
        assertEquals(2, starts.size());
        assertNotEquals(starts.get(0).get("messageId"), starts.get(1).get("messageId"));
        assertTrue(types.indexOf("TEXT_MESSAGE_END") < types.indexOf("TOOL_CALL_START"));
        assertEquals(starts.get(0).get("messageId"), ofType(frames, "TOOL_CALL_START").get(0).get("parentMessageId"));
        assertEquals("RUN_FINISHED", types.get(types.size() - 1));
    }

    @Test
    void shouldEndWithRunErrorWhenAgentFailsMidStream() {
        Iterator<String> source = new Iterator<>() {
            private int calls;

            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public String next() {
                if (calls++ == 0) {
                    return "partial";
                }
                throw new IllegalStateException("model unavailable");
            }
        };

        List<Map<String, Object>> frames = run(AgentHandler.blockingStream(req -> source));

        List<String> types = types(frames);
        assertEquals("RUN_ERROR", types.get(types.size() - 1));
        assertFalse(types.contains("RUN_FINISHED"));
        assertTrue(types.contains("TEXT_MESSAGE_CONTENT"));
        Map<String, Object> error = frames.get(frames.size() - 1);
        assertEquals("model unavailable", error.get("message"));
        assertEquals("IllegalStateException", error.get("code"));
    }

    @Test
    void shouldSerializeToolCallsWhenConfigured() {
        properties.getAgui().setToolCallPolicy(ToolCallPolicy.SERIALIZED);

        List<Map<String, Object>> frames = run(AgentHandler.reactiveStream(req -> Flux.just(
                AgentEvent.toolCallChunk("A", "one", "a"),
                AgentEvent.toolCallChunk("B", "two", "b"),
                AgentEvent.toolResult("A", "ra"),
                AgentEvent.toolResult("B", "rb"))));

        List<String> sequence = new ArrayList<>();
        for (Map<String, Object> frame : frames) {
            if (frame.containsKey("toolCallId")) {
                sequence.add(frame.get("type") + ":" + frame.get("toolCallId"));
            }
        }
        assertEquals(List.of("TOOL_CALL_START:A", "TOOL_CALL_ARGS:A", "TOOL_CALL_END:A", "TOOL_CALL_RESULT:A",
                "TOOL_CALL_START:B", "TOOL_CALL_ARGS:B", "TOOL_CALL_END:B", "TOOL_CALL_RESULT:B"), sequence);
    }

    @Test
    void shouldStreamStateAndCustomEvents() {
        List<Map<String, Object>> frames = run(AgentHandler.blocking(req -> List.of(
                AgentEvent.stateSnapshot(Map.of("step", 1)),
                AgentEvent.custom("progress", Map.of("pct", 50)))));

        assertEquals(List.of("RUN_STARTED", "STATE_SNAPSHOT", "CUSTOM", "RUN_FINISHED"), types(frames));
        assertEquals(Map.of("step", 1), frames.get(1).get("snapshot"));
        assertEquals("progress", frames.get(2).get("name"));
    }

    // --- errors and health ---

    @Test
    void shouldRejectMalformedBody() {
        client(AgentHandler.blocking(req -> "unused"))
                .post().uri("/ag-ui/agent")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("[]")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo(400)
                .jsonPath("$.message").isEqualTo("Request body must be a JSON object");
    }

    @Test
    void shouldReportHealth() {
        client(AgentHandler.blocking(req -> "unused"))
                .get().uri("/ag-ui/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ok")
                .jsonPath("$.protocol").isEqualTo("ag-ui")
                .jsonPath("$.version").isEqualTo("1.0");
    }
}
