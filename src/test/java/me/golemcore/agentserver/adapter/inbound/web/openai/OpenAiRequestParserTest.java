package me.golemcore.agentserver.adapter.inbound.web.openai;

import me.golemcore.agentserver.domain.model.AgentRequest;
import me.golemcore.agentserver.domain.model.ChatMessage;
import me.golemcore.agentserver.domain.model.MessageRole;
import me.golemcore.agentserver.domain.model.ProtocolType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenAiRequestParserTest {

    private OpenAiRequestParser parser;

    @BeforeEach
    void setUp() {
        parser = new OpenAiRequestParser();
    }

    @Test
    void shouldParseMessagesAndFlags() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("X-Request-Id", "req-1");
        Map<String, Object> body = Map.of(
                "model", "gpt-test",
                "stream", true,
                "messages", List.of(
                        Map.of("role", "system", "content", "be brief"),
                        Map.of("role", "user", "content", "Hi")));

        AgentRequest request = parser.parse(body, headers);

        assertEquals(ProtocolType.OPENAI, request.getProtocol());
        assertTrue(request.isStream());
        assertEquals("gpt-test", request.getModel());
        assertEquals(2, request.getMessages().size());
        assertEquals(MessageRole.SYSTEM, request.getMessages().get(0).getRole());
        assertEquals("Hi", request.getLastUserText());
        assertEquals("req-1", request.getHeaders().get("x-request-id"));
        assertEquals(body, request.getRawBody());
    }

    @Test
    void shouldDefaultToNonStreaming() {
        AgentRequest request = parser.parse(Map.of("messages", List.of()), new HttpHeaders());

        assertFalse(request.isStream());
        assertNull(request.getTools());
    }

    @Test
    void shouldParseToolCallsAndToolResults() {
        Map<String, Object> body = Map.of("messages", List.of(
                Map.of("role", "assistant", "tool_calls", List.of(Map.of("id", "tc-1", "type", "function",
                        "function", Map.of("name", "search", "arguments", "{}")))),
                Map.of("role", "tool", "tool_call_id", "tc-1", "content", "found")),
                "tools", List.of(Map.of("type", "function", "function", Map.of("name", "search"))));

        AgentRequest request = parser.parse(body, new HttpHeaders());

        ChatMessage assistant = request.getMessages().get(0);
        assertEquals("tc-1", assistant.getToolCalls().get(0).getId());
        assertEquals("search", assistant.getToolCalls().get(0).getFunction().get("name"));
        assertEquals("tc-1", request.getMessages().get(1).getToolCallId());
        assertEquals("search", request.getTools().get(0).getName());
    }

    @Test
    void shouldJoinMultimodalTextParts() {
        Map<String, Object> body = Map.of("messages", List.of(Map.of("role", "user", "content", List.of(
                Map.of("type", "text", "text", "look at "),
                Map.of("type", "image_url", "image_url", Map.of("url", "http://x")),
                Map.of("type", "text", "text", "this")))));

        assertEquals("look at this", parser.parse(body, new HttpHeaders()).getLastUserText());
    }

    @Test
    void shouldRejectMissingMessages() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> parser.parse(Map.of("model", "x"), new HttpHeaders()));

        assertEquals("Missing required field: messages", error.getMessage());
    }
}
