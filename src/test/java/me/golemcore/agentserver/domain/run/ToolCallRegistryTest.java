package me.golemcore.agentserver.domain.run;

import me.golemcore.agentserver.domain.model.AgentEvent;
import me.golemcore.agentserver.domain.model.EventKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolCallRegistryTest {

    private static final String UUID = "0b6f1f4e-2c1d-4e7a-9f3b-5d8c7a6e1b2f";

    private ToolCallRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ToolCallRegistry();
    }

    private void started(String id, String name) {
        registry.getOrCreate(id, name).setStarted(true);
    }

    @Test
    void shouldPreferExplicitId() {
        AgentEvent event = AgentEvent.of(EventKind.TOOL_CALL_CHUNK,
                Map.of(AgentEvent.ID, "call_1", AgentEvent.CORRELATION_ID, "run-1"));

        assertEquals("call_1", registry.resolve(event));
    }

    @Test
    void shouldRememberIdForIndex() {
        registry.resolve(AgentEvent.of(EventKind.TOOL_CALL_CHUNK, Map.of(AgentEvent.ID, "call_1", AgentEvent.INDEX, 0)));

        assertEquals("call_1", registry.resolve(AgentEvent.of(EventKind.TOOL_CALL_CHUNK, Map.of(AgentEvent.INDEX, "0"))));
    }

    @Test
    void shouldReturnEmptyWithoutIdentity() {
        assertEquals("", registry.resolve(AgentEvent.of(EventKind.TOOL_CALL_CHUNK, Map.of(AgentEvent.INDEX, "x"))));
    }

    @Test
    void shouldFoldUuidOntoSingleMatchingCall() {
        started("call_1", "search");
        started("call_2", "weather");

        assertEquals("call_1", registry.resolveAlias(UUID, "search"));
        assertEquals("call_1", registry.resolveAlias(UUID, ""));
    }

    @Test
    void shouldNotFoldOntoCallThatIsNotStarted() {
        registry.getOrCreate("call_1", "search");

        assertEquals(UUID, registry.resolveAlias(UUID, "search"));
    }

    @Test
    void shouldNotFoldOntoEndedCall() {
        ToolCallState ended = registry.getOrCreate("call_1", "search");
        ended.setStarted(true);
        ended.setEnded(true);

        assertEquals(UUID, registry.resolveAlias(UUID, "search"));
    }

    @Test
    void shouldNotFoldWhenSeveralCandidatesMatch() {
        started("call_1", "search");
        started("call_2", "search");

        assertEquals(UUID, registry.resolveAlias(UUID, "search"));
    }

    @Test
    void shouldLeaveNonUuidIdsUntouched() {
        started("call_1", "search");

        assertEquals("call_9", registry.resolveAlias("call_9", "search"));
    }

    @Test
    void shouldDetectUuidShapes() {
        assertTrue(ToolCallRegistry.isUuidLike(UUID));
        assertTrue(ToolCallRegistry.isUuidLike(UUID.replace("-", "")));
        assertFalse(ToolCallRegistry.isUuidLike("call_abc"));
        assertFalse(ToolCallRegistry.isUuidLike(null));
    }
}
