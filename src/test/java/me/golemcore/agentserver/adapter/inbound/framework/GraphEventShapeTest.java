package me.golemcore.agentserver.adapter.inbound.framework;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GraphEventShapeTest {

    @Test
    void shouldDetectShapes() {
        assertEquals(GraphEventShape.STREAM_EVENT,
                GraphEventShape.detect(Map.of("event", "on_tool_end", "data", Map.of()), "messages"));
        assertEquals(GraphEventShape.STATE_VALUES,
                GraphEventShape.detect(Map.of("messages", List.of()), "messages"));
        assertEquals(GraphEventShape.NODE_UPDATES,
                GraphEventShape.detect(Map.of("model", Map.of("messages", List.of())), "messages"));
    }

    @Test
    void shouldNotTreatEndMarkerAsNodeUpdate() {
        assertEquals(GraphEventShape.UNKNOWN,
                GraphEventShape.detect(Map.of("__end__", Map.of("messages", List.of())), "messages"));
        assertEquals(GraphEventShape.UNKNOWN, GraphEventShape.detect(Map.of("event", "custom"), "messages"));
    }
}
