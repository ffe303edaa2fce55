package me.golemcore.agentserver.adapter.inbound.framework;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentserver.domain.model.AgentEvent;
import me.golemcore.agentserver.domain.model.EventKind;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Converts streamed graph-framework events into canonical events.
 *
 * <p>
 * Handles three shapes (see {@link GraphEventShape}) and keeps correlation
 * tables across items of one stream:
 * <ul>
 * <li>stream index to tool call id, for argument fragments without an id</li>
 * <li>tool name to a FIFO of ids announced by the model but not yet
 * started</li>
 * <li>framework run id to tool call id, for tool start/end notifications that
 * carry their own identifier</li>
 * </ul>
 *
 * <p>
 * Create one instance per stream. Not thread-safe.
 *
 * <pre>
 * GraphEventConverter converter = new GraphEventConverter(objectMapper);
 * AgentHandler handler = AgentHandler.reactiveStream(request -&gt; converter.convertAll(graph.stream(request)));
 * </pre>
 */
@Slf4j
public class GraphEventConverter {

    private static final String DEFAULT_MESSAGES_KEY = "messages";
    private static final Set<String> INTERNAL_INPUT_KEYS = Set.of("runtime", "config", "configurable");

    private final ObjectMapper objectMapper;
    private final String messagesKey;

    private final Map<Integer, String> idsByIndex = new HashMap<>();
    private final Set<String> startedIds = new HashSet<>();
    private final Map<String, Deque<String>> pendingIdsByName = new HashMap<>();
    private final Map<String, String> idsByRunId = new HashMap<>();

    public GraphEventConverter(ObjectMapper objectMapper) {
        this(objectMapper, DEFAULT_MESSAGES_KEY);
    }

    public GraphEventConverter(ObjectMapper objectMapper, String messagesKey) {
        this.objectMapper = objectMapper;
        this.messagesKey = messagesKey;
    }

    /**
     * Converts a whole upstream stream, for use inside a reactive stream
     * handler.
     */
    public Flux<AgentEvent> convertAll(Publisher<?> events) {
        return Flux.from(events).concatMapIterable(this::convert);
    }

    public List<AgentEvent> convert(Object event) {
        if (!(event instanceof Map<?, ?> raw)) {
            log.debug("[Converter] Ignoring non-map event: {}", event != null ? event.getClass().getName() : null);
            return Collections.emptyList();
        }
        Map<String, Object> map = asMap(raw);
        GraphEventShape shape = GraphEventShape.detect(map, messagesKey);
        List<AgentEvent> out = new ArrayList<>();
        switch (shape) {
        case STREAM_EVENT -> convertStreamEvent(map, out);
        case NODE_UPDATES -> convertNodeUpdates(map, out);
        case STATE_VALUES -> convertStateValues(map, out);
        default -> log.debug("[Converter] Unrecognized event shape, keys: {}", map.keySet());
        }
        return out;
    }

    public void reset() {
        idsByIndex.clear();
        startedIds.clear();
        pendingIdsByName.clear();
        idsByRunId.clear();
    }

    // ==================== streamed events ====================

    private void convertStreamEvent(Map<String, Object> event, List<AgentEvent> out) {
        String type = string(event.get("event"));
        Map<String, Object> data = asMap(event.get("data"));
        String name = string(event.get("name"));
        String runId = string(event.get("run_id"));
        log.debug("[Converter] {} (name: {}, run: {})", type, name, runId);

        switch (type) {
        case "on_chat_model_stream" -> onChatModelStream(data, out);
        case "on_chain_stream" -> {
            if ("model".equals(name)) {
                onModelNodeStream(data, out);
            }
        }
        case "on_tool_start" -> onToolStart(data, name, runId, out);
        case "on_tool_end" -> onToolEnd(data, runId, out);
        case "on_tool_error" -> {
            String message = errorMessage(data.get("error"));
            out.add(toolError(name.isEmpty() ? message : "Tool '" + name + "' error: " + message,
                    resolveFinishedToolId(data, runId)));
        }
        case "on_llm_error" -> out.add(AgentEvent.error("LLM error: " + errorMessage(data.get("error")), "LLM_ERROR"));
        case "on_chain_error" -> out.add(AgentEvent.error(
                prefixed("Chain", name, errorMessage(data.get("error"))), "CHAIN_ERROR"));
        case "on_retriever_error" -> out.add(AgentEvent.error(
                prefixed("Retriever", name, errorMessage(data.get("error"))), "RETRIEVER_ERROR"));
        default -> log.trace("[Converter] Skipping event {}", type);
        }
    }

    private void onChatModelStream(Map<String, Object> data, List<AgentEvent> out) {
        Object chunkValue = data.get("chunk");
        if (!(chunkValue instanceof Map<?, ?>)) {
            return;
        }
        Map<String, Object> chunk = asMap(chunkValue);
        String text = extractText(chunk.get("content"));
        if (!text.isEmpty()) {
            out.add(AgentEvent.text(text));
        }
        for (Map<String, Object> fragment : objects(chunk.get("tool_call_chunks"))) {
            Integer index = index(fragment.get("index"));
            String rawId = string(fragment.get("id"));
            String toolName = string(fragment.get("name"));

            String id;
            if (!rawId.isEmpty()) {
                id = rawId;
                if (index != null) {
                    idsByIndex.put(index, id);
                }
            } else if (index != null) {
                id = idsByIndex.getOrDefault(index, String.valueOf(index));
            } else {
                continue;
            }

            String args = argumentsText(fragment.get("args"));
            boolean first = !rawId.isEmpty() && !toolName.isEmpty() && startedIds.add(id);
            if (first) {
                pendingIdsByName.computeIfAbsent(toolName, key -> new ArrayDeque<>()).addLast(id);
                out.add(AgentEvent.toolCallChunk(id, toolName, args));
            } else if (!args.isEmpty()) {
                out.add(AgentEvent.toolCallChunk(id, null, args));
            }
        }
    }

    private void onModelNodeStream(Map<String, Object> data, List<AgentEvent> out) {
        Map<String, Object> chunk = asMap(data.get("chunk"));
        for (Object message : list(chunk.get(messagesKey))) {
            Map<String, Object> msg = asMap(message);
            String content = messageContent(msg);
            if (!content.isEmpty()) {
                out.add(AgentEvent.text(content));
            }
            for (Map<String, Object> toolCall : objects(msg.get("tool_calls"))) {
                String id = string(toolCall.get("id"));
                if (id.isEmpty() || !startedIds.add(id)) {
                    continue;
                }
                String toolName = string(toolCall.get("name"));
                if (!toolName.isEmpty()) {
                    pendingIdsByName.computeIfAbsent(toolName, key -> new ArrayDeque<>()).addLast(id);
                }
                out.add(AgentEvent.toolCallChunk(id, toolName, argumentsText(toolCall.get("args"))));
            }
        }
    }

    private void onToolStart(Map<String, Object> data, String toolName, String runId, List<AgentEvent> out) {
        Object input = data.get("input");
        String id = runtimeToolCallId(input);
        if (id.isEmpty() && !toolName.isEmpty()) {
            Deque<String> pending = pendingIdsByName.get(toolName);
            if (pending != null && !pending.isEmpty()) {
                id = pending.pollFirst();
            }
        }
        if (id.isEmpty()) {
            id = runId;
        }
        if (id.isEmpty()) {
            return;
        }
        if (!runId.isEmpty()) {
            idsByRunId.put(runId, id);
        }
        if (startedIds.add(id)) {
            out.add(AgentEvent.toolCallChunk(id, toolName, argumentsText(filterInput(input))));
        }
    }

    private void onToolEnd(Map<String, Object> data, String runId, List<AgentEvent> out) {
        String id = resolveFinishedToolId(data, runId);
        if (!id.isEmpty()) {
            out.add(AgentEvent.toolResult(id, formatToolOutput(data.get("output"))));
        }
    }

    private String resolveFinishedToolId(Map<String, Object> data, String runId) {
        String id = runtimeToolCallId(data.get("input"));
        if (id.isEmpty() && !runId.isEmpty()) {
            id = idsByRunId.getOrDefault(runId, "");
        }
        return id.isEmpty() ? runId : id;
    }

    private AgentEvent toolError(String message, String toolCallId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(AgentEvent.MESSAGE, message);
        payload.put(AgentEvent.CODE, "TOOL_ERROR");
        payload.put(AgentEvent.TOOL_CALL_ID, toolCallId);
        return AgentEvent.of(EventKind.ERROR, payload);
    }

    // ==================== node updates and state values ====================

    private void convertNodeUpdates(Map<String, Object> event, List<AgentEvent> out) {
        for (Map.Entry<String, Object> entry : event.entrySet()) {
            if (GraphEventShape.END_NODE.equals(entry.getKey()) || !(entry.getValue() instanceof Map<?, ?>)) {
                continue;
            }
            Map<String, Object> update = asMap(entry.getValue());
            for (Object message : nodeMessages(update)) {
                convertMessage(asMap(message), out);
            }
        }
    }

    private void convertStateValues(Map<String, Object> event, List<AgentEvent> out) {
        List<?> messages = list(event.get(messagesKey));
        if (!messages.isEmpty()) {
            convertMessage(asMap(messages.get(messages.size() - 1)), out);
        }
    }

    private List<?> nodeMessages(Map<String, Object> update) {
        Object messages = update.get(messagesKey);
        if (messages instanceof List<?> list) {
            return list;
        }
        for (String key : List.of("message", "output", "response")) {
            Object value = update.get(key);
            if (value instanceof List<?> list) {
                return list;
            }
            if (value instanceof Map<?, ?> map && map.containsKey("content")) {
                return List.of(map);
            }
        }
        return Collections.emptyList();
    }

    private void convertMessage(Map<String, Object> message, List<AgentEvent> out) {
        String type = messageType(message);
        if ("ai".equals(type) || "assistant".equals(type)) {
            String content = messageContent(message);
            if (!content.isEmpty()) {
                out.add(AgentEvent.text(content));
            }
            for (Map<String, Object> toolCall : objects(message.get("tool_calls"))) {
                String id = string(toolCall.get("id"));
                if (!id.isEmpty()) {
                    out.add(AgentEvent.toolCallChunk(id, string(toolCall.get("name")),
                            argumentsText(toolCall.get("args"))));
                }
            }
        } else if ("tool".equals(type)) {
            String toolCallId = string(message.get("tool_call_id"));
            if (!toolCallId.isEmpty()) {
                out.add(AgentEvent.toolResult(toolCallId, messageContent(message)));
            }
        }
    }

    // ==================== helpers ====================

    private static String messageType(Map<String, Object> message) {
        Object type = message.containsKey("type") ? message.get("type") : message.get("role");
        return string(type).toLowerCase(Locale.ROOT);
    }

    private String messageContent(Map<String, Object> message) {
        Object content = message.get("content");
        if (content == null) {
            return "";
        }
        return content instanceof String str ? str : extractText(content);
    }

    private static String extractText(Object content) {
        if (content instanceof String str) {
            return str;
        }
        if (!(content instanceof List<?> parts)) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (Object part : parts) {
            if (part instanceof String str) {
                text.append(str);
            } else if (part instanceof Map<?, ?> map && "text".equals(map.get("type"))) {
                text.append(string(map.get("text")));
            }
        }
        return text.toString();
    }

    private static String runtimeToolCallId(Object input) {
        if (input instanceof Map<?, ?> map && map.get("runtime") instanceof Map<?, ?> runtime) {
            return string(runtime.get("tool_call_id"));
        }
        return "";
    }

    static Object filterInput(Object input) {
        if (!(input instanceof Map<?, ?> map)) {
            return input;
        }
        Map<String, Object> filtered = new LinkedHashMap<>();
        map.forEach((key, value) -> {
            String name = String.valueOf(key);
            if (!INTERNAL_INPUT_KEYS.contains(name) && !name.startsWith("_")) {
                filtered.put(name, value);
            }
        });
        return filtered;
    }

    String formatToolOutput(Object output) {
        if (output == null) {
            return "";
        }
        if (output instanceof Map<?, ?> map) {
            for (String key : List.of("content", "result", "output")) {
                if (map.containsKey(key)) {
                    Object value = map.get(key);
                    if (value instanceof Map<?, ?> || value instanceof List<?>) {
                        return toJson(value);
                    }
                    return value != null ? value.toString() : "";
                }
            }
            return toJson(map);
        }
        return output.toString();
    }

    private String argumentsText(Object args) {
        if (args == null) {
            return "";
        }
        if (args instanceof Map<?, ?> map) {
            return map.isEmpty() ? "" : toJson(map);
        }
        if (args instanceof List<?> list) {
            return list.isEmpty() ? "" : toJson(list);
        }
        return args.toString();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("[Converter] Falling back to toString for {}: {}", value.getClass().getSimpleName(),
                    e.getOriginalMessage());
            return String.valueOf(value);
        }
    }

    private static String errorMessage(Object error) {
        if (error == null) {
            return "";
        }
        if (error instanceof Throwable throwable) {
            return throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
        }
        return error.toString();
    }

    private static String prefixed(String kind, String name, String message) {
        return name.isEmpty() ? message : kind + " '" + name + "' error: " + message;
    }

    private static Integer index(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        return null;
    }

    private static String string(Object value) {
        return value != null ? value.toString() : "";
    }

    private static List<?> list(Object value) {
        return value instanceof List<?> list ? list : Collections.emptyList();
    }

    private static List<Map<String, Object>> objects(Object value) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : list(value)) {
            if (item instanceof Map<?, ?> map) {
                result.add(asMap(map));
            }
        }
        return result;
    }

    private static Map<String, Object> asMap(Object value) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((key, item) -> result.put(String.valueOf(key), item));
        }
        return result;
    }
}
