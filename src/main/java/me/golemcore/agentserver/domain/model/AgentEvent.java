package me.golemcore.agentserver.domain.model;

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

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical, protocol-neutral agent event.
 *
 * <p>
 * The {@link EventKind} is fixed at creation and never re-interpreted. Payload
 * keys depend on the kind and are only checked when the event is encoded. The
 * optional {@code addition} is merged into the encoded wire frame according to
 * {@code additionMergePolicy}.
 *
 * <pre>
 * AgentEvent.text("Hello");
 * AgentEvent.toolCall("tc-1", "get_weather", "{\"city\":\"Paris\"}");
 * AgentEvent.toolResult("tc-1", "Sunny");
 * </pre>
 */
@Builder(toBuilder = true)
public record AgentEvent(EventKind kind, Map<String, Object> payload, Map<String, Object> addition,
        AdditionMergePolicy additionMergePolicy) {

    public static final String DELTA = "delta";
    public static final String ID = "id";
    public static final String INDEX = "index";
    public static final String CORRELATION_ID = "correlation_id";
    public static final String NAME = "name";
    public static final String ARGS = "args";
    public static final String ARGS_DELTA = "args_delta";
    public static final String RESULT = "result";
    public static final String CONTENT = "content";
    public static final String MESSAGE_ID = "message_id";
    public static final String SNAPSHOT = "snapshot";
    public static final String VALUE = "value";
    public static final String MESSAGE = "message";
    public static final String CODE = "code";
    public static final String RAW = "raw";
    public static final String TOOL_CALL_ID = "tool_call_id";
    public static final String TYPE = "type";
    public static final String PROMPT = "prompt";
    public static final String OPTIONS = "options";
    public static final String DEFAULT = "default";
    public static final String TIMEOUT = "timeout";
    public static final String SCHEMA = "schema";

    public AgentEvent {
        Objects.requireNonNull(kind, "kind must not be null");
        payload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Map.of();
        addition = addition != null && !addition.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(addition))
                : null;
        if (additionMergePolicy == null) {
            additionMergePolicy = AdditionMergePolicy.OVERRIDE_AND_ADD;
        }
    }

    public static AgentEvent of(EventKind kind, Map<String, Object> payload) {
        return new AgentEvent(kind, payload, null, null);
    }

    public static AgentEvent text(String delta) {
        return of(EventKind.TEXT, Map.of(DELTA, delta != null ? delta : ""));
    }

    /**
     * Complete tool call. The id may be null, the invoker generates one.
     */
    public static AgentEvent toolCall(String id, String name, String args) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (id != null) {
            payload.put(ID, id);
        }
        payload.put(NAME, name != null ? name : "");
        payload.put(ARGS, args != null ? args : "");
        return of(EventKind.TOOL_CALL, payload);
    }

    public static AgentEvent toolCallChunk(String id, String name, String argsDelta) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(ID, id != null ? id : "");
        if (name != null) {
            payload.put(NAME, name);
        }
        payload.put(ARGS_DELTA, argsDelta != null ? argsDelta : "");
        return of(EventKind.TOOL_CALL_CHUNK, payload);
    }

    public static AgentEvent toolResult(String id, String result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(ID, id != null ? id : "");
        payload.put(RESULT, result != null ? result : "");
        return of(EventKind.TOOL_RESULT, payload);
    }

    public static AgentEvent toolResultChunk(String id, String delta) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(ID, id != null ? id : "");
        payload.put(DELTA, delta != null ? delta : "");
        return of(EventKind.TOOL_RESULT_CHUNK, payload);
    }

    public static AgentEvent stateSnapshot(Object snapshot) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(SNAPSHOT, snapshot);
        return of(EventKind.STATE, payload);
    }

    public static AgentEvent stateDelta(Object delta) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(DELTA, delta);
        return of(EventKind.STATE, payload);
    }

    public static AgentEvent custom(String name, Object value) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(NAME, name);
        payload.put(VALUE, value);
        return of(EventKind.CUSTOM, payload);
    }

    public static AgentEvent error(String message, String code) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(MESSAGE, message != null ? message : "");
        payload.put(CODE, code);
        return of(EventKind.ERROR, payload);
    }

    public static AgentEvent raw(String raw) {
        return of(EventKind.RAW, Map.of(RAW, raw != null ? raw : ""));
    }

    public static AgentEvent hitl(String id, String type, String prompt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(ID, id != null ? id : "");
        payload.put(TYPE, type != null ? type : "confirmation");
        payload.put(PROMPT, prompt != null ? prompt : "");
        return of(EventKind.HITL, payload);
    }

    public AgentEvent withAddition(Map<String, Object> extra, AdditionMergePolicy policy) {
        return new AgentEvent(kind, payload, extra, policy);
    }

    public AgentEvent withPayload(Map<String, Object> newPayload) {
        return new AgentEvent(kind, newPayload, addition, additionMergePolicy);
    }

    public boolean is(EventKind candidate) {
        return kind == candidate;
    }

    public boolean has(String key) {
        return payload.containsKey(key);
    }

    public Object get(String key) {
        return payload.get(key);
    }

    /**
     * Reads a payload value as a string. Missing and null values give the
     * fallback, non-string values their {@code toString()}.
     */
    public String getString(String key, String fallback) {
        Object value = payload.get(key);
        if (value == null) {
            return fallback;
        }
        return value instanceof String str ? str : String.valueOf(value);
    }

    public String getString(String key) {
        return getString(key, "");
    }

    public boolean hasAddition() {
        return addition != null && !addition.isEmpty();
    }
}
