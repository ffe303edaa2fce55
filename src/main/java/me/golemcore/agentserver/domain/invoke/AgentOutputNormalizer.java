package me.golemcore.agentserver.domain.invoke;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentserver.domain.model.AgentEvent;
import me.golemcore.agentserver.domain.model.EventKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Coerces raw callback output into canonical events.
 *
 * <p>
 * Rules:
 * <ul>
 * <li>{@code null} and empty strings are dropped</li>
 * <li>strings become TEXT events</li>
 * <li>TOOL_CALL is rewritten to a single TOOL_CALL_CHUNK carrying the whole
 * arguments, with a generated id when none was given</li>
 * <li>collections are flattened item by item</li>
 * <li>other canonical kinds pass through unchanged</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class AgentOutputNormalizer {

    private static final String TOOL_CALL_ID_PREFIX = "call_";

    private final ObjectMapper objectMapper;

    public List<AgentEvent> normalize(Object item) {
        if (item == null) {
            return Collections.emptyList();
        }
        if (item instanceof CharSequence text) {
            return text.length() == 0
                    ? Collections.emptyList()
                    : List.of(AgentEvent.text(text.toString()));
        }
        if (item instanceof AgentEvent event) {
            return List.of(expand(event));
        }
        if (item instanceof Iterable<?> items) {
            List<AgentEvent> events = new ArrayList<>();
            for (Object nested : items) {
                events.addAll(normalize(nested));
            }
            return events;
        }
        log.debug("[Invoker] Ignoring unsupported agent output type: {}", item.getClass().getName());
        return Collections.emptyList();
    }

    AgentEvent expand(AgentEvent event) {
        if (!event.is(EventKind.TOOL_CALL)) {
            return event;
        }
        String id = event.getString(AgentEvent.ID);
        if (id.isBlank()) {
            id = generateToolCallId();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(AgentEvent.ID, id);
        payload.put(AgentEvent.NAME, event.getString(AgentEvent.NAME));
        payload.put(AgentEvent.ARGS_DELTA, argumentsText(event.get(AgentEvent.ARGS)));
        return new AgentEvent(EventKind.TOOL_CALL_CHUNK, payload, event.addition(), event.additionMergePolicy());
    }

    /**
     * Generated ids carry a {@code call_} prefix so they are never taken for a
     * framework-assigned secondary id and folded onto another call.
     */
    static String generateToolCallId() {
        return TOOL_CALL_ID_PREFIX + UUID.randomUUID().toString().replace("-", "");
    }

    private String argumentsText(Object args) {
        if (args == null) {
            return "";
        }
        if (args instanceof String str) {
            return str;
        }
        try {
            return objectMapper.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tool call arguments are not serializable", e);
        }
    }
}
