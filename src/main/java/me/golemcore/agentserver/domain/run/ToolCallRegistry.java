package me.golemcore.agentserver.domain.run;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentserver.domain.model.AgentEvent;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Resolves the tool-call identity of incoming events.
 *
 * <p>
 * Priority: explicit {@code id}, then a previously recorded {@code index} to id
 * mapping, then the {@code correlation_id}. A UUID-shaped id is folded onto the
 * single open, non-UUID call with the same name (any name when the event
 * carries none); with zero or several candidates it stays its own call.
 */
@Slf4j
public class ToolCallRegistry {

    private static final Pattern UUID_PATTERN = Pattern
            .compile("^[0-9a-fA-F]{8}-?[0-9a-fA-F]{4}-?[0-9a-fA-F]{4}-?[0-9a-fA-F]{4}-?[0-9a-fA-F]{12}$");

    private final Map<String, ToolCallState> calls = new LinkedHashMap<>();
    private final Map<Integer, String> idsByIndex = new HashMap<>();
    private final Map<String, String> aliases = new HashMap<>();

    public String resolve(AgentEvent event) {
        String explicitId = event.getString(AgentEvent.ID);
        Integer index = indexOf(event);
        String name = event.getString(AgentEvent.NAME);

        String id;
        if (!explicitId.isBlank()) {
            id = explicitId;
        } else if (index != null && idsByIndex.containsKey(index)) {
            id = idsByIndex.get(index);
        } else {
            id = event.getString(AgentEvent.CORRELATION_ID);
        }
        if (id.isBlank()) {
            return "";
        }
        if (index != null) {
            idsByIndex.putIfAbsent(index, id);
        }
        return resolveAlias(id, name);
    }

    String resolveAlias(String id, String name) {
        if (!isUuidLike(id)) {
            return id;
        }
        String known = aliases.get(id);
        if (known != null) {
            return known;
        }
        List<String> candidates = new ArrayList<>();
        for (ToolCallState state : calls.values()) {
            if (!isUuidLike(state.getToolCallId()) && state.isOpen()
                    && (name.isEmpty() || name.equals(state.getName()))) {
                candidates.add(state.getToolCallId());
            }
        }
        if (candidates.size() == 1) {
            String target = candidates.get(0);
            aliases.put(id, target);
            log.debug("[Run] Folded tool call id {} onto {}", id, target);
            return target;
        }
        return id;
    }

    public ToolCallState get(String id) {
        return calls.get(id);
    }

    public ToolCallState getOrCreate(String id, String name) {
        return calls.computeIfAbsent(id, key -> new ToolCallState(key, name));
    }

    public Iterable<ToolCallState> all() {
        return calls.values();
    }

    public static boolean isUuidLike(String value) {
        return value != null && UUID_PATTERN.matcher(value).matches();
    }

    private static Integer indexOf(AgentEvent event) {
        Object index = event.get(AgentEvent.INDEX);
        if (index instanceof Number number) {
            return number.intValue();
        }
        if (index instanceof String str && !str.isBlank()) {
            try {
                return Integer.parseInt(str.trim());
            } catch (NumberFormatException e) {
                log.debug("[Run] Ignoring non-numeric tool call index: {}", str);
            }
        }
        return null;
    }
}
