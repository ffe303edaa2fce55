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

import java.util.List;
import java.util.Map;

/**
 * The three event shapes a graph orchestration framework may stream.
 */
public enum GraphEventShape {

    /** {@code {event: "on_*", data, name?, run_id?}} */
    STREAM_EVENT,

    /** {@code {nodeName: stateUpdate}} */
    NODE_UPDATES,

    /** {@code {messages: [...], ...}}, the whole state */
    STATE_VALUES,

    UNKNOWN;

    static final String END_NODE = "__end__";

    public static GraphEventShape detect(Map<String, Object> event, String messagesKey) {
        Object type = event.get("event");
        if (type instanceof String str && str.startsWith("on_")) {
            return STREAM_EVENT;
        }
        if (event.containsKey("event")) {
            return UNKNOWN;
        }
        if (event.get(messagesKey) instanceof List<?>) {
            return STATE_VALUES;
        }
        for (Map.Entry<String, Object> entry : event.entrySet()) {
            if (!END_NODE.equals(entry.getKey()) && entry.getValue() instanceof Map<?, ?>) {
                return NODE_UPDATES;
            }
        }
        return UNKNOWN;
    }
}
