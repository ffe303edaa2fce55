package me.golemcore.agentserver.adapter.inbound.web.openai;

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

import me.golemcore.agentserver.domain.model.RunContext;
import me.golemcore.agentserver.domain.model.SignalType;
import me.golemcore.agentserver.domain.model.StreamSignal;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Folds the signals of a finished run into one {@code chat.completion}
 * response.
 */
public class OpenAiResponseAssembler {

    static final String COMPLETION_OBJECT = "chat.completion";

    public Optional<StreamSignal> findError(List<StreamSignal> signals) {
        return signals.stream().filter(signal -> signal.type() == SignalType.RUN_ERROR).findFirst();
    }

    public Map<String, Object> assemble(List<StreamSignal> signals, RunContext context) {
        StringBuilder content = new StringBuilder();
        boolean hasText = false;
        Map<String, Map<String, Object>> toolCalls = new LinkedHashMap<>();
        Map<String, Map<String, Object>> functions = new LinkedHashMap<>();

        for (StreamSignal signal : signals) {
            if (signal.hitl()) {
                continue;
            }
            if (signal.type() == SignalType.TEXT_MESSAGE_CONTENT) {
                content.append(signal.delta());
                hasText = true;
            } else if (signal.type() == SignalType.TOOL_CALL_START) {
                Map<String, Object> function = new LinkedHashMap<>();
                function.put("name", signal.toolCallName());
                function.put("arguments", "");
                Map<String, Object> toolCall = new LinkedHashMap<>();
                toolCall.put("id", signal.toolCallId());
                toolCall.put("type", "function");
                toolCall.put("function", function);
                toolCalls.put(signal.toolCallId(), toolCall);
                functions.put(signal.toolCallId(), function);
            } else if (signal.type() == SignalType.TOOL_CALL_ARGS) {
                Map<String, Object> function = functions.get(signal.toolCallId());
                if (function != null) {
                    function.put("arguments", function.get("arguments") + signal.delta());
                }
            }
        }

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("role", "assistant");
        message.put("content", hasText ? content.toString() : null);
        if (!toolCalls.isEmpty()) {
            message.put("tool_calls", new ArrayList<>(toolCalls.values()));
        }

        Map<String, Object> choice = new LinkedHashMap<>();
        choice.put("index", 0);
        choice.put("message", message);
        choice.put("finish_reason", toolCalls.isEmpty() ? "stop" : "tool_calls");

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("id", context.getResponseId());
        response.put("object", COMPLETION_OBJECT);
        response.put("created", context.getCreated());
        response.put("model", context.getModel());
        response.put("choices", List.of(choice));
        return response;
    }
}
