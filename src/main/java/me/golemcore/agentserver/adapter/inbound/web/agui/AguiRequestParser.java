package me.golemcore.agentserver.adapter.inbound.web.agui;

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

import me.golemcore.agentserver.adapter.inbound.web.RequestParsingSupport;
import me.golemcore.agentserver.domain.model.AgentRequest;
import me.golemcore.agentserver.domain.model.ChatMessage;
import me.golemcore.agentserver.domain.model.MessageRole;
import me.golemcore.agentserver.domain.model.ProtocolType;
import me.golemcore.agentserver.domain.model.ToolSpec;
import org.springframework.http.HttpHeaders;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Parses AG-UI {@code RunAgentInput} bodies. Thread and run ids are generated
 * when absent, and AG-UI runs are always streamed.
 */
public class AguiRequestParser {

    public AgentRequest parse(Map<String, Object> body, HttpHeaders headers) {
        String threadId = RequestParsingSupport.firstString(body, "threadId", "thread_id");
        String runId = RequestParsingSupport.firstString(body, "runId", "run_id");
        return AgentRequest.builder()
                .protocol(ProtocolType.AGUI)
                .messages(parseMessages(body.get("messages")))
                .tools(parseTools(body.get("tools")))
                .stream(true)
                .threadId(threadId != null ? threadId : UUID.randomUUID().toString())
                .runId(runId != null ? runId : UUID.randomUUID().toString())
                .rawBody(body)
                .headers(RequestParsingSupport.headers(headers))
                .build();
    }

    private List<ChatMessage> parseMessages(Object rawMessages) {
        List<ChatMessage> messages = new ArrayList<>();
        for (Map<String, Object> item : RequestParsingSupport.objects(rawMessages)) {
            Object toolCalls = item.containsKey("toolCalls") ? item.get("toolCalls") : item.get("tool_calls");
            messages.add(ChatMessage.builder()
                    .id(RequestParsingSupport.string(item, "id"))
                    .role(MessageRole.fromWire(RequestParsingSupport.string(item, "role")))
                    .content(item.get("content"))
                    .name(RequestParsingSupport.string(item, "name"))
                    .toolCalls(RequestParsingSupport.toolCalls(toolCalls))
                    .toolCallId(RequestParsingSupport.firstString(item, "toolCallId", "tool_call_id"))
                    .build());
        }
        return messages;
    }

    /**
     * Accepts both the OpenAI {@code {type, function}} shape and the flat AG-UI
     * {@code {name, description, parameters}} shape.
     */
    private List<ToolSpec> parseTools(Object rawTools) {
        List<ToolSpec> tools = new ArrayList<>();
        for (Map<String, Object> item : RequestParsingSupport.objects(rawTools)) {
            Map<String, Object> function;
            if (item.get("function") instanceof Map<?, ?>) {
                function = RequestParsingSupport.object(item.get("function"));
            } else {
                function = new LinkedHashMap<>(item);
                function.remove("type");
            }
            String type = RequestParsingSupport.string(item, "type");
            tools.add(ToolSpec.builder()
                    .type(type != null ? type : "function")
                    .function(function)
                    .build());
        }
        return tools.isEmpty() ? null : tools;
    }
}
