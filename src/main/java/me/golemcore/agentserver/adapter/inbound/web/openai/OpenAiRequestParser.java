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

import me.golemcore.agentserver.adapter.inbound.web.RequestParsingSupport;
import me.golemcore.agentserver.domain.model.AgentRequest;
import me.golemcore.agentserver.domain.model.ChatMessage;
import me.golemcore.agentserver.domain.model.MessageRole;
import me.golemcore.agentserver.domain.model.ProtocolType;
import me.golemcore.agentserver.domain.model.ToolSpec;
import org.springframework.http.HttpHeaders;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses {@code POST /chat/completions} bodies.
 */
public class OpenAiRequestParser {

    public AgentRequest parse(Map<String, Object> body, HttpHeaders headers) {
        Object rawMessages = body.get("messages");
        if (!(rawMessages instanceof List<?>)) {
            throw new IllegalArgumentException("Missing required field: messages");
        }
        return AgentRequest.builder()
                .protocol(ProtocolType.OPENAI)
                .messages(parseMessages(rawMessages))
                .tools(parseTools(body.get("tools")))
                .stream(Boolean.TRUE.equals(body.get("stream")))
                .model(RequestParsingSupport.string(body, "model"))
                .rawBody(body)
                .headers(RequestParsingSupport.headers(headers))
                .build();
    }

    private List<ChatMessage> parseMessages(Object rawMessages) {
        List<ChatMessage> messages = new ArrayList<>();
        for (Map<String, Object> item : RequestParsingSupport.objects(rawMessages)) {
            messages.add(ChatMessage.builder()
                    .role(MessageRole.fromWire(RequestParsingSupport.string(item, "role")))
                    .content(item.get("content"))
                    .name(RequestParsingSupport.string(item, "name"))
                    .toolCalls(RequestParsingSupport.toolCalls(item.get("tool_calls")))
                    .toolCallId(RequestParsingSupport.string(item, "tool_call_id"))
                    .build());
        }
        return messages;
    }

    private List<ToolSpec> parseTools(Object rawTools) {
        List<ToolSpec> tools = new ArrayList<>();
        for (Map<String, Object> item : RequestParsingSupport.objects(rawTools)) {
            String type = RequestParsingSupport.string(item, "type");
            tools.add(ToolSpec.builder()
                    .type(type != null ? type : "function")
                    .function(RequestParsingSupport.object(item.get("function")))
                    .build());
        }
        return tools.isEmpty() ? null : tools;
    }
}
