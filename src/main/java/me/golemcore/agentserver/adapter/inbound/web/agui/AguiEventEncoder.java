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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.agentserver.adapter.inbound.web.SseFrames;
import me.golemcore.agentserver.domain.model.ProtocolType;
import me.golemcore.agentserver.domain.model.RunContext;
import me.golemcore.agentserver.domain.model.SignalType;
import me.golemcore.agentserver.domain.model.StreamSignal;
import me.golemcore.agentserver.domain.service.AdditionMergeSupport;
import me.golemcore.agentserver.port.outbound.ProtocolEncoder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes run signals as AG-UI events, one JSON object per frame with a
 * {@code type} discriminator. Null fields are omitted. Additions merge into
 * the whole frame.
 */
@RequiredArgsConstructor
public class AguiEventEncoder implements ProtocolEncoder {

    private final ObjectMapper objectMapper;

    @Override
    public ProtocolType getProtocol() {
        return ProtocolType.AGUI;
    }

    @Override
    public List<String> encode(StreamSignal signal, RunContext context) {
        if (signal.type() == SignalType.RAW) {
            return List.of(SseFrames.raw(signal.raw()));
        }
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", signal.type().name());
        switch (signal.type()) {
        case RUN_STARTED, RUN_FINISHED -> {
            put(frame, "threadId", context.getThreadId());
            put(frame, "runId", context.getRunId());
        }
        case TEXT_MESSAGE_START -> {
            put(frame, "messageId", signal.messageId());
            put(frame, "role", "assistant");
        }
        case TEXT_MESSAGE_CONTENT -> {
            put(frame, "messageId", signal.messageId());
            put(frame, "delta", signal.delta());
        }
        case TEXT_MESSAGE_END -> put(frame, "messageId", signal.messageId());
        case TOOL_CALL_START -> {
            put(frame, "toolCallId", signal.toolCallId());
            put(frame, "toolCallName", signal.toolCallName());
            put(frame, "parentMessageId", signal.parentMessageId());
        }
        case TOOL_CALL_ARGS -> {
            put(frame, "toolCallId", signal.toolCallId());
            put(frame, "delta", signal.delta());
        }
        case TOOL_CALL_END -> put(frame, "toolCallId", signal.toolCallId());
        case TOOL_CALL_RESULT -> {
            put(frame, "messageId", signal.resultMessageId());
            put(frame, "toolCallId", signal.toolCallId());
            put(frame, "content", signal.content());
            put(frame, "role", "tool");
        }
        case STATE_SNAPSHOT -> frame.put("snapshot", signal.value() != null ? signal.value() : Map.of());
        case STATE_DELTA -> frame.put("delta", signal.value() != null ? signal.value() : List.of());
        case CUSTOM -> {
            put(frame, "name", signal.name());
            put(frame, "value", signal.value());
        }
        case RUN_ERROR -> {
            put(frame, "message", signal.errorMessage());
            put(frame, "code", signal.errorCode());
        }
        default -> {
            return List.of();
        }
        }
        Map<String, Object> payload = signal.hasAddition()
                ? AdditionMergeSupport.merge(frame, signal.addition(), signal.additionMergePolicy())
                : frame;
        return List.of(SseFrames.data(objectMapper, payload));
    }

    private static void put(Map<String, Object> frame, String key, Object value) {
        if (value != null) {
            frame.put(key, value);
        }
    }
}
