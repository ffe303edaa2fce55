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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.agentserver.adapter.inbound.web.SseFrames;
import me.golemcore.agentserver.domain.model.ProtocolType;
import me.golemcore.agentserver.domain.model.RunContext;
import me.golemcore.agentserver.domain.model.StreamSignal;
import me.golemcore.agentserver.domain.service.AdditionMergeSupport;
import me.golemcore.agentserver.port.outbound.ProtocolEncoder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes run signals as {@code chat.completion.chunk} frames.
 *
 * <p>
 * Message boundaries, tool results, state and custom events have no OpenAI
 * counterpart and produce nothing. Human-in-the-loop tool calls are skipped.
 * Additions merge into {@code choices[0].delta}.
 */
@RequiredArgsConstructor
public class OpenAiChunkEncoder implements ProtocolEncoder {

    static final String CHUNK_OBJECT = "chat.completion.chunk";

    private final ObjectMapper objectMapper;

    @Override
    public ProtocolType getProtocol() {
        return ProtocolType.OPENAI;
    }

    @Override
    public List<String> encode(StreamSignal signal, RunContext context) {
        return switch (signal.type()) {
        case TEXT_MESSAGE_CONTENT -> List.of(textChunk(signal, context));
        case TOOL_CALL_START -> signal.hitl() ? Collections.emptyList() : List.of(toolStartChunk(signal, context));
        case TOOL_CALL_ARGS -> signal.hitl() || signal.delta() == null || signal.delta().isEmpty()
                ? Collections.emptyList()
                : List.of(toolArgsChunk(signal, context));
        case RAW -> List.of(SseFrames.raw(signal.raw()));
        case RUN_FINISHED -> List.of(
                chunk(context, new LinkedHashMap<>(), signal.toolCallsEmitted() ? "tool_calls" : "stop"),
                SseFrames.DONE);
        case RUN_ERROR -> List.of(errorFrame(signal, context), SseFrames.DONE);
        default -> Collections.emptyList();
        };
    }

    private String textChunk(StreamSignal signal, RunContext context) {
        Map<String, Object> delta = new LinkedHashMap<>();
        if (signal.firstContent()) {
            delta.put("role", "assistant");
        }
        delta.put("content", signal.delta());
        return chunk(context, applyAddition(delta, signal), null);
    }

    private String toolStartChunk(StreamSignal signal, RunContext context) {
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", signal.toolCallName());
        function.put("arguments", "");
        Map<String, Object> toolCall = new LinkedHashMap<>();
        toolCall.put("index", signal.toolCallIndex());
        toolCall.put("id", signal.toolCallId());
        toolCall.put("type", "function");
        toolCall.put("function", function);

        Map<String, Object> delta = new LinkedHashMap<>();
        if (signal.firstContent()) {
            delta.put("role", "assistant");
        }
        delta.put("tool_calls", List.of(toolCall));
        return chunk(context, delta, null);
    }

    private String toolArgsChunk(StreamSignal signal, RunContext context) {
        Map<String, Object> toolCall = new LinkedHashMap<>();
        toolCall.put("index", signal.toolCallIndex());
        toolCall.put("function", Map.of("arguments", signal.delta()));
        Map<String, Object> delta = new LinkedHashMap<>();
        delta.put("tool_calls", List.of(toolCall));
        return chunk(context, applyAddition(delta, signal), null);
    }

    private String errorFrame(StreamSignal signal, RunContext context) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("message", signal.errorMessage());
        error.put("type", "server_error");
        error.put("code", signal.errorCode());
        Map<String, Object> frame = header(context);
        frame.put("error", error);
        return SseFrames.data(objectMapper, frame);
    }

    private String chunk(RunContext context, Map<String, Object> delta, String finishReason) {
        Map<String, Object> choice = new LinkedHashMap<>();
        choice.put("index", 0);
        choice.put("delta", delta);
        choice.put("finish_reason", finishReason);
        Map<String, Object> frame = header(context);
        frame.put("choices", List.of(choice));
        return SseFrames.data(objectMapper, frame);
    }

    private Map<String, Object> header(RunContext context) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("id", context.getResponseId());
        frame.put("object", CHUNK_OBJECT);
        frame.put("created", context.getCreated());
        frame.put("model", context.getModel());
        return frame;
    }

    private Map<String, Object> applyAddition(Map<String, Object> delta, StreamSignal signal) {
        return signal.hasAddition()
                ? AdditionMergeSupport.merge(delta, signal.addition(), signal.additionMergePolicy())
                : delta;
    }
}
