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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentserver.domain.model.AgentEvent;
import me.golemcore.agentserver.domain.model.EventKind;
import me.golemcore.agentserver.domain.model.RunContext;
import me.golemcore.agentserver.domain.model.RunLifecycle;
import me.golemcore.agentserver.domain.model.SignalType;
import me.golemcore.agentserver.domain.model.StreamSignal;
import me.golemcore.agentserver.domain.model.ToolCallPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Per-run ordering state machine.
 *
 * <p>
 * Consumes canonical events in arrival order and emits protocol-neutral
 * {@link StreamSignal}s with all boundaries a wire protocol requires:
 * <ul>
 * <li>RUN_STARTED first, exactly one of RUN_FINISHED or RUN_ERROR last</li>
 * <li>text content only inside a started message; a message never survives
 * a tool call start</li>
 * <li>one TOOL_CALL_START per call id, synthesized before the first
 * arguments or before an orphan result</li>
 * <li>END boundaries for everything still open before RUN_FINISHED</li>
 * </ul>
 *
 * <p>
 * Under {@link ToolCallPolicy#SERIALIZED} at most one tool call is open at a
 * time; events for other calls wait in their own queue until the active call
 * receives its result.
 *
 * <p>
 * Not thread-safe. One instance serves one run.
 */
@Slf4j
public class RunStateMachine {

    private static final String HITL_PREFIX = "hitl_";
    private static final String DEFAULT_HITL_TYPE = "confirmation";
    private static final String RESULT_MESSAGE_PREFIX = "tool-result-";

    private final RunContext context;
    private final ObjectMapper objectMapper;
    private final RunState state = new RunState();

    public RunStateMachine(RunContext context, ObjectMapper objectMapper) {
        this.context = context;
        this.objectMapper = objectMapper;
    }

    public RunState getState() {
        return state;
    }

    public RunContext getContext() {
        return context;
    }

    public List<StreamSignal> start() {
        if (state.getLifecycle() != RunLifecycle.PENDING) {
            return Collections.emptyList();
        }
        state.setLifecycle(RunLifecycle.STARTED);
        return List.of(signal(SignalType.RUN_STARTED).build());
    }

    public List<StreamSignal> accept(AgentEvent event) {
        if (event == null) {
            return Collections.emptyList();
        }
        if (state.getLifecycle().isTerminal()) {
            log.debug("[Run] Ignoring {} event after run {} ended", event.kind(), context.getRunId());
            return Collections.emptyList();
        }
        List<StreamSignal> out = new ArrayList<>(start());
        switch (event.kind()) {
        case TEXT -> onText(event, out);
        case TOOL_CALL, TOOL_CALL_CHUNK -> onToolCallChunk(event, out);
        case TOOL_RESULT -> onToolResult(event, out);
        case TOOL_RESULT_CHUNK -> state.cacheResultChunk(state.getToolCalls().resolve(event),
                event.getString(AgentEvent.DELTA));
        case HITL -> onHitl(event, out);
        case STATE -> onState(event, out);
        case CUSTOM -> out.add(withAddition(signal(SignalType.CUSTOM)
                .name(event.getString(AgentEvent.NAME, "custom"))
                .value(event.get(AgentEvent.VALUE)), event));
        case RAW -> onRaw(event, out);
        case ERROR -> onError(event, out);
        default -> log.debug("[Run] Unhandled event kind: {}", event.kind());
        }
        return out;
    }

    /**
     * Closes the run normally: drains queued tool calls, closes whatever is
     * still open and emits RUN_FINISHED. No-op once the run is terminal.
     */
    public List<StreamSignal> complete() {
        if (state.getLifecycle().isTerminal()) {
            return Collections.emptyList();
        }
        List<StreamSignal> out = new ArrayList<>(start());
        if (isSerialized()) {
            drainAllQueues(out);
        }
        closeOpenToolCalls(out, null);
        closeText(out);
        state.setActiveToolCallId(null);
        state.setLifecycle(RunLifecycle.FINISHED);
        out.add(signal(SignalType.RUN_FINISHED)
                .toolCallsEmitted(state.isToolCallsEmitted())
                .textEmitted(state.isTextEmitted())
                .build());
        return out;
    }

    /**
     * Ends the run with RUN_ERROR for failures raised outside the agent
     * callback. No-op once the run is terminal.
     */
    public List<StreamSignal> fail(String message, String code) {
        if (state.getLifecycle().isTerminal()) {
            return Collections.emptyList();
        }
        List<StreamSignal> out = new ArrayList<>(start());
        onError(AgentEvent.error(message, code), out);
        return out;
    }

    private void onText(AgentEvent event, List<StreamSignal> out) {
        String delta = event.getString(AgentEvent.DELTA);
        if (delta.isEmpty()) {
            return;
        }
        if (isSerialized()) {
            drainAllQueues(out);
            closeOpenToolCalls(out, null);
            state.setActiveToolCallId(null);
        }
        openTextIfNeeded(out);
        out.add(withAddition(signal(SignalType.TEXT_MESSAGE_CONTENT)
                .messageId(state.getText().getMessageId())
                .delta(delta)
                .firstContent(state.claimFirstContent()), event));
        state.setTextEmitted(true);
    }

    private void onToolCallChunk(AgentEvent event, List<StreamSignal> out) {
        String name = event.getString(AgentEvent.NAME);
        String id = state.getToolCalls().resolve(event);
        if (id.isEmpty()) {
            ToolCallState current = lastOpenToolCall();
            if (current == null) {
                log.debug("[Run] Dropping tool call chunk without identity");
                return;
            }
            id = current.getToolCallId();
        }
        ToolCallState existing = state.getToolCalls().get(id);
        if (existing != null && existing.isEnded()) {
            log.debug("[Run] Dropping arguments for closed tool call {}", id);
            return;
        }
        if (isSerialized()) {
            String active = state.getActiveToolCallId();
            if (active != null && !active.equals(id)) {
                enqueue(id, name, event);
                return;
            }
            state.setActiveToolCallId(id);
        }
        emitToolCallChunk(id, name, event, out);
    }

    private void emitToolCallChunk(String id, String name, AgentEvent event, List<StreamSignal> out) {
        ToolCallState call = state.getToolCalls().get(id);
        if (call != null && call.isEnded()) {
            log.debug("[Run] Dropping arguments for closed tool call {}", id);
            return;
        }
        if (call == null || !call.isStarted()) {
            call = openToolCall(id, name, false, out);
        }
        String args = event.is(EventKind.TOOL_CALL)
                ? stringify(event.get(AgentEvent.ARGS))
                : event.getString(AgentEvent.ARGS_DELTA);
        if (!args.isEmpty()) {
            out.add(withAddition(signal(SignalType.TOOL_CALL_ARGS)
                    .toolCallId(id)
                    .toolCallName(call.getName())
                    .toolCallIndex(call.getIndex())
                    .delta(args), event));
        }
    }

    private void onToolResult(AgentEvent event, List<StreamSignal> out) {
        String id = state.getToolCalls().resolve(event);
        if (id.isEmpty()) {
            log.debug("[Run] Dropping tool result without identity");
            return;
        }
        if (isSerialized()) {
            String active = state.getActiveToolCallId();
            if (active != null && !active.equals(id)) {
                enqueue(id, event.getString(AgentEvent.NAME), event);
                return;
            }
        }
        emitToolResult(id, event, out);
        if (isSerialized() && id.equals(state.getActiveToolCallId())) {
            state.setActiveToolCallId(null);
            drainNext(out);
        }
    }

    private void emitToolResult(String id, AgentEvent event, List<StreamSignal> out) {
        closeText(out);
        if (isSerialized()) {
            closeOpenToolCalls(out, id);
        }
        ToolCallState call = state.getToolCalls().get(id);
        if (call == null || !call.isStarted()) {
            log.debug("[Run] Tool result for unknown call {}, synthesizing start", id);
            call = openToolCall(id, event.getString(AgentEvent.NAME), false, out);
        } else if (call.isResultReceived()) {
            log.debug("[Run] Duplicate tool result for {}", id);
        }
        closeToolCall(call, out);
        call.setResultReceived(true);

        String content = state.popResultChunks(id) + resultText(event);
        String resultMessageId = event.getString(AgentEvent.MESSAGE_ID);
        if (resultMessageId.isBlank()) {
            resultMessageId = RESULT_MESSAGE_PREFIX + id;
        }
        out.add(withAddition(signal(SignalType.TOOL_CALL_RESULT)
                .toolCallId(id)
                .toolCallName(call.getName())
                .toolCallIndex(call.getIndex())
                .content(content)
                .resultMessageId(resultMessageId)
                .hitl(call.isHitl()), event));
    }

    private void onHitl(AgentEvent event, List<StreamSignal> out) {
        closeText(out);
        String referencedId = event.getString(AgentEvent.TOOL_CALL_ID);
        ToolCallState referenced = referencedId.isEmpty() ? null : state.getToolCalls().get(referencedId);
        if (referenced != null && referenced.isStarted()) {
            closeToolCall(referenced, out);
            referenced.setHitl(true);
            referenced.setResultReceived(false);
            if (isSerialized() && referencedId.equals(state.getActiveToolCallId())) {
                state.setActiveToolCallId(null);
                drainNext(out);
            }
            return;
        }

        String id = !referencedId.isEmpty() ? referencedId : event.getString(AgentEvent.ID);
        if (id.isEmpty()) {
            id = UUID.randomUUID().toString();
        }
        String type = event.getString(AgentEvent.TYPE, DEFAULT_HITL_TYPE);
        if (type.isBlank()) {
            type = DEFAULT_HITL_TYPE;
        }
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(AgentEvent.TYPE, type);
        args.put(AgentEvent.PROMPT, event.getString(AgentEvent.PROMPT));
        putIfPresent(args, AgentEvent.OPTIONS, event.get(AgentEvent.OPTIONS));
        putIfPresent(args, AgentEvent.DEFAULT, event.get(AgentEvent.DEFAULT));
        putIfPresent(args, AgentEvent.TIMEOUT, event.get(AgentEvent.TIMEOUT));
        putIfPresent(args, AgentEvent.SCHEMA, event.get(AgentEvent.SCHEMA));

        ToolCallState call = openToolCall(id, HITL_PREFIX + type, true, out);
        out.add(withAddition(signal(SignalType.TOOL_CALL_ARGS)
                .toolCallId(id)
                .toolCallName(call.getName())
                .toolCallIndex(call.getIndex())
                .delta(stringify(args))
                .hitl(true), event));
        closeToolCall(call, out);
        if (isSerialized()) {
            state.setActiveToolCallId(null);
            drainNext(out);
        }
    }

    private void onState(AgentEvent event, List<StreamSignal> out) {
        if (event.has(AgentEvent.SNAPSHOT)) {
            out.add(withAddition(signal(SignalType.STATE_SNAPSHOT).value(event.get(AgentEvent.SNAPSHOT)), event));
        } else if (event.has(AgentEvent.DELTA)) {
            out.add(withAddition(signal(SignalType.STATE_DELTA).value(event.get(AgentEvent.DELTA)), event));
        } else {
            out.add(withAddition(signal(SignalType.STATE_SNAPSHOT).value(event.payload()), event));
        }
    }

    private void onRaw(AgentEvent event, List<StreamSignal> out) {
        String raw = event.getString(AgentEvent.RAW);
        if (!raw.isEmpty()) {
            out.add(signal(SignalType.RAW).raw(raw).build());
        }
    }

    private void onError(AgentEvent event, List<StreamSignal> out) {
        state.setLifecycle(RunLifecycle.ERRORED);
        log.debug("[Run] Run {} errored: {}", context.getRunId(), event.getString(AgentEvent.MESSAGE));
        out.add(withAddition(signal(SignalType.RUN_ERROR)
                .errorMessage(event.getString(AgentEvent.MESSAGE))
                .errorCode(event.getString(AgentEvent.CODE, null)), event));
    }

    private ToolCallState openToolCall(String id, String name, boolean hitl, List<StreamSignal> out) {
        closeText(out);
        if (isSerialized()) {
            closeOpenToolCalls(out, id);
        }
        ToolCallState call = state.getToolCalls().getOrCreate(id, name);
        if (call.getName().isEmpty() && name != null) {
            call.setName(name);
        }
        call.setStarted(true);
        call.setHitl(hitl);
        if (!hitl) {
            call.setIndex(state.allocateToolCallIndex());
            state.setToolCallsEmitted(true);
        }
        out.add(signal(SignalType.TOOL_CALL_START)
                .toolCallId(id)
                .toolCallName(call.getName())
                .toolCallIndex(call.getIndex())
                .parentMessageId(state.getLastMessageId())
                .hitl(hitl)
                .firstContent(!hitl && state.claimFirstContent())
                .build());
        return call;
    }

    private void closeToolCall(ToolCallState call, List<StreamSignal> out) {
        if (!call.isOpen()) {
            return;
        }
        call.setEnded(true);
        out.add(signal(SignalType.TOOL_CALL_END)
                .toolCallId(call.getToolCallId())
                .toolCallName(call.getName())
                .toolCallIndex(call.getIndex())
                .hitl(call.isHitl())
                .build());
    }

    private void closeOpenToolCalls(List<StreamSignal> out, String exceptId) {
        for (ToolCallState call : state.getToolCalls().all()) {
            if (!call.getToolCallId().equals(exceptId)) {
                closeToolCall(call, out);
            }
        }
    }

    private void openTextIfNeeded(List<StreamSignal> out) {
        if (state.isTextOpen()) {
            return;
        }
        TextMessageState text = new TextMessageState();
        text.markStarted();
        state.setText(text);
        state.setLastMessageId(text.getMessageId());
        out.add(signal(SignalType.TEXT_MESSAGE_START).messageId(text.getMessageId()).build());
    }

    private void closeText(List<StreamSignal> out) {
        if (!state.isTextOpen()) {
            return;
        }
        TextMessageState text = state.getText();
        text.markEnded();
        out.add(signal(SignalType.TEXT_MESSAGE_END).messageId(text.getMessageId()).build());
    }

    private void enqueue(String id, String name, AgentEvent event) {
        ToolCallState call = state.getToolCalls().getOrCreate(id, name);
        Map<String, Object> payload = new LinkedHashMap<>(event.payload());
        payload.put(AgentEvent.ID, id);
        call.getPending().addLast(event.withPayload(payload));
        if (!state.getQueuedToolCallIds().contains(id)) {
            state.getQueuedToolCallIds().addLast(id);
        }
        log.debug("[Run] Queued {} for tool call {} while {} is active", event.kind(), id,
                state.getActiveToolCallId());
    }

    /**
     * Replays queued calls, oldest first, while no call is active.
     */
    private void drainNext(List<StreamSignal> out) {
        while (state.getActiveToolCallId() == null && !state.getQueuedToolCallIds().isEmpty()) {
            String id = state.getQueuedToolCallIds().pollFirst();
            ToolCallState call = state.getToolCalls().get(id);
            state.setActiveToolCallId(id);
            while (call.hasPending()) {
                AgentEvent pending = call.getPending().pollFirst();
                if (pending.is(EventKind.TOOL_RESULT)) {
                    emitToolResult(id, pending, out);
                } else {
                    emitToolCallChunk(id, pending.getString(AgentEvent.NAME), pending, out);
                }
            }
            if (!call.isOpen()) {
                state.setActiveToolCallId(null);
            }
        }
    }

    private void drainAllQueues(List<StreamSignal> out) {
        while (!state.getQueuedToolCallIds().isEmpty()) {
            state.setActiveToolCallId(null);
            drainNext(out);
        }
    }

    private ToolCallState lastOpenToolCall() {
        ToolCallState last = null;
        for (ToolCallState call : state.getToolCalls().all()) {
            if (call.isOpen()) {
                last = call;
            }
        }
        return last;
    }

    private boolean isSerialized() {
        return context.getToolCallPolicy() == ToolCallPolicy.SERIALIZED;
    }

    private String resultText(AgentEvent event) {
        Object content = event.get(AgentEvent.CONTENT);
        if (content != null && !(content instanceof String str && str.isEmpty())) {
            return stringify(content);
        }
        return stringify(event.get(AgentEvent.RESULT));
    }

    private String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String str) {
            return str;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable: " + value.getClass().getName(), e);
        }
    }

    private static void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    private static StreamSignal.StreamSignalBuilder signal(SignalType type) {
        return StreamSignal.builder().type(type).toolCallIndex(-1);
    }

    private static StreamSignal withAddition(StreamSignal.StreamSignalBuilder builder, AgentEvent event) {
        if (event.hasAddition()) {
            builder.addition(event.addition()).additionMergePolicy(event.additionMergePolicy());
        }
        return builder.build();
    }
}
