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

import java.util.Map;

/**
 * One protocol-neutral item emitted by the run state machine, carrying
 * everything an encoder needs to produce its wire frames without keeping
 * state of its own.
 *
 * @param type
 *            signal discriminator
 * @param messageId
 *            text message id for TEXT_MESSAGE_*
 * @param toolCallId
 *            resolved tool call id for TOOL_CALL_*
 * @param toolCallName
 *            tool name, set on TOOL_CALL_START
 * @param toolCallIndex
 *            first-START order of the tool call within the run
 * @param parentMessageId
 *            text message that preceded a TOOL_CALL_START, if any
 * @param delta
 *            text or argument fragment
 * @param content
 *            tool result content
 * @param resultMessageId
 *            message id of a TOOL_CALL_RESULT
 * @param name
 *            CUSTOM event name
 * @param value
 *            CUSTOM value, state snapshot or state patch
 * @param errorMessage
 *            RUN_ERROR message
 * @param errorCode
 *            RUN_ERROR code
 * @param raw
 *            RAW wire fragment
 * @param addition
 *            extra fields merged into the frame
 * @param additionMergePolicy
 *            merge mode for {@code addition}
 * @param firstContent
 *            true on the first content bearing signal of the run
 * @param hitl
 *            true for tool call signals synthesized for a human-in-the-loop
 *            request
 * @param toolCallsEmitted
 *            on RUN_FINISHED, whether any non-HITL tool call was started
 * @param textEmitted
 *            on RUN_FINISHED, whether any text content was emitted
 */
@Builder(toBuilder = true)
public record StreamSignal(SignalType type, String messageId, String toolCallId, String toolCallName,
        int toolCallIndex, String parentMessageId, String delta, String content, String resultMessageId,
        String name, Object value, String errorMessage, String errorCode, String raw,
        Map<String, Object> addition, AdditionMergePolicy additionMergePolicy, boolean firstContent,
        boolean hitl, boolean toolCallsEmitted, boolean textEmitted) {

    public boolean hasAddition() {
        return addition != null && !addition.isEmpty();
    }
}
