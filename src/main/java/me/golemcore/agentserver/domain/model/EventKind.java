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

/**
 * Protocol-neutral kinds of agent output.
 *
 * <p>
 * Boundary events (message start/end, tool call start/end, run lifecycle) are
 * not kinds: the run state machine synthesizes them for the target protocol.
 */
public enum EventKind {

    /** Text fragment, payload {@code {delta}}. */
    TEXT,

    /** Complete tool call in one shot, payload {@code {id?, name, args}}. */
    TOOL_CALL,

    /**
     * Tool call fragment, payload
     * {@code {id?, index?, correlation_id?, name?, args_delta}}.
     */
    TOOL_CALL_CHUNK,

    /** Final tool output, payload {@code {id, result | content}}. */
    TOOL_RESULT,

    /** Streamed tool output cached until the TOOL_RESULT, payload {@code {id, delta}}. */
    TOOL_RESULT_CHUNK,

    /** State snapshot or incremental patch. */
    STATE,

    /** Application defined event, payload {@code {name, value}}. */
    CUSTOM,

    /** Terminal failure, payload {@code {message, code}}. */
    ERROR,

    /** Already formed wire fragment, payload {@code {raw}}. */
    RAW,

    /** Human-in-the-loop request. */
    HITL
}
