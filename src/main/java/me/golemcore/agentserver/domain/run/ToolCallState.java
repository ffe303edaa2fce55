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

import lombok.Getter;
import lombok.Setter;
import me.golemcore.agentserver.domain.model.AgentEvent;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Tracking entry for one tool-call identity within a run.
 *
 * <p>
 * Under the serialized policy, events for a call that may not be emitted yet
 * wait in {@link #getPending()} in arrival order.
 */
@Getter
@Setter
public class ToolCallState {

    private final String toolCallId;
    private String name;
    private int index = -1;
    private boolean started;
    private boolean ended;
    private boolean resultReceived;
    private boolean hitl;
    private final Deque<AgentEvent> pending = new ArrayDeque<>();

    public ToolCallState(String toolCallId, String name) {
        this.toolCallId = toolCallId;
        this.name = name != null ? name : "";
    }

    public boolean isOpen() {
        return started && !ended;
    }

    public boolean hasPending() {
        return !pending.isEmpty();
    }
}
