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
import me.golemcore.agentserver.domain.model.RunLifecycle;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of a single run. Owned by one {@link RunStateMachine} and
 * never shared between runs.
 */
@Getter
@Setter
public class RunState {

    private RunLifecycle lifecycle = RunLifecycle.PENDING;
    private TextMessageState text;
    private String lastMessageId;
    private final ToolCallRegistry toolCalls = new ToolCallRegistry();
    private final Map<String, List<String>> resultChunks = new LinkedHashMap<>();
    private final Deque<String> queuedToolCallIds = new ArrayDeque<>();
    private String activeToolCallId;
    private int nextToolCallIndex;
    private boolean contentStarted;
    private boolean toolCallsEmitted;
    private boolean textEmitted;

    public boolean isTextOpen() {
        return text != null && text.isOpen();
    }

    public int allocateToolCallIndex() {
        return nextToolCallIndex++;
    }

    /**
     * Returns true exactly once, for the first content-bearing signal.
     */
    public boolean claimFirstContent() {
        if (contentStarted) {
            return false;
        }
        contentStarted = true;
        return true;
    }

    public void cacheResultChunk(String toolCallId, String delta) {
        if (toolCallId == null || toolCallId.isEmpty() || delta == null || delta.isEmpty()) {
            return;
        }
        resultChunks.computeIfAbsent(toolCallId, key -> new ArrayList<>()).add(delta);
    }

    public String popResultChunks(String toolCallId) {
        List<String> chunks = resultChunks.remove(toolCallId);
        return chunks != null ? String.join("", chunks) : "";
    }
}
