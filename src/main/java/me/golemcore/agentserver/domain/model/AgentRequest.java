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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Protocol-neutral request handed to the agent callback.
 *
 * <p>
 * Both wire formats are parsed into this shape. The original body and request
 * headers are kept for callbacks that need protocol specific fields.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRequest {

    private ProtocolType protocol;
    @Builder.Default
    private List<ChatMessage> messages = new ArrayList<>();
    private boolean stream;
    private List<ToolSpec> tools;
    private String threadId;
    private String runId;
    private String model;
    @Builder.Default
    private Map<String, Object> rawBody = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    /**
     * Returns the last user message text, or null when there is none.
     */
    public String getLastUserText() {
        if (messages == null) {
            return null;
        }
        for (int i = messages.size() - 1; i >= 0; i--) {
            ChatMessage message = messages.get(i);
            if (message != null && message.getRole() == MessageRole.USER) {
                return message.getTextContent();
            }
        }
        return null;
    }
}
