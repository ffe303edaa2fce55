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

import java.util.List;
import java.util.Map;

/**
 * Normalized conversation message. The content is either a string or the raw
 * list of multimodal content parts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    private String id;
    private MessageRole role;
    private Object content;
    private String name;
    private List<ToolCall> toolCalls;
    private String toolCallId;

    /**
     * Returns the content as plain text, joining the {@code text} parts of a
     * multimodal content list.
     */
    public String getTextContent() {
        if (content == null) {
            return null;
        }
        if (content instanceof String text) {
            return text;
        }
        if (content instanceof List<?> parts) {
            StringBuilder sb = new StringBuilder();
            for (Object part : parts) {
                if (part instanceof Map<?, ?> map && "text".equals(map.get("type"))
                        && map.get("text") != null) {
                    sb.append(map.get("text"));
                } else if (part instanceof String str) {
                    sb.append(str);
                }
            }
            return sb.toString();
        }
        return content.toString();
    }
}
