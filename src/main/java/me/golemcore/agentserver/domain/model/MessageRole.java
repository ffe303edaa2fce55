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

import java.util.Locale;

/**
 * Conversation roles shared by the OpenAI and AG-UI request formats.
 */
public enum MessageRole {
    SYSTEM, USER, ASSISTANT, TOOL;

    /**
     * Parses a wire role. Unknown or missing roles fall back to {@link #USER}.
     */
    public static MessageRole fromWire(String value) {
        if (value == null || value.isBlank()) {
            return USER;
        }
        try {
            return MessageRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return USER;
        }
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
