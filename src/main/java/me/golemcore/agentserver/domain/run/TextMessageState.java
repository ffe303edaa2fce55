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

import java.util.UUID;

/**
 * One assistant text message inside a run. Never reused once ended.
 */
@Getter
public class TextMessageState {

    private final String messageId;
    private boolean started;
    private boolean ended;

    public TextMessageState() {
        this(UUID.randomUUID().toString());
    }

    public TextMessageState(String messageId) {
        this.messageId = messageId;
    }

    public boolean isOpen() {
        return started && !ended;
    }

    void markStarted() {
        this.started = true;
    }

    void markEnded() {
        this.ended = true;
    }
}
