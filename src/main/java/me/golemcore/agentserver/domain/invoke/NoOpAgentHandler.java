package me.golemcore.agentserver.domain.invoke;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentserver.domain.model.AgentRequest;

/**
 * Fallback handler used when the host application registers no agent.
 *
 * <p>
 * Always answers with a placeholder text without calling any model.
 */
@Slf4j
public class NoOpAgentHandler implements AgentHandler {

    static final String PLACEHOLDER = "[No agent configured]";

    @Override
    public HandlerMode mode() {
        return HandlerMode.BLOCKING_SINGLE;
    }

    @Override
    public Object handle(AgentRequest request) {
        log.warn("[Invoker] NoOpAgentHandler called - no agent configured");
        return PLACEHOLDER;
    }
}
