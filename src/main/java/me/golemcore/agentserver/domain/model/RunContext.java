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
import lombok.Value;

/**
 * Immutable identity of one run, shared by the state machine and the
 * encoder that owns the run.
 */
@Value
@Builder
public class RunContext {

    String runId;
    String threadId;
    ProtocolType protocol;
    @Builder.Default
    ToolCallPolicy toolCallPolicy = ToolCallPolicy.PARALLEL;

    /** OpenAI {@code chatcmpl-*} response id. */
    String responseId;
    String model;
    /** Epoch seconds. */
    long created;
}
