package me.golemcore.agentserver;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore Agent Server.
 *
 * <p>
 * Exposes a host supplied agent callback as ordered event streams in two wire
 * protocols:
 * <ul>
 * <li><b>OpenAI-compatible</b> - {@code chat.completion.chunk} SSE frames
 * terminated by {@code [DONE]}, or one {@code chat.completion} object</li>
 * <li><b>AG-UI</b> - typed lifecycle, text, tool call and state events</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Inbound adapters   → OpenAiChatHandler, AguiRunHandler, GraphEventConverter
 * Domain             → AgentInvoker, RunStateMachine, RunPipelineService
 * Outbound port      → ProtocolEncoder (OpenAI chunks, AG-UI events)
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code agent-server.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AgentServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentServerApplication.class, args);
    }

}
