package me.golemcore.agentserver.infrastructure.config;

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

import lombok.Data;
import me.golemcore.agentserver.domain.model.ToolCallPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties bound from {@code agent-server.*}.
 *
 * <p>
 * Nested groups:
 * <ul>
 * <li>{@link OpenAiProperties} - OpenAI-compatible endpoints</li>
 * <li>{@link AguiProperties} - AG-UI endpoints and tool-call policy</li>
 * <li>{@link InvokerProperties} - worker pool for blocking agent handlers</li>
 * <li>{@link CorsProperties} - browser origins allowed to call the
 * endpoints</li>
 * </ul>
 *
 * <p>
 * Read-only after startup and shared by all runs.
 */
@Component
@ConfigurationProperties(prefix = "agent-server")
@Data
public class AgentServerProperties {

    private OpenAiProperties openai = new OpenAiProperties();
    private AguiProperties agui = new AguiProperties();
    private InvokerProperties invoker = new InvokerProperties();
    private CorsProperties cors = new CorsProperties();

    @Data
    public static class OpenAiProperties {
        private boolean enabled = true;
        private String prefix = "/openai/v1";
        private String modelName = "agentrun";
    }

    @Data
    public static class AguiProperties {
        private boolean enabled = true;
        private String prefix = "/ag-ui";
        private ToolCallPolicy toolCallPolicy = ToolCallPolicy.PARALLEL;
    }

    @Data
    public static class InvokerProperties {
        private int maxBlockingThreads = 10 * Runtime.getRuntime().availableProcessors();
        private int maxQueuedTasks = 100_000;
    }

    @Data
    public static class CorsProperties {
        /** Comma separated; empty allows any origin pattern. */
        private String allowedOrigins = "";
    }
}
