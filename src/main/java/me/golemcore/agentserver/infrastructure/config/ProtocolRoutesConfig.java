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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentserver.adapter.inbound.web.JsonBodyReader;
import me.golemcore.agentserver.adapter.inbound.web.agui.AguiEventEncoder;
import me.golemcore.agentserver.adapter.inbound.web.agui.AguiRequestParser;
import me.golemcore.agentserver.adapter.inbound.web.agui.AguiRunHandler;
import me.golemcore.agentserver.adapter.inbound.web.openai.OpenAiChatHandler;
import me.golemcore.agentserver.adapter.inbound.web.openai.OpenAiChunkEncoder;
import me.golemcore.agentserver.adapter.inbound.web.openai.OpenAiRequestParser;
import me.golemcore.agentserver.adapter.inbound.web.openai.OpenAiResponseAssembler;
import me.golemcore.agentserver.domain.service.RunPipelineService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerResponse;

import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Registers the protocol endpoints as router functions under their configured
 * prefixes. A disabled protocol contributes no routes.
 */
@Configuration
@Slf4j
public class ProtocolRoutesConfig {

    @Bean
    public JsonBodyReader jsonBodyReader(ObjectMapper objectMapper) {
        return new JsonBodyReader(objectMapper);
    }

    @Bean
    public OpenAiChatHandler openAiChatHandler(RunPipelineService pipelineService, JsonBodyReader jsonBodyReader,
            ObjectMapper objectMapper, AgentServerProperties properties, Clock clock) {
        return new OpenAiChatHandler(pipelineService, jsonBodyReader, new OpenAiRequestParser(),
                new OpenAiChunkEncoder(objectMapper), new OpenAiResponseAssembler(), properties, clock);
    }

    @Bean
    public AguiRunHandler aguiRunHandler(RunPipelineService pipelineService, JsonBodyReader jsonBodyReader,
            ObjectMapper objectMapper, AgentServerProperties properties, Clock clock) {
        return new AguiRunHandler(pipelineService, jsonBodyReader, new AguiRequestParser(),
                new AguiEventEncoder(objectMapper), properties, clock);
    }

    @Bean
    public RouterFunction<ServerResponse> protocolRoutes(AgentServerProperties properties,
            OpenAiChatHandler openAiChatHandler, AguiRunHandler aguiRunHandler) {
        return routes(properties, openAiChatHandler, aguiRunHandler);
    }

    /**
     * Builds the route table. Also used directly by web tests.
     */
    public static RouterFunction<ServerResponse> routes(AgentServerProperties properties,
            OpenAiChatHandler openAiChatHandler, AguiRunHandler aguiRunHandler) {
        RouterFunctions.Builder builder = RouterFunctions.route();
        boolean registered = false;
        AgentServerProperties.OpenAiProperties openai = properties.getOpenai();
        if (openai.isEnabled()) {
            builder.POST(openai.getPrefix() + "/chat/completions", openAiChatHandler::chatCompletions)
                    .GET(openai.getPrefix() + "/models", openAiChatHandler::models);
            log.info("[OpenAI] Endpoints registered under {}", openai.getPrefix());
            registered = true;
        }
        AgentServerProperties.AguiProperties agui = properties.getAgui();
        if (agui.isEnabled()) {
            builder.POST(agui.getPrefix() + "/agent", aguiRunHandler::runAgent)
                    .GET(agui.getPrefix() + "/health", aguiRunHandler::health);
            log.info("[AG-UI] Endpoints registered under {} (tool call policy: {})", agui.getPrefix(),
                    agui.getToolCallPolicy());
            registered = true;
        }
        if (!registered) {
            log.warn("[Routes] All protocols are disabled, no agent endpoints registered");
            return request -> Mono.empty();
        }
        return builder.build();
    }
}
