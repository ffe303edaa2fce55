package me.golemcore.agentserver.adapter.inbound.web.agui;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentserver.adapter.inbound.web.JsonBodyReader;
import me.golemcore.agentserver.adapter.inbound.web.SseFrames;
import me.golemcore.agentserver.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.agentserver.domain.model.AgentRequest;
import me.golemcore.agentserver.domain.model.ProtocolType;
import me.golemcore.agentserver.domain.model.RunContext;
import me.golemcore.agentserver.domain.service.RunPipelineService;
import me.golemcore.agentserver.infrastructure.config.AgentServerProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AG-UI endpoints.
 *
 * <ul>
 * <li>{@code POST {prefix}/agent} - always an SSE stream of AG-UI events</li>
 * <li>{@code GET {prefix}/health} - protocol health check</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class AguiRunHandler {

    static final String PROTOCOL_NAME = "ag-ui";
    static final String PROTOCOL_VERSION = "1.0";

    private final RunPipelineService pipelineService;
    private final JsonBodyReader bodyReader;
    private final AguiRequestParser requestParser;
    private final AguiEventEncoder eventEncoder;
    private final AgentServerProperties properties;
    private final Clock clock;

    public Mono<ServerResponse> runAgent(ServerRequest request) {
        return request.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> {
                    AgentRequest agentRequest;
                    try {
                        agentRequest = requestParser.parse(bodyReader.readObject(body),
                                request.headers().asHttpHeaders());
                    } catch (IllegalArgumentException e) {
                        log.warn("[AG-UI] Rejected request: {}", e.getMessage());
                        return ServerResponse.status(HttpStatus.BAD_REQUEST)
                                .contentType(MediaType.APPLICATION_JSON)
                                .bodyValue(ApiErrorResponse.builder()
                                        .status(HttpStatus.BAD_REQUEST.value())
                                        .message(e.getMessage())
                                        .build());
                    }
                    RunContext context = RunContext.builder()
                            .runId(agentRequest.getRunId())
                            .threadId(agentRequest.getThreadId())
                            .protocol(ProtocolType.AGUI)
                            .toolCallPolicy(properties.getAgui().getToolCallPolicy())
                            .created(clock.instant().getEpochSecond())
                            .build();
                    return SseFrames.stream(pipelineService.stream(agentRequest, context, eventEncoder));
                });
    }

    public Mono<ServerResponse> health(ServerRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("protocol", PROTOCOL_NAME);
        body.put("version", PROTOCOL_VERSION);
        return ServerResponse.ok().contentType(MediaType.APPLICATION_JSON).bodyValue(body);
    }
}
