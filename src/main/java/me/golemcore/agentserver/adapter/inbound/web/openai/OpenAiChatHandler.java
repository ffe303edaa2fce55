package me.golemcore.agentserver.adapter.inbound.web.openai;

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
import me.golemcore.agentserver.domain.model.AgentRequest;
import me.golemcore.agentserver.domain.model.ProtocolType;
import me.golemcore.agentserver.domain.model.RunContext;
import me.golemcore.agentserver.domain.model.StreamSignal;
import me.golemcore.agentserver.domain.model.ToolCallPolicy;
import me.golemcore.agentserver.domain.service.RunPipelineService;
import me.golemcore.agentserver.infrastructure.config.AgentServerProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * OpenAI-compatible endpoints.
 *
 * <ul>
 * <li>{@code POST {prefix}/chat/completions} - SSE stream of
 * {@code chat.completion.chunk} frames when {@code stream} is true, otherwise
 * one {@code chat.completion} object</li>
 * <li>{@code GET {prefix}/models} - the configured model</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class OpenAiChatHandler {

    private static final String RESPONSE_ID_PREFIX = "chatcmpl-";
    private static final String OWNED_BY = "agentrun";

    private final RunPipelineService pipelineService;
    private final JsonBodyReader bodyReader;
    private final OpenAiRequestParser requestParser;
    private final OpenAiChunkEncoder chunkEncoder;
    private final OpenAiResponseAssembler responseAssembler;
    private final AgentServerProperties properties;
    private final Clock clock;

    public Mono<ServerResponse> chatCompletions(ServerRequest request) {
        return request.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> {
                    AgentRequest agentRequest;
                    try {
                        agentRequest = requestParser.parse(bodyReader.readObject(body),
                                request.headers().asHttpHeaders());
                    } catch (IllegalArgumentException e) {
                        log.warn("[OpenAI] Rejected request: {}", e.getMessage());
                        return badRequest(e.getMessage());
                    }
                    RunContext context = newContext(agentRequest);
                    agentRequest.setRunId(context.getRunId());
                    agentRequest.setThreadId(context.getThreadId());
                    return agentRequest.isStream()
                            ? SseFrames.stream(pipelineService.stream(agentRequest, context, chunkEncoder))
                            : complete(agentRequest, context);
                });
    }

    public Mono<ServerResponse> models(ServerRequest request) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("id", properties.getOpenai().getModelName());
        model.put("object", "model");
        model.put("created", clock.instant().getEpochSecond());
        model.put("owned_by", OWNED_BY);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("object", "list");
        body.put("data", List.of(model));
        return ServerResponse.ok().contentType(MediaType.APPLICATION_JSON).bodyValue(body);
    }

    private Mono<ServerResponse> complete(AgentRequest agentRequest, RunContext context) {
        return pipelineService.collect(agentRequest, context)
                .flatMap(signals -> {
                    StreamSignal error = responseAssembler.findError(signals).orElse(null);
                    if (error != null) {
                        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, error.errorMessage(), "server_error",
                                error.errorCode());
                    }
                    return ServerResponse.ok()
                            .contentType(MediaType.APPLICATION_JSON)
                            .bodyValue(responseAssembler.assemble(signals, context));
                });
    }

    private RunContext newContext(AgentRequest agentRequest) {
        String model = agentRequest.getModel() != null && !agentRequest.getModel().isBlank()
                ? agentRequest.getModel()
                : properties.getOpenai().getModelName();
        return RunContext.builder()
                .runId(UUID.randomUUID().toString())
                .threadId(UUID.randomUUID().toString())
                .protocol(ProtocolType.OPENAI)
                .toolCallPolicy(ToolCallPolicy.PARALLEL)
                .responseId(RESPONSE_ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 12))
                .model(model)
                .created(clock.instant().getEpochSecond())
                .build();
    }

    private Mono<ServerResponse> badRequest(String message) {
        return errorResponse(HttpStatus.BAD_REQUEST, message, "invalid_request_error", null);
    }

    private Mono<ServerResponse> errorResponse(HttpStatus status, String message, String type, String code) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("message", message);
        error.put("type", type);
        if (code != null) {
            error.put("code", code);
        }
        return ServerResponse.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("error", error));
    }
}
