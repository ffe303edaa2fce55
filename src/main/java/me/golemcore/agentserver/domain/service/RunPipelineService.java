package me.golemcore.agentserver.domain.service;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentserver.domain.invoke.AgentInvoker;
import me.golemcore.agentserver.domain.model.AgentRequest;
import me.golemcore.agentserver.domain.model.EventKind;
import me.golemcore.agentserver.domain.model.RunContext;
import me.golemcore.agentserver.domain.model.StreamSignal;
import me.golemcore.agentserver.domain.run.RunStateMachine;
import me.golemcore.agentserver.port.outbound.ProtocolEncoder;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Wires one run end to end: invoker output flows through a fresh
 * {@link RunStateMachine} and, for streaming callers, through the protocol
 * encoder that owns the run.
 *
 * <p>
 * Each subscription gets its own state machine. Upstream is pulled only on
 * demand and stops at the first ERROR event or when the client goes away.
 */
@Slf4j
@RequiredArgsConstructor
public class RunPipelineService {

    private final AgentInvoker invoker;
    private final ObjectMapper objectMapper;

    public Flux<StreamSignal> signals(AgentRequest request, RunContext context) {
        return Flux.defer(() -> {
            RunStateMachine machine = new RunStateMachine(context, objectMapper);
            log.info("[Run] Starting run {} (protocol: {}, thread: {}, policy: {})", context.getRunId(),
                    context.getProtocol(), context.getThreadId(), context.getToolCallPolicy());
            return Flux.concat(
                    Flux.fromIterable(machine.start()),
                    invoker.invokeStream(request)
                            .takeUntil(event -> event.is(EventKind.ERROR))
                            .concatMapIterable(machine::accept, 1),
                    Flux.defer(() -> Flux.fromIterable(machine.complete())))
                    .onErrorResume(error -> Flux.fromIterable(failRun(machine, error)))
                    .doOnCancel(() -> log.warn("[Run] Run {} cancelled by client", context.getRunId()))
                    .doOnComplete(() -> log.info("[Run] Run {} ended: {}", context.getRunId(),
                            machine.getState().getLifecycle()));
        });
    }

    public Flux<String> stream(AgentRequest request, RunContext context, ProtocolEncoder encoder) {
        return signals(request, context).concatMapIterable(signal -> encoder.encode(signal, context));
    }

    public Mono<List<StreamSignal>> collect(AgentRequest request, RunContext context) {
        return signals(request, context).collectList();
    }

    private List<StreamSignal> failRun(RunStateMachine machine, Throwable error) {
        Throwable cause = Exceptions.unwrap(error);
        log.error("[Run] Run {} failed while processing events", machine.getContext().getRunId(), cause);
        String code = cause.getClass().getSimpleName();
        return machine.fail(cause.getMessage() != null ? cause.getMessage() : code, code);
    }
}
