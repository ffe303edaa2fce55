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
import me.golemcore.agentserver.domain.model.AgentEvent;
import me.golemcore.agentserver.domain.model.AgentRequest;
import org.reactivestreams.Publisher;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Drives an {@link AgentHandler} and exposes its output as a non-blocking
 * sequence of canonical events.
 *
 * <p>
 * The handler mode is resolved once here and dispatched through a lookup
 * table. Blocking work runs on {@code blockingScheduler}. Any failure while
 * calling the handler or pulling its output ends the sequence with exactly
 * one ERROR event.
 */
@Slf4j
public class AgentInvoker {

    private final AgentHandler handler;
    private final HandlerMode mode;
    private final Scheduler blockingScheduler;
    private final AgentOutputNormalizer normalizer;
    private final Map<HandlerMode, Function<AgentRequest, Flux<Object>>> dispatch = new EnumMap<>(
            HandlerMode.class);

    public AgentInvoker(AgentHandler handler, Scheduler blockingScheduler, AgentOutputNormalizer normalizer) {
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        this.mode = Objects.requireNonNull(handler.mode(), "handler mode must not be null");
        this.blockingScheduler = blockingScheduler;
        this.normalizer = normalizer;
        dispatch.put(HandlerMode.BLOCKING_SINGLE, this::callBlocking);
        dispatch.put(HandlerMode.BLOCKING_MULTI, this::callBlockingStream);
        dispatch.put(HandlerMode.NON_BLOCKING_SINGLE, this::callReactive);
        dispatch.put(HandlerMode.NON_BLOCKING_MULTI, this::callReactiveStream);
        log.info("[Invoker] Agent handler registered: {} ({})", handler.getClass().getSimpleName(), mode);
    }

    public HandlerMode getMode() {
        return mode;
    }

    /**
     * Invokes the agent and streams its normalized output.
     */
    public Flux<AgentEvent> invokeStream(AgentRequest request) {
        return Flux.defer(() -> dispatch.get(mode).apply(request))
                .concatMapIterable(normalizer::normalize, 1)
                .onErrorResume(error -> Flux.just(toErrorEvent(error)));
    }

    /**
     * Invokes the agent and collects all events, for non-streaming callers.
     */
    public Mono<List<AgentEvent>> invoke(AgentRequest request) {
        return invokeStream(request).collectList();
    }

    private Flux<Object> callBlocking(AgentRequest request) {
        return Mono.fromCallable(() -> handler.handle(request))
                .subscribeOn(blockingScheduler)
                .flux();
    }

    private Flux<Object> callBlockingStream(AgentRequest request) {
        return Mono.fromCallable(() -> handler.handle(request))
                .subscribeOn(blockingScheduler)
                .flatMapMany(result -> BlockingSourceBridge.isBlockingSource(result)
                        ? BlockingSourceBridge.pull(result, blockingScheduler)
                        : Flux.just(result));
    }

    private Flux<Object> callReactive(AgentRequest request) {
        return Mono.defer(() -> {
            Object result = handleUnchecked(request);
            if (result instanceof Mono<?> mono) {
                return mono.map(Object.class::cast);
            }
            return Mono.justOrEmpty(result);
        }).flux();
    }

    private Flux<Object> callReactiveStream(AgentRequest request) {
        return Flux.defer(() -> {
            Object result = handleUnchecked(request);
            if (result instanceof Publisher<?> publisher) {
                return Flux.from(publisher).map(Object.class::cast);
            }
            return Mono.justOrEmpty(result).flux();
        });
    }

    private Object handleUnchecked(AgentRequest request) {
        try {
            return handler.handle(request);
        } catch (Exception e) {
            throw Exceptions.propagate(e);
        }
    }

    private AgentEvent toErrorEvent(Throwable error) {
        Throwable cause = Exceptions.unwrap(error);
        String code = cause.getClass().getSimpleName();
        String message = cause.getMessage() != null ? cause.getMessage() : code;
        log.error("[Invoker] Agent invocation failed: {}", message, cause);
        return AgentEvent.error(message, code);
    }
}
