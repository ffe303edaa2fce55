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

import me.golemcore.agentserver.domain.model.AgentRequest;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * User supplied agent callback.
 *
 * <p>
 * The callback may return or yield {@code String}, {@code AgentEvent},
 * {@code null}, or a collection of those. Its {@link HandlerMode} tells the
 * invoker how to drive it:
 * <ul>
 * <li>{@link HandlerMode#BLOCKING_SINGLE} - returns one value, may block</li>
 * <li>{@link HandlerMode#BLOCKING_MULTI} - returns an {@code Iterable},
 * {@code Iterator} or {@code Stream} whose pulls may block</li>
 * <li>{@link HandlerMode#NON_BLOCKING_SINGLE} - returns a {@code Mono}</li>
 * <li>{@link HandlerMode#NON_BLOCKING_MULTI} - returns a {@code Publisher}</li>
 * </ul>
 *
 * <pre>
 * AgentHandler handler = AgentHandler.reactiveStream(request -&gt; Flux.just("Hello ", "World"));
 * </pre>
 */
public interface AgentHandler {

    /**
     * Returns how the invoker should call and consume this handler.
     */
    HandlerMode mode();

    /**
     * Invokes the agent. The shape of the result must match {@link #mode()}.
     */
    Object handle(AgentRequest request) throws Exception;

    /**
     * Callback body that may throw.
     */
    @FunctionalInterface
    interface Callback<T> {
        T apply(AgentRequest request) throws Exception;
    }

    static AgentHandler blocking(Callback<?> callback) {
        return new CallbackAgentHandler(HandlerMode.BLOCKING_SINGLE, callback);
    }

    static AgentHandler blockingStream(Callback<?> callback) {
        return new CallbackAgentHandler(HandlerMode.BLOCKING_MULTI, callback);
    }

    static AgentHandler reactive(Callback<? extends Mono<?>> callback) {
        return new CallbackAgentHandler(HandlerMode.NON_BLOCKING_SINGLE, callback);
    }

    static AgentHandler reactiveStream(Callback<? extends Publisher<?>> callback) {
        return new CallbackAgentHandler(HandlerMode.NON_BLOCKING_MULTI, callback);
    }

    /**
     * Handler backed by a lambda.
     */
    record CallbackAgentHandler(HandlerMode mode, Callback<?> callback) implements AgentHandler {

        public CallbackAgentHandler {
            Objects.requireNonNull(mode, "mode must not be null");
            Objects.requireNonNull(callback, "callback must not be null");
        }

        @Override
        public Object handle(AgentRequest request) throws Exception {
            return callback.apply(request);
        }
    }
}
