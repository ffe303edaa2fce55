package me.golemcore.agentserver.adapter.inbound.web;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Server-Sent-Events framing shared by both protocols.
 *
 * <p>
 * Frames are written as pre-encoded bytes so WebFlux does not wrap them a
 * second time.
 */
public final class SseFrames {

    public static final String DONE = "data: [DONE]\n\n";
    private static final String DATA_PREFIX = "data: ";
    private static final String TERMINATOR = "\n\n";

    private SseFrames() {
    }

    public static String data(ObjectMapper objectMapper, Object payload) {
        try {
            return DATA_PREFIX + objectMapper.writeValueAsString(payload) + TERMINATOR;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize SSE frame", e);
        }
    }

    /**
     * Frames an already formed fragment with exactly one blank-line
     * terminator, whatever trailing newlines it carried.
     */
    public static String raw(String fragment) {
        int end = fragment.length();
        while (end > 0 && fragment.charAt(end - 1) == '\n') {
            end--;
        }
        return fragment.substring(0, end) + TERMINATOR;
    }

    public static Mono<ServerResponse> stream(Flux<String> frames) {
        Flux<DataBuffer> body = frames
                .map(frame -> DefaultDataBufferFactory.sharedInstance.wrap(frame.getBytes(StandardCharsets.UTF_8)));
        return ServerResponse.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .header("Cache-Control", "no-cache")
                .header("X-Accel-Buffering", "no")
                .body(BodyInserters.fromDataBuffers(body));
    }
}
