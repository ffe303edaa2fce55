package me.golemcore.agentserver.port.outbound;

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

import me.golemcore.agentserver.domain.model.ProtocolType;
import me.golemcore.agentserver.domain.model.RunContext;
import me.golemcore.agentserver.domain.model.StreamSignal;

import java.util.List;

/**
 * Port for wire protocol encoders.
 *
 * <p>
 * An encoder is a pure translation from one state machine signal to zero or
 * more complete SSE frames ({@code data: ...\n\n}). It keeps no state of its
 * own: everything it needs travels on the signal and the run context.
 */
public interface ProtocolEncoder {

    ProtocolType getProtocol();

    List<String> encode(StreamSignal signal, RunContext context);
}
