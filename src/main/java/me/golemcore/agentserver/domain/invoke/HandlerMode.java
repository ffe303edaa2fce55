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

/**
 * Shape of an agent callback along two axes: whether it blocks the calling
 * thread, and whether it produces one result or a sequence.
 */
public enum HandlerMode {
    BLOCKING_SINGLE(Execution.BLOCKING, Cardinality.SINGLE),
    BLOCKING_MULTI(Execution.BLOCKING, Cardinality.MULTI),
    NON_BLOCKING_SINGLE(Execution.NON_BLOCKING, Cardinality.SINGLE),
    NON_BLOCKING_MULTI(Execution.NON_BLOCKING, Cardinality.MULTI);

    public enum Execution {
        BLOCKING, NON_BLOCKING
    }

    public enum Cardinality {
        SINGLE, MULTI
    }

    private final Execution execution;
    private final Cardinality cardinality;

    HandlerMode(Execution execution, Cardinality cardinality) {
        this.execution = execution;
        this.cardinality = cardinality;
    }

    public Execution getExecution() {
        return execution;
    }

    public Cardinality getCardinality() {
        return cardinality;
    }

    public boolean isBlocking() {
        return execution == Execution.BLOCKING;
    }

    public static HandlerMode of(Execution execution, Cardinality cardinality) {
        for (HandlerMode mode : values()) {
            if (mode.execution == execution && mode.cardinality == cardinality) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported handler mode: " + execution + "/" + cardinality);
    }
}
