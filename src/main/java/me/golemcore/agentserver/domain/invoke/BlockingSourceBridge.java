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
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Adapts blocking sequences to a {@link Flux}.
 *
 * <p>
 * Items are pulled one at a time, only on downstream demand, on a worker of
 * the given scheduler. A slow {@code next()} therefore holds only its own
 * run. Cancellation stops the pulls and closes the source when it is
 * {@link AutoCloseable}.
 */
@Slf4j
public final class BlockingSourceBridge {

    private BlockingSourceBridge() {
    }

    public static boolean isBlockingSource(Object source) {
        return source instanceof Iterable<?> || source instanceof Iterator<?> || source instanceof Stream<?>;
    }

    public static Flux<Object> pull(Object source, Scheduler scheduler) {
        return Flux.<Object, Iterator<?>>generate(() -> iteratorOf(source), (iterator, sink) -> {
            while (iterator.hasNext()) {
                Object next = iterator.next();
                if (next != null) {
                    sink.next(next);
                    return iterator;
                }
            }
            sink.complete();
            return iterator;
        }, iterator -> close(source, iterator)).subscribeOn(scheduler);
    }

    private static Iterator<?> iteratorOf(Object source) {
        if (source instanceof Stream<?> stream) {
            return stream.iterator();
        }
        if (source instanceof Iterable<?> iterable) {
            return iterable.iterator();
        }
        if (source instanceof Iterator<?> iterator) {
            return iterator;
        }
        throw new IllegalArgumentException("Not a blocking source: " + source.getClass().getName());
    }

    private static void close(Object source, Iterator<?> iterator) {
        Object closeable = source instanceof AutoCloseable ? source : iterator;
        if (closeable instanceof AutoCloseable resource) {
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("[Invoker] Failed to close blocking source {}: {}", resource.getClass().getSimpleName(),
                        e.getMessage());
            }
        }
    }
}
