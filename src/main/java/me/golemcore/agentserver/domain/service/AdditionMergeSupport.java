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

import me.golemcore.agentserver.domain.model.AdditionMergePolicy;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deep merge of event {@code addition} maps into encoded frames.
 *
 * <p>
 * Nested maps merge recursively, any other value (lists included) replaces
 * the existing one. Under {@link AdditionMergePolicy#OVERRIDE_ONLY} keys the
 * target does not already have are dropped at every depth.
 */
public final class AdditionMergeSupport {

    private AdditionMergeSupport() {
    }

    public static Map<String, Object> merge(Map<String, Object> target, Map<String, Object> addition,
            AdditionMergePolicy policy) {
        Map<String, Object> merged = new LinkedHashMap<>(target != null ? target : Map.of());
        if (addition == null || addition.isEmpty()) {
            return merged;
        }
        boolean addNewKeys = policy != AdditionMergePolicy.OVERRIDE_ONLY;
        for (Map.Entry<String, Object> entry : addition.entrySet()) {
            String key = entry.getKey();
            if (!merged.containsKey(key)) {
                if (addNewKeys) {
                    merged.put(key, entry.getValue());
                }
                continue;
            }
            Object existing = merged.get(key);
            Object incoming = entry.getValue();
            if (existing instanceof Map<?, ?> existingMap && incoming instanceof Map<?, ?> incomingMap) {
                merged.put(key, merge(asStringKeyed(existingMap), asStringKeyed(incomingMap), policy));
            } else {
                merged.put(key, incoming);
            }
        }
        return merged;
    }

    private static Map<String, Object> asStringKeyed(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }
}
