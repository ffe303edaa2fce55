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

import me.golemcore.agentserver.domain.model.ToolCall;
import org.springframework.http.HttpHeaders;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lenient accessors for loosely typed JSON request bodies. Malformed entries
 * are skipped instead of failing the request.
 */
public final class RequestParsingSupport {

    private RequestParsingSupport() {
    }

    public static String string(Map<String, Object> source, String key) {
        Object value = source.get(key);
        return value != null ? value.toString() : null;
    }

    public static String firstString(Map<String, Object> source, String... keys) {
        for (String key : keys) {
            String value = string(source, key);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    public static List<Map<String, Object>> objects(Object value) {
        if (!(value instanceof List<?> list)) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                result.add(stringKeyed(map));
            }
        }
        return result;
    }

    public static Map<String, Object> object(Object value) {
        return value instanceof Map<?, ?> map ? stringKeyed(map) : new LinkedHashMap<>();
    }

    public static List<ToolCall> toolCalls(Object value) {
        List<Map<String, Object>> items = objects(value);
        if (items.isEmpty()) {
            return null;
        }
        List<ToolCall> toolCalls = new ArrayList<>();
        for (Map<String, Object> item : items) {
            String id = string(item, "id");
            String type = string(item, "type");
            toolCalls.add(ToolCall.builder()
                    .id(id != null ? id : "")
                    .type(type != null ? type : "function")
                    .function(object(item.get("function")))
                    .build());
        }
        return toolCalls;
    }

    public static Map<String, String> headers(HttpHeaders headers) {
        Map<String, String> result = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            if (!values.isEmpty()) {
                result.put(name.toLowerCase(Locale.ROOT), values.get(0));
            }
        });
        return result;
    }

    private static Map<String, Object> stringKeyed(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }
}
