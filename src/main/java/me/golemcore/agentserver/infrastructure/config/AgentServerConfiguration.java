package me.golemcore.agentserver.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agentserver.domain.invoke.AgentHandler;
import me.golemcore.agentserver.domain.invoke.AgentInvoker;
import me.golemcore.agentserver.domain.invoke.AgentOutputNormalizer;
import me.golemcore.agentserver.domain.invoke.NoOpAgentHandler;
import me.golemcore.agentserver.domain.service.RunPipelineService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

/**
 * Core beans: JSON mapper, clock, the invoker with its blocking worker pool,
 * the run pipeline and CORS.
 *
 * <p>
 * The host application contributes the agent by declaring an
 * {@link AgentHandler} bean. Without one, {@link NoOpAgentHandler} answers.
 */
@Configuration
@Slf4j
public class AgentServerConfiguration {

    private static final String INVOKER_THREAD_PREFIX = "agent-invoker";

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler agentInvokerScheduler(AgentServerProperties properties) {
        AgentServerProperties.InvokerProperties invoker = properties.getInvoker();
        log.info("[Invoker] Blocking worker pool: max {} threads, {} queued tasks",
                invoker.getMaxBlockingThreads(), invoker.getMaxQueuedTasks());
        return Schedulers.newBoundedElastic(invoker.getMaxBlockingThreads(), invoker.getMaxQueuedTasks(),
                INVOKER_THREAD_PREFIX);
    }

    @Bean
    public AgentOutputNormalizer agentOutputNormalizer(ObjectMapper objectMapper) {
        return new AgentOutputNormalizer(objectMapper);
    }

    @Bean
    public AgentInvoker agentInvoker(ObjectProvider<AgentHandler> handlerProvider, Scheduler agentInvokerScheduler,
            AgentOutputNormalizer agentOutputNormalizer) {
        AgentHandler handler = handlerProvider.getIfAvailable(NoOpAgentHandler::new);
        return new AgentInvoker(handler, agentInvokerScheduler, agentOutputNormalizer);
    }

    @Bean
    public RunPipelineService runPipelineService(AgentInvoker agentInvoker, ObjectMapper objectMapper) {
        return new RunPipelineService(agentInvoker, objectMapper);
    }

    @Bean
    public CorsWebFilter corsWebFilter(AgentServerProperties properties) {
        CorsConfiguration config = new CorsConfiguration();
        String origins = properties.getCors().getAllowedOrigins();
        if (origins != null && !origins.isBlank()) {
            config.setAllowedOrigins(Arrays.stream(origins.split(",")).map(String::trim).toList());
        } else {
            config.setAllowedOriginPatterns(List.of("*"));
        }
        config.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
        config.setAllowedHeaders(List.of("*"));
        config.setAllowCredentials(true);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);
        return new CorsWebFilter(source);
    }
}
