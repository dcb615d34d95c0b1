/*
 * Copyright 2025 Firefly Software Solutions Inc
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
 */


package com.firefly.modelengine.inmemory;

import com.firefly.modelengine.resource.ResourceHandle;
import com.firefly.modelengine.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the in-memory model.
 *
 * Provides, for development, demos and tests:
 * - an {@link InMemoryModelDocument} as the {@link ResourceHandle}, unless the host provides one
 * - the reference {@link InMemoryElementOperations}
 * - an {@link InMemoryEngineEvents} history sink, picked up by the engine's composite events
 *
 * The engine itself is enabled with {@code @EnableModelTransactionEngine}.
 */
@AutoConfiguration
@EnableConfigurationProperties(InMemoryModelEngineProperties.class)
public class InMemoryModelEngineAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(InMemoryModelEngineAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(ResourceHandle.class)
    public InMemoryModelDocument inMemoryModelDocument(InMemoryModelEngineProperties properties) {
        log.info(JsonUtils.json(
                "event", "creating_inmemory_model_document",
                "component", "model_engine",
                "document", properties.getDocumentName()
        ));
        return new InMemoryModelDocument(properties.getDocumentName(), properties.getMaxUndoHistory());
    }

    @Bean
    @ConditionalOnMissingBean(InMemoryElementOperations.class)
    @ConditionalOnProperty(prefix = "firefly.model.engine.inmemory.operations", name = "enabled", havingValue = "true", matchIfMissing = true)
    public InMemoryElementOperations inMemoryElementOperations() {
        return new InMemoryElementOperations();
    }

    @Bean
    @ConditionalOnMissingBean(InMemoryEngineEvents.class)
    @ConditionalOnProperty(prefix = "firefly.model.engine.inmemory.events", name = "enabled", havingValue = "true", matchIfMissing = true)
    public InMemoryEngineEvents inMemoryEngineEvents(InMemoryModelEngineProperties properties) {
        log.info(JsonUtils.json(
                "event", "creating_inmemory_engine_events",
                "component", "model_engine",
                "max_events_in_memory", Integer.toString(properties.getEvents().getMaxEventsInMemory())
        ));
        return new InMemoryEngineEvents(properties.getEvents());
    }
}
